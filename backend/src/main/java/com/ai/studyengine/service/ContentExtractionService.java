package com.ai.studyengine.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

/**
 * Extracts the study text from uploaded PDF files using Apache PDFBox.
 */
@Slf4j
@Service
public class ContentExtractionService {

    static final int MIN_TEXT_CHARS = 50;
    private static final long MAX_SIZE_BYTES = 10L * 1024 * 1024;

    /**
     * @return the extracted text of every page, trimmed
     * @throws IOException if the file is not a readable, unprotected PDF or yields
     *                     fewer than 50 characters of text
     */
    public String extractText(MultipartFile file) throws IOException {
        validateFile(file);
        log.info("Extracting text from '{}' ({}KB)", file.getOriginalFilename(), file.getSize() / 1024);

        try (InputStream inputStream = file.getInputStream();
             PDDocument document = PDDocument.load(inputStream)) {

            if (document.isEncrypted()) {
                throw new IOException("Cannot process encrypted PDF files. Please provide an unprotected PDF.");
            }
            if (document.getNumberOfPages() == 0) {
                throw new IOException("PDF file has no pages.");
            }

            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);    // multi-column layouts
            String text = stripper.getText(document);

            if (text == null || text.strip().length() < MIN_TEXT_CHARS) {
                throw new IOException("Not enough readable text in PDF (at least " + MIN_TEXT_CHARS
                        + " characters required). The file may contain only images or scanned content.");
            }

            log.info("Extracted {} characters from {} page(s) of '{}'",
                    text.length(), document.getNumberOfPages(), file.getOriginalFilename());
            return text.strip();
        }
    }

    private void validateFile(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IOException("Uploaded file is empty.");
        }
        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase().endsWith(".pdf")) {
            throw new IOException("Only PDF files are supported. Received: " + filename);
        }
        if (file.getSize() > MAX_SIZE_BYTES) {
            throw new IOException("File size exceeds 10MB limit. File size: " + (file.getSize() / 1024 / 1024) + "MB");
        }
    }
}
