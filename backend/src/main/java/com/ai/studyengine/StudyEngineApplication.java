package com.ai.studyengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Study Engine Application
 * Main entry point for the Spring Boot application.
 */
@SpringBootApplication
public class StudyEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudyEngineApplication.class, args);
    }
}
