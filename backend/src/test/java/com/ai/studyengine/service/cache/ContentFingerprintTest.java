package com.ai.studyengine.service.cache;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentFingerprintTest {

    @Test
    void keyCarriesDigestAndGenerationParameters() {
        String key = ContentFingerprint.cacheKey("Mitochondria make ATP.", 14, 30);

        assertThat(key).matches("ai_session:[0-9a-f]{64}:14:30");
    }

    @Test
    void whitespaceDoesNotChangeTheKey() {
        assertThat(ContentFingerprint.cacheKey("  Mitochondria\n\nmake\tATP. ", 14, 30))
                .isEqualTo(ContentFingerprint.cacheKey("Mitochondria make ATP.", 14, 30));
    }

    @Test
    void textOrParameterChangesDoChangeTheKey() {
        String key = ContentFingerprint.cacheKey("Mitochondria make ATP.", 14, 30);

        assertThat(ContentFingerprint.cacheKey("Mitochondria make ADP.", 14, 30)).isNotEqualTo(key);
        assertThat(ContentFingerprint.cacheKey("Mitochondria make ATP.", 15, 30)).isNotEqualTo(key);
        assertThat(ContentFingerprint.cacheKey("Mitochondria make ATP.", 14, 20)).isNotEqualTo(key);
    }

    @Test
    void digestIsLowercaseHexSha256() {
        assertThat(ContentFingerprint.sha256(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }
}
