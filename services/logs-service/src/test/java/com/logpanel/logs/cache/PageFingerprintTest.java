package com.logpanel.logs.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class PageFingerprintTest {

    private static final Instant FROM = Instant.ofEpochMilli(1_700_000_000_000L);
    private static final Instant TO = Instant.ofEpochMilli(1_700_000_600_000L);

    @Test
    void firstPageUsesSentinel() {
        PageFingerprint fingerprint = PageFingerprint.of("status:ERROR", FROM, TO, "", 100);

        assertThat(fingerprint.toKey()).isEqualTo("logs:status%3AERROR:1700000000000:1700000600000:first:100");
    }

    @Test
    void equalInputsProduceEqualKeys() {
        PageFingerprint a = PageFingerprint.of("error", FROM, TO, "c1", 50);
        PageFingerprint b = PageFingerprint.of("error", FROM, TO, "c1", 50);

        assertThat(a).isEqualTo(b);
        assertThat(a.toKey()).isEqualTo(b.toKey());
    }

    @Test
    void anyDifferingComponentChangesTheKey() {
        String base = PageFingerprint.of("error", FROM, TO, "c1", 50).toKey();

        assertThat(PageFingerprint.of("warn", FROM, TO, "c1", 50).toKey()).isNotEqualTo(base);
        assertThat(PageFingerprint.of("error", FROM.plusMillis(1), TO, "c1", 50).toKey()).isNotEqualTo(base);
        assertThat(PageFingerprint.of("error", FROM, TO.plusMillis(1), "c1", 50).toKey()).isNotEqualTo(base);
        assertThat(PageFingerprint.of("error", FROM, TO, "c2", 50).toKey()).isNotEqualTo(base);
        assertThat(PageFingerprint.of("error", FROM, TO, "c1", 51).toKey()).isNotEqualTo(base);
    }

    @Test
    void separatorsInsideComponentsCannotCollide() {
        String left = PageFingerprint.of("a:1", FROM, TO, "", 10).toKey();
        String right = PageFingerprint.of("a", FROM, TO, "1", 10).toKey();

        assertThat(left).isNotEqualTo(right);
    }

    @Test
    void literalFirstCursorDiffersFromFirstPage() {
        String firstPage = PageFingerprint.of("error", FROM, TO, "", 10).toKey();
        String literal = PageFingerprint.of("error", FROM, TO, "first", 10).toKey();

        assertThat(literal).isNotEqualTo(firstPage);
    }
}
