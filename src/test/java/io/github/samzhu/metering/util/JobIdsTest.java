package io.github.samzhu.metering.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class JobIdsTest {

    @Test
    void shouldDeriveSameIdForSameKey() {
        // When
        String first = JobIds.fromIdempotencyKey("scan:42:abcdefghijklmnop");
        String second = JobIds.fromIdempotencyKey("scan:42:abcdefghijklmnop");

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first).hasSize(16).matches("[0-9a-f]{16}");
    }

    @Test
    void shouldUseSha256Prefix() {
        // SHA-256("abc") = ba7816bf8f01cfea414140de5dae2223...
        assertThat(JobIds.fromIdempotencyKey("abc")).isEqualTo("ba7816bf8f01cfea");
    }

    @Test
    void shouldDeriveDifferentIdsForDifferentKeys() {
        assertThat(JobIds.fromIdempotencyKey("scan:1:key-aaaaaaaaaaaaaa"))
            .isNotEqualTo(JobIds.fromIdempotencyKey("scan:2:key-aaaaaaaaaaaaaa"));
    }

    @Test
    void shouldRejectBlankKey() {
        assertThatThrownBy(() -> JobIds.fromIdempotencyKey(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobIds.fromIdempotencyKey(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
