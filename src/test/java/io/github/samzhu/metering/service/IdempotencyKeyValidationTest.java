package io.github.samzhu.metering.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import io.github.samzhu.metering.exception.InvalidIdempotencyKeyException;

class IdempotencyKeyValidationTest {

    @Test
    void shouldAcceptKeysWithinBounds() {
        assertThatCode(() -> IdempotencyService.validateKey("a".repeat(16))).doesNotThrowAnyException();
        assertThatCode(() -> IdempotencyService.validateKey("a".repeat(255))).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectShortKey() {
        assertThatThrownBy(() -> IdempotencyService.validateKey("a".repeat(15)))
            .isInstanceOf(InvalidIdempotencyKeyException.class)
            .hasMessageContaining("got 15");
    }

    @Test
    void shouldRejectLongKey() {
        assertThatThrownBy(() -> IdempotencyService.validateKey("a".repeat(256)))
            .isInstanceOf(InvalidIdempotencyKeyException.class);
    }

    @Test
    void shouldRejectMissingKey() {
        assertThatThrownBy(() -> IdempotencyService.validateKey(null))
            .isInstanceOf(InvalidIdempotencyKeyException.class)
            .hasMessageContaining("got 0");
    }
}
