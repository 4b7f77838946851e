package io.github.samzhu.metering.exception;

/**
 * 冪等鍵格式錯誤異常。
 *
 * <p>冪等鍵長度必須介於 16 到 255 字元，檢查在任何副作用之前進行；對應 HTTP 400。
 */
public class InvalidIdempotencyKeyException extends RuntimeException {

    private final int length;

    public InvalidIdempotencyKeyException(int length, int minLength, int maxLength) {
        super(String.format("Idempotency-Key must be between %d and %d characters, got %d",
            minLength, maxLength, length));
        this.length = length;
    }

    public int getLength() {
        return length;
    }
}
