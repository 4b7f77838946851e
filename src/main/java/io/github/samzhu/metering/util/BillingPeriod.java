package io.github.samzhu.metering.util;

import java.time.Instant;

/**
 * 計費週期，半開區間 {@code [start, end)}，皆為 UTC 午夜。
 *
 * @param start 週期開始 (含)
 * @param end 週期結束 (不含)，等於下一個週期的開始
 */
public record BillingPeriod(Instant start, Instant end) {

    public BillingPeriod {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Invalid billing period: " + start + " - " + end);
        }
    }

    /**
     * 檢查時間點是否落在此週期內。
     *
     * @param instant 時間點
     * @return {@code start <= instant < end}
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
