package io.github.samzhu.metering.dto;

import java.time.Instant;

/**
 * 保留用量成功的結果。
 *
 * @param resource 資源名稱
 * @param amount 本次保留量
 * @param used 保留後的已使用量
 * @param limit 上限，{@code null} 表示無限制
 * @param periodStart 週期開始
 * @param periodEnd 週期結束
 */
public record UsageResult(
    String resource,
    long amount,
    long used,
    Long limit,
    Instant periodStart,
    Instant periodEnd
) {}
