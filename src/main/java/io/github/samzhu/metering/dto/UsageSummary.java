package io.github.samzhu.metering.dto;

import java.time.Instant;
import java.util.Map;

/**
 * 組織目前計費週期的用量摘要。
 *
 * @param orgId 組織 ID
 * @param planTier 方案代碼
 * @param periodStart 週期開始
 * @param periodEnd 週期結束
 * @param daysRemaining 週期剩餘天數
 * @param resources 各資源用量，key 為資源名稱 (scans / prompts / pages)
 */
public record UsageSummary(
    Long orgId,
    String planTier,
    Instant periodStart,
    Instant periodEnd,
    long daysRemaining,
    Map<String, ResourceUsage> resources
) {
    /**
     * 單一資源的用量。
     *
     * @param used 已使用量
     * @param limit 上限，{@code null} 表示無限制
     * @param warn 是否達到警示門檻
     */
    public record ResourceUsage(long used, Long limit, boolean warn) {}
}
