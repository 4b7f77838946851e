package io.github.samzhu.metering.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 組織文件。
 *
 * <p>記錄組織的方案與計費錨定日。{@code currentPeriodStart} / {@code currentPeriodEnd}
 * 僅為快取提示，實際週期永遠由 {@link io.github.samzhu.metering.util.BillingPeriods}
 * 依錨定日與目前時間計算。
 *
 * @param id 組織 ID
 * @param name 組織名稱
 * @param planTier 方案代碼，對應 {@code metering.plans} 的 key
 * @param billingCycleAnchor 計費錨定日 (1-31)
 * @param currentPeriodStart 快取的目前週期開始
 * @param currentPeriodEnd 快取的目前週期結束
 * @param createdAt 建立時間
 * @param lastUpdatedAt 最後更新時間
 */
@Document(collection = "organizations")
public record Organization(
    @Id Long id,
    String name,
    String planTier,
    int billingCycleAnchor,
    Instant currentPeriodStart,
    Instant currentPeriodEnd,
    Instant createdAt,
    Instant lastUpdatedAt
) {
    /**
     * 檢查快取的週期提示是否與指定週期相同。
     *
     * @param start 週期開始
     * @param end 週期結束
     * @return true 表示提示仍有效
     */
    public boolean hasPeriodHint(Instant start, Instant end) {
        return start.equals(currentPeriodStart) && end.equals(currentPeriodEnd);
    }
}
