package io.github.samzhu.metering.document;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 組織計費週期用量文件。
 *
 * <p>每個組織每個計費週期一筆，第一次保留用量時建立，之後只會遞增，不會刪除。
 * 計數器以條件式 {@code $inc} 更新，MongoDB 對單一文件的寫入是序列化的，
 * 因此同一週期的保留請求有全序。
 *
 * <p>文件 ID 格式：{@code {orgId}_{periodStartDate}}，例如 {@code 42_2025-01-15}
 *
 * @param id 複合 ID
 * @param orgId 組織 ID
 * @param periodStart 週期開始 (含)
 * @param periodEnd 週期結束 (不含)
 * @param scansUsed 已使用掃描點數
 * @param promptsUsed 已使用 prompt 數
 * @param pagesGenerated 已產生頁面數
 * @param createdAt 建立時間
 * @param lastUpdatedAt 最後更新時間
 */
@Document(collection = "usage_periods")
@CompoundIndex(name = "org_period_idx", def = "{'orgId': 1, 'periodStart': -1}")
public record UsagePeriodRecord(
    @Id String id,
    Long orgId,
    Instant periodStart,
    Instant periodEnd,
    long scansUsed,
    long promptsUsed,
    long pagesGenerated,
    Instant createdAt,
    Instant lastUpdatedAt
) {
    public static final String FIELD_SCANS = "scansUsed";
    public static final String FIELD_PROMPTS = "promptsUsed";
    public static final String FIELD_PAGES = "pagesGenerated";

    /**
     * 產生複合主鍵。
     *
     * <p>使用組織 ID 與週期開始日期組合，確保每個組織每個週期只有一筆用量紀錄。
     *
     * @param orgId 組織 ID
     * @param periodStart 週期開始
     * @return 複合 ID，格式為 {@code orgId_YYYY-MM-DD}
     */
    public static String createId(long orgId, Instant periodStart) {
        return orgId + "_" + LocalDate.ofInstant(periodStart, ZoneOffset.UTC);
    }
}
