package io.github.samzhu.metering.dto;

import java.util.Locale;

import io.github.samzhu.metering.config.MeteringProperties.PlanQuota;
import io.github.samzhu.metering.document.UsagePeriodRecord;

/**
 * 由用量帳本計數的資源。
 *
 * <p>每個資源對應 {@link UsagePeriodRecord} 的一個計數欄位與 {@link PlanQuota} 的一個上限。
 */
public enum MeteredResource {

    SCANS("scans", UsagePeriodRecord.FIELD_SCANS),
    PROMPTS("prompts", UsagePeriodRecord.FIELD_PROMPTS),
    PAGES("pages", UsagePeriodRecord.FIELD_PAGES);

    private final String key;
    private final String counterField;

    MeteredResource(String key, String counterField) {
        this.key = key;
        this.counterField = counterField;
    }

    /**
     * 對外使用的資源名稱，例如 {@code scans}。
     */
    public String key() {
        return key;
    }

    /**
     * {@code usage_periods} 中的計數欄位名稱。
     */
    public String counterField() {
        return counterField;
    }

    /**
     * 取得方案中此資源的上限。
     *
     * @param plan 方案
     * @return 上限，{@code null} 表示無限制
     */
    public Long limitOf(PlanQuota plan) {
        return switch (this) {
            case SCANS -> plan.scans();
            case PROMPTS -> plan.prompts();
            case PAGES -> plan.pages();
        };
    }

    /**
     * 取得用量紀錄中此資源的已使用量。
     *
     * @param usage 週期用量，可為 null
     * @return 已使用量，紀錄不存在時為 0
     */
    public long usedIn(UsagePeriodRecord usage) {
        if (usage == null) {
            return 0;
        }
        return switch (this) {
            case SCANS -> usage.scansUsed();
            case PROMPTS -> usage.promptsUsed();
            case PAGES -> usage.pagesGenerated();
        };
    }

    /**
     * 由資源名稱解析，大小寫不拘。
     *
     * @param key 資源名稱
     * @return 資源
     * @throws IllegalArgumentException 未知的資源名稱
     */
    public static MeteredResource fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (MeteredResource resource : values()) {
                if (resource.key.equals(normalized)) {
                    return resource;
                }
            }
        }
        throw new IllegalArgumentException("Unknown metered resource: " + key);
    }
}
