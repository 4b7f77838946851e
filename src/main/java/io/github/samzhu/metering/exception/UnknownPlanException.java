package io.github.samzhu.metering.exception;

/**
 * 未知方案異常。
 *
 * <p>組織的方案代碼沒有對應的 {@code metering.plans} 設定時拋出，
 * 屬於設定錯誤，應在 application.yaml 新增該方案。
 */
public class UnknownPlanException extends RuntimeException {

    private final String planTier;

    public UnknownPlanException(String planTier) {
        super(String.format("Unknown plan tier: '%s'. Please add it under metering.plans in application.yaml",
            planTier));
        this.planTier = planTier;
    }

    public String getPlanTier() {
        return planTier;
    }
}
