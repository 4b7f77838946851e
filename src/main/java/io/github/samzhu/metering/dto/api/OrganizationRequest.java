package io.github.samzhu.metering.dto.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * 建立或更新組織請求。
 *
 * @param name 組織名稱
 * @param planTier 方案代碼
 * @param billingCycleAnchor 計費錨定日 (1-31)，未提供時使用今天的日期
 */
public record OrganizationRequest(
    @NotBlank String name,
    @NotBlank String planTier,
    @Min(1) @Max(31) Integer billingCycleAnchor
) {}
