package io.github.samzhu.metering.dto.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * 保留用量請求。
 *
 * <p>提供 {@code model} 時依模型權重計算點數，否則使用 {@code amount}。
 *
 * @param resource 資源名稱 (scans / prompts / pages)
 * @param amount 保留量
 * @param model LLM 模型識別
 */
public record ReservationRequest(
    @NotBlank String resource,
    @Positive Long amount,
    String model
) {}
