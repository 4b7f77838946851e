package io.github.samzhu.metering.dto.api;

import java.util.Map;

/**
 * 計量提交請求。
 *
 * @param model LLM 模型識別 (掃描時用於計算點數)
 * @param userId 提交的使用者
 * @param parameters 交給背景工作的參數
 */
public record SubmissionRequest(
    String model,
    String userId,
    Map<String, Object> parameters
) {}
