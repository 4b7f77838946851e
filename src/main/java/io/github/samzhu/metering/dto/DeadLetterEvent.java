package io.github.samzhu.metering.dto;

import java.time.Instant;
import java.util.Map;

/**
 * 死信事件，重試用盡的工作發送到 {@code job-dead-letters}。
 *
 * @param jobId 工作 ID
 * @param queue 原佇列
 * @param payload 工作內容
 * @param failureReason 最後一次失敗原因
 * @param retryCount 已重試次數
 * @param maxRetries 最大重試次數
 * @param idempotencyKey 工作冪等鍵
 * @param trace 追蹤資訊
 * @param deadLetteredAt 進入死信的時間
 */
public record DeadLetterEvent(
    String jobId,
    String queue,
    Map<String, Object> payload,
    String failureReason,
    int retryCount,
    int maxRetries,
    String idempotencyKey,
    TraceContext trace,
    Instant deadLetteredAt
) {}
