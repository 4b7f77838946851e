package io.github.samzhu.metering.document;

import java.time.Instant;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 死信工作紀錄。
 *
 * <p>由死信佇列消費者寫入，保存最終失敗的工作內容與原因，供人工檢視或重新提交。
 *
 * @param id 工作 ID
 * @param queue 原佇列
 * @param payload 工作內容
 * @param failureReason 最後一次失敗原因
 * @param retryCount 已重試次數
 * @param metadata 追蹤資訊
 * @param deadLetteredAt 進入死信的時間
 * @param recordedAt 寫入此紀錄的時間
 */
@Document(collection = "dead_letter_jobs")
public record DeadLetterRecord(
    @Id String id,
    String queue,
    Map<String, Object> payload,
    String failureReason,
    int retryCount,
    Job.Metadata metadata,
    @Indexed Instant deadLetteredAt,
    Instant recordedAt
) {}
