package io.github.samzhu.metering.document;

import java.time.Instant;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 背景工作文件。
 *
 * <p>文件 ID 即工作 ID (冪等鍵 SHA-256 前 16 碼)，重複入列會因主鍵衝突而被拒絕。
 * 狀態轉換：
 * <pre>
 * QUEUED → RUNNING → SUCCEEDED
 *                  → FAILED → (到期) QUEUED        retryCount &lt; maxRetries
 *                  → DEAD_LETTERED                 retryCount == maxRetries
 * </pre>
 *
 * @param id 工作 ID
 * @param queue 佇列名稱
 * @param payload 工作內容
 * @param metadata 追蹤與重試資訊
 * @param state 工作狀態，對應 {@link io.github.samzhu.metering.dto.JobState}
 * @param attempts 已開始執行的次數
 * @param availableAt 可被取出的時間 (重試延遲)
 * @param leaseExpiresAt 執行租約到期時間
 * @param workerId 執行中的 worker
 * @param lastError 最後一次失敗原因
 * @param result 執行結果
 * @param createdAt 入列時間
 * @param startedAt 最後一次開始執行時間
 * @param endedAt 結束時間
 * @param lastUpdatedAt 最後更新時間
 */
@Document(collection = "jobs")
@CompoundIndex(name = "queue_state_available_idx", def = "{'queue': 1, 'state': 1, 'availableAt': 1}")
@CompoundIndex(name = "state_lease_idx", def = "{'state': 1, 'leaseExpiresAt': 1}")
public record Job(
    @Id String id,
    String queue,
    Map<String, Object> payload,
    Metadata metadata,
    String state,
    int attempts,
    Instant availableAt,
    Instant leaseExpiresAt,
    String workerId,
    String lastError,
    Map<String, Object> result,
    Instant createdAt,
    Instant startedAt,
    Instant endedAt,
    Instant lastUpdatedAt
) {
    /**
     * 工作的追蹤與重試資訊，重試時保持不變 (除了 {@code retryCount})。
     *
     * @param idempotencyKey 工作冪等鍵
     * @param retryCount 已重試次數
     * @param maxRetries 最大重試次數
     * @param requestId 觸發此工作的請求 ID
     * @param userId 觸發此工作的使用者
     * @param orgId 組織 ID
     */
    public record Metadata(
        String idempotencyKey,
        int retryCount,
        int maxRetries,
        String requestId,
        String userId,
        Long orgId
    ) {}
}
