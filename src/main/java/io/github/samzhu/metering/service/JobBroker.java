package io.github.samzhu.metering.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.github.samzhu.metering.document.Job;

/**
 * 工作佇列的儲存與狀態轉換。
 *
 * <p>所有狀態轉換皆為條件式：只有在工作仍處於預期狀態 (且為同一次執行) 時才會生效，
 * 回傳 {@code false} 表示工作已被其他 worker 或排程處理。
 */
public interface JobBroker {

    /**
     * 新增工作。
     *
     * @param job 工作
     * @return false 表示相同 ID 的工作已存在
     */
    boolean submit(Job job);

    Optional<Job> findById(String jobId);

    /**
     * 取出佇列中最早可執行的 QUEUED 工作並轉為 RUNNING。
     *
     * @param queue 佇列
     * @param workerId worker ID
     * @param lease 執行租約長度
     * @param now 目前時間
     * @return 取得的工作，佇列為空時為 empty
     */
    Optional<Job> dequeue(String queue, String workerId, Duration lease, Instant now);

    boolean complete(Job job, Map<String, Object> result, Instant now);

    /**
     * 記錄失敗並排程重試，{@code retryCount} 加 1。
     */
    boolean scheduleRetry(Job job, String error, Instant availableAt, Instant now);

    boolean deadLetter(Job job, String error, Instant now);

    /**
     * 將執行中的工作放回佇列，不計入重試次數。
     */
    boolean requeue(Job job, Instant now);

    /**
     * 將到期的 FAILED 工作轉回 QUEUED。
     *
     * @return 轉換的工作數
     */
    long promoteDueRetries(Instant now);

    /**
     * 查詢租約已過期的 RUNNING 工作。
     */
    List<Job> findExpiredLeases(Instant now, int limit);

    /**
     * 查詢未過期的入列標記。
     *
     * @param idempotencyKey 工作冪等鍵
     * @param now 目前時間
     * @return 對應的工作 ID
     */
    Optional<String> findMarker(String idempotencyKey, Instant now);

    void saveMarker(String idempotencyKey, String jobId, Instant now, Instant expiresAt);
}
