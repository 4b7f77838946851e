package io.github.samzhu.metering.dto;

import java.time.Instant;
import java.util.Map;

import io.github.samzhu.metering.document.Job;

/**
 * 工作狀態查詢結果。
 *
 * @param jobId 工作 ID
 * @param queue 佇列
 * @param state 狀態
 * @param attempts 已執行次數
 * @param retryCount 已重試次數
 * @param maxRetries 最大重試次數
 * @param failureKind 失敗分類，未失敗時為 null
 * @param lastError 最後失敗原因
 * @param result 執行結果
 * @param trace 追蹤資訊
 * @param createdAt 入列時間
 * @param startedAt 最後開始時間
 * @param endedAt 結束時間
 * @param nextAttemptAt 下次可執行時間 (FAILED 時)
 */
public record JobStatusView(
    String jobId,
    String queue,
    JobState state,
    int attempts,
    int retryCount,
    int maxRetries,
    FailureKind failureKind,
    String lastError,
    Map<String, Object> result,
    TraceContext trace,
    Instant createdAt,
    Instant startedAt,
    Instant endedAt,
    Instant nextAttemptAt
) {
    /**
     * 由工作文件建立狀態檢視。
     */
    public static JobStatusView fromJob(Job job) {
        JobState state = JobState.valueOf(job.state());
        Job.Metadata metadata = job.metadata();
        FailureKind failureKind = switch (state) {
            case DEAD_LETTERED -> FailureKind.PERMANENT;
            case FAILED -> FailureKind.TRANSIENT;
            default -> job.lastError() != null ? FailureKind.TRANSIENT : null;
        };
        return new JobStatusView(
            job.id(),
            job.queue(),
            state,
            job.attempts(),
            metadata.retryCount(),
            metadata.maxRetries(),
            state == JobState.SUCCEEDED ? null : failureKind,
            job.lastError(),
            job.result(),
            new TraceContext(metadata.requestId(), metadata.userId(), metadata.orgId()),
            job.createdAt(),
            job.startedAt(),
            job.endedAt(),
            state == JobState.FAILED ? job.availableAt() : null
        );
    }
}
