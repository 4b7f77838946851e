package io.github.samzhu.metering.service;

import java.util.Map;

import io.github.samzhu.metering.document.Job;
import io.github.samzhu.metering.dto.TraceContext;

/**
 * 交給 {@link JobHandler} 的工作內容。
 *
 * @param jobId 工作 ID
 * @param queue 佇列
 * @param payload 工作內容
 * @param trace 追蹤資訊
 * @param attempt 第幾次執行 (從 1 開始)
 * @param retryCount 已重試次數
 */
public record JobContext(
    String jobId,
    String queue,
    Map<String, Object> payload,
    TraceContext trace,
    int attempt,
    int retryCount
) {
    static JobContext fromJob(Job job) {
        Job.Metadata metadata = job.metadata();
        return new JobContext(
            job.id(),
            job.queue(),
            job.payload() != null ? job.payload() : Map.of(),
            new TraceContext(metadata.requestId(), metadata.userId(), metadata.orgId()),
            job.attempts(),
            metadata.retryCount());
    }
}
