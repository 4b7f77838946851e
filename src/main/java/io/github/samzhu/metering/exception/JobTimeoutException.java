package io.github.samzhu.metering.exception;

import java.time.Duration;

/**
 * 工作執行超過佇列逾時異常，視為一次失敗。
 */
public class JobTimeoutException extends RuntimeException {

    private final String jobId;
    private final Duration timeout;

    public JobTimeoutException(String jobId, Duration timeout) {
        super(String.format("Job %s exceeded timeout of %s", jobId, timeout));
        this.jobId = jobId;
        this.timeout = timeout;
    }

    public String getJobId() {
        return jobId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
