package io.github.samzhu.metering.dto;

/**
 * 工作入列結果。
 *
 * @param status 入列狀態
 * @param jobId 工作 ID，重複入列時為既有工作的 ID
 */
public record EnqueueResult(Status status, String jobId) {

    public enum Status {
        ACCEPTED,
        ALREADY_ENQUEUED
    }

    public static EnqueueResult accepted(String jobId) {
        return new EnqueueResult(Status.ACCEPTED, jobId);
    }

    public static EnqueueResult alreadyEnqueued(String jobId) {
        return new EnqueueResult(Status.ALREADY_ENQUEUED, jobId);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
