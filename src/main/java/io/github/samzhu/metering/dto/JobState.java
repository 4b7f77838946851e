package io.github.samzhu.metering.dto;

/**
 * 背景工作狀態。
 */
public enum JobState {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    /** 失敗，等待重試延遲後回到 QUEUED */
    FAILED,
    /** 重試用盡，終止狀態 */
    DEAD_LETTERED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == DEAD_LETTERED;
    }
}
