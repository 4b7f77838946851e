package io.github.samzhu.metering.dto;

/**
 * 工作失敗分類。
 */
public enum FailureKind {
    /** 仍會重試 */
    TRANSIENT,
    /** 重試用盡，已進入死信 */
    PERMANENT
}
