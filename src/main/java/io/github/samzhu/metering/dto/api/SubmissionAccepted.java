package io.github.samzhu.metering.dto.api;

import java.time.Instant;

/**
 * 計量提交被接受的回應內容 (202)。
 *
 * @param submissionId 提交 ID
 * @param resourceType 資源類型
 * @param jobId 背景工作 ID
 * @param jobEnqueued 是否成功入列
 * @param creditsReserved 本次扣除的點數
 * @param used 扣除後的已使用量
 * @param limit 上限，{@code null} 表示無限制
 * @param acceptedAt 接受時間
 */
public record SubmissionAccepted(
    String submissionId,
    String resourceType,
    String jobId,
    boolean jobEnqueued,
    long creditsReserved,
    long used,
    Long limit,
    Instant acceptedAt
) {}
