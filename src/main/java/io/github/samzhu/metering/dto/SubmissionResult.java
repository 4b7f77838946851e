package io.github.samzhu.metering.dto;

/**
 * 計量提交的回應。
 *
 * @param status HTTP 狀態碼
 * @param body 回應內容 (原始 JSON)
 * @param replayed 是否為冪等重播
 */
public record SubmissionResult(int status, String body, boolean replayed) {}
