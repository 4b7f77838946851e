package io.github.samzhu.metering.dto;

/**
 * 冪等鍵保存的回應，重播時原樣回傳。
 *
 * @param status HTTP 狀態碼
 * @param body 回應內容 (原始 JSON)
 * @param resourceId 建立的資源 ID
 */
public record CachedResponse(int status, String body, String resourceId) {}
