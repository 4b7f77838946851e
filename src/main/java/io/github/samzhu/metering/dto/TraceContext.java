package io.github.samzhu.metering.dto;

/**
 * 隨背景工作傳遞的追蹤資訊。
 *
 * @param requestId 觸發的請求 ID
 * @param userId 觸發的使用者
 * @param orgId 組織 ID
 */
public record TraceContext(String requestId, String userId, Long orgId) {

    public static TraceContext empty() {
        return new TraceContext(null, null, null);
    }
}
