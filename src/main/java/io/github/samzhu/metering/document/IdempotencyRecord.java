package io.github.samzhu.metering.document;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 冪等鍵文件。
 *
 * <p>範圍為 (idempotencyKey, orgId, resourceType)。以 {@code _id} 唯一性實現「第一個寫入者勝出」：
 * 請求執行前先以 {@code PENDING} 狀態佔用，完成後轉為 {@code COMPLETED} 並保存回應，
 * 之後相同鍵的請求直接重播保存的狀態碼與回應內容。
 *
 * <p>文件 ID 格式：{@code {orgId}:{resourceType}:{idempotencyKey}}，resourceType 中的 {@code :} 與 {@code %}
 * 以百分比編碼表示，冪等鍵放在最後且不編碼，不同範圍不會得到相同 ID。
 *
 * @param id 複合 ID
 * @param idempotencyKey 用戶端提供的冪等鍵
 * @param orgId 組織 ID
 * @param resourceType 資源類型，例如 {@code scan}
 * @param resourceId 建立的資源 ID
 * @param state {@code PENDING} 或 {@code COMPLETED}
 * @param responseStatus 保存的 HTTP 狀態碼
 * @param responseBody 保存的回應內容 (原始 JSON)
 * @param claimedAt 佔用時間
 * @param createdAt 建立時間
 * @param expiresAt 過期時間
 */
@Document(collection = "idempotency_keys")
public record IdempotencyRecord(
    @Id String id,
    String idempotencyKey,
    Long orgId,
    String resourceType,
    String resourceId,
    String state,
    Integer responseStatus,
    String responseBody,
    Instant claimedAt,
    Instant createdAt,
    @Indexed Instant expiresAt
) {
    public static final String STATE_PENDING = "PENDING";
    public static final String STATE_COMPLETED = "COMPLETED";

    /**
     * 產生複合主鍵。
     *
     * @param orgId 組織 ID
     * @param resourceType 資源類型
     * @param idempotencyKey 冪等鍵
     * @return 複合 ID
     */
    public static String createId(long orgId, String resourceType, String idempotencyKey) {
        return orgId + ":" + URLEncoder.encode(resourceType, StandardCharsets.UTF_8) + ":" + idempotencyKey;
    }

    public boolean isCompleted() {
        return STATE_COMPLETED.equals(state);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
