package io.github.samzhu.metering.exception;

/**
 * 相同冪等鍵的請求仍在執行中異常。
 *
 * <p>用戶端應稍後以相同冪等鍵重試，屆時會取得第一個請求的回應；對應 HTTP 409。
 */
public class IdempotencyConflictException extends RuntimeException {

    private final long orgId;
    private final String resourceType;

    public IdempotencyConflictException(long orgId, String resourceType) {
        super(String.format("A request with the same Idempotency-Key is still in progress: orgId=%d, resourceType=%s",
            orgId, resourceType));
        this.orgId = orgId;
        this.resourceType = resourceType;
    }

    public long getOrgId() {
        return orgId;
    }

    public String getResourceType() {
        return resourceType;
    }
}
