package io.github.samzhu.metering.exception;

/**
 * 用量超過方案上限異常。
 *
 * <p>保留用量或數量型檢查 (品牌、席位) 超過方案上限時拋出，不會有任何計數被修改。
 * 此異常為終止性錯誤，不應自動重試；對應 HTTP 429。
 */
public class LimitExceededException extends RuntimeException {

    public static final String CODE = "LIMIT_EXCEEDED";

    private final String resource;
    private final long current;
    private final long limit;
    private final long requested;

    public LimitExceededException(String resource, long current, long limit, long requested) {
        super(String.format("%s limit reached. Please upgrade your plan.", resource));
        this.resource = resource;
        this.current = current;
        this.limit = limit;
        this.requested = requested;
    }

    public String getCode() {
        return CODE;
    }

    public String getResource() {
        return resource;
    }

    public long getCurrent() {
        return current;
    }

    public long getLimit() {
        return limit;
    }

    public long getRequested() {
        return requested;
    }
}
