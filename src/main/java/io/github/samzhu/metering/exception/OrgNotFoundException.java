package io.github.samzhu.metering.exception;

/**
 * 組織不存在異常，對應 HTTP 404。
 */
public class OrgNotFoundException extends RuntimeException {

    private final long orgId;

    public OrgNotFoundException(long orgId) {
        super("Organization not found: " + orgId);
        this.orgId = orgId;
    }

    public long getOrgId() {
        return orgId;
    }
}
