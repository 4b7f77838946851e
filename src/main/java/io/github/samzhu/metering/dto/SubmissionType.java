package io.github.samzhu.metering.dto;

import java.util.Locale;

/**
 * 需計量的提交類型。
 *
 * <p>每種類型對應一個冪等資源類型、一個佇列與一個計量資源。
 * 掃描依模型權重扣點，頁面產生每次扣 1。
 */
public enum SubmissionType {

    SCAN("scan", "scans", MeteredResource.SCANS, true),
    PAGE("page", "pages", MeteredResource.PAGES, false);

    private final String resourceType;
    private final String queue;
    private final MeteredResource resource;
    private final boolean weighted;

    SubmissionType(String resourceType, String queue, MeteredResource resource, boolean weighted) {
        this.resourceType = resourceType;
        this.queue = queue;
        this.resource = resource;
        this.weighted = weighted;
    }

    public String resourceType() {
        return resourceType;
    }

    public String queue() {
        return queue;
    }

    public MeteredResource resource() {
        return resource;
    }

    public boolean weighted() {
        return weighted;
    }

    /**
     * 由資源類型解析，接受單數或複數 (scan / scans)。
     */
    public static SubmissionType fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (SubmissionType type : values()) {
                if (type.resourceType.equals(normalized) || type.queue.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown submission type: " + key);
    }
}
