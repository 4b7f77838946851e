package io.github.samzhu.metering.dto;

import java.util.Locale;

import io.github.samzhu.metering.config.MeteringProperties.PlanQuota;

/**
 * 數量型的方案上限 (非週期計數)，目前數量由擁有該實體的服務提供。
 */
public enum SlotKind {

    BRANDS("brands"),
    SEATS("seats");

    private final String key;

    SlotKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public Long limitOf(PlanQuota plan) {
        return switch (this) {
            case BRANDS -> plan.brands();
            case SEATS -> plan.seats();
        };
    }

    public static SlotKind fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (SlotKind kind : values()) {
                if (kind.key.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown slot kind: " + key);
    }
}
