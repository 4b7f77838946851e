package io.github.samzhu.metering.dto;

/**
 * 佔用冪等鍵的結果。
 *
 * @param outcome 結果類型
 * @param cached {@link Outcome#REPLAY} 時保存的回應，其他情況為 null
 */
public record ClaimResult(Outcome outcome, CachedResponse cached) {

    public enum Outcome {
        /** 取得執行權，呼叫端應執行副作用並呼叫 record 或 release */
        ACQUIRED,
        /** 已有完成的回應，應直接重播 */
        REPLAY,
        /** 相同鍵的請求仍在執行中 */
        IN_PROGRESS
    }

    public static ClaimResult acquired() {
        return new ClaimResult(Outcome.ACQUIRED, null);
    }

    public static ClaimResult replay(CachedResponse cached) {
        return new ClaimResult(Outcome.REPLAY, cached);
    }

    public static ClaimResult inProgress() {
        return new ClaimResult(Outcome.IN_PROGRESS, null);
    }
}
