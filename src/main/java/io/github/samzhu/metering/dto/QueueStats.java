package io.github.samzhu.metering.dto;

/**
 * 佇列執行統計。
 *
 * @param queue 佇列名稱
 * @param succeeded 成功次數
 * @param failed 失敗次數 (含逾時)
 * @param timedOut 逾時次數
 * @param deadLettered 進入死信次數
 * @param execution 執行時間統計
 */
public record QueueStats(
    String queue,
    long succeeded,
    long failed,
    long timedOut,
    long deadLettered,
    ExecutionStats execution
) {
    /**
     * 執行時間統計 (毫秒)，百分位數以 T-Digest 計算。
     */
    public record ExecutionStats(
        long count,
        long minMs,
        long maxMs,
        double avgMs,
        double p50Ms,
        double p90Ms,
        double p95Ms,
        double p99Ms
    ) {
        public static ExecutionStats empty() {
            return new ExecutionStats(0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0);
        }
    }
}
