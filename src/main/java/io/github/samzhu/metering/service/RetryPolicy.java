package io.github.samzhu.metering.service;

import java.time.Duration;
import java.util.List;

import io.github.samzhu.metering.config.MeteringProperties.JobsConfig;

/**
 * 固定間隔表的重試政策。
 *
 * <p>第 n 次失敗 (已重試 n-1 次) 時，若已重試次數小於 {@code maxRetries} 則在
 * {@code delays[retryCount]} 之後重試，否則進入死信。間隔表比重試次數短時沿用最後一個間隔。
 * {@code maxRetries = 3} 時一個工作最多執行 4 次。
 */
public class RetryPolicy {

    private final int maxRetries;
    private final List<Duration> delays;

    public RetryPolicy(int maxRetries, List<Duration> delays) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (maxRetries > 0 && (delays == null || delays.isEmpty())) {
            throw new IllegalArgumentException("Retry delays must not be empty when retries are enabled");
        }
        this.maxRetries = maxRetries;
        this.delays = delays == null ? List.of() : List.copyOf(delays);
    }

    /**
     * 由工作設定建立重試政策。
     */
    public static RetryPolicy from(JobsConfig config) {
        return new RetryPolicy(config.maxRetries(), config.retryDelays());
    }

    /**
     * 決定失敗後的處理方式。
     *
     * @param retryCount 失敗前已重試的次數
     * @return 重試 (含延遲) 或進入死信
     */
    public Decision onFailure(int retryCount) {
        return onFailure(retryCount, maxRetries);
    }

    /**
     * 以工作入列時記錄的重試上限決定失敗後的處理方式，間隔仍取自本政策的間隔表。
     *
     * @param retryCount 失敗前已重試的次數
     * @param jobMaxRetries 工作自身的重試上限
     * @return 重試 (含延遲) 或進入死信
     */
    public Decision onFailure(int retryCount, int jobMaxRetries) {
        if (retryCount < jobMaxRetries) {
            Duration delay = delays.isEmpty()
                ? Duration.ZERO
                : delays.get(Math.min(retryCount, delays.size() - 1));
            return new Decision(true, delay);
        }
        return new Decision(false, Duration.ZERO);
    }

    public int maxRetries() {
        return maxRetries;
    }

    /**
     * 失敗處理決定。
     *
     * @param retry true 表示重試，false 表示進入死信
     * @param delay 重試前的延遲
     */
    public record Decision(boolean retry, Duration delay) {}
}
