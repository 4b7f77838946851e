package io.github.samzhu.metering.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Metering 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link PlanQuota} - 各方案 (plan tier) 的資源上限，未設定代表無限制</li>
 *   <li>{@code creditWeights} - 各 LLM 模型每次掃描消耗的點數</li>
 *   <li>{@link IdempotencyConfig} - 冪等鍵的保存期限與清理排程</li>
 *   <li>{@link JobsConfig} - 背景工作的重試、逾時與 worker 設定</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * metering:
 *   warn-threshold: 0.80
 *   plans:
 *     starter:
 *       scans: 1000
 *       pages: 3
 *     enterprise:
 *       display-name: Enterprise
 *   credit-weights:
 *     "[perplexity-sonar]": 2
 *   jobs:
 *     max-retries: 3
 *     retry-delays: 60s,300s,900s
 *     queues:
 *       scans:
 *         timeout: 30m
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "metering")
public record MeteringProperties(
    Map<String, PlanQuota> plans,
    Map<String, Integer> creditWeights,
    Integer defaultCreditWeight,
    Double warnThreshold,
    IdempotencyConfig idempotency,
    JobsConfig jobs
) {
    public MeteringProperties {
        if (plans == null) {
            plans = Map.of();
        }
        if (creditWeights == null) {
            creditWeights = Map.of();
        }
        if (defaultCreditWeight == null || defaultCreditWeight <= 0) {
            defaultCreditWeight = 1;
        }
        if (warnThreshold == null || warnThreshold <= 0) {
            warnThreshold = 0.80;
        }
        if (idempotency == null) {
            idempotency = IdempotencyConfig.defaults();
        }
        if (jobs == null) {
            jobs = JobsConfig.defaults();
        }
    }

    /**
     * 單一方案的資源上限。
     *
     * <p>任一欄位為 {@code null} 代表該資源無限制 (例如 enterprise 方案)。
     * {@code brands} 與 {@code seats} 為數量型上限，不由用量帳本計數。
     *
     * @param displayName 顯示名稱
     * @param scans 每個計費週期的掃描點數
     * @param prompts 每個計費週期的 prompt 範本數
     * @param pages 每個計費週期可產生的頁面數
     * @param brands 品牌數量上限
     * @param seats 成員席位上限
     */
    public record PlanQuota(
        String displayName,
        Long scans,
        Long prompts,
        Long pages,
        Long brands,
        Long seats
    ) {}

    /**
     * 冪等鍵設定。
     *
     * @param ttl 快取回應的保存期限，預設 24 小時
     * @param claimTimeout 執行中 (PENDING) 的鍵被視為中斷而可被接手的時間，預設 5 分鐘
     * @param sweepCron 過期資料清理 Cron 表達式，預設每小時 15 分
     * @param sweepBatchSize 每批刪除筆數，預設 1000
     * @param sweepMaxBatches 每次清理最多批數，預設 50
     */
    public record IdempotencyConfig(
        Duration ttl,
        Duration claimTimeout,
        String sweepCron,
        int sweepBatchSize,
        int sweepMaxBatches
    ) {
        public IdempotencyConfig {
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                ttl = Duration.ofHours(24);
            }
            if (claimTimeout == null || claimTimeout.isNegative() || claimTimeout.isZero()) {
                claimTimeout = Duration.ofMinutes(5);
            }
            if (sweepCron == null || sweepCron.isBlank()) {
                sweepCron = "0 15 * * * *";
            }
            if (sweepBatchSize <= 0) {
                sweepBatchSize = 1000;
            }
            if (sweepMaxBatches <= 0) {
                sweepMaxBatches = 50;
            }
        }

        /**
         * 建立預設冪等設定。
         */
        public static IdempotencyConfig defaults() {
            return new IdempotencyConfig(Duration.ofHours(24), Duration.ofMinutes(5), "0 15 * * * *", 1000, 50);
        }
    }

    /**
     * 背景工作設定。
     *
     * <p>重試間隔依序套用；重試次數超過列表長度時沿用最後一個間隔。
     *
     * @param workerEnabled 是否在此節點啟動 worker
     * @param maxRetries 最大重試次數，預設 3 (共 4 次執行)
     * @param retryDelays 重試間隔，預設 1 分、5 分、15 分
     * @param markerTtl 入列標記的保存期限，預設 24 小時
     * @param leaseGrace 執行租約在逾時之外的寬限時間
     * @param pollInterval worker 輪詢間隔
     * @param concurrency 同時執行的工作數
     * @param shutdownTimeout 關閉時等待執行中工作的時間
     * @param deadLetterBinding 死信事件的 output binding 名稱
     * @param statsCompression 執行時間 T-Digest 壓縮因子
     * @param queues 各佇列設定，{@code default} 為未列出佇列的預設值
     */
    public record JobsConfig(
        Boolean workerEnabled,
        Integer maxRetries,
        List<Duration> retryDelays,
        Duration markerTtl,
        Duration leaseGrace,
        Duration pollInterval,
        Integer concurrency,
        Duration shutdownTimeout,
        String deadLetterBinding,
        Integer statsCompression,
        Map<String, QueueConfig> queues
    ) {
        public static final String DEFAULT_QUEUE = "default";

        public JobsConfig {
            if (workerEnabled == null) {
                workerEnabled = true;
            }
            if (maxRetries == null || maxRetries < 0) {
                maxRetries = 3;
            }
            if (retryDelays == null || retryDelays.isEmpty()) {
                retryDelays = List.of(Duration.ofSeconds(60), Duration.ofSeconds(300), Duration.ofSeconds(900));
            }
            if (markerTtl == null || markerTtl.isNegative() || markerTtl.isZero()) {
                markerTtl = Duration.ofHours(24);
            }
            if (leaseGrace == null || leaseGrace.isNegative()) {
                leaseGrace = Duration.ofSeconds(60);
            }
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
                pollInterval = Duration.ofSeconds(1);
            }
            if (concurrency == null || concurrency <= 0) {
                concurrency = 4;
            }
            if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
                shutdownTimeout = Duration.ofSeconds(30);
            }
            if (deadLetterBinding == null || deadLetterBinding.isBlank()) {
                deadLetterBinding = "deadLetters-out-0";
            }
            if (statsCompression == null || statsCompression <= 0) {
                statsCompression = 100;
            }
            if (queues == null) {
                queues = Map.of();
            }
        }

        /**
         * 建立預設工作設定。
         */
        public static JobsConfig defaults() {
            return new JobsConfig(true, 3, null, null, null, null, null, null, null, null,
                Map.of(
                    "scans", new QueueConfig(Duration.ofMinutes(30)),
                    "pages", new QueueConfig(Duration.ofMinutes(10)),
                    DEFAULT_QUEUE, new QueueConfig(Duration.ofMinutes(5))));
        }

        /**
         * 取得佇列的執行逾時；未設定的佇列使用 {@code default} 佇列的值，再無則為 5 分鐘。
         *
         * @param queue 佇列名稱
         * @return 執行逾時
         */
        public Duration timeoutFor(String queue) {
            QueueConfig config = queues.get(queue);
            if (config == null) {
                config = queues.get(DEFAULT_QUEUE);
            }
            return config != null ? config.timeout() : Duration.ofMinutes(5);
        }
    }

    /**
     * 單一佇列設定。
     *
     * @param timeout 單次執行逾時
     */
    public record QueueConfig(Duration timeout) {
        public QueueConfig {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                timeout = Duration.ofMinutes(5);
            }
        }
    }
}
