package io.github.samzhu.metering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Metering Service - 多租戶用量計量與背景工作派送服務。
 *
 * <p>此服務負責：
 * <ul>
 *   <li>依組織的計費週期計算用量區間</li>
 *   <li>以原子化的「檢查並遞增」保留用量，確保併發請求不會超出方案上限</li>
 *   <li>以冪等鍵避免用戶端重試造成重複執行</li>
 *   <li>派送背景工作，提供有上限的重試與死信佇列</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * API Request → QuotaPolicy (點數) → UsageLedger (usage_periods)
 *                    ↓
 *             IdempotencyStore (idempotency_keys)
 *                    ↓
 *             JobDispatcher (jobs) → JobWorker → job-dead-letters
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/">Spring Data MongoDB</a>
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/">Spring Cloud Stream</a>
 */
@SpringBootApplication
@EnableScheduling
public class MeteringApplication {

    private static final Logger log = LoggerFactory.getLogger(MeteringApplication.class);

    public static void main(String[] args) {
        log.info("Starting Metering Service - quota metering and job dispatch");
        SpringApplication.run(MeteringApplication.class, args);
    }
}
