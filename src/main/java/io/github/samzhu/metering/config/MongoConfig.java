package io.github.samzhu.metering.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code organizations} - 組織、方案與計費錨定日</li>
 *   <li>{@code usage_periods} - 每個組織每個計費週期的用量計數</li>
 *   <li>{@code idempotency_keys} - 冪等鍵與快取回應</li>
 *   <li>{@code jobs} - 背景工作與其狀態</li>
 *   <li>{@code job_markers} - 入列標記 (TTL)</li>
 *   <li>{@code dead_letter_jobs} - 死信工作紀錄</li>
 * </ul>
 *
 * <p>索引宣告在各 document 上，由 {@code spring.data.mongodb.auto-index-creation} 建立；
 * {@code job_markers} 的 TTL 索引由 MongoDB 自動清除過期標記。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.metering.repository")
public class MongoConfig {
}
