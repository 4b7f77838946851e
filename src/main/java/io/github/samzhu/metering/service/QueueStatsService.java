package io.github.samzhu.metering.service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import com.tdunning.math.stats.Centroid;
import com.tdunning.math.stats.TDigest;

import io.github.samzhu.metering.config.MeteringProperties;
import io.github.samzhu.metering.dto.QueueStats;
import io.github.samzhu.metering.dto.QueueStats.ExecutionStats;

/**
 * 佇列執行統計服務。
 *
 * <p>以 T-Digest 記錄各佇列的執行時間分布 (P50/P90/P95/P99)，用於調整佇列逾時。
 * 統計保存在記憶體，僅反映此節點啟動後的執行。
 *
 * @see <a href="https://github.com/tdunning/t-digest">T-Digest GitHub</a>
 */
@Service
public class QueueStatsService {

    private final int compression;
    private final Map<String, QueueCounters> queues = new ConcurrentHashMap<>();

    public QueueStatsService(MeteringProperties properties) {
        this.compression = properties.jobs().statsCompression();
    }

    public void recordSuccess(String queue, Duration elapsed) {
        counters(queue).record(elapsed, true, false);
    }

    public void recordFailure(String queue, Duration elapsed, boolean timedOut) {
        counters(queue).record(elapsed, false, timedOut);
    }

    public void recordDeadLetter(String queue) {
        counters(queue).deadLettered();
    }

    /**
     * 取得單一佇列的統計。
     */
    public Optional<QueueStats> snapshot(String queue) {
        QueueCounters counters = queues.get(queue);
        return counters == null ? Optional.empty() : Optional.of(counters.snapshot(queue));
    }

    /**
     * 取得所有佇列的統計，依佇列名稱排序。
     */
    public List<QueueStats> snapshots() {
        return queues.entrySet().stream()
            .map(entry -> entry.getValue().snapshot(entry.getKey()))
            .sorted(Comparator.comparing(QueueStats::queue))
            .toList();
    }

    private QueueCounters counters(String queue) {
        return queues.computeIfAbsent(queue, q -> new QueueCounters(TDigest.createMergingDigest(compression)));
    }

    /**
     * 單一佇列的計數器，以 synchronized 保護 T-Digest。
     */
    private static final class QueueCounters {

        private final TDigest digest;
        private long succeeded;
        private long failed;
        private long timedOut;
        private long deadLettered;

        QueueCounters(TDigest digest) {
            this.digest = digest;
        }

        synchronized void record(Duration elapsed, boolean success, boolean timeout) {
            digest.add(Math.max(0, elapsed.toMillis()));
            if (success) {
                succeeded++;
            } else {
                failed++;
                if (timeout) {
                    timedOut++;
                }
            }
        }

        synchronized void deadLettered() {
            deadLettered++;
        }

        synchronized QueueStats snapshot(String queue) {
            return new QueueStats(queue, succeeded, failed, timedOut, deadLettered, executionStats());
        }

        private ExecutionStats executionStats() {
            if (digest.size() == 0) {
                return ExecutionStats.empty();
            }
            // 以 centroids 加權平均計算平均值
            double sum = 0;
            for (Centroid centroid : digest.centroids()) {
                sum += centroid.mean() * centroid.count();
            }
            return new ExecutionStats(
                digest.size(),
                (long) digest.getMin(),
                (long) digest.getMax(),
                sum / digest.size(),
                digest.quantile(0.50),
                digest.quantile(0.90),
                digest.quantile(0.95),
                digest.quantile(0.99));
        }
    }
}
