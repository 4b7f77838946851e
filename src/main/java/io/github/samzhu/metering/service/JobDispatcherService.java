package io.github.samzhu.metering.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.metering.config.MeteringProperties;
import io.github.samzhu.metering.config.MeteringProperties.JobsConfig;
import io.github.samzhu.metering.document.Job;
import io.github.samzhu.metering.dto.DeadLetterEvent;
import io.github.samzhu.metering.dto.EnqueueResult;
import io.github.samzhu.metering.dto.JobState;
import io.github.samzhu.metering.dto.JobStatusView;
import io.github.samzhu.metering.dto.TraceContext;
import io.github.samzhu.metering.exception.JobTimeoutException;
import io.github.samzhu.metering.util.JobIds;

/**
 * 背景工作派送服務。
 *
 * <p>入列流程：
 * <ol>
 *   <li>由工作冪等鍵計算工作 ID (SHA-256 前 16 碼)</li>
 *   <li>檢查入列標記，存在則回傳既有工作 ID</li>
 *   <li>以工作 ID 為主鍵新增工作，主鍵衝突代表已入列</li>
 *   <li>保存入列標記 (24 小時)</li>
 * </ol>
 *
 * <p>失敗處理依 {@link RetryPolicy}：已重試次數小於上限時排程重試，否則標記為
 * {@code DEAD_LETTERED} 並發送 {@link DeadLetterEvent}。重試延遲到期後由
 * {@link #promoteDueRetries()} 轉回 {@code QUEUED}；租約過期的執行中工作由
 * {@link #reapExpiredLeases()} 視為失敗。
 */
@Service
public class JobDispatcherService {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcherService.class);

    private static final int REAP_BATCH_SIZE = 100;

    private final JobBroker broker;
    private final DeadLetterPublisher deadLetterPublisher;
    private final QueueStatsService queueStats;
    private final Clock clock;
    private final JobsConfig config;
    private final RetryPolicy retryPolicy;

    public JobDispatcherService(
            JobBroker broker,
            DeadLetterPublisher deadLetterPublisher,
            QueueStatsService queueStats,
            MeteringProperties properties,
            Clock clock) {
        this.broker = broker;
        this.deadLetterPublisher = deadLetterPublisher;
        this.queueStats = queueStats;
        this.clock = clock;
        this.config = properties.jobs();
        this.retryPolicy = RetryPolicy.from(config);
    }

    /**
     * 將工作加入佇列。
     *
     * <p>同一個冪等鍵永遠對應同一個工作，重複入列不會建立新工作。
     *
     * @param queue 佇列名稱
     * @param payload 工作內容
     * @param idempotencyKey 工作冪等鍵
     * @param trace 追蹤資訊
     * @return {@code ACCEPTED} 或 {@code ALREADY_ENQUEUED}，皆帶工作 ID
     */
    public EnqueueResult enqueue(String queue, Map<String, Object> payload, String idempotencyKey,
            TraceContext trace) {
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("Queue name must not be blank");
        }
        String jobId = JobIds.fromIdempotencyKey(idempotencyKey);
        Instant now = clock.instant();

        Optional<String> marked = broker.findMarker(idempotencyKey, now);
        if (marked.isPresent()) {
            log.info("Job already enqueued (marker): jobId={}, queue={}", marked.get(), queue);
            return EnqueueResult.alreadyEnqueued(marked.get());
        }

        TraceContext context = trace != null ? trace : TraceContext.empty();
        Job job = new Job(
            jobId,
            queue,
            payload != null ? new LinkedHashMap<>(payload) : Map.of(),
            new Job.Metadata(idempotencyKey, 0, retryPolicy.maxRetries(),
                context.requestId(), context.userId(), context.orgId()),
            JobState.QUEUED.name(),
            0,
            now,
            null,
            null,
            null,
            null,
            now,
            null,
            null,
            now
        );

        boolean inserted = broker.submit(job);
        broker.saveMarker(idempotencyKey, jobId, now, now.plus(config.markerTtl()));

        if (!inserted) {
            log.info("Job already enqueued: jobId={}, queue={}", jobId, queue);
            return EnqueueResult.alreadyEnqueued(jobId);
        }
        log.info("Job enqueued: jobId={}, queue={}, orgId={}, requestId={}",
            jobId, queue, context.orgId(), context.requestId());
        return EnqueueResult.accepted(jobId);
    }

    /**
     * 查詢工作狀態。
     *
     * @param jobId 工作 ID
     * @return 工作狀態，不存在時為 empty
     */
    public Optional<JobStatusView> jobStatus(String jobId) {
        return broker.findById(jobId).map(JobStatusView::fromJob);
    }

    /**
     * 取出佇列中下一個可執行的工作。
     *
     * @param queue 佇列
     * @param workerId worker ID
     * @return 工作 (已轉為 RUNNING)
     */
    public Optional<Job> dequeue(String queue, String workerId) {
        Duration lease = config.timeoutFor(queue).plus(config.leaseGrace());
        return broker.dequeue(queue, workerId, lease, clock.instant());
    }

    /**
     * 佇列的執行逾時。
     */
    public Duration timeoutFor(String queue) {
        return config.timeoutFor(queue);
    }

    /**
     * 記錄執行成功。
     */
    public void markSucceeded(Job job, Map<String, Object> result, Duration elapsed) {
        if (broker.complete(job, result, clock.instant())) {
            queueStats.recordSuccess(job.queue(), elapsed);
            log.info("Job succeeded: jobId={}, queue={}, attempt={}, elapsedMs={}",
                job.id(), job.queue(), job.attempts(), elapsed.toMillis());
        }
    }

    /**
     * 記錄執行失敗並依重試政策處理。
     *
     * @param job 執行中的工作
     * @param error 失敗原因
     * @param elapsed 執行時間
     * @return 處理後的狀態：{@code FAILED} (等待重試) 或 {@code DEAD_LETTERED}
     */
    public JobState markFailed(Job job, Throwable error, Duration elapsed) {
        String reason = describe(error);
        Instant now = clock.instant();
        int retryCount = job.metadata().retryCount();
        int maxRetries = job.metadata().maxRetries();
        queueStats.recordFailure(job.queue(), elapsed, error instanceof JobTimeoutException);

        RetryPolicy.Decision decision = retryPolicy.onFailure(retryCount, maxRetries);
        if (decision.retry()) {
            Instant nextAttemptAt = now.plus(decision.delay());
            if (broker.scheduleRetry(job, reason, nextAttemptAt, now)) {
                log.warn("Job failed, retry {}/{} at {}: jobId={}, queue={}, error={}",
                    retryCount + 1, maxRetries, nextAttemptAt, job.id(), job.queue(), reason);
            }
            return JobState.FAILED;
        }

        if (broker.deadLetter(job, reason, now)) {
            queueStats.recordDeadLetter(job.queue());
            log.error("Job dead-lettered after {} retries: jobId={}, queue={}, error={}",
                retryCount, job.id(), job.queue(), reason, error);
            Job.Metadata metadata = job.metadata();
            deadLetterPublisher.publish(new DeadLetterEvent(
                job.id(),
                job.queue(),
                job.payload(),
                reason,
                retryCount,
                metadata.maxRetries(),
                metadata.idempotencyKey(),
                new TraceContext(metadata.requestId(), metadata.userId(), metadata.orgId()),
                now));
        }
        return JobState.DEAD_LETTERED;
    }

    /**
     * 將執行中的工作放回佇列，不計入重試 (關閉時使用)。
     */
    public void requeue(Job job) {
        if (broker.requeue(job, clock.instant())) {
            log.info("Job requeued on shutdown: jobId={}, queue={}", job.id(), job.queue());
        }
    }

    /**
     * 將重試延遲已到期的工作轉回 {@code QUEUED}。
     *
     * @return 轉換的工作數
     */
    @Scheduled(fixedDelayString = "${metering.jobs.maintenance-interval-ms:5000}")
    public long promoteDueRetries() {
        long promoted = broker.promoteDueRetries(clock.instant());
        if (promoted > 0) {
            log.info("Jobs promoted for retry: {}", promoted);
        }
        return promoted;
    }

    /**
     * 回收租約已過期的執行中工作，視為一次失敗 (worker 中斷或逾時未回報)。
     *
     * @return 回收的工作數
     */
    @Scheduled(fixedDelayString = "${metering.jobs.maintenance-interval-ms:5000}")
    public int reapExpiredLeases() {
        Instant now = clock.instant();
        int reaped = 0;
        for (Job job : broker.findExpiredLeases(now, REAP_BATCH_SIZE)) {
            Duration elapsed = job.startedAt() != null ? Duration.between(job.startedAt(), now) : Duration.ZERO;
            log.warn("Job lease expired: jobId={}, queue={}, worker={}", job.id(), job.queue(), job.workerId());
            markFailed(job, new JobTimeoutException(job.id(), config.timeoutFor(job.queue())), elapsed);
            reaped++;
        }
        return reaped;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank()
            ? error.getClass().getSimpleName()
            : error.getClass().getSimpleName() + ": " + message;
    }
}
