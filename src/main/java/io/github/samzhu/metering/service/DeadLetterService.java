package io.github.samzhu.metering.service;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import io.github.samzhu.metering.document.DeadLetterRecord;
import io.github.samzhu.metering.document.Job;
import io.github.samzhu.metering.dto.DeadLetterEvent;
import io.github.samzhu.metering.dto.TraceContext;
import io.github.samzhu.metering.repository.DeadLetterRecordRepository;

/**
 * 死信紀錄服務。
 *
 * <p>保存重試用盡的工作並發出 error 等級的告警 log，不會再重試。
 * 以工作 ID 為文件 ID，同一事件重複投遞只會保存一筆。
 */
@Service
public class DeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterService.class);

    private final DeadLetterRecordRepository repository;
    private final Clock clock;

    public DeadLetterService(DeadLetterRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * 保存死信事件。
     *
     * @param event 死信事件
     * @param eventId CloudEvent ID，用於追蹤
     * @return 保存的紀錄
     */
    public DeadLetterRecord record(DeadLetterEvent event, String eventId) {
        TraceContext trace = event.trace() != null ? event.trace() : TraceContext.empty();
        DeadLetterRecord record = repository.save(new DeadLetterRecord(
            event.jobId(),
            event.queue(),
            event.payload(),
            event.failureReason(),
            event.retryCount(),
            new Job.Metadata(event.idempotencyKey(), event.retryCount(), event.maxRetries(),
                trace.requestId(), trace.userId(), trace.orgId()),
            event.deadLetteredAt(),
            clock.instant()
        ));

        // TODO: 串接告警通道 (Slack / PagerDuty)，目前僅以 error log 告警
        log.error("ALERT job dead-lettered: eventId={}, jobId={}, queue={}, retries={}, orgId={}, requestId={}, reason={}",
            eventId, event.jobId(), event.queue(), event.retryCount(), trace.orgId(), trace.requestId(),
            event.failureReason());
        return record;
    }

    /**
     * 分頁查詢死信紀錄，最新的在前。
     *
     * @param queue 佇列名稱，null 表示全部
     * @param page 頁碼 (從 0 開始)
     * @param size 每頁數量
     * @return 死信紀錄
     */
    public Page<DeadLetterRecord> list(String queue, int page, int size) {
        PageRequest pageable = PageRequest.of(page, size);
        if (queue == null || queue.isBlank()) {
            return repository.findAllByOrderByDeadLetteredAtDesc(pageable);
        }
        return repository.findByQueueOrderByDeadLetteredAtDesc(queue, pageable);
    }
}
