package io.github.samzhu.metering.controller;

import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.metering.document.DeadLetterRecord;
import io.github.samzhu.metering.dto.JobStatusView;
import io.github.samzhu.metering.dto.QueueStats;
import io.github.samzhu.metering.service.DeadLetterService;
import io.github.samzhu.metering.service.JobDispatcherService;
import io.github.samzhu.metering.service.QueueStatsService;

/**
 * 背景工作查詢 API 控制器。
 */
@RestController
@RequestMapping("/api/v1/jobs")
public class JobApiController {

    private final JobDispatcherService dispatcher;
    private final DeadLetterService deadLetterService;
    private final QueueStatsService queueStatsService;

    public JobApiController(
            JobDispatcherService dispatcher,
            DeadLetterService deadLetterService,
            QueueStatsService queueStatsService) {
        this.dispatcher = dispatcher;
        this.deadLetterService = deadLetterService;
        this.queueStatsService = queueStatsService;
    }

    /**
     * 查詢工作狀態。
     *
     * @param jobId 工作 ID
     * @return 工作狀態，不存在時 404
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<JobStatusView> getJob(@PathVariable String jobId) {
        return dispatcher.jobStatus(jobId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * 查詢死信紀錄（分頁）。
     *
     * @param queue 佇列名稱，未提供表示全部
     * @param page 頁碼（從 0 開始）
     * @param size 每頁數量
     * @return 死信紀錄，最新的在前
     */
    @GetMapping("/dead-letters")
    public ResponseEntity<Page<DeadLetterRecord>> getDeadLetters(
            @RequestParam(required = false) String queue,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(deadLetterService.list(queue, page, size));
    }

    /**
     * 取得各佇列的執行統計。
     */
    @GetMapping("/queues/stats")
    public ResponseEntity<List<QueueStats>> getQueueStats() {
        return ResponseEntity.ok(queueStatsService.snapshots());
    }
}
