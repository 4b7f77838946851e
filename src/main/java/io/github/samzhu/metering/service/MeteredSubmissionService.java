package io.github.samzhu.metering.service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.metering.dto.ClaimResult;
import io.github.samzhu.metering.dto.EnqueueResult;
import io.github.samzhu.metering.dto.SubmissionResult;
import io.github.samzhu.metering.dto.SubmissionType;
import io.github.samzhu.metering.dto.TraceContext;
import io.github.samzhu.metering.dto.UsageResult;
import io.github.samzhu.metering.dto.api.SubmissionAccepted;
import io.github.samzhu.metering.dto.api.SubmissionRequest;
import io.github.samzhu.metering.exception.IdempotencyConflictException;
import io.github.samzhu.metering.exception.LimitExceededException;

/**
 * 計量提交服務：冪等鍵 → 保留用量 → 入列 → 保存回應。
 *
 * <p>處理流程：
 * <ol>
 *   <li>有冪等鍵時先佔用；已完成則原樣重播，執行中則回 409</li>
 *   <li>保留用量 (掃描依模型權重，頁面每次 1)，超過上限時釋放冪等鍵並回 429</li>
 *   <li>以 {@code {type}:{orgId}:{key}} 為工作冪等鍵入列，重試不會產生第二個工作</li>
 *   <li>保存 202 回應供之後重播</li>
 * </ol>
 *
 * <p>入列失敗時只記錄錯誤並回報 {@code jobEnqueued=false}，已保留的用量不退回。
 */
@Service
public class MeteredSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(MeteredSubmissionService.class);

    private final IdempotencyService idempotencyService;
    private final UsageLedgerService ledgerService;
    private final JobDispatcherService dispatcher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MeteredSubmissionService(
            IdempotencyService idempotencyService,
            UsageLedgerService ledgerService,
            JobDispatcherService dispatcher,
            ObjectMapper objectMapper,
            Clock clock) {
        this.idempotencyService = idempotencyService;
        this.ledgerService = ledgerService;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * 提交需計量的工作。
     *
     * @param orgId 組織 ID
     * @param type 提交類型
     * @param request 提交內容
     * @param idempotencyKey 冪等鍵，可為 null
     * @param requestId 請求 ID
     * @return 回應狀態與內容；重播時 {@code replayed=true}
     * @throws LimitExceededException 用量不足
     * @throws IdempotencyConflictException 相同冪等鍵的請求執行中
     */
    public SubmissionResult submit(long orgId, SubmissionType type, SubmissionRequest request,
            String idempotencyKey, String requestId) {
        String resourceType = type.resourceType();

        if (idempotencyKey != null) {
            ClaimResult claim = idempotencyService.claim(idempotencyKey, orgId, resourceType);
            switch (claim.outcome()) {
                case REPLAY:
                    return new SubmissionResult(claim.cached().status(), claim.cached().body(), true);
                case IN_PROGRESS:
                    throw new IdempotencyConflictException(orgId, resourceType);
                default:
                    break;
            }
        }

        String submissionId = UUID.randomUUID().toString();
        String body;
        try {
            UsageResult usage = type.weighted()
                ? ledgerService.reserveScanCredits(orgId, request.model())
                : ledgerService.reserveCredits(orgId, type.resource(), 1);

            String jobKey = idempotencyKey != null
                ? resourceType + ":" + orgId + ":" + idempotencyKey
                : resourceType + ":" + submissionId;
            String jobId = enqueue(orgId, type, request, submissionId, jobKey, requestId);

            body = toJson(new SubmissionAccepted(
                submissionId,
                resourceType,
                jobId,
                jobId != null,
                usage.amount(),
                usage.used(),
                usage.limit(),
                clock.instant()));
        } catch (RuntimeException e) {
            if (idempotencyKey != null) {
                idempotencyService.release(idempotencyKey, orgId, resourceType);
            }
            throw e;
        }

        int status = HttpStatus.ACCEPTED.value();
        if (idempotencyKey != null) {
            storeResponse(idempotencyKey, orgId, resourceType, submissionId, body, status);
        }
        log.info("Submission accepted: orgId={}, type={}, submissionId={}", orgId, resourceType, submissionId);
        return new SubmissionResult(status, body, false);
    }

    /**
     * 保存回應供重播。保存失敗時工作已被接受，仍回應成功並釋放佔用，避免鍵在 claim-timeout 前一直回 409。
     */
    private void storeResponse(String idempotencyKey, long orgId, String resourceType, String submissionId,
            String body, int status) {
        try {
            idempotencyService.record(idempotencyKey, orgId, resourceType, submissionId, body, status);
        } catch (RuntimeException e) {
            log.error("Failed to store idempotent response, retries with this key will not be replayed: "
                + "orgId={}, type={}, submissionId={}, error={}", orgId, resourceType, submissionId, e.getMessage(), e);
            try {
                idempotencyService.release(idempotencyKey, orgId, resourceType);
            } catch (RuntimeException releaseError) {
                log.error("Failed to release idempotency claim, it expires after claim-timeout: orgId={}, type={}, error={}",
                    orgId, resourceType, releaseError.getMessage(), releaseError);
            }
        }
    }

    private String enqueue(long orgId, SubmissionType type, SubmissionRequest request, String submissionId,
            String jobKey, String requestId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (request.parameters() != null) {
            payload.putAll(request.parameters());
        }
        payload.put("submissionId", submissionId);
        payload.put("orgId", orgId);
        if (request.model() != null) {
            payload.put("model", request.model());
        }
        try {
            EnqueueResult result = dispatcher.enqueue(type.queue(), payload, jobKey,
                new TraceContext(requestId, request.userId(), orgId));
            return result.jobId();
        } catch (RuntimeException e) {
            log.error("Failed to enqueue {} job: orgId={}, submissionId={}, error={}",
                type.resourceType(), orgId, submissionId, e.getMessage(), e);
            return null;
        }
    }

    private String toJson(SubmissionAccepted accepted) {
        try {
            return objectMapper.writeValueAsString(accepted);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize submission response", e);
        }
    }
}
