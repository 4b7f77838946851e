package io.github.samzhu.metering.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.metering.config.RequestIdFilter;
import io.github.samzhu.metering.dto.SubmissionResult;
import io.github.samzhu.metering.dto.SubmissionType;
import io.github.samzhu.metering.dto.api.SubmissionRequest;
import io.github.samzhu.metering.service.MeteredSubmissionService;

/**
 * 計量提交 API 控制器。
 *
 * <p>支援 {@code Idempotency-Key} header：相同鍵的重試回傳第一次的狀態碼與回應內容，
 * 並帶上 {@code Idempotent-Replayed: true}。
 */
@RestController
@RequestMapping("/api/v1/orgs/{orgId}/submissions")
public class SubmissionApiController {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    public static final String REPLAYED_HEADER = "Idempotent-Replayed";

    private final MeteredSubmissionService submissionService;

    public SubmissionApiController(MeteredSubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    /**
     * 提交掃描 ({@code scan}) 或頁面產生 ({@code page})。
     *
     * @param orgId 組織 ID
     * @param type 提交類型
     * @param idempotencyKey 冪等鍵 (16-255 字元)
     * @param request 提交內容
     * @return 202 與提交結果，或重播的回應
     */
    @PostMapping("/{type}")
    public ResponseEntity<String> submit(
            @PathVariable long orgId,
            @PathVariable String type,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestBody(required = false) SubmissionRequest request) {

        SubmissionResult result = submissionService.submit(
            orgId,
            SubmissionType.fromKey(type),
            request != null ? request : new SubmissionRequest(null, null, null),
            idempotencyKey,
            RequestIdFilter.currentRequestId());

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(result.status())
            .contentType(MediaType.APPLICATION_JSON);
        if (result.replayed()) {
            builder.header(REPLAYED_HEADER, "true");
        }
        return builder.body(result.body());
    }
}
