package io.github.samzhu.metering.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.metering.document.UsagePeriodRecord;
import io.github.samzhu.metering.dto.MeteredResource;
import io.github.samzhu.metering.dto.SlotKind;
import io.github.samzhu.metering.dto.UsageResult;
import io.github.samzhu.metering.dto.UsageSummary;
import io.github.samzhu.metering.dto.UsageSummary.ResourceUsage;
import io.github.samzhu.metering.dto.api.ReservationRequest;
import io.github.samzhu.metering.service.UsageLedgerService;

/**
 * 用量查詢與保留 API 控制器。
 *
 * <p>超過方案上限時回 429 (見 {@link ApiExceptionHandler})。
 */
@RestController
@RequestMapping("/api/v1/orgs/{orgId}")
public class UsageApiController {

    private static final Logger log = LoggerFactory.getLogger(UsageApiController.class);

    private final UsageLedgerService ledgerService;

    public UsageApiController(UsageLedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    /**
     * 取得目前計費週期的用量摘要。
     *
     * @param orgId 組織 ID
     * @return 用量摘要
     */
    @GetMapping("/usage")
    public ResponseEntity<UsageSummary> getUsageSummary(@PathVariable long orgId) {
        log.debug("Getting usage summary: orgId={}", orgId);
        return ResponseEntity.ok(ledgerService.usageSummary(orgId));
    }

    /**
     * 取得最近幾個計費週期的用量。
     *
     * @param orgId 組織 ID
     * @param periods 週期數，預設 6
     * @return 週期用量，最新的在前
     */
    @GetMapping("/usage/history")
    public ResponseEntity<List<UsagePeriodRecord>> getUsageHistory(
            @PathVariable long orgId,
            @RequestParam(defaultValue = "6") int periods) {
        return ResponseEntity.ok(ledgerService.usageHistory(orgId, Math.max(1, Math.min(periods, 24))));
    }

    /**
     * 保留用量。
     *
     * <p>{@code scans} 且帶有 {@code model} 時依模型權重扣點，否則扣 {@code amount} (預設 1)。
     *
     * @param orgId 組織 ID
     * @param request 保留請求
     * @return 保留後的用量
     */
    @PostMapping("/usage/reservations")
    public ResponseEntity<UsageResult> reserve(
            @PathVariable long orgId,
            @RequestBody @Validated ReservationRequest request) {
        MeteredResource resource = MeteredResource.fromKey(request.resource());
        UsageResult result;
        if (resource == MeteredResource.SCANS && request.model() != null && request.amount() == null) {
            result = ledgerService.reserveScanCredits(orgId, request.model());
        } else {
            long amount = request.amount() != null ? request.amount() : 1;
            result = ledgerService.reserveCredits(orgId, resource, amount);
        }
        return ResponseEntity.ok(result);
    }

    /**
     * 檢查數量型上限 (brands / seats) 是否還有空位。
     *
     * @param orgId 組織 ID
     * @param kind brands 或 seats
     * @param current 目前數量
     * @return 目前數量與上限；沒有空位時回 429
     */
    @GetMapping("/slots/{kind}")
    public ResponseEntity<ResourceUsage> checkSlot(
            @PathVariable long orgId,
            @PathVariable String kind,
            @RequestParam long current) {
        return ResponseEntity.ok(ledgerService.assertSlotAvailable(orgId, SlotKind.fromKey(kind), current));
    }
}
