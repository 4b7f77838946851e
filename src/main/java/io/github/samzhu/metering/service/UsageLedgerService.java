package io.github.samzhu.metering.service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import io.github.samzhu.metering.config.MeteringProperties.PlanQuota;
import io.github.samzhu.metering.document.Organization;
import io.github.samzhu.metering.document.UsagePeriodRecord;
import io.github.samzhu.metering.dto.MeteredResource;
import io.github.samzhu.metering.dto.SlotKind;
import io.github.samzhu.metering.dto.UsageResult;
import io.github.samzhu.metering.dto.UsageSummary;
import io.github.samzhu.metering.dto.UsageSummary.ResourceUsage;
import io.github.samzhu.metering.exception.LimitExceededException;
import io.github.samzhu.metering.exception.OrgNotFoundException;
import io.github.samzhu.metering.repository.UsagePeriodRepository;
import io.github.samzhu.metering.util.BillingPeriod;
import io.github.samzhu.metering.util.BillingPeriods;

/**
 * 用量帳本服務。
 *
 * <p>每個 (組織, 計費週期) 對應一筆 {@link UsagePeriodRecord}，保留用量以單一條件式
 * {@code findAndModify} 完成「檢查並遞增」：
 * <pre>
 * filter: { _id: "42_2025-01-15", scansUsed: { $lte: limit - amount } }
 * update: { $inc: { scansUsed: amount } }
 * </pre>
 * MongoDB 對單一文件的寫入是原子且序列化的，因此併發請求合計永遠不會超過上限；
 * 不同組織或不同週期是不同文件，彼此不互相阻塞。
 *
 * <p>條件不成立時不會修改任何資料，回報目前用量與上限。無限制的資源直接 {@code $inc}。
 */
@Service
public class UsageLedgerService {

    private static final Logger log = LoggerFactory.getLogger(UsageLedgerService.class);

    private final MongoTemplate mongoTemplate;
    private final UsagePeriodRepository usagePeriodRepository;
    private final OrganizationService organizationService;
    private final QuotaPolicyService quotaPolicy;
    private final Clock clock;

    public UsageLedgerService(
            MongoTemplate mongoTemplate,
            UsagePeriodRepository usagePeriodRepository,
            OrganizationService organizationService,
            QuotaPolicyService quotaPolicy,
            Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.usagePeriodRepository = usagePeriodRepository;
        this.organizationService = organizationService;
        this.quotaPolicy = quotaPolicy;
        this.clock = clock;
    }

    /**
     * 在目前計費週期保留用量。
     *
     * @param orgId 組織 ID
     * @param resource 資源
     * @param amount 保留量，必須大於 0
     * @return 保留後的用量
     * @throws LimitExceededException 保留後會超過方案上限，此時不修改任何計數
     * @throws OrgNotFoundException 組織不存在
     * @throws IllegalArgumentException amount 小於等於 0
     */
    public UsageResult reserveCredits(long orgId, MeteredResource resource, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Reservation amount must be positive: " + amount);
        }

        Organization org = organizationService.require(orgId);
        PlanQuota plan = quotaPolicy.planFor(org.planTier());
        Long limit = resource.limitOf(plan);

        Instant now = clock.instant();
        BillingPeriod period = BillingPeriods.periodFor(org.billingCycleAnchor(), now);
        String recordId = UsagePeriodRecord.createId(orgId, period.start());

        UsagePeriodRecord updated = tryIncrement(recordId, resource, amount, limit, now);
        if (updated == null && !mongoTemplate.exists(byId(recordId), UsagePeriodRecord.class)) {
            createPeriodRecord(recordId, orgId, period, now);
            updated = tryIncrement(recordId, resource, amount, limit, now);
        }

        if (updated == null) {
            UsagePeriodRecord current = mongoTemplate.findById(recordId, UsagePeriodRecord.class);
            long used = resource.usedIn(current);
            log.warn("Reservation rejected: orgId={}, resource={}, requested={}, used={}, limit={}",
                orgId, resource.key(), amount, used, limit);
            throw new LimitExceededException(resource.key(), used, limit, amount);
        }

        organizationService.refreshPeriodHint(org, period);

        long used = resource.usedIn(updated);
        log.debug("Reserved: orgId={}, resource={}, amount={}, used={}, limit={}",
            orgId, resource.key(), amount, used, limit);
        return new UsageResult(resource.key(), amount, used, limit, period.start(), period.end());
    }

    /**
     * 依模型權重保留掃描點數。
     *
     * @param orgId 組織 ID
     * @param model 模型識別
     * @return 保留後的用量，{@link UsageResult#amount()} 為實際扣除點數
     * @throws LimitExceededException 點數不足
     */
    public UsageResult reserveScanCredits(long orgId, String model) {
        return reserveCredits(orgId, MeteredResource.SCANS, quotaPolicy.creditsFor(model));
    }

    /**
     * 檢查數量型上限 (品牌、席位) 是否還有空位。
     *
     * @param orgId 組織 ID
     * @param kind 數量類型
     * @param currentCount 目前數量，由擁有該實體的服務提供
     * @return 目前數量與上限
     * @throws LimitExceededException {@code currentCount >= limit}
     */
    public ResourceUsage assertSlotAvailable(long orgId, SlotKind kind, long currentCount) {
        Organization org = organizationService.require(orgId);
        Long limit = kind.limitOf(quotaPolicy.planFor(org.planTier()));
        if (limit != null && currentCount >= limit) {
            log.warn("Slot check rejected: orgId={}, kind={}, current={}, limit={}",
                orgId, kind.key(), currentCount, limit);
            throw new LimitExceededException(kind.key(), currentCount, limit, 1);
        }
        return new ResourceUsage(currentCount, limit, quotaPolicy.isWarning(currentCount, limit));
    }

    /**
     * 取得組織目前計費週期的用量摘要 (唯讀)。
     *
     * <p>週期尚未有任何保留時，各資源用量為 0，且不會建立紀錄。
     *
     * @param orgId 組織 ID
     * @return 用量摘要
     * @throws OrgNotFoundException 組織不存在
     */
    public UsageSummary usageSummary(long orgId) {
        Organization org = organizationService.require(orgId);
        PlanQuota plan = quotaPolicy.planFor(org.planTier());

        Instant now = clock.instant();
        BillingPeriod period = BillingPeriods.periodFor(org.billingCycleAnchor(), now);
        UsagePeriodRecord usage = usagePeriodRepository
            .findById(UsagePeriodRecord.createId(orgId, period.start()))
            .orElse(null);

        Map<String, ResourceUsage> resources = new LinkedHashMap<>();
        for (MeteredResource resource : MeteredResource.values()) {
            long used = resource.usedIn(usage);
            Long limit = resource.limitOf(plan);
            resources.put(resource.key(), new ResourceUsage(used, limit, quotaPolicy.isWarning(used, limit)));
        }

        return new UsageSummary(
            orgId,
            org.planTier(),
            period.start(),
            period.end(),
            BillingPeriods.daysRemaining(period, now),
            resources
        );
    }

    /**
     * 查詢組織最近的週期用量紀錄。
     *
     * @param orgId 組織 ID
     * @param periods 最多幾個週期
     * @return 週期用量，最新的在前
     */
    public List<UsagePeriodRecord> usageHistory(long orgId, int periods) {
        organizationService.require(orgId);
        return usagePeriodRepository.findByOrgIdOrderByPeriodStartDesc(orgId, PageRequest.of(0, periods));
    }

    private UsagePeriodRecord tryIncrement(String recordId, MeteredResource resource, long amount,
            Long limit, Instant now) {
        Criteria criteria = Criteria.where("_id").is(recordId);
        if (limit != null) {
            criteria = criteria.and(resource.counterField()).lte(limit - amount);
        }
        Update update = new Update()
            .inc(resource.counterField(), amount)
            .set("lastUpdatedAt", now);
        return mongoTemplate.findAndModify(
            Query.query(criteria),
            update,
            FindAndModifyOptions.options().returnNew(true),
            UsagePeriodRecord.class);
    }

    private void createPeriodRecord(String recordId, long orgId, BillingPeriod period, Instant now) {
        Update update = new Update()
            .setOnInsert("orgId", orgId)
            .setOnInsert("periodStart", period.start())
            .setOnInsert("periodEnd", period.end())
            .setOnInsert(UsagePeriodRecord.FIELD_SCANS, 0L)
            .setOnInsert(UsagePeriodRecord.FIELD_PROMPTS, 0L)
            .setOnInsert(UsagePeriodRecord.FIELD_PAGES, 0L)
            .setOnInsert("createdAt", now)
            .setOnInsert("lastUpdatedAt", now);
        try {
            mongoTemplate.upsert(byId(recordId), update, UsagePeriodRecord.class);
            log.info("Usage period opened: orgId={}, period={}", orgId, BillingPeriods.format(period));
        } catch (DuplicateKeyException e) {
            // 另一個請求同時建立了同一週期
            log.debug("Usage period already created concurrently: id={}", recordId);
        }
    }

    private static Query byId(String id) {
        return Query.query(Criteria.where("_id").is(id));
    }
}
