package io.github.samzhu.metering.service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import io.github.samzhu.metering.document.Organization;
import io.github.samzhu.metering.dto.api.OrganizationRequest;
import io.github.samzhu.metering.exception.OrgNotFoundException;
import io.github.samzhu.metering.exception.UnknownPlanException;
import io.github.samzhu.metering.repository.OrganizationRepository;
import io.github.samzhu.metering.util.BillingPeriod;
import io.github.samzhu.metering.util.BillingPeriods;

/**
 * 組織服務。
 *
 * <p>管理組織的方案與計費錨定日，並維護目前計費週期的快取提示。
 * 快取提示只用於顯示，用量帳本永遠由錨定日重新計算週期。
 */
@Service
public class OrganizationService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

    private final OrganizationRepository organizationRepository;
    private final MongoTemplate mongoTemplate;
    private final QuotaPolicyService quotaPolicy;
    private final Clock clock;

    public OrganizationService(
            OrganizationRepository organizationRepository,
            MongoTemplate mongoTemplate,
            QuotaPolicyService quotaPolicy,
            Clock clock) {
        this.organizationRepository = organizationRepository;
        this.mongoTemplate = mongoTemplate;
        this.quotaPolicy = quotaPolicy;
        this.clock = clock;
    }

    /**
     * 建立或更新組織。
     *
     * <p>新組織未指定錨定日時使用今天 (UTC) 的日期，即從購買當天起算；
     * 既有組織未指定時保留原錨定日。
     *
     * @param orgId 組織 ID
     * @param request 組織資料
     * @return 儲存後的組織
     * @throws UnknownPlanException 方案未設定
     */
    public Organization register(long orgId, OrganizationRequest request) {
        String planTier = request.planTier().trim().toLowerCase(Locale.ROOT);
        if (!quotaPolicy.isKnownPlan(planTier)) {
            throw new UnknownPlanException(request.planTier());
        }

        Instant now = clock.instant();
        Organization existing = organizationRepository.findById(orgId).orElse(null);

        int anchor;
        if (request.billingCycleAnchor() != null) {
            anchor = request.billingCycleAnchor();
        } else if (existing != null) {
            anchor = existing.billingCycleAnchor();
        } else {
            anchor = now.atZone(ZoneOffset.UTC).getDayOfMonth();
        }

        BillingPeriod period = BillingPeriods.periodFor(anchor, now);
        Organization saved = organizationRepository.save(new Organization(
            orgId,
            request.name(),
            planTier,
            anchor,
            period.start(),
            period.end(),
            existing != null ? existing.createdAt() : now,
            now
        ));

        log.info("Organization {}: orgId={}, plan={}, anchor={}, period={}",
            existing != null ? "updated" : "registered", orgId, planTier, anchor, BillingPeriods.format(period));
        return saved;
    }

    /**
     * 取得組織。
     *
     * @param orgId 組織 ID
     * @return 組織
     * @throws OrgNotFoundException 組織不存在
     */
    public Organization require(long orgId) {
        return organizationRepository.findById(orgId)
            .orElseThrow(() -> new OrgNotFoundException(orgId));
    }

    /**
     * 週期改變時更新組織的快取週期提示。
     *
     * <p>以目前提示值為條件更新，多個請求同時跨週期時只有一個會寫入。
     *
     * @param org 組織
     * @param period 目前計費週期
     */
    public void refreshPeriodHint(Organization org, BillingPeriod period) {
        if (org.hasPeriodHint(period.start(), period.end())) {
            return;
        }
        Query query = Query.query(Criteria.where("_id").is(org.id())
            .and("currentPeriodStart").is(org.currentPeriodStart()));
        Update update = new Update()
            .set("currentPeriodStart", period.start())
            .set("currentPeriodEnd", period.end())
            .set("lastUpdatedAt", clock.instant());
        long modified = mongoTemplate.updateFirst(query, update, Organization.class).getModifiedCount();
        if (modified > 0) {
            log.info("Billing period rolled over: orgId={}, period={}", org.id(), BillingPeriods.format(period));
        }
    }
}
