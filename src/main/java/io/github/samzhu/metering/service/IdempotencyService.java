package io.github.samzhu.metering.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.metering.config.MeteringProperties;
import io.github.samzhu.metering.document.IdempotencyRecord;
import io.github.samzhu.metering.dto.CachedResponse;
import io.github.samzhu.metering.dto.ClaimResult;
import io.github.samzhu.metering.exception.InvalidIdempotencyKeyException;

/**
 * 冪等鍵服務。
 *
 * <p>冪等鍵的範圍為 (key, orgId, resourceType)，保存 {@code ttl} (預設 24 小時)。
 * 使用方式：
 * <ol>
 *   <li>{@link #claim} 在執行副作用之前佔用冪等鍵，第一個佔用者取得執行權</li>
 *   <li>副作用成功後以 {@link #record} 保存回應，之後相同鍵的請求直接重播</li>
 *   <li>副作用失敗時以 {@link #release} 釋放，用戶端可以相同鍵重試</li>
 * </ol>
 *
 * <p>佔用中 ({@code PENDING}) 超過 {@code claim-timeout} 的鍵視為前一個請求已中斷，可被接手。
 * 只呼叫 {@link #lookup} / {@link #record} 而不佔用時，{@link #record} 仍是「第一個寫入者勝出」。
 */
@Service
public class IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyService.class);

    public static final int MIN_KEY_LENGTH = 16;
    public static final int MAX_KEY_LENGTH = 255;

    private static final int MAX_CLAIM_ATTEMPTS = 3;

    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final Duration ttl;
    private final Duration claimTimeout;
    private final int sweepBatchSize;
    private final int sweepMaxBatches;

    public IdempotencyService(MongoTemplate mongoTemplate, MeteringProperties properties, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
        this.ttl = properties.idempotency().ttl();
        this.claimTimeout = properties.idempotency().claimTimeout();
        this.sweepBatchSize = properties.idempotency().sweepBatchSize();
        this.sweepMaxBatches = properties.idempotency().sweepMaxBatches();
    }

    /**
     * 檢查冪等鍵格式。
     *
     * @param key 冪等鍵
     * @throws InvalidIdempotencyKeyException 長度不在 16-255 字元之間
     */
    public static void validateKey(String key) {
        int length = key == null ? 0 : key.length();
        if (length < MIN_KEY_LENGTH || length > MAX_KEY_LENGTH) {
            throw new InvalidIdempotencyKeyException(length, MIN_KEY_LENGTH, MAX_KEY_LENGTH);
        }
    }

    /**
     * 查詢已完成且未過期的回應。
     *
     * @param key 冪等鍵
     * @param orgId 組織 ID
     * @param resourceType 資源類型
     * @return 保存的回應，不存在、執行中或已過期時為 empty
     */
    public Optional<CachedResponse> lookup(String key, long orgId, String resourceType) {
        validateKey(key);
        IdempotencyRecord record = mongoTemplate.findById(
            IdempotencyRecord.createId(orgId, resourceType, key), IdempotencyRecord.class);
        if (record == null || !record.isCompleted() || record.isExpired(clock.instant())) {
            return Optional.empty();
        }
        log.debug("Idempotency hit: orgId={}, resourceType={}, resourceId={}",
            orgId, resourceType, record.resourceId());
        return Optional.of(toCachedResponse(record));
    }

    /**
     * 在執行副作用之前佔用冪等鍵。
     *
     * @param key 冪等鍵
     * @param orgId 組織 ID
     * @param resourceType 資源類型
     * @return {@code ACQUIRED} 取得執行權；{@code REPLAY} 已有完成的回應；{@code IN_PROGRESS} 另一個請求執行中
     */
    public ClaimResult claim(String key, long orgId, String resourceType) {
        validateKey(key);
        String id = IdempotencyRecord.createId(orgId, resourceType, key);

        for (int attempt = 0; attempt < MAX_CLAIM_ATTEMPTS; attempt++) {
            Instant now = clock.instant();
            try {
                mongoTemplate.insert(new IdempotencyRecord(
                    id, key, orgId, resourceType, null, IdempotencyRecord.STATE_PENDING,
                    null, null, now, now, now.plus(ttl)));
                log.debug("Idempotency key claimed: orgId={}, resourceType={}", orgId, resourceType);
                return ClaimResult.acquired();
            } catch (DuplicateKeyException e) {
                IdempotencyRecord existing = mongoTemplate.findById(id, IdempotencyRecord.class);
                if (existing == null) {
                    continue;
                }
                if (existing.isExpired(now) || isAbandoned(existing, now)) {
                    if (takeOver(existing, now)) {
                        log.info("Idempotency key taken over: orgId={}, resourceType={}, previousState={}",
                            orgId, resourceType, existing.state());
                        return ClaimResult.acquired();
                    }
                    continue;
                }
                if (existing.isCompleted()) {
                    log.info("Idempotent replay: orgId={}, resourceType={}, resourceId={}",
                        orgId, resourceType, existing.resourceId());
                    return ClaimResult.replay(toCachedResponse(existing));
                }
                log.warn("Idempotency key in progress: orgId={}, resourceType={}", orgId, resourceType);
                return ClaimResult.inProgress();
            }
        }
        return ClaimResult.inProgress();
    }

    /**
     * 保存回應。
     *
     * <p>若鍵已被 {@link #claim} 佔用則完成該佔用；否則插入新紀錄。
     * 已有未過期的完成紀錄時不做任何事 (第一個寫入者勝出)。
     *
     * @param key 冪等鍵
     * @param orgId 組織 ID
     * @param resourceType 資源類型
     * @param resourceId 建立的資源 ID
     * @param responseBody 回應內容 (原始 JSON)
     * @param responseStatus HTTP 狀態碼
     * @return true 表示本次寫入成功，false 表示已有其他回應
     */
    public boolean record(String key, long orgId, String resourceType, String resourceId,
            String responseBody, int responseStatus) {
        validateKey(key);
        String id = IdempotencyRecord.createId(orgId, resourceType, key);
        Instant now = clock.instant();

        Query pending = Query.query(Criteria.where("_id").is(id)
            .and("state").is(IdempotencyRecord.STATE_PENDING));
        Update complete = new Update()
            .set("state", IdempotencyRecord.STATE_COMPLETED)
            .set("resourceId", resourceId)
            .set("responseBody", responseBody)
            .set("responseStatus", responseStatus)
            .set("createdAt", now)
            .set("expiresAt", now.plus(ttl));
        if (mongoTemplate.updateFirst(pending, complete, IdempotencyRecord.class).getModifiedCount() > 0) {
            log.debug("Idempotency response recorded: orgId={}, resourceType={}, resourceId={}",
                orgId, resourceType, resourceId);
            return true;
        }

        try {
            mongoTemplate.insert(new IdempotencyRecord(
                id, key, orgId, resourceType, resourceId, IdempotencyRecord.STATE_COMPLETED,
                responseStatus, responseBody, now, now, now.plus(ttl)));
            log.debug("Idempotency response stored: orgId={}, resourceType={}, resourceId={}",
                orgId, resourceType, resourceId);
            return true;
        } catch (DuplicateKeyException e) {
            IdempotencyRecord existing = mongoTemplate.findById(id, IdempotencyRecord.class);
            if (existing != null && existing.isExpired(now)) {
                Query stale = Query.query(Criteria.where("_id").is(id)
                    .and("expiresAt").is(existing.expiresAt()));
                boolean replaced = mongoTemplate.updateFirst(stale,
                    complete.set("claimedAt", now), IdempotencyRecord.class).getModifiedCount() > 0;
                if (replaced) {
                    return true;
                }
            }
            log.debug("Idempotency response already stored, ignoring: orgId={}, resourceType={}",
                orgId, resourceType);
            return false;
        }
    }

    /**
     * 釋放尚未完成的佔用，讓用戶端可以相同鍵重試。已完成的紀錄不受影響。
     *
     * @param key 冪等鍵
     * @param orgId 組織 ID
     * @param resourceType 資源類型
     */
    public void release(String key, long orgId, String resourceType) {
        Query pending = Query.query(Criteria.where("_id").is(IdempotencyRecord.createId(orgId, resourceType, key))
            .and("state").is(IdempotencyRecord.STATE_PENDING));
        long deleted = mongoTemplate.remove(pending, IdempotencyRecord.class).getDeletedCount();
        if (deleted > 0) {
            log.debug("Idempotency claim released: orgId={}, resourceType={}", orgId, resourceType);
        }
    }

    /**
     * 定時清除過期的冪等紀錄，分批刪除以避免長時間佔用資料庫。
     *
     * @return 刪除筆數
     */
    @Scheduled(cron = "${metering.idempotency.sweep-cron:0 15 * * * *}")
    public long sweepExpired() {
        Instant now = clock.instant();
        long total = 0;
        for (int batch = 0; batch < sweepMaxBatches; batch++) {
            Query expired = Query.query(Criteria.where("expiresAt").lte(now)).limit(sweepBatchSize);
            expired.fields().include("_id");
            List<Object> ids = mongoTemplate.find(expired, IdempotencyRecord.class).stream()
                .map(record -> (Object) record.id())
                .toList();
            if (ids.isEmpty()) {
                break;
            }
            total += mongoTemplate.remove(
                Query.query(Criteria.where("_id").in(ids).and("expiresAt").lte(now)),
                IdempotencyRecord.class).getDeletedCount();
            if (ids.size() < sweepBatchSize) {
                break;
            }
        }
        if (total > 0) {
            log.info("Expired idempotency keys removed: {}", total);
        }
        return total;
    }

    private boolean isAbandoned(IdempotencyRecord record, Instant now) {
        return !record.isCompleted()
            && record.claimedAt() != null
            && !record.claimedAt().plus(claimTimeout).isAfter(now);
    }

    private boolean takeOver(IdempotencyRecord existing, Instant now) {
        Query query = Query.query(Criteria.where("_id").is(existing.id())
            .and("state").is(existing.state())
            .and("claimedAt").is(existing.claimedAt()));
        Update update = new Update()
            .set("state", IdempotencyRecord.STATE_PENDING)
            .set("claimedAt", now)
            .set("createdAt", now)
            .set("expiresAt", now.plus(ttl))
            .unset("resourceId")
            .unset("responseBody")
            .unset("responseStatus");
        return mongoTemplate.updateFirst(query, update, IdempotencyRecord.class).getModifiedCount() > 0;
    }

    private static CachedResponse toCachedResponse(IdempotencyRecord record) {
        int status = record.responseStatus() != null ? record.responseStatus() : 200;
        return new CachedResponse(status, record.responseBody(), record.resourceId());
    }
}
