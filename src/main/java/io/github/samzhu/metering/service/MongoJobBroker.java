package io.github.samzhu.metering.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import io.github.samzhu.metering.document.EnqueueMarker;
import io.github.samzhu.metering.document.Job;
import io.github.samzhu.metering.dto.JobState;
import io.github.samzhu.metering.repository.EnqueueMarkerRepository;
import io.github.samzhu.metering.repository.JobRepository;

/**
 * 以 MongoDB {@code jobs} 集合實作的工作佇列。
 *
 * <p>取出工作使用 {@code findAndModify}，同一筆工作只會被一個 worker 取得。
 * 執行中的狀態轉換以 (_id, state=RUNNING, attempts) 為條件，
 * 避免過期租約被回收後，舊的執行結果覆寫新的執行。
 */
@Component
public class MongoJobBroker implements JobBroker {

    private static final Logger log = LoggerFactory.getLogger(MongoJobBroker.class);

    private final MongoTemplate mongoTemplate;
    private final JobRepository jobRepository;
    private final EnqueueMarkerRepository markerRepository;

    public MongoJobBroker(
            MongoTemplate mongoTemplate,
            JobRepository jobRepository,
            EnqueueMarkerRepository markerRepository) {
        this.mongoTemplate = mongoTemplate;
        this.jobRepository = jobRepository;
        this.markerRepository = markerRepository;
    }

    @Override
    public boolean submit(Job job) {
        try {
            mongoTemplate.insert(job);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Job already exists: jobId={}", job.id());
            return false;
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    public Optional<Job> dequeue(String queue, String workerId, Duration lease, Instant now) {
        Query query = Query.query(Criteria.where("queue").is(queue)
                .and("state").is(JobState.QUEUED.name())
                .and("availableAt").lte(now))
            .with(Sort.by(Sort.Direction.ASC, "availableAt"));
        Update update = new Update()
            .set("state", JobState.RUNNING.name())
            .set("workerId", workerId)
            .set("startedAt", now)
            .set("leaseExpiresAt", now.plus(lease))
            .set("lastUpdatedAt", now)
            .inc("attempts", 1);
        return Optional.ofNullable(mongoTemplate.findAndModify(
            query, update, FindAndModifyOptions.options().returnNew(true), Job.class));
    }

    @Override
    public boolean complete(Job job, Map<String, Object> result, Instant now) {
        Update update = new Update()
            .set("state", JobState.SUCCEEDED.name())
            .set("result", result)
            .set("endedAt", now)
            .set("lastUpdatedAt", now)
            .unset("leaseExpiresAt")
            .unset("workerId");
        return updateRunning(job, update);
    }

    @Override
    public boolean scheduleRetry(Job job, String error, Instant availableAt, Instant now) {
        Update update = new Update()
            .set("state", JobState.FAILED.name())
            .set("lastError", error)
            .set("availableAt", availableAt)
            .set("endedAt", now)
            .set("lastUpdatedAt", now)
            .inc("metadata.retryCount", 1)
            .unset("leaseExpiresAt")
            .unset("workerId");
        return updateRunning(job, update);
    }

    @Override
    public boolean deadLetter(Job job, String error, Instant now) {
        Update update = new Update()
            .set("state", JobState.DEAD_LETTERED.name())
            .set("lastError", error)
            .set("endedAt", now)
            .set("lastUpdatedAt", now)
            .unset("leaseExpiresAt")
            .unset("workerId");
        return updateRunning(job, update);
    }

    @Override
    public boolean requeue(Job job, Instant now) {
        Update update = new Update()
            .set("state", JobState.QUEUED.name())
            .set("availableAt", now)
            .set("lastUpdatedAt", now)
            .inc("attempts", -1)
            .unset("leaseExpiresAt")
            .unset("workerId");
        return updateRunning(job, update);
    }

    @Override
    public long promoteDueRetries(Instant now) {
        Query query = Query.query(Criteria.where("state").is(JobState.FAILED.name())
            .and("availableAt").lte(now));
        Update update = new Update()
            .set("state", JobState.QUEUED.name())
            .set("lastUpdatedAt", now);
        return mongoTemplate.updateMulti(query, update, Job.class).getModifiedCount();
    }

    @Override
    public List<Job> findExpiredLeases(Instant now, int limit) {
        Query query = Query.query(Criteria.where("state").is(JobState.RUNNING.name())
                .and("leaseExpiresAt").lte(now))
            .with(Sort.by(Sort.Direction.ASC, "leaseExpiresAt"))
            .limit(limit);
        return mongoTemplate.find(query, Job.class);
    }

    @Override
    public Optional<String> findMarker(String idempotencyKey, Instant now) {
        return markerRepository.findById(idempotencyKey)
            .filter(marker -> !marker.isExpired(now))
            .map(EnqueueMarker::jobId);
    }

    @Override
    public void saveMarker(String idempotencyKey, String jobId, Instant now, Instant expiresAt) {
        markerRepository.save(new EnqueueMarker(idempotencyKey, jobId, now, expiresAt));
    }

    private boolean updateRunning(Job job, Update update) {
        Query query = Query.query(Criteria.where("_id").is(job.id())
            .and("state").is(JobState.RUNNING.name())
            .and("attempts").is(job.attempts()));
        boolean updated = mongoTemplate.updateFirst(query, update, Job.class).getModifiedCount() > 0;
        if (!updated) {
            log.warn("Job transition skipped, no longer running this attempt: jobId={}, attempts={}",
                job.id(), job.attempts());
        }
        return updated;
    }
}
