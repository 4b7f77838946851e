package io.github.samzhu.metering.repository;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import io.github.samzhu.metering.document.Job;

/**
 * 背景工作 Repository。
 */
@Repository
public interface JobRepository extends MongoRepository<Job, String> {
}
