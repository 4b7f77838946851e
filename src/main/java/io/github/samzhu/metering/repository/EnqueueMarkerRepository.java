package io.github.samzhu.metering.repository;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import io.github.samzhu.metering.document.EnqueueMarker;

/**
 * 入列標記 Repository。
 */
@Repository
public interface EnqueueMarkerRepository extends MongoRepository<EnqueueMarker, String> {
}
