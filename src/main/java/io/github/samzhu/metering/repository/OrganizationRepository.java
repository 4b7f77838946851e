package io.github.samzhu.metering.repository;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import io.github.samzhu.metering.document.Organization;

/**
 * 組織 Repository。
 */
@Repository
public interface OrganizationRepository extends MongoRepository<Organization, Long> {
}
