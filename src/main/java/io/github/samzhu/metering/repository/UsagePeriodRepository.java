package io.github.samzhu.metering.repository;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import io.github.samzhu.metering.document.UsagePeriodRecord;

/**
 * 週期用量 Repository。
 *
 * <p>計數器的遞增一律透過 {@link io.github.samzhu.metering.service.UsageLedgerService}
 * 的條件式更新，此介面只用於查詢。
 */
@Repository
public interface UsagePeriodRepository extends MongoRepository<UsagePeriodRecord, String> {

    /**
     * 查詢組織的歷史週期用量，最新的在前。
     *
     * @param orgId 組織 ID
     * @param pageable 分頁參數
     * @return 週期用量列表
     */
    List<UsagePeriodRecord> findByOrgIdOrderByPeriodStartDesc(Long orgId, Pageable pageable);
}
