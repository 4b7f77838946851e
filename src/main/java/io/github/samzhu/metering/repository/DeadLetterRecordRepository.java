package io.github.samzhu.metering.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import io.github.samzhu.metering.document.DeadLetterRecord;

/**
 * 死信工作紀錄 Repository。
 */
@Repository
public interface DeadLetterRecordRepository extends MongoRepository<DeadLetterRecord, String> {

    /**
     * 分頁查詢死信紀錄，最新的在前。
     *
     * @param queue 佇列名稱
     * @param pageable 分頁參數
     * @return 死信紀錄
     */
    Page<DeadLetterRecord> findByQueueOrderByDeadLetteredAtDesc(String queue, Pageable pageable);

    /**
     * 分頁查詢所有死信紀錄，最新的在前。
     *
     * @param pageable 分頁參數
     * @return 死信紀錄
     */
    Page<DeadLetterRecord> findAllByOrderByDeadLetteredAtDesc(Pageable pageable);
}
