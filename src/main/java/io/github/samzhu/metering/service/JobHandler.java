package io.github.samzhu.metering.service;

import java.util.Map;

/**
 * 背景工作處理器，每個佇列一個。
 *
 * <p>{@link JobWorker} 只從有處理器的佇列取出工作；沒有處理器的佇列的工作會留在
 * {@code QUEUED}，等待有對應處理器的 worker。丟出任何例外即視為一次失敗，依重試政策處理。
 */
public interface JobHandler {

    /**
     * 處理的佇列名稱。
     */
    String queue();

    /**
     * 執行工作。執行超過佇列逾時時執行緒會被中斷。
     *
     * @param context 工作內容
     * @return 執行結果，會保存於工作文件
     * @throws Exception 執行失敗
     */
    Map<String, Object> handle(JobContext context) throws Exception;
}
