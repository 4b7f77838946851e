package io.github.samzhu.metering.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 入列標記文件。
 *
 * <p>以工作冪等鍵為 ID 的快速存在檢查，{@code expiresAt} 上的 TTL 索引讓 MongoDB 自動清除過期標記。
 * TTL 清除為背景執行，讀取時仍需比對 {@code expiresAt}。
 *
 * @param id 工作冪等鍵
 * @param jobId 工作 ID
 * @param createdAt 建立時間
 * @param expiresAt 過期時間
 */
@Document(collection = "job_markers")
public record EnqueueMarker(
    @Id String id,
    String jobId,
    Instant createdAt,
    @Indexed(expireAfterSeconds = 0) Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
