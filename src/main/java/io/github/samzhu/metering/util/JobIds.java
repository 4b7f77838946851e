package io.github.samzhu.metering.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 背景工作 ID 產生工具。
 *
 * <p>工作 ID 為冪等鍵 SHA-256 雜湊的前 16 個十六進位字元，
 * 同一個冪等鍵永遠對應同一個工作 ID。
 */
public final class JobIds {

    private static final int JOB_ID_LENGTH = 16;

    private JobIds() {
        // 工具類不允許實例化
    }

    /**
     * 由冪等鍵產生工作 ID。
     *
     * @param idempotencyKey 工作冪等鍵
     * @return 16 字元小寫十六進位字串
     */
    public static String fromIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Job idempotency key must not be blank");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(idempotencyKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, JOB_ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
