package io.github.samzhu.metering.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * 計費週期計算工具類。
 *
 * <p>計費週期以組織的錨定日 (1-31) 為起點，每月一期。
 * 錨定日不存在於某月時 (例如 2 月 30 日)，改用該月最後一天。
 * 所有時間計算均使用 UTC 時區。
 *
 * <p>範例 (錨定日 31)：
 * <pre>
 * 2025-01-31 → 2025-02-28 → 2025-03-31 → 2025-04-30
 * </pre>
 */
public final class BillingPeriods {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private BillingPeriods() {
        // 工具類不允許實例化
    }

    /**
     * 計算參考時間所屬的計費週期。
     *
     * <p>週期開始為參考時間當下或之前最近一次出現的錨定日 (UTC 午夜)，
     * 週期結束為下一個月的錨定日。參考時間剛好等於週期結束時屬於下一期。
     *
     * @param anchorDay 錨定日 (1-31)
     * @param reference 參考時間
     * @return 半開區間的計費週期
     * @throws IllegalArgumentException 錨定日不在 1-31 之間
     */
    public static BillingPeriod periodFor(int anchorDay, Instant reference) {
        if (anchorDay < 1 || anchorDay > 31) {
            throw new IllegalArgumentException("Billing cycle anchor must be between 1 and 31: " + anchorDay);
        }
        if (reference == null) {
            throw new IllegalArgumentException("Reference time must not be null");
        }

        YearMonth month = YearMonth.from(reference.atZone(ZoneOffset.UTC));
        Instant start = anchorIn(month, anchorDay);
        if (start.isAfter(reference)) {
            month = month.minusMonths(1);
            start = anchorIn(month, anchorDay);
        }
        Instant end = anchorIn(month.plusMonths(1), anchorDay);
        return new BillingPeriod(start, end);
    }

    /**
     * 取得指定月份的錨定日 UTC 午夜，錨定日超過月底時取月底。
     *
     * @param month 年月
     * @param anchorDay 錨定日
     * @return 錨定時間
     */
    static Instant anchorIn(YearMonth month, int anchorDay) {
        int day = Math.min(anchorDay, month.lengthOfMonth());
        return month.atDay(day).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /**
     * 計算距離週期結束的剩餘天數。
     *
     * @param period 計費週期
     * @param now 目前時間
     * @return 剩餘天數，如果已過期則返回 0
     */
    public static long daysRemaining(BillingPeriod period, Instant now) {
        if (!now.isBefore(period.end())) {
            return 0;
        }
        return ChronoUnit.DAYS.between(now, period.end());
    }

    /**
     * 取得週期的格式化字串。
     *
     * @param period 計費週期
     * @return 格式如 "2025-01-15/2025-02-15"
     */
    public static String format(BillingPeriod period) {
        LocalDate start = LocalDate.ofInstant(period.start(), ZoneOffset.UTC);
        LocalDate end = LocalDate.ofInstant(period.end(), ZoneOffset.UTC);
        return DATE_FORMAT.format(start) + "/" + DATE_FORMAT.format(end);
    }
}
