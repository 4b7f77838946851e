package io.github.samzhu.metering.service;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import io.github.samzhu.metering.config.MeteringProperties;
import io.github.samzhu.metering.config.MeteringProperties.PlanQuota;
import io.github.samzhu.metering.exception.UnknownPlanException;

/**
 * 方案配額政策服務。
 *
 * <p>提供三項純計算：
 * <ul>
 *   <li>方案代碼 → 各資源上限 ({@code metering.plans})</li>
 *   <li>模型識別 → 每次掃描扣除的點數 ({@code metering.credit-weights})</li>
 *   <li>已使用量 / 上限 → 是否達到警示門檻 ({@code metering.warn-threshold})</li>
 * </ul>
 *
 * <p>未列出的模型使用 {@code default-credit-weight}，但名稱含 {@code online} 的模型
 * 需即時搜尋，固定扣 2 點。
 */
@Service
public class QuotaPolicyService {

    static final int ONLINE_MODEL_WEIGHT = 2;

    private final Map<String, PlanQuota> plans;
    private final Map<String, Integer> creditWeights;
    private final int defaultCreditWeight;
    private final double warnThreshold;

    public QuotaPolicyService(MeteringProperties properties) {
        this.plans = properties.plans();
        this.creditWeights = properties.creditWeights();
        this.defaultCreditWeight = properties.defaultCreditWeight();
        this.warnThreshold = properties.warnThreshold();
    }

    /**
     * 取得方案設定。
     *
     * @param planTier 方案代碼
     * @return 方案上限
     * @throws UnknownPlanException 方案未設定
     */
    public PlanQuota planFor(String planTier) {
        PlanQuota plan = planTier != null ? plans.get(planTier.toLowerCase(Locale.ROOT)) : null;
        if (plan == null) {
            throw new UnknownPlanException(planTier);
        }
        return plan;
    }

    /**
     * 檢查方案是否存在。
     */
    public boolean isKnownPlan(String planTier) {
        return planTier != null && plans.containsKey(planTier.toLowerCase(Locale.ROOT));
    }

    /**
     * 取得所有已設定的方案代碼。
     */
    public Set<String> planTiers() {
        return plans.keySet();
    }

    /**
     * 計算模型每次掃描扣除的點數。
     *
     * @param model 模型識別，null 或空白時使用預設權重
     * @return 點數，至少為 1
     */
    public int creditsFor(String model) {
        if (model == null || model.isBlank()) {
            return defaultCreditWeight;
        }
        String normalized = model.trim().toLowerCase(Locale.ROOT);
        Integer weight = creditWeights.get(normalized);
        if (weight != null && weight > 0) {
            return weight;
        }
        if (normalized.contains("online")) {
            return Math.max(ONLINE_MODEL_WEIGHT, defaultCreditWeight);
        }
        return defaultCreditWeight;
    }

    /**
     * 判斷是否達到警示門檻。
     *
     * <p>無限制或上限為 0 的資源永遠不警示。
     *
     * @param used 已使用量
     * @param limit 上限，{@code null} 表示無限制
     * @return true 表示 {@code used / limit >= warnThreshold}
     */
    public boolean isWarning(long used, Long limit) {
        if (limit == null || limit == 0) {
            return false;
        }
        return (double) used / limit >= warnThreshold;
    }

    public double warnThreshold() {
        return warnThreshold;
    }
}
