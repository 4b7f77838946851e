package io.github.samzhu.metering.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.metering.config.MeteringProperties;
import io.github.samzhu.metering.config.MeteringProperties.PlanQuota;
import io.github.samzhu.metering.exception.UnknownPlanException;

class QuotaPolicyServiceTest {

    private QuotaPolicyService policy;

    @BeforeEach
    void setUp() {
        Map<String, PlanQuota> plans = Map.of(
            "starter", new PlanQuota("Starter", 1000L, 50L, 3L, 1L, 1L),
            "pro", new PlanQuota("Pro", 5000L, 200L, 10L, 3L, 5L),
            "enterprise", new PlanQuota("Enterprise", null, null, null, null, null)
        );
        Map<String, Integer> weights = Map.of(
            "gpt-4o", 1,
            "perplexity-sonar", 2,
            "claude-opus", 3
        );
        policy = new QuotaPolicyService(new MeteringProperties(plans, weights, 1, 0.80, null, null));
    }

    @Test
    void shouldResolvePlanCaseInsensitively() {
        // When
        PlanQuota plan = policy.planFor("Starter");

        // Then
        assertThat(plan.scans()).isEqualTo(1000L);
        assertThat(plan.pages()).isEqualTo(3L);
        assertThat(policy.isKnownPlan("PRO")).isTrue();
    }

    @Test
    void shouldTreatMissingLimitsAsUnlimited() {
        // When
        PlanQuota plan = policy.planFor("enterprise");

        // Then
        assertThat(plan.scans()).isNull();
        assertThat(plan.seats()).isNull();
    }

    @Test
    void shouldRejectUnknownPlan() {
        assertThatThrownBy(() -> policy.planFor("platinum"))
            .isInstanceOf(UnknownPlanException.class)
            .hasMessageContaining("platinum");
        assertThat(policy.isKnownPlan(null)).isFalse();
    }

    @Test
    void shouldUseConfiguredCreditWeight() {
        assertThat(policy.creditsFor("perplexity-sonar")).isEqualTo(2);
        assertThat(policy.creditsFor("Claude-Opus")).isEqualTo(3);
        assertThat(policy.creditsFor("gpt-4o")).isEqualTo(1);
    }

    @Test
    void shouldFallBackToDefaultWeightForUnknownModel() {
        assertThat(policy.creditsFor("mistral-large")).isEqualTo(1);
        assertThat(policy.creditsFor(null)).isEqualTo(1);
        assertThat(policy.creditsFor("  ")).isEqualTo(1);
    }

    @Test
    void shouldChargeOnlineModelsTwoCredits() {
        // Given: 未設定權重但名稱含 online 的模型需即時搜尋
        String model = "llama-3-sonar-online";

        // When & Then
        assertThat(policy.creditsFor(model)).isEqualTo(2);
    }

    @Test
    void shouldWarnAtThreshold() {
        assertThat(policy.isWarning(799, 1000L)).isFalse();
        assertThat(policy.isWarning(800, 1000L)).isTrue();
        assertThat(policy.isWarning(1000, 1000L)).isTrue();
    }

    @Test
    void shouldNeverWarnForUnlimitedOrZeroLimit() {
        assertThat(policy.isWarning(1_000_000, null)).isFalse();
        assertThat(policy.isWarning(0, 0L)).isFalse();
    }
}
