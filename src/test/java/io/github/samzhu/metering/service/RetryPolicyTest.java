package io.github.samzhu.metering.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.metering.config.MeteringProperties.JobsConfig;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.from(JobsConfig.defaults());

    @Test
    void shouldRetryWithConfiguredDelays() {
        assertThat(policy.onFailure(0)).isEqualTo(new RetryPolicy.Decision(true, Duration.ofSeconds(60)));
        assertThat(policy.onFailure(1)).isEqualTo(new RetryPolicy.Decision(true, Duration.ofSeconds(300)));
        assertThat(policy.onFailure(2)).isEqualTo(new RetryPolicy.Decision(true, Duration.ofSeconds(900)));
    }

    @Test
    void shouldDeadLetterAfterMaxRetries() {
        // When: 第 4 次失敗 (已重試 3 次)
        RetryPolicy.Decision decision = policy.onFailure(3);

        // Then
        assertThat(decision.retry()).isFalse();
    }

    @Test
    void shouldHonorRetryLimitRecordedOnJob() {
        assertThat(policy.onFailure(1, 1).retry()).isFalse();
        assertThat(policy.onFailure(3, 5)).isEqualTo(new RetryPolicy.Decision(true, Duration.ofSeconds(900)));
        assertThat(new RetryPolicy(0, List.of()).onFailure(0, 1))
            .isEqualTo(new RetryPolicy.Decision(true, Duration.ZERO));
    }

    @Test
    void shouldAllowFourExecutionsInTotal() {
        // Given
        int executions = 0;
        int retryCount = 0;

        // When: 每次執行都失敗
        while (true) {
            executions++;
            if (!policy.onFailure(retryCount).retry()) {
                break;
            }
            retryCount++;
        }

        // Then
        assertThat(executions).isEqualTo(4);
        assertThat(retryCount).isEqualTo(3);
    }

    @Test
    void shouldReuseLastDelayWhenScheduleIsShort() {
        // Given
        RetryPolicy shortSchedule = new RetryPolicy(5, List.of(Duration.ofSeconds(10)));

        // When & Then
        assertThat(shortSchedule.onFailure(4).delay()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void shouldDeadLetterImmediatelyWithoutRetries() {
        assertThat(new RetryPolicy(0, List.of()).onFailure(0).retry()).isFalse();
    }

    @Test
    void shouldRejectRetriesWithoutDelays() {
        assertThatThrownBy(() -> new RetryPolicy(2, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
