package io.github.samzhu.metering.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import io.github.samzhu.metering.config.MeteringProperties.PlanQuota;
import io.github.samzhu.metering.document.UsagePeriodRecord;

class MeteredResourceTest {

    private static final PlanQuota STARTER = new PlanQuota("Starter", 1000L, 50L, 3L, 1L, 1L);

    @Test
    void shouldParseResourceKeysIgnoringCase() {
        assertThat(MeteredResource.fromKey("scans")).isEqualTo(MeteredResource.SCANS);
        assertThat(MeteredResource.fromKey(" Prompts ")).isEqualTo(MeteredResource.PROMPTS);
        assertThat(MeteredResource.fromKey("PAGES")).isEqualTo(MeteredResource.PAGES);
    }

    @Test
    void shouldRejectUnknownResource() {
        assertThatThrownBy(() -> MeteredResource.fromKey("tokens"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tokens");
        assertThatThrownBy(() -> MeteredResource.fromKey(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReadLimitAndUsageForEachResource() {
        // Given
        Instant start = Instant.parse("2025-01-15T00:00:00Z");
        UsagePeriodRecord usage = new UsagePeriodRecord(
            UsagePeriodRecord.createId(42L, start), 42L, start, Instant.parse("2025-02-15T00:00:00Z"),
            999L, 7L, 2L, start, start);

        // Then
        assertThat(MeteredResource.SCANS.limitOf(STARTER)).isEqualTo(1000L);
        assertThat(MeteredResource.SCANS.usedIn(usage)).isEqualTo(999L);
        assertThat(MeteredResource.PROMPTS.usedIn(usage)).isEqualTo(7L);
        assertThat(MeteredResource.PAGES.limitOf(STARTER)).isEqualTo(3L);
        assertThat(MeteredResource.PAGES.usedIn(usage)).isEqualTo(2L);
    }

    @Test
    void shouldTreatMissingUsageAsZero() {
        assertThat(MeteredResource.SCANS.usedIn(null)).isZero();
    }

    @Test
    void shouldMapSubmissionTypesToQueuesAndResources() {
        // When
        SubmissionType scan = SubmissionType.fromKey("scan");
        SubmissionType page = SubmissionType.fromKey("pages");

        // Then
        assertThat(scan.queue()).isEqualTo("scans");
        assertThat(scan.resource()).isEqualTo(MeteredResource.SCANS);
        assertThat(scan.weighted()).isTrue();
        assertThat(page.resourceType()).isEqualTo("page");
        assertThat(page.resource()).isEqualTo(MeteredResource.PAGES);
        assertThat(page.weighted()).isFalse();
    }

    @Test
    void shouldReadSlotLimitsFromPlan() {
        assertThat(SlotKind.fromKey("Brands").limitOf(STARTER)).isEqualTo(1L);
        assertThat(SlotKind.SEATS.limitOf(new PlanQuota("Enterprise", null, null, null, null, null))).isNull();
        assertThatThrownBy(() -> SlotKind.fromKey("projects"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
