package io.github.samzhu.metering.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.metering.dto.CachedResponse;
import io.github.samzhu.metering.dto.ClaimResult;
import io.github.samzhu.metering.dto.EnqueueResult;
import io.github.samzhu.metering.dto.MeteredResource;
import io.github.samzhu.metering.dto.SubmissionResult;
import io.github.samzhu.metering.dto.SubmissionType;
import io.github.samzhu.metering.dto.TraceContext;
import io.github.samzhu.metering.dto.UsageResult;
import io.github.samzhu.metering.dto.api.SubmissionRequest;
import io.github.samzhu.metering.exception.IdempotencyConflictException;
import io.github.samzhu.metering.exception.LimitExceededException;

class MeteredSubmissionServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-20T09:00:00Z");
    private static final Instant PERIOD_START = Instant.parse("2025-01-15T00:00:00Z");
    private static final Instant PERIOD_END = Instant.parse("2025-02-15T00:00:00Z");
    private static final String KEY = "client-key-20-chars!";

    private IdempotencyService idempotencyService;
    private UsageLedgerService ledgerService;
    private JobDispatcherService dispatcher;
    private ObjectMapper objectMapper;
    private MeteredSubmissionService submissionService;

    @BeforeEach
    void setUp() {
        idempotencyService = mock(IdempotencyService.class);
        ledgerService = mock(UsageLedgerService.class);
        dispatcher = mock(JobDispatcherService.class);
        objectMapper = new ObjectMapper().findAndRegisterModules();
        submissionService = new MeteredSubmissionService(idempotencyService, ledgerService, dispatcher,
            objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldReleaseClaimWhenStoringResponseFails() {
        // Given: 保留與入列成功，但保存回應時資料庫無法連線
        when(idempotencyService.claim(KEY, 7, "page")).thenReturn(ClaimResult.acquired());
        when(ledgerService.reserveCredits(7, MeteredResource.PAGES, 1))
            .thenReturn(new UsageResult("pages", 1, 2, 3L, PERIOD_START, PERIOD_END));
        when(dispatcher.enqueue(eq("pages"), any(), eq("page:7:" + KEY), any(TraceContext.class)))
            .thenReturn(EnqueueResult.accepted("abcdef0123456789"));
        when(idempotencyService.record(eq(KEY), eq(7L), eq("page"), anyString(), anyString(), eq(202)))
            .thenThrow(new DataAccessResourceFailureException("mongo unavailable"));

        // When
        SubmissionResult result = submissionService.submit(7, SubmissionType.PAGE,
            new SubmissionRequest(null, "user-1", Map.of()), KEY, "req-1");

        // Then
        assertThat(result.status()).isEqualTo(202);
        assertThat(result.replayed()).isFalse();
        verify(idempotencyService).release(KEY, 7, "page");
    }

    @Test
    void shouldReserveEnqueueAndRecordResponse() throws Exception {
        // Given
        when(idempotencyService.claim(KEY, 7, "scan")).thenReturn(ClaimResult.acquired());
        when(ledgerService.reserveScanCredits(7, "perplexity-sonar"))
            .thenReturn(new UsageResult("scans", 2, 12, 1000L, PERIOD_START, PERIOD_END));
        when(dispatcher.enqueue(eq("scans"), any(), eq("scan:7:" + KEY), any(TraceContext.class)))
            .thenReturn(EnqueueResult.accepted("abcdef0123456789"));

        // When
        SubmissionResult result = submissionService.submit(7, SubmissionType.SCAN,
            new SubmissionRequest("perplexity-sonar", "user-1", Map.of("brand", "acme")), KEY, "req-1");

        // Then
        assertThat(result.status()).isEqualTo(202);
        assertThat(result.replayed()).isFalse();
        JsonNode body = objectMapper.readTree(result.body());
        assertThat(body.get("jobId").asText()).isEqualTo("abcdef0123456789");
        assertThat(body.get("jobEnqueued").asBoolean()).isTrue();
        assertThat(body.get("creditsReserved").asLong()).isEqualTo(2);
        assertThat(body.get("used").asLong()).isEqualTo(12);

        verify(idempotencyService).record(eq(KEY), eq(7L), eq("scan"),
            eq(body.get("submissionId").asText()), eq(result.body()), eq(202));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<TraceContext> trace = ArgumentCaptor.forClass(TraceContext.class);
        verify(dispatcher).enqueue(eq("scans"), payload.capture(), eq("scan:7:" + KEY), trace.capture());
        assertThat(payload.getValue()).containsEntry("brand", "acme").containsEntry("orgId", 7L);
        assertThat(trace.getValue()).isEqualTo(new TraceContext("req-1", "user-1", 7L));
    }

    @Test
    void shouldReplayCompletedResponseWithoutSideEffects() {
        // Given
        String cachedBody = "{\"submissionId\":\"s-1\"}";
        when(idempotencyService.claim(KEY, 7, "scan"))
            .thenReturn(ClaimResult.replay(new CachedResponse(202, cachedBody, "s-1")));

        // When
        SubmissionResult result = submissionService.submit(7, SubmissionType.SCAN,
            new SubmissionRequest(null, null, null), KEY, "req-2");

        // Then
        assertThat(result.replayed()).isTrue();
        assertThat(result.status()).isEqualTo(202);
        assertThat(result.body()).isEqualTo(cachedBody);
        verifyNoInteractions(ledgerService, dispatcher);
        verify(idempotencyService, never()).record(anyString(), anyLong(), anyString(), any(), any(), anyInt());
    }

    @Test
    void shouldRejectConcurrentRequestWithSameKey() {
        // Given
        when(idempotencyService.claim(KEY, 7, "scan")).thenReturn(ClaimResult.inProgress());

        // When & Then
        assertThatThrownBy(() -> submissionService.submit(7, SubmissionType.SCAN,
                new SubmissionRequest(null, null, null), KEY, null))
            .isInstanceOf(IdempotencyConflictException.class);
        verifyNoInteractions(ledgerService, dispatcher);
    }

    @Test
    void shouldReleaseKeyWhenLimitExceeded() {
        // Given
        when(idempotencyService.claim(KEY, 7, "page")).thenReturn(ClaimResult.acquired());
        when(ledgerService.reserveCredits(7, MeteredResource.PAGES, 1))
            .thenThrow(new LimitExceededException("pages", 3, 3, 1));

        // When & Then
        assertThatThrownBy(() -> submissionService.submit(7, SubmissionType.PAGE,
                new SubmissionRequest(null, null, null), KEY, null))
            .isInstanceOf(LimitExceededException.class)
            .hasMessage("pages limit reached. Please upgrade your plan.");
        verify(idempotencyService).release(KEY, 7, "page");
        verify(idempotencyService, never()).record(anyString(), anyLong(), anyString(), any(), any(), anyInt());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void shouldAcceptWithoutKeyUsingSubmissionScopedJobKey() throws Exception {
        // Given
        when(ledgerService.reserveCredits(7, MeteredResource.PAGES, 1))
            .thenReturn(new UsageResult("pages", 1, 1, 3L, PERIOD_START, PERIOD_END));
        when(dispatcher.enqueue(eq("pages"), any(), anyString(), any()))
            .thenReturn(EnqueueResult.accepted("0123456789abcdef"));

        // When
        SubmissionResult result = submissionService.submit(7, SubmissionType.PAGE,
            new SubmissionRequest(null, null, null), null, null);

        // Then
        String submissionId = objectMapper.readTree(result.body()).get("submissionId").asText();
        verify(dispatcher).enqueue(eq("pages"), any(), eq("page:" + submissionId), any());
        verifyNoInteractions(idempotencyService);
    }

    @Test
    void shouldStillAcceptWhenEnqueueFails() throws Exception {
        // Given
        when(idempotencyService.claim(KEY, 7, "scan")).thenReturn(ClaimResult.acquired());
        when(ledgerService.reserveScanCredits(7, null))
            .thenReturn(new UsageResult("scans", 1, 1, 1000L, PERIOD_START, PERIOD_END));
        when(dispatcher.enqueue(anyString(), any(), anyString(), any()))
            .thenThrow(new IllegalStateException("mongo unavailable"));

        // When
        SubmissionResult result = submissionService.submit(7, SubmissionType.SCAN,
            new SubmissionRequest(null, null, null), KEY, null);

        // Then
        JsonNode body = objectMapper.readTree(result.body());
        assertThat(result.status()).isEqualTo(202);
        assertThat(body.get("jobEnqueued").asBoolean()).isFalse();
        assertThat(body.get("jobId").isNull()).isTrue();
        verify(idempotencyService, never()).release(anyString(), anyLong(), anyString());
    }
}
