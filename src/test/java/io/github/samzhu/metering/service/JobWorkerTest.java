package io.github.samzhu.metering.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import io.github.samzhu.metering.config.MeteringProperties;
import io.github.samzhu.metering.config.MeteringProperties.JobsConfig;
import io.github.samzhu.metering.document.Job;
import io.github.samzhu.metering.dto.JobState;
import io.github.samzhu.metering.exception.JobTimeoutException;

class JobWorkerTest {

    private JobDispatcherService dispatcher;
    private JobWorker worker;
    private final AtomicReference<ThrowingHandler> behavior = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        dispatcher = mock(JobDispatcherService.class);
        when(dispatcher.timeoutFor("scans")).thenReturn(Duration.ofMillis(300));
        when(dispatcher.markFailed(any(), any(), any())).thenReturn(JobState.FAILED);

        JobHandler handler = new JobHandler() {
            @Override
            public String queue() {
                return "scans";
            }

            @Override
            public Map<String, Object> handle(JobContext context) throws Exception {
                return behavior.get().handle(context);
            }
        };

        JobsConfig jobs = new JobsConfig(false, 3, null, null, null, Duration.ofMillis(10), 1,
            Duration.ofMillis(100), null, null, null);
        worker = new JobWorker(dispatcher, List.of(handler),
            new MeteringProperties(null, null, null, null, null, jobs));
    }

    @AfterEach
    void tearDown() {
        worker.stop();
    }

    @Test
    void shouldReturnEmptyWhenQueueIsEmpty() {
        // Given
        when(dispatcher.dequeue(eq("scans"), anyString())).thenReturn(Optional.empty());

        // When & Then
        assertThat(worker.processNext("scans")).isEmpty();
    }

    @Test
    void shouldMarkSucceededWithHandlerResult() {
        // Given
        Job job = JobDispatcherServiceTest.runningJob(0);
        when(dispatcher.dequeue(eq("scans"), anyString())).thenReturn(Optional.of(job));
        behavior.set(context -> Map.of("pages", context.payload().get("orgId")));

        // When
        Optional<JobState> state = worker.processNext("scans");

        // Then
        assertThat(state).contains(JobState.SUCCEEDED);
        verify(dispatcher).markSucceeded(eq(job), eq(Map.of("pages", 42)), any(Duration.class));
        verify(dispatcher, never()).markFailed(any(), any(), any());
    }

    @Test
    void shouldMarkFailedWhenHandlerThrows() {
        // Given
        Job job = JobDispatcherServiceTest.runningJob(0);
        when(dispatcher.dequeue(eq("scans"), anyString())).thenReturn(Optional.of(job));
        behavior.set(context -> {
            throw new IllegalStateException("upstream unavailable");
        });

        // When
        Optional<JobState> state = worker.processNext("scans");

        // Then
        assertThat(state).contains(JobState.FAILED);
        ArgumentCaptor<Throwable> captor = ArgumentCaptor.forClass(Throwable.class);
        verify(dispatcher).markFailed(eq(job), captor.capture(), any(Duration.class));
        assertThat(captor.getValue()).isInstanceOf(IllegalStateException.class)
            .hasMessage("upstream unavailable");
    }

    @Test
    void shouldFailJobThatExceedsQueueTimeout() {
        // Given
        Job job = JobDispatcherServiceTest.runningJob(0);
        when(dispatcher.dequeue(eq("scans"), anyString())).thenReturn(Optional.of(job));
        behavior.set(context -> {
            Thread.sleep(5_000);
            return Map.of();
        });

        // When
        worker.processNext("scans");

        // Then
        ArgumentCaptor<Throwable> captor = ArgumentCaptor.forClass(Throwable.class);
        verify(dispatcher).markFailed(eq(job), captor.capture(), any(Duration.class));
        assertThat(captor.getValue()).isInstanceOf(JobTimeoutException.class);
        verify(dispatcher, never()).markSucceeded(any(), any(), any());
    }

    @Test
    void shouldRequeueInFlightJobOnShutdown() throws Exception {
        // Given: 工作執行時間超過關閉等待時間
        Job job = JobDispatcherServiceTest.runningJob(0);
        when(dispatcher.timeoutFor("scans")).thenReturn(Duration.ofMinutes(1));
        when(dispatcher.dequeue(eq("scans"), anyString())).thenReturn(Optional.of(job), Optional.empty());
        CountDownLatch started = new CountDownLatch(1);
        behavior.set(context -> {
            started.countDown();
            Thread.sleep(60_000);
            return Map.of();
        });

        // When
        worker.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        worker.stop();

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(dispatcher, atLeastOnce()).requeue(job));
        verify(dispatcher, never()).markFailed(any(), any(), any());
        assertThat(worker.isRunning()).isFalse();
    }

    @Test
    void shouldKeepPollingAfterDequeueFailure() {
        // Given: concurrency = 1，第一次取出時資料庫暫時無法連線
        Job job = JobDispatcherServiceTest.runningJob(0);
        when(dispatcher.dequeue(eq("scans"), anyString()))
            .thenThrow(new DataAccessResourceFailureException("mongo unavailable"))
            .thenReturn(Optional.of(job), Optional.empty());
        behavior.set(context -> Map.of("ok", true));

        // When
        worker.start();

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(dispatcher).markSucceeded(eq(job), eq(Map.of("ok", true)), any(Duration.class)));
    }

    @Test
    void shouldRequeueJobDequeuedWhileStopping() throws Exception {
        // Given: 取出工作的呼叫在 stop() 期間卡住且不回應中斷，stop() 結束後才回傳工作
        Job job = JobDispatcherServiceTest.runningJob(0);
        CountDownLatch dequeuing = new CountDownLatch(1);
        CountDownLatch stopped = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        when(dispatcher.dequeue(eq("scans"), anyString())).thenAnswer(invocation -> {
            if (calls.getAndIncrement() > 0) {
                return Optional.empty();
            }
            dequeuing.countDown();
            boolean released = false;
            while (!released) {
                try {
                    released = stopped.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    // 模擬不回應中斷的資料庫呼叫
                    released = false;
                }
            }
            return Optional.of(job);
        });
        behavior.set(context -> Map.of());

        // When
        worker.start();
        assertThat(dequeuing.await(5, TimeUnit.SECONDS)).isTrue();
        worker.stop();
        stopped.countDown();

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(dispatcher).requeue(job));
        verify(dispatcher, never()).markSucceeded(any(), any(), any());
        verify(dispatcher, never()).markFailed(any(), any(), any());
    }

    @Test
    void shouldRunJobsAfterRestart() {
        // Given
        Job job = JobDispatcherServiceTest.runningJob(0);
        behavior.set(context -> Map.of("ok", true));
        worker.start();
        worker.stop();
        when(dispatcher.dequeue(eq("scans"), anyString())).thenReturn(Optional.of(job), Optional.empty());

        // When
        worker.start();

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(dispatcher).markSucceeded(eq(job), eq(Map.of("ok", true)), any(Duration.class)));
        verify(dispatcher, never()).markFailed(any(), any(), any());
    }

    @Test
    void shouldNotAutoStartWhenDisabled() {
        assertThat(worker.isAutoStartup()).isFalse();
        assertThat(worker.getPhase()).isEqualTo(Integer.MAX_VALUE);
    }

    @FunctionalInterface
    interface ThrowingHandler {
        Map<String, Object> handle(JobContext context) throws Exception;
    }
}
