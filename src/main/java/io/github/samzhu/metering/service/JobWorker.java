package io.github.samzhu.metering.service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import io.github.samzhu.metering.config.MeteringProperties;
import io.github.samzhu.metering.config.MeteringProperties.JobsConfig;
import io.github.samzhu.metering.config.RequestIdFilter;
import io.github.samzhu.metering.document.Job;
import io.github.samzhu.metering.dto.JobState;
import io.github.samzhu.metering.exception.JobTimeoutException;

/**
 * 背景工作 worker。
 *
 * <p>只輪詢有 {@link JobHandler} 的佇列，最多同時執行 {@code concurrency} 個工作。
 * 每個工作在獨立執行緒中執行，超過佇列逾時即中斷並記為一次失敗。
 *
 * <p>實作 {@link SmartLifecycle} 確保關閉時：
 * <ul>
 *   <li>停止取出新工作</li>
 *   <li>等待執行中的工作最多 {@code shutdown-timeout}</li>
 *   <li>仍未完成的工作被中斷並放回佇列 (不計入重試)，不會遺失</li>
 *   <li>關閉順序在 Spring Cloud Stream bindings 之前 (phase: MAX_VALUE)，死信事件仍可發送</li>
 * </ul>
 */
@Component
public class JobWorker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final JobDispatcherService dispatcher;
    private final Map<String, JobHandler> handlers;
    private final JobsConfig config;
    private final String workerId;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final Map<String, Job> inFlight = new ConcurrentHashMap<>();

    private final Semaphore capacity;
    private ScheduledExecutorService poller;
    private ExecutorService workers;
    private volatile ExecutorService handlerThreads;

    public JobWorker(JobDispatcherService dispatcher, List<JobHandler> handlers, MeteringProperties properties) {
        this.dispatcher = dispatcher;
        this.handlers = handlers.stream()
            .collect(Collectors.toUnmodifiableMap(JobHandler::queue, Function.identity()));
        this.config = properties.jobs();
        this.capacity = new Semaphore(config.concurrency());
        this.workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        this.handlerThreads = Executors.newCachedThreadPool(namedThreads("job-exec-"));
    }

    /**
     * 同步執行佇列中的下一個工作。
     *
     * @param queue 佇列
     * @return 執行後的狀態，佇列為空時為 empty
     */
    public Optional<JobState> processNext(String queue) {
        return dispatcher.dequeue(queue, workerId).map(this::execute);
    }

    /**
     * 輪詢一次：在容量允許下從各佇列取出工作交給 worker 執行緒。
     *
     * <p>取出失敗時歸還容量；取出後 worker 已停止或拒收時，工作放回佇列。
     */
    void pollOnce() {
        if (!running.get()) {
            return;
        }
        try {
            for (String queue : handlers.keySet()) {
                while (running.get() && capacity.tryAcquire()) {
                    if (!dispatchNext(queue)) {
                        break;
                    }
                }
            }
        } catch (Exception e) {
            log.error("Job polling failed: worker={}, error={}", workerId, e.getMessage(), e);
        }
    }

    private boolean dispatchNext(String queue) {
        Optional<Job> next;
        try {
            next = dispatcher.dequeue(queue, workerId);
        } catch (RuntimeException e) {
            capacity.release();
            throw e;
        }
        if (next.isEmpty()) {
            capacity.release();
            return false;
        }
        Job job = next.get();
        if (!running.get()) {
            handBack(job);
            return false;
        }
        try {
            workers.execute(() -> {
                try {
                    execute(job);
                } finally {
                    capacity.release();
                }
            });
        } catch (RejectedExecutionException e) {
            handBack(job);
            return false;
        }
        return true;
    }

    private void handBack(Job job) {
        capacity.release();
        log.info("Worker stopping, returning job to queue: jobId={}, queue={}", job.id(), job.queue());
        dispatcher.requeue(job);
    }

    private JobState execute(Job job) {
        JobHandler handler = handlers.get(job.queue());
        Duration timeout = dispatcher.timeoutFor(job.queue());
        inFlight.put(job.id(), job);
        long start = System.nanoTime();
        MDC.put("jobId", job.id());
        try {
            if (handler == null) {
                return dispatcher.markFailed(job,
                    new IllegalStateException("No handler registered for queue " + job.queue()), Duration.ZERO);
            }
            Future<Map<String, Object>> future = handlerThreads.submit(() -> runHandler(handler, job));
            try {
                Map<String, Object> result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                dispatcher.markSucceeded(job, result, elapsedSince(start));
                return JobState.SUCCEEDED;
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Job timed out after {}: jobId={}, queue={}", timeout, job.id(), job.queue());
                return dispatcher.markFailed(job, new JobTimeoutException(job.id(), timeout), elapsedSince(start));
            } catch (ExecutionException e) {
                return dispatcher.markFailed(job, e.getCause(), elapsedSince(start));
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                if (stopping.get()) {
                    dispatcher.requeue(job);
                    return JobState.QUEUED;
                }
                return dispatcher.markFailed(job, e, elapsedSince(start));
            }
        } catch (RuntimeException e) {
            log.error("Job bookkeeping failed, lease will expire: jobId={}, error={}", job.id(), e.getMessage(), e);
            throw e;
        } finally {
            inFlight.remove(job.id());
            MDC.remove("jobId");
        }
    }

    private Map<String, Object> runHandler(JobHandler handler, Job job) throws Exception {
        MDC.put("jobId", job.id());
        if (job.metadata().requestId() != null) {
            MDC.put(RequestIdFilter.MDC_KEY, job.metadata().requestId());
        }
        try {
            log.debug("Job started: jobId={}, queue={}, attempt={}", job.id(), job.queue(), job.attempts());
            Map<String, Object> result = handler.handle(JobContext.fromJob(job));
            return result != null ? result : Map.of();
        } finally {
            MDC.remove("jobId");
            MDC.remove(RequestIdFilter.MDC_KEY);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ===== SmartLifecycle Implementation =====

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        stopping.set(false);
        if (handlerThreads.isShutdown()) {
            handlerThreads = Executors.newCachedThreadPool(namedThreads("job-exec-"));
        }
        workers = Executors.newFixedThreadPool(config.concurrency(), namedThreads("job-worker-"));
        poller = Executors.newSingleThreadScheduledExecutor(namedThreads("job-poller-"));
        long interval = config.pollInterval().toMillis();
        poller.scheduleWithFixedDelay(this::pollOnce, interval, interval, TimeUnit.MILLISECONDS);
        log.info("JobWorker started: worker={}, queues={}, concurrency={}",
            workerId, handlers.keySet(), config.concurrency());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("JobWorker stopping, waiting for {} in-flight jobs...", inFlight.size());
        stopping.set(true);
        poller.shutdownNow();
        try {
            // 等待進行中的輪詢結束，之後取出的工作由輪詢端放回佇列
            if (!poller.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Poller did not finish within {}", config.shutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Shutdown timeout reached, interrupting {} in-flight jobs", inFlight.size());
                workers.shutdownNow();
                workers.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        // worker 執行緒未能回報的工作直接放回佇列
        for (Job job : inFlight.values()) {
            dispatcher.requeue(job);
        }
        inFlight.clear();
        handlerThreads.shutdownNow();
        log.info("JobWorker stopped: worker={}", workerId);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return config.workerEnabled();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    public String workerId() {
        return workerId;
    }
}
