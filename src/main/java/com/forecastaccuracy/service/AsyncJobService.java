package com.forecastaccuracy.service;

import com.forecastaccuracy.dto.AsyncJobResponse;
import com.forecastaccuracy.dto.AsyncJobStatus;
import com.forecastaccuracy.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * In-memory registry of background jobs. Finished jobs are evicted oldest first
 * once more than {@code jobs.max-retained} are held.
 */
@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:4}")
    private int poolSize;

    @Value("${jobs.max-retained:500}")
    private int maxRetained;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobRecord> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize));
        log.info("AsyncJobService started | poolSize={} | maxRetained={}", Math.max(2, poolSize), maxRetained);
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(String jobType, String requestId, Function<JobProgress, Object> task) {
        JobRecord job = new JobRecord(UUID.randomUUID(), jobType, requestId);
        jobs.put(job.jobId, job);
        evictFinished();

        CompletableFuture.runAsync(() -> run(job, task), executor);
        log.info("Job queued | jobId={} | type={} | requestId={}", job.jobId, jobType, requestId);
        return job.jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        JobRecord job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job.toResponse();
    }

    private void run(JobRecord job, Function<JobProgress, Object> task) {
        job.start();
        try {
            Object result = task.apply(job::progress);
            job.complete(result);
            log.info("Job completed | jobId={} | type={} | requestId={}", job.jobId, job.jobType, job.requestId);
        } catch (RuntimeException ex) {
            String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            job.fail(reason);
            log.error("Job failed | jobId={} | type={} | reason={} | requestId={}",
                job.jobId, job.jobType, reason, job.requestId, ex);
        }
    }

    private void evictFinished() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().isFinished())
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobRecord {
        private final UUID jobId;
        private final String jobType;
        private final String requestId;
        private final Instant createdAt = Instant.now();
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private volatile int progressPercent;
        private volatile String message = "Queued";
        private volatile Object result;

        private JobRecord(UUID jobId, String jobType, String requestId) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.requestId = requestId;
        }

        private synchronized void start() {
            startedAt = Instant.now();
            status = AsyncJobStatus.RUNNING;
            message = "Started";
            progressPercent = 5;
        }

        private synchronized void progress(String stage, int percent) {
            if (status != AsyncJobStatus.RUNNING) {
                return;
            }
            message = stage;
            progressPercent = Math.max(progressPercent, Math.min(99, percent));
        }

        private synchronized void complete(Object value) {
            completedAt = Instant.now();
            status = AsyncJobStatus.COMPLETED;
            result = value;
            message = "Completed";
            progressPercent = 100;
        }

        private synchronized void fail(String reason) {
            completedAt = Instant.now();
            status = AsyncJobStatus.FAILED;
            message = reason;
            progressPercent = 100;
        }

        private boolean isFinished() {
            return status == AsyncJobStatus.COMPLETED || status == AsyncJobStatus.FAILED;
        }

        private synchronized AsyncJobResponse toResponse() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .progressPercent(progressPercent)
                .message(message)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
