package com.forecastaccuracy.service;

import com.forecastaccuracy.dto.AsyncJobResponse;
import com.forecastaccuracy.dto.AsyncJobStatus;
import com.forecastaccuracy.exception.JobNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsyncJobServiceTest {

    private final AsyncJobService service = new AsyncJobService();

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(service, "poolSize", 2);
        ReflectionTestUtils.setField(service, "maxRetained", 10);
        service.init();
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private AsyncJobResponse awaitFinished(UUID jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        AsyncJobResponse job = service.getJob(jobId);
        while (job.getStatus() != AsyncJobStatus.COMPLETED && job.getStatus() != AsyncJobStatus.FAILED
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            job = service.getJob(jobId);
        }
        return job;
    }

    @Test
    void submit_completedJobCarriesResult() throws InterruptedException {
        UUID jobId = service.submit("TEST", "req-1", progress -> "done");

        AsyncJobResponse job = awaitFinished(jobId);

        assertThat(job.getStatus()).isEqualTo(AsyncJobStatus.COMPLETED);
        assertThat(job.getResult()).isEqualTo("done");
        assertThat(job.getProgressPercent()).isEqualTo(100);
        assertThat(job.getRequestId()).isEqualTo("req-1");
    }

    @Test
    void submit_failingJobRecordsReason() throws InterruptedException {
        UUID jobId = service.submit("TEST", "req-2", progress -> {
            throw new IllegalStateException("upstream gone");
        });

        AsyncJobResponse job = awaitFinished(jobId);

        assertThat(job.getStatus()).isEqualTo(AsyncJobStatus.FAILED);
        assertThat(job.getMessage()).isEqualTo("upstream gone");
    }

    @Test
    void submit_progressIsVisibleWhileRunning() throws InterruptedException {
        CountDownLatch reported = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        UUID jobId = service.submit("TEST", "req-3", progress -> {
            progress.report("Fetching forecast", 40);
            reported.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "ok";
        });

        assertThat(reported.await(5, TimeUnit.SECONDS)).isTrue();
        AsyncJobResponse running = service.getJob(jobId);
        assertThat(running.getStatus()).isEqualTo(AsyncJobStatus.RUNNING);
        assertThat(running.getMessage()).isEqualTo("Fetching forecast");
        assertThat(running.getProgressPercent()).isEqualTo(40);

        release.countDown();
        assertThat(awaitFinished(jobId).getStatus()).isEqualTo(AsyncJobStatus.COMPLETED);
    }

    @Test
    void getJob_unknownId_throws() {
        assertThatThrownBy(() -> service.getJob(UUID.randomUUID()))
            .isInstanceOf(JobNotFoundException.class);
    }
}
