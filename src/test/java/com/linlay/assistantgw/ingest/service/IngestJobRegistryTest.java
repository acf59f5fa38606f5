package com.linlay.assistantgw.ingest.service;

import com.linlay.assistantgw.ingest.model.IngestJob;
import com.linlay.assistantgw.ingest.model.IngestJobStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class IngestJobRegistryTest {

    private final IngestJobRegistry registry =
            new IngestJobRegistry(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));

    @Test
    void createShouldStartRunningAtZero() {
        IngestJob job = registry.create(1000);

        assertThat(job.status()).isEqualTo(IngestJobStatus.RUNNING);
        assertThat(job.progress()).isZero();
        assertThat(job.error()).isNull();
        assertThat(job.jobId()).matches("^[0-9a-f]{32}$");
        assertThat(registry.get(job.jobId())).contains(job);
    }

    @Test
    void progressShouldFollowProcessedBytesAndStayBelowCompletion() {
        String jobId = registry.create(1000).jobId();

        registry.updateProgress(jobId, 500);
        assertThat(registry.get(jobId).orElseThrow().progress()).isEqualTo(0.5);

        registry.updateProgress(jobId, 2000);
        assertThat(registry.get(jobId).orElseThrow().progress()).isEqualTo(0.99);

        registry.markDone(jobId);
        IngestJob done = registry.get(jobId).orElseThrow();
        assertThat(done.status()).isEqualTo(IngestJobStatus.DONE);
        assertThat(done.progress()).isEqualTo(1.0);
    }

    @Test
    void progressShouldNeverDecrease() {
        String jobId = registry.create(1000).jobId();

        registry.updateProgress(jobId, 600);
        registry.updateProgress(jobId, 100);

        assertThat(registry.get(jobId).orElseThrow().progress()).isEqualTo(0.6);
    }

    @Test
    void zeroTotalShouldKeepProgressAtZeroUntilDone() {
        String jobId = registry.create(0).jobId();

        registry.updateProgress(jobId, 10);

        assertThat(registry.get(jobId).orElseThrow().progress()).isZero();
    }

    @Test
    void cancelShouldOnlyApplyToRunningJobs() {
        String jobId = registry.create(10).jobId();

        assertThat(registry.cancel(jobId)).isTrue();
        assertThat(registry.isCanceled(jobId)).isTrue();
        assertThat(registry.cancel(jobId)).isFalse();
        assertThat(registry.cancel("missing")).isFalse();
        assertThat(registry.cancel(null)).isFalse();
    }

    @Test
    void terminalJobsShouldIgnoreLaterTransitions() {
        String canceled = registry.create(10).jobId();
        registry.cancel(canceled);
        registry.markDone(canceled);
        registry.markError(canceled, "boom");
        registry.updateProgress(canceled, 10);

        IngestJob job = registry.get(canceled).orElseThrow();
        assertThat(job.status()).isEqualTo(IngestJobStatus.CANCELED);
        assertThat(job.error()).isNull();
        assertThat(job.progress()).isZero();

        String failed = registry.create(10).jobId();
        registry.markError(failed, "boom");
        registry.markDone(failed);

        assertThat(registry.get(failed).orElseThrow().status()).isEqualTo(IngestJobStatus.ERROR);
        assertThat(registry.get(failed).orElseThrow().error()).isEqualTo("boom");
    }

    @Test
    void unknownJobShouldBeAbsent() {
        assertThat(registry.get("missing")).isEmpty();
        assertThat(registry.get(null)).isEmpty();
        assertThat(registry.isCanceled("missing")).isFalse();
    }

    @Test
    void concurrentCreatesShouldYieldDistinctIds() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return registry.create(1).jobId();
                }));
            }
            start.countDown();
            Set<String> ids = new HashSet<>();
            for (Future<String> future : futures) {
                ids.add(future.get(5, TimeUnit.SECONDS));
            }
            assertThat(ids).hasSize(200);
        } finally {
            executor.shutdownNow();
        }
    }
}
