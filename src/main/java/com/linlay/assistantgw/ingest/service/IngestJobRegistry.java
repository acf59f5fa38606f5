package com.linlay.assistantgw.ingest.service;

import com.linlay.assistantgw.ingest.model.IngestJob;
import com.linlay.assistantgw.ingest.model.IngestJobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 摄取任务的进程内状态表。
 * <p>
 * 每个操作都在同一把锁内完成；对外只返回快照。状态只能从 running 迁移到
 * done / error / canceled，三者均为终态。重启后状态丢失。
 */
public class IngestJobRegistry {

    static final double RUNNING_PROGRESS_CEILING = 0.99;

    private static final Logger log = LoggerFactory.getLogger(IngestJobRegistry.class);

    private final Map<String, JobEntry> jobs = new HashMap<>();
    private final Object lock = new Object();
    private final Clock clock;

    public IngestJobRegistry() {
        this(Clock.systemUTC());
    }

    public IngestJobRegistry(Clock clock) {
        this.clock = clock;
    }

    public IngestJob create(long totalBytes) {
        if (totalBytes < 0) {
            throw new IllegalArgumentException("totalBytes must be non-negative");
        }
        Instant now = clock.instant();
        synchronized (lock) {
            String jobId = nextJobId();
            JobEntry entry = new JobEntry(jobId, totalBytes, now);
            jobs.put(jobId, entry);
            return entry.snapshot();
        }
    }

    public Optional<IngestJob> get(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            JobEntry entry = jobs.get(jobId);
            return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
        }
    }

    public void updateProgress(String jobId, long processedBytes) {
        Instant now = clock.instant();
        synchronized (lock) {
            JobEntry entry = jobs.get(jobId);
            if (entry == null || entry.status != IngestJobStatus.RUNNING) {
                return;
            }
            entry.processedBytes = processedBytes;
            if (entry.totalBytes > 0) {
                double candidate = Math.min((double) processedBytes / entry.totalBytes, RUNNING_PROGRESS_CEILING);
                entry.progress = Math.max(entry.progress, candidate);
            }
            entry.updatedAt = now;
        }
    }

    public void markDone(String jobId) {
        Instant now = clock.instant();
        synchronized (lock) {
            JobEntry entry = runningEntry(jobId, "done");
            if (entry == null) {
                return;
            }
            entry.status = IngestJobStatus.DONE;
            entry.progress = 1.0;
            entry.updatedAt = now;
        }
    }

    public void markError(String jobId, String message) {
        Instant now = clock.instant();
        synchronized (lock) {
            JobEntry entry = runningEntry(jobId, "error");
            if (entry == null) {
                return;
            }
            entry.status = IngestJobStatus.ERROR;
            entry.error = message;
            entry.updatedAt = now;
        }
    }

    public boolean cancel(String jobId) {
        if (jobId == null) {
            return false;
        }
        Instant now = clock.instant();
        synchronized (lock) {
            JobEntry entry = jobs.get(jobId);
            if (entry == null || entry.status != IngestJobStatus.RUNNING) {
                return false;
            }
            entry.status = IngestJobStatus.CANCELED;
            entry.updatedAt = now;
            return true;
        }
    }

    public boolean isCanceled(String jobId) {
        synchronized (lock) {
            JobEntry entry = jobs.get(jobId);
            return entry != null && entry.status == IngestJobStatus.CANCELED;
        }
    }

    private JobEntry runningEntry(String jobId, String target) {
        JobEntry entry = jobs.get(jobId);
        if (entry == null) {
            return null;
        }
        if (entry.status.isTerminal()) {
            log.debug("ignore transition to {} for terminal job jobId={} status={}", target, jobId, entry.status.value());
            return null;
        }
        return entry;
    }

    private String nextJobId() {
        String jobId;
        do {
            jobId = UUID.randomUUID().toString().replace("-", "");
        } while (jobs.containsKey(jobId));
        return jobId;
    }

    private static final class JobEntry {
        private final String jobId;
        private final long totalBytes;
        private final Instant createdAt;
        private IngestJobStatus status = IngestJobStatus.RUNNING;
        private double progress;
        private String error;
        private long processedBytes;
        private Instant updatedAt;

        private JobEntry(String jobId, long totalBytes, Instant createdAt) {
            this.jobId = jobId;
            this.totalBytes = totalBytes;
            this.createdAt = createdAt;
            this.updatedAt = createdAt;
        }

        private IngestJob snapshot() {
            return new IngestJob(jobId, status, progress, error, totalBytes, processedBytes, createdAt, updatedAt);
        }
    }
}
