package github.sarthakdev143.media_jobs.worker;

import github.sarthakdev143.media_jobs.config.MediaJobsProperties;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.integration.storage.ArtifactStore;
import github.sarthakdev143.media_jobs.model.ErrorClass;
import github.sarthakdev143.media_jobs.model.Job;
import github.sarthakdev143.media_jobs.model.JobError;
import github.sarthakdev143.media_jobs.model.JobState;
import github.sarthakdev143.media_jobs.model.JobUpdate;
import github.sarthakdev143.media_jobs.queue.TaskQueue;
import github.sarthakdev143.media_jobs.store.JobRecordStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
@ConditionalOnProperty(name = "media-jobs.worker.enabled", havingValue = "true", matchIfMissing = true)
public class JobReaper {

    private static final Logger logger = LoggerFactory.getLogger(JobReaper.class);
    static final String LEASE_EXPIRED_CODE = "worker_lease_expired";

    private final JobRecordStore store;
    private final TaskQueue queue;
    private final ArtifactStore artifactStore;
    private final Clock clock;
    private final MediaJobsProperties properties;
    private final Counter expiredCounter;
    private final Counter failedCounter;

    public JobReaper(
            JobRecordStore store,
            TaskQueue queue,
            ArtifactStore artifactStore,
            Clock clock,
            MediaJobsProperties properties,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.queue = queue;
        this.artifactStore = artifactStore;
        this.clock = clock;
        this.properties = properties;
        this.expiredCounter = meterRegistry.counter("media_jobs.jobs.finished", "outcome", "expired");
        this.failedCounter = meterRegistry.counter("media_jobs.jobs.finished", "outcome", "failed");
    }

    @Scheduled(
            initialDelayString = "${media-jobs.worker.reaper-interval-ms:30000}",
            fixedDelayString = "${media-jobs.worker.reaper-interval-ms:30000}")
    public void sweep() {
        Instant now = clock.instant();
        int batchSize = properties.getWorker().getReaperBatchSize();

        try {
            queue.requeueExpiredDeliveries();
            int expired = expireQueued(now, batchSize);
            int recovered = recoverLeases(now, batchSize);
            int purged = store.purgeTerminalBefore(now.minus(properties.getJobs().getRetention()));
            int artifactsDeleted = purgeArtifacts(now);
            if (expired + recovered + purged + artifactsDeleted > 0) {
                logger.info("Reaper expired={} recovered={} purged={} artifactsDeleted={}",
                        expired, recovered, purged, artifactsDeleted);
            }
        } catch (TransientInfraException e) {
            logger.warn("Reaper sweep interrupted by {}: {}", e.code(), e.getMessage());
        }
    }

    int expireQueued(Instant now, int batchSize) {
        int expired = 0;
        for (Job job : store.findQueuedBefore(now.minus(properties.getJobs().getQueuedTtl()), batchSize)) {
            if (job.attemptCount() > 0) {
                // Requeued after a failed attempt; bounded by maxAttempts.
                continue;
            }
            boolean moved = store.compareAndTransition(
                    job.id(),
                    JobState.QUEUED,
                    job.attemptCount(),
                    JobState.EXPIRED,
                    JobUpdate.failed(JobError.queuedTtlExceeded(job.attemptCount(), now)));
            if (moved) {
                expired++;
                expiredCounter.increment();
                logger.warn("Job {} expired after waiting in the queue since {}", job.id(), job.createdAt());
            }
        }
        return expired;
    }

    int recoverLeases(Instant now, int batchSize) {
        int recovered = 0;
        for (Job job : store.findRunningLeaseExpired(now, batchSize)) {
            if (job.attemptsExhausted()) {
                JobError error = new JobError(
                        ErrorClass.TRANSIENT_INFRA,
                        LEASE_EXPIRED_CODE,
                        "Worker stopped responding during the final attempt.",
                        job.attemptCount(),
                        now);
                if (store.compareAndTransition(job.id(), JobState.RUNNING, job.attemptCount(), JobState.FAILED, JobUpdate.failed(error))) {
                    failedCounter.increment();
                    logger.error("Job {} failed: lease of attempt {} expired with no attempts left", job.id(), job.attemptCount());
                    recovered++;
                }
                continue;
            }

            if (store.compareAndTransition(job.id(), JobState.RUNNING, job.attemptCount(), JobState.QUEUED, JobUpdate.released())) {
                queue.enqueue(job.id());
                logger.warn("Job {} lease of attempt {} expired, requeued", job.id(), job.attemptCount());
                recovered++;
            }
        }
        return recovered;
    }

    int purgeArtifacts(Instant now) {
        MediaJobsProperties.Storage storage = properties.getStorage();
        if (storage.getArtifactRetention().isZero() || storage.getArtifactRetention().isNegative()) {
            return 0;
        }
        Instant cutoff = now.minus(storage.getArtifactRetention());
        return artifactStore.deleteOlderThan(storage.getOutputPrefix(), cutoff)
                + artifactStore.deleteOlderThan(storage.getUploadPrefix(), cutoff);
    }
}
