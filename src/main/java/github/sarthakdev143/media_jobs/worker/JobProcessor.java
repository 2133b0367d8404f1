package github.sarthakdev143.media_jobs.worker;

import github.sarthakdev143.media_jobs.config.MediaJobsProperties;
import github.sarthakdev143.media_jobs.exception.JobPipelineException;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.exception.TransientUpstreamException;
import github.sarthakdev143.media_jobs.model.Delivery;
import github.sarthakdev143.media_jobs.model.Job;
import github.sarthakdev143.media_jobs.model.JobError;
import github.sarthakdev143.media_jobs.model.JobState;
import github.sarthakdev143.media_jobs.model.JobUpdate;
import github.sarthakdev143.media_jobs.queue.TaskQueue;
import github.sarthakdev143.media_jobs.store.JobRecordStore;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Drives one delivery through the job state machine.
 */
@Component
public class JobProcessor {

    private static final Logger logger = LoggerFactory.getLogger(JobProcessor.class);

    private final JobRecordStore store;
    private final TaskQueue queue;
    private final JobPipeline pipeline;
    private final Clock clock;
    private final Duration queuedTtl;
    private final Duration runningLease;
    private final Duration leaseRenewInterval;
    private final TaskScheduler taskScheduler;
    private final Retry infraRetry;
    private final Counter attemptsStartedCounter;
    private final Counter attemptsRetriedCounter;
    private final Counter succeededCounter;
    private final Counter failedCounter;
    private final Counter expiredCounter;
    private final Counter discardedCounter;

    public JobProcessor(
            JobRecordStore store,
            TaskQueue queue,
            JobPipeline pipeline,
            Clock clock,
            MediaJobsProperties properties,
            TaskScheduler taskScheduler,
            @Qualifier("infraRetry") Retry infraRetry,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.queue = queue;
        this.pipeline = pipeline;
        this.clock = clock;
        this.queuedTtl = properties.getJobs().getQueuedTtl();
        this.runningLease = properties.getJobs().getRunningLease();
        this.leaseRenewInterval = properties.getWorker().getLeaseRenewInterval();
        this.taskScheduler = taskScheduler;
        this.infraRetry = infraRetry;
        this.attemptsStartedCounter = meterRegistry.counter("media_jobs.attempts.started");
        this.attemptsRetriedCounter = meterRegistry.counter("media_jobs.attempts.retried");
        this.succeededCounter = meterRegistry.counter("media_jobs.jobs.finished", "outcome", "succeeded");
        this.failedCounter = meterRegistry.counter("media_jobs.jobs.finished", "outcome", "failed");
        this.expiredCounter = meterRegistry.counter("media_jobs.jobs.finished", "outcome", "expired");
        this.discardedCounter = meterRegistry.counter("media_jobs.deliveries.discarded");
    }

    public void process(Delivery delivery) {
        String jobId = delivery.jobId();
        Optional<Job> current = store.get(jobId);
        if (current.isEmpty() || current.get().state() != JobState.QUEUED) {
            logger.debug(
                    "Discarding delivery {} for job {} in state {}",
                    delivery.message().messageId(),
                    jobId,
                    current.map(Job::state).orElse(null));
            discard(delivery);
            return;
        }

        Job job = current.get();
        Instant now = clock.instant();
        // Queued TTL applies only to jobs that never started.
        if (job.attemptCount() == 0 && !job.createdAt().plus(queuedTtl).isAfter(now)) {
            expire(delivery, job, now);
            return;
        }

        int attempt = job.attemptCount() + 1;
        boolean claimed = attempt <= job.maxAttempts() && store.compareAndTransition(
                jobId,
                JobState.QUEUED,
                job.attemptCount(),
                JobState.RUNNING,
                JobUpdate.claim(attempt, now.plus(runningLease)));
        if (!claimed) {
            logger.debug("Job {} was claimed elsewhere, discarding delivery {}", jobId, delivery.message().messageId());
            discard(delivery);
            return;
        }

        attemptsStartedCounter.increment();
        logger.info("Job {} attempt {}/{} started (delivery attempt {})",
                jobId, attempt, job.maxAttempts(), delivery.message().deliveryAttempt());

        AttemptLease lease = new AttemptLease(store, jobId, attempt, clock, runningLease);
        ScheduledFuture<?> heartbeat = taskScheduler.scheduleAtFixedRate(
                lease::renew,
                now.plus(leaseRenewInterval),
                leaseRenewInterval);
        String outputRef;
        try {
            outputRef = pipeline.execute(job, lease);
        } catch (JobPipelineException e) {
            handleFailure(delivery, job, attempt, e);
            return;
        } catch (RuntimeException e) {
            handleFailure(delivery, job, attempt, new TransientUpstreamException(
                    "unexpected_error",
                    "Unexpected failure: " + e.getMessage(),
                    e));
            return;
        } finally {
            heartbeat.cancel(false);
        }

        boolean recorded = writeOutcome(() -> store.compareAndTransition(
                jobId,
                JobState.RUNNING,
                attempt,
                JobState.SUCCEEDED,
                JobUpdate.succeeded(outputRef)));
        if (recorded) {
            succeededCounter.increment();
            logger.info("Job {} succeeded on attempt {} with output {}", jobId, attempt, outputRef);
        } else {
            logger.warn("Job {} attempt {} finished but no longer owns the job, result not recorded", jobId, attempt);
        }
        queue.ack(delivery.token());
    }

    private void handleFailure(Delivery delivery, Job job, int attempt, JobPipelineException failure) {
        JobError error = failure.toJobError(attempt, clock.instant());

        if (failure.isRetryable() && attempt < job.maxAttempts()) {
            boolean released = writeOutcome(() -> store.compareAndTransition(
                    job.id(),
                    JobState.RUNNING,
                    attempt,
                    JobState.QUEUED,
                    JobUpdate.released()));
            if (released) {
                attemptsRetriedCounter.increment();
                logger.warn("Job {} attempt {}/{} failed with {}, requeueing: {}",
                        job.id(), attempt, job.maxAttempts(), failure.code(), failure.getMessage());
                queue.nack(delivery.token());
            } else {
                logger.warn("Job {} attempt {} failed after losing ownership, dropping delivery", job.id(), attempt);
                queue.ack(delivery.token());
            }
            return;
        }

        boolean failed = writeOutcome(() -> store.compareAndTransition(
                job.id(),
                JobState.RUNNING,
                attempt,
                JobState.FAILED,
                JobUpdate.failed(error)));
        if (failed) {
            failedCounter.increment();
            logger.error("Job {} failed on attempt {}/{} with {} ({})",
                    job.id(), attempt, job.maxAttempts(), failure.code(), failure.errorClass(), failure);
        } else {
            logger.warn("Job {} attempt {} failed after losing ownership, dropping delivery", job.id(), attempt);
        }
        queue.ack(delivery.token());
    }

    private void expire(Delivery delivery, Job job, Instant now) {
        boolean expired = store.compareAndTransition(
                job.id(),
                JobState.QUEUED,
                job.attemptCount(),
                JobState.EXPIRED,
                JobUpdate.failed(JobError.queuedTtlExceeded(job.attemptCount(), now)));
        if (expired) {
            expiredCounter.increment();
            logger.warn("Job {} expired after waiting in the queue since {}", job.id(), job.createdAt());
        }
        queue.ack(delivery.token());
    }

    private void discard(Delivery delivery) {
        discardedCounter.increment();
        queue.ack(delivery.token());
    }

    private boolean writeOutcome(Supplier<Boolean> write) {
        return Retry.decorateSupplier(infraRetry, write).get();
    }
}
