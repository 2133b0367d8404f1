package github.sarthakdev143.media_jobs.store;

import github.sarthakdev143.media_jobs.model.Job;
import github.sarthakdev143.media_jobs.model.JobState;
import github.sarthakdev143.media_jobs.model.JobUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable mapping from job id to job state. {@link #compareAndTransition} is the only way to
 * change a stored job.
 */
public interface JobRecordStore {

    int ANY_ATTEMPT = -1;

    /**
     * Persists a new job.
     *
     * @throws IllegalStateException if a job with the same id already exists
     */
    String create(Job job);

    Optional<Job> get(String jobId);

    default boolean compareAndTransition(String jobId, JobState expectedState, JobState newState, JobUpdate update) {
        return compareAndTransition(jobId, expectedState, ANY_ATTEMPT, newState, update);
    }

    /**
     * Atomically moves the job to {@code newState} if it is currently in {@code expectedState}
     * and, unless {@code expectedAttempt} is {@link #ANY_ATTEMPT}, its attempt count equals
     * {@code expectedAttempt}. Refreshes {@code updatedAt} on success.
     *
     * @return {@code false}, leaving the record untouched, when the job is missing or does not match
     * @throws IllegalArgumentException if the edge is not part of the job state machine
     */
    boolean compareAndTransition(
            String jobId,
            JobState expectedState,
            int expectedAttempt,
            JobState newState,
            JobUpdate update);

    /**
     * Pushes the lease of a RUNNING job forward, provided it is still on {@code expectedAttempt}.
     *
     * @return {@code false} when the attempt no longer owns the job
     */
    boolean renewLease(String jobId, int expectedAttempt, Instant leaseExpiresAt);

    /** Queued jobs that entered QUEUED before {@code cutoff}, oldest first. */
    List<Job> findQueuedBefore(Instant cutoff, int limit);

    /** Running jobs whose lease ended before {@code now}. */
    List<Job> findRunningLeaseExpired(Instant now, int limit);

    /**
     * Drops terminal records last updated before {@code cutoff}.
     *
     * @return number of records removed
     */
    int purgeTerminalBefore(Instant cutoff);
}
