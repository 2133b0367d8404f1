package github.sarthakdev143.media_jobs.model;

import java.time.Instant;
import java.util.List;

/** Authoritative state of a single media job. */
public record Job(
        String id,
        JobState state,
        List<String> inputRefs,
        JobParams params,
        String outputRef,
        JobError error,
        int attemptCount,
        int maxAttempts,
        Instant createdAt,
        Instant updatedAt,
        Instant leaseExpiresAt,
        long version) {

    public Job {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Job id is required.");
        }
        if (state == null) {
            throw new IllegalArgumentException("Job state is required.");
        }
        inputRefs = inputRefs == null ? List.of() : List.copyOf(inputRefs);
        if ((outputRef != null) != (state == JobState.SUCCEEDED)) {
            throw new IllegalStateException("outputRef must be set only for SUCCEEDED jobs, job " + id + " is " + state);
        }
        boolean errorState = state == JobState.FAILED || state == JobState.EXPIRED;
        if ((error != null) != errorState) {
            throw new IllegalStateException("error must be set only for FAILED or EXPIRED jobs, job " + id + " is " + state);
        }
        if ((leaseExpiresAt != null) != (state == JobState.RUNNING)) {
            throw new IllegalStateException("leaseExpiresAt must be set only for RUNNING jobs, job " + id + " is " + state);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1.");
        }
        if (attemptCount < 0 || attemptCount > maxAttempts) {
            throw new IllegalStateException(
                    "attemptCount " + attemptCount + " is outside 0.." + maxAttempts + " for job " + id);
        }
    }

    public static Job queued(String id, List<String> inputRefs, JobParams params, int maxAttempts, Instant now) {
        return new Job(id, JobState.QUEUED, inputRefs, params, null, null, 0, maxAttempts, now, now, null, 0L);
    }

    public Job transitionTo(JobState next, JobUpdate update, Instant now) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalArgumentException("Illegal job transition " + state + " -> " + next + " for job " + id);
        }
        JobUpdate changes = update == null ? JobUpdate.released() : update;
        int nextAttemptCount = changes.attemptCount() == null ? attemptCount : changes.attemptCount();
        return new Job(
                id,
                next,
                inputRefs,
                params,
                next == JobState.SUCCEEDED ? changes.outputRef() : null,
                next == JobState.FAILED || next == JobState.EXPIRED ? changes.error() : null,
                nextAttemptCount,
                maxAttempts,
                createdAt,
                now,
                next == JobState.RUNNING ? changes.leaseExpiresAt() : null,
                version + 1);
    }

    public Job withLease(Instant newLeaseExpiresAt) {
        if (state != JobState.RUNNING) {
            throw new IllegalStateException("Only RUNNING jobs hold a lease, job " + id + " is " + state);
        }
        return new Job(
                id,
                state,
                inputRefs,
                params,
                outputRef,
                error,
                attemptCount,
                maxAttempts,
                createdAt,
                updatedAt,
                newLeaseExpiresAt,
                version + 1);
    }

    public boolean attemptsExhausted() {
        return attemptCount >= maxAttempts;
    }
}
