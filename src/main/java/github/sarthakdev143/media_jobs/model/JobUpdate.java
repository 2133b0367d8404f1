package github.sarthakdev143.media_jobs.model;

import java.time.Instant;

/**
 * Field changes applied together with a state transition. Fields that do not belong to the
 * target state are dropped by {@link Job#transitionTo}.
 */
public record JobUpdate(
        Integer attemptCount,
        String outputRef,
        JobError error,
        Instant leaseExpiresAt) {

    public static JobUpdate claim(int attemptCount, Instant leaseExpiresAt) {
        return new JobUpdate(attemptCount, null, null, leaseExpiresAt);
    }

    public static JobUpdate succeeded(String outputRef) {
        return new JobUpdate(null, outputRef, null, null);
    }

    public static JobUpdate failed(JobError error) {
        return new JobUpdate(null, null, error, null);
    }

    public static JobUpdate released() {
        return new JobUpdate(null, null, null, null);
    }
}
