package github.sarthakdev143.media_jobs.model;

import java.time.Instant;

public record JobError(
        ErrorClass errorClass,
        String code,
        String message,
        int attempt,
        Instant occurredAt) {

    public static final String QUEUED_TTL_EXCEEDED = "queued_ttl_exceeded";

    public static JobError queuedTtlExceeded(int attempt, Instant occurredAt) {
        return new JobError(
                ErrorClass.EXPIRED,
                QUEUED_TTL_EXCEEDED,
                "Job was not picked up before its queue time-to-live elapsed.",
                attempt,
                occurredAt);
    }
}
