package github.sarthakdev143.media_jobs.model;

public enum ErrorClass {
    TRANSIENT_INFRA,
    TRANSIENT_UPSTREAM,
    PERMANENT,
    EXPIRED;

    public boolean isRetryable() {
        return this == TRANSIENT_INFRA || this == TRANSIENT_UPSTREAM;
    }
}
