package github.sarthakdev143.media_jobs.model;

public enum JobState {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == EXPIRED;
    }

    public boolean canTransitionTo(JobState next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == EXPIRED;
            case RUNNING -> next == SUCCEEDED || next == FAILED || next == QUEUED;
            case SUCCEEDED, FAILED, EXPIRED -> false;
        };
    }
}
