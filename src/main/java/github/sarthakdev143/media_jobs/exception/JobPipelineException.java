package github.sarthakdev143.media_jobs.exception;

import github.sarthakdev143.media_jobs.model.ErrorClass;
import github.sarthakdev143.media_jobs.model.JobError;

import java.time.Instant;

/**
 * Failure raised while a job is processed. {@link #code()} is stored on the job record.
 */
public abstract class JobPipelineException extends RuntimeException {

    private final String code;

    protected JobPipelineException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected JobPipelineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public abstract ErrorClass errorClass();

    public String code() {
        return code;
    }

    public boolean isRetryable() {
        return errorClass().isRetryable();
    }

    public JobError toJobError(int attempt, Instant occurredAt) {
        return new JobError(errorClass(), code, getMessage(), attempt, occurredAt);
    }
}
