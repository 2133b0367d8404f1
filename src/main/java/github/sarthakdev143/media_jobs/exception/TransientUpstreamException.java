package github.sarthakdev143.media_jobs.exception;

import github.sarthakdev143.media_jobs.model.ErrorClass;

public class TransientUpstreamException extends JobPipelineException {

    public TransientUpstreamException(String code, String message) {
        super(code, message);
    }

    public TransientUpstreamException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }

    @Override
    public ErrorClass errorClass() {
        return ErrorClass.TRANSIENT_UPSTREAM;
    }
}
