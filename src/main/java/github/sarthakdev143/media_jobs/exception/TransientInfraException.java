package github.sarthakdev143.media_jobs.exception;

import github.sarthakdev143.media_jobs.model.ErrorClass;

public class TransientInfraException extends JobPipelineException {

    public TransientInfraException(String code, String message) {
        super(code, message);
    }

    public TransientInfraException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }

    @Override
    public ErrorClass errorClass() {
        return ErrorClass.TRANSIENT_INFRA;
    }
}
