package github.sarthakdev143.media_jobs.exception;

import github.sarthakdev143.media_jobs.model.ErrorClass;

public class PermanentJobException extends JobPipelineException {

    public PermanentJobException(String code, String message) {
        super(code, message);
    }

    public PermanentJobException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }

    @Override
    public ErrorClass errorClass() {
        return ErrorClass.PERMANENT;
    }
}
