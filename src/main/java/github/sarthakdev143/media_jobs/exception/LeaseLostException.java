package github.sarthakdev143.media_jobs.exception;

public class LeaseLostException extends TransientInfraException {

    public static final String CODE = "lease_lost";

    public LeaseLostException(String jobId, int attempt) {
        super(CODE, "Attempt " + attempt + " of job " + jobId + " no longer owns the job.");
    }
}
