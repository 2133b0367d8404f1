package github.sarthakdev143.media_jobs.exception;

public class TransformTimeoutException extends TransientUpstreamException {

    public static final String CODE = "transform_timeout";

    public TransformTimeoutException(String message) {
        super(CODE, message);
    }
}
