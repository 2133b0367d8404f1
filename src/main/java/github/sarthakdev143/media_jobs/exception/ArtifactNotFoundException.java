package github.sarthakdev143.media_jobs.exception;

public class ArtifactNotFoundException extends PermanentJobException {

    public static final String CODE = "input_not_found";

    public ArtifactNotFoundException(String ref) {
        super(CODE, "Input not found: " + ref);
    }

    public ArtifactNotFoundException(String ref, Throwable cause) {
        super(CODE, "Input not found: " + ref, cause);
    }
}
