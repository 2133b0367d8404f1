package github.sarthakdev143.media_jobs.integration.generation;

import java.nio.file.Path;

public record GenerationRequest(String prompt, Path firstFrameImage, String idempotencyKey) {

    public static String idempotencyKey(String jobId, int attempt) {
        return jobId + "-" + attempt;
    }
}
