package github.sarthakdev143.media_jobs.integration.generation;

import java.nio.file.Path;

public interface ImageGenerationClient {

    /**
     * Renders a still image for {@code prompt} into {@code target}.
     *
     * @return {@code target}
     */
    Path generateImage(String prompt, Path target);
}
