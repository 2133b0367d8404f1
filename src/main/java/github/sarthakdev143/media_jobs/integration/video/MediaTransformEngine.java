package github.sarthakdev143.media_jobs.integration.video;

import java.nio.file.Path;

public interface MediaTransformEngine {

    /**
     * Renders the request into a single MP4 at {@code outputPath}. Intermediate files live in a
     * private work directory that is removed on every exit path.
     */
    void transform(TransformRequest request, Path outputPath);
}
