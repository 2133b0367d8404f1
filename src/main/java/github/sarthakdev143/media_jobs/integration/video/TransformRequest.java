package github.sarthakdev143.media_jobs.integration.video;

import github.sarthakdev143.media_jobs.model.JobParams;
import github.sarthakdev143.media_jobs.model.MediaKind;

import java.nio.file.Path;
import java.util.List;

/**
 * @param scenes     visual inputs in playback order
 * @param audioInput optional background track, looped or cut to the length of the visuals
 */
public record TransformRequest(List<Scene> scenes, Path audioInput, JobParams params) {

    public TransformRequest {
        scenes = scenes == null ? List.of() : List.copyOf(scenes);
    }

    public record Scene(Path source, MediaKind kind) {
    }
}
