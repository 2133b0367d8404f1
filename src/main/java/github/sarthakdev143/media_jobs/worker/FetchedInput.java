package github.sarthakdev143.media_jobs.worker;

import github.sarthakdev143.media_jobs.model.MediaKind;

import java.nio.file.Path;

public record FetchedInput(String ref, Path path, MediaKind kind) {
}
