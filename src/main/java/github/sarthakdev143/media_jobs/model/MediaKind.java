package github.sarthakdev143.media_jobs.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum MediaKind {
    IMAGE(Set.of(".jpg", ".jpeg", ".png")),
    VIDEO(Set.of(".mp4", ".mov", ".webm", ".mkv")),
    AUDIO(Set.of(".mp3", ".wav", ".aac", ".m4a", ".ogg"));

    private final Set<String> extensions;

    MediaKind(Set<String> extensions) {
        this.extensions = extensions;
    }

    public static Optional<MediaKind> fromFileName(String fileName) {
        String extension = extensionOf(fileName);
        if (extension.isEmpty()) {
            return Optional.empty();
        }
        for (MediaKind kind : values()) {
            if (kind.extensions.contains(extension)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        String path = fileName;
        int queryIndex = path.indexOf('?');
        if (queryIndex >= 0) {
            path = path.substring(0, queryIndex);
        }
        int slashIndex = path.lastIndexOf('/');
        int dotIndex = path.lastIndexOf('.');
        if (dotIndex < 0 || dotIndex < slashIndex || dotIndex == path.length() - 1) {
            return "";
        }
        return path.substring(dotIndex).toLowerCase(Locale.ROOT);
    }

    public boolean isVisual() {
        return this == IMAGE || this == VIDEO;
    }
}
