package github.sarthakdev143.media_jobs.integration.storage;

import github.sarthakdev143.media_jobs.exception.ArtifactNotFoundException;
import github.sarthakdev143.media_jobs.exception.PermanentJobException;
import github.sarthakdev143.media_jobs.model.ErrorClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalArtifactStoreTest {

    @TempDir
    Path tempDir;

    private LocalArtifactStore store;
    private Path root;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("artifacts");
        store = new LocalArtifactStore(root);
    }

    @Test
    void putThenFetchCopiesContent() throws Exception {
        Path source = Files.writeString(tempDir.resolve("source.mp4"), "video-bytes");

        ArtifactRef ref = store.put("outputs/job-1/output.mp4", source, "video/mp4");

        assertThat(ref.uri()).isEqualTo("local://outputs/job-1/output.mp4");
        assertThat(store.exists(ref)).isTrue();
        Path target = tempDir.resolve("fetched.mp4");
        store.fetch(ref, target);
        assertThat(Files.readString(target)).isEqualTo("video-bytes");
    }

    @Test
    void putIsWriteOnceForTheSameKey() throws Exception {
        Path first = Files.writeString(tempDir.resolve("first.mp4"), "first");
        Path second = Files.writeString(tempDir.resolve("second.mp4"), "second");

        store.put("outputs/job-1/output.mp4", first, "video/mp4");
        ArtifactRef ref = store.put("outputs/job-1/output.mp4", second, "video/mp4");

        assertThat(Files.readString(root.resolve("outputs/job-1/output.mp4"))).isEqualTo("first");
        assertThat(ref.key()).isEqualTo("outputs/job-1/output.mp4");
        try (var files = Files.list(root.resolve("outputs/job-1"))) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    void fetchOfMissingObjectIsPermanentNotFound() {
        assertThatThrownBy(() -> store.fetch(ArtifactRef.local("uploads/missing.jpg"), tempDir.resolve("x.jpg")))
                .isInstanceOf(ArtifactNotFoundException.class)
                .satisfies(e -> assertThat(((ArtifactNotFoundException) e).errorClass()).isEqualTo(ErrorClass.PERMANENT));
    }

    @Test
    void keysCannotEscapeTheRoot() {
        assertThatThrownBy(() -> store.resolve("../outside.txt"))
                .isInstanceOf(PermanentJobException.class);
    }

    @Test
    void s3ReferencesAreNotSupported() {
        ArtifactRef s3Ref = ArtifactRef.s3("bucket", "uploads/a.jpg");

        assertThat(store.supports(s3Ref)).isFalse();
        assertThatThrownBy(() -> store.exists(s3Ref)).isInstanceOf(PermanentJobException.class);
    }

    @Test
    void deleteOlderThanOnlyRemovesExpiredFilesUnderPrefix() throws Exception {
        Path source = Files.writeString(tempDir.resolve("source.mp4"), "bytes");
        store.put("outputs/old/output.mp4", source, "video/mp4");
        store.put("outputs/new/output.mp4", source, "video/mp4");
        store.put("uploads/old.jpg", source, "image/jpeg");
        Instant now = Instant.now();
        FileTime old = FileTime.from(now.minus(Duration.ofDays(10)));
        Files.setLastModifiedTime(root.resolve("outputs/old/output.mp4"), old);
        Files.setLastModifiedTime(root.resolve("uploads/old.jpg"), old);

        int deleted = store.deleteOlderThan("outputs/", now.minus(Duration.ofDays(7)));

        assertThat(deleted).isEqualTo(1);
        assertThat(root.resolve("outputs/old/output.mp4")).doesNotExist();
        assertThat(root.resolve("outputs/new/output.mp4")).exists();
        assertThat(root.resolve("uploads/old.jpg")).exists();
    }

    @Test
    void presignedUrlPointsAtStoredFile() throws Exception {
        Path source = Files.writeString(tempDir.resolve("source.mp4"), "bytes");
        ArtifactRef ref = store.put("outputs/job-1/output.mp4", source, "video/mp4");

        assertThat(store.presignedUrl(ref, Duration.ofMinutes(5))).startsWith("file:").endsWith("outputs/job-1/output.mp4");
    }
}
