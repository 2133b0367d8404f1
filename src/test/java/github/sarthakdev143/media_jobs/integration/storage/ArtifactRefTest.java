package github.sarthakdev143.media_jobs.integration.storage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactRefTest {

    @Test
    void parsesS3Uri() {
        ArtifactRef ref = ArtifactRef.parse("s3://media-bucket/uploads/a/scene.jpg");

        assertThat(ref.scheme()).isEqualTo(ArtifactRef.S3);
        assertThat(ref.bucket()).isEqualTo("media-bucket");
        assertThat(ref.key()).isEqualTo("uploads/a/scene.jpg");
        assertThat(ref.fileName()).isEqualTo("scene.jpg");
        assertThat(ref.uri()).isEqualTo("s3://media-bucket/uploads/a/scene.jpg");
    }

    @Test
    void parsesLocalUri() {
        ArtifactRef ref = ArtifactRef.parse("local://outputs/job-1/output.mp4");

        assertThat(ref.scheme()).isEqualTo(ArtifactRef.LOCAL);
        assertThat(ref.bucket()).isNull();
        assertThat(ref.uri()).isEqualTo("local://outputs/job-1/output.mp4");
    }

    @Test
    void parsesRegionalVirtualHostUrl() {
        assertThat(ArtifactRef.tryParse("https://media-bucket.s3.eu-west-1.amazonaws.com/uploads/clip.mp4"))
                .contains(ArtifactRef.s3("media-bucket", "uploads/clip.mp4"));
        assertThat(ArtifactRef.tryParse("https://media-bucket.s3.amazonaws.com/uploads/clip.mp4"))
                .contains(ArtifactRef.s3("media-bucket", "uploads/clip.mp4"));
    }

    @Test
    void leavesPresignedAndForeignUrlsToHttpDownload() {
        assertThat(ArtifactRef.tryParse("https://media-bucket.s3.amazonaws.com/uploads/clip.mp4?X-Amz-Signature=abc"))
                .isEmpty();
        assertThat(ArtifactRef.tryParse("https://cdn.example.com/clip.mp4")).isEmpty();
        assertThat(ArtifactRef.tryParse("http://media-bucket.s3.amazonaws.com/clip.mp4")).isEmpty();
    }

    @Test
    void rejectsIncompleteReferences() {
        assertThat(ArtifactRef.tryParse("s3://bucket-only")).isEmpty();
        assertThat(ArtifactRef.tryParse("s3://bucket/")).isEmpty();
        assertThat(ArtifactRef.tryParse("local://")).isEmpty();
        assertThat(ArtifactRef.tryParse("  ")).isEmpty();
        assertThatThrownBy(() -> ArtifactRef.parse("ftp://host/file.mp4"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
