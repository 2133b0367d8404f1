package github.sarthakdev143.media_jobs.config;

import github.sarthakdev143.media_jobs.integration.storage.ArtifactStore;
import github.sarthakdev143.media_jobs.integration.storage.LocalArtifactStore;
import github.sarthakdev143.media_jobs.integration.storage.S3ArtifactStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@Configuration
public class StorageConfiguration {

    @Configuration
    @ConditionalOnProperty(name = "media-jobs.storage.type", havingValue = "s3")
    static class S3Storage {

        @Bean(destroyMethod = "close")
        S3Client s3Client(MediaJobsProperties properties) {
            return S3Client.builder()
                    .region(region(properties))
                    .build();
        }

        @Bean(destroyMethod = "close")
        S3Presigner s3Presigner(MediaJobsProperties properties) {
            return S3Presigner.builder()
                    .region(region(properties))
                    .build();
        }

        @Bean
        ArtifactStore artifactStore(S3Client s3Client, S3Presigner s3Presigner, MediaJobsProperties properties) {
            String bucket = properties.getStorage().getBucket();
            if (bucket == null || bucket.isBlank()) {
                throw new IllegalStateException(
                        "media-jobs.storage.bucket is required when media-jobs.storage.type=s3.");
            }
            return new S3ArtifactStore(s3Client, s3Presigner, bucket);
        }

        private Region region(MediaJobsProperties properties) {
            String region = properties.getStorage().getRegion();
            return Region.of(region == null || region.isBlank() ? "us-east-1" : region);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "media-jobs.storage.type", havingValue = "local", matchIfMissing = true)
    static class LocalStorage {

        @Bean
        ArtifactStore artifactStore(MediaJobsProperties properties) {
            return new LocalArtifactStore(properties.getStorage().getLocalRoot());
        }
    }
}
