package github.sarthakdev143.media_jobs.integration.storage;

import github.sarthakdev143.media_jobs.exception.ArtifactNotFoundException;
import github.sarthakdev143.media_jobs.exception.PermanentJobException;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

public class S3ArtifactStore implements ArtifactStore {

    private static final Logger logger = LoggerFactory.getLogger(S3ArtifactStore.class);
    private static final int PRECONDITION_FAILED = 412;

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final String bucket;

    public S3ArtifactStore(S3Client s3Client, S3Presigner presigner, String bucket) {
        this.s3Client = s3Client;
        this.presigner = presigner;
        this.bucket = bucket;
    }

    @Override
    public ArtifactRef put(String key, Path source, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .ifNoneMatch("*")
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromFile(source));
            logger.info("Uploaded {} to s3://{}/{}", source.getFileName(), bucket, key);
        } catch (S3Exception e) {
            if (e.statusCode() != PRECONDITION_FAILED) {
                throw new TransientInfraException("storage_unavailable", "Upload to s3://" + bucket + "/" + key + " failed.", e);
            }
            logger.info("Object s3://{}/{} already exists, keeping the stored copy", bucket, key);
        } catch (SdkClientException e) {
            throw new TransientInfraException("storage_unavailable", "Upload to s3://" + bucket + "/" + key + " failed.", e);
        }
        return ArtifactRef.s3(bucket, key);
    }

    @Override
    public void fetch(ArtifactRef ref, Path target) {
        requireSupported(ref);
        try {
            Files.deleteIfExists(target);
            s3Client.getObject(GetObjectRequest.builder().bucket(ref.bucket()).key(ref.key()).build(), target);
        } catch (NoSuchKeyException e) {
            throw new ArtifactNotFoundException(ref.uri(), e);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new ArtifactNotFoundException(ref.uri(), e);
            }
            if (e.statusCode() == 403) {
                throw new PermanentJobException("input_access_denied", "Access denied to " + ref.uri(), e);
            }
            throw new TransientInfraException("storage_unavailable", "Download of " + ref.uri() + " failed.", e);
        } catch (SdkClientException | IOException e) {
            throw new TransientInfraException("storage_unavailable", "Download of " + ref.uri() + " failed.", e);
        }
    }

    @Override
    public boolean exists(ArtifactRef ref) {
        requireSupported(ref);
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(ref.bucket()).key(ref.key()).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new TransientInfraException("storage_unavailable", "Lookup of " + ref.uri() + " failed.", e);
        } catch (SdkClientException e) {
            throw new TransientInfraException("storage_unavailable", "Lookup of " + ref.uri() + " failed.", e);
        }
    }

    @Override
    public String presignedUrl(ArtifactRef ref, Duration ttl) {
        requireSupported(ref);
        GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                .signatureDuration(ttl)
                .getObjectRequest(builder -> builder.bucket(ref.bucket()).key(ref.key()))
                .build();
        return presigner.presignGetObject(request).url().toString();
    }

    @Override
    public int deleteOlderThan(String prefix, Instant cutoff) {
        int deleted = 0;
        try {
            ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).build();
            for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
                if (object.lastModified() != null && object.lastModified().isBefore(cutoff)) {
                    s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(object.key()).build());
                    deleted++;
                }
            }
        } catch (S3Exception | SdkClientException e) {
            throw new TransientInfraException("storage_unavailable", "Retention sweep of s3://" + bucket + "/" + prefix + " failed.", e);
        }
        return deleted;
    }

    @Override
    public boolean supports(ArtifactRef ref) {
        return ArtifactRef.S3.equals(ref.scheme());
    }

    private void requireSupported(ArtifactRef ref) {
        if (!supports(ref)) {
            throw new PermanentJobException("foreign_artifact", "Artifact " + ref.uri() + " is not an S3 object.");
        }
    }
}
