package github.sarthakdev143.media_jobs.integration.storage;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Durable object storage for job inputs and outputs.
 *
 * <p>Implementations throw {@link github.sarthakdev143.media_jobs.exception.ArtifactNotFoundException}
 * when a referenced object does not exist and
 * {@link github.sarthakdev143.media_jobs.exception.TransientInfraException} when the storage
 * backend cannot be reached.
 */
public interface ArtifactStore {

    /**
     * Stores {@code source} under {@code key}. Writes are write-once: when the key already holds
     * an object, that object is kept and its reference returned.
     */
    ArtifactRef put(String key, Path source, String contentType);

    void fetch(ArtifactRef ref, Path target);

    boolean exists(ArtifactRef ref);

    String presignedUrl(ArtifactRef ref, Duration ttl);

    /**
     * @return number of objects under {@code prefix} removed because they were last modified
     * before {@code cutoff}
     */
    int deleteOlderThan(String prefix, Instant cutoff);

    /** Whether this store can read {@code ref}. */
    boolean supports(ArtifactRef ref);
}
