package github.sarthakdev143.media_jobs.integration.storage;

import github.sarthakdev143.media_jobs.exception.ArtifactNotFoundException;
import github.sarthakdev143.media_jobs.exception.PermanentJobException;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Artifact store on the local filesystem. Presigned URLs are plain {@code file:} URIs.
 */
public class LocalArtifactStore implements ArtifactStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalArtifactStore.class);

    private final Path root;

    public LocalArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public ArtifactRef put(String key, Path source, String contentType) {
        Path target = resolve(key);
        Path staging = null;
        try {
            Files.createDirectories(target.getParent());
            staging = Files.createTempFile(target.getParent(), ".staging-", ".part");
            Files.copy(source, staging, StandardCopyOption.REPLACE_EXISTING);
            Files.move(staging, target);
            logger.info("Stored {} at local://{}", source.getFileName(), key);
        } catch (FileAlreadyExistsException e) {
            logger.info("Artifact local://{} already exists, keeping the stored copy", key);
        } catch (IOException e) {
            throw new TransientInfraException("storage_unavailable", "Unable to store local://" + key, e);
        } finally {
            deleteIfExists(staging);
        }
        return ArtifactRef.local(key);
    }

    @Override
    public void fetch(ArtifactRef ref, Path target) {
        Path source = resolve(requireSupported(ref).key());
        try {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(ref.uri(), e);
        } catch (IOException e) {
            throw new TransientInfraException("storage_unavailable", "Unable to read " + ref.uri(), e);
        }
    }

    @Override
    public boolean exists(ArtifactRef ref) {
        return Files.isRegularFile(resolve(requireSupported(ref).key()));
    }

    @Override
    public String presignedUrl(ArtifactRef ref, Duration ttl) {
        return resolve(requireSupported(ref).key()).toUri().toString();
    }

    @Override
    public int deleteOlderThan(String prefix, Instant cutoff) {
        Path base = resolve(prefix);
        if (!Files.isDirectory(base)) {
            return 0;
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(base)) {
            files = walk.filter(Files::isRegularFile).collect(Collectors.toList());
        } catch (IOException e) {
            throw new TransientInfraException("storage_unavailable", "Unable to list local://" + prefix, e);
        }

        int deleted = 0;
        for (Path file : files) {
            try {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                    Files.deleteIfExists(file);
                    deleted++;
                }
            } catch (IOException e) {
                logger.warn("Unable to remove expired artifact {}", file, e);
            }
        }
        return deleted;
    }

    @Override
    public boolean supports(ArtifactRef ref) {
        return ArtifactRef.LOCAL.equals(ref.scheme());
    }

    Path resolve(String key) {
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new PermanentJobException("invalid_artifact_key", "Artifact key escapes the storage root: " + key);
        }
        return resolved;
    }

    private ArtifactRef requireSupported(ArtifactRef ref) {
        if (!supports(ref)) {
            throw new PermanentJobException("foreign_artifact", "Artifact " + ref.uri() + " is not stored locally.");
        }
        return ref;
    }

    private void deleteIfExists(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
