package github.sarthakdev143.media_jobs.worker;

import github.sarthakdev143.media_jobs.exception.ArtifactNotFoundException;
import github.sarthakdev143.media_jobs.exception.PermanentJobException;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.exception.TransientUpstreamException;
import github.sarthakdev143.media_jobs.integration.storage.ArtifactRef;
import github.sarthakdev143.media_jobs.integration.storage.ArtifactStore;
import github.sarthakdev143.media_jobs.model.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Copies job inputs into a work directory. Artifact-store references are read through the
 * {@link ArtifactStore}; any other {@code http(s)} URL is downloaded directly.
 */
@Component
public class InputFetcher {

    private static final Logger logger = LoggerFactory.getLogger(InputFetcher.class);
    static final String QUOTA_EXCEEDED_CODE = "temp_quota_exceeded";
    private static final int BUFFER_SIZE = 64 * 1024;

    private final ArtifactStore artifactStore;
    private final RestTemplate downloadRestTemplate;

    public InputFetcher(ArtifactStore artifactStore, @Qualifier("downloadRestTemplate") RestTemplate downloadRestTemplate) {
        this.artifactStore = artifactStore;
        this.downloadRestTemplate = downloadRestTemplate;
    }

    /**
     * @param maxBytes the work-directory space this input may still take
     */
    public FetchedInput fetch(String ref, Path workDir, int index, long maxBytes) {
        Optional<ArtifactRef> artifactRef = ArtifactRef.tryParse(ref);
        String fileName = artifactRef.map(ArtifactRef::key).orElse(ref);
        MediaKind kind = MediaKind.fromFileName(fileName)
                .orElseThrow(() -> new PermanentJobException("unsupported_format", "Unsupported input format: " + ref));
        Path target = workDir.resolve("input-" + index + MediaKind.extensionOf(fileName));

        if (artifactRef.isPresent() && artifactStore.supports(artifactRef.get())) {
            artifactStore.fetch(artifactRef.get(), target);
            long size = sizeOf(target);
            if (size > maxBytes) {
                deleteQuietly(target);
                throw quotaExceeded(ref, size, maxBytes);
            }
        } else if (isHttpUrl(ref)) {
            download(ref, target, maxBytes);
        } else {
            throw new PermanentJobException("invalid_input_ref", "Input reference cannot be resolved: " + ref);
        }

        logger.debug("Fetched input {} as {} ({})", ref, target.getFileName(), kind);
        return new FetchedInput(ref, target, kind);
    }

    public Path download(String url, Path target, long maxBytes) {
        try {
            downloadRestTemplate.execute(URI.create(url), HttpMethod.GET, null, response -> {
                long declared = response.getHeaders().getContentLength();
                if (declared > maxBytes) {
                    throw quotaExceeded(url, declared, maxBytes);
                }
                copyLimited(url, response.getBody(), target, maxBytes);
                return target;
            });
            return target;
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 404 || status == 410) {
                throw new ArtifactNotFoundException(url, e);
            }
            if (status == 401 || status == 403) {
                throw new PermanentJobException("input_access_denied", "Access denied to " + url, e);
            }
            if (status >= 400 && status < 500 && status != 408 && status != 429) {
                throw new PermanentJobException("input_rejected", "Download of " + url + " was rejected with HTTP " + status, e);
            }
            throw new TransientUpstreamException("input_unavailable", "Download of " + url + " failed with HTTP " + status, e);
        } catch (ResourceAccessException e) {
            throw new TransientUpstreamException("input_unreachable", "Download of " + url + " failed.", e);
        } catch (RestClientException e) {
            throw new TransientUpstreamException("input_unavailable", "Download of " + url + " failed.", e);
        } catch (IllegalArgumentException e) {
            throw new PermanentJobException("invalid_input_ref", "Malformed URL: " + url, e);
        }
    }

    private void copyLimited(String url, InputStream source, Path target, long maxBytes) throws IOException {
        long copied = 0;
        try (InputStream body = source; OutputStream out = Files.newOutputStream(target)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = body.read(buffer)) != -1) {
                copied += read;
                if (copied > maxBytes) {
                    break;
                }
                out.write(buffer, 0, read);
            }
        }
        if (copied > maxBytes) {
            deleteQuietly(target);
            throw quotaExceeded(url, copied, maxBytes);
        }
    }

    private static PermanentJobException quotaExceeded(String ref, long size, long maxBytes) {
        return new PermanentJobException(
                QUOTA_EXCEEDED_CODE,
                "Input " + ref + " needs at least " + size + " bytes, only " + maxBytes + " bytes of temp storage are left.");
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new TransientInfraException("temp_storage_unavailable", "Unable to measure " + path, e);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }

    static boolean isHttpUrl(String ref) {
        return ref.startsWith("https://") || ref.startsWith("http://");
    }
}
