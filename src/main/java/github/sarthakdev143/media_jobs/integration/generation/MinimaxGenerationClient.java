package github.sarthakdev143.media_jobs.integration.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import github.sarthakdev143.media_jobs.config.MediaJobsProperties;
import github.sarthakdev143.media_jobs.exception.JobPipelineException;
import github.sarthakdev143.media_jobs.exception.PermanentJobException;
import github.sarthakdev143.media_jobs.exception.TransientUpstreamException;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Image-to-video client for the MiniMax API: submit a generation task, poll it until it settles,
 * then resolve the produced file to a download URL.
 */
@Component
public class MinimaxGenerationClient implements GenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(MinimaxGenerationClient.class);

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";
    private static final long MAX_FIRST_FRAME_BYTES = 20L * 1024 * 1024;
    private static final double MIN_ASPECT_RATIO = 0.4;
    private static final double MAX_ASPECT_RATIO = 2.5;
    private static final int MIN_SHORT_SIDE_PX = 300;

    private static final Set<String> PENDING_STATUSES = Set.of("Queueing", "Preparing", "Processing");
    private static final Set<Integer> AUTH_STATUS_CODES = Set.of(1004, 1008);
    private static final Set<Integer> INVALID_REQUEST_STATUS_CODES = Set.of(1026, 2013);
    private static final int RATE_LIMIT_STATUS_CODE = 1002;

    private final RestTemplate restTemplate;
    private final Retry retry;
    private final ObjectMapper objectMapper;
    private final MediaJobsProperties.Generation settings;

    public MinimaxGenerationClient(
            @Qualifier("generationRestTemplate") RestTemplate restTemplate,
            @Qualifier("generationRetry") Retry retry,
            ObjectMapper objectMapper,
            MediaJobsProperties properties) {
        this.restTemplate = restTemplate;
        this.retry = retry;
        this.objectMapper = objectMapper;
        this.settings = properties.getGeneration();
    }

    @Override
    public ContentRef generate(GenerationRequest request) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new PermanentJobException("generation_not_configured", "No generation API key is configured.");
        }
        if (request.firstFrameImage() == null) {
            throw new PermanentJobException("first_frame_required", "Image-to-video generation needs a first frame image.");
        }

        String taskId = submit(request);
        logger.info("Submitted generation task {} (idempotency key {})", taskId, request.idempotencyKey());

        String fileId = awaitCompletion(taskId);
        String downloadUrl = retrieveDownloadUrl(fileId);
        logger.info("Generation task {} produced file {}", taskId, fileId);
        return new ContentRef(taskId, fileId, downloadUrl);
    }

    private String submit(GenerationRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.getModel());
        body.put("prompt", request.prompt());
        body.put("first_frame_image", encodeFirstFrame(request.firstFrameImage()));
        body.put("prompt_optimizer", true);

        HttpHeaders headers = authorizedHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(IDEMPOTENCY_HEADER, request.idempotencyKey());

        String url = settings.getBaseUrl() + "/video_generation";
        JsonNode response = call("submit", () -> exchange(url, HttpMethod.POST, new HttpEntity<>(toJson(body), headers)));
        String taskId = response.path("task_id").asText("");
        if (taskId.isBlank()) {
            throw new TransientUpstreamException("generation_bad_response", "Generation API returned no task_id.");
        }
        return taskId;
    }

    private String awaitCompletion(String taskId) {
        String url = UriComponentsBuilder.fromUriString(settings.getBaseUrl() + "/query/video_generation")
                .queryParam("task_id", taskId)
                .toUriString();

        for (int poll = 1; poll <= settings.getMaxPolls(); poll++) {
            pause(settings.getPollInterval());
            JsonNode response = call("poll", () -> exchange(url, HttpMethod.GET, new HttpEntity<>(authorizedHeaders())));
            String status = response.path("status").asText("");
            logger.debug("Generation task {} status {} (poll {}/{})", taskId, status, poll, settings.getMaxPolls());

            if ("Success".equals(status)) {
                String fileId = response.path("file_id").asText("");
                if (fileId.isBlank()) {
                    throw new TransientUpstreamException("generation_bad_response", "Task " + taskId + " succeeded without a file_id.");
                }
                return fileId;
            }
            if (!PENDING_STATUSES.contains(status)) {
                throw new TransientUpstreamException(
                        "generation_failed",
                        "Generation task " + taskId + " ended with status " + (status.isBlank() ? "<none>" : status) + ".");
            }
        }

        throw new TransientUpstreamException(
                "generation_timeout",
                "Generation task " + taskId + " did not finish after " + settings.getMaxPolls() + " polls.");
    }

    private String retrieveDownloadUrl(String fileId) {
        String url = UriComponentsBuilder.fromUriString(settings.getBaseUrl() + "/files/retrieve")
                .queryParam("file_id", fileId)
                .toUriString();
        JsonNode response = call("retrieve", () -> exchange(url, HttpMethod.GET, new HttpEntity<>(authorizedHeaders())));
        String downloadUrl = response.path("file").path("download_url").asText("");
        if (downloadUrl.isBlank()) {
            throw new TransientUpstreamException("generation_bad_response", "No download_url returned for file " + fileId + ".");
        }
        return downloadUrl;
    }

    private JsonNode call(String stage, Supplier<JsonNode> operation) {
        try {
            return retry.executeSupplier(operation);
        } catch (JobPipelineException e) {
            logger.warn("Generation {} call failed with {}: {}", stage, e.code(), e.getMessage());
            throw e;
        }
    }

    private JsonNode exchange(String url, HttpMethod method, HttpEntity<String> entity) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, method, entity, String.class);
        } catch (RestClientResponseException e) {
            throw classifyHttpStatus(e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new TransientUpstreamException("generation_unreachable", "Generation API could not be reached.", e);
        } catch (RestClientException e) {
            throw new TransientUpstreamException("generation_unavailable", "Generation API call failed.", e);
        }

        JsonNode body = parse(response.getBody());
        JsonNode baseResp = body.path("base_resp");
        int statusCode = baseResp.path("status_code").asInt(-1);
        if (statusCode != 0) {
            throw classifyBaseStatus(statusCode, baseResp.path("status_msg").asText("Unknown error"));
        }
        return body;
    }

    static JobPipelineException classifyHttpStatus(int status, Throwable cause) {
        if (status == 401 || status == 403) {
            return new PermanentJobException("generation_auth_failed", "Generation API rejected the credentials (HTTP " + status + ").", cause);
        }
        if (status == 400 || status == 404 || status == 422) {
            return new PermanentJobException("generation_invalid_request", "Generation API rejected the request (HTTP " + status + ").", cause);
        }
        if (status == 429) {
            return new TransientUpstreamException("generation_rate_limited", "Generation API rate limit hit.", cause);
        }
        return new TransientUpstreamException("generation_unavailable", "Generation API answered HTTP " + status + ".", cause);
    }

    static JobPipelineException classifyBaseStatus(int statusCode, String message) {
        String detail = "Generation API status " + statusCode + ": " + message;
        if (AUTH_STATUS_CODES.contains(statusCode)) {
            return new PermanentJobException("generation_auth_failed", detail);
        }
        if (INVALID_REQUEST_STATUS_CODES.contains(statusCode)) {
            return new PermanentJobException("generation_invalid_request", detail);
        }
        if (statusCode == RATE_LIMIT_STATUS_CODE) {
            return new TransientUpstreamException("generation_rate_limited", detail);
        }
        return new TransientUpstreamException("generation_error", detail);
    }

    /**
     * The API accepts JPG or PNG up to 20MB, aspect ratio between 2:5 and 5:2 and a short side
     * above 300px.
     */
    String encodeFirstFrame(Path image) {
        String fileName = image.getFileName().toString().toLowerCase(Locale.ROOT);
        String mime;
        if (fileName.endsWith(".jpg") || fileName.endsWith(".jpeg")) {
            mime = "image/jpeg";
        } else if (fileName.endsWith(".png")) {
            mime = "image/png";
        } else {
            throw new PermanentJobException("invalid_first_frame", "First frame must be a JPG or PNG image.");
        }

        try {
            long size = Files.size(image);
            if (size > MAX_FIRST_FRAME_BYTES) {
                throw new PermanentJobException("invalid_first_frame", "First frame exceeds the 20MB limit (" + size + " bytes).");
            }

            BufferedImage decoded = ImageIO.read(image.toFile());
            if (decoded == null) {
                throw new PermanentJobException("unsupported_input", "First frame is not a readable image.");
            }
            double aspectRatio = (double) decoded.getWidth() / decoded.getHeight();
            if (aspectRatio < MIN_ASPECT_RATIO || aspectRatio > MAX_ASPECT_RATIO) {
                throw new PermanentJobException("invalid_first_frame", "First frame aspect ratio must be between 2:5 and 5:2.");
            }
            if (Math.min(decoded.getWidth(), decoded.getHeight()) <= MIN_SHORT_SIDE_PX) {
                throw new PermanentJobException("invalid_first_frame", "First frame shorter side must exceed " + MIN_SHORT_SIDE_PX + " pixels.");
            }

            return "data:" + mime + ";base64," + Base64.getEncoder().encodeToString(Files.readAllBytes(image));
        } catch (IOException e) {
            throw new PermanentJobException("unsupported_input", "First frame could not be read.", e);
        }
    }

    private HttpHeaders authorizedHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(settings.getApiKey());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new TransientUpstreamException("generation_bad_response", "Generation API returned an empty body.");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransientUpstreamException("generation_bad_response", "Generation API returned malformed JSON.", e);
        }
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize generation request.", e);
        }
    }

    private void pause(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            return;
        }
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientUpstreamException("generation_interrupted", "Interrupted while waiting for the generation task.");
        }
    }
}
