package github.sarthakdev143.media_jobs.integration.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import github.sarthakdev143.media_jobs.config.MediaJobsProperties;
import github.sarthakdev143.media_jobs.exception.JobPipelineException;
import github.sarthakdev143.media_jobs.exception.PermanentJobException;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Text-to-image client for the Segmind API. The response body is the encoded image itself.
 */
@Component
public class SegmindImageGenerationClient implements ImageGenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(SegmindImageGenerationClient.class);
    static final String API_KEY_HEADER = "x-api-key";

    private final RestTemplate restTemplate;
    private final Retry retry;
    private final ObjectMapper objectMapper;
    private final MediaJobsProperties.ImageGeneration settings;

    public SegmindImageGenerationClient(
            @Qualifier("generationRestTemplate") RestTemplate restTemplate,
            @Qualifier("generationRetry") Retry retry,
            ObjectMapper objectMapper,
            MediaJobsProperties properties) {
        this.restTemplate = restTemplate;
        this.retry = retry;
        this.objectMapper = objectMapper;
        this.settings = properties.getImageGeneration();
    }

    @Override
    public Path generateImage(String prompt, Path target) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new PermanentJobException("image_generation_not_configured", "No image generation API key is configured.");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, settings.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.IMAGE_JPEG, MediaType.IMAGE_PNG));
        HttpEntity<String> entity = new HttpEntity<>(requestBody(prompt), headers);
        String url = settings.getBaseUrl() + "/" + settings.getModel();

        byte[] image;
        try {
            image = retry.executeSupplier(() -> exchange(url, entity));
        } catch (JobPipelineException e) {
            logger.warn("Image generation failed with {}: {}", e.code(), e.getMessage());
            throw e;
        }

        try {
            Files.write(target, image);
        } catch (IOException e) {
            throw new TransientInfraException("temp_storage_unavailable", "Unable to write generated image to " + target, e);
        }
        logger.info("Generated {} byte image with {}", image.length, settings.getModel());
        return target;
    }

    String requestBody(String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("positivePrompt", prompt);
        body.put("negativePrompt", settings.getNegativePrompt());
        body.put("width", settings.getWidth());
        body.put("height", settings.getHeight());
        body.put("steps", settings.getSteps());
        body.put("seed", settings.getSeed());
        body.put("CFGScale", settings.getCfgScale());
        body.put("outputFormat", "JPG");
        body.put("scheduler", "Euler");
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize image generation request.", e);
        }
    }

    private byte[] exchange(String url, HttpEntity<String> entity) {
        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, entity, byte[].class);
        } catch (RestClientResponseException e) {
            throw classifyHttpStatus(e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new TransientUpstreamException("image_generation_unreachable", "Image generation API could not be reached.", e);
        } catch (RestClientException e) {
            throw new TransientUpstreamException("image_generation_unavailable", "Image generation API call failed.", e);
        }

        byte[] body = response.getBody();
        MediaType contentType = response.getHeaders().getContentType();
        if (body == null || body.length == 0) {
            throw new TransientUpstreamException("image_generation_bad_response", "Image generation API returned an empty body.");
        }
        if (contentType != null && !"image".equals(contentType.getType())) {
            throw new TransientUpstreamException(
                    "image_generation_bad_response",
                    "Image generation API returned " + contentType + " instead of an image.");
        }
        return body;
    }

    static JobPipelineException classifyHttpStatus(int status, Throwable cause) {
        if (status == 401 || status == 403) {
            return new PermanentJobException("image_generation_auth_failed", "Image generation API rejected the credentials (HTTP " + status + ").", cause);
        }
        if (status == 400 || status == 404 || status == 406 || status == 422) {
            return new PermanentJobException("image_generation_invalid_request", "Image generation API rejected the request (HTTP " + status + ").", cause);
        }
        if (status == 429) {
            return new TransientUpstreamException("image_generation_rate_limited", "Image generation API rate limit hit.", cause);
        }
        return new TransientUpstreamException("image_generation_unavailable", "Image generation API answered HTTP " + status + ".", cause);
    }
}
