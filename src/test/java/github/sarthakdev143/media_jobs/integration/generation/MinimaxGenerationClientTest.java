package github.sarthakdev143.media_jobs.integration.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.media_jobs.config.MediaJobsProperties;
import github.sarthakdev143.media_jobs.exception.JobPipelineException;
import github.sarthakdev143.media_jobs.exception.PermanentJobException;
import github.sarthakdev143.media_jobs.exception.TransientUpstreamException;
import github.sarthakdev143.media_jobs.model.ErrorClass;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class MinimaxGenerationClientTest {

    private static final String BASE_URL = "https://api.test/v1";
    private static final String SUBMIT_URL = BASE_URL + "/video_generation";
    private static final String QUERY_URL = BASE_URL + "/query/video_generation?task_id=task-1";
    private static final String RETRIEVE_URL = BASE_URL + "/files/retrieve?file_id=file-1";
    private static final String OK = "\"base_resp\":{\"status_code\":0,\"status_msg\":\"success\"}";

    @TempDir
    Path tempDir;

    private MediaJobsProperties properties;
    private MockRestServiceServer server;
    private MinimaxGenerationClient client;
    private Path frame;

    @BeforeEach
    void setUp() throws Exception {
        frame = writeImage("first-frame.png", 576, 1024);
        properties = new MediaJobsProperties();
        properties.getGeneration().setBaseUrl(BASE_URL);
        properties.getGeneration().setApiKey("test-key");
        properties.getGeneration().setModel("I2V-01-Director");
        properties.getGeneration().setPollInterval(Duration.ZERO);
        properties.getGeneration().setMaxPolls(3);

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        Retry retry = Retry.of("generation-test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(TransientUpstreamException.class)
                .build());
        client = new MinimaxGenerationClient(restTemplate, retry, new ObjectMapper(), properties);
    }

    @Test
    void generateSubmitsPollsAndResolvesDownloadUrl() {
        server.expect(requestTo(SUBMIT_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(header(MinimaxGenerationClient.IDEMPOTENCY_HEADER, "job-1-1"))
                .andExpect(jsonPath("$.model").value("I2V-01-Director"))
                .andExpect(jsonPath("$.prompt").value("a slow pan over the sea"))
                .andRespond(json("{\"task_id\":\"task-1\"," + OK + "}"));
        server.expect(requestTo(QUERY_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(json("{\"task_id\":\"task-1\",\"status\":\"Processing\"," + OK + "}"));
        server.expect(requestTo(QUERY_URL))
                .andRespond(json("{\"task_id\":\"task-1\",\"status\":\"Success\",\"file_id\":\"file-1\"," + OK + "}"));
        server.expect(requestTo(RETRIEVE_URL))
                .andRespond(json("{\"file\":{\"file_id\":\"file-1\",\"download_url\":\"https://cdn.test/file-1.mp4\"}," + OK + "}"));

        ContentRef content = client.generate(new GenerationRequest("a slow pan over the sea", frame, "job-1-1"));

        assertThat(content).isEqualTo(new ContentRef("task-1", "file-1", "https://cdn.test/file-1.mp4"));
        server.verify();
    }

    @Test
    void firstFrameIsSentAsDataUri() throws Exception {
        Path image = writeImage("frame.png", 400, 600);
        server.expect(requestTo(SUBMIT_URL))
                .andExpect(jsonPath("$.first_frame_image", startsWith("data:image/png;base64,")))
                .andRespond(json("{\"task_id\":\"task-1\"," + OK + "}"));
        server.expect(requestTo(QUERY_URL))
                .andRespond(json("{\"status\":\"Success\",\"file_id\":\"file-1\"," + OK + "}"));
        server.expect(requestTo(RETRIEVE_URL))
                .andRespond(json("{\"file\":{\"download_url\":\"https://cdn.test/file-1.mp4\"}," + OK + "}"));

        client.generate(new GenerationRequest("animate", image, "job-1-1"));

        server.verify();
    }

    @Test
    void transientSubmitFailureIsRetriedWithSameIdempotencyKey() {
        server.expect(requestTo(SUBMIT_URL))
                .andExpect(header(MinimaxGenerationClient.IDEMPOTENCY_HEADER, "job-1-2"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(requestTo(SUBMIT_URL))
                .andExpect(header(MinimaxGenerationClient.IDEMPOTENCY_HEADER, "job-1-2"))
                .andRespond(json("{\"task_id\":\"task-1\"," + OK + "}"));
        server.expect(requestTo(QUERY_URL))
                .andRespond(json("{\"status\":\"Success\",\"file_id\":\"file-1\"," + OK + "}"));
        server.expect(requestTo(RETRIEVE_URL))
                .andRespond(json("{\"file\":{\"download_url\":\"https://cdn.test/file-1.mp4\"}," + OK + "}"));

        ContentRef content = client.generate(new GenerationRequest("prompt", frame, "job-1-2"));

        assertThat(content.taskId()).isEqualTo("task-1");
        server.verify();
    }

    @Test
    void rejectedCredentialsArePermanentAndNotRetried() {
        server.expect(requestTo(SUBMIT_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> client.generate(new GenerationRequest("prompt", frame, "job-1-1")))
                .isInstanceOf(PermanentJobException.class)
                .satisfies(e -> assertThat(((PermanentJobException) e).code()).isEqualTo("generation_auth_failed"));
        server.verify();
    }

    @Test
    void rateLimitStatusIsRetriedUntilAttemptsRunOut() {
        String rateLimited = "{\"base_resp\":{\"status_code\":1002,\"status_msg\":\"rate limit\"}}";
        for (int i = 0; i < 3; i++) {
            server.expect(requestTo(SUBMIT_URL)).andRespond(json(rateLimited));
        }

        assertThatThrownBy(() -> client.generate(new GenerationRequest("prompt", frame, "job-1-1")))
                .isInstanceOf(TransientUpstreamException.class)
                .satisfies(e -> assertThat(((TransientUpstreamException) e).code()).isEqualTo("generation_rate_limited"));
        server.verify();
    }

    @Test
    void failedTaskIsTransient() {
        server.expect(requestTo(SUBMIT_URL)).andRespond(json("{\"task_id\":\"task-1\"," + OK + "}"));
        server.expect(requestTo(QUERY_URL)).andRespond(json("{\"status\":\"Fail\"," + OK + "}"));

        assertThatThrownBy(() -> client.generate(new GenerationRequest("prompt", frame, "job-1-1")))
                .isInstanceOf(TransientUpstreamException.class)
                .satisfies(e -> assertThat(((TransientUpstreamException) e).code()).isEqualTo("generation_failed"));
    }

    @Test
    void pollingGivesUpAfterMaxPolls() {
        server.expect(requestTo(SUBMIT_URL)).andRespond(json("{\"task_id\":\"task-1\"," + OK + "}"));
        for (int i = 0; i < 3; i++) {
            server.expect(requestTo(QUERY_URL)).andRespond(json("{\"status\":\"Queueing\"," + OK + "}"));
        }

        assertThatThrownBy(() -> client.generate(new GenerationRequest("prompt", frame, "job-1-1")))
                .isInstanceOf(TransientUpstreamException.class)
                .satisfies(e -> assertThat(((TransientUpstreamException) e).code()).isEqualTo("generation_timeout"));
        server.verify();
    }

    @Test
    void missingApiKeyFailsWithoutCallingTheApi() {
        properties.getGeneration().setApiKey(" ");

        assertThatThrownBy(() -> client.generate(new GenerationRequest("prompt", frame, "job-1-1")))
                .isInstanceOf(PermanentJobException.class)
                .satisfies(e -> assertThat(((PermanentJobException) e).code()).isEqualTo("generation_not_configured"));
        server.verify();
    }

    @Test
    void generationWithoutFirstFrameIsRejectedBeforeAnyCall() {
        assertThatThrownBy(() -> client.generate(new GenerationRequest("prompt", null, "job-1-1")))
                .isInstanceOf(PermanentJobException.class)
                .satisfies(e -> assertThat(((PermanentJobException) e).code()).isEqualTo("first_frame_required"));
        server.verify();
    }

    @Test
    void firstFrameBelowMinimumSizeIsRejected() throws Exception {
        Path small = writeImage("small.png", 200, 200);

        assertThatThrownBy(() -> client.encodeFirstFrame(small))
                .isInstanceOf(PermanentJobException.class)
                .satisfies(e -> assertThat(((PermanentJobException) e).code()).isEqualTo("invalid_first_frame"));
    }

    @Test
    void firstFrameWithExtremeAspectRatioIsRejected() throws Exception {
        Path banner = writeImage("banner.png", 1600, 320);

        assertThatThrownBy(() -> client.encodeFirstFrame(banner))
                .isInstanceOf(PermanentJobException.class)
                .hasMessageContaining("aspect ratio");
    }

    @Test
    void firstFrameMustBeJpgOrPng() throws Exception {
        Path gif = Files.write(tempDir.resolve("frame.gif"), new byte[]{1, 2, 3});

        assertThatThrownBy(() -> client.encodeFirstFrame(gif))
                .isInstanceOf(PermanentJobException.class);
    }

    @Test
    void httpStatusesMapToErrorClasses() {
        assertThat(classOf(MinimaxGenerationClient.classifyHttpStatus(403, null))).isEqualTo(ErrorClass.PERMANENT);
        assertThat(classOf(MinimaxGenerationClient.classifyHttpStatus(422, null))).isEqualTo(ErrorClass.PERMANENT);
        assertThat(classOf(MinimaxGenerationClient.classifyHttpStatus(429, null))).isEqualTo(ErrorClass.TRANSIENT_UPSTREAM);
        assertThat(classOf(MinimaxGenerationClient.classifyHttpStatus(502, null))).isEqualTo(ErrorClass.TRANSIENT_UPSTREAM);
        assertThat(classOf(MinimaxGenerationClient.classifyBaseStatus(1004, "auth"))).isEqualTo(ErrorClass.PERMANENT);
        assertThat(classOf(MinimaxGenerationClient.classifyBaseStatus(1026, "sensitive"))).isEqualTo(ErrorClass.PERMANENT);
        assertThat(classOf(MinimaxGenerationClient.classifyBaseStatus(1013, "internal"))).isEqualTo(ErrorClass.TRANSIENT_UPSTREAM);
    }

    private ErrorClass classOf(JobPipelineException exception) {
        return exception.errorClass();
    }

    private org.springframework.test.web.client.ResponseCreator json(String body) {
        return withSuccess(body, MediaType.APPLICATION_JSON);
    }

    private Path writeImage(String name, int width, int height) throws Exception {
        Path path = tempDir.resolve(name);
        ImageIO.write(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB), "png", path.toFile());
        return path;
    }
}
