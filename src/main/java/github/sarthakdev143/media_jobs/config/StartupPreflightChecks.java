package github.sarthakdev143.media_jobs.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "media-jobs.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final int FFMPEG_CHECK_TIMEOUT_SECONDS = 10;

    private final MediaJobsProperties properties;

    public StartupPreflightChecks(MediaJobsProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.getWorker().isEnabled()) {
            checkFfmpegConfiguration();
            checkTempRoot();
        }
        checkStorageConfiguration();
        checkGenerationConfiguration();
    }

    private void checkFfmpegConfiguration() {
        String ffmpegBinary = properties.getTransform().resolveFfmpegBinary();
        boolean explicitPath = ffmpegBinary.contains("/") || ffmpegBinary.contains("\\");
        if (explicitPath && !Files.isRegularFile(Path.of(ffmpegBinary))) {
            throw new IllegalStateException(
                    "FFmpeg binary not found at " + Path.of(ffmpegBinary).toAbsolutePath()
                            + ". Set " + MediaJobsProperties.Transform.FFMPEG_PATH_ENV
                            + " or media-jobs.transform.ffmpeg-path to a valid ffmpeg executable path.");
        }

        try {
            Process process = new ProcessBuilder(ffmpegBinary, "-version")
                    .redirectErrorStream(true)
                    .start();
            boolean finished = process.waitFor(FFMPEG_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
            }
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        "FFmpeg is not usable at " + ffmpegBinary + ". Install FFmpeg or set "
                                + MediaJobsProperties.Transform.FFMPEG_PATH_ENV + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    "FFmpeg is not available on PATH. Install FFmpeg or set "
                            + MediaJobsProperties.Transform.FFMPEG_PATH_ENV + ".",
                    e);
        }
    }

    private void checkTempRoot() {
        Path tempRoot = properties.getWorker().getTempRoot();
        try {
            Files.createDirectories(tempRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Worker temp root cannot be created at " + tempRoot.toAbsolutePath() + ".", e);
        }
        if (!Files.isWritable(tempRoot)) {
            throw new IllegalStateException("Worker temp root is not writable at " + tempRoot.toAbsolutePath() + ".");
        }
    }

    private void checkStorageConfiguration() {
        MediaJobsProperties.Storage storage = properties.getStorage();
        if ("s3".equalsIgnoreCase(storage.getType())
                && (storage.getBucket() == null || storage.getBucket().isBlank())) {
            throw new IllegalStateException(
                    "media-jobs.storage.bucket is required for S3 storage. Set S3_BUCKET_NAME.");
        }
    }

    private void checkGenerationConfiguration() {
        String apiKey = properties.getGeneration().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            logger.warn("No generation API key configured; jobs with a prompt will fail with generation_not_configured.");
        }
    }
}
