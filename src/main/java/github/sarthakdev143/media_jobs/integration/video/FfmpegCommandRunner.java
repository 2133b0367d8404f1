package github.sarthakdev143.media_jobs.integration.video;

import github.sarthakdev143.media_jobs.exception.PermanentJobException;
import github.sarthakdev143.media_jobs.exception.TransformTimeoutException;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.exception.TransientUpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Component
public class FfmpegCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegCommandRunner.class);
    private static final int LOG_TAIL_CHARS = 2000;
    private static final List<String> INPUT_ERROR_MARKERS = List.of(
            "invalid data found when processing input",
            "could not find codec parameters",
            "unsupported codec",
            "does not contain any stream",
            "moov atom not found",
            "no such file or directory");

    public void run(List<String> command, Path workDir, String stage, Duration timeout) {
        logger.info("Running FFmpeg command for stage {}: {}", stage, String.join(" ", command));
        Path logFile = workDir.resolve(stage.replaceAll("[^A-Za-z0-9]+", "-") + ".log");

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();
        } catch (IOException e) {
            throw new TransientInfraException(
                    "transform_tool_unavailable",
                    "Unable to start " + command.get(0) + " for stage " + stage + ".",
                    e);
        }

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new TransientUpstreamException("transform_interrupted", "Interrupted during stage " + stage + ".", e);
        }

        if (!finished) {
            process.destroyForcibly();
            throw new TransformTimeoutException("FFmpeg timed out after " + timeout + " during stage " + stage + ".");
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String output = readTail(logFile);
            String message = "FFmpeg failed during stage " + stage + " with exit code " + exitCode + ". Output: " + output;
            if (looksLikeInputError(output)) {
                throw new PermanentJobException("unsupported_input", message);
            }
            throw new TransientUpstreamException("transform_failed", message);
        }
    }

    static boolean looksLikeInputError(String output) {
        String normalized = output.toLowerCase(Locale.ROOT);
        return INPUT_ERROR_MARKERS.stream().anyMatch(normalized::contains);
    }

    private String readTail(Path logFile) {
        try {
            String output = Files.readString(logFile, StandardCharsets.UTF_8);
            return output.length() <= LOG_TAIL_CHARS ? output : output.substring(output.length() - LOG_TAIL_CHARS);
        } catch (IOException e) {
            return "<no output captured>";
        }
    }
}
