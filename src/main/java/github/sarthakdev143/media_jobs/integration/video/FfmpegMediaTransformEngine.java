package github.sarthakdev143.media_jobs.integration.video;

import github.sarthakdev143.media_jobs.config.MediaJobsProperties;
import github.sarthakdev143.media_jobs.exception.PermanentJobException;
import github.sarthakdev143.media_jobs.exception.TransformTimeoutException;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.model.CaptionPosition;
import github.sarthakdev143.media_jobs.model.CompositionLayout;
import github.sarthakdev143.media_jobs.model.JobParams;
import github.sarthakdev143.media_jobs.model.MediaKind;
import github.sarthakdev143.media_jobs.model.OutputPreset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

@Component
public class FfmpegMediaTransformEngine implements MediaTransformEngine {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegMediaTransformEngine.class);
    private static final double STACK_PRIMARY_SHARE = 0.6;

    private final FfmpegCommandRunner commandRunner;
    private final MediaJobsProperties.Transform settings;
    private final Path tempRoot;
    private final Clock clock;

    public FfmpegMediaTransformEngine(FfmpegCommandRunner commandRunner, MediaJobsProperties properties, Clock clock) {
        this.commandRunner = commandRunner;
        this.settings = properties.getTransform();
        this.tempRoot = properties.getWorker().getTempRoot();
        this.clock = clock;
    }

    @Override
    public void transform(TransformRequest request, Path outputPath) {
        if (request.scenes().isEmpty()) {
            throw new PermanentJobException("no_visual_input", "A transform needs at least one image or video input.");
        }

        JobParams params = request.params();
        if (params.layout().isStacked() && request.scenes().size() != 2) {
            throw new PermanentJobException(
                    "invalid_layout",
                    "Layout " + params.layout() + " needs two visual inputs, got " + request.scenes().size() + ".");
        }

        Instant deadline = clock.instant().plus(settings.getTimeout());
        Path workDir = createWorkDir();
        try {
            OutputPreset preset = params.outputPreset();
            Path visualTrack = workDir.resolve("visual.mp4");

            if (params.layout().isStacked()) {
                runStage(buildStackCommand(request.scenes(), params, visualTrack), workDir, "stack scenes", deadline);
            } else {
                List<Path> sceneClips = new ArrayList<>();
                for (int index = 0; index < request.scenes().size(); index++) {
                    TransformRequest.Scene scene = request.scenes().get(index);
                    String caption = index == 0 ? params.captionText() : null;
                    Path sceneClip = workDir.resolve("scene-" + index + ".mp4");
                    List<String> command = scene.kind() == MediaKind.IMAGE
                            ? buildImageSceneCommand(scene.source(), params.imageDurationSec(), preset, caption, params, sceneClip)
                            : buildVideoSceneCommand(scene.source(), preset, caption, params, sceneClip);
                    runStage(command, workDir, "render scene " + index, deadline);
                    sceneClips.add(sceneClip);
                }

                if (sceneClips.size() == 1) {
                    Files.move(sceneClips.get(0), visualTrack);
                } else {
                    runStage(buildVisualConcatCommand(sceneClips, visualTrack), workDir, "combine scene clips", deadline);
                }
            }

            if (request.audioInput() != null) {
                Path muxed = workDir.resolve("muxed.mp4");
                runStage(
                        buildAudioMuxCommand(visualTrack, request.audioInput(), params.backgroundVolume(), muxed),
                        workDir,
                        "mix background audio",
                        deadline);
                visualTrack = muxed;
            }

            Files.createDirectories(outputPath.toAbsolutePath().getParent());
            Files.move(visualTrack, outputPath, StandardCopyOption.REPLACE_EXISTING);
            logger.info("Rendered {} scene(s) as {} into {}", request.scenes().size(), params.layout(), outputPath.getFileName());
        } catch (IOException e) {
            throw new TransientInfraException("temp_storage_unavailable", "Unable to manage transform work files.", e);
        } finally {
            deleteRecursively(workDir);
        }
    }

    List<String> buildImageSceneCommand(
            Path source,
            double durationSec,
            OutputPreset preset,
            String caption,
            JobParams params,
            Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(settings.resolveFfmpegBinary());
        command.add("-y");
        command.add("-loop");
        command.add("1");
        command.add("-i");
        command.add(source.toString());
        command.add("-t");
        command.add(formatSeconds(durationSec));
        command.add("-vf");
        command.add(buildSceneFilter(preset, caption, params));
        command.add("-r");
        command.add("30");
        command.add("-an");
        appendVideoEncoding(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildVideoSceneCommand(
            Path source,
            OutputPreset preset,
            String caption,
            JobParams params,
            Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(settings.resolveFfmpegBinary());
        command.add("-y");
        command.add("-i");
        command.add(source.toString());
        command.add("-vf");
        command.add(buildSceneFilter(preset, caption, params));
        command.add("-an");
        command.add("-r");
        command.add("30");
        appendVideoEncoding(command);
        command.add(outputPath.toString());
        return command;
    }

    /**
     * Both inputs are cropped to fill their band; the second one loops until the first ends.
     */
    List<String> buildStackCommand(List<TransformRequest.Scene> scenes, JobParams params, Path outputPath) {
        OutputPreset preset = params.outputPreset();
        int width = preset.width();
        int primaryHeight = evenPixels(preset.height() * STACK_PRIMARY_SHARE);
        int secondaryHeight = preset.height() - primaryHeight;
        TransformRequest.Scene primary = scenes.get(0);
        TransformRequest.Scene secondary = scenes.get(1);

        List<String> command = new ArrayList<>();
        command.add(settings.resolveFfmpegBinary());
        command.add("-y");
        if (primary.kind() == MediaKind.IMAGE) {
            command.add("-loop");
            command.add("1");
            command.add("-t");
            command.add(formatSeconds(params.imageDurationSec()));
        }
        command.add("-i");
        command.add(primary.source().toString());
        if (secondary.kind() == MediaKind.IMAGE) {
            command.add("-loop");
            command.add("1");
        } else {
            command.add("-stream_loop");
            command.add("-1");
        }
        command.add("-i");
        command.add(secondary.source().toString());

        String top = params.layout() == CompositionLayout.STACK_PRIMARY_TOP ? "[p]" : "[s]";
        String bottom = params.layout() == CompositionLayout.STACK_PRIMARY_TOP ? "[s]" : "[p]";
        StringBuilder filter = new StringBuilder()
                .append("[0:v]").append(fillBand(width, primaryHeight)).append("[p];")
                .append("[1:v]").append(fillBand(width, secondaryHeight)).append("[s];")
                .append(top).append(bottom).append("vstack=inputs=2:shortest=1");
        if (params.captionText() != null) {
            filter.append(",").append(buildCaptionFilter(params.captionText(), params, width, preset.height()));
        }
        filter.append("[v]");

        command.add("-filter_complex");
        command.add(filter.toString());
        command.add("-map");
        command.add("[v]");
        command.add("-an");
        command.add("-r");
        command.add("30");
        appendVideoEncoding(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildVisualConcatCommand(List<Path> sceneClips, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(settings.resolveFfmpegBinary());
        command.add("-y");
        for (Path sceneClip : sceneClips) {
            command.add("-i");
            command.add(sceneClip.toString());
        }

        StringBuilder filterBuilder = new StringBuilder();
        for (int index = 0; index < sceneClips.size(); index++) {
            filterBuilder.append("[").append(index).append(":v]");
        }
        filterBuilder.append("concat=n=").append(sceneClips.size()).append(":v=1:a=0[v]");

        command.add("-filter_complex");
        command.add(filterBuilder.toString());
        command.add("-map");
        command.add("[v]");
        appendVideoEncoding(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildAudioMuxCommand(Path visualTrackPath, Path audioPath, double volume, Path outputVideoPath) {
        return List.of(
                settings.resolveFfmpegBinary(),
                "-y",
                "-i",
                visualTrackPath.toString(),
                "-stream_loop",
                "-1",
                "-i",
                audioPath.toString(),
                "-filter_complex",
                "[1:a]volume=" + formatDecimal(volume) + "[a]",
                "-map",
                "0:v:0",
                "-map",
                "[a]",
                "-c:v",
                "copy",
                "-c:a",
                "aac",
                "-b:a",
                "192k",
                "-shortest",
                outputVideoPath.toString());
    }

    String buildSceneFilter(OutputPreset preset, String caption, JobParams params) {
        int width = preset.width();
        int height = preset.height();
        List<String> filters = new ArrayList<>();
        filters.add("scale="
                + width
                + ":"
                + height
                + ":force_original_aspect_ratio=decrease,pad="
                + width
                + ":"
                + height
                + ":(ow-iw)/2:(oh-ih)/2:black,setsar=1");

        if (caption != null) {
            filters.add(buildCaptionFilter(caption, params, width, height));
        }
        return String.join(",", filters);
    }

    private String buildCaptionFilter(String caption, JobParams params, int width, int height) {
        CaptionPosition position = params.captionPosition() == null ? CaptionPosition.BOTTOM : params.captionPosition();
        StringBuilder filter = new StringBuilder("drawtext=");
        Path fontFile = resolveFont(params.fontStyle());
        if (fontFile != null) {
            filter.append("fontfile='").append(escapeFilterValue(fontFile.toString())).append("':");
        }
        filter.append("text='")
                .append(escapeFilterValue(caption))
                .append("':fontcolor=white:fontsize=")
                .append(Math.max(width, height) / 24)
                .append(":borderw=2:bordercolor=black")
                .append(":box=1:boxcolor=black@0.45:boxborderw=12:x=(w-text_w)/2:y=")
                .append(position.yExpression());
        return filter.toString();
    }

    private Path resolveFont(String fontStyle) {
        if (fontStyle == null) {
            return null;
        }
        Path fontFile = settings.getFonts().get(fontStyle);
        if (fontFile == null) {
            throw new PermanentJobException("unknown_font", "Font style is not configured: " + fontStyle);
        }
        return fontFile;
    }

    private void runStage(List<String> command, Path workDir, String stage, Instant deadline) {
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isZero() || remaining.isNegative()) {
            throw new TransformTimeoutException(
                    "Transform used its " + settings.getTimeout() + " budget before stage " + stage + ".");
        }
        commandRunner.run(command, workDir, stage, remaining);
        checkTempQuota(workDir, stage);
    }

    void checkTempQuota(Path workDir, String stage) {
        long used;
        try (Stream<Path> files = Files.walk(workDir)) {
            used = files.filter(Files::isRegularFile).mapToLong(this::sizeOf).sum();
        } catch (IOException e) {
            throw new TransientInfraException("temp_storage_unavailable", "Unable to measure transform work files.", e);
        }
        if (used > settings.getTempQuotaBytes()) {
            throw new PermanentJobException(
                    "temp_quota_exceeded",
                    "Transform used " + used + " bytes of temp storage after stage " + stage
                            + ", quota is " + settings.getTempQuotaBytes() + ".");
        }
    }

    private String fillBand(int width, int height) {
        return "scale=" + width + ":" + height + ":force_original_aspect_ratio=increase,crop="
                + width + ":" + height + ",setsar=1";
    }

    private int evenPixels(double pixels) {
        int rounded = (int) Math.round(pixels);
        return rounded - (rounded % 2);
    }

    private void appendVideoEncoding(List<String> command) {
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("23");
        command.add("-pix_fmt");
        command.add("yuv420p");
    }

    private String escapeFilterValue(String text) {
        return text
                .replace("\\", "\\\\")
                .replace(":", "\\:")
                .replace("'", "\\'")
                .replace("%", "\\%");
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    private String formatDecimal(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private Path createWorkDir() {
        try {
            Files.createDirectories(tempRoot);
            return Files.createTempDirectory(tempRoot, "media-jobs-transform-");
        } catch (IOException e) {
            throw new TransientInfraException("temp_storage_unavailable", "Unable to create a transform work directory.", e);
        }
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0L;
        }
    }

    private void deleteRecursively(Path directory) {
        if (directory == null || Files.notExists(directory)) {
            return;
        }
        try (Stream<Path> pathStream = Files.walk(directory)) {
            pathStream
                    .sorted(Comparator.reverseOrder())
                    .forEach(this::deleteIfExists);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
