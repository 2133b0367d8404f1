package github.sarthakdev143.media_jobs.worker;

import github.sarthakdev143.media_jobs.config.MediaJobsProperties;
import github.sarthakdev143.media_jobs.exception.PermanentJobException;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.integration.generation.ContentRef;
import github.sarthakdev143.media_jobs.integration.generation.GenerationClient;
import github.sarthakdev143.media_jobs.integration.generation.GenerationRequest;
import github.sarthakdev143.media_jobs.integration.generation.ImageGenerationClient;
import github.sarthakdev143.media_jobs.integration.storage.ArtifactRef;
import github.sarthakdev143.media_jobs.integration.storage.ArtifactStore;
import github.sarthakdev143.media_jobs.integration.video.MediaTransformEngine;
import github.sarthakdev143.media_jobs.integration.video.TransformRequest;
import github.sarthakdev143.media_jobs.model.Job;
import github.sarthakdev143.media_jobs.model.JobParams;
import github.sarthakdev143.media_jobs.model.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * One attempt of a job: fetch inputs, optionally generate a clip, transform, upload.
 */
@Component
public class JobPipeline {

    private static final Logger logger = LoggerFactory.getLogger(JobPipeline.class);
    static final String OUTPUT_FILE_NAME = "output.mp4";
    private static final String OUTPUT_CONTENT_TYPE = "video/mp4";

    private final InputFetcher inputFetcher;
    private final GenerationClient generationClient;
    private final ImageGenerationClient imageGenerationClient;
    private final MediaTransformEngine transformEngine;
    private final ArtifactStore artifactStore;
    private final Path tempRoot;
    private final String outputPrefix;
    private final long inputQuotaBytes;

    public JobPipeline(
            InputFetcher inputFetcher,
            GenerationClient generationClient,
            ImageGenerationClient imageGenerationClient,
            MediaTransformEngine transformEngine,
            ArtifactStore artifactStore,
            MediaJobsProperties properties) {
        this.inputFetcher = inputFetcher;
        this.generationClient = generationClient;
        this.imageGenerationClient = imageGenerationClient;
        this.transformEngine = transformEngine;
        this.artifactStore = artifactStore;
        this.tempRoot = properties.getWorker().getTempRoot();
        this.outputPrefix = properties.getStorage().getOutputPrefix();
        this.inputQuotaBytes = properties.getTransform().getTempQuotaBytes();
    }

    /**
     * @return URI of the stored output
     * @throws github.sarthakdev143.media_jobs.exception.LeaseLostException when another attempt
     *         took the job over
     */
    public String execute(Job job, AttemptLease lease) {
        int attempt = lease.attempt();
        String outputKey = outputKey(job.id());
        Path workDir = createWorkDir(job.id());
        try {
            long inputBytes = 0;
            List<FetchedInput> inputs = new ArrayList<>();
            for (int index = 0; index < job.inputRefs().size(); index++) {
                FetchedInput input = inputFetcher.fetch(job.inputRefs().get(index), workDir, index, inputQuotaBytes - inputBytes);
                inputBytes += sizeOf(input.path());
                inputs.add(input);
            }

            List<TransformRequest.Scene> scenes = new ArrayList<>();
            Path audio = null;
            FetchedInput firstImage = null;
            for (FetchedInput input : inputs) {
                if (input.kind() == MediaKind.AUDIO) {
                    audio = input.path();
                    continue;
                }
                if (input.kind() == MediaKind.IMAGE && firstImage == null) {
                    firstImage = input;
                }
                scenes.add(new TransformRequest.Scene(input.path(), input.kind()));
            }

            JobParams params = job.params();
            if (params.requiresGeneration()) {
                lease.ensureHeld();
                Path firstFrame = firstImage == null
                        ? imageGenerationClient.generateImage(params.prompt(), workDir.resolve("generated-frame.jpg"))
                        : firstImage.path();
                Path generatedClip = generate(job, attempt, firstFrame, workDir, inputQuotaBytes - inputBytes);
                TransformRequest.Scene generatedScene = new TransformRequest.Scene(generatedClip, MediaKind.VIDEO);
                if (firstImage == null) {
                    scenes.add(0, generatedScene);
                } else {
                    Path firstImagePath = firstImage.path();
                    scenes.replaceAll(scene -> scene.source().equals(firstImagePath) ? generatedScene : scene);
                }
            }

            if (scenes.isEmpty()) {
                throw new PermanentJobException("no_visual_input", "Job " + job.id() + " has no visual input to render.");
            }

            lease.ensureHeld();
            Path output = workDir.resolve(OUTPUT_FILE_NAME);
            transformEngine.transform(new TransformRequest(scenes, audio, params), output);

            lease.ensureHeld();
            ArtifactRef stored = artifactStore.put(outputKey, output, OUTPUT_CONTENT_TYPE);
            logger.info("Job {} attempt {} stored output at {}", job.id(), attempt, stored.uri());
            return stored.uri();
        } finally {
            deleteRecursively(workDir);
        }
    }

    String outputKey(String jobId) {
        return outputPrefix + jobId + "/" + OUTPUT_FILE_NAME;
    }

    private Path generate(Job job, int attempt, Path firstFrame, Path workDir, long remainingBytes) {
        GenerationRequest request = new GenerationRequest(
                job.params().prompt(),
                firstFrame,
                GenerationRequest.idempotencyKey(job.id(), attempt));
        ContentRef content = generationClient.generate(request);
        logger.info("Job {} attempt {} generated clip from task {}", job.id(), attempt, content.taskId());
        return inputFetcher.download(content.downloadUrl(), workDir.resolve("generated.mp4"), remainingBytes);
    }

    private long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new TransientInfraException("temp_storage_unavailable", "Unable to measure " + path, e);
        }
    }

    private Path createWorkDir(String jobId) {
        try {
            Files.createDirectories(tempRoot);
            return Files.createTempDirectory(tempRoot, "media-jobs-" + jobId + "-");
        } catch (IOException e) {
            throw new TransientInfraException("temp_storage_unavailable", "Unable to create a work directory for job " + jobId, e);
        }
    }

    private void deleteRecursively(Path directory) {
        if (directory == null || Files.notExists(directory)) {
            return;
        }
        try (Stream<Path> pathStream = Files.walk(directory)) {
            pathStream
                    .sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException ignored) {
                            // Cleanup failures are non-fatal.
                        }
                    });
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
