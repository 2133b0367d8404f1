package github.sarthakdev143.media_jobs.service.impl;

import github.sarthakdev143.media_jobs.config.MediaJobsProperties;
import github.sarthakdev143.media_jobs.dto.JobSubmissionRequest;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.integration.storage.ArtifactRef;
import github.sarthakdev143.media_jobs.integration.storage.ArtifactStore;
import github.sarthakdev143.media_jobs.model.ErrorClass;
import github.sarthakdev143.media_jobs.model.Job;
import github.sarthakdev143.media_jobs.model.JobError;
import github.sarthakdev143.media_jobs.model.JobState;
import github.sarthakdev143.media_jobs.model.JobUpdate;
import github.sarthakdev143.media_jobs.model.MediaKind;
import github.sarthakdev143.media_jobs.queue.TaskQueue;
import github.sarthakdev143.media_jobs.service.JobService;
import github.sarthakdev143.media_jobs.store.JobRecordStore;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

@Service
public class DefaultJobService implements JobService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultJobService.class);
    static final String ENQUEUE_FAILED_CODE = "enqueue_failed";

    private final JobRecordStore store;
    private final TaskQueue queue;
    private final ArtifactStore artifactStore;
    private final JobRequestValidator validator;
    private final Clock clock;
    private final MediaJobsProperties properties;
    private final Retry infraRetry;
    private final Counter submittedCounter;
    private final Counter uploadsCounter;

    public DefaultJobService(
            JobRecordStore store,
            TaskQueue queue,
            ArtifactStore artifactStore,
            JobRequestValidator validator,
            Clock clock,
            MediaJobsProperties properties,
            @Qualifier("infraRetry") Retry infraRetry,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.queue = queue;
        this.artifactStore = artifactStore;
        this.validator = validator;
        this.clock = clock;
        this.properties = properties;
        this.infraRetry = infraRetry;
        this.submittedCounter = meterRegistry.counter("media_jobs.jobs.submitted");
        this.uploadsCounter = meterRegistry.counter("media_jobs.assets.uploaded");
    }

    @Override
    public String submitJob(JobSubmissionRequest request) {
        JobRequestValidator.ValidatedSubmission submission = validator.normalizeAndValidate(request);

        String jobId = UUID.randomUUID().toString();
        Job job = Job.queued(
                jobId,
                submission.inputRefs(),
                submission.params(),
                properties.getJobs().getMaxAttempts(),
                clock.instant());

        Retry.decorateRunnable(infraRetry, () -> store.create(job)).run();
        try {
            Retry.decorateRunnable(infraRetry, () -> queue.enqueue(jobId)).run();
        } catch (TransientInfraException e) {
            abandonUnqueued(job, e);
            throw e;
        }

        submittedCounter.increment();
        logger.info(
                "Accepted job {} inputs={} generation={} preset={}",
                jobId,
                submission.inputRefs().size(),
                submission.params().requiresGeneration(),
                submission.params().outputPreset());
        return jobId;
    }

    @Override
    public Optional<Job> getJob(String jobId) {
        return store.get(jobId);
    }

    @Override
    public String artifactUrl(Job job) {
        if (job.state() != JobState.SUCCEEDED) {
            throw new IllegalStateException("Job " + job.id() + " has no output in state " + job.state());
        }
        return artifactStore.presignedUrl(ArtifactRef.parse(job.outputRef()), properties.getStorage().getPresignTtl());
    }

    @Override
    public ArtifactRef uploadAsset(MultipartFile file) {
        MediaKind kind = validator.validateUpload(file);
        String extension = MediaKind.extensionOf(file.getOriginalFilename());
        String key = properties.getStorage().getUploadPrefix() + UUID.randomUUID() + extension;

        Path staging = null;
        try {
            staging = Files.createTempFile("media-jobs-upload-", extension);
            file.transferTo(staging);
            ArtifactRef ref = artifactStore.put(key, staging, file.getContentType());
            uploadsCounter.increment();
            logger.info("Stored {} upload of {} bytes at {}", kind, file.getSize(), ref.uri());
            return ref;
        } catch (IOException e) {
            throw new TransientInfraException("upload_staging_failed", "Unable to stage the uploaded file.", e);
        } finally {
            deleteTempFile(staging);
        }
    }

    private void abandonUnqueued(Job job, TransientInfraException cause) {
        logger.error("Job {} could not be enqueued, closing its record", job.id(), cause);
        try {
            store.compareAndTransition(
                    job.id(),
                    JobState.QUEUED,
                    0,
                    JobState.EXPIRED,
                    JobUpdate.failed(new JobError(
                            ErrorClass.EXPIRED,
                            ENQUEUE_FAILED_CODE,
                            "Job could not be handed to the task queue.",
                            0,
                            clock.instant())));
        } catch (TransientInfraException e) {
            logger.warn("Could not close unqueued job {}, the reaper will expire it", job.id());
        }
    }

    private void deleteTempFile(Path filePath) {
        if (filePath == null) {
            return;
        }
        try {
            Files.deleteIfExists(filePath);
        } catch (Exception ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
