package github.sarthakdev143.media_jobs.service;

import github.sarthakdev143.media_jobs.dto.JobSubmissionRequest;
import github.sarthakdev143.media_jobs.integration.storage.ArtifactRef;
import github.sarthakdev143.media_jobs.model.Job;
import org.springframework.web.multipart.MultipartFile;

import java.util.Optional;

public interface JobService {

    /**
     * Validates and records a job, then hands it to the task queue. Returns without doing any
     * media work.
     *
     * @throws IllegalArgumentException if the request is invalid; nothing is recorded
     * @throws github.sarthakdev143.media_jobs.exception.TransientInfraException if the record
     *         store or the queue stays unavailable
     */
    String submitJob(JobSubmissionRequest request);

    Optional<Job> getJob(String jobId);

    /** Presigned download URL for the output of a SUCCEEDED job. */
    String artifactUrl(Job job);

    ArtifactRef uploadAsset(MultipartFile file);
}
