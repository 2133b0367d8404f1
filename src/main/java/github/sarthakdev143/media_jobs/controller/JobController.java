package github.sarthakdev143.media_jobs.controller;

import github.sarthakdev143.media_jobs.dto.AssetUploadResponse;
import github.sarthakdev143.media_jobs.dto.JobStatusResponse;
import github.sarthakdev143.media_jobs.dto.JobSubmissionRequest;
import github.sarthakdev143.media_jobs.dto.JobSubmissionResponse;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.integration.storage.ArtifactRef;
import github.sarthakdev143.media_jobs.model.Job;
import github.sarthakdev143.media_jobs.model.JobState;
import github.sarthakdev143.media_jobs.service.JobService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.net.URI;
import java.util.Optional;

@RestController
@RequestMapping("/jobs")
public class JobController {

    private static final Logger logger = LoggerFactory.getLogger(JobController.class);

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping(consumes = "application/json")
    public ResponseEntity<?> submit(@RequestBody JobSubmissionRequest request) {
        try {
            String jobId = jobService.submitJob(request);
            return ResponseEntity.accepted()
                    .body(new JobSubmissionResponse(
                            jobId,
                            JobState.QUEUED,
                            "Job accepted. Poll /jobs/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (TransientInfraException e) {
            logger.warn("Job submission rejected, backend unavailable ({})", e.code());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Job backend is temporarily unavailable. Please retry.");
        } catch (Exception e) {
            logger.error("Job submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to submit job. Please try again.");
        }
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        try {
            return jobService.getJob(jobId)
                    .<ResponseEntity<?>>map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
                    .orElseGet(() -> notFound(jobId));
        } catch (TransientInfraException e) {
            logger.warn("Status lookup for job {} failed, backend unavailable ({})", jobId, e.code());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Job backend is temporarily unavailable. Please retry.");
        }
    }

    @GetMapping("/{jobId}/artifact")
    public ResponseEntity<?> getArtifact(@PathVariable String jobId) {
        try {
            Optional<Job> job = jobService.getJob(jobId);
            if (job.isEmpty()) {
                return notFound(jobId);
            }
            if (job.get().state() != JobState.SUCCEEDED) {
                return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body("Job " + jobId + " is " + job.get().state() + ", no artifact is available.");
            }
            String url = jobService.artifactUrl(job.get());
            return ResponseEntity.status(HttpStatus.FOUND)
                    .header(HttpHeaders.LOCATION, URI.create(url).toString())
                    .build();
        } catch (TransientInfraException e) {
            logger.warn("Artifact lookup for job {} failed, backend unavailable ({})", jobId, e.code());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Job backend is temporarily unavailable. Please retry.");
        } catch (Exception e) {
            logger.error("Artifact lookup for job {} failed", jobId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to resolve the job artifact. Please try again.");
        }
    }

    @PostMapping(value = "/assets", consumes = "multipart/form-data")
    public ResponseEntity<?> uploadAsset(@RequestParam("file") MultipartFile file) {
        try {
            ArtifactRef ref = jobService.uploadAsset(file);
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(new AssetUploadResponse(ref.uri(), file.getContentType(), file.getSize()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (TransientInfraException e) {
            logger.warn("Asset upload rejected, storage unavailable ({})", e.code());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Artifact storage is temporarily unavailable. Please retry.");
        } catch (Exception e) {
            logger.error("Asset upload failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to store the uploaded file. Please try again.");
        }
    }

    private ResponseEntity<?> notFound(String jobId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId);
    }
}
