package github.sarthakdev143.media_jobs.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import github.sarthakdev143.media_jobs.model.Job;
import github.sarthakdev143.media_jobs.model.JobError;
import github.sarthakdev143.media_jobs.model.JobState;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        String jobId,
        JobState state,
        String outputRef,
        JobError error,
        int attemptCount,
        int maxAttempts,
        Instant createdAt,
        Instant updatedAt) {

    public static JobStatusResponse from(Job job) {
        return new JobStatusResponse(
                job.id(),
                job.state(),
                job.outputRef(),
                job.error(),
                job.attemptCount(),
                job.maxAttempts(),
                job.createdAt(),
                job.updatedAt());
    }
}
