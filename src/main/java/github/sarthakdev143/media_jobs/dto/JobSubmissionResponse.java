package github.sarthakdev143.media_jobs.dto;

import github.sarthakdev143.media_jobs.model.JobState;

public record JobSubmissionResponse(String jobId, JobState state, String message) {
}
