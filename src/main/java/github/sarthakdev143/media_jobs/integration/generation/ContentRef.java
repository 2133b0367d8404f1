package github.sarthakdev143.media_jobs.integration.generation;

public record ContentRef(String taskId, String fileId, String downloadUrl) {
}
