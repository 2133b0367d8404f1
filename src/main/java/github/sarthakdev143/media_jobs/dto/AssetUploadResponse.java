package github.sarthakdev143.media_jobs.dto;

public record AssetUploadResponse(String ref, String contentType, long sizeBytes) {
}
