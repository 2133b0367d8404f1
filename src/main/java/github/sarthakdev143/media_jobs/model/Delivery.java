package github.sarthakdev143.media_jobs.model;

public record Delivery(String token, QueueMessage message) {

    public String jobId() {
        return message.jobId();
    }
}
