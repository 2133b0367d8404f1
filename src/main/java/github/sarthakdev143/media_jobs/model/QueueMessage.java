package github.sarthakdev143.media_jobs.model;

import java.time.Instant;

public record QueueMessage(
        String messageId,
        String jobId,
        Instant enqueueTime,
        int deliveryAttempt) {

    public QueueMessage redelivered(String nextMessageId) {
        return new QueueMessage(nextMessageId, jobId, enqueueTime, deliveryAttempt + 1);
    }
}
