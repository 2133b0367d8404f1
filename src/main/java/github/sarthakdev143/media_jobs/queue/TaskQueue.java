package github.sarthakdev143.media_jobs.queue;

import github.sarthakdev143.media_jobs.model.Delivery;

import java.time.Duration;
import java.util.Optional;

/**
 * At-least-once dispatch queue for job ids. A delivery that is neither acked nor nacked within
 * the visibility timeout is handed out again by {@link #requeueExpiredDeliveries()}.
 */
public interface TaskQueue {

    void enqueue(String jobId);

    /**
     * Waits up to {@code timeout} for the next message.
     */
    Optional<Delivery> dequeue(Duration timeout);

    /** Removes the delivered message for good. Unknown tokens are ignored. */
    void ack(String deliveryToken);

    /** Returns the delivered message to the queue with its delivery counter incremented. */
    void nack(String deliveryToken);

    /**
     * Puts deliveries whose visibility timeout elapsed back on the queue.
     *
     * @return number of messages requeued
     */
    int requeueExpiredDeliveries();
}
