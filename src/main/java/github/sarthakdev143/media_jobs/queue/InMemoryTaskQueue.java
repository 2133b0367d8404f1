package github.sarthakdev143.media_jobs.queue;

import github.sarthakdev143.media_jobs.model.Delivery;
import github.sarthakdev143.media_jobs.model.QueueMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

public class InMemoryTaskQueue implements TaskQueue {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTaskQueue.class);

    private final BlockingQueue<QueueMessage> pending = new LinkedBlockingQueue<>();
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration visibilityTimeout;

    public InMemoryTaskQueue(Clock clock, Duration visibilityTimeout) {
        this.clock = clock;
        this.visibilityTimeout = visibilityTimeout;
    }

    @Override
    public void enqueue(String jobId) {
        pending.add(new QueueMessage(UUID.randomUUID().toString(), jobId, clock.instant(), 1));
    }

    @Override
    public Optional<Delivery> dequeue(Duration timeout) {
        requeueExpiredDeliveries();
        QueueMessage message;
        try {
            message = timeout.isZero() || timeout.isNegative()
                    ? pending.poll()
                    : pending.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        if (message == null) {
            return Optional.empty();
        }

        String token = UUID.randomUUID().toString();
        inFlight.put(token, new InFlight(message, clock.instant().plus(visibilityTimeout)));
        return Optional.of(new Delivery(token, message));
    }

    @Override
    public void ack(String deliveryToken) {
        if (inFlight.remove(deliveryToken) == null) {
            logger.debug("Ignoring ack for unknown delivery {}", deliveryToken);
        }
    }

    @Override
    public void nack(String deliveryToken) {
        InFlight removed = inFlight.remove(deliveryToken);
        if (removed == null) {
            logger.debug("Ignoring nack for unknown delivery {}", deliveryToken);
            return;
        }
        pending.add(removed.message().redelivered(UUID.randomUUID().toString()));
    }

    @Override
    public int requeueExpiredDeliveries() {
        Instant now = clock.instant();
        int requeued = 0;
        for (Map.Entry<String, InFlight> entry : inFlight.entrySet()) {
            if (entry.getValue().deadline().isAfter(now)) {
                continue;
            }
            if (inFlight.remove(entry.getKey(), entry.getValue())) {
                pending.add(entry.getValue().message().redelivered(UUID.randomUUID().toString()));
                requeued++;
            }
        }
        if (requeued > 0) {
            logger.warn("Requeued {} deliveries after visibility timeout", requeued);
        }
        return requeued;
    }

    public int pendingCount() {
        return pending.size();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private record InFlight(QueueMessage message, Instant deadline) {
    }
}
