package github.sarthakdev143.media_jobs.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.model.Delivery;
import github.sarthakdev143.media_jobs.model.QueueMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisListCommands.Direction;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Reliable queue on Redis lists: {@code LPUSH} onto {@code <prefix>:queue:pending}, {@code BLMOVE}
 * onto {@code <prefix>:queue:processing}, visibility deadlines in {@code <prefix>:queue:deadlines}.
 */
public class RedisTaskQueue implements TaskQueue {

    private static final Logger logger = LoggerFactory.getLogger(RedisTaskQueue.class);

    private static final RedisScript<Long> REQUEUE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('LREM', KEYS[1], 1, ARGV[1]) == 0 then return 0 end\n"
                    + "redis.call('ZREM', KEYS[2], ARGV[1])\n"
                    + "redis.call('LPUSH', KEYS[3], ARGV[2])\n"
                    + "return 1",
            Long.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration visibilityTimeout;
    private final String pendingKey;
    private final String processingKey;
    private final String deadlinesKey;

    public RedisTaskQueue(
            StringRedisTemplate redis,
            ObjectMapper objectMapper,
            Clock clock,
            String keyPrefix,
            Duration visibilityTimeout) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.visibilityTimeout = visibilityTimeout;
        this.pendingKey = keyPrefix + ":queue:pending";
        this.processingKey = keyPrefix + ":queue:processing";
        this.deadlinesKey = keyPrefix + ":queue:deadlines";
    }

    @Override
    public void enqueue(String jobId) {
        QueueMessage message = new QueueMessage(UUID.randomUUID().toString(), jobId, clock.instant(), 1);
        String raw = serialize(message);
        withRedis(() -> redis.opsForList().leftPush(pendingKey, raw));
    }

    @Override
    public Optional<Delivery> dequeue(Duration timeout) {
        String raw = withRedis(() -> timeout.isZero() || timeout.isNegative()
                ? redis.opsForList().move(pendingKey, Direction.RIGHT, processingKey, Direction.LEFT)
                : redis.opsForList().move(pendingKey, Direction.RIGHT, processingKey, Direction.LEFT, timeout));
        if (raw == null) {
            return Optional.empty();
        }

        long deadline = clock.instant().plus(visibilityTimeout).toEpochMilli();
        withRedis(() -> redis.opsForZSet().add(deadlinesKey, raw, deadline));
        return Optional.of(new Delivery(raw, deserialize(raw)));
    }

    @Override
    public void ack(String deliveryToken) {
        Long removed = withRedis(() -> redis.opsForList().remove(processingKey, 1, deliveryToken));
        withRedis(() -> redis.opsForZSet().remove(deadlinesKey, deliveryToken));
        if (removed == null || removed == 0L) {
            logger.debug("Ack for a delivery that is no longer in flight");
        }
    }

    @Override
    public void nack(String deliveryToken) {
        if (!moveBackToPending(deliveryToken)) {
            logger.debug("Nack for a delivery that is no longer in flight");
        }
    }

    @Override
    public int requeueExpiredDeliveries() {
        adoptUntrackedDeliveries();

        Set<String> expired = withRedis(() -> redis.opsForZSet()
                .rangeByScore(deadlinesKey, 0, clock.instant().toEpochMilli()));
        if (expired == null || expired.isEmpty()) {
            return 0;
        }

        int requeued = 0;
        for (String raw : expired) {
            if (moveBackToPending(raw)) {
                requeued++;
            } else {
                withRedis(() -> redis.opsForZSet().remove(deadlinesKey, raw));
            }
        }
        if (requeued > 0) {
            logger.warn("Requeued {} deliveries after visibility timeout", requeued);
        }
        return requeued;
    }

    // consumer died between BLMOVE and ZADD
    private void adoptUntrackedDeliveries() {
        List<String> processing = withRedis(() -> redis.opsForList().range(processingKey, 0, -1));
        if (processing == null) {
            return;
        }
        long deadline = clock.instant().plus(visibilityTimeout).toEpochMilli();
        for (String raw : processing) {
            Double score = withRedis(() -> redis.opsForZSet().score(deadlinesKey, raw));
            if (score == null) {
                withRedis(() -> redis.opsForZSet().add(deadlinesKey, raw, deadline));
            }
        }
    }

    private boolean moveBackToPending(String raw) {
        QueueMessage next = deserialize(raw).redelivered(UUID.randomUUID().toString());
        Long moved = withRedis(() -> redis.execute(
                REQUEUE_SCRIPT,
                List.of(processingKey, deadlinesKey, pendingKey),
                raw,
                serialize(next)));
        return moved != null && moved == 1L;
    }

    private String serialize(QueueMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize queue message for job " + message.jobId(), e);
        }
    }

    private QueueMessage deserialize(String raw) {
        try {
            return objectMapper.readValue(raw, QueueMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Queue message is not readable: " + raw, e);
        }
    }

    private <T> T withRedis(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            throw new TransientInfraException("queue_unavailable", "Task queue is unavailable.", e);
        }
    }
}
