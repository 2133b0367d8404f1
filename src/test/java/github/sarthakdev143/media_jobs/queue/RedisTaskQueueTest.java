package github.sarthakdev143.media_jobs.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.model.Delivery;
import github.sarthakdev143.media_jobs.model.QueueMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisListCommands.Direction;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisTaskQueueTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration VISIBILITY = Duration.ofMinutes(50);

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    private StringRedisTemplate redis;
    private ListOperations<String, String> listOps;
    private ZSetOperations<String, String> zSetOps;
    private RedisTaskQueue queue;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        listOps = mock(ListOperations.class);
        zSetOps = mock(ZSetOperations.class);
        when(redis.opsForList()).thenReturn(listOps);
        when(redis.opsForZSet()).thenReturn(zSetOps);
        queue = new RedisTaskQueue(redis, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC), "media-jobs", VISIBILITY);
    }

    @Test
    void enqueuePushesFirstDeliveryOntoPendingList() throws Exception {
        queue.enqueue("job-1");

        ArgumentCaptor<String> raw = ArgumentCaptor.forClass(String.class);
        verify(listOps).leftPush(eq("media-jobs:queue:pending"), raw.capture());
        QueueMessage message = objectMapper.readValue(raw.getValue(), QueueMessage.class);
        assertThat(message.jobId()).isEqualTo("job-1");
        assertThat(message.deliveryAttempt()).isEqualTo(1);
        assertThat(message.enqueueTime()).isEqualTo(NOW);
    }

    @Test
    void dequeueMovesMessageToProcessingAndRecordsDeadline() throws Exception {
        String raw = rawMessage("job-1", 1);
        when(listOps.move("media-jobs:queue:pending", Direction.RIGHT, "media-jobs:queue:processing", Direction.LEFT,
                Duration.ofSeconds(2))).thenReturn(raw);

        Optional<Delivery> delivery = queue.dequeue(Duration.ofSeconds(2));

        assertThat(delivery).isPresent();
        assertThat(delivery.get().jobId()).isEqualTo("job-1");
        assertThat(delivery.get().token()).isEqualTo(raw);
        verify(zSetOps).add("media-jobs:queue:deadlines", raw, (double) NOW.plus(VISIBILITY).toEpochMilli());
    }

    @Test
    void dequeueReturnsEmptyOnTimeout() {
        when(listOps.move("media-jobs:queue:pending", Direction.RIGHT, "media-jobs:queue:processing", Direction.LEFT,
                Duration.ofSeconds(2))).thenReturn(null);

        assertThat(queue.dequeue(Duration.ofSeconds(2))).isEmpty();
        verify(zSetOps, never()).add(anyString(), anyString(), anyDouble());
    }

    @Test
    void ackRemovesMessageAndDeadline() throws Exception {
        String raw = rawMessage("job-1", 1);

        queue.ack(raw);

        verify(listOps).remove("media-jobs:queue:processing", 1, raw);
        verify(zSetOps).remove("media-jobs:queue:deadlines", raw);
    }

    @Test
    @SuppressWarnings("unchecked")
    void nackRequeuesWithIncrementedDeliveryAttempt() throws Exception {
        String raw = rawMessage("job-1", 1);
        when(redis.execute(any(RedisScript.class), anyList(), any(), any())).thenReturn(1L);

        queue.nack(raw);

        verify(redis).execute(
                any(RedisScript.class),
                eq(List.of("media-jobs:queue:processing", "media-jobs:queue:deadlines", "media-jobs:queue:pending")),
                eq(raw),
                argThat(next -> readQuietly(next.toString()).deliveryAttempt() == 2
                        && readQuietly(next.toString()).jobId().equals("job-1")));
    }

    @Test
    @SuppressWarnings("unchecked")
    void requeueExpiredDeliveriesAdoptsOrphansAndMovesOverdueMessages() throws Exception {
        String orphan = rawMessage("job-orphan", 1);
        String overdue = rawMessage("job-overdue", 1);
        when(listOps.range("media-jobs:queue:processing", 0, -1)).thenReturn(List.of(orphan, overdue));
        when(zSetOps.score("media-jobs:queue:deadlines", orphan)).thenReturn(null);
        when(zSetOps.score("media-jobs:queue:deadlines", overdue)).thenReturn((double) NOW.minusSeconds(5).toEpochMilli());
        when(zSetOps.rangeByScore("media-jobs:queue:deadlines", 0, NOW.toEpochMilli())).thenReturn(Set.of(overdue));
        when(redis.execute(any(RedisScript.class), anyList(), any(), any())).thenReturn(1L);

        int requeued = queue.requeueExpiredDeliveries();

        assertThat(requeued).isEqualTo(1);
        verify(zSetOps).add("media-jobs:queue:deadlines", orphan, (double) NOW.plus(VISIBILITY).toEpochMilli());
        verify(zSetOps, never()).add(eq("media-jobs:queue:deadlines"), eq(overdue), anyDouble());
    }

    @Test
    void redisFailureSurfacesAsTransientInfraError() {
        when(listOps.leftPush(anyString(), anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> queue.enqueue("job-1"))
                .isInstanceOf(TransientInfraException.class)
                .satisfies(e -> assertThat(((TransientInfraException) e).code()).isEqualTo("queue_unavailable"));
    }

    private String rawMessage(String jobId, int attempt) throws Exception {
        return objectMapper.writeValueAsString(new QueueMessage("msg-" + jobId, jobId, NOW, attempt));
    }

    private QueueMessage readQuietly(String raw) {
        try {
            return objectMapper.readValue(raw, QueueMessage.class);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
