package github.sarthakdev143.media_jobs.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.model.Job;
import github.sarthakdev143.media_jobs.model.JobState;
import github.sarthakdev143.media_jobs.model.JobUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Jobs live in {@code <prefix>:job:<id>} hashes; {@code <prefix>:jobs:queued} and
 * {@code <prefix>:jobs:running} index them by queue time and lease expiry.
 */
public class RedisJobRecordStore implements JobRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisJobRecordStore.class);
    private static final int MAX_CAS_ROUNDS = 8;

    private static final RedisScript<Long> CREATE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 1 then return 0 end\n"
                    + "redis.call('HSET', KEYS[1], 'version', ARGV[1], 'state', ARGV[2], 'payload', ARGV[3])\n"
                    + "redis.call('ZADD', KEYS[2], ARGV[4], ARGV[5])\n"
                    + "return 1",
            Long.class);

    private static final RedisScript<Long> TRANSITION_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('HGET', KEYS[1], 'version') ~= ARGV[1] then return 0 end\n"
                    + "redis.call('HSET', KEYS[1], 'version', ARGV[2], 'state', ARGV[3], 'payload', ARGV[4])\n"
                    + "if ARGV[6] ~= '' then redis.call('ZADD', KEYS[2], ARGV[6], ARGV[5])"
                    + " else redis.call('ZREM', KEYS[2], ARGV[5]) end\n"
                    + "if ARGV[7] ~= '' then redis.call('ZADD', KEYS[3], ARGV[7], ARGV[5])"
                    + " else redis.call('ZREM', KEYS[3], ARGV[5]) end\n"
                    + "if ARGV[8] ~= '0' then redis.call('PEXPIRE', KEYS[1], ARGV[8]) end\n"
                    + "return 1",
            Long.class);

    private static final RedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('HGET', KEYS[1], 'version') ~= ARGV[1] then return 0 end\n"
                    + "redis.call('HSET', KEYS[1], 'version', ARGV[2], 'payload', ARGV[3])\n"
                    + "redis.call('ZADD', KEYS[2], ARGV[4], ARGV[5])\n"
                    + "return 1",
            Long.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration retention;

    public RedisJobRecordStore(
            StringRedisTemplate redis,
            ObjectMapper objectMapper,
            Clock clock,
            String keyPrefix,
            Duration retention) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
        this.retention = retention;
    }

    @Override
    public String create(Job job) {
        String payload = serialize(job);
        Long created = withRedis(() -> redis.execute(
                CREATE_SCRIPT,
                List.of(jobKey(job.id()), queuedIndexKey()),
                Long.toString(job.version()),
                job.state().name(),
                payload,
                Long.toString(job.updatedAt().toEpochMilli()),
                job.id()));
        if (created == null || created == 0L) {
            throw new IllegalStateException("Job already exists: " + job.id());
        }
        return job.id();
    }

    @Override
    public Optional<Job> get(String jobId) {
        return readVersioned(jobId).map(VersionedJob::job);
    }

    @Override
    public boolean compareAndTransition(
            String jobId,
            JobState expectedState,
            int expectedAttempt,
            JobState newState,
            JobUpdate update) {
        if (!expectedState.canTransitionTo(newState)) {
            throw new IllegalArgumentException("Illegal job transition " + expectedState + " -> " + newState);
        }

        for (int round = 0; round < MAX_CAS_ROUNDS; round++) {
            Optional<VersionedJob> current = readVersioned(jobId);
            if (current.isEmpty()
                    || !InMemoryJobRecordStore.matches(current.get().job(), expectedState, expectedAttempt)) {
                return false;
            }

            Job next = current.get().job().transitionTo(newState, update, clock.instant());
            String queuedScore = newState == JobState.QUEUED
                    ? Long.toString(next.updatedAt().toEpochMilli())
                    : "";
            String runningScore = newState == JobState.RUNNING
                    ? Long.toString(next.leaseExpiresAt().toEpochMilli())
                    : "";
            String expireMillis = newState.isTerminal() ? Long.toString(retention.toMillis()) : "0";

            Long applied = withRedis(() -> redis.execute(
                    TRANSITION_SCRIPT,
                    List.of(jobKey(jobId), queuedIndexKey(), runningIndexKey()),
                    current.get().version(),
                    Long.toString(next.version()),
                    newState.name(),
                    serialize(next),
                    jobId,
                    queuedScore,
                    runningScore,
                    expireMillis));
            if (applied != null && applied == 1L) {
                return true;
            }
            logger.debug("Concurrent update on job {} while moving {} -> {}, re-reading", jobId, expectedState, newState);
        }
        throw new TransientInfraException(
                "store_contention",
                "Gave up updating job " + jobId + " after " + MAX_CAS_ROUNDS + " concurrent modifications.");
    }

    @Override
    public boolean renewLease(String jobId, int expectedAttempt, Instant leaseExpiresAt) {
        for (int round = 0; round < MAX_CAS_ROUNDS; round++) {
            Optional<VersionedJob> current = readVersioned(jobId);
            if (current.isEmpty()
                    || !InMemoryJobRecordStore.matches(current.get().job(), JobState.RUNNING, expectedAttempt)) {
                return false;
            }

            Job next = current.get().job().withLease(leaseExpiresAt);
            Long applied = withRedis(() -> redis.execute(
                    RENEW_SCRIPT,
                    List.of(jobKey(jobId), runningIndexKey()),
                    current.get().version(),
                    Long.toString(next.version()),
                    serialize(next),
                    Long.toString(leaseExpiresAt.toEpochMilli()),
                    jobId));
            if (applied != null && applied == 1L) {
                return true;
            }
        }
        throw new TransientInfraException(
                "store_contention",
                "Gave up renewing the lease of job " + jobId + " after " + MAX_CAS_ROUNDS + " concurrent modifications.");
    }

    @Override
    public List<Job> findQueuedBefore(Instant cutoff, int limit) {
        return findIndexed(queuedIndexKey(), cutoff, limit, JobState.QUEUED);
    }

    @Override
    public List<Job> findRunningLeaseExpired(Instant now, int limit) {
        return findIndexed(runningIndexKey(), now, limit, JobState.RUNNING);
    }

    @Override
    public int purgeTerminalBefore(Instant cutoff) {
        return 0;
    }

    private List<Job> findIndexed(String indexKey, Instant before, int limit, JobState expectedState) {
        Set<String> ids = withRedis(() -> redis.opsForZSet()
                .rangeByScore(indexKey, 0, before.toEpochMilli() - 1, 0, limit));
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }

        List<Job> jobs = new ArrayList<>();
        for (String id : ids) {
            Optional<Job> job = get(id);
            if (job.isPresent() && job.get().state() == expectedState) {
                jobs.add(job.get());
            } else {
                withRedis(() -> redis.opsForZSet().remove(indexKey, id));
            }
        }
        return jobs;
    }

    private Optional<VersionedJob> readVersioned(String jobId) {
        List<Object> fields = withRedis(() -> redis.opsForHash().multiGet(jobKey(jobId), List.<Object>of("version", "payload")));
        if (fields == null || fields.size() < 2 || fields.get(0) == null || fields.get(1) == null) {
            return Optional.empty();
        }
        return Optional.of(new VersionedJob(fields.get(0).toString(), deserialize(fields.get(1).toString())));
    }

    private String serialize(Job job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize job " + job.id(), e);
        }
    }

    private Job deserialize(String payload) {
        try {
            return objectMapper.readValue(payload, Job.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored job payload is not readable.", e);
        }
    }

    private <T> T withRedis(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            throw new TransientInfraException("store_unavailable", "Job record store is unavailable.", e);
        }
    }

    private String jobKey(String jobId) {
        return keyPrefix + ":job:" + jobId;
    }

    private String queuedIndexKey() {
        return keyPrefix + ":jobs:queued";
    }

    private String runningIndexKey() {
        return keyPrefix + ":jobs:running";
    }

    private record VersionedJob(String version, Job job) {
    }
}
