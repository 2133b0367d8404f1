package github.sarthakdev143.media_jobs.store;

import github.sarthakdev143.media_jobs.model.Job;
import github.sarthakdev143.media_jobs.model.JobState;
import github.sarthakdev143.media_jobs.model.JobUpdate;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryJobRecordStore implements JobRecordStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobRecordStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String create(Job job) {
        Job existing = jobs.putIfAbsent(job.id(), job);
        if (existing != null) {
            throw new IllegalStateException("Job already exists: " + job.id());
        }
        return job.id();
    }

    @Override
    public Optional<Job> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
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

        AtomicBoolean applied = new AtomicBoolean(false);
        jobs.computeIfPresent(jobId, (ignored, current) -> {
            if (!matches(current, expectedState, expectedAttempt)) {
                return current;
            }
            Job next = current.transitionTo(newState, update, clock.instant());
            applied.set(true);
            return next;
        });
        return applied.get();
    }

    @Override
    public boolean renewLease(String jobId, int expectedAttempt, Instant leaseExpiresAt) {
        AtomicBoolean renewed = new AtomicBoolean(false);
        jobs.computeIfPresent(jobId, (ignored, current) -> {
            if (!matches(current, JobState.RUNNING, expectedAttempt)) {
                return current;
            }
            renewed.set(true);
            return current.withLease(leaseExpiresAt);
        });
        return renewed.get();
    }

    @Override
    public List<Job> findQueuedBefore(Instant cutoff, int limit) {
        return jobs.values()
                .stream()
                .filter(job -> job.state() == JobState.QUEUED)
                .filter(job -> job.updatedAt().isBefore(cutoff))
                .sorted(Comparator.comparing(Job::updatedAt))
                .limit(limit)
                .toList();
    }

    @Override
    public List<Job> findRunningLeaseExpired(Instant now, int limit) {
        return jobs.values()
                .stream()
                .filter(job -> job.state() == JobState.RUNNING)
                .filter(job -> job.leaseExpiresAt().isBefore(now))
                .sorted(Comparator.comparing(Job::leaseExpiresAt))
                .limit(limit)
                .toList();
    }

    @Override
    public int purgeTerminalBefore(Instant cutoff) {
        int removed = 0;
        for (Job job : List.copyOf(jobs.values())) {
            if (job.state().isTerminal()
                    && job.updatedAt().isBefore(cutoff)
                    && jobs.remove(job.id(), job)) {
                removed++;
            }
        }
        return removed;
    }

    static boolean matches(Job current, JobState expectedState, int expectedAttempt) {
        return current.state() == expectedState
                && (expectedAttempt == ANY_ATTEMPT || current.attemptCount() == expectedAttempt);
    }
}
