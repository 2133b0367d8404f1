package github.sarthakdev143.media_jobs.worker;

import github.sarthakdev143.media_jobs.config.MediaJobsProperties;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.integration.storage.ArtifactStore;
import github.sarthakdev143.media_jobs.model.ErrorClass;
import github.sarthakdev143.media_jobs.model.Job;
import github.sarthakdev143.media_jobs.model.JobError;
import github.sarthakdev143.media_jobs.model.JobState;
import github.sarthakdev143.media_jobs.model.JobUpdate;
import github.sarthakdev143.media_jobs.queue.InMemoryTaskQueue;
import github.sarthakdev143.media_jobs.queue.TaskQueue;
import github.sarthakdev143.media_jobs.store.InMemoryJobRecordStore;
import github.sarthakdev143.media_jobs.support.MutableClock;
import github.sarthakdev143.media_jobs.support.TestJobs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobReaperTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private ArtifactStore artifactStore;

    private MutableClock clock;
    private InMemoryJobRecordStore store;
    private InMemoryTaskQueue queue;
    private MediaJobsProperties properties;
    private JobReaper reaper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryJobRecordStore(clock);
        queue = new InMemoryTaskQueue(clock, Duration.ofMinutes(50));
        properties = new MediaJobsProperties();
        reaper = new JobReaper(store, queue, artifactStore, clock, properties, new SimpleMeterRegistry());
    }

    @Test
    void queuedJobPastTtlIsExpired() {
        store.create(TestJobs.queued("stale", T0));
        clock.advance(Duration.ofMinutes(20));
        store.create(TestJobs.queued("fresh", clock.instant()));
        clock.advance(Duration.ofMinutes(11));

        int expired = reaper.expireQueued(clock.instant(), 100);

        assertThat(expired).isEqualTo(1);
        Job stale = store.get("stale").orElseThrow();
        assertThat(stale.state()).isEqualTo(JobState.EXPIRED);
        assertThat(stale.error().code()).isEqualTo(JobError.QUEUED_TTL_EXCEEDED);
        assertThat(store.get("fresh").orElseThrow().state()).isEqualTo(JobState.QUEUED);
    }

    @Test
    void requeuedJobIsNotExpiredByQueuedTtl() {
        store.create(TestJobs.queued("retried", T0));
        store.compareAndTransition("retried", JobState.QUEUED, 0, JobState.RUNNING, JobUpdate.claim(1, T0.plus(Duration.ofMinutes(45))));
        store.compareAndTransition("retried", JobState.RUNNING, 1, JobState.QUEUED, JobUpdate.released());
        clock.advance(Duration.ofMinutes(31));

        int expired = reaper.expireQueued(clock.instant(), 100);

        assertThat(expired).isZero();
        Job retried = store.get("retried").orElseThrow();
        assertThat(retried.state()).isEqualTo(JobState.QUEUED);
        assertThat(retried.attemptCount()).isEqualTo(1);
    }

    @Test
    void expiredLeaseWithAttemptsLeftIsRequeued() {
        store.create(TestJobs.queued("job-1", T0));
        store.compareAndTransition("job-1", JobState.QUEUED, 0, JobState.RUNNING, JobUpdate.claim(1, T0.plus(Duration.ofMinutes(1))));
        clock.advance(Duration.ofMinutes(2));

        int recovered = reaper.recoverLeases(clock.instant(), 100);

        assertThat(recovered).isEqualTo(1);
        Job job = store.get("job-1").orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.QUEUED);
        assertThat(job.attemptCount()).isEqualTo(1);
        assertThat(queue.pendingCount()).isEqualTo(1);
    }

    @Test
    void expiredLeaseOnFinalAttemptFailsJob() {
        store.create(TestJobs.queued("job-1", T0));
        store.compareAndTransition("job-1", JobState.QUEUED, 0, JobState.RUNNING, JobUpdate.claim(3, T0.plus(Duration.ofMinutes(1))));
        clock.advance(Duration.ofMinutes(2));

        reaper.recoverLeases(clock.instant(), 100);

        Job job = store.get("job-1").orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.FAILED);
        assertThat(job.error().code()).isEqualTo(JobReaper.LEASE_EXPIRED_CODE);
        assertThat(job.error().errorClass()).isEqualTo(ErrorClass.TRANSIENT_INFRA);
        assertThat(queue.pendingCount()).isZero();
    }

    @Test
    void liveLeaseIsLeftAlone() {
        store.create(TestJobs.queued("job-1", T0));
        store.compareAndTransition("job-1", JobState.QUEUED, 0, JobState.RUNNING, JobUpdate.claim(1, T0.plus(Duration.ofMinutes(45))));
        clock.advance(Duration.ofMinutes(10));

        assertThat(reaper.recoverLeases(clock.instant(), 100)).isZero();
        assertThat(store.get("job-1").orElseThrow().state()).isEqualTo(JobState.RUNNING);
    }

    @Test
    void artifactsOlderThanRetentionArePurged() {
        when(artifactStore.deleteOlderThan("outputs/", T0.minus(Duration.ofDays(7)))).thenReturn(2);
        when(artifactStore.deleteOlderThan("uploads/", T0.minus(Duration.ofDays(7)))).thenReturn(3);

        assertThat(reaper.purgeArtifacts(T0)).isEqualTo(5);
    }

    @Test
    void zeroArtifactRetentionDisablesPurge() {
        properties.getStorage().setArtifactRetention(Duration.ZERO);

        assertThat(reaper.purgeArtifacts(T0)).isZero();
        verifyNoInteractions(artifactStore);
    }

    @Test
    void sweepSurvivesBackendOutage() {
        TaskQueue brokenQueue = mock(TaskQueue.class);
        when(brokenQueue.requeueExpiredDeliveries()).thenThrow(new TransientInfraException("redis_unavailable", "down"));
        JobReaper brokenReaper = new JobReaper(store, brokenQueue, artifactStore, clock, properties, new SimpleMeterRegistry());

        assertThatCode(brokenReaper::sweep).doesNotThrowAnyException();
        verifyNoInteractions(artifactStore);
    }

    @Test
    void sweepRunsEveryHousekeepingStep() {
        store.create(TestJobs.queued("stale", T0));
        clock.advance(Duration.ofMinutes(31));
        when(artifactStore.deleteOlderThan(anyString(), any(Instant.class))).thenReturn(0);

        reaper.sweep();

        assertThat(store.get("stale").orElseThrow().state()).isEqualTo(JobState.EXPIRED);
        verify(artifactStore).deleteOlderThan("outputs/", clock.instant().minus(Duration.ofDays(7)));
        verify(artifactStore).deleteOlderThan("uploads/", clock.instant().minus(Duration.ofDays(7)));
    }
}
