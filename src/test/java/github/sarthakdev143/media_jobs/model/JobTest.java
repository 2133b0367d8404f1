package github.sarthakdev143.media_jobs.model;

import github.sarthakdev143.media_jobs.support.TestJobs;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void queuedJobStartsWithNoAttemptsAndNoOutcome() {
        Job job = TestJobs.queued("job-1", T0);

        assertThat(job.state()).isEqualTo(JobState.QUEUED);
        assertThat(job.attemptCount()).isZero();
        assertThat(job.outputRef()).isNull();
        assertThat(job.error()).isNull();
        assertThat(job.leaseExpiresAt()).isNull();
        assertThat(job.createdAt()).isEqualTo(job.updatedAt());
    }

    @Test
    void claimSetsAttemptAndLease() {
        Job running = TestJobs.queued("job-1", T0)
                .transitionTo(JobState.RUNNING, JobUpdate.claim(1, T0.plusSeconds(60)), T0.plusSeconds(1));

        assertThat(running.state()).isEqualTo(JobState.RUNNING);
        assertThat(running.attemptCount()).isEqualTo(1);
        assertThat(running.leaseExpiresAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(running.updatedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(running.version()).isEqualTo(1L);
    }

    @Test
    void releaseKeepsAttemptCountAndDropsLease() {
        Job requeued = TestJobs.queued("job-1", T0)
                .transitionTo(JobState.RUNNING, JobUpdate.claim(1, T0.plusSeconds(60)), T0)
                .transitionTo(JobState.QUEUED, JobUpdate.released(), T0.plusSeconds(5));

        assertThat(requeued.state()).isEqualTo(JobState.QUEUED);
        assertThat(requeued.attemptCount()).isEqualTo(1);
        assertThat(requeued.leaseExpiresAt()).isNull();
    }

    @Test
    void succeededJobCarriesOutputOnly() {
        Job succeeded = TestJobs.queued("job-1", T0)
                .transitionTo(JobState.RUNNING, JobUpdate.claim(1, T0.plusSeconds(60)), T0)
                .transitionTo(JobState.SUCCEEDED, JobUpdate.succeeded("s3://bucket/outputs/job-1/output.mp4"), T0);

        assertThat(succeeded.outputRef()).isEqualTo("s3://bucket/outputs/job-1/output.mp4");
        assertThat(succeeded.error()).isNull();
        assertThat(succeeded.leaseExpiresAt()).isNull();
    }

    @Test
    void terminalStatesRejectFurtherTransitions() {
        Job expired = TestJobs.queued("job-1", T0)
                .transitionTo(JobState.EXPIRED, JobUpdate.failed(JobError.queuedTtlExceeded(0, T0)), T0);

        assertThatThrownBy(() -> expired.transitionTo(JobState.RUNNING, JobUpdate.claim(1, T0), T0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("EXPIRED -> RUNNING");
    }

    @Test
    void queuedCannotJumpToSucceeded() {
        Job job = TestJobs.queued("job-1", T0);

        assertThatThrownBy(() -> job.transitionTo(JobState.SUCCEEDED, JobUpdate.succeeded("s3://b/k.mp4"), T0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructorRejectsFailedJobWithoutError() {
        assertThatThrownBy(() -> new Job(
                "job-1", JobState.FAILED, null, TestJobs.defaultParams(), null, null, 1, 3, T0, T0, null, 2L))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("error must be set");
    }

    @Test
    void constructorRejectsAttemptsAboveMaximum() {
        assertThatThrownBy(() -> new Job(
                "job-1", JobState.QUEUED, null, TestJobs.defaultParams(), null, null, 4, 3, T0, T0, null, 0L))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stateMachineAllowsOnlyDocumentedEdges() {
        assertThat(JobState.QUEUED.canTransitionTo(JobState.RUNNING)).isTrue();
        assertThat(JobState.QUEUED.canTransitionTo(JobState.EXPIRED)).isTrue();
        assertThat(JobState.QUEUED.canTransitionTo(JobState.FAILED)).isFalse();
        assertThat(JobState.RUNNING.canTransitionTo(JobState.QUEUED)).isTrue();
        assertThat(JobState.RUNNING.canTransitionTo(JobState.EXPIRED)).isFalse();
        assertThat(JobState.SUCCEEDED.canTransitionTo(JobState.QUEUED)).isFalse();
    }
}
