package github.sarthakdev143.media_jobs.worker;

import github.sarthakdev143.media_jobs.exception.LeaseLostException;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.store.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/** Lease of one running attempt, renewed only while the job is still on that attempt. */
public class AttemptLease {

    private static final Logger logger = LoggerFactory.getLogger(AttemptLease.class);

    private final JobRecordStore store;
    private final String jobId;
    private final int attempt;
    private final Clock clock;
    private final Duration duration;
    private volatile boolean lost;

    public AttemptLease(JobRecordStore store, String jobId, int attempt, Clock clock, Duration duration) {
        this.store = store;
        this.jobId = jobId;
        this.attempt = attempt;
        this.clock = clock;
        this.duration = duration;
    }

    /**
     * @return whether the attempt still owns the job
     */
    public boolean renew() {
        if (lost) {
            return false;
        }
        try {
            if (!store.renewLease(jobId, attempt, clock.instant().plus(duration))) {
                lost = true;
                logger.warn("Job {} attempt {} lost its lease", jobId, attempt);
            }
        } catch (TransientInfraException e) {
            // The next renewal or the final compare-and-transition decides.
            logger.warn("Could not renew lease of job {} attempt {}: {}", jobId, attempt, e.code());
        }
        return !lost;
    }

    public void ensureHeld() {
        if (!renew()) {
            throw new LeaseLostException(jobId, attempt);
        }
    }

    public boolean isLost() {
        return lost;
    }

    public int attempt() {
        return attempt;
    }
}
