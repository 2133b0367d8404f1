package github.sarthakdev143.media_jobs.worker;

import github.sarthakdev143.media_jobs.config.MediaJobsProperties;
import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import github.sarthakdev143.media_jobs.model.Delivery;
import github.sarthakdev143.media_jobs.queue.TaskQueue;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Component
@ConditionalOnProperty(name = "media-jobs.worker.enabled", havingValue = "true", matchIfMissing = true)
public class JobWorkerPool implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(JobWorkerPool.class);

    private final TaskQueue queue;
    private final JobProcessor processor;
    private final TaskExecutor workerExecutor;
    private final int slots;
    private final Duration pollTimeout;
    private final int maxDeliveryAttempts;
    private final IntervalFunction infraBackoff;
    private volatile boolean running;

    public JobWorkerPool(
            TaskQueue queue,
            JobProcessor processor,
            @Qualifier("workerExecutor") TaskExecutor workerExecutor,
            IntervalFunction infraBackoff,
            MediaJobsProperties properties) {
        this.queue = queue;
        this.processor = processor;
        this.workerExecutor = workerExecutor;
        this.slots = properties.getWorker().getSlots();
        this.pollTimeout = properties.getQueue().getPollTimeout();
        this.maxDeliveryAttempts = properties.getQueue().getMaxDeliveryAttempts();
        this.infraBackoff = infraBackoff;
    }

    @Override
    public void start() {
        running = true;
        for (int slot = 0; slot < slots; slot++) {
            int slotNumber = slot;
            workerExecutor.execute(() -> runSlot(slotNumber));
        }
        logger.info("Started {} worker slot(s)", slots);
    }

    @Override
    public void stop() {
        running = false;
        logger.info("Stopping worker slots, in-flight jobs finish their current attempt");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void runSlot(int slotNumber) {
        int consecutiveFailures = 0;
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
                consecutiveFailures = 0;
            } catch (TransientInfraException e) {
                logger.warn("Worker slot {} hit {}: {}", slotNumber, e.code(), e.getMessage());
                if (!pause(++consecutiveFailures)) {
                    break;
                }
            } catch (RuntimeException e) {
                logger.error("Worker slot {} failed unexpectedly", slotNumber, e);
                if (!pause(++consecutiveFailures)) {
                    break;
                }
            }
        }
        logger.debug("Worker slot {} stopped", slotNumber);
    }

    /**
     * @return whether a delivery was processed
     */
    boolean pollOnce() {
        Optional<Delivery> delivery = queue.dequeue(pollTimeout);
        if (delivery.isEmpty()) {
            return false;
        }
        try {
            processor.process(delivery.get());
        } catch (TransientInfraException e) {
            releaseQuietly(delivery.get());
            throw e;
        } catch (RuntimeException e) {
            if (delivery.get().message().deliveryAttempt() >= maxDeliveryAttempts) {
                dropPoisonDelivery(delivery.get(), e);
            } else {
                releaseQuietly(delivery.get());
            }
            throw e;
        }
        return true;
    }

    private void dropPoisonDelivery(Delivery delivery, RuntimeException cause) {
        logger.error("Dropping delivery {} for job {} after {} failed deliveries",
                delivery.message().messageId(), delivery.jobId(), delivery.message().deliveryAttempt(), cause);
        try {
            queue.ack(delivery.token());
        } catch (TransientInfraException e) {
            logger.warn("Could not drop delivery for job {}, it comes back after the visibility timeout", delivery.jobId());
        }
    }

    private void releaseQuietly(Delivery delivery) {
        try {
            queue.nack(delivery.token());
        } catch (TransientInfraException e) {
            logger.warn("Could not return delivery for job {}, it comes back after the visibility timeout", delivery.jobId());
        }
    }

    private boolean pause(int consecutiveFailures) {
        try {
            Thread.sleep(infraBackoff.apply(consecutiveFailures));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
