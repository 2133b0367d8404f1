package github.sarthakdev143.media_jobs.config;

import github.sarthakdev143.media_jobs.exception.TransientInfraException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResilienceConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceConfiguration.class);
    private static final double INFRA_BACKOFF_MULTIPLIER = 2.0;
    private static final double INFRA_BACKOFF_JITTER = 0.5;

    @Bean
    IntervalFunction infraBackoff(MediaJobsProperties properties) {
        MediaJobsProperties.Worker worker = properties.getWorker();
        return IntervalFunction.ofExponentialRandomBackoff(
                worker.getInfraBackoffInitial().toMillis(),
                INFRA_BACKOFF_MULTIPLIER,
                INFRA_BACKOFF_JITTER,
                worker.getInfraBackoffMax().toMillis());
    }

    @Bean
    Retry infraRetry(MediaJobsProperties properties, IntervalFunction infraBackoff) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getWorker().getInfraRetryAttempts()))
                .intervalFunction(infraBackoff)
                .retryExceptions(TransientInfraException.class)
                .build();
        Retry retry = Retry.of("infra", config);
        retry.getEventPublisher().onRetry(event -> logger.warn(
                "Retrying infrastructure call (attempt {}) after {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()));
        return retry;
    }
}
