package github.sarthakdev143.media_jobs.config;

import github.sarthakdev143.media_jobs.exception.TransientUpstreamException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class GenerationConfiguration {

    private static final Duration DOWNLOAD_READ_TIMEOUT = Duration.ofMinutes(5);

    @Bean
    RestTemplate generationRestTemplate(RestTemplateBuilder builder, MediaJobsProperties properties) {
        MediaJobsProperties.Generation generation = properties.getGeneration();
        return builder
                .connectTimeout(generation.getConnectTimeout())
                .readTimeout(generation.getReadTimeout())
                .build();
    }

    @Bean
    RestTemplate downloadRestTemplate(RestTemplateBuilder builder, MediaJobsProperties properties) {
        return builder
                .connectTimeout(properties.getGeneration().getConnectTimeout())
                .readTimeout(DOWNLOAD_READ_TIMEOUT)
                .build();
    }

    @Bean
    Retry generationRetry(MediaJobsProperties properties) {
        MediaJobsProperties.Generation generation = properties.getGeneration();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, generation.getMaxRetries() + 1))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        generation.getInitialBackoff().toMillis(),
                        generation.getBackoffMultiplier(),
                        generation.getMaxBackoff().toMillis()))
                .retryExceptions(TransientUpstreamException.class)
                .build();
        return Retry.of("generation", config);
    }
}
