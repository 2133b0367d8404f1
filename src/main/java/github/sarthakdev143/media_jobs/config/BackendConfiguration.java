package github.sarthakdev143.media_jobs.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.media_jobs.queue.InMemoryTaskQueue;
import github.sarthakdev143.media_jobs.queue.RedisTaskQueue;
import github.sarthakdev143.media_jobs.queue.TaskQueue;
import github.sarthakdev143.media_jobs.store.InMemoryJobRecordStore;
import github.sarthakdev143.media_jobs.store.JobRecordStore;
import github.sarthakdev143.media_jobs.store.RedisJobRecordStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class BackendConfiguration {

    @Configuration
    @ConditionalOnProperty(name = "media-jobs.backend", havingValue = "redis", matchIfMissing = true)
    static class RedisBackend {

        @Bean
        JobRecordStore jobRecordStore(
                StringRedisTemplate redisTemplate,
                ObjectMapper objectMapper,
                Clock clock,
                MediaJobsProperties properties) {
            return new RedisJobRecordStore(
                    redisTemplate,
                    objectMapper,
                    clock,
                    properties.getJobs().getKeyPrefix(),
                    properties.getJobs().getRetention());
        }

        @Bean
        TaskQueue taskQueue(
                StringRedisTemplate redisTemplate,
                ObjectMapper objectMapper,
                Clock clock,
                MediaJobsProperties properties) {
            return new RedisTaskQueue(
                    redisTemplate,
                    objectMapper,
                    clock,
                    properties.getJobs().getKeyPrefix(),
                    properties.getQueue().getVisibilityTimeout());
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "media-jobs.backend", havingValue = "memory")
    static class InMemoryBackend {

        @Bean
        JobRecordStore jobRecordStore(Clock clock) {
            return new InMemoryJobRecordStore(clock);
        }

        @Bean
        TaskQueue taskQueue(Clock clock, MediaJobsProperties properties) {
            return new InMemoryTaskQueue(clock, properties.getQueue().getVisibilityTimeout());
        }
    }
}
