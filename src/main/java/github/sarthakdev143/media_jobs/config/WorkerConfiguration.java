package github.sarthakdev143.media_jobs.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@EnableScheduling
public class WorkerConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "media-jobs.worker.enabled", havingValue = "true", matchIfMissing = true)
    ThreadPoolTaskExecutor workerExecutor(MediaJobsProperties properties) {
        int slots = Math.max(1, properties.getWorker().getSlots());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(slots);
        executor.setMaxPoolSize(slots);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("media-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }

    @Bean
    ThreadPoolTaskScheduler taskScheduler(MediaJobsProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(2, properties.getWorker().getSlots() + 1));
        scheduler.setThreadNamePrefix("media-scheduler-");
        return scheduler;
    }
}
