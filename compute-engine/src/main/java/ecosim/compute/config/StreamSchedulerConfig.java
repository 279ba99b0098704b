package ecosim.compute.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class StreamSchedulerConfig {

    public static final String STREAM_SCHEDULER = "simulationStreamScheduler";

    @Bean(name = STREAM_SCHEDULER)
    public ThreadPoolTaskScheduler simulationStreamScheduler(StreamProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.schedulerPoolSize());
        scheduler.setThreadNamePrefix("sim-stream-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
