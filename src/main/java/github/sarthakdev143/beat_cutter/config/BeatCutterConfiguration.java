package github.sarthakdev143.beat_cutter.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Random;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(BeatCutterProperties.class)
public class BeatCutterConfiguration {

    public static final String SESSION_TASK_EXECUTOR = "sessionTaskExecutor";

    @Bean(name = SESSION_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor sessionTaskExecutor(BeatCutterProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.maxConcurrentSessions());
        executor.setMaxPoolSize(properties.maxConcurrentSessions());
        executor.setQueueCapacity(properties.sessionQueueCapacity());
        executor.setThreadNamePrefix("beat-session-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random clipShuffleRandom() {
        return new Random();
    }
}
