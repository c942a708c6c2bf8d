package ch.wordgame.wordgamebackend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools of the application.
 *
 * <ul>
 *   <li>{@link TaskScheduler}: runs @Scheduled jobs (idle game eviction)</li>
 *   <li>turn controller executor: one long-lived worker thread per active game</li>
 * </ul>
 */
@Configuration
public class ConcurrencyConfig {

    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("wordgame-scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Unbounded pool: a worker blocks on its game's mailbox for the game's whole lifetime,
     * so every active game needs its own thread. Workers are interrupted on shutdown.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService turnControllerExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("turn-controller-"));
    }
}
