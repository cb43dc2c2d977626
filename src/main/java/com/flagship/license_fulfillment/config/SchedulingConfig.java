package com.flagship.license_fulfillment.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Time and scheduling infrastructure.
 *
 * All time-dependent components take the {@link Clock} bean so tests can pin it.
 * {@code taskScheduler} runs the {@code @Scheduled} sweeps and the outbox
 * relay. Blockchain monitors get their own pool so a burst of pending crypto
 * payments cannot starve those jobs.
 */
@Configuration
public class SchedulingConfig {

    public static final String CRYPTO_MONITOR_SCHEDULER = "cryptoMonitorScheduler";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("fulfillment-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean(name = CRYPTO_MONITOR_SCHEDULER)
    public ThreadPoolTaskScheduler cryptoMonitorScheduler(FulfillmentProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getMonitor().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("crypto-monitor-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
