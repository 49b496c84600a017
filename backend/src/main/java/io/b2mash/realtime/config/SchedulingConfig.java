package io.b2mash.realtime.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools shared by every tenant connection. Managers never own a thread: their mailboxes
 * drain on {@code connectExecutor} and their timers fire on {@code connectScheduler}.
 */
@Configuration
public class SchedulingConfig {

  @Bean(name = "connectExecutor")
  public ThreadPoolTaskExecutor connectExecutor() {
    var executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("connect-");
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(256);
    // Hand-off queue: blocked pipelines grow the pool instead of starving other tenants
    executor.setQueueCapacity(0);
    executor.setKeepAliveSeconds(60);
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }

  @Bean(name = "connectScheduler")
  public ThreadPoolTaskScheduler connectScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setThreadNamePrefix("connect-timer-");
    scheduler.setPoolSize(4);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }
}
