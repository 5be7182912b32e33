/*
 * Where: Notification scheduling configuration
 * What: Dedicated single-threaded scheduler for the announcement sweep
 * Why: One thread means sweep ticks can never overlap
 */
package com.evenza.notification.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(
    name = "notification.sweep.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SweepSchedulerConfig {

  @Bean
  public ThreadPoolTaskScheduler announcementSweepScheduler() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("announcement-sweep-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(10);
    return scheduler;
  }
}
