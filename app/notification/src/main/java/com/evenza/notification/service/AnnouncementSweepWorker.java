/*
 * Where: Notification sweep worker
 * What: Owns the recurring sweep task and its start/stop lifecycle
 * Why: Scheduled announcements need a periodic tick that ends cleanly on shutdown
 */
package com.evenza.notification.service;

import com.evenza.notification.config.NotificationSweepProperties;
import com.evenza.notification.model.SweepResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.sweep.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class AnnouncementSweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(AnnouncementSweepWorker.class);

  private final AnnouncementSweepService sweepService;
  private final NotificationSweepProperties properties;
  private final TaskScheduler scheduler;
  private final AtomicBoolean started;
  private ScheduledFuture<?> task;

  public AnnouncementSweepWorker(
      AnnouncementSweepService sweepService,
      NotificationSweepProperties properties,
      @Qualifier("announcementSweepScheduler") TaskScheduler scheduler) {
    this.sweepService = sweepService;
    this.properties = properties;
    this.scheduler = scheduler;
    this.started = new AtomicBoolean(false);
  }

  /** Schedules the first tick one interval from now; ticks never overlap. */
  @PostConstruct
  public synchronized void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    final Duration interval = properties.pollInterval();
    final Instant firstRun = scheduler.getClock().instant().plus(interval);
    task = scheduler.scheduleWithFixedDelay(this::run, firstRun, interval);
    logger.info("announcement sweep started interval={}", interval);
  }

  @PreDestroy
  public synchronized void stop() {
    if (!started.compareAndSet(true, false)) {
      return;
    }
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    logger.info("announcement sweep stopped");
  }

  public boolean isRunning() {
    return started.get();
  }

  public void run() {
    try {
      final SweepResult result = sweepService.sweep();
      if (result.failed() > 0) {
        logger.warn("announcement sweep had failures failed={} due={}", result.failed(), result.due());
      }
    } catch (RuntimeException ex) {
      logger.warn("announcement sweep failed", ex);
    }
  }
}
