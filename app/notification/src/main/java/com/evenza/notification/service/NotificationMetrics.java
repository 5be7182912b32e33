/*
 * Where: Notification service layer
 * What: Application metrics for fan-out, the sweep and read tracking
 * Why: Dispatch outcomes and sweep backlog are observable from Prometheus
 */
package com.evenza.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class NotificationMetrics {

  static final String METRIC_DISPATCH_TOTAL = "announcement.dispatch.total";
  static final String METRIC_FANOUT_SIZE = "announcement.fanout.size";
  static final String METRIC_SWEEP_DUE = "announcement.sweep.due";
  static final String METRIC_SWEEP_DURATION = "announcement.sweep.duration";
  static final String METRIC_READ_TOTAL = "notification.read.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger sweepDue = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
  private final DistributionSummary fanOutSize;
  private final Timer sweepDuration;
  private final Counter readCounter;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_SWEEP_DUE, sweepDue, AtomicInteger::get)
        .description("Scheduled announcements found due by the last sweep")
        .register(meterRegistry);
    this.fanOutSize =
        DistributionSummary.builder(METRIC_FANOUT_SIZE)
            .description("Notification rows inserted per fan-out")
            .register(meterRegistry);
    this.sweepDuration =
        Timer.builder(METRIC_SWEEP_DURATION)
            .description("Wall time of one sweep tick")
            .register(meterRegistry);
    this.readCounter =
        Counter.builder(METRIC_READ_TOTAL)
            .description("Notifications marked read by their recipient")
            .register(meterRegistry);
  }

  /** result is one of {@code sent}, {@code empty} or {@code failed}. */
  public void recordDispatchResult(String result) {
    dispatchCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DISPATCH_TOTAL)
                    .description("Fan-out outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordFanOut(int inserted) {
    fanOutSize.record(Math.max(inserted, 0));
  }

  public void updateSweepDue(int due) {
    sweepDue.set(Math.max(due, 0));
  }

  public void recordSweepDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    sweepDuration.record(duration);
  }

  public void recordRead() {
    readCounter.increment();
  }
}
