/*
 * Where: Notification configuration binding
 * What: Interval and batch size of the scheduled announcement sweep
 * Why: Lets operators slow down or disable dispatch without a redeploy
 */
package com.evenza.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.sweep")
@Validated
public record NotificationSweepProperties(
    boolean enabled, @NotNull Duration pollInterval, @Positive int batchSize) {

  @AssertTrue(message = "notification.sweep.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    // null is reported by @NotNull.
    return pollInterval == null || (!pollInterval.isZero() && !pollInterval.isNegative());
  }
}
