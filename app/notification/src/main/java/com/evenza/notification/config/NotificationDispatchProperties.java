/*
 * Where: Notification configuration binding
 * What: Limits applied when a dispatch failure is recorded
 * Why: last_error is a bounded column
 */
package com.evenza.notification.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.dispatch")
@Validated
public record NotificationDispatchProperties(@Positive int errorMessageMaxLength) {}
