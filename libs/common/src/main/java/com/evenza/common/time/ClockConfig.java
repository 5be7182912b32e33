/*
 * Where: Shared configuration
 * What: Exposes the UTC Clock every service injects
 * Why: Tests replace it with Clock.fixed to pin "now"
 */
package com.evenza.common.time;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
