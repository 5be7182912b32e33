/*
 * Where: Notification service entry point
 * What: Boots Spring and scans configuration properties
 * Why: Pulls the shared Clock from evenza-common, which lives outside the scanned package
 */
package com.evenza.notification;

import com.evenza.common.time.ClockConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(ClockConfig.class)
public class NotificationApplication {

  public static void main(String[] args) {
    SpringApplication.run(NotificationApplication.class, args);
  }
}
