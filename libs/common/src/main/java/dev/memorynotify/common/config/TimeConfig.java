/*
 * Where: Common configuration
 * What: Exposes the Clock used for slot dates, delay windows and state timestamps
 * Why: Slot runs reason in local calendar days, so the zone must be explicit and injectable
 */
package dev.memorynotify.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${notifier.time-zone:}") String timeZone) {
    return Clock.system(resolveZone(timeZone));
  }

  static ZoneId resolveZone(String timeZone) {
    if (timeZone == null || timeZone.isBlank()) {
      return ZoneId.systemDefault();
    }
    return ZoneId.of(timeZone.trim());
  }
}
