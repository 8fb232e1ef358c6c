/*
 * Where: Notifier configuration
 * What: Provides randomness, blocking sleep and the meter registry for a slot run
 * Why: Selection, delay and retry must be replaceable by deterministic doubles in tests
 */
package dev.memorynotify.notifier.config;

import dev.memorynotify.notifier.service.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Random;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotifierRuntimeConfig {

  @Bean
  public Random selectionRandom() {
    return new Random();
  }

  @Bean
  public Sleeper sleeper() {
    return duration -> Thread.sleep(duration.toMillis());
  }

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry meterRegistry() {
    // one-shot process: counters are read back for the run summary instead of being scraped
    return new SimpleMeterRegistry();
  }
}
