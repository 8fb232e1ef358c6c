/*
 * Where: Notifier service layer
 * What: Records dispatch outcomes, retry attempts and run duration
 * Why: The run summary reports the same counters an external registry would scrape
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.model.DispatchOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class NotifierMetrics {

  private static final String METRIC_DISPATCH_TOTAL = "notifier.dispatch.total";
  private static final String METRIC_RETRY_TOTAL = "notifier.upstream.retry.total";
  private static final String METRIC_RUN_DURATION = "notifier.run.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<DispatchOutcome, Counter> dispatchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
  private final Timer runTimer;

  public NotifierMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.runTimer =
        Timer.builder(METRIC_RUN_DURATION)
            .description("Wall-clock duration of one slot run, delay excluded")
            .register(meterRegistry);
  }

  public void recordDispatchOutcome(DispatchOutcome outcome) {
    dispatchCounter(outcome).increment();
  }

  public void recordRetry(String operation) {
    retryCounters
        .computeIfAbsent(
            operation,
            ignored ->
                Counter.builder(METRIC_RETRY_TOTAL)
                    .description("Failed upstream attempts that were retried")
                    .tags(Tags.of("operation", operation))
                    .register(meterRegistry))
        .increment();
  }

  public void recordRunDuration(Duration duration) {
    runTimer.record(duration);
  }

  /** Dispatch counts per outcome, omitting outcomes that never occurred. */
  public Map<DispatchOutcome, Long> dispatchCounts() {
    final Map<DispatchOutcome, Long> counts = new EnumMap<>(DispatchOutcome.class);
    dispatchCounters.forEach((outcome, counter) -> counts.put(outcome, (long) counter.count()));
    return counts;
  }

  public long retryCount() {
    return retryCounters.values().stream().mapToLong(counter -> (long) counter.count()).sum();
  }

  private Counter dispatchCounter(DispatchOutcome outcome) {
    return dispatchCounters.computeIfAbsent(
        outcome,
        ignored ->
            Counter.builder(METRIC_DISPATCH_TOTAL)
                .description("Per-user slot dispatch outcomes")
                .tags(Tags.of("result", outcome.name().toLowerCase(Locale.ROOT)))
                .register(meterRegistry));
  }
}
