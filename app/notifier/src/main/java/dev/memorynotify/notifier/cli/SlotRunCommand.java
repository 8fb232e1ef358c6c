/*
 * Where: Notifier command line
 * What: Parses slot run options and hands them to the slot run service
 * Why: One process invocation per slot; the exit code is the scheduler's only signal
 */
package dev.memorynotify.notifier.cli;

import dev.memorynotify.notifier.model.SlotRunRequest;
import dev.memorynotify.notifier.model.SlotRunResult;
import dev.memorynotify.notifier.service.SlotRunService;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

@CommandLine.Command(
    name = "memory-notify",
    mixinStandardHelpOptions = true,
    version = "memory-notify 0.1",
    description = "Selects and pushes one memory or person photo notification slot for all users")
@Component
public class SlotRunCommand implements Callable<Integer> {

  private static final Logger logger = LoggerFactory.getLogger(SlotRunCommand.class);

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
      names = {"--slot"},
      required = true,
      description = "Slot number to process (1-based)")
  int slot;

  @CommandLine.Option(
      names = {"--config"},
      description = "Additional YAML configuration file (read at startup)")
  Path config;

  @CommandLine.Option(
      names = {"--test"},
      description = "Test mode: always send, short delay, [TEST] title, state untouched")
  boolean testMode;

  @CommandLine.Option(
      names = {"--dry-run"},
      description = "Select and render but do not send or save state")
  boolean dryRun;

  @CommandLine.Option(
      names = {"--force"},
      description = "Send even if this slot was already sent today")
  boolean force;

  @CommandLine.Option(
      names = {"--no-delay"},
      description = "Skip the random wait inside the slot window")
  boolean noDelay;

  @CommandLine.Option(
      names = {"--date"},
      description = "Target date as YYYY-MM-DD (default: today)")
  LocalDate date;

  private final SlotRunService slotRunService;
  private final Clock clock;

  public SlotRunCommand(SlotRunService slotRunService, Clock clock) {
    this.slotRunService = slotRunService;
    this.clock = clock;
  }

  @Override
  public Integer call() {
    if (slot < 1) {
      throw new CommandLine.ParameterException(
          spec.commandLine(), "--slot must be at least 1 but was " + slot);
    }
    final SlotRunRequest request =
        new SlotRunRequest(
            slot, date == null ? LocalDate.now(clock) : date, testMode, dryRun, force, noDelay);
    try {
      final SlotRunResult result = slotRunService.run(request);
      return result.successful() ? CommandLine.ExitCode.OK : CommandLine.ExitCode.SOFTWARE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("slot run interrupted while waiting for the delivery window");
      return CommandLine.ExitCode.SOFTWARE;
    }
  }
}
