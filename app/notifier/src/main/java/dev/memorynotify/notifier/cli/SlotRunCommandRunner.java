package dev.memorynotify.notifier.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/** Executes {@link SlotRunCommand} once the context is up and keeps its exit code. */
@Component
@RequiredArgsConstructor
public class SlotRunCommandRunner implements CommandLineRunner, ExitCodeGenerator {

  private final SlotRunCommand command;
  private int exitCode;

  @Override
  public void run(String... args) {
    exitCode = new CommandLine(command).execute(args);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
