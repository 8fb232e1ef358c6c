package dev.memorynotify.notifier;

import com.google.common.annotations.VisibleForTesting;
import dev.memorynotify.common.config.TimeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class NotifierApplication {

  private static final Logger logger = LoggerFactory.getLogger(NotifierApplication.class);
  private static final String CONFIG_OPTION = "--config";

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /** Starts the context, runs one slot and returns the process exit code. */
  public static int run(String[] args) {
    final SpringApplicationBuilder builder =
        new SpringApplicationBuilder(NotifierApplication.class)
            .web(WebApplicationType.NONE)
            .logStartupInfo(false);
    builder.application().setAddCommandLineProperties(false);
    final String configPath = extractConfigPath(args);
    if (configPath != null) {
      builder.properties("spring.config.additional-location=file:" + configPath);
    }
    try {
      final ConfigurableApplicationContext context = builder.run(args);
      return SpringApplication.exit(context);
    } catch (RuntimeException ex) {
      logger.error("notifier failed to start: {}", ex.getMessage());
      return 1;
    }
  }

  /** Configuration files are bound before picocli parses, so the path is read up front. */
  @VisibleForTesting
  static String extractConfigPath(String[] args) {
    for (int i = 0; i < args.length; i++) {
      final String arg = args[i];
      if (arg.startsWith(CONFIG_OPTION + "=")) {
        return arg.substring(CONFIG_OPTION.length() + 1);
      }
      if (arg.equals(CONFIG_OPTION) && i + 1 < args.length) {
        return args[i + 1];
      }
    }
    return null;
  }
}
