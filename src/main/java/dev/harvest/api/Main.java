package dev.harvest.api;

import dev.harvest.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for {@code harvest build|history|cache}.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: harvest <build|history|cache> [options]";
  private static final String HELP_TEXT = """
      HARVEST command dispatcher

      Usage:
        harvest <command> [options]

      Commands:
        build     Run the stage graph incrementally (build --help for details)
        history   Show recorded stage runs
        cache     Evict fetch cache entries by stage tag

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (input.help() && remainder.length == 0) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = delegateArgs(args, remainder[0]);
    return switch (command) {
      case "build" -> BuildCli.run(delegateArgs);
      case "history" -> HistoryCli.run(delegateArgs);
      case "cache" -> CacheCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] delegateArgs(String[] args, String command) {
    for (int i = 0; i < args.length; i++) {
      if (args[i] != null && args[i].trim().equals(command)) {
        return Arrays.copyOfRange(args, i + 1, args.length);
      }
    }
    return new String[0];
  }
}
