package ca.gc.cra.qaops.api;

import ca.gc.cra.qaops.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code qaops} command line.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: qaops <analyze|kpi> [options]";
  private static final String HELP_TEXT = """
      QAOps alarm analyzer

      Usage:
        qaops <command> [options]

      Commands:
        analyze     Alarm summary for one product and environment (analyze --help for details)
        kpi         Daily KPIs for every configured product and environment

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
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
    String[] delegateArgs = withoutCommand(args, remainder[0]);
    return switch (command) {
      case "analyze" -> AnalyzeCli.run(delegateArgs);
      case "kpi" -> KpiCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  /** Drops the command token; flags are forwarded to the command. */
  private static String[] withoutCommand(String[] args, String command) {
    List<String> rest = new ArrayList<>(Arrays.asList(args));
    for (int i = 0; i < rest.size(); i++) {
      if (rest.get(i) != null && rest.get(i).trim().equals(command)) {
        rest.remove(i);
        break;
      }
    }
    return rest.toArray(String[]::new);
  }
}
