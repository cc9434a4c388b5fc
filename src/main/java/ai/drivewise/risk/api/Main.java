package ai.drivewise.risk.api;

import ai.drivewise.risk.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code drivewise} dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: drivewise <run|grid|score|route> [options]";
  private static final String HELP_TEXT = """
      DriveWise risk engine

      Usage:
        drivewise <command> [options]

      Commands:
        run     Start the scheduled traffic, vehicle, refresh and full-pipeline jobs (run --help for details)
        grid    Print the sampling grid around a coordinate
        score   Compute one on-demand risk score
        route   Print live traffic along a route between two points

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM. Flags and key/value
   * arguments are forwarded to the subcommand untouched.
   *
   * @param args dispatcher arguments
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.command().isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = input.command().get();
    String[] delegateArgs = withoutCommand(args, command);
    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "grid" -> GridCli.run(delegateArgs);
      case "score" -> ScoreCli.run(delegateArgs);
      case "route" -> RouteCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutCommand(String[] args, String command) {
    List<String> out = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().toLowerCase(Locale.ROOT).equals(command)) {
        removed = true;
        continue;
      }
      out.add(arg);
    }
    return out.toArray(String[]::new);
  }
}
