package solver.cli;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code solve --target 24 --numbers 2,4,8,12 [--operators +,-,*,/] [--tolerance 1e-9]
 *       [--parallel] [--parallelism 4] [--time-budget-ms 500] [--max-results 10] [--distinct]
 *       [--json]}
 *   <li>{@code examples}
 * </ul>
 *
 * <p>Exit codes: 0 success (including "nothing found"), 1 unexpected failure, 2 invalid
 * arguments, 3 search stopped early.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    int exit = run(args);
    if (exit != 0) {
      System.exit(exit);
    }
  }

  static int run(String[] args) {
    String command =
        args != null && args.length > 0 && !args[0].startsWith("--")
            ? args[0].toLowerCase(Locale.ROOT)
            : "solve";
    try {
      return switch (command) {
        case "solve" -> new SolveCommand(System.out).execute(args);
        case "examples" -> new ExamplesCommand().execute(args);
        default -> throw new IllegalArgumentException("Unknown command: " + args[0]);
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      LOG.error("Usage: solve --target <t> --numbers <a,b,...> [options] | examples");
      return 2;
    } catch (RuntimeException ex) {
      LOG.error("Search failed", ex);
      return 1;
    }
  }
}
