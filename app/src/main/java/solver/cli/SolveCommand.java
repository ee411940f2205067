package solver.cli;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.core.OperatorTable;
import solver.core.Operators;
import solver.core.SearchResult;
import solver.pipeline.SearchDriver;

/** Handles the {@code solve} command. */
final class SolveCommand {
  private static final Logger LOG = LoggerFactory.getLogger(SolveCommand.class);

  private final PrintStream out;

  SolveCommand(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  int execute(String[] args) {
    CliOptions options = parseArgs(args);
    OperatorTable operators = Operators.bySymbols(options.operators());
    SearchDriver driver = new SearchDriver(operators);
    SearchResult result =
        driver.search(options.target(), options.numbers(), options.searchOptions());

    if (options.json()) {
      out.println(new JsonReportBuilder().build(result, operators));
    } else {
      logSummary(result);
    }
    return result.isComplete() ? 0 : 3;
  }

  CliOptions parseArgs(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        value = CliParsers.nextValue(effectiveArgs, ++i, parsed.option());
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put(
        "--target",
        OptionSpec.withValue((b, raw) -> b.target(CliParsers.parseDouble(raw, "--target"))));
    specs.put(
        "--numbers", OptionSpec.withValue((b, raw) -> b.numbers(CliParsers.parseNumbers(raw))));
    specs.put(
        "--operators",
        OptionSpec.withValue((b, raw) -> b.operators(CliParsers.parseOperators(raw))));
    specs.put(
        "--tolerance",
        OptionSpec.withValue((b, raw) -> b.tolerance(CliParsers.parseDouble(raw, "--tolerance"))));
    specs.put(
        "--time-budget-ms",
        OptionSpec.withValue(
            (b, raw) -> b.timeBudgetMs(CliParsers.parseLong(raw, 0L, "--time-budget-ms"))));
    specs.put(
        "--max-results",
        OptionSpec.withValue(
            (b, raw) -> b.maxResults(CliParsers.parseInt(raw, 0, "--max-results"))));
    specs.put(
        "--parallelism",
        OptionSpec.withValue(
            (b, raw) -> b.parallelism(CliParsers.parseInt(raw, 0, "--parallelism"))));
    specs.put("--parallel", OptionSpec.flag(b -> b.parallel(true)));
    specs.put("--distinct", OptionSpec.flag(b -> b.distinct(true)));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    return specs;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("solve".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private void logSummary(SearchResult result) {
    LOG.info("Attempted {} expressions, found {}", result.attempts(), result.resultCount());
    if (!result.found()) {
      LOG.info("No expression reaches the target.");
      return;
    }
    for (String expression : result.expressions()) {
      LOG.info("  {}", expression);
    }
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(raw.substring(0, equalsIndex), value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
