package solver.cli;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter COMMA_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private CliParsers() {}

  static String nextValue(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + option);
    }
    return args[index];
  }

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static double parseDouble(String raw, String optionName) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing value for " + optionName);
    }
    try {
      double value = Double.parseDouble(raw.trim());
      if (!Double.isFinite(value)) {
        throw new IllegalArgumentException("Non-finite number for " + optionName + ": " + raw);
      }
      return value;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number for " + optionName + ": " + raw);
    }
  }

  /** Parses {@code "2, 4,8"}; duplicates are kept in order. */
  static List<Double> parseNumbers(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing value for --numbers");
    }
    List<Double> numbers = new ArrayList<>();
    for (String part : COMMA_SPLITTER.split(raw)) {
      numbers.add(parseDouble(part, "--numbers"));
    }
    if (numbers.isEmpty()) {
      throw new IllegalArgumentException("--numbers must list at least one number");
    }
    return numbers;
  }

  static List<String> parseOperators(String raw) {
    if (raw == null || raw.isBlank()) {
      return CliOptions.DEFAULT_OPERATORS;
    }
    return COMMA_SPLITTER.splitToList(raw);
  }
}
