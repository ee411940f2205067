package solver.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import solver.core.OperatorTable;
import solver.core.SearchResult;
import solver.render.NumberFormatter;

/** Machine-readable summary of a search, printed by {@code solve --json}. */
final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  String build(SearchResult result, OperatorTable operators) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(result, operators));
    root.put("counts", counts(result));
    root.put("expressions", result.expressions());
    if (result.terminationReason() != null) {
      root.put("termination_reason", result.terminationReason());
    }
    return gson.toJson(root);
  }

  private Map<String, Object> meta(SearchResult result, OperatorTable operators) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("time_ms", result.elapsedMillis());
    meta.put("target", NumberFormatter.format(result.target()));
    List<String> numbers = new ArrayList<>(result.numbers().size());
    for (double number : result.numbers()) {
      numbers.add(NumberFormatter.format(number));
    }
    meta.put("numbers", numbers);
    meta.put("operators", operators.symbols());
    return meta;
  }

  private Map<String, Object> counts(SearchResult result) {
    Map<String, Object> counts = new LinkedHashMap<>();
    counts.put("attempted", result.attempts());
    counts.put("planned", result.plannedAttempts());
    counts.put("domain_failures", result.domainFailures());
    counts.put("found", result.resultCount());
    return counts;
  }
}
