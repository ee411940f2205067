package solver.cli;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.core.Operators;
import solver.core.SearchResult;
import solver.pipeline.SearchDriver;

/** Handles the {@code examples} command: two fixed demonstration queries. */
final class ExamplesCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ExamplesCommand.class);

  record Demo(double target, List<Double> numbers) {}

  static final List<Demo> DEMOS =
      List.of(
          new Demo(24, List.of(2.0, 4.0, 8.0, 12.0)),
          new Demo(67, List.of(1.0, 2.0, 3.0, 4.0, 5.0)));

  int execute(String[] args) {
    if (args.length > 1) {
      throw new IllegalArgumentException("The examples command takes no options");
    }
    SearchDriver driver = new SearchDriver(Operators.standard());
    for (Demo demo : DEMOS) {
      LOG.info("Solving for {} using {}:", (long) demo.target(), demo.numbers());
      SearchResult result = driver.search(demo.target(), demo.numbers());
      for (String expression : result.expressions()) {
        LOG.info("  {}", expression);
      }
    }
    return 0;
  }
}
