package solver.pipeline.generation;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.core.model.Shape;

/**
 * Shapes keyed by operand count. Shapes depend only on the count, so they are shared across
 * every query with the same number of operands.
 */
public final class ShapeCache {
  private static final Logger LOG = LoggerFactory.getLogger(ShapeCache.class);

  private final StructureGenerator generator;
  private final Map<Integer, List<Shape>> shapesByCount = new ConcurrentHashMap<>();
  private final CacheStats stats = new CacheStats();

  public ShapeCache() {
    this(new StructureGenerator());
  }

  public ShapeCache(StructureGenerator generator) {
    this.generator = Objects.requireNonNull(generator, "generator");
  }

  public List<Shape> shapes(int operandCount) {
    List<Shape> cached = shapesByCount.get(operandCount);
    if (cached != null) {
      stats.recordHit();
      LOG.debug("Shape cache hit for {} operand(s)", operandCount);
      return cached;
    }
    List<Shape> computed = shapesByCount.computeIfAbsent(operandCount, generator::generate);
    stats.recordMiss();
    LOG.debug("Generated {} shape(s) for {} operand(s)", computed.size(), operandCount);
    return computed;
  }

  public CacheStats stats() {
    return stats;
  }

  public void clear() {
    shapesByCount.clear();
  }
}
