package solver.pipeline.generation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;
import org.junit.jupiter.api.Test;
import solver.core.model.Shape;

final class ShapeCacheTest {

  @Test
  void secondLookupIsAHit() {
    ShapeCache cache = new ShapeCache();
    List<Shape> first = cache.shapes(4);
    List<Shape> second = cache.shapes(4);

    assertSame(first, second, "Cached list is reused");
    assertEquals(1, cache.stats().misses());
    assertEquals(1, cache.stats().hits());
    assertEquals(0.5, cache.stats().hitRate(), 1e-12);
  }

  @Test
  void clearForcesRegeneration() {
    ShapeCache cache = new ShapeCache();
    cache.shapes(3);
    cache.clear();
    assertEquals(2, cache.shapes(3).size());
    assertEquals(2, cache.stats().misses(), "Both lookups missed");
    assertEquals(0, cache.stats().hits());
  }
}
