package solver.pipeline.generation;

/** Hit/miss counters for {@link ShapeCache}. */
public final class CacheStats {
  private long hits;
  private long misses;

  public synchronized void recordHit() {
    hits++;
  }

  public synchronized void recordMiss() {
    misses++;
  }

  public synchronized long hits() {
    return hits;
  }

  public synchronized long misses() {
    return misses;
  }

  public synchronized double hitRate() {
    long total = hits + misses;
    return total == 0 ? 0.0 : hits / (double) total;
  }

  @Override
  public synchronized String toString() {
    return "CacheStats[hits=" + hits + ", misses=" + misses + "]";
  }
}
