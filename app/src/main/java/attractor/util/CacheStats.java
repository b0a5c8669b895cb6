package attractor.util;

import java.util.concurrent.atomic.LongAdder;

/** Hit/miss counters for a memoization cache. Safe to update from parallel workers. */
public final class CacheStats {
  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();

  public CacheStats() {}

  private CacheStats(long hits, long misses) {
    this.hits.add(hits);
    this.misses.add(misses);
  }

  public static CacheStats of(long hits, long misses) {
    return new CacheStats(hits, misses);
  }

  public void recordHit() {
    hits.increment();
  }

  public void recordMiss() {
    misses.increment();
  }

  public long hits() {
    return hits.sum();
  }

  public long misses() {
    return misses.sum();
  }

  public long lookups() {
    return hits() + misses();
  }

  public double hitRate() {
    long total = lookups();
    return total == 0 ? 0.0 : hits() / (double) total;
  }

  public CacheStats snapshot() {
    return CacheStats.of(hits(), misses());
  }

  @Override
  public String toString() {
    return "CacheStats[hits=" + hits() + ", misses=" + misses() + "]";
  }
}
