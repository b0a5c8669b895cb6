package attractor.algebra;

import attractor.core.Expression;
import attractor.util.CacheStats;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memo of canonical forms keyed by the raw expression's structural key and the simplification
 * mode. Entries are immutable expressions, so one cache can be shared across closure builds and
 * parallel workers.
 */
public final class CanonicalCache {
  private final Map<CacheKey, Expression> entries = new ConcurrentHashMap<>();
  private final CacheStats stats;

  public CanonicalCache() {
    this(new CacheStats());
  }

  public CanonicalCache(CacheStats stats) {
    this.stats = Objects.requireNonNull(stats, "stats");
  }

  Expression get(Simplification mode, Expression raw) {
    Expression cached = entries.get(new CacheKey(mode, raw.key()));
    if (cached != null) {
      stats.recordHit();
    } else {
      stats.recordMiss();
    }
    return cached;
  }

  void put(Simplification mode, Expression raw, Expression canonical) {
    entries.putIfAbsent(new CacheKey(mode, raw.key()), canonical);
  }

  public int size() {
    return entries.size();
  }

  public CacheStats stats() {
    return stats;
  }

  private record CacheKey(Simplification mode, String key) {}
}
