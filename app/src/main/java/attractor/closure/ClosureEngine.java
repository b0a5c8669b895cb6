package attractor.closure;

import attractor.algebra.CanonicalCache;
import attractor.algebra.ExpressionAlgebra;
import attractor.core.DepthLimitException;
import attractor.core.Expression;
import attractor.core.Predicate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generation-by-generation closure of a predicate and its negation under AND, OR and NOT.
 *
 * <p>Algorithm:
 *
 * <ul>
 *   <li>Generation 0 is {P, ¬P}.
 *   <li>Each step conjoins and disjoins every element of the current generation with P and ¬P,
 *       then negates the element. Candidates are canonicalized and admitted only when their key
 *       is new.
 *   <li>A step that admits nothing marks a fixed point; its unchanged snapshot is recorded and
 *       the build stops with {@code converged = true}.
 *   <li>After {@code maxDepth} steps the build stops with {@code converged = false}.
 *   <li>Admitting a key beyond {@code maxSetSize} aborts the build with {@link
 *       DepthLimitException}; partial generations are discarded.
 * </ul>
 *
 * Elements expanded in an earlier step only produce keys that are already members, so each step
 * expands just the elements admitted by the previous one. The resulting set and its order equal
 * those of a full re-expansion.
 *
 * <p>In parallel mode the per-element candidate lists of a step are built on a {@link
 * ForkJoinPool} and merged on the calling thread in element order, so output is identical to the
 * sequential build. One pool serves every step of a build and is shut down when the build ends.
 */
public final class ClosureEngine {
  private static final Logger LOG = LoggerFactory.getLogger(ClosureEngine.class);

  private final CanonicalCache cache;
  private final int depthCeiling;

  public ClosureEngine() {
    this(null);
  }

  /** Engine whose builds share {@code cache}; {@code null} disables memoization. */
  public ClosureEngine(CanonicalCache cache) {
    this(cache, ClosureDefaults.maxDepthCeiling());
  }

  public ClosureEngine(CanonicalCache cache, int depthCeiling) {
    if (depthCeiling < 0) {
      throw new IllegalArgumentException("depthCeiling must be non-negative");
    }
    this.cache = cache;
    this.depthCeiling = depthCeiling;
  }

  public int depthCeiling() {
    return depthCeiling;
  }

  public AttractorResult buildAttractor(String seedName, int maxDepth, int maxSetSize) {
    Predicate seed = Predicate.of(seedName);
    return buildAttractor(seed, ClosureOptions.of(maxDepth, maxSetSize));
  }

  public AttractorResult buildAttractor(Predicate seed, ClosureOptions options) {
    Objects.requireNonNull(seed, "seed");
    Objects.requireNonNull(options, "options");
    if (options.maxDepth() > depthCeiling) {
      throw DepthLimitException.depthCeilingExceeded(seed.name(), options.maxDepth(), depthCeiling);
    }

    long startedAt = System.nanoTime();
    ExpressionAlgebra algebra = new ExpressionAlgebra(options.simplification(), cache);
    List<Expression> base = seed.base();

    Map<String, Expression> members = new LinkedHashMap<>();
    for (Expression element : base) {
      admit(members, algebra.canonicalize(element), seed, 0, options.maxSetSize());
    }

    List<Generation> generations = new ArrayList<>();
    generations.add(Generation.of(0, members.values()));
    List<Expression> frontier = List.copyOf(members.values());
    boolean converged = false;
    int convergenceGeneration = -1;

    ForkJoinPool pool =
        options.parallel() && options.maxDepth() > 0
            ? new ForkJoinPool(options.parallelism())
            : null;
    try {
      for (int step = 1; step <= options.maxDepth(); step++) {
        List<List<Expression>> candidates = expand(frontier, base, algebra, pool);
        List<Expression> admitted = new ArrayList<>();
        for (List<Expression> perElement : candidates) {
          for (Expression candidate : perElement) {
            if (admit(members, candidate, seed, step, options.maxSetSize())) {
              admitted.add(candidate);
            }
          }
        }
        generations.add(Generation.of(step, members.values()));
        LOG.debug(
            "Generation {} of '{}': {} new, {} total", step, seed, admitted.size(), members.size());

        if (admitted.isEmpty()) {
          converged = true;
          convergenceGeneration = step - 1;
          break;
        }
        frontier = admitted;
      }
    } finally {
      if (pool != null) {
        pool.shutdown();
      }
    }

    long elapsed = (System.nanoTime() - startedAt) / 1_000_000;
    LOG.info(
        "Attractor of '{}' built: {} expressions, {} generations, converged={} ({} ms)",
        seed,
        members.size(),
        generations.size(),
        converged,
        elapsed);
    return new AttractorResult(
        seed,
        options,
        generations,
        List.copyOf(members.values()),
        converged,
        convergenceGeneration,
        elapsed);
  }

  /** Candidates of one element, in the fixed order (e ∧ b, e ∨ b) per base element, then ¬e. */
  static List<Expression> candidatesFor(
      Expression element, List<Expression> base, ExpressionAlgebra algebra) {
    List<Expression> out = new ArrayList<>(base.size() * 2 + 1);
    for (Expression b : base) {
      out.add(algebra.conjoin(element, b));
      out.add(algebra.disjoin(element, b));
    }
    out.add(algebra.negate(element));
    return out;
  }

  /** Candidate lists per frontier element; {@code pool} is null for sequential builds. */
  private static List<List<Expression>> expand(
      List<Expression> frontier,
      List<Expression> base,
      ExpressionAlgebra algebra,
      ForkJoinPool pool) {
    if (pool == null || frontier.size() < ClosureDefaults.PARALLEL_THRESHOLD) {
      List<List<Expression>> out = new ArrayList<>(frontier.size());
      for (Expression element : frontier) {
        out.add(candidatesFor(element, base, algebra));
      }
      return out;
    }
    Callable<List<List<Expression>>> task =
        () ->
            frontier.parallelStream()
                .map(element -> candidatesFor(element, base, algebra))
                .toList();
    return pool.submit(task).join();
  }

  private static boolean admit(
      Map<String, Expression> members,
      Expression candidate,
      Predicate seed,
      int generation,
      int maxSetSize) {
    if (members.containsKey(candidate.key())) {
      return false;
    }
    int attempted = members.size() + 1;
    if (attempted > maxSetSize) {
      LOG.warn(
          "Closure of '{}' hit max set size {} in generation {}", seed, maxSetSize, generation);
      throw DepthLimitException.setSizeExceeded(seed.name(), generation, attempted, maxSetSize);
    }
    members.put(candidate.key(), candidate);
    return true;
  }
}
