package attractor.closure;

import attractor.core.Expression;
import attractor.core.Predicate;
import java.util.List;
import java.util.Objects;

/**
 * Output of {@link ClosureEngine#buildAttractor}: every generation snapshot, the final set in
 * insertion order and whether a fixed point was reached.
 *
 * <p>{@code convergenceGeneration} is the index n with generation n+1 equal to generation n, or -1
 * when the build stopped at the depth bound.
 */
public record AttractorResult(
    Predicate seed,
    ClosureOptions options,
    List<Generation> generations,
    List<Expression> finalSet,
    boolean converged,
    int convergenceGeneration,
    long elapsedMillis) {

  public AttractorResult {
    Objects.requireNonNull(seed, "seed");
    Objects.requireNonNull(options, "options");
    generations = List.copyOf(Objects.requireNonNull(generations, "generations"));
    finalSet = List.copyOf(Objects.requireNonNull(finalSet, "finalSet"));
    if (generations.isEmpty()) {
      throw new IllegalArgumentException("An attractor has at least generation 0");
    }
  }

  public List<String> finalKeys() {
    return finalSet.stream().map(Expression::key).toList();
  }

  public List<List<String>> generationKeys() {
    return generations.stream().map(Generation::keys).toList();
  }

  public Generation lastGeneration() {
    return generations.get(generations.size() - 1);
  }

  public boolean contains(String key) {
    for (Expression expression : finalSet) {
      if (expression.key().equals(key)) {
        return true;
      }
    }
    return false;
  }

  public int size() {
    return finalSet.size();
  }
}
