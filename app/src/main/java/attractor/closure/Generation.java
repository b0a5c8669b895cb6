package attractor.closure;

import attractor.core.Expression;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Cumulative snapshot of the closure set after one expansion step, in insertion order. */
public record Generation(int index, List<Expression> expressions) {

  public Generation {
    if (index < 0) {
      throw new IllegalArgumentException("index must be non-negative");
    }
    expressions = List.copyOf(Objects.requireNonNull(expressions, "expressions"));
  }

  static Generation of(int index, Collection<Expression> expressions) {
    return new Generation(index, List.copyOf(expressions));
  }

  public int size() {
    return expressions.size();
  }

  public List<String> keys() {
    return expressions.stream().map(Expression::key).toList();
  }

  public Set<String> keySet() {
    Set<String> keys = new LinkedHashSet<>();
    for (Expression expression : expressions) {
      keys.add(expression.key());
    }
    return keys;
  }

  public boolean contains(String key) {
    for (Expression expression : expressions) {
      if (expression.key().equals(key)) {
        return true;
      }
    }
    return false;
  }
}
