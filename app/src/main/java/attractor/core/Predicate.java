package attractor.core;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Atomic named proposition. Two predicates with the same name are interchangeable; the negation is
 * derived structurally as a negated {@link Literal} and never equals the asserted literal.
 */
public record Predicate(String name) {
  private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");
  private static final Set<String> RESERVED =
      Set.of(
          "True", "False", "None", "and", "or", "not", "if", "else", "elif", "for", "while",
          "def", "class", "return", "yield", "import", "from", "as", "try", "except", "finally",
          "with", "lambda", "global", "nonlocal");

  public Predicate {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new InvalidPredicateException(name, "Predicate name cannot be empty");
    }
    if (!IDENTIFIER.matcher(name).matches()) {
      throw new InvalidPredicateException(name, "'" + name + "' is not a valid identifier");
    }
    if (RESERVED.contains(name)) {
      throw new InvalidPredicateException(name, "'" + name + "' is a reserved name");
    }
  }

  public static Predicate of(String name) {
    return new Predicate(name);
  }

  public Literal asserted() {
    return new Literal(this, false);
  }

  public Literal negation() {
    return new Literal(this, true);
  }

  /** The base set {P, ¬P}, asserted literal first. */
  public List<Expression> base() {
    return List.of(asserted(), negation());
  }

  @Override
  public String toString() {
    return name;
  }
}
