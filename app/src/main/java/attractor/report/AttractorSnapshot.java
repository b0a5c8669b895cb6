package attractor.report;

import java.util.List;
import java.util.Objects;

/** Key-level view of an attractor as read back from JSON. */
public record AttractorSnapshot(
    String seed,
    int maxDepth,
    int maxSetSize,
    String simplification,
    List<List<String>> generations,
    List<String> finalSet,
    boolean converged,
    int convergenceGeneration) {

  public AttractorSnapshot {
    Objects.requireNonNull(seed, "seed");
    generations =
        Objects.requireNonNull(generations, "generations").stream().map(List::copyOf).toList();
    finalSet = List.copyOf(Objects.requireNonNull(finalSet, "finalSet"));
  }
}
