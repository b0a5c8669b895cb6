package attractor.report;

import attractor.validate.OscillationReport;
import attractor.validate.ValidationFailure;
import attractor.validate.ValidationReport;
import attractor.validate.VerificationResult;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Renders validation and verification reports as JSON. */
public final class ReportJson {
  private final Gson gson =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().serializeNulls().create();

  public String toJson(ValidationReport report) {
    return gson.toJson(validation(report));
  }

  public String toJson(OscillationReport report) {
    return gson.toJson(oscillation(report));
  }

  public String toJson(VerificationResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("seed", result.seed());
    List<Map<String, Object>> sweep = new ArrayList<>();
    for (VerificationResult.DepthSample sample : result.sweep()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("depth", sample.depth());
      entry.put("total_expressions", sample.totalExpressions());
      entry.put("new_expressions", sample.newExpressions());
      sweep.add(entry);
    }
    root.put("convergence_sweep", sweep);
    root.put("convergence_depth", result.convergenceDepth());
    root.put("contradiction_preservation", result.contradictionPreserved());
    root.put("oscillation_period", result.oscillationPeriod());
    root.put("oscillation_stable", result.oscillationStable());
    root.put("entropy_conservation", result.oscillationEntropyBits());
    root.put("passed", result.passed());
    return gson.toJson(root);
  }

  Map<String, Object> validation(ValidationReport report) {
    Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put("seed", report.seed());
    parameters.put("max_depth", report.maxDepth());
    parameters.put("max_set_size", report.maxSetSize());
    parameters.put("simplification", report.simplification().name());

    Map<String, Object> root = new LinkedHashMap<>();
    root.put("parameters", parameters);
    root.put("contradiction_present", report.contradictionPresent());
    root.put("tautology_present", report.tautologyPresent());
    root.put("base_predicate_present", report.basePredicatePresent());
    root.put("base_negation_present", report.baseNegationPresent());
    root.put("converged", report.converged());
    root.put("converged_consistent", report.convergedConsistent());
    root.put("entropy_bits", report.entropyBits());
    root.put("entropy_conserved", report.entropyConserved());
    root.put("total_expressions", report.totalExpressions());
    root.put("generation_count", report.generationCount());
    root.put("passed", report.passed());
    root.put("failures", failures(report.failures()));
    return root;
  }

  Map<String, Object> oscillation(OscillationReport report) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("length", report.length());
    root.put("period", report.period());
    root.put("classification", report.classification().label());
    root.put("entropy_bits", report.entropyBits());
    root.put("passed", report.passed());
    root.put("failures", failures(report.failures()));
    return root;
  }

  private List<Map<String, Object>> failures(List<ValidationFailure> failures) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (ValidationFailure failure : failures) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("reason", failure.reason().name().toLowerCase(Locale.ROOT));
      entry.put("message", failure.message());
      if (!failure.attributes().isEmpty()) {
        entry.put("attributes", failure.attributes());
      }
      out.add(entry);
    }
    return out;
  }
}
