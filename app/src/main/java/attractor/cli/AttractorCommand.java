package attractor.cli;

import attractor.algebra.Simplification;
import attractor.cli.CliParsers.OptionSpec;
import attractor.closure.AttractorResult;
import attractor.closure.ClosureDefaults;
import attractor.closure.ClosureEngine;
import attractor.closure.ClosureOptions;
import attractor.core.Expression;
import attractor.core.Predicate;
import attractor.report.AttractorJson;
import attractor.report.ReportJson;
import attractor.validate.AttractorValidator;
import attractor.validate.ValidationFailure;
import attractor.validate.ValidationReport;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the `attractor` command: builds, optionally validates, and prints a closure set. */
final class AttractorCommand {
  private static final Logger LOG = LoggerFactory.getLogger(AttractorCommand.class);

  private final PrintStream out;

  AttractorCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(CliParsers.stripCommand(args), optionSpecs());
    Predicate seed = Predicate.of(options.predicate());
    ClosureOptions closureOptions =
        ClosureOptions.of(options.depth(), options.maxSetSize())
            .withSimplification(options.simplification())
            .withParallel(options.parallel());

    AttractorResult result = new ClosureEngine().buildAttractor(seed, closureOptions);
    ValidationReport report =
        options.validate() ? new AttractorValidator().validate(result, seed) : null;

    String rendered =
        options.json() ? renderJson(result, report) : renderText(result, report, options);
    if (options.hasOutput()) {
      CliParsers.write(options.output(), rendered);
      out.println("Attractor saved to " + options.output());
      LOG.info("Wrote attractor of '{}' to {}", seed, options.output());
    } else {
      out.print(rendered);
    }
    return report == null || report.passed() ? 0 : 2;
  }

  private String renderText(AttractorResult result, ValidationReport report, CliOptions options) {
    StringBuilder sb = new StringBuilder();
    sb.append("Attractor for '")
        .append(result.seed().name())
        .append("' at depth ")
        .append(options.depth())
        .append(System.lineSeparator());
    sb.append("Total expressions: ").append(result.size()).append(System.lineSeparator());
    sb.append("Generations: ").append(result.generations().size()).append(System.lineSeparator());
    sb.append("Converged: ").append(result.converged()).append(System.lineSeparator());
    if (report != null) {
      sb.append("Validation: ")
          .append(report.passed() ? "PASSED" : "FAILED")
          .append(System.lineSeparator());
      sb.append("Contains contradiction: ")
          .append(report.contradictionPresent())
          .append(System.lineSeparator());
      sb.append("Contains tautology: ")
          .append(report.tautologyPresent())
          .append(System.lineSeparator());
      sb.append("Entropy (bits): ").append(report.entropyBits()).append(System.lineSeparator());
      for (ValidationFailure failure : report.failures()) {
        sb.append("  ! ").append(failure.message()).append(System.lineSeparator());
      }
    }
    if (options.verbose()) {
      sb.append(System.lineSeparator()).append("Expressions:").append(System.lineSeparator());
      List<Expression> expressions = result.finalSet();
      for (int i = 0; i < expressions.size(); i++) {
        sb.append("  ")
            .append(i + 1)
            .append(": ")
            .append(expressions.get(i).key())
            .append(System.lineSeparator());
      }
    }
    return sb.toString();
  }

  private String renderJson(AttractorResult result, ValidationReport report) {
    String attractor = new AttractorJson().toJson(result);
    if (report == null) {
      return attractor + System.lineSeparator();
    }
    return attractor
        + System.lineSeparator()
        + new ReportJson().toJson(report)
        + System.lineSeparator();
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--predicate", OptionSpec.withValue(CliOptions.Builder::predicate));
    specs.put(
        "--depth",
        OptionSpec.withValue(
            (b, raw) -> b.depth(CliParsers.parseInt(raw, ClosureDefaults.MAX_DEPTH, "--depth"))));
    specs.put(
        "--max-size",
        OptionSpec.withValue(
            (b, raw) ->
                b.maxSetSize(
                    CliParsers.parseInt(raw, ClosureDefaults.MAX_SET_SIZE, "--max-size"))));
    specs.put(
        "--simplification",
        OptionSpec.withValue((b, raw) -> b.simplification(CliParsers.parseSimplification(raw))));
    specs.put("--lattice", OptionSpec.flag(b -> b.simplification(Simplification.LATTICE)));
    specs.put("--parallel", OptionSpec.flag(b -> b.parallel(true)));
    specs.put("--validate", OptionSpec.flag(b -> b.validate(true)));
    specs.put("--verbose", OptionSpec.flag(b -> b.verbose(true)));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    specs.put("--output", OptionSpec.withValue((b, raw) -> b.output(Path.of(raw))));
    return specs;
  }
}
