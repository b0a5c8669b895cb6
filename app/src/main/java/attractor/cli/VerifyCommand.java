package attractor.cli;

import attractor.algebra.Simplification;
import attractor.cli.CliParsers.OptionSpec;
import attractor.closure.ClosureDefaults;
import attractor.closure.ClosureEngine;
import attractor.report.ReportJson;
import attractor.validate.VerificationResult;
import attractor.validate.VerificationSuite;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** Handles the `verify` command: runs the verification suite for one predicate. */
final class VerifyCommand {
  private final PrintStream out;

  VerifyCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(CliParsers.stripCommand(args), optionSpecs());
    VerificationSuite suite =
        new VerificationSuite(
            new ClosureEngine(), options.simplification(), options.maxSetSize());

    out.println("Running verification suite...");
    VerificationResult result = suite.run(options.predicate());

    out.println("Convergence sweep:");
    for (VerificationResult.DepthSample sample : result.sweep()) {
      out.printf(
          "  depth %d: %d expressions (+%d)%n",
          sample.depth(), sample.totalExpressions(), sample.newExpressions());
    }
    out.println("  convergence depth: " + result.convergenceDepth());
    out.println("Contradiction preservation: " + result.contradictionPreserved());
    out.println("Oscillation period: " + result.oscillationPeriod());
    out.println("Oscillation stable: " + result.oscillationStable());
    out.println("Entropy conservation: " + result.oscillationEntropyBits());

    if (options.hasOutput()) {
      CliParsers.write(options.output(), new ReportJson().toJson(result));
      out.println("Results saved to " + options.output());
    }
    return result.passed() ? 0 : 2;
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--predicate", OptionSpec.withValue(CliOptions.Builder::predicate));
    specs.put(
        "--max-size",
        OptionSpec.withValue(
            (b, raw) ->
                b.maxSetSize(
                    CliParsers.parseInt(raw, ClosureDefaults.MAX_SET_SIZE, "--max-size"))));
    specs.put("--lattice", OptionSpec.flag(b -> b.simplification(Simplification.LATTICE)));
    specs.put("--output", OptionSpec.withValue((b, raw) -> b.output(Path.of(raw))));
    return specs;
  }
}
