package attractor.cli;

import attractor.cli.CliParsers.OptionSpec;
import attractor.oscillator.Oscillator;
import attractor.report.ReportJson;
import attractor.validate.AttractorValidator;
import attractor.validate.OscillationReport;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Handles the `oscillate` command. */
final class OscillateCommand {
  private final PrintStream out;

  OscillateCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(CliParsers.stripCommand(args), optionSpecs());
    List<Boolean> history = Oscillator.iterate(options.initial(), options.steps());
    OscillationReport report = new AttractorValidator().validateOscillation(history);

    if (options.hasOutput()) {
      StringBuilder csv = new StringBuilder();
      for (int i = 0; i < history.size(); i++) {
        csv.append(i).append(',').append(history.get(i)).append(System.lineSeparator());
      }
      CliParsers.write(options.output(), csv.toString());
      out.println("Oscillation history saved to " + options.output());
    } else if (options.json()) {
      out.println(new ReportJson().toJson(report));
    } else {
      out.println("Oscillation history:");
      for (int i = 0; i < history.size(); i++) {
        out.println("Step " + i + ": " + history.get(i));
      }
      out.println(
          "Classification: "
              + report.classification().label()
              + (report.period() != null ? " (period " + report.period() + ")" : ""));
    }
    return 0;
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put(
        "--steps",
        OptionSpec.withValue(
            (b, raw) -> b.steps(CliParsers.parseInt(raw, CliOptions.DEFAULT_STEPS, "--steps"))));
    specs.put(
        "--initial",
        OptionSpec.withValue((b, raw) -> b.initial(CliParsers.parseBoolean(raw, "--initial"))));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    specs.put("--output", OptionSpec.withValue((b, raw) -> b.output(Path.of(raw))));
    return specs;
  }
}
