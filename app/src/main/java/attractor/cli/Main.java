package attractor.cli;

import attractor.closure.AttractorResult;
import attractor.closure.ClosureEngine;
import attractor.core.AttractorException;
import attractor.core.Predicate;
import attractor.oscillator.Oscillator;
import attractor.validate.AttractorValidator;
import attractor.validate.ValidationReport;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entrypoint.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code attractor --predicate X --depth 3 [--max-size N] [--lattice] [--parallel]
 *       [--validate] [--verbose] [--json] [--output FILE]}
 *   <li>{@code oscillate --steps 10 --initial true [--json] [--output FILE]}
 *   <li>{@code verify [--predicate X] [--lattice] [--output FILE]}
 *   <li>{@code demo}
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args == null || args.length == 0) {
      printUsage(err);
      return 1;
    }
    String command = args[0].toLowerCase(Locale.ROOT);
    try {
      return switch (command) {
        case "attractor", "symbolic" -> new AttractorCommand(out).execute(args);
        case "oscillate" -> new OscillateCommand(out).execute(args);
        case "verify" -> new VerifyCommand(out).execute(args);
        case "demo" -> demo(out);
        case "help", "--help", "-h" -> {
          printUsage(out);
          yield 0;
        }
        default -> {
          err.println("Unknown command: " + args[0]);
          printUsage(err);
          yield 1;
        }
      };
    } catch (AttractorException | IllegalArgumentException ex) {
      LOG.debug("Command '{}' failed", command, ex);
      err.println("Error: " + ex.getMessage());
      return 1;
    } catch (IOException ex) {
      LOG.error("I/O failure while running '{}'", command, ex);
      err.println("Error: " + ex.getMessage());
      return 1;
    }
  }

  private static int demo(PrintStream out) {
    out.println("Attractor demo");
    out.println("=".repeat(30));

    out.println();
    out.println("1. Oscillator:");
    out.println("Oscillation: " + Oscillator.iterate(true, 8));

    out.println();
    out.println("2. Closure:");
    Predicate seed = Predicate.of("Demo");
    AttractorResult attractor = new ClosureEngine().buildAttractor("Demo", 2, 1_000);
    out.println("Attractor has " + attractor.size() + " expressions");

    out.println();
    out.println("3. Validation:");
    ValidationReport report = new AttractorValidator().validate(attractor, seed);
    out.println("Validation passed: " + report.passed());
    return 0;
  }

  private static void printUsage(PrintStream stream) {
    stream.println("Usage: <command> [options]");
    stream.println("Commands:");
    stream.println("  attractor  --predicate X --depth 2 [--max-size N] [--lattice] [--parallel]");
    stream.println("             [--validate] [--verbose] [--json] [--output FILE]");
    stream.println("  oscillate  --steps 10 --initial true [--json] [--output FILE]");
    stream.println("  verify     [--predicate X] [--lattice] [--output FILE]");
    stream.println("  demo");
  }
}
