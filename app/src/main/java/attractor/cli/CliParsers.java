package attractor.cli;

import attractor.algebra.Simplification;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Shared helpers for CLI argument parsing and output. */
final class CliParsers {

  private CliParsers() {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static boolean parseBoolean(String raw, String optionName) {
    if (raw == null) {
      throw new IllegalArgumentException("Missing value for " + optionName);
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "t", "1", "yes" -> true;
      case "false", "f", "0", "no" -> false;
      default ->
          throw new IllegalArgumentException("Invalid boolean for " + optionName + ": " + raw);
    };
  }

  static Simplification parseSimplification(String raw) {
    if (raw == null || raw.isBlank()) {
      return Simplification.STRUCTURAL;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "structural", "default" -> Simplification.STRUCTURAL;
      case "lattice" -> Simplification.LATTICE;
      default -> throw new IllegalArgumentException("Invalid simplification: " + raw);
    };
  }

  /** Drops the leading command word. */
  static String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    return Arrays.copyOfRange(args, 1, args.length);
  }

  static CliOptions parse(String[] args, Map<String, OptionSpec> specs) {
    CliOptions.Builder builder = CliOptions.builder();
    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  static void write(Path output, String content) throws IOException {
    Path parent = output.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(output, content, StandardCharsets.UTF_8);
  }

  record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
