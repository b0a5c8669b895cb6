package attractor.report;

import attractor.closure.AttractorResult;
import attractor.closure.ClosureOptions;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of an {@link AttractorResult}. Keys are written in insertion order and read back in
 * the same order, together with the converged flag.
 */
public final class AttractorJson {
  private static final String VERSION = "1.0.0";

  private final Gson gson;

  public AttractorJson() {
    this(true);
  }

  public AttractorJson(boolean pretty) {
    GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
    if (pretty) {
      builder.setPrettyPrinting();
    }
    this.gson = builder.create();
  }

  public String toJson(AttractorResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("version", VERSION);
    root.put("seed", result.seed().name());
    root.put("options", options(result.options()));
    root.put("generations", result.generationKeys());
    root.put("final_set", result.finalKeys());
    root.put("converged", result.converged());
    root.put("convergence_generation", result.convergenceGeneration());
    root.put("time_ms", result.elapsedMillis());
    return gson.toJson(root);
  }

  public AttractorSnapshot fromJson(String json) {
    JsonObject root;
    try {
      root = JsonParser.parseString(json).getAsJsonObject();
    } catch (IllegalStateException ex) {
      throw new JsonParseException("Attractor JSON must be an object", ex);
    }
    JsonObject options = required(root, "options").getAsJsonObject();
    List<List<String>> generations = new ArrayList<>();
    for (JsonElement generation : required(root, "generations").getAsJsonArray()) {
      generations.add(strings(generation.getAsJsonArray()));
    }
    return new AttractorSnapshot(
        required(root, "seed").getAsString(),
        required(options, "max_depth").getAsInt(),
        required(options, "max_set_size").getAsInt(),
        required(options, "simplification").getAsString(),
        generations,
        strings(required(root, "final_set").getAsJsonArray()),
        required(root, "converged").getAsBoolean(),
        root.has("convergence_generation") ? root.get("convergence_generation").getAsInt() : -1);
  }

  private Map<String, Object> options(ClosureOptions options) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("max_depth", options.maxDepth());
    map.put("max_set_size", options.maxSetSize());
    map.put("simplification", options.simplification().name());
    map.put("parallel", options.parallel());
    return map;
  }

  private static JsonElement required(JsonObject object, String member) {
    JsonElement element = object.get(member);
    if (element == null || element.isJsonNull()) {
      throw new JsonParseException("Missing member: " + member);
    }
    return element;
  }

  private static List<String> strings(JsonArray array) {
    List<String> out = new ArrayList<>(array.size());
    for (JsonElement element : array) {
      out.add(element.getAsString());
    }
    return out;
  }
}
