package com.verlumen.tradeindicators.configurable;

import com.google.common.base.Ascii;
import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/** Utility class for loading indicator group documents from JSON and YAML. */
public final class IndicatorSpecLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private IndicatorSpecLoader() {}

  private static String normalizeResourcePath(String resourcePath) {
    return resourcePath.startsWith("/") ? resourcePath : "/" + resourcePath;
  }

  private static boolean isYaml(String path) {
    String lowerPath = Ascii.toLowerCase(path);
    return lowerPath.endsWith(".yaml") || lowerPath.endsWith(".yml");
  }

  private static boolean isJson(String path) {
    return Ascii.toLowerCase(path).endsWith(".json");
  }

  /**
   * Loads an indicator group from a file, detecting the format from its extension.
   *
   * @param path path to a {@code .json}, {@code .yaml} or {@code .yml} file
   */
  public static IndicatorGroupSpec load(String path) {
    String content;
    try {
      content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IndicatorSpecException("Failed to load indicator group from: " + path, e);
    }

    logger.atInfo().log("Loading indicator group from %s", path);
    if (isYaml(path)) {
      return parseYaml(content);
    } else if (isJson(path)) {
      return parseJson(content);
    }
    throw new IllegalArgumentException(
        "Unsupported file format. Use .json, .yaml, or .yml: " + path);
  }

  /**
   * Loads an indicator group from a classpath resource, detecting the format from its extension.
   */
  public static IndicatorGroupSpec loadResource(String resourcePath) {
    if (!isYaml(resourcePath) && !isJson(resourcePath)) {
      throw new IllegalArgumentException(
          "Unsupported file format. Use .json, .yaml, or .yml: " + resourcePath);
    }

    String normalizedPath = normalizeResourcePath(resourcePath);
    try (InputStream is = IndicatorSpecLoader.class.getResourceAsStream(normalizedPath)) {
      if (is == null) {
        throw new IndicatorSpecException("Resource not found: " + resourcePath);
      }
      logger.atInfo().log("Loading indicator group from resource %s", normalizedPath);
      if (isYaml(resourcePath)) {
        Map<String, Object> yamlMap = new Yaml().load(is);
        return fromJson(GSON.toJson(yamlMap));
      }
      try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
        return checkLoaded(GSON.fromJson(reader, IndicatorGroupSpec.class));
      }
    } catch (IOException | JsonParseException | YAMLException | ClassCastException e) {
      throw new IndicatorSpecException(
          "Failed to load indicator group from resource: " + resourcePath, e);
    }
  }

  /** Parses an indicator group from a JSON string. */
  public static IndicatorGroupSpec parseJson(String jsonContent) {
    try {
      return fromJson(jsonContent);
    } catch (JsonParseException e) {
      throw new IndicatorSpecException("Malformed JSON indicator group", e);
    }
  }

  /** Parses an indicator group from a YAML string. */
  public static IndicatorGroupSpec parseYaml(String yamlContent) {
    try {
      Map<String, Object> yamlMap = new Yaml().load(yamlContent);
      return fromJson(GSON.toJson(yamlMap));
    } catch (YAMLException | JsonParseException | ClassCastException e) {
      throw new IndicatorSpecException("Malformed YAML indicator group", e);
    }
  }

  /** Serializes an indicator group to JSON. */
  public static String toJson(IndicatorGroupSpec spec) {
    return GSON.toJson(spec);
  }

  private static IndicatorGroupSpec fromJson(String json) {
    return checkLoaded(GSON.fromJson(json, IndicatorGroupSpec.class));
  }

  private static IndicatorGroupSpec checkLoaded(IndicatorGroupSpec spec) {
    if (spec == null) {
      throw new IndicatorSpecException("Indicator group document is empty");
    }
    return spec;
  }
}
