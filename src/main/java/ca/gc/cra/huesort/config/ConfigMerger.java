package ca.gc.cra.huesort.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence.
 */
public final class ConfigMerger {
  /** CLI-only keys that never reach the effective configuration. */
  private static final Set<String> CLI_ONLY_KEYS = Set.of("config");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked for CLI overrides of YAML keys and for unknown keys; may be {@code null}
   * @return immutable merged configuration map
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> sink = warn == null ? message -> { } : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    yamlCopy.forEach((key, value) -> {
      if (!defaultsCopy.isEmpty() && !defaultsCopy.containsKey(key)) {
        sink.accept("Ignoring unknown YAML key for " + mode + ": " + key);
        return;
      }
      merged.put(key, value);
    });
    cliCopy.forEach((key, value) -> {
      if (key == null || value == null || CLI_ONLY_KEYS.contains(key)) {
        return;
      }
      if (!defaultsCopy.isEmpty() && !defaultsCopy.containsKey(key)) {
        throw new IllegalArgumentException("Unknown option for " + mode + ": " + key);
      }
      if (yamlCopy.containsKey(key)) {
        sink.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, value);
    });
    return Map.copyOf(merged);
  }
}
