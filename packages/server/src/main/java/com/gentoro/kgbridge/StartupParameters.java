package com.gentoro.kgbridge;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class StartupParameters {

  /** Options that never take a value, so {@code --clear export.json} keeps the file positional. */
  static final Set<String> FLAGS = Set.of("clear", "use-script", "guide", "queries", "help");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "import"); // import, hetero, server, help
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        // first bare argument is the export file
        result.putIfAbsent("file", arguments[p]);
        continue;
      }

      String paramName = arguments[p].substring(2);
      int eq = paramName.indexOf('=');
      if (eq > 0) {
        result.put(paramName.substring(0, eq), paramName.substring(eq + 1));
        continue;
      }

      if (FLAGS.contains(paramName)) {
        result.put(paramName, Boolean.TRUE);
        continue;
      }

      String paramValue = null;

      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    if (Boolean.TRUE.equals(result.get("help"))) {
      result.put("mode", "help");
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null
        || (!mode.equals("help")
            && !mode.equals("import")
            && !mode.equals("hetero")
            && !mode.equals("server"))) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }

    if (!parameters.containsKey("config-file")
        || parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/kgbridge.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  /** Positional export file, when one was given. */
  public Optional<String> exportFile() {
    return getOptionalParameter("file", String.class);
  }

  public boolean isFlagSet(String name) {
    return Boolean.TRUE.equals(parameters.get(name));
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
