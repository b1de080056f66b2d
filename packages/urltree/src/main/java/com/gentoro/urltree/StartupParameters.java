package com.gentoro.urltree;

import com.gentoro.urltree.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Command line arguments in {@code --name value} form. */
public class StartupParameters {
  private static final Set<String> MODES = Set.of("export", "help");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "export");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;

      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    if (!MODES.contains(parameters.get("mode"))) {
      throw new ValidationException("Invalid mode: " + parameters.get("mode"));
    }

    String configFile = parameters.get("config-file");
    if (configFile == null || configFile.isBlank()) {
      throw new ValidationException("Missing config file location");
    }
  }

  public String mode() {
    return parameters.get("mode");
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/urltree.yaml", "config/local.yaml".
   */
  public String configFile() {
    return parameters.get("config-file");
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
