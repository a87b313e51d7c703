package com.gentoro.reformat;

import com.gentoro.reformat.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command-line arguments in the form {@code --name value}, boolean switches and positional
 * arguments (the input files).
 */
public class StartupParameters {
  /** Options that never take a value. */
  static final Set<String> SWITCHES = Set.of("flip-h", "flip-v", "exact", "help");

  private final Map<String, String> parameters = new LinkedHashMap<>();
  private final List<String> positional = new ArrayList<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg.startsWith("--") && arg.length() > 2) {
        String name = arg.substring(2);
        int eq = name.indexOf('=');
        if (eq > 0) {
          parameters.put(name.substring(0, eq), name.substring(eq + 1));
        } else if (SWITCHES.contains(name)) {
          parameters.put(name, "true");
        } else if (i + 1 < args.length) {
          parameters.put(name, args[++i]);
        } else {
          throw new ConfigurationException("Missing value for option --" + name);
        }
      } else {
        positional.add(arg);
      }
    }
  }

  public boolean has(String name) {
    return parameters.containsKey(name);
  }

  /** Typed accessor; returns {@code null} when the parameter is absent. */
  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) return null;
    try {
      if (type == String.class) {
        return type.cast(raw);
      } else if (type == Integer.class) {
        return type.cast(Integer.valueOf(raw.trim()));
      } else if (type == Double.class) {
        return type.cast(Double.valueOf(raw.trim()));
      } else if (type == Boolean.class) {
        return type.cast(Boolean.valueOf(raw.trim()));
      }
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          "Option --" + name + " expects a " + type.getSimpleName() + ", got '" + raw + "'", e);
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  public <T> T getParameter(String name, Class<T> type, T defaultValue) {
    T value = getParameter(name, type);
    return value == null ? defaultValue : value;
  }

  public String configFile() {
    return getParameter("config-file", String.class);
  }

  public List<String> positional() {
    return Collections.unmodifiableList(positional);
  }
}
