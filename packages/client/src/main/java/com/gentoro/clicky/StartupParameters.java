package com.gentoro.clicky;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line arguments in {@code --key=value} or {@code --key value} form. A flag without a
 * value is recorded as {@code "true"}.
 */
public final class StartupParameters {
  private final Map<String, String> values = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
        continue;
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq >= 0) {
        values.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (isValue(args, i + 1)) {
        values.put(body, args[++i]);
      } else {
        values.put(body, "true");
      }
    }
  }

  private static boolean isValue(String[] args, int index) {
    return index < args.length && args[index] != null && !args[index].startsWith("--");
  }

  public boolean hasParameter(String name) {
    return values.containsKey(name);
  }

  /** Typed lookup; supports String, Integer, Long and Boolean. Returns null when absent. */
  public <T> T getParameter(String name, Class<T> type) {
    String raw = values.get(name);
    if (raw == null) return null;
    if (type == String.class) return type.cast(raw);
    if (type == Integer.class) return type.cast(Integer.valueOf(raw.trim()));
    if (type == Long.class) return type.cast(Long.valueOf(raw.trim()));
    if (type == Boolean.class) return type.cast(Boolean.valueOf(raw.trim()));
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  /** Path passed with {@code --config}, or null to use the bundled {@code application.yaml}. */
  public String configFile() {
    return getParameter("config", String.class);
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(values);
  }
}
