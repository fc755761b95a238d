package com.consullo.printlog.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Immutable mapping from color key to ANSI escape sequence.
 *
 * <p>Lookups never fail: a key without an entry resolves to the empty string, so a partial table
 * simply leaves those severities uncolored.
 *
 * @since 1.0
 */
public final class ColorTable {

  public static final String RESET_KEY = "reset";

  private static final ColorTable DEFAULTS = new ColorTable(defaultEntries());

  private final Map<String, String> entries;

  private ColorTable(Map<String, String> entries) {
    this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  /**
   * Returns the stock palette (blue info, red error, yellow warning, ...).
   *
   * @return default color table
   */
  public static ColorTable defaults() {
    return DEFAULTS;
  }

  /**
   * Creates a table holding exactly the given entries.
   *
   * @param entries color key to escape sequence
   * @return color table
   */
  public static ColorTable of(Map<String, String> entries) {
    Validate.notNull(entries, "entries must not be null");
    for (Map.Entry<String, String> e : entries.entrySet()) {
      Validate.notNull(e.getKey(), "color key must not be null");
      Validate.notNull(e.getValue(), "color for '%s' must not be null", e.getKey());
    }
    return new ColorTable(entries);
  }

  /**
   * Returns a copy of this table with one entry added or replaced.
   *
   * @param key color key
   * @param escape escape sequence
   * @return new table
   */
  public ColorTable with(String key, String escape) {
    Validate.notNull(key, "key must not be null");
    Validate.notNull(escape, "escape must not be null");
    Map<String, String> copy = new LinkedHashMap<>(entries);
    copy.put(key, escape);
    return new ColorTable(copy);
  }

  public String get(String key) {
    String value = entries.get(key);
    return value == null ? "" : value;
  }

  public String colorFor(Severity severity) {
    return get(severity.colorKey());
  }

  public String reset() {
    return get(RESET_KEY);
  }

  private static Map<String, String> defaultEntries() {
    Map<String, String> m = new LinkedHashMap<>(16);
    m.put("normal", "\033[37m");
    m.put("info", "\033[34m");
    m.put("error", "\033[31m");
    m.put("warning", "\033[33m");
    m.put("success", "\033[32m");
    m.put("debug", "\033[36m");
    // white on red
    m.put("critical", "\033[41m\033[37m");
    m.put(RESET_KEY, "\033[0m");
    return m;
  }
}
