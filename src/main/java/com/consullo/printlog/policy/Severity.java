package com.consullo.printlog.policy;

/**
 * Severity of a print call. Controls the file tag and the console color.
 *
 * <p>All severities are always emitted; there is no threshold filtering.
 *
 * @since 1.0
 */
public enum Severity {
  NORMAL("normal", false),
  INFO("info", false),
  SUCCESS("success", false),
  WARNING("warning", false),
  ERROR("error", true),
  DEBUG("debug", false),
  CRITICAL("critical", true);

  private final String colorKey;
  private final boolean flushByDefault;

  Severity(String colorKey, boolean flushByDefault) {
    this.colorKey = colorKey;
    this.flushByDefault = flushByDefault;
  }

  /**
   * Returns the key used to look up this severity in a {@link ColorTable}.
   *
   * @return color key, e.g. {@code "warning"}
   */
  public String colorKey() {
    return colorKey;
  }

  /**
   * Returns true if console output of this severity is flushed unless the caller says otherwise.
   *
   * @return true for {@link #ERROR} and {@link #CRITICAL}
   */
  public boolean flushByDefault() {
    return flushByDefault;
  }
}
