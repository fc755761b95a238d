package com.consullo.printlog.policy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Properties;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Builds a {@link LogPolicy} from {@link Properties}.
 *
 * <p>Recognized keys (all optional, prefixed with {@value #PREFIX}):
 * <ul>
 * <li>{@code dir}, {@code timezone}, {@code retentionDays}</li>
 * <li>{@code toFile}, {@code toConsole}, {@code colors}, {@code captureStderr}</li>
 * <li>{@code encoding}, {@code encodingErrors} (strict/replace/ignore), {@code buffering} (line/sync)</li>
 * <li>{@code filenamePattern}, {@code timestampPattern}</li>
 * <li>{@code tag.<severity>} and {@code color.<key>}</li>
 * </ul>
 * Unset keys keep the builder defaults.
 *
 * @since 1.0
 */
public final class LogPolicyProperties {

  public static final String PREFIX = "printlog.";

  private LogPolicyProperties() {
  }

  /**
   * Loads a classpath resource and converts it.
   *
   * @param resource resource name, e.g. {@code printlog.properties}
   * @return builder pre-populated from the resource
   * @throws IOException if the resource cannot be read
   * @throws IllegalArgumentException if the resource is missing or a value is invalid
   */
  public static LogPolicy.Builder fromResource(String resource) throws IOException {
    Validate.notBlank(resource, "resource must not be blank");
    Properties props = new Properties();
    try (InputStream in = LogPolicyProperties.class.getClassLoader().getResourceAsStream(resource)) {
      Validate.isTrue(in != null, "Missing resource: %s", resource);
      props.load(in);
    }
    return fromProperties(props);
  }

  /**
   * Converts properties into a policy builder so callers can still override individual settings.
   *
   * @param props source properties
   * @return builder
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static LogPolicy.Builder fromProperties(Properties props) {
    Validate.notNull(props, "props must not be null");
    LogPolicy.Builder b = LogPolicy.builder();

    String v = value(props, "dir");
    if (v != null) {
      b.directory(Path.of(v));
    }
    v = value(props, "timezone");
    if (v != null) {
      b.zone(ZoneId.of(v));
    }
    v = value(props, "retentionDays");
    if (v != null) {
      b.retentionDays(parseInt("retentionDays", v));
    }
    v = value(props, "toFile");
    if (v != null) {
      b.logToFile(parseBoolean("toFile", v));
    }
    v = value(props, "toConsole");
    if (v != null) {
      b.logToConsole(parseBoolean("toConsole", v));
    }
    v = value(props, "colors");
    if (v != null) {
      b.consoleColors(parseBoolean("colors", v));
    }
    v = value(props, "captureStderr");
    if (v != null) {
      b.captureErrorStream(parseBoolean("captureStderr", v));
    }
    v = value(props, "encoding");
    if (v != null) {
      b.fileEncoding(Charset.forName(v));
    }
    v = value(props, "encodingErrors");
    if (v != null) {
      b.encodingErrors(EncodingErrorMode.valueOf(v.toUpperCase(Locale.ROOT)));
    }
    v = value(props, "buffering");
    if (v != null) {
      b.fileBuffering(FileBuffering.valueOf(v.toUpperCase(Locale.ROOT)));
    }
    v = value(props, "filenamePattern");
    if (v != null) {
      b.fileNamePattern(v);
    }
    v = value(props, "timestampPattern");
    if (v != null) {
      b.timestampPattern(v);
    }

    for (Severity severity : Severity.values()) {
      if (severity == Severity.NORMAL) {
        continue;
      }
      String tag = props.getProperty(PREFIX + "tag." + severity.colorKey());
      if (tag != null) {
        b.tag(severity, tag);
      }
    }

    ColorTable colors = ColorTable.defaults();
    String colorPrefix = PREFIX + "color.";
    for (String name : props.stringPropertyNames()) {
      if (name.startsWith(colorPrefix)) {
        colors = colors.with(name.substring(colorPrefix.length()), unescape(props.getProperty(name)));
      }
    }
    b.colors(colors);
    return b;
  }

  private static String value(Properties props, String key) {
    String v = props.getProperty(PREFIX + key);
    return StringUtils.isBlank(v) ? null : v.trim();
  }

  private static int parseInt(String key, String v) {
    try {
      return Integer.parseInt(v);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(PREFIX + key + " is not a number: " + v, e);
    }
  }

  private static boolean parseBoolean(String key, String v) {
    try {
      return BooleanUtils.toBoolean(v.toLowerCase(Locale.ROOT), "true", "false");
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(PREFIX + key + " must be true or false: " + v, e);
    }
  }

  // Unicode escapes work in .properties files; the shell-style \033 spelling is accepted as well.
  private static String unescape(String v) {
    return StringUtils.replace(v, "\\033", "\033");
  }
}
