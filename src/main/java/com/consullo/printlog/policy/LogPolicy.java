package com.consullo.printlog.policy;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Immutable formatting and behavior settings for a print logger.
 *
 * <p>Created once through {@link #builder()} and read-only afterwards. Every setting has a default,
 * so {@code LogPolicy.builder().build()} yields a working configuration that writes to
 * {@code logs/log_yyyy-MM-dd.txt} in UTC.
 *
 * @since 1.0
 */
public final class LogPolicy {

  private final Path directory;
  private final ZoneId zone;
  private final int retentionDays;
  private final boolean logToFile;
  private final boolean logToConsole;
  private final boolean consoleColors;
  private final boolean captureErrorStream;
  private final Charset fileEncoding;
  private final EncodingErrorMode encodingErrors;
  private final FileBuffering fileBuffering;
  private final LogFileNamingPolicy fileNaming;
  private final String timestampPattern;
  private final DateTimeFormatter timestampFormatter;
  private final Map<Severity, String> tags;
  private final ColorTable colors;

  private LogPolicy(Builder b) {
    this.directory = b.directory;
    this.zone = b.zone;
    this.retentionDays = b.retentionDays;
    this.logToFile = b.logToFile;
    this.logToConsole = b.logToConsole;
    this.consoleColors = b.consoleColors;
    this.captureErrorStream = b.captureErrorStream;
    this.fileEncoding = b.fileEncoding;
    this.encodingErrors = b.encodingErrors;
    this.fileBuffering = b.fileBuffering;
    this.fileNaming = b.fileNaming;
    this.timestampPattern = b.timestampPattern;
    this.timestampFormatter = DateTimeFormatter.ofPattern(b.timestampPattern);
    this.tags = Collections.unmodifiableMap(new EnumMap<>(b.tags));
    this.colors = b.colors;
  }

  public Path directory() {
    return directory;
  }

  public ZoneId zone() {
    return zone;
  }

  public int retentionDays() {
    return retentionDays;
  }

  public boolean logToFile() {
    return logToFile;
  }

  public boolean logToConsole() {
    return logToConsole;
  }

  public boolean consoleColors() {
    return consoleColors;
  }

  public boolean captureErrorStream() {
    return captureErrorStream;
  }

  public Charset fileEncoding() {
    return fileEncoding;
  }

  public EncodingErrorMode encodingErrors() {
    return encodingErrors;
  }

  public FileBuffering fileBuffering() {
    return fileBuffering;
  }

  public LogFileNamingPolicy fileNaming() {
    return fileNaming;
  }

  public String timestampPattern() {
    return timestampPattern;
  }

  public DateTimeFormatter timestampFormatter() {
    return timestampFormatter;
  }

  /**
   * Returns the file tag for a severity. {@link Severity#NORMAL} shares the info tag.
   *
   * @param severity severity
   * @return tag such as {@code [WARN]}
   */
  public String tagFor(Severity severity) {
    Validate.notNull(severity, "severity must not be null");
    return tags.get(severity == Severity.NORMAL ? Severity.INFO : severity);
  }

  public ColorTable colors() {
    return colors;
  }

  /**
   * Resolves the full path of the log file for a date.
   *
   * @param date calendar date in {@link #zone()}
   * @return directory plus the name produced by {@link #fileNaming()}
   */
  public Path logFileFor(LocalDate date) {
    return directory.resolve(fileNaming.fileNameFor(date));
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private Path directory = Path.of("logs");
    private ZoneId zone = ZoneOffset.UTC;
    private int retentionDays = 7;
    private boolean logToFile = true;
    private boolean logToConsole = true;
    private boolean consoleColors = true;
    private boolean captureErrorStream = true;
    private Charset fileEncoding = StandardCharsets.UTF_8;
    private EncodingErrorMode encodingErrors = EncodingErrorMode.REPLACE;
    private FileBuffering fileBuffering = FileBuffering.LINE;
    private LogFileNamingPolicy fileNaming = new PatternLogFileNamingPolicy();
    private String timestampPattern = "HH:mm:ss";
    private final Map<Severity, String> tags = new EnumMap<>(Severity.class);
    private ColorTable colors = ColorTable.defaults();

    private Builder() {
      tags.put(Severity.INFO, "[INFO]");
      tags.put(Severity.ERROR, "[ERROR]");
      tags.put(Severity.WARNING, "[WARN]");
      tags.put(Severity.SUCCESS, "[SUCCESS]");
      tags.put(Severity.DEBUG, "[DEBUG]");
      tags.put(Severity.CRITICAL, "[CRIT]");
    }

    public Builder directory(Path directory) {
      this.directory = directory;
      return this;
    }

    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    public Builder retentionDays(int retentionDays) {
      this.retentionDays = retentionDays;
      return this;
    }

    public Builder logToFile(boolean logToFile) {
      this.logToFile = logToFile;
      return this;
    }

    public Builder logToConsole(boolean logToConsole) {
      this.logToConsole = logToConsole;
      return this;
    }

    public Builder consoleColors(boolean consoleColors) {
      this.consoleColors = consoleColors;
      return this;
    }

    public Builder captureErrorStream(boolean captureErrorStream) {
      this.captureErrorStream = captureErrorStream;
      return this;
    }

    public Builder fileEncoding(Charset fileEncoding) {
      this.fileEncoding = fileEncoding;
      return this;
    }

    public Builder encodingErrors(EncodingErrorMode encodingErrors) {
      this.encodingErrors = encodingErrors;
      return this;
    }

    public Builder fileBuffering(FileBuffering fileBuffering) {
      this.fileBuffering = fileBuffering;
      return this;
    }

    public Builder fileNaming(LogFileNamingPolicy fileNaming) {
      this.fileNaming = fileNaming;
      return this;
    }

    /**
     * Sets the file name pattern used by the default naming policy.
     *
     * @param pattern {@link DateTimeFormatter} pattern with quoted literals
     * @return this builder
     */
    public Builder fileNamePattern(String pattern) {
      this.fileNaming = new PatternLogFileNamingPolicy(pattern);
      return this;
    }

    public Builder timestampPattern(String timestampPattern) {
      this.timestampPattern = timestampPattern;
      return this;
    }

    /**
     * Sets the file tag of a severity. The tag of {@link Severity#NORMAL} cannot be set on its own;
     * it follows {@link Severity#INFO}.
     *
     * @param severity severity other than NORMAL
     * @param tag tag text
     * @return this builder
     */
    public Builder tag(Severity severity, String tag) {
      Validate.notNull(severity, "severity must not be null");
      Validate.isTrue(severity != Severity.NORMAL, "NORMAL uses the INFO tag");
      Validate.notNull(tag, "tag must not be null");
      tags.put(severity, tag);
      return this;
    }

    public Builder colors(ColorTable colors) {
      this.colors = colors;
      return this;
    }

    public LogPolicy build() {
      Validate.notNull(directory, "directory must not be null");
      Validate.notNull(zone, "zone must not be null");
      Validate.isTrue(retentionDays >= 0, "retentionDays must not be negative: %d", retentionDays);
      Validate.notNull(fileEncoding, "fileEncoding must not be null");
      Validate.notNull(encodingErrors, "encodingErrors must not be null");
      Validate.notNull(fileBuffering, "fileBuffering must not be null");
      Validate.notNull(fileNaming, "fileNaming must not be null");
      Validate.notBlank(timestampPattern, "timestampPattern must not be blank");
      Validate.notNull(colors, "colors must not be null");
      return new LogPolicy(this);
    }
  }
}
