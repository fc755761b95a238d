package com.consullo.printlog.policy;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import org.apache.commons.lang3.Validate;

/**
 * Default naming policy: formats the date with a {@link DateTimeFormatter} pattern.
 *
 * <p>Literal text must be quoted, e.g. {@code 'log_'yyyy-MM-dd'.txt'}.
 */
public final class PatternLogFileNamingPolicy implements LogFileNamingPolicy {

  public static final String DEFAULT_PATTERN = "'log_'yyyy-MM-dd'.txt'";

  private final DateTimeFormatter formatter;

  public PatternLogFileNamingPolicy() {
    this(DEFAULT_PATTERN);
  }

  /**
   * @param pattern date pattern producing the file name
   * @throws IllegalArgumentException if the pattern is blank or invalid
   */
  public PatternLogFileNamingPolicy(final String pattern) {
    Validate.notBlank(pattern, "pattern must not be blank");
    this.formatter = DateTimeFormatter.ofPattern(pattern);
  }

  @Override
  public String fileNameFor(final LocalDate date) {
    Validate.notNull(date, "date must not be null");
    return formatter.format(date);
  }
}
