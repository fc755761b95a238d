package com.consullo.printlog.dispatch;

import com.consullo.printlog.policy.Severity;
import java.io.PrintStream;
import org.apache.commons.lang3.Validate;

/**
 * Per-call options of a print operation.
 *
 * @param separator text placed between the printed values
 * @param terminator text appended after the last value; an empty terminator leaves the line open
 * @param stream explicit target stream, or null for the managed console and file pipeline. A
 *     non-null stream receives the plain message only: no colors and no file entry.
 * @param flush true or false to force the decision, null to use {@link Severity#flushByDefault()}
 * @since 1.0
 */
public record PrintOptions(
    String separator,
    String terminator,
    PrintStream stream,
    Boolean flush) {

  public static final PrintOptions DEFAULTS = new PrintOptions(" ", "\n", null, null);

  public PrintOptions {
    Validate.notNull(separator, "separator must not be null");
    Validate.notNull(terminator, "terminator must not be null");
  }

  public PrintOptions withSeparator(String separator) {
    return new PrintOptions(separator, terminator, stream, flush);
  }

  public PrintOptions withTerminator(String terminator) {
    return new PrintOptions(separator, terminator, stream, flush);
  }

  public PrintOptions withStream(PrintStream stream) {
    return new PrintOptions(separator, terminator, stream, flush);
  }

  public PrintOptions withFlush(boolean flush) {
    return new PrintOptions(separator, terminator, stream, flush);
  }

  /**
   * Shorthand for {@code DEFAULTS.withTerminator(terminator)}.
   *
   * @param terminator line terminator
   * @return options
   */
  public static PrintOptions end(String terminator) {
    return DEFAULTS.withTerminator(terminator);
  }

  boolean flushFor(Severity severity) {
    return flush == null ? severity.flushByDefault() : flush;
  }
}
