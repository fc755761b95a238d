package com.consullo.printlog.file;

import org.apache.commons.lang3.Validate;

/**
 * Turns raw print output into log file text.
 *
 * <p>Every logical line that starts while the file is at {@link LineState#FRESH_LINE} is prefixed
 * with {@code [timestamp] tag }. Text continuing an unterminated line gets no prefix, so
 * {@code "Loading"} followed by {@code "...Done!\n"} lands on one tagged row.
 *
 * @since 1.0
 */
public final class LineFormatter {

  public static final char TERMINATOR = '\n';

  private LineFormatter() {
  }

  /**
   * Formats one print call.
   *
   * @param text raw text, may contain any number of terminators
   * @param tag severity tag, e.g. {@code [INFO]}
   * @param timestamp already formatted timestamp
   * @param state line state before this text
   * @return formatted text plus the resulting line state
   */
  public static FormattedEntry format(String text, String tag, String timestamp, LineState state) {
    Validate.notNull(text, "text must not be null");
    Validate.notNull(tag, "tag must not be null");
    Validate.notNull(timestamp, "timestamp must not be null");
    Validate.notNull(state, "state must not be null");

    StringBuilder sb = new StringBuilder(text.length() + 32);
    int lastPreamble = -1;
    LineState current = state;

    int start = 0;
    int length = text.length();
    while (true) {
      int nl = text.indexOf(TERMINATOR, start);
      // nothing after a trailing terminator
      if (nl < 0 && start == length && start > 0) {
        break;
      }
      if (current == LineState.FRESH_LINE) {
        lastPreamble = sb.length();
        sb.append(preamble(timestamp, tag));
        current = LineState.MID_LINE;
      }
      if (nl < 0) {
        sb.append(text, start, length);
        break;
      }
      sb.append(text, start, nl).append(TERMINATOR);
      current = LineState.FRESH_LINE;
      start = nl + 1;
    }
    return new FormattedEntry(sb.toString(), lastPreamble, current);
  }

  /**
   * Returns the prefix injected at the start of each new line.
   *
   * @param timestamp formatted timestamp
   * @param tag severity tag
   * @return {@code [timestamp] tag } including the trailing space
   */
  public static String preamble(String timestamp, String tag) {
    return "[" + timestamp + "] " + tag + " ";
  }
}
