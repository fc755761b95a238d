package com.consullo.printlog.file;

/**
 * Text ready to be appended to a log file.
 *
 * @param text text with preambles injected
 * @param lastPreambleIndex char index in {@code text} where the last preamble starts, or -1 if the
 *     text only continues the previous line
 * @param endState line state after the text is written
 * @since 1.0
 */
public record FormattedEntry(
    String text,
    int lastPreambleIndex,
    LineState endState) {

  public boolean hasPreamble() {
    return lastPreambleIndex >= 0;
  }
}
