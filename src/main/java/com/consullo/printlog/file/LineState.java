package com.consullo.printlog.file;

/**
 * Position of the log file cursor relative to logical lines.
 *
 * @since 1.0
 */
public enum LineState {
  /** The next byte starts a new entry and gets a timestamp/tag preamble. */
  FRESH_LINE,
  /** The last entry has no terminator yet; the next write continues it without a preamble. */
  MID_LINE
}
