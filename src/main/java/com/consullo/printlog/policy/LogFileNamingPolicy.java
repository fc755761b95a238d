package com.consullo.printlog.policy;

import java.time.LocalDate;

/**
 * Maps a calendar date to the name of the log file holding that day's entries.
 *
 * @since 1.0
 */
public interface LogFileNamingPolicy {

  /**
   * Returns the file name (relative to the log directory) for the given date.
   *
   * @param date calendar date in the policy time zone
   * @return file name, never empty
   */
  String fileNameFor(final LocalDate date);
}
