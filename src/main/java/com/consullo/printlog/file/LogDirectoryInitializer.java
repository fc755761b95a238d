package com.consullo.printlog.file;

import com.consullo.printlog.policy.LogPolicy;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares the log directory before the first file is opened.
 *
 * <p>Creates the directory if needed and deletes files whose last-modified date, in the policy
 * zone, is more than {@link LogPolicy#retentionDays()} days before today.
 *
 * @since 1.0
 */
public final class LogDirectoryInitializer {

  private static final Logger LOGGER = LoggerFactory.getLogger(LogDirectoryInitializer.class);

  private final LogPolicy policy;
  private final Clock clock;
  private final PrintStream errorStream;

  /**
   * @param policy policy supplying directory, zone and retention
   * @param clock source of "today"
   * @param errorStream stream receiving the warning when the directory cannot be created
   */
  public LogDirectoryInitializer(LogPolicy policy, Clock clock, PrintStream errorStream) {
    Validate.notNull(policy, "policy must not be null");
    Validate.notNull(clock, "clock must not be null");
    Validate.notNull(errorStream, "errorStream must not be null");
    this.policy = policy;
    this.clock = clock;
    this.errorStream = errorStream;
  }

  /**
   * Creates the directory and applies retention.
   *
   * @return true if the directory exists afterwards
   */
  public boolean initialize() {
    Path dir = policy.directory();
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      errorStream.println("Warning: Could not create logs directory '" + dir + "'.");
      LOGGER.debug("createDirectories({}) failed", dir, e);
      return false;
    }
    int deleted = deleteExpired();
    if (deleted > 0) {
      LOGGER.debug("Deleted {} expired log file(s) from {}", deleted, dir);
    }
    return true;
  }

  /**
   * Deletes regular files last modified before {@code today - retentionDays}.
   *
   * @return number of files deleted
   */
  public int deleteExpired() {
    Path dir = policy.directory();
    if (!Files.isDirectory(dir)) {
      return 0;
    }
    LocalDate cutoff = LocalDate.ofInstant(clock.instant(), policy.zone()).minusDays(policy.retentionDays());

    int deleted = 0;
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
      for (Path entry : entries) {
        if (!Files.isRegularFile(entry)) {
          continue;
        }
        try {
          LocalDate modified = LocalDate.ofInstant(Files.getLastModifiedTime(entry).toInstant(), policy.zone());
          if (modified.isBefore(cutoff)) {
            Files.delete(entry);
            deleted++;
          }
        } catch (IOException e) {
          LOGGER.debug("Skipping {} during retention: {}", entry, e.toString());
        }
      }
    } catch (IOException e) {
      LOGGER.warn("Cannot scan log directory {}: {}", dir, e.toString());
    }
    return deleted;
  }
}
