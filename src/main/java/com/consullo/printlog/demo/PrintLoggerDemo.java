package com.consullo.printlog.demo;

import com.consullo.printlog.dispatch.ErrorStreamRedirect;
import com.consullo.printlog.dispatch.PrintLogger;
import com.consullo.printlog.dispatch.PrintOptions;
import com.consullo.printlog.policy.LogPolicy;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks through the print logger surface and leaves a log file behind.
 *
 * <p>This demo emits:
 * 1) plain prints, including a line finished by a second call
 * 2) a progress counter rewritten in place with carriage returns
 * 3) one line per severity
 * 4) a stack trace written to the captured error stream
 *
 * @since 1.0
 */
public final class PrintLoggerDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(PrintLoggerDemo.class);

  private PrintLoggerDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional log directory (default {@code logs})
   * @throws Exception if sleep is interrupted
   */
  public static void main(final String[] args) throws Exception {
    final Path logDir = Path.of(args.length > 0 ? args[0] : "logs");

    final LogPolicy policy = LogPolicy.builder()
        .directory(logDir)
        .retentionDays(30)
        .zone(ZoneId.of("America/New_York"))
        .build();

    try (PrintLogger print = PrintLogger.create(policy);
        ErrorStreamRedirect stderr = print.installErrorCapture()) {
      LOGGER.info("Writing demo log to {}", print.currentLogFile());

      print.print("System initializing...");
      print.print(PrintOptions.end("..."), "Loading modules");
      print.print("Done!");

      // The first update opens the row; the following ones rewrite it.
      print.info(PrintOptions.end(""), "Downloading 0%");
      for (int p = 25; p <= 100; p += 25) {
        Thread.sleep(15L);
        print.info(PrintOptions.end(""), "\rDownloading " + p + "%");
      }
      print.info("\rDownload complete");

      print.success("Database connected successfully.");
      print.warning("High latency detected:", "450ms");
      print.error("Connection dropped.");
      print.critical("System Failure! Shutting down.");
      print.debug("Variable state:", Map.of("x", 10));

      try {
        divide(1, 0);
      } catch (ArithmeticException e) {
        e.printStackTrace();
      }
      System.err.flush();
    }
  }

  private static int divide(int a, int b) {
    return a / b;
  }
}
