package com.consullo.printlog.dispatch;

import com.consullo.printlog.policy.LogPolicy;
import com.consullo.printlog.policy.Severity;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests for console/file routing, coloring and serialization of print calls.
 *
 * @since 1.0
 */
public class PrintLoggerTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T10:15:30Z"), ZoneOffset.UTC);
  private static final String LOG_FILE = "log_2026-10-19.txt";

  @TempDir
  Path dir;

  private final ByteArrayOutputStream consoleBytes = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
  private final PrintStream console = new PrintStream(consoleBytes, true, StandardCharsets.UTF_8);
  private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

  private PrintLogger logger;

  @AfterEach
  void tearDown() {
    if (logger != null) {
      logger.close();
    }
  }

  private LogPolicy.Builder policy() {
    return LogPolicy.builder().directory(dir).captureErrorStream(false);
  }

  private PrintLogger create(LogPolicy policy) {
    logger = PrintLogger.create(policy, console, err, CLOCK);
    return logger;
  }

  private String console() {
    return consoleBytes.toString(StandardCharsets.UTF_8);
  }

  private String file() throws Exception {
    return Files.readString(dir.resolve(LOG_FILE), StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("Should color the console and keep escapes out of the file")
  void error_ColorsEnabled_ColoredConsolePlainFile() throws Exception {
    create(policy().build());

    logger.error("x");

    assertThat(console()).isEqualTo("\033[31mx\n\033[0m");
    assertThat(file()).isEqualTo("[10:15:30] [ERROR] x\n");
  }

  @Test
  @DisplayName("Should tag every severity with its configured tag")
  void severities_AllOperations_TaggedInFile() throws Exception {
    create(policy().consoleColors(false).build());

    logger.print("plain");
    logger.info("info");
    logger.success("ok");
    logger.warning("careful");
    logger.error("broken");
    logger.debug("state");
    logger.critical("down");

    assertThat(file()).isEqualTo(
        "[10:15:30] [INFO] plain\n"
            + "[10:15:30] [INFO] info\n"
            + "[10:15:30] [SUCCESS] ok\n"
            + "[10:15:30] [WARN] careful\n"
            + "[10:15:30] [ERROR] broken\n"
            + "[10:15:30] [DEBUG] state\n"
            + "[10:15:30] [CRIT] down\n");
    assertThat(console()).isEqualTo("plain\ninfo\nok\ncareful\nbroken\nstate\ndown\n");
  }

  @Test
  @DisplayName("Should join values with the separator and honour the terminator")
  void print_SeparatorAndTerminator_Applied() throws Exception {
    create(policy().consoleColors(false).build());

    logger.warning("High latency detected:", "450ms");
    logger.print(PrintOptions.DEFAULTS.withSeparator(", "), 1, 2.5, null);
    logger.print();
    logger.print(PrintOptions.end("..."), "Loading modules");
    logger.print("Done!");

    assertThat(console()).isEqualTo("High latency detected: 450ms\n1, 2.5, null\n\nLoading modules...Done!\n");
    assertThat(file()).isEqualTo(
        "[10:15:30] [WARN] High latency detected: 450ms\n"
            + "[10:15:30] [INFO] 1, 2.5, null\n"
            + "[10:15:30] [INFO] \n"
            + "[10:15:30] [INFO] Loading modules...Done!\n");
  }

  @Test
  @DisplayName("Should keep a leading carriage return ahead of the color escape")
  void print_OverwriteMarker_MarkerBeforeColor() throws Exception {
    create(policy().build());

    logger.info(PrintOptions.end(""), "Downloading 10%");
    logger.info(PrintOptions.end(""), "\rDownloading 90%");
    logger.success("\rDownload complete");

    assertThat(console()).isEqualTo(
        "\033[34mDownloading 10%\033[0m"
            + "\r\033[34mDownloading 90%\033[0m"
            + "\r\033[32mDownload complete\n\033[0m");
    assertThat(file()).isEqualTo("[10:15:30] [SUCCESS] Download complete\n");
  }

  @Test
  @DisplayName("Should send explicit-stream output only to that stream, uncolored")
  void print_OverrideStream_BypassesConsoleAndFile() throws Exception {
    create(policy().logToConsole(false).build());
    final ByteArrayOutputStream other = new ByteArrayOutputStream();

    logger.warning(PrintOptions.DEFAULTS.withStream(new PrintStream(other, true, StandardCharsets.UTF_8)), "a", "b");

    assertThat(other.toString(StandardCharsets.UTF_8)).isEqualTo("a b\n");
    assertThat(console()).isEmpty();
    assertThat(file()).isEmpty();
  }

  @Test
  @DisplayName("Should write nothing to disk when file logging is disabled")
  void print_FileLoggingDisabled_NoFilesystemWrites() {
    final Path logDir = dir.resolve("logs");
    create(policy().directory(logDir).logToFile(false).consoleColors(false).build());

    logger.info("console only");
    logger.close();

    assertThat(logDir).doesNotExist();
    assertThat(console()).isEqualTo("console only\n");
    assertThat(logger.currentLogFile()).isNull();
  }

  @Test
  @DisplayName("Should still log to the file when the console is disabled")
  void print_ConsoleDisabled_FileOnly() throws Exception {
    create(policy().logToConsole(false).build());

    logger.debug("quiet");

    assertThat(console()).isEmpty();
    assertThat(file()).isEqualTo("[10:15:30] [DEBUG] quiet\n");
  }

  @Test
  @DisplayName("Should swallow console failures and still write the file")
  void print_ConsoleThrows_FileStillWritten() throws Exception {
    final PrintStream broken = mock(PrintStream.class);
    doThrow(new IllegalStateException("closed")).when(broken).print(anyString());
    logger = PrintLogger.create(policy().build(), broken, err, CLOCK);

    logger.error("still logged");

    assertThat(file()).isEqualTo("[10:15:30] [ERROR] still logged\n");
  }

  @Test
  @DisplayName("Should flush the console for error and critical by default only")
  void print_FlushDefaults_PerSeverity() {
    final PrintStream target = mock(PrintStream.class);
    logger = PrintLogger.create(policy().logToFile(false).build(), target, err, CLOCK);

    logger.info("a");
    logger.warning("b");
    verify(target, never()).flush();

    logger.error("c");
    logger.critical("d");
    verify(target, times(2)).flush();

    logger.info(PrintOptions.DEFAULTS.withFlush(true), "e");
    logger.error(PrintOptions.DEFAULTS.withFlush(false), "f");
    verify(target, times(3)).flush();
  }

  @Test
  @DisplayName("Should keep each concurrent call contiguous in the file")
  void emit_ConcurrentCallers_NoInterleaving() throws Exception {
    create(policy().logToConsole(false).build());
    final int threads = 8;
    final int callsPerThread = 200;
    final ExecutorService pool = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<?>> futures = new ArrayList<>(threads);

    for (int t = 0; t < threads; t++) {
      final int id = t;
      futures.add(pool.submit(() -> {
        start.await();
        for (int i = 0; i < callsPerThread; i++) {
          logger.emit(Severity.INFO, PrintOptions.DEFAULTS, "t" + id + "-" + i + " alpha\nt" + id + "-" + i + " beta");
        }
        return null;
      }));
    }
    start.countDown();
    for (Future<?> f : futures) {
      f.get(30, TimeUnit.SECONDS);
    }
    pool.shutdown();

    final List<String> lines = Files.readAllLines(dir.resolve(LOG_FILE), StandardCharsets.UTF_8);
    assertThat(lines).hasSize(threads * callsPerThread * 2);
    for (int i = 0; i < lines.size(); i += 2) {
      final String alpha = lines.get(i);
      final String beta = lines.get(i + 1);
      assertThat(alpha).startsWith("[10:15:30] [INFO] t").endsWith(" alpha");
      final String key = alpha.substring("[10:15:30] [INFO] ".length(), alpha.length() - " alpha".length());
      assertThat(beta).isEqualTo("[10:15:30] [INFO] " + key + " beta");
    }
  }

  @Test
  @DisplayName("Should stop file writes after close but keep printing to the console")
  void close_ThenPrint_ConsoleOnly() throws Exception {
    create(policy().consoleColors(false).build());

    logger.info("before");
    logger.close();
    logger.close();
    logger.info("after");

    assertThat(file()).isEqualTo("[10:15:30] [INFO] before\n");
    assertThat(console()).isEqualTo("before\nafter\n");
  }

  @Test
  @DisplayName("Should keep running with file logging degraded when the directory is unusable")
  void create_UnusableDirectory_WarnsAndDegrades() throws Exception {
    final Path blocker = Files.writeString(dir.resolve("plain-file"), "x");
    create(policy().directory(blocker.resolve("logs")).consoleColors(false).build());

    logger.error("nowhere to go");

    assertThat(errBytes.toString(StandardCharsets.UTF_8)).startsWith("Warning: Could not create logs directory");
    assertThat(logger.currentLogFile()).isNull();
    assertThat(console()).isEqualTo("nowhere to go\n");
  }

  @Test
  @DisplayName("Should refuse to install error capture when the policy disables it")
  void installErrorCapture_Disabled_Throws() {
    create(policy().build());

    assertThat(logger.errorStreamCapture()).isNull();
    assertThatThrownBy(() -> logger.installErrorCapture()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should list exactly one log file after a session")
  void create_FileLogging_SingleDailyFile() throws Exception {
    create(policy().build());
    logger.info("one");

    try (Stream<Path> files = Files.list(dir)) {
      assertThat(files).containsExactly(dir.resolve(LOG_FILE));
    }
    assertThat(logger.currentLogFile()).isEqualTo(dir.resolve(LOG_FILE));
  }

  @Test
  @DisplayName("Should insert the carriage return before the color escape")
  void colorize_LeadingMarker_MarkerFirst() {
    assertThat(PrintLogger.colorize("\rabc", "<c>", "<r>")).isEqualTo("\r<c>abc<r>");
    assertThat(PrintLogger.colorize("abc\n", "<c>", "<r>")).isEqualTo("<c>abc\n<r>");
    assertThat(PrintLogger.colorize("", "", "")).isEmpty();
  }
}
