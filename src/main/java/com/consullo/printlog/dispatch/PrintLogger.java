package com.consullo.printlog.dispatch;

import com.consullo.printlog.file.LogDirectoryInitializer;
import com.consullo.printlog.file.RotatingFileChannel;
import com.consullo.printlog.policy.ColorTable;
import com.consullo.printlog.policy.LogPolicy;
import com.consullo.printlog.policy.Severity;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drop-in replacement for console prints that also keeps a daily log file.
 *
 * <p>
 * Each call:
 * <ul>
 * <li>joins the values with the separator and appends the terminator,</li>
 * <li>writes the message to the console, wrapped in the severity's color,</li>
 * <li>appends it to today's log file with a {@code [HH:mm:ss] [TAG] } preamble per line.</li>
 * </ul>
 * Console and file writes of one call happen under a single lock, so concurrent callers never
 * interleave within the file. No print call throws; I/O failures only lose the affected output.
 * </p>
 *
 * <p>
 * The installed error capture stream is the one target written outside that lock. Its
 * {@link PrintStream} monitor is always taken before the lock, by this class and by every other
 * thread printing to {@link System#err}. Diagnostics are logged through SLF4J only after the lock is
 * released, for the same reason.
 * </p>
 *
 * <p>
 * Lifecycle is explicit: obtain an instance with {@link #create}, optionally install the error
 * stream capture with {@link #installErrorCapture()}, and call {@link #close()} on shutdown. No
 * JVM shutdown hook is registered.
 * </p>
 *
 * <pre>{@code
 * try (PrintLogger print = PrintLogger.create(LogPolicy.builder().build())) {
 *   print.print(PrintOptions.end("..."), "Loading modules");
 *   print.print("Done!");
 *   print.warning("High latency detected:", "450ms");
 * }
 * }</pre>
 */
public final class PrintLogger implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(PrintLogger.class);

  private final LogPolicy policy;
  private final PrintStream console;
  private final RotatingFileChannel channel;
  private final ErrorStreamCapture errorCapture;
  private final PrintStream captureStream;

  private final Object lock = new Object();

  // Set while this thread logs diagnostics; nested diagnostics are dropped.
  private final ThreadLocal<Boolean> reporting = new ThreadLocal<>();

  // Guarded by lock.
  private boolean closed;
  private ErrorStreamRedirect redirect;

  private PrintLogger(LogPolicy policy, PrintStream console, PrintStream errorStream, Clock clock) {
    this.policy = policy;
    this.console = console;
    this.channel = new RotatingFileChannel(policy, clock);
    if (policy.captureErrorStream()) {
      this.errorCapture = new ErrorStreamCapture(this, errorStream, Charset.defaultCharset());
      // No autoflush: a flush forwards unterminated text, so only explicit flushes may trigger it.
      this.captureStream = new PrintStream(errorCapture, false, errorCapture.charset());
    } else {
      this.errorCapture = null;
      this.captureStream = null;
    }
  }

  /**
   * Creates a logger printing to {@link System#out}, capturing for {@link System#err}, using the
   * system clock.
   *
   * @param policy logging policy
   * @return ready logger
   */
  public static PrintLogger create(LogPolicy policy) {
    return create(policy, System.out, System.err, Clock.systemUTC());
  }

  /**
   * Creates a logger with explicit collaborators.
   *
   * <p>When file logging is enabled the log directory is prepared (created, expired files deleted)
   * and today's file is opened before this method returns.
   *
   * @param policy logging policy
   * @param console stream for console output
   * @param errorStream the process's original error stream; receives captured bytes unchanged
   * @param clock source of dates and timestamps
   * @return ready logger
   */
  public static PrintLogger create(LogPolicy policy, PrintStream console, PrintStream errorStream, Clock clock) {
    Validate.notNull(policy, "policy must not be null");
    Validate.notNull(console, "console must not be null");
    Validate.notNull(errorStream, "errorStream must not be null");
    Validate.notNull(clock, "clock must not be null");

    PrintLogger logger = new PrintLogger(policy, console, errorStream, clock);
    if (policy.logToFile()) {
      new LogDirectoryInitializer(policy, clock, errorStream).initialize();
      List<Runnable> diagnostics;
      synchronized (logger.lock) {
        logger.channel.ensureCurrent(true);
        diagnostics = logger.channel.takePendingDiagnostics();
      }
      logger.report(diagnostics);
    }
    return logger;
  }

  /**
   * Prints at {@link Severity#NORMAL}, the equivalent of a plain print call.
   *
   * @param parts values to print
   */
  public void print(Object... parts) {
    emit(Severity.NORMAL, PrintOptions.DEFAULTS, parts);
  }

  public void print(PrintOptions options, Object... parts) {
    emit(Severity.NORMAL, options, parts);
  }

  public void info(Object... parts) {
    emit(Severity.INFO, PrintOptions.DEFAULTS, parts);
  }

  public void info(PrintOptions options, Object... parts) {
    emit(Severity.INFO, options, parts);
  }

  public void success(Object... parts) {
    emit(Severity.SUCCESS, PrintOptions.DEFAULTS, parts);
  }

  public void success(PrintOptions options, Object... parts) {
    emit(Severity.SUCCESS, options, parts);
  }

  public void warning(Object... parts) {
    emit(Severity.WARNING, PrintOptions.DEFAULTS, parts);
  }

  public void warning(PrintOptions options, Object... parts) {
    emit(Severity.WARNING, options, parts);
  }

  /**
   * Prints at {@link Severity#ERROR}. The console is flushed unless the options say otherwise.
   *
   * @param parts values to print
   */
  public void error(Object... parts) {
    emit(Severity.ERROR, PrintOptions.DEFAULTS, parts);
  }

  public void error(PrintOptions options, Object... parts) {
    emit(Severity.ERROR, options, parts);
  }

  public void debug(Object... parts) {
    emit(Severity.DEBUG, PrintOptions.DEFAULTS, parts);
  }

  public void debug(PrintOptions options, Object... parts) {
    emit(Severity.DEBUG, options, parts);
  }

  /**
   * Prints at {@link Severity#CRITICAL}. The console is flushed unless the options say otherwise.
   *
   * @param parts values to print
   */
  public void critical(Object... parts) {
    emit(Severity.CRITICAL, PrintOptions.DEFAULTS, parts);
  }

  public void critical(PrintOptions options, Object... parts) {
    emit(Severity.CRITICAL, options, parts);
  }

  /**
   * Formats and routes one message to the console and the log file.
   *
   * @param severity severity; null is treated as {@link Severity#NORMAL}
   * @param options call options; null means {@link PrintOptions#DEFAULTS}
   * @param parts values joined with the separator; null elements print as {@code "null"}
   */
  public void emit(Severity severity, PrintOptions options, Object... parts) {
    Severity sev = severity == null ? Severity.NORMAL : severity;
    PrintOptions opts = options == null ? PrintOptions.DEFAULTS : options;
    String message = join(parts, opts.separator()) + opts.terminator();
    PrintStream override = opts.stream();
    PrintStream target = override != null ? override : console;
    boolean toConsole = policy.logToConsole() || override != null;
    boolean viaCapture = toConsole && captureStream != null && target == captureStream;

    String out = message;
    if (override == null && policy.consoleColors()) {
      ColorTable colors = policy.colors();
      out = colorize(message, colors.colorFor(sev), colors.reset());
    }

    List<Runnable> diagnostics = new ArrayList<>(0);
    synchronized (lock) {
      if (toConsole && !viaCapture) {
        writeConsole(target, out, opts.flushFor(sev), diagnostics);
      }
      if (policy.logToFile() && override == null) {
        appendToFile(message, policy.tagFor(sev));
      }
      diagnostics.addAll(channel.takePendingDiagnostics());
    }
    if (viaCapture) {
      writeConsole(target, out, opts.flushFor(sev), diagnostics);
    }
    report(diagnostics);
  }

  /**
   * Installs the error stream capture as {@link System#err}. Closing the returned handle (or this
   * logger) restores the previous stream.
   *
   * @return handle restoring the previous error stream
   * @throws IllegalStateException if the policy disables error capture
   */
  public ErrorStreamRedirect installErrorCapture() {
    Validate.validState(errorCapture != null, "Error stream capture is disabled by the policy");
    synchronized (lock) {
      Validate.validState(!closed, "Logger is closed");
      if (redirect == null || !redirect.isActive()) {
        redirect = ErrorStreamRedirect.install(captureStream);
      }
      return redirect;
    }
  }

  /**
   * Returns the capture adapter so hosts can wire it themselves.
   *
   * @return capture adapter, or null when the policy disables error capture
   */
  public ErrorStreamCapture errorStreamCapture() {
    return errorCapture;
  }

  /**
   * @return path of the log file currently open, or null if file logging is off or failing
   */
  public Path currentLogFile() {
    synchronized (lock) {
      return channel.currentFile();
    }
  }

  /**
   * Flushes captured error output, restores the error stream and closes the log file. Later print
   * calls still reach the console but no longer the file.
   */
  @Override
  public void close() {
    ErrorStreamRedirect r;
    synchronized (lock) {
      if (closed) {
        return;
      }
      r = redirect;
      redirect = null;
    }
    if (r != null) {
      r.close();
    }
    if (errorCapture != null) {
      errorCapture.flush();
    }
    List<Runnable> diagnostics = new ArrayList<>(0);
    synchronized (lock) {
      closed = true;
      channel.close();
      diagnostics.addAll(channel.takePendingDiagnostics());
    }
    try {
      console.flush();
    } catch (RuntimeException e) {
      LOGGER.trace("Console flush failed", e);
    }
    report(diagnostics);
  }

  Object emissionLock() {
    return lock;
  }

  /**
   * Appends captured error output to the file under the error tag. Callers collect
   * {@link #takeDiagnostics()} under the lock and {@link #report} them after releasing it.
   */
  void appendErrorLine(String text) {
    synchronized (lock) {
      if (policy.logToFile()) {
        appendToFile(text, policy.tagFor(Severity.ERROR));
      }
    }
  }

  // Caller holds lock.
  List<Runnable> takeDiagnostics() {
    return channel.takePendingDiagnostics();
  }

  // Caller must not hold lock.
  void report(List<Runnable> diagnostics) {
    if (diagnostics.isEmpty() || reporting.get() != null) {
      return;
    }
    reporting.set(Boolean.TRUE);
    try {
      for (Runnable diagnostic : diagnostics) {
        diagnostic.run();
      }
    } finally {
      reporting.remove();
    }
  }

  // Caller holds lock.
  private void appendToFile(String text, String tag) {
    if (!closed) {
      channel.append(text, tag);
    }
  }

  private static void writeConsole(PrintStream target, String out, boolean flush, List<Runnable> diagnostics) {
    try {
      target.print(out);
      if (flush) {
        target.flush();
      }
    } catch (RuntimeException e) {
      diagnostics.add(() -> LOGGER.trace("Console write failed", e));
    }
  }

  static String colorize(String message, String color, String reset) {
    // Keep a leading carriage return ahead of the escape so the cursor still returns.
    if (!message.isEmpty() && message.charAt(0) == RotatingFileChannel.OVERWRITE_MARKER) {
      return RotatingFileChannel.OVERWRITE_MARKER + color + message.substring(1) + reset;
    }
    return color + message + reset;
  }

  private static String join(Object[] parts, String separator) {
    if (parts == null || parts.length == 0) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < parts.length; i++) {
      if (i > 0) {
        sb.append(separator);
      }
      sb.append(parts[i]);
    }
    return sb.toString();
  }
}
