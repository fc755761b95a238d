package com.consullo.printlog.dispatch;

import java.io.PrintStream;

/**
 * Handle for an installed {@link ErrorStreamCapture}. {@link #close()} flushes the capture and puts
 * the previous {@link System#err} back.
 *
 * <p>Obtained from {@link PrintLogger#installErrorCapture()}; the host decides when to install and
 * when to restore.
 *
 * @since 1.0
 */
public final class ErrorStreamRedirect implements AutoCloseable {

  private final PrintStream previous;
  private final PrintStream installed;

  private volatile boolean active;

  private ErrorStreamRedirect(PrintStream previous, PrintStream installed) {
    this.previous = previous;
    this.installed = installed;
    this.active = true;
  }

  static ErrorStreamRedirect install(PrintStream installed) {
    PrintStream previous = System.err;
    System.setErr(installed);
    return new ErrorStreamRedirect(previous, installed);
  }

  public boolean isActive() {
    return active;
  }

  /**
   * @return the stream that replaced {@link System#err}
   */
  public PrintStream stream() {
    return installed;
  }

  /**
   * Restores the previous error stream. Does nothing if already closed. If another component has
   * replaced {@link System#err} in the meantime, that replacement is left alone.
   */
  @Override
  public synchronized void close() {
    if (!active) {
      return;
    }
    active = false;
    installed.flush();
    if (System.err == installed) {
      System.setErr(previous);
    }
  }
}
