package com.consullo.printlog.dispatch;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stands in front of the process's error stream and copies complete lines into the log file.
 *
 * <p>
 * Bytes are forwarded unchanged to the original stream first, so nothing disappears from the
 * terminal. They are then buffered until a {@code '\n'} arrives; each complete line goes to the log
 * file under the error tag as one entry. {@link #flush()} pushes an unterminated remainder (the tail
 * of a stack trace written just before exit, for example) to the file as-is.
 * </p>
 *
 * <p>The buffer is guarded by the owning logger's emission lock, the same lock that serializes all
 * file writes. Callers reach this class holding the monitor of the installed {@link java.io.PrintStream}
 * and take the emission lock second; nothing here logs while the lock is held. The original stream
 * is not owned and never closed here.
 */
public final class ErrorStreamCapture extends OutputStream {

  private static final Logger LOGGER = LoggerFactory.getLogger(ErrorStreamCapture.class);

  private static final byte TERMINATOR = '\n';

  private final PrintLogger logger;
  private final OutputStream original;
  private final Charset charset;

  private final ByteArrayOutputStream pending = new ByteArrayOutputStream(256);

  ErrorStreamCapture(PrintLogger logger, OutputStream original, Charset charset) {
    Validate.notNull(logger, "logger must not be null");
    Validate.notNull(original, "original must not be null");
    Validate.notNull(charset, "charset must not be null");
    this.logger = logger;
    this.original = original;
    this.charset = charset;
  }

  @Override
  public void write(int b) {
    write(new byte[] {(byte) b}, 0, 1);
  }

  @Override
  public void write(byte[] b, int off, int len) {
    Objects.checkFromIndexSize(off, len, b.length);
    if (len == 0) {
      return;
    }
    try {
      original.write(b, off, len);
    } catch (IOException e) {
      LOGGER.trace("Original error stream rejected write", e);
    }

    List<Runnable> diagnostics;
    synchronized (logger.emissionLock()) {
      pending.write(b, off, len);
      drainCompleteLines();
      diagnostics = logger.takeDiagnostics();
    }
    logger.report(diagnostics);
  }

  /**
   * Flushes the original stream and forwards any unterminated remainder to the log file.
   */
  @Override
  public void flush() {
    try {
      original.flush();
    } catch (IOException e) {
      LOGGER.trace("Original error stream rejected flush", e);
    }

    List<Runnable> diagnostics;
    synchronized (logger.emissionLock()) {
      if (pending.size() > 0) {
        String rest = pending.toString(charset);
        pending.reset();
        logger.appendErrorLine(rest);
      }
      diagnostics = logger.takeDiagnostics();
    }
    logger.report(diagnostics);
  }

  /**
   * Same as {@link #flush()}; the original stream stays open.
   */
  @Override
  public void close() {
    flush();
  }

  public Charset charset() {
    return charset;
  }

  /**
   * @return number of buffered bytes not yet terminated by a newline
   */
  public int pendingSize() {
    synchronized (logger.emissionLock()) {
      return pending.size();
    }
  }

  // Caller holds the emission lock.
  private void drainCompleteLines() {
    byte[] buf = pending.toByteArray();
    int start = 0;
    for (int i = 0; i < buf.length; i++) {
      if (buf[i] == TERMINATOR) {
        logger.appendErrorLine(new String(buf, start, i - start + 1, charset));
        start = i + 1;
      }
    }
    if (start > 0) {
      pending.reset();
      pending.write(buf, start, buf.length - start);
    }
  }
}
