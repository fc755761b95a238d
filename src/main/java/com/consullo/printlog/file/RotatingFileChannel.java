package com.consullo.printlog.file;

import com.consullo.printlog.policy.FileBuffering;
import com.consullo.printlog.policy.LogPolicy;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single open log file and swaps it when the calendar date changes.
 *
 * <p>
 * Behavior:
 * <ul>
 * <li>Every {@link #append} first checks the date in the policy zone, so long running processes
 * roll over to a new file without any timer.</li>
 * <li>Text starting with {@code \r} truncates the file back to the start of the last entry before
 * writing, which turns repeated progress updates into a single row.</li>
 * <li>Each append is encoded into one buffer and written with one call.</li>
 * <li>No method throws: open failures leave the channel closed until a later rotation succeeds,
 * write failures drop the entry.</li>
 * </ul>
 * </p>
 *
 * <p>
 * Failures are not logged where they happen. They are queued and handed out by
 * {@link #takePendingDiagnostics()}, so the owner can log them after releasing its lock. A logging
 * backend that writes to a captured error stream would otherwise call back into that lock.
 * </p>
 *
 * <p>Not thread-safe. The owning {@code PrintLogger} serializes all calls.
 */
public final class RotatingFileChannel implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(RotatingFileChannel.class);

  public static final char OVERWRITE_MARKER = '\r';

  static final int MAX_PENDING_DIAGNOSTICS = 64;

  /**
   * Opens the channel for a log file.
   */
  @FunctionalInterface
  interface ChannelOpener {
    FileChannel open(Path path) throws IOException;
  }

  private final LogPolicy policy;
  private final Clock clock;
  private final ChannelOpener opener;
  private final List<Runnable> pendingDiagnostics = new ArrayList<>();

  private LocalDate currentDate;
  private OpenLogFile file;
  private boolean openFailureReported;

  /**
   * State of the currently open file.
   */
  private static final class OpenLogFile {
    final Path path;
    final FileChannel channel;
    long lastEntryOffset;
    LineState lineState;

    OpenLogFile(Path path, FileChannel channel, long endOffset) {
      this.path = path;
      this.channel = channel;
      this.lastEntryOffset = endOffset;
      this.lineState = LineState.FRESH_LINE;
    }
  }

  public RotatingFileChannel(LogPolicy policy, Clock clock) {
    this(policy, clock, path -> FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE));
  }

  RotatingFileChannel(LogPolicy policy, Clock clock, ChannelOpener opener) {
    Validate.notNull(policy, "policy must not be null");
    Validate.notNull(clock, "clock must not be null");
    Validate.notNull(opener, "opener must not be null");
    this.policy = policy;
    this.clock = clock;
    this.opener = opener;
  }

  /**
   * Opens the file for today unless it is already open.
   */
  public void ensureCurrent() {
    ensureCurrent(false);
  }

  /**
   * Opens the file for today, replacing the open one if the date changed.
   *
   * @param force reopen even if the date did not change
   */
  public void ensureCurrent(boolean force) {
    LocalDate today = LocalDate.ofInstant(clock.instant(), policy.zone());
    if (!force && file != null && today.equals(currentDate)) {
      return;
    }

    currentDate = today;
    closeQuietly();

    Path path = policy.logFileFor(today);
    FileChannel channel = null;
    try {
      channel = opener.open(path);
      long end = channel.size();
      channel.position(end);
      file = new OpenLogFile(path, channel, end);
      openFailureReported = false;
      defer(() -> LOGGER.debug("Opened log file {} at offset {}", path, end));
    } catch (IOException | RuntimeException e) {
      file = null;
      if (channel != null) {
        try {
          channel.close();
        } catch (IOException closeFailure) {
          e.addSuppressed(closeFailure);
        }
      }
      // Retried on every append; report once per failure streak.
      if (!openFailureReported) {
        openFailureReported = true;
        String cause = e.toString();
        defer(() -> LOGGER.warn("Cannot open log file {}: {}", path, cause));
      }
    }
  }

  /**
   * Appends print output with preambles injected at every new line.
   *
   * @param text raw text; empty text is ignored
   * @param tag severity tag used for new lines
   */
  public void append(String text, String tag) {
    if (text == null || text.isEmpty()) {
      return;
    }
    ensureCurrent();
    if (file == null) {
      return;
    }

    String body = text;
    if (body.charAt(0) == OVERWRITE_MARKER) {
      try {
        file.channel.truncate(file.lastEntryOffset);
        file.channel.position(file.lastEntryOffset);
        body = stripOverwriteMarkers(body);
        file.lineState = LineState.FRESH_LINE;
      } catch (IOException e) {
        Path path = file.path;
        String cause = e.toString();
        defer(() -> LOGGER.debug("Overwrite of {} failed, appending instead: {}", path, cause));
      }
    }

    Instant now = clock.instant();
    String timestamp = policy.timestampFormatter().format(now.atZone(policy.zone()));
    FormattedEntry entry = LineFormatter.format(body, tag, timestamp, file.lineState);

    try {
      long position = file.channel.position();
      ByteBuffer bytes;
      long preambleOffset = -1;
      if (entry.hasPreamble()) {
        ByteBuffer head = encode(entry.text().substring(0, entry.lastPreambleIndex()));
        ByteBuffer tail = encode(entry.text().substring(entry.lastPreambleIndex()));
        preambleOffset = position + head.remaining();
        bytes = ByteBuffer.allocate(head.remaining() + tail.remaining());
        bytes.put(head).put(tail).flip();
      } else {
        bytes = encode(entry.text());
      }

      while (bytes.hasRemaining()) {
        file.channel.write(bytes);
      }
      if (policy.fileBuffering() == FileBuffering.SYNC) {
        file.channel.force(false);
      }

      if (preambleOffset >= 0) {
        file.lastEntryOffset = preambleOffset;
      }
      file.lineState = entry.endState();
    } catch (CharacterCodingException e) {
      String cause = e.toString();
      defer(() -> LOGGER.debug("Dropped entry that cannot be encoded as {}: {}", policy.fileEncoding(), cause));
    } catch (IOException e) {
      Path path = file.path;
      String cause = e.toString();
      defer(() -> LOGGER.debug("Write to {} failed: {}", path, cause));
    }
  }

  /**
   * Closes the open file, if any. Safe to call repeatedly.
   */
  @Override
  public void close() {
    closeQuietly();
    currentDate = null;
  }

  public boolean isOpen() {
    return file != null;
  }

  /**
   * @return path of the open file, or null if none is open
   */
  public Path currentFile() {
    return file == null ? null : file.path;
  }

  /**
   * @return line state of the open file, or {@link LineState#FRESH_LINE} if none is open
   */
  public LineState lineState() {
    return file == null ? LineState.FRESH_LINE : file.lineState;
  }

  /**
   * @return byte offset where the last entry of the open file starts, or -1 if none is open
   */
  public long lastEntryOffset() {
    return file == null ? -1 : file.lastEntryOffset;
  }

  /**
   * Hands out the diagnostics queued since the last call. Running them logs through SLF4J.
   *
   * @return queued diagnostics, oldest first; empty if nothing happened
   */
  public List<Runnable> takePendingDiagnostics() {
    if (pendingDiagnostics.isEmpty()) {
      return Collections.emptyList();
    }
    List<Runnable> taken = new ArrayList<>(pendingDiagnostics);
    pendingDiagnostics.clear();
    return taken;
  }

  // Dropped once the queue is full.
  private void defer(Runnable diagnostic) {
    if (pendingDiagnostics.size() < MAX_PENDING_DIAGNOSTICS) {
      pendingDiagnostics.add(diagnostic);
    }
  }

  private ByteBuffer encode(String s) throws CharacterCodingException {
    CharsetEncoder encoder = policy.fileEncoding().newEncoder()
        .onMalformedInput(policy.encodingErrors().action())
        .onUnmappableCharacter(policy.encodingErrors().action());
    return encoder.encode(CharBuffer.wrap(s));
  }

  private void closeQuietly() {
    if (file == null) {
      return;
    }
    OpenLogFile old = file;
    file = null;
    try {
      old.channel.close();
    } catch (IOException e) {
      String cause = e.toString();
      defer(() -> LOGGER.debug("Ignoring close failure of {}: {}", old.path, cause));
    }
  }

  private static String stripOverwriteMarkers(String s) {
    int i = 0;
    while (i < s.length() && s.charAt(i) == OVERWRITE_MARKER) {
      i++;
    }
    return s.substring(i);
  }
}
