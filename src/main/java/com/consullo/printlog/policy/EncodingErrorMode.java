package com.consullo.printlog.policy;

import java.nio.charset.CodingErrorAction;

/**
 * Strategy for characters the log file encoding cannot represent.
 *
 * @since 1.0
 */
public enum EncodingErrorMode {
  /** Fail the write; the affected entry is dropped. */
  STRICT(CodingErrorAction.REPORT),
  /** Substitute the encoder's replacement bytes. */
  REPLACE(CodingErrorAction.REPLACE),
  /** Skip the offending characters. */
  IGNORE(CodingErrorAction.IGNORE);

  private final CodingErrorAction action;

  EncodingErrorMode(CodingErrorAction action) {
    this.action = action;
  }

  public CodingErrorAction action() {
    return action;
  }
}
