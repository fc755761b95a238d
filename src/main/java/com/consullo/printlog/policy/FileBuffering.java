package com.consullo.printlog.policy;

/**
 * How far each append is pushed before the write call returns.
 *
 * @since 1.0
 */
public enum FileBuffering {
  /** Every append is handed to the operating system before returning. */
  LINE,
  /** Every append is also forced to the storage device. */
  SYNC
}
