package com.etl.core;

public enum StatusType {
  /** Output is open, input has not produced anything yet. */
  START,
  /** Sent after every written record. */
  STATUS,
  /** Input is exhausted; output is still open. */
  END,
  INFO,
  ERROR
}
