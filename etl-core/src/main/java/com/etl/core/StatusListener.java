package com.etl.core;

/** Progress reporting hook. {@code message} is {@code null} for START, STATUS and END. */
@FunctionalInterface
public interface StatusListener {
  void status(Pipeline pipeline, StatusType type, String message);
}
