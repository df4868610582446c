package com.etl.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default status reporting through SLF4J. Progress is logged every {@code every} records. */
public final class LoggingStatusListener implements StatusListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingStatusListener.class);

  private final int every;

  public LoggingStatusListener() { this(50); }

  public LoggingStatusListener(int every) {
    if (every < 1) throw new IllegalArgumentException("every must be >= 1");
    this.every = every;
  }

  @Override
  public void status(Pipeline pipeline, StatusType type, String message) {
    switch (type) {
      case START -> log.info("[{}] Processing '{}'...", pipeline.name(), pipeline.source());
      case END -> log.info("[{}] Finished '{}'!", pipeline.name(), pipeline.source());
      case STATUS -> {
        if (pipeline.count() % every == 0) log.info("[{}] Processed record #{}...", pipeline.name(), pipeline.count());
      }
      case INFO -> log.info("[{}] {}", pipeline.name(), message);
      case ERROR -> log.error("[{}] {}", pipeline.name(), message);
    }
  }
}
