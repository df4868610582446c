package com.etl.core;

/**
 * Fatal failure of a pipeline run. Record-level failures carry the number of the record being
 * processed; run-level failures carry 0.
 */
public class PipelineException extends RuntimeException {
  private final String pipelineName;
  private final long recordNumber;

  public PipelineException(String pipelineName, long recordNumber, String message, Throwable cause) {
    super(message, cause);
    this.pipelineName = pipelineName;
    this.recordNumber = recordNumber;
  }

  public PipelineException(String pipelineName, String message) {
    this(pipelineName, 0L, message, null);
  }

  public String pipelineName() {
    return pipelineName;
  }

  public long recordNumber() {
    return recordNumber;
  }
}
