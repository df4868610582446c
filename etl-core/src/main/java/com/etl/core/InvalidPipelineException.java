package com.etl.core;

/** The pipeline configuration failed {@link Pipeline#validate()}; nothing was opened. */
public final class InvalidPipelineException extends PipelineException {
  public InvalidPipelineException(String pipelineName, String reason) {
    super(pipelineName, reason);
  }
}
