package com.etl.io.input;

import com.etl.core.Input;
import com.etl.core.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Base for inputs that read one file, found under the pipeline's data directory when the run
 * starts. A missing file fails the run before the output is opened.
 */
public abstract class FileInput implements Input {
  private static final Logger log = LoggerFactory.getLogger(FileInput.class);

  protected final FileCriteria criteria;
  private Path file;

  protected FileInput(Map<String, ?> options, String defaultIname) {
    this.criteria = FileCriteria.from(Objects.requireNonNull(options, "options"), defaultIname);
  }

  @Override
  public void configure(Pipeline pipeline) throws IOException {
    file = criteria.findOne(pipeline.dataIn());
    log.debug("[{}] reading {}", pipeline.name(), file);
    open(pipeline, file);
  }

  /** Called once the file is known. */
  protected abstract void open(Pipeline pipeline, Path file) throws IOException;

  /** The file being read, {@code null} before the run. */
  public Path file() {
    return file;
  }

  @Override
  public String describe(Pipeline pipeline) {
    return file == null ? criteria.describe() : file.getFileName().toString();
  }
}
