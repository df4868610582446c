package com.etl.io.input;

import com.etl.core.Input;
import com.etl.core.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base for inputs that read every matching file under the data directory, one after another.
 * No matching file is an empty run, not an error.
 */
public abstract class FileListInput implements Input {
  private static final Logger log = LoggerFactory.getLogger(FileListInput.class);

  protected final FileCriteria criteria;
  private List<Path> files = List.of();
  private Path current;

  protected FileListInput(Map<String, ?> options, String defaultIname) {
    this.criteria = FileCriteria.from(Objects.requireNonNull(options, "options"), defaultIname);
  }

  @Override
  public void configure(Pipeline pipeline) throws IOException {
    files = criteria.findAll(pipeline.dataIn());
    if (files.isEmpty()) log.warn("[{}] no files matched {} in {}", pipeline.name(), criteria.describe(), pipeline.dataIn());
  }

  @Override
  public void run(Pipeline pipeline) throws IOException {
    for (Path path : files) {
      current = path;
      log.debug("[{}] reading {}", pipeline.name(), path);
      read(pipeline, path);
    }
  }

  /** Hands every record in {@code file} to the pipeline. */
  protected abstract void read(Pipeline pipeline, Path file) throws IOException;

  @Override
  public void finish(Pipeline pipeline) {
    current = null;
  }

  public List<Path> files() {
    return files;
  }

  /** The file being read. */
  public Path current() {
    return current;
  }

  @Override
  public String describe(Pipeline pipeline) {
    return current == null ? criteria.describe() : current.getFileName().toString();
  }
}
