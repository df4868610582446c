package com.etl.io.output;

import com.etl.core.Options;
import com.etl.core.Output;
import com.etl.core.Pipeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/**
 * One JSON object per line.
 *
 * <p>Options: {@code file} (relative to the working directory, default {@code <pipeline>.jsonl}),
 * {@code append} (keep existing lines), {@code sessionKey} (session variable that receives the
 * absolute path of the file when it is opened, so chained stages can find it).
 */
public final class JsonLinesOutput implements Output {
  private static final Logger log = LoggerFactory.getLogger(JsonLinesOutput.class);
  private static final ObjectMapper M = new ObjectMapper();

  private final String file;
  private final boolean append;
  private final String sessionKey;

  private Path path;
  private BufferedWriter writer;
  private long lines;

  public JsonLinesOutput(Map<String, Object> options) {
    this.file = Options.string(options, "file", null);
    this.append = Options.bool(options, "append", false);
    this.sessionKey = Options.string(options, "sessionKey", null);
  }

  @Override
  public void open(Pipeline pipeline) throws IOException {
    path = pipeline.workIn().resolve(file == null ? pipeline.name() + ".jsonl" : file).toAbsolutePath();
    Path parent = path.getParent();
    if (parent != null) Files.createDirectories(parent);
    writer = append
        ? Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)
        : Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    lines = 0;
    if (sessionKey != null) pipeline.session().set(sessionKey, path);
  }

  @Override
  public boolean write(Pipeline pipeline, Map<String, Object> record) throws IOException {
    writer.write(M.writeValueAsString(record));
    writer.newLine();
    lines++;
    return true;
  }

  @Override
  public void close(Pipeline pipeline) throws IOException {
    if (writer == null) return;
    try {
      writer.close();
    } finally {
      writer = null;
    }
    log.debug("[{}] wrote {} lines to {}", pipeline.name(), lines, path);
  }

  /** The file of the last run, {@code null} before the first. */
  public Path path() {
    return path;
  }
}
