package com.etl.io.input;

import com.etl.core.Pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The files themselves as records, for pipelines that catalogue or move files. Each record has
 * {@code name}, {@code path} (absolute), {@code relative} (to the data directory),
 * {@code extension} (without the dot, empty when none), {@code size} and {@code directory}.
 */
public final class FileListingInput extends FileListInput {

  public FileListingInput(Map<String, Object> options) {
    super(options, null);
  }

  @Override
  protected void read(Pipeline pipeline, Path file) throws IOException {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');

    Map<String, Object> record = new LinkedHashMap<>();
    record.put("name", name);
    record.put("path", file.toAbsolutePath().toString());
    record.put("relative", pipeline.dataIn().relativize(file).toString());
    record.put("extension", dot > 0 ? name.substring(dot + 1) : "");
    record.put("size", Files.size(file));
    record.put("directory", file.getParent().toAbsolutePath().toString());
    pipeline.record(record);
  }
}
