package com.etl.io.input;

import com.etl.core.Options;
import com.etl.core.Pipeline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Every matching JSON file (default {@code *.json}). {@code recordsAt} is a slash path to the list
 * of records inside each document; anything other than a list there is a single record. Records
 * are the parsed trees: maps, lists and scalars.
 */
public final class JsonFilesInput extends FileListInput {
  private static final ObjectMapper M = new ObjectMapper();

  private final List<String> recordsAt;

  public JsonFilesInput(Map<String, Object> options) {
    super(options, "*.json");
    this.recordsAt = segments(Options.string(options, "recordsAt", "/"));
  }

  @Override
  protected void read(Pipeline pipeline, Path file) throws IOException {
    Object document;
    try {
      document = M.readValue(file.toFile(), Object.class);
    } catch (JsonProcessingException e) {
      throw new IOException("JSON file '" + file + "', unable to parse: " + e.getOriginalMessage(), e);
    }

    Object list = document;
    for (String segment : recordsAt) {
      if (list instanceof Map<?, ?> map) {
        list = map.get(segment);
      } else if (list instanceof List<?> items && !segment.isEmpty() && segment.length() < 10 && segment.chars().allMatch(Character::isDigit)) {
        int index = Integer.parseInt(segment);
        list = index < items.size() ? items.get(index) : null;
      } else {
        list = null;
      }
    }
    if (list == null) return;

    if (list instanceof List<?> records) {
      for (Object record : records) pipeline.record(record);
    } else {
      pipeline.record(list);
    }
  }

  private static List<String> segments(String path) {
    return Arrays.stream(path.split("/"))
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
