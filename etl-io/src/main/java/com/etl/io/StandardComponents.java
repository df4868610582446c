package com.etl.io;

import com.etl.core.ComponentRegistry;
import com.etl.io.input.DelimitedTextInput;
import com.etl.io.input.ExcelInput;
import com.etl.io.input.FileListingInput;
import com.etl.io.input.JsonFilesInput;
import com.etl.io.input.XmlFilesInput;
import com.etl.io.input.XmlInput;
import com.etl.io.output.JdbcOutput;
import com.etl.io.output.JsonLinesOutput;

/** Registers the file based inputs and outputs under their short names. */
public final class StandardComponents {
  private StandardComponents() {}

  public static ComponentRegistry register(ComponentRegistry registry) {
    return registry
        .registerInput("DelimitedText", DelimitedTextInput::new)
        .registerInput("Excel", ExcelInput::new)
        .registerInput("JsonFiles", JsonFilesInput::new)
        .registerInput("Xml", XmlInput::new)
        .registerInput("XmlFiles", XmlFilesInput::new)
        .registerInput("FileListing", FileListingInput::new)
        .registerOutput("JsonLines", JsonLinesOutput::new)
        .registerOutput("Jdbc", JdbcOutput::new);
  }

  /** The core defaults plus everything above. */
  public static ComponentRegistry registry() {
    return register(ComponentRegistry.withDefaults());
  }
}
