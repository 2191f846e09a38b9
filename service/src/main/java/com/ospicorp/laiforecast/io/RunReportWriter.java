package com.ospicorp.laiforecast.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.ospicorp.laiforecast.pipeline.RunReport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class RunReportWriter {

  private final ObjectWriter writer;

  public RunReportWriter(ObjectMapper mapper) {
    this.writer = mapper.writerWithDefaultPrettyPrinter();
  }

  public void write(Path file, RunReport report) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      writer.writeValue(file.toFile(), report);
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot write run summary to " + file, ex);
    }
  }
}
