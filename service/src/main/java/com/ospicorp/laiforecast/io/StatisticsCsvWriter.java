package com.ospicorp.laiforecast.io;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.laiforecast.pipeline.StatisticsRow;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Writes statistics rows as CSV with a header line. Undefined statistics are written as NaN. */
public class StatisticsCsvWriter {

  private final CsvMapper mapper;
  private final CsvSchema schema;

  public StatisticsCsvWriter() {
    this.mapper = new CsvMapper();
    this.mapper.findAndRegisterModules();
    this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    this.schema = mapper.schemaFor(StatisticsRow.class).withHeader();
  }

  public void write(Path file, List<StatisticsRow> rows) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
        write(out, rows);
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot write statistics to " + file, ex);
    }
  }

  public void write(Writer out, List<StatisticsRow> rows) throws IOException {
    mapper.writer(schema).writeValues(out).writeAll(rows).flush();
  }
}
