package com.ospicorp.laiforecast.web;

import com.ospicorp.laiforecast.io.StatisticsCsvWriter;
import com.ospicorp.laiforecast.pipeline.StatisticsRow;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/** Renders collections of {@link StatisticsRow} as {@code text/csv}. Write-only. */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Object> {

  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final StatisticsCsvWriter csvWriter;

  public CsvHttpMessageConverter(StatisticsCsvWriter csvWriter) {
    super(StandardCharsets.UTF_8, TEXT_CSV);
    this.csvWriter = csvWriter;
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  protected boolean canRead(MediaType mediaType) {
    return false;
  }

  @Override
  @NonNull
  protected Object readInternal(@NonNull Class<?> clazz, @NonNull HttpInputMessage inputMessage)
      throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Object object, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    Collection<?> collection = (Collection<?>) object;
    List<StatisticsRow> rows = new ArrayList<>(collection.size());
    for (Object element : collection) {
      if (!(element instanceof StatisticsRow row)) {
        throw new HttpMessageNotWritableException("Cannot render "
            + (element == null ? "null" : element.getClass().getSimpleName()) + " as CSV");
      }
      rows.add(row);
    }
    Writer out = new OutputStreamWriter(outputMessage.getBody(), StandardCharsets.UTF_8);
    csvWriter.write(out, rows);
    out.flush();
  }
}
