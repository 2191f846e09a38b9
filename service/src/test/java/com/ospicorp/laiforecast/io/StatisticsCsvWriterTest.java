package com.ospicorp.laiforecast.io;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.laiforecast.pipeline.Period;
import com.ospicorp.laiforecast.pipeline.StatisticsRow;
import com.ospicorp.laiforecast.zonal.ClassStatistics;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatisticsCsvWriterTest {

  private static final String HEADER = "date,vegetation_class,pixel_count,mean_lai,std_lai,period,"
      + "class_name,min_lai,q1_lai,median_lai,q3_lai,max_lai";

  @TempDir
  Path tempDir;

  private final StatisticsCsvWriter writer = new StatisticsCsvWriter();

  @Test
  void writesHeaderAndOneLinePerRow() throws IOException {
    LocalDate date = LocalDate.of(2023, 2, 14);
    List<StatisticsRow> rows = List.of(
        StatisticsRow.of(date, 110, "cropland", Period.BASE,
            new ClassStatistics(4, 2.5d, 0.5d, 2d, 2d, 2.5d, 3d, 3d)),
        StatisticsRow.of(date, 610, "forest", Period.PREDICTED, ClassStatistics.EMPTY));
    Path file = tempDir.resolve("result/statistics.csv");

    writer.write(file, rows);

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertEquals(HEADER, lines.get(0));
    assertEquals("2023-02-14,110,4,2.5,0.5,base,cropland,2.0,2.0,2.5,3.0,3.0", lines.get(1));
    assertTrue(lines.get(2).startsWith("2023-02-14,610,0,NaN,NaN,predicted,forest"));
  }
}
