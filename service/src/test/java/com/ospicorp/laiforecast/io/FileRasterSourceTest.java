package com.ospicorp.laiforecast.io;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.laiforecast.raster.GeoTransform;
import com.ospicorp.laiforecast.raster.GridGeometry;
import com.ospicorp.laiforecast.raster.Raster;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.NoSuchElementException;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

class FileRasterSourceTest {

  private static final GridGeometry GRID =
      new GridGeometry(2, 1, new GeoTransform(0d, 1d, 1d, -1d), "EPSG:32633");
  private static final LocalDate DATE = LocalDate.of(2023, 1, 5);

  private final RasterStore store = new RasterStore() {
    @Override
    public Raster read(Path path) {
      return new Raster(GRID, new float[] {-0.2f, 1.5f}, Float.NaN);
    }

    @Override
    public void write(Path path, Raster raster) {
      throw new UnsupportedOperationException();
    }
  };

  private TreeMap<LocalDate, Path> files() {
    TreeMap<LocalDate, Path> files = new TreeMap<>();
    files.put(DATE, Path.of("LAI_2023005.tif"));
    return files;
  }

  @Test
  void negativeValuesBecomeNodataWhenEnabled() {
    Raster raster = new FileRasterSource(files(), store, true).load(DATE);

    assertFalse(raster.isValid(0));
    assertEquals(1.5f, raster.get(1));
  }

  @Test
  void negativeValuesAreKeptWhenDisabled() {
    Raster raster = new FileRasterSource(files(), store, false).load(DATE);

    assertTrue(raster.isValid(0));
  }

  @Test
  void unknownDateIsRejected() {
    FileRasterSource source = new FileRasterSource(files(), store, true);

    assertEquals(1, source.dates().size());
    assertThrows(NoSuchElementException.class, () -> source.load(DATE.plusDays(1)));
  }
}
