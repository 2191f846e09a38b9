package com.ospicorp.laiforecast.io;

import com.ospicorp.laiforecast.pipeline.DatedRasterSource;
import com.ospicorp.laiforecast.raster.Raster;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.NoSuchElementException;
import java.util.TreeMap;

/** Lazily reads the GeoTIFF listed for a date. */
public class FileRasterSource implements DatedRasterSource {

  private final NavigableMap<LocalDate, Path> files;
  private final RasterStore store;
  private final boolean negativeAsNodata;

  public FileRasterSource(NavigableMap<LocalDate, Path> files, RasterStore store,
      boolean negativeAsNodata) {
    this.files = Collections.unmodifiableNavigableMap(new TreeMap<>(files));
    this.store = store;
    this.negativeAsNodata = negativeAsNodata;
  }

  @Override
  public NavigableSet<LocalDate> dates() {
    return files.navigableKeySet();
  }

  @Override
  public Raster load(LocalDate date) {
    Path file = files.get(date);
    if (file == null) {
      throw new NoSuchElementException("No raster file for " + date);
    }
    Raster raster = store.read(file);
    return negativeAsNodata ? raster.withInvalidBelow(0f) : raster;
  }
}
