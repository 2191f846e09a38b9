package com.ospicorp.laiforecast.io;

import com.ospicorp.laiforecast.raster.Raster;
import java.nio.file.Path;

public interface RasterStore {

  /**
   * Reads the first band of a georeferenced raster.
   *
   * @throws RasterReadException if the file is missing or unreadable, or carries no CRS
   */
  Raster read(Path path);

  /**
   * Writes a single-band raster, replacing any existing file. Invalid samples are stored as NaN.
   *
   * @throws RasterWriteException on any I/O failure
   */
  void write(Path path, Raster raster);
}
