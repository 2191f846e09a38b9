package com.ospicorp.laiforecast.pipeline;

import com.ospicorp.laiforecast.raster.Raster;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableSet;
import java.util.NoSuchElementException;
import java.util.TreeMap;

/** Date-ordered LAI rasters. {@link #load} is called at most once per date and run. */
public interface DatedRasterSource {

  NavigableSet<LocalDate> dates();

  Raster load(LocalDate date);

  static DatedRasterSource of(Map<LocalDate, Raster> rasters) {
    TreeMap<LocalDate, Raster> copy = new TreeMap<>(rasters);
    return new DatedRasterSource() {
      @Override
      public NavigableSet<LocalDate> dates() {
        return Collections.unmodifiableNavigableSet(copy.navigableKeySet());
      }

      @Override
      public Raster load(LocalDate date) {
        Raster raster = copy.get(date);
        if (raster == null) {
          throw new NoSuchElementException("No raster for " + date);
        }
        return raster;
      }
    };
  }
}
