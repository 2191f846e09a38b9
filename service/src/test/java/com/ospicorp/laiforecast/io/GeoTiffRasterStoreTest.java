package com.ospicorp.laiforecast.io;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.laiforecast.raster.CrsRegistry;
import com.ospicorp.laiforecast.raster.GeoTransform;
import com.ospicorp.laiforecast.raster.GridGeometry;
import com.ospicorp.laiforecast.raster.Raster;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GeoTiffRasterStoreTest {

  @TempDir
  Path tempDir;

  private final GeoTiffRasterStore store = new GeoTiffRasterStore(new CrsRegistry());

  @Test
  void writtenRasterReadsBackWithGeoreferencing() {
    GridGeometry grid = new GridGeometry(3, 2,
        new GeoTransform(500000d, 4200000d, 10d, -10d), "EPSG:32633");
    Raster raster = new Raster(grid, new float[] {0.5f, 1.5f, -9999f, 2.25f, 0f, 6f}, -9999f);
    Path file = tempDir.resolve("out/LAI_2023045.tif");

    store.write(file, raster);
    Raster read = store.read(file);

    assertEquals(grid, read.grid());
    assertTrue(Float.isNaN(read.nodata()));
    float[] samples = read.toArray();
    assertEquals(0.5f, samples[0]);
    assertEquals(2.25f, samples[3]);
    assertEquals(6f, samples[5]);
    assertTrue(Float.isNaN(samples[2]));
    assertEquals(5, read.validCount());
  }

  @Test
  void geographicCrsRoundTrips() {
    GridGeometry grid = new GridGeometry(2, 2, new GeoTransform(10d, 46d, 0.5d, -0.5d),
        "EPSG:4326");
    Path file = tempDir.resolve("geo.tif");

    store.write(file, Raster.filled(grid, 1f, Float.NaN));

    assertEquals(grid, store.read(file).grid());
  }

  @Test
  void missingFileIsAReadError() {
    assertThrows(RasterReadException.class, () -> store.read(tempDir.resolve("absent.tif")));
  }

  @Test
  void garbageFileIsAReadError() throws IOException {
    Path file = tempDir.resolve("broken.tif");
    Files.writeString(file, "not a tiff");

    assertThrows(RasterReadException.class, () -> store.read(file));
  }

  @Test
  void tiffWithoutCrsIsAReadError() throws IOException {
    Path file = tempDir.resolve("plain.tif");
    writeTiff(file.toFile(), null, null);

    RasterReadException ex = assertThrows(RasterReadException.class, () -> store.read(file));
    assertTrue(ex.getMessage().contains("coordinate reference system"));
  }

  @Test
  void pixelIsPointTiepointIsShiftedToTheCorner() throws IOException {
    Path file = tempDir.resolve("point.tif");
    List<Integer> geoKeys = List.of(1, 1, 0, 2,
        GeoTiffRasterStore.KEY_RASTER_TYPE, 0, 1, GeoTiffRasterStore.RASTER_PIXEL_IS_POINT,
        GeoTiffRasterStore.KEY_PROJECTED_TYPE, 0, 1, 32633);
    writeTiff(file.toFile(), geoKeys, "-1");

    Raster read = store.read(file);

    assertEquals(new GeoTransform(95d, 205d, 10d, -10d), read.grid().transform());
    assertEquals(-1f, read.nodata());
    assertEquals("EPSG:32633", read.grid().crs());
  }

  @Test
  void userDefinedCrsIsIgnored() {
    List<Integer> geoKeys = List.of(1, 1, 0, 1,
        GeoTiffRasterStore.KEY_PROJECTED_TYPE, 0, 1, GeoTiffRasterStore.USER_DEFINED);
    assertNull(GeoTiffRasterStore.crsFrom(geoKeys));
    assertNull(GeoTiffRasterStore.crsFrom(List.of()));
  }

  @Test
  void nodataTextIsParsedLeniently() {
    assertTrue(Float.isNaN(GeoTiffRasterStore.parseNodata("nan")));
    assertTrue(Float.isNaN(GeoTiffRasterStore.parseNodata("")));
    assertEquals(-9999f, GeoTiffRasterStore.parseNodata(" -9999\u0000"));
    assertThrows(RasterReadException.class, () -> GeoTiffRasterStore.parseNodata("none"));
  }

  @Test
  void nonEpsgCrsCannotBeWritten() {
    GridGeometry grid = new GridGeometry(1, 1, new GeoTransform(0d, 1d, 1d, -1d), "ESRI:102003");

    assertThrows(RasterWriteException.class,
        () -> store.write(tempDir.resolve("x.tif"), Raster.filled(grid, 1f, Float.NaN)));
  }

  private static void writeTiff(File file, List<Integer> geoKeys, String nodata)
      throws IOException {
    Rasters rasters = new Rasters(2, 2, 1, FieldType.FLOAT);
    for (int y = 0; y < 2; y++) {
      for (int x = 0; x < 2; x++) {
        rasters.setFirstPixelSample(x, y, (float) (x + y));
      }
    }
    FileDirectory directory = new FileDirectory();
    directory.setImageWidth(2);
    directory.setImageHeight(2);
    directory.setBitsPerSample(FieldType.FLOAT.getBits());
    directory.setCompression(TiffConstants.COMPRESSION_NO);
    directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
    directory.setSamplesPerPixel(1);
    directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
    directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
    directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);
    directory.setWriteRasters(rasters);
    List<Double> scale = List.of(10d, 10d, 0d);
    List<Double> tiepoint = List.of(0d, 0d, 0d, 100d, 200d, 0d);
    directory.addEntry(new FileDirectoryEntry(GeoTiffRasterStore.MODEL_PIXEL_SCALE,
        FieldType.DOUBLE, scale.size(), scale));
    directory.addEntry(new FileDirectoryEntry(GeoTiffRasterStore.MODEL_TIEPOINT,
        FieldType.DOUBLE, tiepoint.size(), tiepoint));
    if (geoKeys != null) {
      directory.addEntry(new FileDirectoryEntry(GeoTiffRasterStore.GEO_KEY_DIRECTORY,
          FieldType.SHORT, geoKeys.size(), geoKeys));
    }
    if (nodata != null) {
      directory.addEntry(new FileDirectoryEntry(GeoTiffRasterStore.GDAL_NODATA,
          FieldType.ASCII, nodata.length() + 1, List.of(nodata)));
    }
    TIFFImage image = new TIFFImage();
    image.add(directory);
    TiffWriter.writeTiff(file, image);
  }
}
