package com.ospicorp.laiforecast.io;

import com.ospicorp.laiforecast.raster.CrsRegistry;
import com.ospicorp.laiforecast.raster.GeoTransform;
import com.ospicorp.laiforecast.raster.GridGeometry;
import com.ospicorp.laiforecast.raster.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import mil.nga.tiff.util.TiffException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GeoTIFF reader/writer on tiff-java. Georeferencing comes from ModelPixelScale plus
 * ModelTiepoint (or a non-rotated ModelTransformation) and the EPSG code in the GeoKey
 * directory; nodata from the GDAL_NODATA tag.
 */
public class GeoTiffRasterStore implements RasterStore {

  private static final Logger log = LoggerFactory.getLogger(GeoTiffRasterStore.class);

  // GeoTIFF and GDAL tags, looked up by id
  static final FieldTagType MODEL_PIXEL_SCALE = FieldTagType.getById(33550);
  static final FieldTagType MODEL_TIEPOINT = FieldTagType.getById(33922);
  static final FieldTagType MODEL_TRANSFORMATION = FieldTagType.getById(34264);
  static final FieldTagType GEO_KEY_DIRECTORY = FieldTagType.getById(34735);
  static final FieldTagType GDAL_NODATA = FieldTagType.getById(42113);

  static final int KEY_MODEL_TYPE = 1024;
  static final int KEY_RASTER_TYPE = 1025;
  static final int KEY_GEOGRAPHIC_TYPE = 2048;
  static final int KEY_PROJECTED_TYPE = 3072;
  static final int MODEL_TYPE_PROJECTED = 1;
  static final int MODEL_TYPE_GEOGRAPHIC = 2;
  static final int RASTER_PIXEL_IS_AREA = 1;
  static final int RASTER_PIXEL_IS_POINT = 2;
  static final int USER_DEFINED = 32767;

  private final CrsRegistry crsRegistry;

  public GeoTiffRasterStore(CrsRegistry crsRegistry) {
    this.crsRegistry = Objects.requireNonNull(crsRegistry, "crsRegistry");
  }

  @Override
  public Raster read(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new RasterReadException("Raster file not found: " + path);
    }
    TIFFImage image;
    try {
      image = TiffReader.readTiff(path.toFile());
    } catch (IOException | TiffException ex) {
      throw new RasterReadException("Cannot read GeoTIFF " + path + ": " + ex.getMessage(), ex);
    }
    FileDirectory directory = image.getFileDirectory();
    if (directory == null) {
      throw new RasterReadException("GeoTIFF " + path + " has no image directory");
    }

    Rasters rasters;
    try {
      rasters = directory.readRasters();
    } catch (RuntimeException ex) {
      throw new RasterReadException("Cannot decode pixels of " + path + ": " + ex.getMessage(), ex);
    }
    int width = rasters.getWidth();
    int height = rasters.getHeight();

    List<Integer> geoKeys = intValues(directory, GEO_KEY_DIRECTORY);
    String crs = crsFrom(geoKeys);
    if (crs == null) {
      throw new RasterReadException("GeoTIFF " + path + " has no EPSG coordinate reference system");
    }
    GeoTransform transform = transformFrom(directory, geoKeys, path);
    float nodata = nodataFrom(directory);

    float[] samples = new float[width * height];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        Number sample = rasters.getFirstPixelSample(x, y);
        samples[y * width + x] = sample == null ? nodata : sample.floatValue();
      }
    }
    Raster raster = new Raster(new GridGeometry(width, height, transform, crs), samples, nodata);
    log.debug("Read {} from {}", raster, path);
    return raster;
  }

  @Override
  public void write(Path path, Raster raster) {
    GridGeometry grid = raster.grid();
    int epsg = epsgCode(grid.crs());
    if (epsg < 0) {
      throw new RasterWriteException("Cannot write " + path + ": CRS " + grid.crs()
          + " is not an EPSG code");
    }
    boolean geographic;
    try {
      geographic = crsRegistry.isGeographic(grid.crs());
    } catch (IllegalArgumentException ex) {
      throw new RasterWriteException("Cannot write " + path + ": " + ex.getMessage(), ex);
    }

    int width = grid.width();
    int height = grid.height();
    Rasters rasters = new Rasters(width, height, 1, FieldType.FLOAT);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        rasters.setFirstPixelSample(x, y, raster.isValid(x, y) ? raster.get(x, y) : Float.NaN);
      }
    }

    FileDirectory directory = new FileDirectory();
    directory.setImageWidth(width);
    directory.setImageHeight(height);
    directory.setBitsPerSample(FieldType.FLOAT.getBits());
    directory.setCompression(TiffConstants.COMPRESSION_NO);
    directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
    directory.setSamplesPerPixel(1);
    directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
    directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
    directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);
    directory.setWriteRasters(rasters);

    GeoTransform transform = grid.transform();
    List<Double> scale = List.of(transform.pixelWidth(), -transform.pixelHeight(), 0d);
    List<Double> tiepoint = List.of(0d, 0d, 0d, transform.originX(), transform.originY(), 0d);
    List<Integer> geoKeys = List.of(
        1, 1, 0, 3,
        KEY_MODEL_TYPE, 0, 1, geographic ? MODEL_TYPE_GEOGRAPHIC : MODEL_TYPE_PROJECTED,
        KEY_RASTER_TYPE, 0, 1, RASTER_PIXEL_IS_AREA,
        geographic ? KEY_GEOGRAPHIC_TYPE : KEY_PROJECTED_TYPE, 0, 1, epsg);
    directory.addEntry(new FileDirectoryEntry(MODEL_PIXEL_SCALE, FieldType.DOUBLE,
        scale.size(), scale));
    directory.addEntry(new FileDirectoryEntry(MODEL_TIEPOINT, FieldType.DOUBLE,
        tiepoint.size(), tiepoint));
    directory.addEntry(new FileDirectoryEntry(GEO_KEY_DIRECTORY, FieldType.SHORT,
        geoKeys.size(), geoKeys));

    TIFFImage image = new TIFFImage();
    image.add(directory);
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      TiffWriter.writeTiff(path.toFile(), image);
    } catch (IOException | TiffException ex) {
      throw new RasterWriteException("Cannot write GeoTIFF " + path + ": " + ex.getMessage(), ex);
    }
    log.debug("Wrote {} to {}", raster, path);
  }

  static String crsFrom(List<Integer> geoKeys) {
    Integer projected = geoKey(geoKeys, KEY_PROJECTED_TYPE);
    if (projected != null && projected > 0 && projected != USER_DEFINED) {
      return "EPSG:" + projected;
    }
    Integer geographic = geoKey(geoKeys, KEY_GEOGRAPHIC_TYPE);
    if (geographic != null && geographic > 0 && geographic != USER_DEFINED) {
      return "EPSG:" + geographic;
    }
    return null;
  }

  // Only inline SHORT values are looked up; keys stored in GeoDoubleParams/GeoAsciiParams are skipped.
  static Integer geoKey(List<Integer> geoKeys, int keyId) {
    if (geoKeys.size() < 4) {
      return null;
    }
    int count = geoKeys.get(3);
    for (int i = 0; i < count; i++) {
      int base = 4 + i * 4;
      if (base + 3 >= geoKeys.size()) {
        break;
      }
      if (geoKeys.get(base) == keyId && geoKeys.get(base + 1) == 0) {
        return geoKeys.get(base + 3);
      }
    }
    return null;
  }

  private static GeoTransform transformFrom(FileDirectory directory, List<Integer> geoKeys,
      Path path) {
    GeoTransform transform;
    List<Double> scale = doubleValues(directory, MODEL_PIXEL_SCALE);
    List<Double> tiepoint = doubleValues(directory, MODEL_TIEPOINT);
    List<Double> matrix = doubleValues(directory, MODEL_TRANSFORMATION);
    try {
      if (scale.size() >= 2 && tiepoint.size() >= 6) {
        double sx = scale.get(0);
        double sy = scale.get(1);
        transform = new GeoTransform(tiepoint.get(3) - tiepoint.get(0) * sx,
            tiepoint.get(4) + tiepoint.get(1) * sy, sx, -sy);
      } else if (matrix.size() >= 16) {
        if (matrix.get(1) != 0d || matrix.get(4) != 0d) {
          throw new RasterReadException("Rotated GeoTIFF " + path + " is not supported");
        }
        transform = new GeoTransform(matrix.get(3), matrix.get(7), matrix.get(0), matrix.get(5));
      } else {
        throw new RasterReadException("GeoTIFF " + path + " has no georeferencing tags");
      }
    } catch (IllegalArgumentException ex) {
      throw new RasterReadException("GeoTIFF " + path + " has an invalid transform: "
          + ex.getMessage(), ex);
    }

    Integer rasterType = geoKey(geoKeys, KEY_RASTER_TYPE);
    if (rasterType != null && rasterType == RASTER_PIXEL_IS_POINT) {
      transform = new GeoTransform(
          transform.originX() - transform.pixelWidth() / 2d,
          transform.originY() - transform.pixelHeight() / 2d,
          transform.pixelWidth(), transform.pixelHeight());
    }
    return transform;
  }

  static float nodataFrom(FileDirectory directory) {
    FileDirectoryEntry entry = directory.get(GDAL_NODATA);
    if (entry == null || entry.getValues() == null) {
      return Float.NaN;
    }
    Object values = entry.getValues();
    String text = values instanceof List<?> list
        ? (list.isEmpty() ? "" : String.valueOf(list.get(0)))
        : String.valueOf(values);
    return parseNodata(text);
  }

  static float parseNodata(String text) {
    String trimmed = text.replace("\u0000", "").trim();
    if (trimmed.isEmpty() || trimmed.toLowerCase(Locale.ROOT).equals("nan")) {
      return Float.NaN;
    }
    try {
      return Float.parseFloat(trimmed);
    } catch (NumberFormatException ex) {
      throw new RasterReadException("Unparsable GDAL_NODATA value '" + trimmed + "'", ex);
    }
  }

  static int epsgCode(String crs) {
    if (crs == null || !crs.startsWith("EPSG:")) {
      return -1;
    }
    try {
      return Integer.parseInt(crs.substring("EPSG:".length()));
    } catch (NumberFormatException ex) {
      return -1;
    }
  }

  private static List<Double> doubleValues(FileDirectory directory, FieldTagType tag) {
    List<Double> out = new ArrayList<>();
    for (Number number : numbers(directory, tag)) {
      out.add(number.doubleValue());
    }
    return out;
  }

  private static List<Integer> intValues(FileDirectory directory, FieldTagType tag) {
    List<Integer> out = new ArrayList<>();
    for (Number number : numbers(directory, tag)) {
      out.add(number.intValue());
    }
    return out;
  }

  private static List<Number> numbers(FileDirectory directory, FieldTagType tag) {
    FileDirectoryEntry entry = directory.get(tag);
    List<Number> out = new ArrayList<>();
    if (entry == null) {
      return out;
    }
    Object values = entry.getValues();
    if (values instanceof List<?> list) {
      for (Object value : list) {
        if (value instanceof Number number) {
          out.add(number);
        }
      }
    } else if (values instanceof Number number) {
      out.add(number);
    }
    return out;
  }
}
