package com.ospicorp.laiforecast.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds dated GeoTIFFs below a directory. The date is taken from the first capture group of
 * {@code datePattern}, matched against the file name without extension. Yearly rasters such as
 * forecast class maps are found the same way with {@code yearPattern}.
 */
public class DatedFileCatalog {

  private static final Logger log = LoggerFactory.getLogger(DatedFileCatalog.class);

  public static final String DEFAULT_PATTERN = "^[^_]+_(\\d{7})(?:_.*)?$";
  public static final String DEFAULT_FORMAT = "uuuuDDD";
  /** Year as the last underscore-separated part of the name, e.g. {@code landuse_2030}. */
  public static final String DEFAULT_YEAR_PATTERN = "^(?:.*_)?(\\d{4})$";

  private final Pattern datePattern;
  private final DateTimeFormatter dateFormat;
  private final Pattern yearPattern;

  public DatedFileCatalog() {
    this(DEFAULT_PATTERN, DEFAULT_FORMAT, DEFAULT_YEAR_PATTERN);
  }

  public DatedFileCatalog(String datePattern, String dateFormat, String yearPattern) {
    this.datePattern = compile(datePattern, "date");
    this.dateFormat = DateTimeFormatter.ofPattern(dateFormat, Locale.ROOT);
    this.yearPattern = compile(yearPattern, "year");
  }

  private static Pattern compile(String regex, String what) {
    Pattern pattern = Pattern.compile(regex);
    if (pattern.matcher("").groupCount() < 1) {
      throw new IllegalArgumentException(what + " pattern needs a capture group: " + regex);
    }
    return pattern;
  }

  public NavigableMap<LocalDate, Path> scan(Path directory) {
    NavigableMap<LocalDate, Path> byDate = new TreeMap<>();
    for (Path file : listGeoTiffs(directory)) {
      LocalDate date = dateOf(file);
      if (date == null) {
        log.warn("Skipping {}: no date in file name", file);
        continue;
      }
      Path previous = byDate.putIfAbsent(date, file);
      if (previous != null) {
        log.warn("Skipping {}: date {} already provided by {}", file, date, previous);
      }
    }
    log.info("Found {} dated rasters in {}", byDate.size(), directory);
    return byDate;
  }

  /** Rasters below {@code directory} keyed by the year in their file name. */
  public NavigableMap<Integer, Path> scanYears(Path directory) {
    NavigableMap<Integer, Path> byYear = new TreeMap<>();
    for (Path file : listGeoTiffs(directory)) {
      Integer year = yearOf(file);
      if (year == null) {
        log.warn("Skipping {}: no year in file name", file);
        continue;
      }
      Path previous = byYear.putIfAbsent(year, file);
      if (previous != null) {
        log.warn("Skipping {}: year {} already provided by {}", file, year, previous);
      }
    }
    log.info("Found {} yearly rasters in {}", byYear.size(), directory);
    return byYear;
  }

  /** Date encoded in the file name, or null when the name does not carry one. */
  public LocalDate dateOf(Path file) {
    Matcher matcher = datePattern.matcher(stem(file));
    if (!matcher.matches()) {
      return null;
    }
    try {
      return LocalDate.parse(matcher.group(1), dateFormat);
    } catch (DateTimeParseException ex) {
      log.debug("'{}' is not a date in {}", matcher.group(1), dateFormat, ex);
      return null;
    }
  }

  /** Year encoded in the file name, or null when the name does not carry one. */
  public Integer yearOf(Path file) {
    Matcher matcher = yearPattern.matcher(stem(file));
    return matcher.matches() ? Integer.valueOf(matcher.group(1)) : null;
  }

  private static String stem(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private static List<Path> listGeoTiffs(Path directory) {
    if (!Files.isDirectory(directory)) {
      throw new IllegalStateException("Input directory does not exist: " + directory);
    }
    try (Stream<Path> walk = Files.walk(directory)) {
      return walk.filter(Files::isRegularFile)
          .filter(DatedFileCatalog::isGeoTiff)
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot list " + directory, ex);
    }
  }

  private static boolean isGeoTiff(Path file) {
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    return name.endsWith(".tif") || name.endsWith(".tiff");
  }
}
