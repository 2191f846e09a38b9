package com.ospicorp.laiforecast.raster;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.proj.LongLatProjection;

/**
 * Resolves CRS codes such as {@code EPSG:32633} through proj4j. Resolved systems are cached;
 * transforms are created per call because proj4j transforms keep mutable scratch state.
 */
public class CrsRegistry {

  private final CRSFactory crsFactory = new CRSFactory();
  private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
  private final Map<String, CoordinateReferenceSystem> systems = new ConcurrentHashMap<>();

  public CoordinateReferenceSystem resolve(String code) {
    if (code == null) {
      throw new IllegalArgumentException("CRS code is undefined");
    }
    return systems.computeIfAbsent(code, this::create);
  }

  public CoordinateTransform transform(String fromCode, String toCode) {
    return transformFactory.createTransform(resolve(fromCode), resolve(toCode));
  }

  public boolean isGeographic(String code) {
    return resolve(code).getProjection() instanceof LongLatProjection;
  }

  private CoordinateReferenceSystem create(String code) {
    CoordinateReferenceSystem system;
    try {
      system = crsFactory.createFromName(code);
    } catch (Proj4jException ex) {
      throw new IllegalArgumentException("Unknown coordinate reference system " + code, ex);
    }
    if (system == null) {
      throw new IllegalArgumentException("Unknown coordinate reference system " + code);
    }
    return system;
  }
}
