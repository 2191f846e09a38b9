package com.ospicorp.laiforecast.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads Polygon and MultiPolygon geometries from a GeoJSON file, directly or inside features
 * and geometry collections. Coordinates default to EPSG:4326; a legacy named {@code crs} member
 * overrides that. Polygons that are empty, have no area or are not valid are dropped; a file
 * left without any polygon is rejected.
 */
public class GeoJsonBoundarySource implements BoundarySource {

  private static final Logger log = LoggerFactory.getLogger(GeoJsonBoundarySource.class);

  static final String DEFAULT_CRS = "EPSG:4326";

  private final ObjectMapper mapper;
  private final GeometryFactory geometryFactory = new GeometryFactory();

  public GeoJsonBoundarySource(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public Boundary loadBoundary(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new BoundaryReadException("Boundary file not found: " + path);
    }
    JsonNode root;
    try {
      root = mapper.readTree(path.toFile());
    } catch (IOException ex) {
      throw new BoundaryReadException("Cannot parse boundary " + path + ": " + ex.getMessage(), ex);
    }
    if (root == null || !root.isObject()) {
      throw new BoundaryReadException("Boundary " + path + " is not a GeoJSON object");
    }

    List<Polygon> polygons = new ArrayList<>();
    collect(root, polygons, path);
    if (polygons.isEmpty()) {
      throw new BoundaryReadException("Boundary " + path + " contains no usable polygon");
    }
    String crs = crsOf(root);
    log.info("Loaded {} boundary polygon(s) in {} from {}", polygons.size(), crs, path);
    return new Boundary(polygons, crs);
  }

  private void collect(JsonNode node, List<Polygon> polygons, Path path) {
    String type = node.path("type").asText("");
    switch (type) {
      case "FeatureCollection" -> {
        for (JsonNode feature : node.path("features")) {
          collect(feature, polygons, path);
        }
      }
      case "Feature" -> {
        JsonNode geometry = node.path("geometry");
        if (geometry.isObject()) {
          collect(geometry, polygons, path);
        }
      }
      case "GeometryCollection" -> {
        for (JsonNode geometry : node.path("geometries")) {
          collect(geometry, polygons, path);
        }
      }
      case "Polygon", "MultiPolygon" -> {
        Geometry geometry = read((ObjectNode) node, path);
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
          Polygon polygon = (Polygon) geometry.getGeometryN(i);
          if (polygon.isEmpty() || polygon.getArea() <= 0d || !polygon.isValid()) {
            log.warn("Dropping degenerate polygon {} in {}", polygon, path);
          } else {
            polygons.add(polygon);
          }
        }
      }
      default -> log.debug("Ignoring GeoJSON {} in {}", type.isEmpty() ? "node" : type, path);
    }
  }

  private Geometry read(ObjectNode node, Path path) {
    // the crs member is resolved separately, see crsOf
    ObjectNode geometry = node.deepCopy();
    geometry.remove("crs");
    try {
      return new GeoJsonReader(geometryFactory).read(mapper.writeValueAsString(geometry));
    } catch (ParseException | JsonProcessingException | IllegalArgumentException ex) {
      throw new BoundaryReadException("Invalid " + node.path("type").asText() + " in " + path
          + ": " + ex.getMessage(), ex);
    }
  }

  static String crsOf(JsonNode root) {
    String name = root.path("crs").path("properties").path("name").asText("");
    if (name.isBlank()) {
      return DEFAULT_CRS;
    }
    String upper = name.trim().toUpperCase(Locale.ROOT);
    if (upper.endsWith("CRS84")) {
      return DEFAULT_CRS;
    }
    String code = upper.substring(upper.lastIndexOf(':') + 1);
    if (code.isEmpty() || !code.chars().allMatch(Character::isDigit)) {
      throw new BoundaryReadException("Unsupported boundary CRS " + name);
    }
    return "EPSG:" + code;
  }
}
