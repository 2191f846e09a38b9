package com.ospicorp.laiforecast.io;

import com.ospicorp.laiforecast.raster.CrsRegistry;
import com.ospicorp.laiforecast.raster.GeoTransform;
import com.ospicorp.laiforecast.raster.GridGeometry;
import com.ospicorp.laiforecast.raster.GridMismatchException;
import com.ospicorp.laiforecast.raster.StudyAreaMask;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

/** Study-area polygons in their own CRS. */
public record Boundary(List<Polygon> polygons, String crs) {

  public Boundary {
    Objects.requireNonNull(polygons, "polygons");
    Objects.requireNonNull(crs, "crs");
    if (polygons.isEmpty()) {
      throw new IllegalArgumentException("a boundary needs at least one polygon");
    }
    polygons = List.copyOf(polygons);
  }

  /**
   * A pixel is inside when its centre lies in the interior of any polygon. Holes are not part of
   * a polygon's interior.
   */
  public StudyAreaMask rasterize(GridGeometry grid, CrsRegistry crsRegistry) {
    if (!grid.hasCrs()) {
      throw new GridMismatchException("Cannot rasterize a boundary onto a grid without a CRS");
    }
    List<PreparedGeometry> shapes = new ArrayList<>(polygons.size());
    for (Polygon polygon : polygons) {
      shapes.add(PreparedGeometryFactory.prepare(polygon));
    }

    CoordinateTransform toBoundary = null;
    if (!grid.crs().equalsIgnoreCase(crs)) {
      try {
        toBoundary = crsRegistry.transform(grid.crs(), crs);
      } catch (IllegalArgumentException | Proj4jException ex) {
        throw new GridMismatchException("Cannot reproject boundary from " + crs + " to "
            + grid.crs() + ": " + ex.getMessage(), ex);
      }
    }

    GeometryFactory factory = polygons.get(0).getFactory();
    GeoTransform transform = grid.transform();
    ProjCoordinate in = new ProjCoordinate();
    ProjCoordinate out = new ProjCoordinate();
    boolean[] inside = new boolean[grid.size()];
    for (int row = 0; row < grid.height(); row++) {
      for (int col = 0; col < grid.width(); col++) {
        double x = transform.columnCenterX(col);
        double y = transform.rowCenterY(row);
        if (toBoundary != null) {
          in.x = x;
          in.y = y;
          try {
            toBoundary.transform(in, out);
          } catch (Proj4jException ex) {
            // outside the projection domain, so outside the study area
            continue;
          }
          x = out.x;
          y = out.y;
        }
        Point centre = factory.createPoint(new Coordinate(x, y));
        for (PreparedGeometry shape : shapes) {
          if (shape.contains(centre)) {
            inside[grid.index(col, row)] = true;
            break;
          }
        }
      }
    }
    return new StudyAreaMask(grid, inside);
  }
}
