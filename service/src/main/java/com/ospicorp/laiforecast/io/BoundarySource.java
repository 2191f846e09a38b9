package com.ospicorp.laiforecast.io;

import java.nio.file.Path;

public interface BoundarySource {

  /**
   * @throws BoundaryReadException if the file is absent, unparsable, or holds no polygon
   */
  Boundary loadBoundary(Path path);
}
