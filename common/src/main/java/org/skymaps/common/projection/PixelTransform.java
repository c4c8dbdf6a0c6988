/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.skymaps.common.projection;

import java.io.Serializable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A linear (plate carrée, CAR) mapping between the pixels of a layer and sky coordinates in degrees, following the
 * FITS world coordinate conventions: reference pixel {@code CRPIXn} (1-based), reference value {@code CRVALn} and
 * increment {@code CDELTn} per axis.
 * <p>
 * Pixels are addressed in display order, as everywhere else in tile addressing: column 0 is the left edge and row 0
 * the top of the map, while FITS stores the bottom row first.
 * <p>
 * This class is threadsafe.
 */
@ToString
@EqualsAndHashCode
public class PixelTransform implements Serializable {
  private static final long serialVersionUID = -1542379112240781146L;

  private final double crpix1;
  private final double crval1;
  private final double cdelt1;
  private final double crpix2;
  private final double crval2;
  private final double cdelt2;
  private final int rows;

  public PixelTransform(double crpix1, double crval1, double cdelt1,
                        double crpix2, double crval2, double cdelt2, int rows) {
    Preconditions.checkArgument(cdelt1 != 0 && cdelt2 != 0, "Pixel increments must be non zero");
    this.crpix1 = crpix1;
    this.crval1 = crval1;
    this.cdelt1 = cdelt1;
    this.crpix2 = crpix2;
    this.crval2 = crval2;
    this.cdelt2 = cdelt2;
    this.rows = rows;
  }

  /**
   * A full sky transform for a grid without a world coordinate system: RA runs from +180° on the left to −180° on the
   * right, as on the sky seen from inside, and Dec from +90° at the top to −90° at the bottom.
   */
  public static PixelTransform fullSky(GridShape shape) {
    return new PixelTransform(shape.getCols() / 2d + 0.5, 0, -360d / shape.getCols(),
                              shape.getRows() / 2d + 0.5, 0, 180d / shape.getRows(),
                              shape.getRows());
  }

  /**
   * Converts the centre of a pixel to RA (x) and Dec (y) in degrees.
   */
  public Double2D toSky(double col, double row) {
    double p1 = col + 1;
    double p2 = rows - row;
    return new Double2D(crval1 + cdelt1 * (p1 - crpix1), crval2 + cdelt2 * (p2 - crpix2));
  }

  /**
   * Converts RA and Dec in degrees to fractional display pixel coordinates.
   */
  public Double2D toPixel(double ra, double dec) {
    double p1 = (ra - crval1) / cdelt1 + crpix1;
    double p2 = (dec - crval2) / cdelt2 + crpix2;
    return new Double2D(p1 - 1, rows - p2);
  }

  /**
   * Returns the sky envelope of the pixel rectangle, as the minimum and maximum corners.  RA is expressed in the
   * −180..180 range.
   */
  public Double2D[] boundary(PixelRectangle rectangle) {
    Double2D topLeft = toSky(rectangle.getX() - 0.5, rectangle.getY() - 0.5);
    Double2D bottomRight = toSky(rectangle.getMaxX() - 0.5, rectangle.getMaxY() - 0.5);
    double ra1 = to180Degrees(topLeft.getX());
    double ra2 = to180Degrees(bottomRight.getX());
    return new Double2D[] {
      new Double2D(Math.min(ra1, ra2), Math.min(topLeft.getY(), bottomRight.getY())),
      new Double2D(Math.max(ra1, ra2), Math.max(topLeft.getY(), bottomRight.getY()))
    };
  }

  /**
   * The sky envelope of a whole grid.
   */
  public Double2D[] boundary(GridShape shape) {
    return boundary(new PixelRectangle(0, 0, shape.getCols(), shape.getRows()));
  }

  /**
   * If the longitude is expressed from 0..360 it is converted to -180..180.
   */
  @VisibleForTesting
  static double to180Degrees(double longitude) {
    if (longitude > 180) {
      return longitude - 360;
    } else if (longitude < -180) {
      return longitude + 360;
    }
    return longitude;
  }
}
