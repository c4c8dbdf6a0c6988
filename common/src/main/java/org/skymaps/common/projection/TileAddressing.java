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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.math.IntMath;

import java.math.RoundingMode;

/**
 * Maps tile addresses onto the native pixels of a layer, and back.
 * <p>
 * The pyramid is virtual: tiles are square, {@code tileSize} pixels on an edge, and at zoom {@code z} a tile covers
 * {@code tileSize · 2^(zMax − z)} native pixels on an edge.  {@code zMax} is the smallest zoom at which one tile pixel
 * is one native pixel, so grids whose size is not a power of two are covered by partial tiles along the right and
 * bottom edges.  Row 0 is the top of the map and tile {@code y} increases downwards.
 * <p>
 * This class is threadsafe.
 */
public class TileAddressing {

  private final int tileSize;

  public TileAddressing(int tileSize) {
    Preconditions.checkArgument(tileSize > 0, "Tile size must be positive");
    this.tileSize = tileSize;
  }

  public int getTileSize() {
    return tileSize;
  }

  /**
   * @return the deepest zoom level of the pyramid over a grid of this shape
   */
  public int maxZoom(GridShape shape) {
    int longest = Math.max(shape.getRows(), shape.getCols());
    if (longest <= tileSize) {
      return 0;
    }
    int tilesAtNative = IntMath.divide(longest, tileSize, RoundingMode.CEILING);
    return IntMath.log2(tilesAtNative, RoundingMode.CEILING);
  }

  /**
   * @return the number of native pixels on the edge of one tile at the zoom
   */
  public long span(GridShape shape, int z) {
    return (long) tileSize << (maxZoom(shape) - z);
  }

  /**
   * @return the ratio between native pixels and tile pixels at the zoom
   */
  public int downsampleFactor(GridShape shape, int z) {
    checkZoom(shape, z);
    return 1 << (maxZoom(shape) - z);
  }

  public long tilesWide(GridShape shape, int z) {
    checkZoom(shape, z);
    return ceilDiv(shape.getCols(), span(shape, z));
  }

  public long tilesHigh(GridShape shape, int z) {
    checkZoom(shape, z);
    return ceilDiv(shape.getRows(), span(shape, z));
  }

  /**
   * Resolves the native pixels covered by a tile.
   *
   * @param shape of the layer
   * @param z zoom
   * @param x tile column
   * @param y tile row
   * @return the covered rectangle, which may extend beyond the grid for edge tiles
   * @throws TileOutOfRangeException if the tile does not exist at this zoom
   */
  public PixelRectangle resolve(GridShape shape, int z, long x, long y) {
    checkZoom(shape, z);
    long wide = tilesWide(shape, z);
    long high = tilesHigh(shape, z);
    if (x < 0 || x >= wide || y < 0 || y >= high) {
      throw new TileOutOfRangeException(
        String.format("Tile %d/%d/%d is outside the %d×%d tile grid of zoom %d", z, x, y, wide, high, z));
    }
    long span = span(shape, z);
    return new PixelRectangle(x * span, y * span, span, span);
  }

  /**
   * The inverse of {@link #resolve}: the tile containing a native pixel at the given zoom.
   */
  public Long2D tileContaining(GridShape shape, int z, long col, long row) {
    checkZoom(shape, z);
    if (col < 0 || col >= shape.getCols() || row < 0 || row >= shape.getRows()) {
      throw new TileOutOfRangeException(String.format("Pixel %d,%d is outside the %s grid", col, row, shape));
    }
    long span = span(shape, z);
    return new Long2D(col / span, row / span);
  }

  /**
   * The target shape that a tile is rendered at.
   */
  public GridShape tileShape() {
    return GridShape.square(tileSize);
  }

  private void checkZoom(GridShape shape, int z) {
    int maxZoom = maxZoom(shape);
    if (z < 0 || z > maxZoom) {
      throw new TileOutOfRangeException(String.format("Zoom %d is outside the range 0–%d", z, maxZoom));
    }
  }

  @VisibleForTesting
  static long ceilDiv(long a, long b) {
    return (a + b - 1) / b;
  }
}
