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
package org.skymaps.common.source;

import org.skymaps.common.projection.GridShape;
import org.skymaps.common.projection.PixelRectangle;
import org.skymaps.common.projection.PixelTransform;

/**
 * Access to the single logical 2D grid of float samples behind a layer.
 * <p>
 * Implementations must be safe for unbounded concurrent use; the backing data is immutable once loaded.
 */
public interface SourceDataProvider {

  /**
   * @return the native shape of the grid
   * @throws DataUnavailableException if the source cannot be opened
   */
  GridShape shape();

  /**
   * @return the mapping of pixels to sky coordinates
   * @throws DataUnavailableException if the source cannot be opened
   */
  PixelTransform transform();

  /**
   * Reads a rectangle of the grid at the target shape.  When the target is coarser than the rectangle each target
   * pixel is the mean of the valid native pixels in its block; pixels outside the grid and no-data pixels are excluded
   * and a block with no valid pixel is no-data.
   *
   * @param rectangle in native pixels, possibly extending beyond the grid
   * @param target the shape to read at, dividing the rectangle into whole blocks
   * @throws DataUnavailableException if the source cannot be opened
   */
  Array2D readRegion(PixelRectangle rectangle, GridShape target);

  /**
   * @return the whole grid at native resolution; callers must not assume a copy
   * @throws DataUnavailableException if the source cannot be opened
   */
  Array2D readNative();
}
