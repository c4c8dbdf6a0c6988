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
import org.skymaps.common.projection.PixelTransform;

/**
 * A provider over a grid already held in memory, e.g. generated data or tests.
 */
public class ArraySourceDataProvider extends AbstractSourceDataProvider {

  private final Array2D array;
  private final PixelTransform transform;

  public ArraySourceDataProvider(String layerId, Array2D array, PixelTransform transform) {
    super(layerId);
    this.array = array;
    this.transform = transform;
  }

  /**
   * A provider assuming the grid covers the full sky.
   */
  public ArraySourceDataProvider(String layerId, Array2D array) {
    this(layerId, array, PixelTransform.fullSky(array.getShape()));
  }

  @Override
  protected Array2D load() {
    return array;
  }

  @Override
  public GridShape shape() {
    return array.getShape();
  }

  @Override
  public PixelTransform transform() {
    return transform;
  }
}
