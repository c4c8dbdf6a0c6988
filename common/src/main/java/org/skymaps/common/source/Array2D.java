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

import com.google.common.base.Preconditions;

/**
 * An immutable 2D grid of float samples held row-major, row 0 being the top of the map.
 * <p>
 * The no-data sentinel is {@link Float#NaN}: it marks pixels without a valid sample, including pixels of an edge tile
 * that fall outside the source grid.  It is never treated as a value.
 * <p>
 * Instances take ownership of the array they wrap and never modify it, so they may be shared between threads.
 */
public final class Array2D {

  public static final float NO_DATA = Float.NaN;

  private final GridShape shape;
  private final float[] samples;

  private Array2D(GridShape shape, float[] samples) {
    Preconditions.checkArgument(samples.length == shape.size(),
                                "Expected %s samples for a %s grid but got %s", shape.size(), shape, samples.length);
    this.shape = shape;
    this.samples = samples;
  }

  /**
   * Wraps the samples without copying; the caller must not modify them afterwards.
   */
  public static Array2D wrap(GridShape shape, float[] samples) {
    return new Array2D(shape, samples);
  }

  /**
   * Copies a jagged row-major array.
   */
  public static Array2D of(float[][] rows) {
    Preconditions.checkArgument(rows.length > 0 && rows[0].length > 0, "Empty array");
    GridShape shape = new GridShape(rows.length, rows[0].length);
    float[] samples = new float[(int) shape.size()];
    for (int r = 0; r < rows.length; r++) {
      Preconditions.checkArgument(rows[r].length == shape.getCols(), "Ragged array at row %s", r);
      System.arraycopy(rows[r], 0, samples, r * shape.getCols(), shape.getCols());
    }
    return new Array2D(shape, samples);
  }

  public static boolean isNoData(float value) {
    return Float.isNaN(value);
  }

  public GridShape getShape() {
    return shape;
  }

  public int getRows() {
    return shape.getRows();
  }

  public int getCols() {
    return shape.getCols();
  }

  public int size() {
    return samples.length;
  }

  public float get(int row, int col) {
    return samples[row * shape.getCols() + col];
  }

  /**
   * Returns the sample at a row-major index.
   */
  public float getFlat(int index) {
    return samples[index];
  }
}
