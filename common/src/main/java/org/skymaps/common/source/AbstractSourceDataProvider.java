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

import java.util.function.Supplier;

import com.google.common.base.Preconditions;
import com.google.common.base.Suppliers;

/**
 * Base for providers holding the whole grid in memory once loaded.  Loading happens at most once on success; a failed
 * load is attempted again by the next reader.
 */
public abstract class AbstractSourceDataProvider implements SourceDataProvider {

  private final String layerId;
  private final Supplier<Array2D> data;

  protected AbstractSourceDataProvider(String layerId) {
    this.layerId = layerId;
    this.data = Suppliers.memoize(this::load);
  }

  /**
   * Loads the grid in display order (row 0 at the top).
   *
   * @throws DataUnavailableException if the source cannot be read
   */
  protected abstract Array2D load();

  public String getLayerId() {
    return layerId;
  }

  @Override
  public Array2D readNative() {
    return data.get();
  }

  @Override
  public Array2D readRegion(PixelRectangle rectangle, GridShape target) {
    Preconditions.checkArgument(rectangle.getWidth() % target.getCols() == 0
                                && rectangle.getHeight() % target.getRows() == 0,
                                "Rectangle %s does not divide into a %s target", rectangle, target);
    long factorX = rectangle.getWidth() / target.getCols();
    long factorY = rectangle.getHeight() / target.getRows();
    Preconditions.checkArgument(factorX == factorY, "Downsampling must be equal on both axes");

    Array2D source = readNative();
    return factorX == 1 ? copy(source, rectangle, target) : blockAverage(source, rectangle, target, (int) factorX);
  }

  private static Array2D copy(Array2D source, PixelRectangle rectangle, GridShape target) {
    float[] out = new float[(int) target.size()];
    for (int r = 0; r < target.getRows(); r++) {
      long row = rectangle.getY() + r;
      for (int c = 0; c < target.getCols(); c++) {
        long col = rectangle.getX() + c;
        out[r * target.getCols() + c] = inside(source, row, col) ? source.get((int) row, (int) col) : Array2D.NO_DATA;
      }
    }
    return Array2D.wrap(target, out);
  }

  /**
   * Averages whole blocks, excluding no-data and out of grid pixels.  The summation order is fixed so that the result
   * is identical on every call.
   */
  private static Array2D blockAverage(Array2D source, PixelRectangle rectangle, GridShape target, int factor) {
    float[] out = new float[(int) target.size()];
    for (int r = 0; r < target.getRows(); r++) {
      long firstRow = rectangle.getY() + (long) r * factor;
      for (int c = 0; c < target.getCols(); c++) {
        long firstCol = rectangle.getX() + (long) c * factor;

        double sum = 0;
        int count = 0;
        long lastRow = Math.min(firstRow + factor, source.getRows());
        long lastCol = Math.min(firstCol + factor, source.getCols());
        for (long row = Math.max(firstRow, 0); row < lastRow; row++) {
          for (long col = Math.max(firstCol, 0); col < lastCol; col++) {
            float v = source.get((int) row, (int) col);
            if (!Array2D.isNoData(v)) {
              sum += v;
              count++;
            }
          }
        }
        out[r * target.getCols() + c] = count == 0 ? Array2D.NO_DATA : (float) (sum / count);
      }
    }
    return Array2D.wrap(target, out);
  }

  private static boolean inside(Array2D source, long row, long col) {
    return row >= 0 && col >= 0 && row < source.getRows() && col < source.getCols();
  }
}
