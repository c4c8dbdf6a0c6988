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

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A rectangle of native pixels, addressed with column {@code x} and row {@code y} of its top left corner.
 * The rectangle of an edge tile may extend beyond the grid it was resolved against; readers fill the pixels outside
 * the grid with the no-data sentinel.
 */
@Data
@AllArgsConstructor
public class PixelRectangle implements Serializable {
  private static final long serialVersionUID = 7710270263612316021L;

  private final long x;
  private final long y;
  private final long width;
  private final long height;

  /**
   * @return the first column after the rectangle
   */
  public long getMaxX() {
    return x + width;
  }

  /**
   * @return the first row after the rectangle
   */
  public long getMaxY() {
    return y + height;
  }

  public long area() {
    return width * height;
  }

  /**
   * True if every pixel of the rectangle lies within the grid.
   */
  public boolean isWithin(GridShape shape) {
    return x >= 0 && y >= 0 && getMaxX() <= shape.getCols() && getMaxY() <= shape.getRows();
  }

  @Override
  public String toString() {
    return String.format("[%d:%d, %d:%d]", x, getMaxX(), y, getMaxY());
  }
}
