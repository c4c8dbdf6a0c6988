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

import com.google.common.base.Preconditions;

import lombok.Data;

/**
 * The shape of a 2D grid of samples; rows are the vertical axis and cols the horizontal.
 */
@Data
public class GridShape implements Serializable {
  private static final long serialVersionUID = -3052311796418742183L;

  private final int rows;
  private final int cols;

  public GridShape(int rows, int cols) {
    Preconditions.checkArgument(rows > 0 && cols > 0, "Grid shape must be positive, got %s×%s", rows, cols);
    this.rows = rows;
    this.cols = cols;
  }

  public static GridShape square(int edge) {
    return new GridShape(edge, edge);
  }

  public long size() {
    return (long) rows * cols;
  }

  @Override
  public String toString() {
    return rows + "×" + cols;
  }
}
