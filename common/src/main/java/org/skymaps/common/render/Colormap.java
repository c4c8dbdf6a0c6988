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
package org.skymaps.common.render;

import com.google.common.base.Preconditions;

/**
 * A fixed function from a normalized value to an opaque ARGB colour, held as a 256 entry lookup table interpolated
 * linearly between evenly spaced anchor colours.
 * <p>
 * Values below 0 take the under colour and values above 1 the over colour; both are the end colours of the table, so
 * an unclipped normalization saturates.
 */
public final class Colormap {
  public static final int SIZE = 256;

  private final String name;
  private final int[] lut;

  private Colormap(String name, int[] lut) {
    this.name = name;
    this.lut = lut;
  }

  /**
   * @param name of the colormap
   * @param anchors RGB colours (0xRRGGBB) evenly spaced over [0,1]
   */
  static Colormap interpolate(String name, int... anchors) {
    Preconditions.checkArgument(anchors.length >= 2, "A colormap needs at least two anchors");
    int[] lut = new int[SIZE];
    int segments = anchors.length - 1;
    for (int i = 0; i < SIZE; i++) {
      double position = (double) i / (SIZE - 1) * segments;
      int segment = Math.min((int) position, segments - 1);
      double t = position - segment;
      lut[i] = blend(anchors[segment], anchors[segment + 1], t);
    }
    return new Colormap(name, lut);
  }

  private static int blend(int from, int to, double t) {
    int r = channel(from >> 16, to >> 16, t);
    int g = channel(from >> 8, to >> 8, t);
    int b = channel(from, to, t);
    return 0xFF000000 | r << 16 | g << 8 | b;
  }

  private static int channel(int from, int to, double t) {
    int a = from & 0xFF;
    int b = to & 0xFF;
    return (int) Math.round(a + (b - a) * t);
  }

  /**
   * @return the same colours in the reverse order, named with an {@code _r} suffix
   */
  Colormap reversed() {
    int[] reversed = new int[SIZE];
    for (int i = 0; i < SIZE; i++) {
      reversed[i] = lut[SIZE - 1 - i];
    }
    return new Colormap(name + "_r", reversed);
  }

  public String getName() {
    return name;
  }

  /**
   * Looks up the colour of a normalized value.
   *
   * @param normalized the value, where [0,1] is the range of the table; NaN is not accepted
   * @return ARGB colour
   */
  public int color(double normalized) {
    if (normalized < 0) {
      return getUnderColor();
    } else if (normalized >= 1) {
      return getOverColor();
    }
    return lut[Math.min(SIZE - 1, (int) (normalized * SIZE))];
  }

  public int getUnderColor() {
    return lut[0];
  }

  public int getOverColor() {
    return lut[SIZE - 1];
  }

  @Override
  public String toString() {
    return name;
  }
}
