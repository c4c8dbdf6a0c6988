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

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

/**
 * The named colormaps tiles can be rendered with.  Every colormap is also available reversed, by appending
 * {@code _r} to its name.  Anchor colours follow the matplotlib colormaps of the same names.
 */
public class Colormaps {

  public static final String DEFAULT = "viridis";

  private static final Map<String, Colormap> COLORMAPS;

  static {
    ImmutableMap.Builder<String, Colormap> builder = ImmutableMap.builder();
    Colormap[] base = new Colormap[] {
      Colormap.interpolate("viridis",
        0x440154, 0x482878, 0x3e4989, 0x31688e, 0x26828e, 0x1f9e89, 0x35b779, 0x6ece58, 0xb5de2b, 0xfde725),
      Colormap.interpolate("magma",
        0x000004, 0x180f3d, 0x440f76, 0x721f81, 0x9e2f7f, 0xcd4071, 0xf1605d, 0xfd9668, 0xfeca8d, 0xfcfdbf),
      Colormap.interpolate("plasma",
        0x0d0887, 0x46039f, 0x7201a8, 0x9c179e, 0xbd3786, 0xd8576b, 0xed7953, 0xfb9f3a, 0xfdca26, 0xf0f921),
      Colormap.interpolate("inferno",
        0x000004, 0x1b0c41, 0x4a0c6b, 0x781c6d, 0xa52c60, 0xcf4446, 0xed6925, 0xfb9b06, 0xf7d13d, 0xfcffa4),
      Colormap.interpolate("cividis",
        0x00224e, 0x123570, 0x3b496c, 0x575d6d, 0x707173, 0x8a8678, 0xa59c74, 0xc3b369, 0xe1cc55, 0xfee838),
      Colormap.interpolate("gray", 0x000000, 0xffffff),
      Colormap.interpolate("greys", 0xffffff, 0x000000),
      Colormap.interpolate("coolwarm",
        0x3b4cc0, 0x6788ee, 0x9abbff, 0xc9d7f0, 0xedd1c2, 0xf7a889, 0xe26952, 0xb40426),
      Colormap.interpolate("RdBu",
        0x67001f, 0xb2182b, 0xd6604d, 0xf4a582, 0xfddbc7, 0xf7f7f7, 0xd1e5f0, 0x92c5de, 0x4393c3, 0x2166ac, 0x053061),
      Colormap.interpolate("RdYlBu",
        0xa50026, 0xd73027, 0xf46d43, 0xfdae61, 0xfee090, 0xffffbf, 0xe0f3f8, 0xabd9e9, 0x74add1, 0x4575b4, 0x313695)
    };
    for (Colormap colormap : base) {
      builder.put(colormap.getName(), colormap);
      Colormap reversed = colormap.reversed();
      builder.put(reversed.getName(), reversed);
    }
    COLORMAPS = builder.build();
  }

  private Colormaps() {}

  /**
   * @throws InvalidRenderParametersException if there is no such colormap
   */
  public static Colormap get(String name) {
    Colormap colormap = COLORMAPS.get(name);
    if (colormap == null) {
      throw new InvalidRenderParametersException("Unknown colormap: " + name);
    }
    return colormap;
  }

  public static boolean exists(String name) {
    return name != null && COLORMAPS.containsKey(name);
  }

  public static Set<String> names() {
    return COLORMAPS.keySet();
  }
}
