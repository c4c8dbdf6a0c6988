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

import java.io.Serializable;
import java.util.Locale;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Validated parameters for turning samples into colours.
 * <p>
 * The bounds are rounded to the fixed precision used by cache keys when the parameters are built, so that two
 * requests sharing a key always render with exactly the same bounds.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RenderParameters implements Serializable {
  private static final long serialVersionUID = -6287069823174216554L;

  private static final String BOUND_FORMAT = "%.8e";

  private final String colormap;
  private final double vmin;
  private final double vmax;
  private final Normalization normalization;
  private final boolean clip;
  /**
   * Samples are rendered by magnitude, ignoring their sign.
   */
  private final boolean abs;

  private RenderParameters(String colormap, double vmin, double vmax, Normalization normalization, boolean clip,
                           boolean abs) {
    this.colormap = colormap;
    this.vmin = vmin;
    this.vmax = vmax;
    this.normalization = normalization;
    this.clip = clip;
    this.abs = abs;
  }

  /**
   * Parameters rendering the signed sample values.
   *
   * @see #of(String, double, double, Normalization, boolean, boolean)
   */
  public static RenderParameters of(String colormap, double vmin, double vmax, Normalization normalization,
                                    boolean clip) {
    return of(colormap, vmin, vmax, normalization, clip, false);
  }

  /**
   * Validates and canonicalizes the parameters.
   *
   * @throws InvalidRenderParametersException if the colormap is unknown, a bound is not finite, vmax is not above
   * vmin, or logarithmic normalization is requested with vmin ≤ 0
   */
  public static RenderParameters of(String colormap, double vmin, double vmax, Normalization normalization,
                                    boolean clip, boolean abs) {
    if (!Colormaps.exists(colormap)) {
      throw new InvalidRenderParametersException("Unknown colormap: " + colormap);
    }
    if (normalization == null) {
      throw new InvalidRenderParametersException("A normalization is required");
    }
    if (!Double.isFinite(vmin) || !Double.isFinite(vmax)) {
      throw new InvalidRenderParametersException("vmin and vmax must be finite numbers");
    }
    double min = canonical(vmin);
    double max = canonical(vmax);
    if (max <= min) {
      throw new InvalidRenderParametersException(
        String.format(Locale.ROOT, "vmax (%s) must be greater than vmin (%s)", vmax, vmin));
    }
    if (normalization == Normalization.LOG && min <= 0) {
      throw new InvalidRenderParametersException("Logarithmic normalization requires vmin > 0, got " + vmin);
    }
    return new RenderParameters(colormap, min, max, normalization, clip, abs);
  }

  /**
   * Formats a bound with the fixed precision of cache keys; negative zero is written as zero.
   */
  public static String formatBound(double value) {
    return String.format(Locale.ROOT, BOUND_FORMAT, value == 0 ? 0d : value);
  }

  static double canonical(double value) {
    return Double.parseDouble(formatBound(value));
  }

  public boolean isLog() {
    return normalization == Normalization.LOG;
  }
}
