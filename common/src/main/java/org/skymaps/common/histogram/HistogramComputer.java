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
package org.skymaps.common.histogram;

import org.skymaps.common.catalog.Layer;
import org.skymaps.common.catalog.RenderDefaults;
import org.skymaps.common.source.Array2D;

import java.util.Arrays;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summarises the values of a layer from its native data.
 * <p>
 * Large grids are sampled with a fixed stride so that a histogram never inspects more than {@code maxSamples} values;
 * for a given layer and configuration the result is always the same.
 * <p>
 * This class is threadsafe.
 */
public class HistogramComputer {
  private static final Logger LOG = LoggerFactory.getLogger(HistogramComputer.class);

  /**
   * The bin range extends this far beyond the suggested bounds.
   */
  private static final double RANGE_FACTOR = 4;

  private final int bins;
  private final int maxSamples;
  private final double contrastPercentile;

  /**
   * @param bins the number of equal width bins
   * @param maxSamples the most values inspected per layer
   * @param contrastPercentile the quantile {@code p} for suggested bounds, which are the {@code p} and {@code 1 - p}
   * quantiles
   */
  public HistogramComputer(int bins, int maxSamples, double contrastPercentile) {
    Preconditions.checkArgument(bins > 0, "At least one bin is required");
    Preconditions.checkArgument(maxSamples > 0, "maxSamples must be positive");
    Preconditions.checkArgument(contrastPercentile >= 0 && contrastPercentile < 0.5,
                                "contrastPercentile must be in [0, 0.5)");
    this.bins = bins;
    this.maxSamples = maxSamples;
    this.contrastPercentile = contrastPercentile;
  }

  /**
   * @throws org.skymaps.common.source.DataUnavailableException if the layer cannot be read
   */
  public Histogram compute(Layer layer) {
    Stopwatch timer = Stopwatch.createStarted();
    Array2D data = layer.getSource().readNative();

    int stride = stride(data.size(), maxSamples);
    float[] sample = new float[(data.size() + stride - 1) / stride];
    int count = 0;
    for (int i = 0; i < data.size(); i += stride) {
      float v = data.getFlat(i);
      if (Float.isFinite(v)) {
        sample[count++] = v;
      }
    }
    float[] sorted = Arrays.copyOf(sample, count);
    Arrays.sort(sorted);

    double[] bounds = suggestBounds(sorted, layer.getDefaults());
    double[] edges = edges(bounds[0], bounds[1], bins);
    long[] counts = count(sorted, edges);

    LOG.info("Computed histogram of layer {} from {} samples (stride {}) in {}ms, suggesting [{}, {}]",
             layer.getLayerId(), count, stride, timer.elapsed().toMillis(), bounds[0], bounds[1]);
    return new Histogram(layer.getLayerId(), edges, counts, bounds[0], bounds[1], count, stride,
                         positiveQuantile(sorted, contrastPercentile));
  }

  @VisibleForTesting
  static int stride(int size, int maxSamples) {
    return Math.max(1, (int) ((size + (long) maxSamples - 1) / maxSamples));
  }

  /**
   * Configured bounds take precedence over the quantiles of the data.
   */
  @VisibleForTesting
  double[] suggestBounds(float[] sorted, RenderDefaults defaults) {
    double vmin;
    double vmax;
    if (sorted.length == 0) {
      vmin = defaults.getVmin() != null ? defaults.getVmin() : 0;
      vmax = defaults.getVmax() != null ? defaults.getVmax() : 1;
    } else {
      vmin = defaults.getVmin() != null ? defaults.getVmin() : quantile(sorted, contrastPercentile);
      vmax = defaults.getVmax() != null ? defaults.getVmax() : quantile(sorted, 1 - contrastPercentile);
    }
    if (vmin > vmax) {
      double swap = vmin;
      vmin = vmax;
      vmax = swap;
    } else if (vmin == vmax) {
      vmin -= 0.5;
      vmax += 0.5;
    }
    return new double[] {vmin, vmax};
  }

  /**
   * Linear interpolation between the closest order statistics.
   */
  @VisibleForTesting
  static double quantile(float[] sorted, double q) {
    double position = q * (sorted.length - 1);
    int lower = (int) Math.floor(position);
    int upper = (int) Math.ceil(position);
    return sorted[lower] + (sorted[upper] - (double) sorted[lower]) * (position - lower);
  }

  /**
   * The quantile of the strictly positive samples.
   *
   * @return the quantile, or null when no sample is positive
   */
  @VisibleForTesting
  static Double positiveQuantile(float[] sorted, double q) {
    int first = 0;
    while (first < sorted.length && sorted[first] <= 0) {
      first++;
    }
    if (first == sorted.length) {
      return null;
    }
    return quantile(Arrays.copyOfRange(sorted, first, sorted.length), q);
  }

  /**
   * Bins extend beyond the suggested bounds, keeping the bounds' sign when both share one.
   */
  @VisibleForTesting
  static double[] edges(double vmin, double vmax, int bins) {
    double start;
    double end;
    if ((vmin >= 0 && vmax >= 0) || (vmin <= 0 && vmax <= 0)) {
      start = vmin < 0 ? vmin * RANGE_FACTOR : vmin / RANGE_FACTOR;
      end = vmax < 0 ? vmax / RANGE_FACTOR : vmax * RANGE_FACTOR;
    } else {
      start = vmin * RANGE_FACTOR;
      end = vmax * RANGE_FACTOR;
    }
    if (start == end) {
      start -= 0.5;
      end += 0.5;
    }
    double[] edges = new double[bins + 1];
    for (int i = 0; i <= bins; i++) {
      edges[i] = start + (end - start) * i / bins;
    }
    edges[bins] = end;
    return edges;
  }

  private static long[] count(float[] sorted, double[] edges) {
    int bins = edges.length - 1;
    double start = edges[0];
    double end = edges[bins];
    long[] counts = new long[bins];
    for (float v : sorted) {
      if (v < start || v > end) {
        continue;
      }
      int bin = v == end ? bins - 1 : (int) ((v - start) / (end - start) * bins);
      counts[Math.min(bin, bins - 1)]++;
    }
    return counts;
  }
}
