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
package org.skymaps.service;

import org.skymaps.cache.CacheStore;
import org.skymaps.common.cache.TileCacheKey;
import org.skymaps.common.catalog.Layer;
import org.skymaps.common.catalog.LayerRegistry;
import org.skymaps.common.catalog.RenderDefaults;
import org.skymaps.common.histogram.Histogram;
import org.skymaps.common.projection.PixelRectangle;
import org.skymaps.common.projection.TileAddressing;
import org.skymaps.common.render.Normalization;
import org.skymaps.common.render.RenderParameters;
import org.skymaps.common.render.Renderer;
import org.skymaps.common.render.TileImage;
import org.skymaps.common.source.Array2D;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves rendered tiles, computing each at most once at a time per process.
 * <p>
 * A request is first resolved to a {@link TileCacheKey}, which validates the layer, the tile address and the render
 * parameters.  The tile is then read from the cache store or, on a miss, computed through the coalescer: the source
 * region is read, rendered and written back to the store before it is returned to every waiting caller.
 */
public class TileService {
  private static final Logger LOG = LoggerFactory.getLogger(TileService.class);

  /**
   * Lower bounds on a logarithmic scale fall back to this fraction of the upper bound.
   */
  static final double LOG_FLOOR = 1e-3;

  private final LayerRegistry registry;
  private final TileAddressing addressing;
  private final Renderer renderer;
  private final CacheStore store;
  private final Coalescer<TileImage> coalescer;
  private final HistogramService histograms;
  private final Counter computedCounter;
  private final AtomicLong computations = new AtomicLong();

  public TileService(LayerRegistry registry, TileAddressing addressing, Renderer renderer, CacheStore store,
                     Coalescer<TileImage> coalescer, HistogramService histograms, MeterRegistry meterRegistry) {
    this.registry = registry;
    this.addressing = addressing;
    this.renderer = renderer;
    this.store = store;
    this.coalescer = coalescer;
    this.histograms = histograms;
    this.computedCounter = Counter.builder("tiles.computed")
      .description("Tiles rendered from source data")
      .register(meterRegistry);
  }

  /**
   * Validates a request and builds its key.
   *
   * @throws org.skymaps.common.catalog.LayerNotFoundException if the layer is not in the catalog
   * @throws org.skymaps.common.projection.TileOutOfRangeException if the tile does not exist
   * @throws org.skymaps.common.render.InvalidRenderParametersException if the render parameters are unusable
   */
  public TileCacheKey keyFor(RenderRequest request) {
    Layer layer = registry.get(request.getLayerId());
    addressing.resolve(layer.shape(), request.getZ(), request.getX(), request.getY());
    RenderParameters parameters = resolveParameters(layer, request);
    return new TileCacheKey(layer.getLayerId(), request.getZ(), request.getX(), request.getY(), parameters,
                            request.getFormat());
  }

  /**
   * Fills the options missing from the request with the layer defaults, taking bounds from the layer histogram when
   * the catalog has none.  On a logarithmic scale a non-positive bound from the histogram is replaced by one derived
   * from the positive samples, so that a request without bounds is always renderable.
   */
  public RenderParameters resolveParameters(Layer layer, RenderRequest request) {
    RenderDefaults defaults = layer.getDefaults();
    String colormap = request.getColormap() != null ? request.getColormap() : defaults.getColormap();
    boolean log = request.getLogNorm() != null ? request.getLogNorm() : defaults.isLogNorm();
    boolean clip = request.getClip() != null ? request.getClip() : defaults.isClip();

    Double vmin = request.getVmin() != null ? request.getVmin() : defaults.getVmin();
    Double vmax = request.getVmax() != null ? request.getVmax() : defaults.getVmax();
    if (vmin == null || vmax == null) {
      Histogram histogram = histograms.get(layer.getLayerId());
      boolean vminFromHistogram = vmin == null;
      boolean vmaxFromHistogram = vmax == null;
      vmin = vminFromHistogram ? histogram.getVmin() : vmin;
      vmax = vmaxFromHistogram ? histogram.getVmax() : vmax;
      if (log) {
        if (vminFromHistogram && vmin <= 0) {
          vmin = positiveLowerBound(histogram, vmax);
        }
        if (vmaxFromHistogram && vmax <= vmin) {
          vmax = vmin / LOG_FLOOR;
        }
      }
    }
    return RenderParameters.of(colormap, vmin, vmax, Normalization.fromLogFlag(log), clip, request.isAbs());
  }

  /**
   * The low quantile of the positive samples where it lies below the upper bound, otherwise {@link #LOG_FLOOR} times
   * the upper bound, or {@link #LOG_FLOOR} itself when the upper bound is not positive.
   */
  @VisibleForTesting
  static double positiveLowerBound(Histogram histogram, double vmax) {
    Double positive = histogram.getPositiveVmin();
    if (positive != null && positive > 0 && positive < vmax) {
      return positive;
    }
    return vmax > 0 ? vmax * LOG_FLOOR : LOG_FLOOR;
  }

  /**
   * @return the rendered tile, from the cache where possible
   * @throws org.skymaps.common.source.DataUnavailableException if the source of the layer cannot be read
   */
  public TileImage getTile(TileCacheKey key) {
    String storageKey = key.storageKey();
    Optional<TileImage> cached = store.get(storageKey);
    if (cached.isPresent()) {
      LOG.debug("Cache hit for {}", key);
      return cached.get();
    }
    LOG.debug("Cache miss for {}", key);
    // a computation for the key may have finished between the lookup above and joining
    return coalescer.getOrCompute(storageKey, () -> store.get(storageKey).orElseGet(() -> compute(key, storageKey)));
  }

  private TileImage compute(TileCacheKey key, String storageKey) {
    Stopwatch timer = Stopwatch.createStarted();
    Layer layer = registry.get(key.getLayerId());
    PixelRectangle rectangle = addressing.resolve(layer.shape(), key.getZ(), key.getX(), key.getY());
    Array2D samples = layer.getSource().readRegion(rectangle, addressing.tileShape());
    TileImage image = renderer.render(samples, key.getParameters(), key.getFormat());

    computations.incrementAndGet();
    computedCounter.increment();
    if (!store.set(storageKey, image)) {
      LOG.debug("Tile {} was not stored", key);
    }
    LOG.debug("Computed {} from {} in {}ms", key, rectangle, timer.elapsed().toMillis());
    return image;
  }

  /**
   * @return the number of tiles rendered by this service since it started
   */
  public long getComputationCount() {
    return computations.get();
  }
}
