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

import org.skymaps.TileServerConfiguration;
import org.skymaps.common.catalog.Layer;
import org.skymaps.common.catalog.LayerRegistry;
import org.skymaps.common.projection.GridShape;
import org.skymaps.common.projection.TileAddressing;
import org.skymaps.common.render.ImageFormat;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Populates the caches with the histograms and the shallow tiles of every layer, rendered with the layer defaults.
 * <p>
 * Warmup runs on a background thread once the application is ready, so it never delays serving.  Tiles are requested
 * through {@link TileService} exactly as a client would request them, so warmed entries are the ones later requests
 * read.
 */
public class TileCacheWarmer implements DisposableBean {
  private static final Logger LOG = LoggerFactory.getLogger(TileCacheWarmer.class);

  private final LayerRegistry registry;
  private final TileAddressing addressing;
  private final TileService tileService;
  private final HistogramService histogramService;
  private final ImageFormat format;
  private final boolean enabled;
  private final List<Integer> levels;
  private final ExecutorService executor = Executors.newSingleThreadExecutor(
    new ThreadFactoryBuilder().setNameFormat("tile-warmup-%d").setDaemon(true).build());

  private volatile CompletableFuture<WarmupReport> completion;

  public TileCacheWarmer(LayerRegistry registry, TileAddressing addressing, TileService tileService,
                         HistogramService histogramService, ImageFormat format,
                         TileServerConfiguration.Warmup configuration) {
    this.registry = registry;
    this.addressing = addressing;
    this.tileService = tileService;
    this.histogramService = histogramService;
    this.format = format;
    this.enabled = configuration.isEnabled();
    this.levels = ImmutableList.copyOf(configuration.getLevels());
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (enabled) {
      start();
    } else {
      LOG.info("Cache warmup is disabled");
    }
  }

  /**
   * Starts warming in the background, unless it has already been started.
   *
   * @return completes with the report once every layer has been visited
   */
  public synchronized CompletableFuture<WarmupReport> start() {
    if (completion == null) {
      LOG.info("Warming {} layers at zoom levels {}", registry.size(), levels);
      completion = CompletableFuture.supplyAsync(this::warm, executor);
    }
    return completion;
  }

  /**
   * @return the running or completed warmup, or null if it was never started
   */
  public CompletableFuture<WarmupReport> getCompletion() {
    return completion;
  }

  private WarmupReport warm() {
    Stopwatch timer = Stopwatch.createStarted();
    WarmupReport report = new WarmupReport();
    for (Layer layer : registry.layers()) {
      try {
        long tiles = warm(layer);
        report.setLayersWarmed(report.getLayersWarmed() + 1);
        report.setTilesRendered(report.getTilesRendered() + tiles);
        LOG.info("Warmed layer {} with {} tiles", layer.getLayerId(), tiles);
      } catch (RuntimeException e) {
        LOG.warn("Unable to warm layer {}", layer.getLayerId(), e);
        report.failed(layer.getLayerId(), String.valueOf(e.getMessage()));
      }
    }
    report.setElapsedMillis(timer.elapsed().toMillis());
    LOG.info("Warmup completed in {}ms: {} layers, {} tiles, {} failures", report.getElapsedMillis(),
             report.getLayersWarmed(), report.getTilesRendered(), report.getFailures().size());
    return report;
  }

  private long warm(Layer layer) {
    histogramService.get(layer.getLayerId());

    GridShape shape = layer.shape();
    int maxZoom = addressing.maxZoom(shape);
    long tiles = 0;
    for (int z : levels) {
      if (z < 0 || z > maxZoom) {
        continue;
      }
      for (long y = 0; y < addressing.tilesHigh(shape, z); y++) {
        for (long x = 0; x < addressing.tilesWide(shape, z); x++) {
          RenderRequest request = RenderRequest.builder()
            .layerId(layer.getLayerId())
            .z(z)
            .x(x)
            .y(y)
            .format(format)
            .build();
          tileService.getTile(tileService.keyFor(request));
          tiles++;
        }
      }
    }
    return tiles;
  }

  @Override
  public void destroy() {
    executor.shutdownNow();
  }
}
