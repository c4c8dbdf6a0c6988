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
import org.skymaps.common.catalog.LayerRegistry;
import org.skymaps.common.histogram.Histogram;
import org.skymaps.common.histogram.HistogramComputer;
import org.skymaps.common.render.TileImage;
import org.skymaps.config.ConfigUtils;

import java.io.IOException;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.cache2k.Cache;
import org.cache2k.config.Cache2kConfig;
import org.cache2k.extra.spring.SpringCache2kCacheManager;
import org.cache2k.io.CacheLoaderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;

/**
 * Histograms of the layers, computed once and kept in memory.  They are also written to the cache store so that other
 * processes sharing the store need not compute them again.
 */
public class HistogramService {
  private static final Logger LOG = LoggerFactory.getLogger(HistogramService.class);
  static final String CACHE_NAME = "histogramCache";

  private final LayerRegistry registry;
  private final HistogramComputer computer;
  private final CacheStore store;
  private final ObjectMapper objectMapper;
  private final Cache<String, Histogram> cache;

  public HistogramService(LayerRegistry registry, HistogramComputer computer, CacheStore store,
                          ObjectMapper objectMapper, SpringCache2kCacheManager cacheManager,
                          MeterRegistry meterRegistry, Cache2kConfig<String, Histogram> histogramCacheConfiguration) {
    this.registry = registry;
    this.computer = computer;
    this.store = store;
    this.objectMapper = objectMapper;
    this.cache = histogramCacheBuilder(cacheManager, meterRegistry, histogramCacheConfiguration);
  }

  private Cache<String, Histogram> histogramCacheBuilder(SpringCache2kCacheManager manager, MeterRegistry meterRegistry,
                                                         Cache2kConfig<String, Histogram> configuration) {
    manager.addCaches(b ->
      configuration.builder()
        .manager(manager.getNativeCacheManager())
        .name(CACHE_NAME)
        .loader(this::load));
    Cache<String, Histogram> cache = manager.getNativeCacheManager().getCache(CACHE_NAME);
    ConfigUtils.registerCacheMetrics(cache, meterRegistry);
    return cache;
  }

  /**
   * @throws org.skymaps.common.catalog.LayerNotFoundException if the layer is not in the catalog
   * @throws org.skymaps.common.source.DataUnavailableException if the source of the layer cannot be read
   */
  public Histogram get(String layerId) {
    registry.get(layerId);
    try {
      return cache.get(layerId);
    } catch (CacheLoaderException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new TileComputationException("Unable to compute the histogram of " + layerId, e.getCause());
    }
  }

  private Histogram load(String layerId) {
    String key = storageKey(layerId);
    Optional<Histogram> stored = store.get(key).flatMap(entry -> read(key, entry));
    if (stored.isPresent()) {
      LOG.debug("Histogram of {} read from the cache store", layerId);
      return stored.get();
    }

    Histogram histogram = computer.compute(registry.get(layerId));
    try {
      store.set(key, new TileImage(objectMapper.writeValueAsBytes(histogram), MediaType.APPLICATION_JSON_VALUE));
    } catch (JsonProcessingException e) {
      LOG.warn("Unable to store the histogram of {}", layerId, e);
    }
    return histogram;
  }

  private Optional<Histogram> read(String key, TileImage entry) {
    try {
      return Optional.of(objectMapper.readValue(entry.getBytes(), Histogram.class));
    } catch (IOException e) {
      LOG.warn("Ignoring an unreadable histogram stored under {}", key, e);
      return Optional.empty();
    }
  }

  static String storageKey(String layerId) {
    return TileCacheKey.storageKey("histogram/" + layerId);
  }
}
