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
package org.skymaps.cache;

import org.skymaps.common.render.TileImage;
import org.skymaps.config.ConfigUtils;

import java.util.Optional;

import io.micrometer.core.instrument.MeterRegistry;
import org.cache2k.Cache;
import org.cache2k.config.Cache2kConfig;
import org.cache2k.extra.spring.SpringCache2kCacheManager;

/**
 * An in-process store held in a cache2k heap cache, bounded by its configured entry capacity.
 */
public class LocalCacheStore implements CacheStore {
  static final String CACHE_NAME = "tileCache";

  private final Cache<String, TileImage> cache;

  public LocalCacheStore(Cache<String, TileImage> cache) {
    this.cache = cache;
  }

  public static LocalCacheStore create(SpringCache2kCacheManager manager, MeterRegistry meterRegistry,
                                       Cache2kConfig<String, TileImage> tileCacheConfiguration) {
    manager.addCaches(b ->
      tileCacheConfiguration.builder()
        .manager(manager.getNativeCacheManager())
        .name(CACHE_NAME));
    Cache<String, TileImage> cache = manager.getNativeCacheManager().getCache(CACHE_NAME);
    ConfigUtils.registerCacheMetrics(cache, meterRegistry);
    return new LocalCacheStore(cache);
  }

  @Override
  public Optional<TileImage> get(String key) {
    return Optional.ofNullable(cache.peek(key));
  }

  @Override
  public boolean set(String key, TileImage image) {
    return cache.putIfAbsent(key, image);
  }
}
