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
package org.skymaps;

import org.skymaps.cache.CacheStore;
import org.skymaps.cache.LocalCacheStore;
import org.skymaps.cache.NoopCacheStore;
import org.skymaps.cache.SharedCacheStore;
import org.skymaps.common.histogram.Histogram;
import org.skymaps.common.render.TileImage;

import java.io.IOException;

import io.micrometer.core.instrument.MeterRegistry;
import org.cache2k.config.Cache2kConfig;
import org.cache2k.extra.spring.SpringCache2kCacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class CacheConfiguration {
  private static final Logger LOG = LoggerFactory.getLogger(CacheConfiguration.class);

  @ConfigurationProperties(prefix = "cache.tiles")
  @Bean
  public Cache2kConfig<String, TileImage> tileCache2kConfig() {
    return new Cache2kConfig<>();
  }

  @ConfigurationProperties(prefix = "cache.histograms")
  @Bean
  public Cache2kConfig<String, Histogram> histogramCache2kConfig() {
    return new Cache2kConfig<>();
  }

  @Bean
  public SpringCache2kCacheManager cacheManager() {
    return new SpringCache2kCacheManager();
  }

  /**
   * The store is chosen once, at startup; every backend holds the same bytes for a key.
   */
  @Bean
  public CacheStore cacheStore(TileServerConfiguration configuration, SpringCache2kCacheManager cacheManager,
                               MeterRegistry meterRegistry, Cache2kConfig<String, TileImage> tileCache2kConfig)
    throws IOException {
    TileServerConfiguration.CacheStoreConfiguration cache = configuration.getCache();
    LOG.info("Using the {} cache store", cache.getType());
    switch (cache.getType()) {
      case MEMCACHED:
        TileServerConfiguration.Memcached memcached = cache.getMemcached();
        return SharedCacheStore.connect(memcached.getServers(), memcached.getTimeoutMillis(),
                                        memcached.getMaxItemBytes(), memcached.getTtlSeconds());
      case NONE:
        return new NoopCacheStore();
      case LOCAL:
      default:
        return LocalCacheStore.create(cacheManager, meterRegistry, tileCache2kConfig);
    }
  }
}
