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
package org.skymaps.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.cache2k.Cache;
import org.cache2k.core.api.InternalCache;

public class ConfigUtils {

  private ConfigUtils() {}

  // Manually expose Cache2K metrics using Micrometer
  public static void registerCacheMetrics(Cache<?, ?> cache, MeterRegistry meterRegistry) {
    InternalCache<?, ?> internalCache = cache.requestInterface(InternalCache.class);

    Gauge.builder("cache.size", internalCache, InternalCache::getTotalEntryCount)
        .description("The number of entries in the cache")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.gets", internalCache, c -> c.getInfo().getGetCount())
        .description("The number of cache gets (hits + misses)")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.hits", internalCache, c -> c.getInfo().getHeapHitCount())
        .description("The number of cache hits")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.misses", internalCache, c -> c.getInfo().getMissCount())
        .description("The number of cache misses")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.evictions", internalCache, c -> c.getInfo().getEvictedCount())
        .description("The number of entries evicted to stay within the capacity")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.load_count", internalCache, c -> c.getInfo().getLoadCount())
        .description("Successful loads, which for tiles and histograms are computations")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.millis_per_load", internalCache, c -> c.getInfo().getMillisPerLoad())
        .description("The mean time taken by a load")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.heap_capacity", internalCache, c -> c.getInfo().getHeapCapacity())
        .description("Configured limit of the total cache entry capacity")
        .tags("cache", cache.getName())
        .register(meterRegistry);
  }
}
