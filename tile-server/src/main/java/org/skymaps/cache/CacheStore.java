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

import java.util.Optional;

/**
 * A key value store for encoded tiles.  Keys must already be safe for the backend, as produced by
 * {@link org.skymaps.common.cache.TileCacheKey#storageKey()}.
 * <p>
 * Implementations are threadsafe and never throw for backend failures: a failed read is a miss and a failed write
 * returns false.
 */
public interface CacheStore {

  Optional<TileImage> get(String key);

  /**
   * Stores the image unless the key already has an entry, so the first writer wins and later writes are no-ops.
   *
   * @return true if this call stored the entry
   */
  boolean set(String key, TileImage image);
}
