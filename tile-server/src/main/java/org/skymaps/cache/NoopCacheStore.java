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
 * Stores nothing, so that every request is computed; coalescing of concurrent requests still applies.
 */
public class NoopCacheStore implements CacheStore {

  @Override
  public Optional<TileImage> get(String key) {
    return Optional.empty();
  }

  @Override
  public boolean set(String key, TileImage image) {
    return false;
  }
}
