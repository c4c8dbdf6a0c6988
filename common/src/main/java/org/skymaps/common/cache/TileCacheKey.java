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
package org.skymaps.common.cache;

import org.skymaps.common.render.ImageFormat;
import org.skymaps.common.render.RenderParameters;

import java.nio.charset.StandardCharsets;

import com.google.common.base.CharMatcher;
import com.google.common.hash.Hashing;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The identity of a rendered tile: everything its bytes depend upon, and nothing else.
 * <p>
 * Keys are written as {@code tile/<layer>/<z>/<x>/<y>/<cmap>/<vmin>/<vmax>/<lin|log>/<clip|noclip>.<ext>} with the
 * bounds in a fixed locale independent precision, so that equal keys are produced in every process sharing a cache.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public final class TileCacheKey {

  /**
   * The longest key accepted by memcached.
   */
  public static final int MAX_KEY_BYTES = 250;

  private static final CharMatcher UNSAFE = CharMatcher.whitespace().or(CharMatcher.javaIsoControl());

  private final String layerId;
  private final int z;
  private final long x;
  private final long y;
  private final RenderParameters parameters;
  private final ImageFormat format;

  /**
   * The key in its readable form.
   */
  public String canonical() {
    return "tile/" + layerId + '/' + z + '/' + x + '/' + y + '/'
           + parameters.getColormap() + '/'
           + RenderParameters.formatBound(parameters.getVmin()) + '/'
           + RenderParameters.formatBound(parameters.getVmax()) + '/'
           + parameters.getNormalization().getCode() + '/'
           + (parameters.isClip() ? "clip" : "noclip") + '/'
           + (parameters.isAbs() ? "abs" : "signed")
           + '.' + format.getExtension();
  }

  /**
   * The key as stored: the readable form where a shared cache accepts it, otherwise its SHA-256 digest.
   */
  public String storageKey() {
    return storageKey(canonical());
  }

  /**
   * Replaces keys that memcached would refuse by {@code <prefix>/sha256/<hex>}, keeping the first path segment.
   */
  public static String storageKey(String key) {
    if (isSafe(key)) {
      return key;
    }
    int slash = key.indexOf('/');
    String prefix = slash > 0 && isSafe(key.substring(0, slash)) ? key.substring(0, slash) : "key";
    return prefix + "/sha256/" + Hashing.sha256().hashString(key, StandardCharsets.UTF_8);
  }

  static boolean isSafe(String key) {
    return key.getBytes(StandardCharsets.UTF_8).length <= MAX_KEY_BYTES && UNSAFE.matchesNoneOf(key);
  }

  @Override
  public String toString() {
    return canonical();
  }
}
