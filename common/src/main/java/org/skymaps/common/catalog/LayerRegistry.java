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
package org.skymaps.common.catalog;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * The layers served by one process, keyed by their identifier.  Built once at startup and handed to whatever needs
 * it.
 * <p>
 * This class is threadsafe.
 */
public class LayerRegistry {

  private final Map<String, Layer> layers;

  public LayerRegistry(Iterable<Layer> layers) {
    ImmutableMap.Builder<String, Layer> builder = ImmutableMap.builder();
    for (Layer layer : layers) {
      builder.put(layer.getLayerId(), layer);
    }
    try {
      this.layers = builder.buildOrThrow();
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Layer identifiers must be unique: " + e.getMessage(), e);
    }
  }

  /**
   * @throws LayerNotFoundException if there is no such layer
   */
  public Layer get(String layerId) {
    Preconditions.checkNotNull(layerId, "A layer identifier is required");
    Layer layer = layers.get(layerId);
    if (layer == null) {
      throw new LayerNotFoundException(layerId);
    }
    return layer;
  }

  public Optional<Layer> find(String layerId) {
    return Optional.ofNullable(layers.get(layerId));
  }

  /**
   * @return the layers in catalog order
   */
  public Collection<Layer> layers() {
    return layers.values();
  }

  public int size() {
    return layers.size();
  }
}
