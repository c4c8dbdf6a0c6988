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

import org.skymaps.common.projection.GridShape;
import org.skymaps.common.source.SourceDataProvider;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A named grid of samples that tiles are cut from.  The group, map and band it belongs to are only kept for browsing;
 * tile computation needs nothing but the identifier and the source.
 */
@Getter
@Builder
@ToString(exclude = "source")
public class Layer {

  @NonNull
  private final String layerId;
  private final String name;
  private final String description;

  private final String group;
  private final String map;
  private final String band;

  private final String quantity;
  private final String units;

  /**
   * The access grant required to view the layer; evaluated outside the tile engine.
   */
  private final String grant;

  @NonNull
  private final RenderDefaults defaults;

  @NonNull
  private final SourceDataProvider source;

  public GridShape shape() {
    return source.shape();
  }
}
