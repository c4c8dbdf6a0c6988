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

import org.skymaps.common.render.ImageFormat;

import lombok.Builder;
import lombok.Data;

/**
 * A request for one tile.  Render options left null take the layer defaults.
 */
@Data
@Builder
public class RenderRequest {
  private final String layerId;
  private final int z;
  private final long x;
  private final long y;
  private final ImageFormat format;

  private final String colormap;
  private final Double vmin;
  private final Double vmax;
  private final Boolean logNorm;
  private final Boolean clip;
  private final boolean abs;
}
