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

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * The render policy a layer is shown with when a request does not say otherwise.  Missing bounds are taken from the
 * layer histogram.
 */
@Data
@AllArgsConstructor
public class RenderDefaults implements Serializable {
  private static final long serialVersionUID = 1129381739270918221L;

  private final String colormap;
  private final Double vmin;
  private final Double vmax;
  private final boolean logNorm;
  private final boolean clip;

  public boolean hasBounds() {
    return vmin != null && vmax != null;
  }
}
