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

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * The root of a catalog file: groups of maps, each with bands, each with layers.
 * <pre>
 * {
 *   "map_groups": [{
 *     "name": "ACT DR6", "description": "...",
 *     "maps": [{
 *       "name": "Coadd", "description": "...",
 *       "bands": [{
 *         "name": "f090", "description": "...",
 *         "layers": [{
 *           "layer_id": "dr6-f090-i", "name": "I", "description": "Intensity",
 *           "provider": {"provider_type": "fits", "filename": "coadd.fits", "hdu": 0, "index": 0},
 *           "quantity": "T (I)", "units": "uK", "vmin": -500, "vmax": 500, "cmap": "RdBu_r"
 *         }]
 *       }]
 *     }]
 *   }]
 * }
 * </pre>
 */
@Data
public class CatalogDefinition {
  private List<MapGroupDefinition> mapGroups = new ArrayList<>();

  @Data
  public static class MapGroupDefinition {
    private String name;
    private String description;
    private String grant;
    private List<MapDefinition> maps = new ArrayList<>();
  }

  @Data
  public static class MapDefinition {
    private String name;
    private String description;
    private String grant;
    private List<BandDefinition> bands = new ArrayList<>();
  }

  @Data
  public static class BandDefinition {
    private String name;
    private String description;
    private String grant;
    private List<LayerDefinition> layers = new ArrayList<>();
  }

  @Data
  public static class LayerDefinition {
    private String layerId;
    private String name;
    private String description;
    private String grant;
    private ProviderDefinition provider;
    private String quantity;
    private String units;
    private Double vmin;
    private Double vmax;
    private String cmap;
    private boolean logNorm;
    private boolean clip = true;
  }
}
