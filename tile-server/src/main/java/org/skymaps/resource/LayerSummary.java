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
package org.skymaps.resource;

import org.skymaps.common.catalog.Layer;
import org.skymaps.common.catalog.RenderDefaults;
import org.skymaps.common.projection.Double2D;
import org.skymaps.common.projection.GridShape;
import org.skymaps.common.projection.TileAddressing;
import org.skymaps.common.source.DataUnavailableException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The description of a layer returned by the catalog listing.  The shape and sky bounds come from the source header;
 * they are left out for a layer whose source cannot be opened.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LayerSummary {
  private static final Logger LOG = LoggerFactory.getLogger(LayerSummary.class);

  private String layerId;
  private String name;
  private String description;
  private String group;
  private String map;
  private String band;
  private String quantity;
  private String units;
  private String grant;

  private Integer rows;
  private Integer cols;
  private Integer tileSize;
  private Integer maxZoom;

  private Double boundingLeft;
  private Double boundingRight;
  private Double boundingTop;
  private Double boundingBottom;

  private String cmap;
  private Double vmin;
  private Double vmax;
  private boolean logNorm;
  private boolean clip;

  static LayerSummary of(Layer layer, TileAddressing addressing) {
    LayerSummary summary = new LayerSummary();
    summary.setLayerId(layer.getLayerId());
    summary.setName(layer.getName());
    summary.setDescription(layer.getDescription());
    summary.setGroup(layer.getGroup());
    summary.setMap(layer.getMap());
    summary.setBand(layer.getBand());
    summary.setQuantity(layer.getQuantity());
    summary.setUnits(layer.getUnits());
    summary.setGrant(layer.getGrant());

    RenderDefaults defaults = layer.getDefaults();
    summary.setCmap(defaults.getColormap());
    summary.setVmin(defaults.getVmin());
    summary.setVmax(defaults.getVmax());
    summary.setLogNorm(defaults.isLogNorm());
    summary.setClip(defaults.isClip());

    try {
      GridShape shape = layer.shape();
      summary.setRows(shape.getRows());
      summary.setCols(shape.getCols());
      summary.setTileSize(addressing.getTileSize());
      summary.setMaxZoom(addressing.maxZoom(shape));

      // RA increases to the left, so the left bound is the greater
      Double2D[] bounds = layer.getSource().transform().boundary(shape);
      summary.setBoundingLeft(bounds[1].getX());
      summary.setBoundingRight(bounds[0].getX());
      summary.setBoundingBottom(bounds[0].getY());
      summary.setBoundingTop(bounds[1].getY());
    } catch (DataUnavailableException e) {
      LOG.warn("Listing layer {} without its shape: {}", layer.getLayerId(), e.getMessage());
    }
    return summary;
  }
}
