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

import org.skymaps.common.catalog.LayerRegistry;
import org.skymaps.common.projection.TileAddressing;

import java.util.List;
import java.util.stream.Collectors;

import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.extensions.ExtensionProperty;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.skymaps.resource.Params.enableCORS;

/**
 * The catalog of layers.
 */
@Tag(name = "Layers",
  description = "The layers available as tiles.",
  extensions = @io.swagger.v3.oas.annotations.extensions.Extension(
    name = "Order", properties = @ExtensionProperty(name = "Order", value = "0100"))
)
@RestController
@RequestMapping(value = "/maps", produces = MediaType.APPLICATION_JSON_VALUE)
public class LayerResource {

  private final LayerRegistry registry;
  private final TileAddressing addressing;

  @Autowired
  public LayerResource(LayerRegistry registry, TileAddressing addressing) {
    this.registry = registry;
    this.addressing = addressing;
  }

  @Operation(
    operationId = "listLayers",
    summary = "List layers",
    description = "Lists every layer with its place in the catalog, shape, deepest zoom and default rendering.")
  @GetMapping
  @Timed
  public List<LayerSummary> list(HttpServletResponse response) {
    enableCORS(response);
    return registry.layers().stream()
      .map(layer -> LayerSummary.of(layer, addressing))
      .collect(Collectors.toList());
  }

  @Operation(
    operationId = "getLayer",
    summary = "Describe a layer")
  @GetMapping("/{layer}")
  @Timed
  public LayerSummary get(
    @Parameter(description = "The layer identifier") @PathVariable("layer") String layerId,
    HttpServletResponse response) {
    enableCORS(response);
    return LayerSummary.of(registry.get(layerId), addressing);
  }
}
