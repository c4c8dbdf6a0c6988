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

import org.skymaps.common.histogram.Histogram;
import org.skymaps.common.render.Renderer;
import org.skymaps.service.HistogramService;

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
 * Value distributions of the layers, and the colourbars to draw beside them.
 */
@Tag(name = "Histograms",
  description = "Layer histograms and colormap strips.",
  extensions = @io.swagger.v3.oas.annotations.extensions.Extension(
    name = "Order", properties = @ExtensionProperty(name = "Order", value = "0300"))
)
@RestController
@RequestMapping("/histograms")
public class HistogramResource {

  private final HistogramService histogramService;
  private final Renderer renderer;

  @Autowired
  public HistogramResource(HistogramService histogramService, Renderer renderer) {
    this.histogramService = histogramService;
    this.renderer = renderer;
  }

  @Operation(
    operationId = "getHistogram",
    summary = "Layer histogram",
    description = "The counts of the layer values in equal width bins, with the bounds suggested for rendering.")
  @GetMapping(value = "/data/{layer}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Timed
  public Histogram histogram(
    @Parameter(description = "The layer identifier") @PathVariable("layer") String layerId,
    HttpServletResponse response) {
    enableCORS(response);
    return histogramService.get(layerId);
  }

  @Operation(
    operationId = "getColorbar",
    summary = "Colormap strip",
    description = "A 256×8 PNG of the colormap, low values on the left.")
  @GetMapping(value = "/{cmap}.png", produces = MediaType.IMAGE_PNG_VALUE)
  @Timed
  public byte[] colorbar(
    @Parameter(description = "The colormap name") @PathVariable("cmap") String colormap,
    HttpServletResponse response) {
    enableCORS(response);
    return renderer.renderColorbar(colormap).getBytes();
  }
}
