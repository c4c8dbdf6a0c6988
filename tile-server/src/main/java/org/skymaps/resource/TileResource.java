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

import org.skymaps.common.cache.TileCacheKey;
import org.skymaps.common.render.ImageFormat;
import org.skymaps.common.render.TileImage;
import org.skymaps.service.RenderRequest;
import org.skymaps.service.TileService;

import java.nio.charset.StandardCharsets;

import com.google.common.hash.Hashing;
import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.extensions.ExtensionProperty;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import static org.skymaps.resource.Params.enableCORS;

/**
 * The tile resource, rendering tiles of the catalog layers on demand.
 */
@OpenAPIDefinition(
  info = @Info(
    title = "Sky Maps API",
    version = "v1",
    description =
      "The sky maps API serves image tiles cut from large sky maps, in a virtual pyramid where each zoom level " +
        "halves the resolution of the next.\n" +
        "\n" +
        "Tiles are rendered on demand with a colormap between two bounds, linearly or logarithmically, and are cached. " +
        "Render options left out take the defaults of the layer."))
@Tag(name = "Tiles",
  description = "Rendered map tiles.",
  extensions = @io.swagger.v3.oas.annotations.extensions.Extension(
    name = "Order", properties = @ExtensionProperty(name = "Order", value = "0200"))
)
@RestController
@RequestMapping("/maps")
public class TileResource {

  private final TileService tileService;

  @Autowired
  public TileResource(TileService tileService) {
    this.tileService = tileService;
  }

  @Operation(
    operationId = "getTile",
    summary = "Rendered tile",
    description = "Renders the tile at zoom `z`, column `x` and row `y`, counted from the top left.  Zoom 0 is a " +
      "single tile covering the whole layer.")
  @ApiResponses({
    @ApiResponse(responseCode = "200", description = "The tile"),
    @ApiResponse(responseCode = "400", description = "Invalid render options"),
    @ApiResponse(responseCode = "404", description = "Unknown layer, or a tile outside the layer")
  })
  @GetMapping("/{layer}/{z}/{x}/{y}.{ext}")
  @Timed
  public ResponseEntity<byte[]> tile(
    @Parameter(description = "The layer identifier") @PathVariable("layer") String layerId,
    @PathVariable("z") int z,
    @PathVariable("x") long x,
    @PathVariable("y") long y,
    @Parameter(description = "Image format: png or jpg") @PathVariable("ext") String extension,
    @Parameter(description = "Colormap, optionally suffixed with _r to reverse it")
    @RequestParam(value = "cmap", required = false) String colormap,
    @RequestParam(value = "vmin", required = false) Double vmin,
    @RequestParam(value = "vmax", required = false) Double vmax,
    @Parameter(description = "Logarithmic rather than linear normalization")
    @RequestParam(value = "log_norm", required = false) Boolean logNorm,
    @Parameter(description = "Clamp values outside the bounds to the ends of the colormap")
    @RequestParam(value = "clip", required = false) Boolean clip,
    @Parameter(description = "Render the absolute value of the samples")
    @RequestParam(value = "abs", defaultValue = "false") boolean abs,
    HttpServletResponse response) {

    enableCORS(response);
    RenderRequest request = RenderRequest.builder()
      .layerId(layerId)
      .z(z)
      .x(x)
      .y(y)
      .format(ImageFormat.fromExtension(extension))
      .colormap(colormap)
      .vmin(vmin)
      .vmax(vmax)
      .logNorm(logNorm)
      .clip(clip)
      .abs(abs)
      .build();

    TileCacheKey key = tileService.keyFor(request);
    TileImage image = tileService.getTile(key);
    return ResponseEntity.ok()
      .contentType(MediaType.parseMediaType(image.getContentType()))
      // A weak ETag is set, as the encoder may change between releases.
      .header(HttpHeaders.ETAG, String.format("W/\"%s\"", etag(key)))
      .body(image.getBytes());
  }

  static String etag(TileCacheKey key) {
    return Hashing.sha256().hashString(key.canonical(), StandardCharsets.UTF_8).toString().substring(0, 32);
  }
}
