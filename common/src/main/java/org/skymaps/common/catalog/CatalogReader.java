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

import org.skymaps.common.render.Colormaps;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a JSON catalog into a {@link LayerRegistry}.  Nothing is read from the FITS files themselves until a layer is
 * first used.
 */
public class CatalogReader {
  private static final Logger LOG = LoggerFactory.getLogger(CatalogReader.class);

  private static final ObjectMapper MAPPER = new ObjectMapper()
    .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private CatalogReader() {}

  /**
   * Reads the catalog file, resolving relative FITS file names against its directory.
   *
   * @throws UncheckedIOException if the file cannot be read or parsed
   * @throws IllegalArgumentException if a layer is incomplete or two layers share an identifier
   */
  public static LayerRegistry read(Path catalogFile) {
    try (InputStream in = Files.newInputStream(catalogFile)) {
      Path directory = catalogFile.toAbsolutePath().getParent();
      LayerRegistry registry = read(in, directory);
      LOG.info("Loaded {} layers from catalog {}", registry.size(), catalogFile);
      return registry;
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read catalog " + catalogFile, e);
    }
  }

  public static LayerRegistry read(InputStream in, Path baseDirectory) throws IOException {
    CatalogDefinition catalog = MAPPER.readValue(in, CatalogDefinition.class);
    return toRegistry(catalog, baseDirectory);
  }

  static LayerRegistry toRegistry(CatalogDefinition catalog, Path baseDirectory) {
    List<Layer> layers = new ArrayList<>();
    for (CatalogDefinition.MapGroupDefinition group : catalog.getMapGroups()) {
      for (CatalogDefinition.MapDefinition map : group.getMaps()) {
        for (CatalogDefinition.BandDefinition band : map.getBands()) {
          for (CatalogDefinition.LayerDefinition layer : band.getLayers()) {
            String grant = firstNonEmpty(layer.getGrant(), band.getGrant(), map.getGrant(), group.getGrant());
            layers.add(toLayer(layer, group.getName(), map.getName(), band.getName(), grant, baseDirectory));
          }
        }
      }
    }
    return new LayerRegistry(layers);
  }

  private static Layer toLayer(CatalogDefinition.LayerDefinition definition, String group, String map, String band,
                               String grant, Path baseDirectory) {
    String layerId = definition.getLayerId();
    Preconditions.checkArgument(!Strings.isNullOrEmpty(layerId), "Layer %s in %s/%s has no layer_id",
                                definition.getName(), map, band);
    Preconditions.checkArgument(definition.getProvider() != null, "Layer %s has no provider", layerId);

    String colormap = Strings.isNullOrEmpty(definition.getCmap()) ? Colormaps.DEFAULT : definition.getCmap();
    Preconditions.checkArgument(Colormaps.exists(colormap), "Layer %s has an unknown colormap %s", layerId, colormap);

    return Layer.builder()
      .layerId(layerId)
      .name(definition.getName())
      .description(definition.getDescription())
      .group(group)
      .map(map)
      .band(band)
      .quantity(definition.getQuantity())
      .units(definition.getUnits())
      .grant(grant)
      .defaults(new RenderDefaults(colormap, definition.getVmin(), definition.getVmax(), definition.isLogNorm(),
                                   definition.isClip()))
      .source(definition.getProvider().createProvider(layerId, baseDirectory))
      .build();
  }

  private static String firstNonEmpty(String... values) {
    for (String value : values) {
      if (!Strings.isNullOrEmpty(value)) {
        return value;
      }
    }
    return null;
  }
}
