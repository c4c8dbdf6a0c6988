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

import org.skymaps.common.source.FitsSourceDataProvider;
import org.skymaps.common.source.SourceDataProvider;

import java.nio.file.Path;

import lombok.Data;

/**
 * An image HDU of a FITS file, optionally one plane of a cube.
 */
@Data
public class FitsProviderDefinition implements ProviderDefinition {
  private String filename;
  private int hdu;
  private Integer index;

  @Override
  public SourceDataProvider createProvider(String layerId, Path baseDirectory) {
    Path path = Path.of(filename);
    if (!path.isAbsolute() && baseDirectory != null) {
      path = baseDirectory.resolve(path);
    }
    return new FitsSourceDataProvider(layerId, path.toFile(), hdu, index);
  }
}
