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

/**
 * Thrown when a layer identifier is not in the catalog.
 */
public class LayerNotFoundException extends RuntimeException {
  private static final long serialVersionUID = 6391263084530011528L;

  public LayerNotFoundException(String layerId) {
    super("Layer not found: " + layerId);
  }
}
