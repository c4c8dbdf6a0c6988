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

import org.skymaps.common.source.SourceDataProvider;

import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Where the samples of a layer come from, distinguished in the catalog by {@code provider_type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "provider_type")
@JsonSubTypes({@JsonSubTypes.Type(value = FitsProviderDefinition.class, name = "fits")})
public interface ProviderDefinition {

  /**
   * @param layerId of the layer the provider serves
   * @param baseDirectory against which relative file names are resolved
   */
  SourceDataProvider createProvider(String layerId, Path baseDirectory);
}
