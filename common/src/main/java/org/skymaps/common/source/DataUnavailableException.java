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
package org.skymaps.common.source;

/**
 * Thrown when the data behind a layer cannot be read.  Never substituted by an empty tile.
 */
public class DataUnavailableException extends RuntimeException {
  private static final long serialVersionUID = -7022137489932264518L;

  private final String layerId;

  public DataUnavailableException(String layerId, String message, Throwable cause) {
    super(message, cause);
    this.layerId = layerId;
  }

  public DataUnavailableException(String layerId, String message) {
    this(layerId, message, null);
  }

  public String getLayerId() {
    return layerId;
  }
}
