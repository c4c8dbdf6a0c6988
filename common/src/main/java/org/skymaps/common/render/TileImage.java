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
package org.skymaps.common.render;

import java.io.Serializable;
import java.util.Arrays;

/**
 * An encoded image with its content type, as held in the tile caches.  Histograms are cached in the same form, as
 * JSON.  Instances are never modified once built.
 */
public final class TileImage implements Serializable {
  private static final long serialVersionUID = 3261585017739581263L;

  private final byte[] bytes;
  private final String contentType;

  public TileImage(byte[] bytes, String contentType) {
    this.bytes = bytes;
    this.contentType = contentType;
  }

  /**
   * @return the encoded bytes, which callers must not modify
   */
  public byte[] getBytes() {
    return bytes;
  }

  public String getContentType() {
    return contentType;
  }

  public int length() {
    return bytes.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TileImage)) {
      return false;
    }
    TileImage other = (TileImage) o;
    return contentType.equals(other.contentType) && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * contentType.hashCode() + Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return contentType + " (" + bytes.length + " bytes)";
  }
}
