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

/**
 * How sample values are mapped onto the [0,1] range of a colormap.
 */
public enum Normalization {
  LINEAR("lin"),
  LOG("log");

  private final String code;

  Normalization(String code) {
    this.code = code;
  }

  /**
   * The short form used in cache keys.
   */
  public String getCode() {
    return code;
  }

  public static Normalization fromLogFlag(boolean log) {
    return log ? LOG : LINEAR;
  }
}
