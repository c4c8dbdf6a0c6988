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
 * Thrown for render parameters that can never produce an image, before any data is read.
 */
public class InvalidRenderParametersException extends IllegalArgumentException {
  private static final long serialVersionUID = -5619283009715524409L;

  public InvalidRenderParametersException(String message) {
    super(message);
  }
}
