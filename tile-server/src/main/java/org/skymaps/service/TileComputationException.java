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
package org.skymaps.service;

/**
 * A shared computation failed with a checked exception, or was abandoned.
 */
public class TileComputationException extends RuntimeException {
  private static final long serialVersionUID = -2305917438260919153L;

  public TileComputationException(String message, Throwable cause) {
    super(message, cause);
  }
}
