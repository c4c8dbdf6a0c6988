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

import jakarta.servlet.http.HttpServletResponse;

/**
 * Utilities shared by the resources.
 */
class Params {

  private Params() {}

  static void enableCORS(HttpServletResponse response) {
    response.addHeader("Allow-Control-Allow-Methods", "GET,HEAD,OPTIONS");
    response.addHeader("Access-Control-Allow-Origin", "*");
  }
}
