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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Data;

/**
 * The outcome of a warmup run.  A layer that failed is listed with the reason and did not stop the others.
 */
@Data
public class WarmupReport {
  private int layersWarmed;
  private long tilesRendered;
  private final Map<String, String> failures = new LinkedHashMap<>();
  private long elapsedMillis;

  void failed(String layerId, String reason) {
    failures.put(layerId, reason);
  }

  public Map<String, String> getFailures() {
    return Collections.unmodifiableMap(failures);
  }

  public boolean isSuccessful() {
    return failures.isEmpty();
  }
}
