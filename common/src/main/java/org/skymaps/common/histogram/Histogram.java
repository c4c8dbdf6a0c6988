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
package org.skymaps.common.histogram;

import java.io.Serializable;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The distribution of the values of one layer, with the bounds suggested for rendering it.
 * <p>
 * {@code edges} has one more element than {@code counts}; bin {@code i} covers {@code [edges[i], edges[i+1])} and the
 * last bin is closed on the right.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Histogram implements Serializable {
  private static final long serialVersionUID = 4271129462838116021L;

  @JsonProperty("layer_id")
  private String layerId;

  private double[] edges;

  @JsonProperty("histogram")
  private long[] counts;

  /**
   * Suggested lower bound for rendering.
   */
  private double vmin;

  /**
   * Suggested upper bound for rendering.
   */
  private double vmax;

  /**
   * The number of finite samples inspected.
   */
  @JsonProperty("valid_samples")
  private long validSamples;

  /**
   * Every {@code stride}-th sample of the native grid was inspected.
   */
  private int stride;

  /**
   * The low quantile of the positive samples, a lower bound usable on a logarithmic scale; null when no sample is
   * positive.
   */
  @JsonProperty("positive_vmin")
  private Double positiveVmin;

  public int bins() {
    return counts.length;
  }
}
