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
package org.skymaps;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.Data;

/**
 * Application configuration with sensible defaults if applicable.
 */
@Data
public class TileServerConfiguration {
  private Catalog catalog = new Catalog();
  private Tiles tiles = new Tiles();
  private CacheStoreConfiguration cache = new CacheStoreConfiguration();
  private HistogramConfiguration histogram = new HistogramConfiguration();
  private Warmup warmup = new Warmup();

  @Data
  public static class Catalog {
    /**
     * The JSON catalog of layers; FITS file names in it are relative to its directory.
     */
    private String path;
  }

  @Data
  public static class Tiles {
    private int tileSize = 256;
    private String format = "png";
    private float jpegQuality = 0.9f;
    private int computeThreads = Runtime.getRuntime().availableProcessors();
  }

  public enum CacheType {
    LOCAL,
    MEMCACHED,
    NONE
  }

  /**
   * The store rendered tiles and histograms are kept in.  The cache2k sizing of the local store is bound separately,
   * under {@code cache.tiles} and {@code cache.histograms}.
   */
  @Data
  public static class CacheStoreConfiguration {
    private CacheType type = CacheType.LOCAL;
    private Memcached memcached = new Memcached();
  }

  @Data
  public static class Memcached {
    private String servers = "localhost:11211";
    private int timeoutMillis = 500;
    private int maxItemBytes = 1024 * 1024;
    private int ttlSeconds = 0;
  }

  @Data
  public static class HistogramConfiguration {
    private int bins = 128;
    private int maxSamples = 4 * 1024 * 1024;
    private double contrastPercentile = 0.01;
  }

  @Data
  public static class Warmup {
    private boolean enabled = false;
    private List<Integer> levels = new ArrayList<>(Arrays.asList(0, 1));
  }
}
