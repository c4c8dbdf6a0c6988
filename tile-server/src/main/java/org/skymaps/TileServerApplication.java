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

import org.skymaps.cache.CacheStore;
import org.skymaps.common.catalog.CatalogReader;
import org.skymaps.common.catalog.LayerRegistry;
import org.skymaps.common.histogram.Histogram;
import org.skymaps.common.histogram.HistogramComputer;
import org.skymaps.common.projection.TileAddressing;
import org.skymaps.common.render.ImageFormat;
import org.skymaps.common.render.Renderer;
import org.skymaps.common.render.TileImage;
import org.skymaps.service.Coalescer;
import org.skymaps.service.HistogramService;
import org.skymaps.service.TileCacheWarmer;
import org.skymaps.service.TileService;

import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.cache2k.config.Cache2kConfig;
import org.cache2k.extra.spring.SpringCache2kCacheManager;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * The main entry point for running the tile server.
 */
@SpringBootApplication(scanBasePackages = "org.skymaps")
@EnableConfigurationProperties
public class TileServerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TileServerApplication.class, args);
  }

  /**
   * Accepts the listing and tile paths with a trailing slash.
   */
  @org.springframework.context.annotation.Configuration
  public static class WebServerConfiguration implements WebMvcConfigurer {
    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
      configurer.setUseTrailingSlashMatch(true);
    }
  }

  @org.springframework.context.annotation.Configuration
  public static class TileServerSpringConfiguration {

    @ConfigurationProperties
    @Bean
    TileServerConfiguration tileServerConfiguration() {
      return new TileServerConfiguration();
    }

    /**
     * Times the resource methods annotated with {@code @Timed}.
     */
    @Bean
    TimedAspect timedAspect(MeterRegistry meterRegistry) {
      return new TimedAspect(meterRegistry);
    }

    @Bean
    LayerRegistry layerRegistry(TileServerConfiguration configuration) {
      String path = configuration.getCatalog().getPath();
      Preconditions.checkArgument(!Strings.isNullOrEmpty(path), "catalog.path must be configured");
      return CatalogReader.read(Path.of(path));
    }

    @Bean
    TileAddressing tileAddressing(TileServerConfiguration configuration) {
      return new TileAddressing(configuration.getTiles().getTileSize());
    }

    @Bean
    Renderer renderer(TileServerConfiguration configuration) {
      return new Renderer(configuration.getTiles().getJpegQuality());
    }

    @Bean
    HistogramComputer histogramComputer(TileServerConfiguration configuration) {
      TileServerConfiguration.HistogramConfiguration histogram = configuration.getHistogram();
      return new HistogramComputer(histogram.getBins(), histogram.getMaxSamples(), histogram.getContrastPercentile());
    }

    @Bean
    Coalescer<TileImage> tileCoalescer(TileServerConfiguration configuration) {
      return new Coalescer<>("tile-compute", configuration.getTiles().getComputeThreads());
    }

    @Bean
    HistogramService histogramService(LayerRegistry registry, HistogramComputer computer, CacheStore cacheStore,
                                      ObjectMapper objectMapper, SpringCache2kCacheManager cacheManager,
                                      MeterRegistry meterRegistry,
                                      Cache2kConfig<String, Histogram> histogramCache2kConfig) {
      return new HistogramService(registry, computer, cacheStore, objectMapper, cacheManager, meterRegistry,
                                  histogramCache2kConfig);
    }

    @Bean
    TileService tileService(LayerRegistry registry, TileAddressing addressing, Renderer renderer,
                            CacheStore cacheStore, Coalescer<TileImage> tileCoalescer,
                            HistogramService histogramService, MeterRegistry meterRegistry) {
      return new TileService(registry, addressing, renderer, cacheStore, tileCoalescer, histogramService,
                             meterRegistry);
    }

    @Bean
    TileCacheWarmer tileCacheWarmer(TileServerConfiguration configuration, LayerRegistry registry,
                                    TileAddressing addressing, TileService tileService,
                                    HistogramService histogramService) {
      return new TileCacheWarmer(registry, addressing, tileService, histogramService,
                                 ImageFormat.fromExtension(configuration.getTiles().getFormat()),
                                 configuration.getWarmup());
    }
  }
}
