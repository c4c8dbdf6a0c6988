package org.skymaps.service;

import org.skymaps.TileServerConfiguration;
import org.skymaps.TileServerFixture;
import org.skymaps.common.render.ImageFormat;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.junit.Assert.*;

public class TileCacheWarmerTest {

  private static TileServerConfiguration.Warmup warmup(boolean enabled, Integer... levels) {
    TileServerConfiguration.Warmup configuration = new TileServerConfiguration.Warmup();
    configuration.setEnabled(enabled);
    configuration.setLevels(Arrays.asList(levels));
    return configuration;
  }

  private static TileCacheWarmer warmer(TileServerFixture fixture, TileServerConfiguration.Warmup configuration) {
    return new TileCacheWarmer(fixture.registry, fixture.addressing, fixture.tileService, fixture.histogramService,
                               ImageFormat.PNG, configuration);
  }

  @Test
  public void testWarmsShallowLevels() throws Exception {
    try (TileServerFixture fixture = new TileServerFixture(
      TileServerFixture.autoLayer("a", 512), TileServerFixture.autoLayer("b", 512))) {
      TileCacheWarmer warmer = warmer(fixture, warmup(true, 0, 1, 7));
      try {
        WarmupReport report = warmer.start().get(60, TimeUnit.SECONDS);
        assertTrue(report.isSuccessful());
        assertEquals(2, report.getLayersWarmed());
        // one tile at zoom 0 and four at zoom 1; zoom 7 is beyond these layers
        assertEquals(10, report.getTilesRendered());
        assertEquals(10, fixture.tileService.getComputationCount());

        // a client asking for a warmed tile is served from the cache
        fixture.tileService.getTile(fixture.tileService.keyFor(
          RenderRequest.builder().layerId("a").z(1).x(1).y(0).format(ImageFormat.PNG).build()));
        assertEquals(10, fixture.tileService.getComputationCount());
      } finally {
        warmer.destroy();
      }
    }
  }

  @Test
  public void testFailingLayerDoesNotStopWarmup() throws Exception {
    try (TileServerFixture fixture = new TileServerFixture(
      TileServerFixture.autoLayer("a", 512), TileServerFixture.missingLayer("gone"))) {
      TileCacheWarmer warmer = warmer(fixture, warmup(true, 0));
      try {
        WarmupReport report = warmer.start().get(60, TimeUnit.SECONDS);
        assertFalse(report.isSuccessful());
        assertEquals(1, report.getLayersWarmed());
        assertEquals(1, report.getTilesRendered());
        assertTrue(report.getFailures().containsKey("gone"));
      } finally {
        warmer.destroy();
      }
    }
  }

  @Test
  public void testWarmsLogLayerWithNegativeData() throws Exception {
    try (TileServerFixture fixture = new TileServerFixture(TileServerFixture.logLayer("log", 512))) {
      TileCacheWarmer warmer = warmer(fixture, warmup(true, 0, 1));
      try {
        WarmupReport report = warmer.start().get(60, TimeUnit.SECONDS);
        assertTrue(report.getFailures().toString(), report.isSuccessful());
        assertEquals(5, report.getTilesRendered());
      } finally {
        warmer.destroy();
      }
    }
  }

  @Test
  public void testStartsOnce() throws Exception {
    try (TileServerFixture fixture = new TileServerFixture(TileServerFixture.autoLayer("a", 256))) {
      TileCacheWarmer warmer = warmer(fixture, warmup(true, 0));
      try {
        assertSame(warmer.start(), warmer.start());
        assertEquals(1, warmer.getCompletion().get(60, TimeUnit.SECONDS).getTilesRendered());
      } finally {
        warmer.destroy();
      }
    }
  }

  @Test
  public void testDisabled() {
    try (TileServerFixture fixture = new TileServerFixture(TileServerFixture.autoLayer("a", 256))) {
      TileCacheWarmer warmer = warmer(fixture, warmup(false, 0));
      try {
        warmer.onApplicationReady();
        assertNull(warmer.getCompletion());
        assertEquals(0, fixture.tileService.getComputationCount());
      } finally {
        warmer.destroy();
      }
    }
  }
}
