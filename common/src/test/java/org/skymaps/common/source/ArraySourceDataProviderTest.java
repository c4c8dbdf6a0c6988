package org.skymaps.common.source;

import org.skymaps.common.projection.GridShape;
import org.skymaps.common.projection.PixelRectangle;

import org.junit.Test;

import static org.junit.Assert.*;

public class ArraySourceDataProviderTest {

  private static final float N = Array2D.NO_DATA;

  private final ArraySourceDataProvider provider = new ArraySourceDataProvider("test", Array2D.of(new float[][] {
    { 1,  2,  3,  4},
    { 5,  6,  7,  8},
    { 9, 10,  N,  N},
    {13, 14,  N, 16}
  }));

  @Test
  public void testNativeRegion() {
    Array2D region = provider.readRegion(new PixelRectangle(1, 1, 2, 2), GridShape.square(2));
    assertEquals(6, region.get(0, 0), 0);
    assertEquals(7, region.get(0, 1), 0);
    assertEquals(10, region.get(1, 0), 0);
    assertTrue(Array2D.isNoData(region.get(1, 1)));
  }

  @Test
  public void testBlockAverageExcludesNoData() {
    Array2D region = provider.readRegion(new PixelRectangle(0, 0, 4, 4), GridShape.square(2));
    assertEquals((1 + 2 + 5 + 6) / 4f, region.get(0, 0), 1e-6);
    assertEquals((3 + 4 + 7 + 8) / 4f, region.get(0, 1), 1e-6);
    assertEquals((9 + 10 + 13 + 14) / 4f, region.get(1, 0), 1e-6);
    assertEquals(16, region.get(1, 1), 1e-6); // only one valid pixel in the block
  }

  @Test
  public void testBlockWithoutValidPixels() {
    ArraySourceDataProvider empty = new ArraySourceDataProvider("empty", Array2D.of(new float[][] {
      {N, N},
      {N, N}
    }));
    Array2D region = empty.readRegion(new PixelRectangle(0, 0, 2, 2), GridShape.square(1));
    assertTrue(Array2D.isNoData(region.get(0, 0)));
  }

  @Test
  public void testOutsideGridIsNoData() {
    // a rectangle running off the right and bottom edges, as for a partial edge tile
    Array2D region = provider.readRegion(new PixelRectangle(2, 2, 4, 4), GridShape.square(4));
    assertTrue(Array2D.isNoData(region.get(0, 0)));
    assertEquals(16, region.get(1, 1), 0);
    assertTrue(Array2D.isNoData(region.get(0, 2)));
    assertTrue(Array2D.isNoData(region.get(3, 3)));

    Array2D downsampled = provider.readRegion(new PixelRectangle(0, 0, 8, 8), GridShape.square(2));
    assertEquals(98f / 13, downsampled.get(0, 0), 1e-5); // the whole grid, excluding the sentinel
    assertTrue(Array2D.isNoData(downsampled.get(0, 1)));
    assertTrue(Array2D.isNoData(downsampled.get(1, 1)));
  }

  @Test
  public void testDeterministic() {
    PixelRectangle rectangle = new PixelRectangle(0, 0, 4, 4);
    Array2D a = provider.readRegion(rectangle, GridShape.square(2));
    Array2D b = provider.readRegion(rectangle, GridShape.square(2));
    for (int i = 0; i < a.size(); i++) {
      assertEquals(Float.floatToIntBits(a.getFlat(i)), Float.floatToIntBits(b.getFlat(i)));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnequalFactors() {
    provider.readRegion(new PixelRectangle(0, 0, 4, 2), GridShape.square(2));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFractionalFactor() {
    provider.readRegion(new PixelRectangle(0, 0, 3, 3), GridShape.square(2));
  }
}
