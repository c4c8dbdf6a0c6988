package org.skymaps.common.render;

import org.junit.Test;

import static org.junit.Assert.*;

public class RenderParametersTest {

  @Test
  public void testFormatBound() {
    assertEquals("1.00000000e+00", RenderParameters.formatBound(1));
    assertEquals("-5.00000000e+02", RenderParameters.formatBound(-500));
    assertEquals("0.00000000e+00", RenderParameters.formatBound(-0.0));
    assertEquals("1.23456789e-07", RenderParameters.formatBound(1.234567891e-7));
  }

  @Test
  public void testBoundsAreCanonical() {
    RenderParameters a = RenderParameters.of("viridis", 0.1234567891, 10, Normalization.LINEAR, true);
    RenderParameters b = RenderParameters.of("viridis", 0.1234567894, 10, Normalization.LINEAR, true);
    assertEquals(a, b);
    assertEquals(0.123456789, a.getVmin(), 0);
  }

  @Test
  public void testValid() {
    RenderParameters parameters = RenderParameters.of("coolwarm_r", 1, 1000, Normalization.LOG, false);
    assertTrue(parameters.isLog());
    assertFalse(parameters.isClip());
    assertFalse(parameters.isAbs());
    assertEquals("coolwarm_r", parameters.getColormap());
  }

  @Test(expected = InvalidRenderParametersException.class)
  public void testLogRequiresPositiveMinimum() {
    RenderParameters.of("viridis", 0, 10, Normalization.LOG, true);
  }

  @Test(expected = InvalidRenderParametersException.class)
  public void testLogNegativeMinimum() {
    RenderParameters.of("viridis", -1, 10, Normalization.LOG, true);
  }

  @Test(expected = InvalidRenderParametersException.class)
  public void testEqualBounds() {
    RenderParameters.of("viridis", 3, 3, Normalization.LINEAR, true);
  }

  @Test(expected = InvalidRenderParametersException.class)
  public void testBoundsEqualAfterRounding() {
    RenderParameters.of("viridis", 1.0000000001, 1.0000000002, Normalization.LINEAR, true);
  }

  @Test(expected = InvalidRenderParametersException.class)
  public void testReversedBounds() {
    RenderParameters.of("viridis", 10, 0, Normalization.LINEAR, true);
  }

  @Test(expected = InvalidRenderParametersException.class)
  public void testNonFiniteBound() {
    RenderParameters.of("viridis", 0, Double.POSITIVE_INFINITY, Normalization.LINEAR, true);
  }

  @Test(expected = InvalidRenderParametersException.class)
  public void testUnknownColormap() {
    RenderParameters.of("nope", 0, 1, Normalization.LINEAR, true);
  }

  @Test
  public void testInvalidIsIllegalArgument() {
    try {
      RenderParameters.of("viridis", Double.NaN, 1, Normalization.LINEAR, true);
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e instanceof InvalidRenderParametersException);
    }
  }
}
