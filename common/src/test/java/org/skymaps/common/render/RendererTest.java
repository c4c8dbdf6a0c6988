package org.skymaps.common.render;

import org.skymaps.common.source.Array2D;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.Arrays;

import javax.imageio.ImageIO;

import org.junit.Test;

import static org.junit.Assert.*;

public class RendererTest {

  private final Renderer renderer = new Renderer(0.9f);
  private final Colormap viridis = Colormaps.get("viridis");

  private static Array2D ramp(int size) {
    float[] samples = new float[size * size];
    for (int i = 0; i < samples.length; i++) {
      samples[i] = i % size;
    }
    return Array2D.wrap(org.skymaps.common.projection.GridShape.square(size), samples);
  }

  @Test
  public void testNoDataIsTransparent() throws Exception {
    float[][] rows = new float[4][4];
    rows[0][0] = Array2D.NO_DATA;
    rows[1][1] = 1;
    RenderParameters parameters = RenderParameters.of("viridis", 0, 1, Normalization.LINEAR, true);

    TileImage image = renderer.render(Array2D.of(rows), parameters, ImageFormat.PNG);
    assertEquals("image/png", image.getContentType());

    BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image.getBytes()));
    assertEquals(4, decoded.getWidth());
    assertEquals(4, decoded.getHeight());
    assertEquals(0, decoded.getRGB(0, 0) >>> 24);
    assertEquals(viridis.getUnderColor(), decoded.getRGB(1, 0));
    assertEquals(viridis.getOverColor(), decoded.getRGB(1, 1));
  }

  @Test
  public void testLinearNormalization() {
    RenderParameters parameters = RenderParameters.of("viridis", 0, 10, Normalization.LINEAR, true);
    assertEquals(viridis.color(0.5), Renderer.color(5, parameters, viridis));
    assertEquals(viridis.getUnderColor(), Renderer.color(0, parameters, viridis));
    assertEquals(viridis.getOverColor(), Renderer.color(10, parameters, viridis));
  }

  @Test
  public void testClipAndSaturation() {
    RenderParameters clipped = RenderParameters.of("viridis", 0, 10, Normalization.LINEAR, true);
    RenderParameters unclipped = RenderParameters.of("viridis", 0, 10, Normalization.LINEAR, false);
    assertEquals(viridis.getOverColor(), Renderer.color(50, clipped, viridis));
    assertEquals(viridis.getUnderColor(), Renderer.color(-50, clipped, viridis));
    assertEquals(viridis.getOverColor(), Renderer.color(50, unclipped, viridis));
    assertEquals(viridis.getUnderColor(), Renderer.color(-50, unclipped, viridis));
    assertEquals(viridis.getOverColor(), Renderer.color(Float.POSITIVE_INFINITY, unclipped, viridis));
    assertEquals(viridis.getUnderColor(), Renderer.color(Float.NEGATIVE_INFINITY, unclipped, viridis));
  }

  @Test
  public void testLogNormalization() {
    RenderParameters parameters = RenderParameters.of("magma", 1, 100, Normalization.LOG, true);
    Colormap magma = Colormaps.get("magma");
    assertEquals(magma.color(0.5), Renderer.color(10, parameters, magma));
    assertEquals(magma.getOverColor(), Renderer.color(100, parameters, magma));
  }

  @Test
  public void testLogNonPositiveIsUnderColor() {
    RenderParameters clipped = RenderParameters.of("magma", 1, 100, Normalization.LOG, true);
    RenderParameters unclipped = RenderParameters.of("magma", 1, 100, Normalization.LOG, false);
    Colormap magma = Colormaps.get("magma");
    assertEquals(magma.getUnderColor(), Renderer.color(0, clipped, magma));
    assertEquals(magma.getUnderColor(), Renderer.color(-3, clipped, magma));
    assertEquals(magma.getUnderColor(), Renderer.color(-3, unclipped, magma));
  }

  @Test
  public void testAbsoluteValue() {
    RenderParameters linear = RenderParameters.of("viridis", 0, 10, Normalization.LINEAR, true, true);
    assertEquals(Renderer.color(5, linear, viridis), Renderer.color(-5, linear, viridis));
    assertEquals(viridis.color(0.5), Renderer.color(-5, linear, viridis));
    assertEquals(Renderer.TRANSPARENT, Renderer.color(Array2D.NO_DATA, linear, viridis));

    // negative values have a colour of their own on a log scale once their sign is dropped
    RenderParameters log = RenderParameters.of("magma", 1, 100, Normalization.LOG, true, true);
    Colormap magma = Colormaps.get("magma");
    assertEquals(magma.color(0.5), Renderer.color(-10, log, magma));
    assertNotEquals(magma.getUnderColor(), Renderer.color(-10, log, magma));
    assertEquals(magma.getUnderColor(), Renderer.color(0, log, magma));
  }

  @Test
  public void testDeterministic() {
    Array2D samples = ramp(256);
    RenderParameters parameters = RenderParameters.of("RdBu_r", 0, 255, Normalization.LINEAR, true);
    for (ImageFormat format : ImageFormat.values()) {
      TileImage first = renderer.render(samples, parameters, format);
      TileImage second = renderer.render(samples, parameters, format);
      assertTrue(format + " output differs", Arrays.equals(first.getBytes(), second.getBytes()));
      assertEquals(first, second);
    }
  }

  @Test
  public void testJpeg() throws Exception {
    TileImage image = renderer.render(ramp(256), RenderParameters.of("gray", 0, 255, Normalization.LINEAR, true),
                                      ImageFormat.JPEG);
    assertEquals("image/jpeg", image.getContentType());
    BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image.getBytes()));
    assertEquals(256, decoded.getWidth());
    assertEquals(256, decoded.getHeight());
    assertFalse(decoded.getColorModel().hasAlpha());
  }

  @Test
  public void testColorbar() throws Exception {
    TileImage image = renderer.renderColorbar("viridis_r");
    BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image.getBytes()));
    assertEquals(Colormap.SIZE, decoded.getWidth());
    assertEquals(8, decoded.getHeight());
    assertEquals(viridis.getOverColor(), decoded.getRGB(0, 0));
    assertEquals(viridis.getUnderColor(), decoded.getRGB(255, 7));
  }

  @Test(expected = InvalidRenderParametersException.class)
  public void testUnknownColorbar() {
    renderer.renderColorbar("rainbow-unicorn");
  }
}
