package org.skymaps.common.source;

import org.skymaps.common.projection.Double2D;
import org.skymaps.common.projection.GridShape;
import org.skymaps.common.projection.PixelRectangle;

import java.io.File;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.util.BufferedFile;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

public class FitsSourceDataProviderTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private File write(Object data, String name, Object... keywords) throws Exception {
    File file = folder.newFile(name);
    try (Fits fits = new Fits()) {
      BasicHDU<?> hdu = Fits.makeHDU(data);
      for (int i = 0; i < keywords.length; i += 2) {
        Object value = keywords[i + 1];
        if (value instanceof Double) {
          hdu.getHeader().addValue((String) keywords[i], (Double) value, "");
        } else {
          hdu.getHeader().addValue((String) keywords[i], ((Number) value).longValue(), "");
        }
      }
      fits.addHDU(hdu);
      try (BufferedFile out = new BufferedFile(file, "rw")) {
        fits.write(out);
      }
    }
    return file;
  }

  @Test
  public void testFloatImageIsFlippedToDisplayOrder() throws Exception {
    // FITS rows are stored bottom first
    float[][] data = {
      {1, 2, 3},
      {4, 5, 6}
    };
    File file = write(data, "image.fits");
    FitsSourceDataProvider provider = new FitsSourceDataProvider("image", file, 0, null);

    assertEquals(new GridShape(2, 3), provider.shape());
    Array2D samples = provider.readNative();
    assertEquals(4, samples.get(0, 0), 0);
    assertEquals(6, samples.get(0, 2), 0);
    assertEquals(1, samples.get(1, 0), 0);
    assertEquals(3, samples.get(1, 2), 0);
  }

  @Test
  public void testCubePlane() throws Exception {
    float[][][] cube = {
      {{1, 1}, {1, 1}},
      {{2, 2}, {2, 2}},
      {{3, 3}, {3, 3}}
    };
    File file = write(cube, "cube.fits");
    FitsSourceDataProvider provider = new FitsSourceDataProvider("q", file, 0, 1);
    assertEquals(new GridShape(2, 2), provider.shape());
    assertEquals(2, provider.readNative().get(1, 1), 0);

    Array2D region = provider.readRegion(new PixelRectangle(0, 0, 2, 2), GridShape.square(1));
    assertEquals(2, region.get(0, 0), 0);
  }

  @Test
  public void testScalingAndBlank() throws Exception {
    int[][] data = {
      {10, -1},
      {20, 30}
    };
    File file = write(data, "scaled.fits", "BSCALE", 0.5d, "BZERO", 1.0d, "BLANK", -1);
    Array2D samples = new FitsSourceDataProvider("scaled", file, 0, null).readNative();
    assertEquals(11, samples.get(0, 0), 1e-6);
    assertEquals(16, samples.get(0, 1), 1e-6);
    assertEquals(6, samples.get(1, 0), 1e-6);
    assertTrue(Array2D.isNoData(samples.get(1, 1)));
  }

  @Test
  public void testWorldCoordinates() throws Exception {
    float[][] data = new float[10][20];
    File file = write(data, "wcs.fits",
                      "CRPIX1", 1.0d, "CRVAL1", 10.0d, "CDELT1", -0.5d,
                      "CRPIX2", 1.0d, "CRVAL2", -5.0d, "CDELT2", 0.5d);
    FitsSourceDataProvider provider = new FitsSourceDataProvider("wcs", file, 0, null);

    // the first FITS pixel is the bottom left of the display
    Double2D sky = provider.transform().toSky(0, 9);
    assertEquals(10, sky.getX(), 1e-9);
    assertEquals(-5, sky.getY(), 1e-9);
  }

  @Test
  public void testMissingFile() {
    FitsSourceDataProvider provider =
      new FitsSourceDataProvider("missing", new File(folder.getRoot(), "absent.fits"), 0, null);
    try {
      provider.readNative();
      fail("Expected the missing file to be reported");
    } catch (DataUnavailableException e) {
      assertEquals("missing", e.getLayerId());
    }
    // not cached, a later read tries again
    try {
      provider.shape();
      fail("Expected the missing file to be reported");
    } catch (DataUnavailableException e) {
      assertEquals("missing", e.getLayerId());
    }
  }

  @Test(expected = DataUnavailableException.class)
  public void testMissingPlane() throws Exception {
    float[][][] cube = {{{1}}, {{2}}};
    File file = write(cube, "small-cube.fits");
    new FitsSourceDataProvider("plane", file, 0, 5).readNative();
  }
}
