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
package org.skymaps.common.source;

import org.skymaps.common.projection.GridShape;
import org.skymaps.common.projection.PixelTransform;

import java.io.File;
import java.io.IOException;
import java.util.function.Supplier;

import com.google.common.base.Stopwatch;
import com.google.common.base.Suppliers;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a layer from an image HDU of a FITS file, optionally selecting one plane of a cube.
 * <p>
 * The header is read on first use of {@link #shape()} or {@link #transform()} without touching the pixel data, so a
 * catalog can be listed cheaply.  The pixels are read once, on the first region request, with {@code BSCALE},
 * {@code BZERO} and {@code BLANK} applied and the rows flipped from FITS order (bottom first) to display order.
 */
public class FitsSourceDataProvider extends AbstractSourceDataProvider {
  private static final Logger LOG = LoggerFactory.getLogger(FitsSourceDataProvider.class);

  private final File file;
  private final int hdu;
  private final Integer index;
  private final Supplier<HeaderInfo> header;

  /**
   * @param layerId used when reporting errors
   * @param file the FITS file
   * @param hdu the zero based HDU holding the image
   * @param index the plane of a cube, or null for a 2D image
   */
  public FitsSourceDataProvider(String layerId, File file, int hdu, Integer index) {
    super(layerId);
    this.file = file;
    this.hdu = hdu;
    this.index = index;
    this.header = Suppliers.memoize(this::readHeader);
  }

  public File getFile() {
    return file;
  }

  @Override
  public GridShape shape() {
    return header.get().shape;
  }

  @Override
  public PixelTransform transform() {
    return header.get().transform;
  }

  private HeaderInfo readHeader() {
    try (Fits fits = open()) {
      Header h = imageHdu(fits).getHeader();
      int cols = h.getIntValue("NAXIS1", 0);
      int rows = h.getIntValue("NAXIS2", 0);
      if (cols <= 0 || rows <= 0) {
        throw new DataUnavailableException(getLayerId(), "HDU " + hdu + " of " + file + " is not an image");
      }
      GridShape shape = new GridShape(rows, cols);
      return new HeaderInfo(shape, transform(h, shape),
                            h.getDoubleValue("BSCALE", 1d), h.getDoubleValue("BZERO", 0d),
                            h.containsKey("BLANK") ? Long.valueOf(h.getLongValue("BLANK")) : null);
    } catch (IOException | FitsException e) {
      throw new DataUnavailableException(getLayerId(), "Unable to read the header of " + file, e);
    }
  }

  /**
   * Builds a linear transform from the CAR keywords, falling back to a full sky grid when there are none.
   */
  private static PixelTransform transform(Header h, GridShape shape) {
    double cdelt1 = h.getDoubleValue("CDELT1", h.getDoubleValue("CD1_1", 0d));
    double cdelt2 = h.getDoubleValue("CDELT2", h.getDoubleValue("CD2_2", 0d));
    if (cdelt1 == 0 || cdelt2 == 0) {
      return PixelTransform.fullSky(shape);
    }
    return new PixelTransform(
      h.getDoubleValue("CRPIX1", shape.getCols() / 2d + 0.5), h.getDoubleValue("CRVAL1", 0d), cdelt1,
      h.getDoubleValue("CRPIX2", shape.getRows() / 2d + 0.5), h.getDoubleValue("CRVAL2", 0d), cdelt2,
      shape.getRows());
  }

  @Override
  protected Array2D load() {
    HeaderInfo info = header.get();
    Stopwatch timer = Stopwatch.createStarted();
    try (Fits fits = open()) {
      Object kernel = imageHdu(fits).getKernel();
      if (index != null) {
        Object[] planes = (Object[]) kernel;
        if (index < 0 || index >= planes.length) {
          throw new DataUnavailableException(getLayerId(), "Plane " + index + " is not in " + file);
        }
        kernel = planes[index];
      }
      Array2D array = toArray(kernel, info);
      LOG.info("Loaded layer {} from {} ({}) in {}ms", getLayerId(), file, info.shape, timer.elapsed().toMillis());
      return array;
    } catch (IOException | FitsException | ClassCastException e) {
      throw new DataUnavailableException(getLayerId(), "Unable to read the image data of " + file, e);
    }
  }

  private Fits open() throws FitsException {
    if (!file.canRead()) {
      throw new DataUnavailableException(getLayerId(), "Unable to open " + file);
    }
    return new Fits(file);
  }

  private BasicHDU<?> imageHdu(Fits fits) throws FitsException, IOException {
    BasicHDU<?> image = fits.getHDU(hdu);
    if (image == null) {
      throw new DataUnavailableException(getLayerId(), "HDU " + hdu + " does not exist in " + file);
    }
    return image;
  }

  private Array2D toArray(Object plane, HeaderInfo info) {
    Object[] fitsRows = (Object[]) plane;
    GridShape shape = info.shape;
    if (fitsRows.length != shape.getRows()) {
      throw new DataUnavailableException(getLayerId(), "Image data of " + file + " does not match its header");
    }
    float[] samples = new float[(int) shape.size()];
    for (int fitsRow = 0; fitsRow < fitsRows.length; fitsRow++) {
      int offset = (shape.getRows() - 1 - fitsRow) * shape.getCols();
      copyRow(fitsRows[fitsRow], samples, offset, shape.getCols(), info);
    }
    return Array2D.wrap(shape, samples);
  }

  private void copyRow(Object row, float[] samples, int offset, int cols, HeaderInfo info) {
    if (row instanceof float[]) {
      float[] values = (float[]) row;
      for (int c = 0; c < cols; c++) {
        samples[offset + c] = info.scale(values[c]);
      }
    } else if (row instanceof double[]) {
      double[] values = (double[]) row;
      for (int c = 0; c < cols; c++) {
        samples[offset + c] = info.scale(values[c]);
      }
    } else if (row instanceof int[]) {
      int[] values = (int[]) row;
      for (int c = 0; c < cols; c++) {
        samples[offset + c] = info.scaleInteger(values[c]);
      }
    } else if (row instanceof short[]) {
      short[] values = (short[]) row;
      for (int c = 0; c < cols; c++) {
        samples[offset + c] = info.scaleInteger(values[c]);
      }
    } else if (row instanceof byte[]) {
      byte[] values = (byte[]) row;
      for (int c = 0; c < cols; c++) {
        samples[offset + c] = info.scaleInteger(values[c] & 0xFF); // FITS bytes are unsigned
      }
    } else if (row instanceof long[]) {
      long[] values = (long[]) row;
      for (int c = 0; c < cols; c++) {
        samples[offset + c] = info.scaleInteger(values[c]);
      }
    } else {
      throw new DataUnavailableException(getLayerId(), "Unsupported FITS data type in " + file);
    }
  }

  /**
   * The parts of the header needed to interpret the pixels.
   */
  private static class HeaderInfo {
    private final GridShape shape;
    private final PixelTransform transform;
    private final double bscale;
    private final double bzero;
    private final Long blank;

    HeaderInfo(GridShape shape, PixelTransform transform, double bscale, double bzero, Long blank) {
      this.shape = shape;
      this.transform = transform;
      this.bscale = bscale;
      this.bzero = bzero;
      this.blank = blank;
    }

    float scale(double value) {
      return (float) (bzero + bscale * value);
    }

    float scaleInteger(long value) {
      if (blank != null && blank == value) {
        return Array2D.NO_DATA;
      }
      return scale(value);
    }
  }
}
