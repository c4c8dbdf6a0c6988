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
package org.skymaps.common.render;

import org.skymaps.common.source.Array2D;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * Turns grids of samples into encoded images.
 * <p>
 * Rendering is a pure function of the samples, the parameters and the format: the encoder is configured identically on
 * every call, so identical inputs give byte-identical output, which the tile cache relies upon.
 * <p>
 * This class is threadsafe.
 */
public class Renderer {

  static final int TRANSPARENT = 0x00000000;
  private static final int COLORBAR_HEIGHT = 8;

  private final float jpegQuality;

  /**
   * @param jpegQuality the compression quality used for every JPEG, between 0 and 1
   */
  public Renderer(float jpegQuality) {
    Preconditions.checkArgument(jpegQuality > 0 && jpegQuality <= 1, "JPEG quality must be in (0,1]");
    this.jpegQuality = jpegQuality;
  }

  /**
   * Renders the samples, one image pixel per sample.
   */
  public TileImage render(Array2D samples, RenderParameters parameters, ImageFormat format) {
    return encode(colorize(samples, parameters, format), format);
  }

  /**
   * Renders a horizontal strip of the colormap, low values on the left.
   */
  public TileImage renderColorbar(String colormapName) {
    Colormap colormap = Colormaps.get(colormapName);
    BufferedImage image = new BufferedImage(Colormap.SIZE, COLORBAR_HEIGHT, BufferedImage.TYPE_INT_ARGB);
    for (int x = 0; x < Colormap.SIZE; x++) {
      int color = colormap.color((x + 0.5) / Colormap.SIZE);
      for (int y = 0; y < COLORBAR_HEIGHT; y++) {
        image.setRGB(x, y, color);
      }
    }
    return encode(image, ImageFormat.PNG);
  }

  @VisibleForTesting
  BufferedImage colorize(Array2D samples, RenderParameters parameters, ImageFormat format) {
    Colormap colormap = Colormaps.get(parameters.getColormap());
    int type = format.hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    BufferedImage image = new BufferedImage(samples.getCols(), samples.getRows(), type);
    for (int row = 0; row < samples.getRows(); row++) {
      for (int col = 0; col < samples.getCols(); col++) {
        image.setRGB(col, row, color(samples.get(row, col), parameters, colormap));
      }
    }
    return image;
  }

  /**
   * The ARGB colour of one sample.
   */
  @VisibleForTesting
  static int color(float value, RenderParameters parameters, Colormap colormap) {
    if (Array2D.isNoData(value)) {
      return TRANSPARENT;
    }
    if (parameters.isAbs()) {
      value = Math.abs(value);
    }
    double normalized;
    if (parameters.isLog()) {
      if (value <= 0) {
        return colormap.getUnderColor();
      }
      double low = Math.log10(parameters.getVmin());
      double high = Math.log10(parameters.getVmax());
      normalized = (Math.log10(value) - low) / (high - low);
    } else {
      normalized = (value - parameters.getVmin()) / (parameters.getVmax() - parameters.getVmin());
    }
    if (parameters.isClip()) {
      normalized = Math.max(0, Math.min(1, normalized));
    }
    return colormap.color(normalized);
  }

  private TileImage encode(BufferedImage image, ImageFormat format) {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getWriterName());
    if (!writers.hasNext()) {
      throw new IllegalStateException("No image writer available for " + format);
    }
    ImageWriter writer = writers.next();
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(16 * 1024);
    try (ImageOutputStream out = new MemoryCacheImageOutputStream(buffer)) {
      writer.setOutput(out);
      ImageWriteParam param = writer.getDefaultWriteParam();
      if (format == ImageFormat.JPEG) {
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(jpegQuality);
      }
      writer.write(null, new IIOImage(image, null, null), param);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to encode image as " + format, e);
    } finally {
      writer.dispose();
    }
    return new TileImage(buffer.toByteArray(), format.getContentType());
  }
}
