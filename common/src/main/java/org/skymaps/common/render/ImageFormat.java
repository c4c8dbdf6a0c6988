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

import java.util.Locale;

/**
 * Raster formats tiles can be encoded in.
 */
public enum ImageFormat {
  PNG("png", "png", "image/png", true),
  JPEG("jpg", "jpeg", "image/jpeg", false);

  private final String extension;
  private final String writerName;
  private final String contentType;
  private final boolean alpha;

  ImageFormat(String extension, String writerName, String contentType, boolean alpha) {
    this.extension = extension;
    this.writerName = writerName;
    this.contentType = contentType;
    this.alpha = alpha;
  }

  /**
   * @throws InvalidRenderParametersException for unsupported extensions
   */
  public static ImageFormat fromExtension(String extension) {
    String ext = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
    switch (ext) {
      case "png": return PNG;
      case "jpg":
      case "jpeg": return JPEG;
      default: throw new InvalidRenderParametersException("Unsupported image format: " + extension);
    }
  }

  public String getExtension() {
    return extension;
  }

  String getWriterName() {
    return writerName;
  }

  public String getContentType() {
    return contentType;
  }

  public boolean hasAlpha() {
    return alpha;
  }
}
