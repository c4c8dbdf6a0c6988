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
package org.skymaps.resource;

import org.skymaps.common.catalog.LayerNotFoundException;
import org.skymaps.common.projection.TileOutOfRangeException;
import org.skymaps.common.render.InvalidRenderParametersException;
import org.skymaps.common.source.DataUnavailableException;
import org.skymaps.service.TileComputationException;

import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps the exceptions of the tile engine to HTTP responses with a short JSON body.
 */
@RestControllerAdvice
public class ErrorHandler {
  private static final Logger LOG = LoggerFactory.getLogger(ErrorHandler.class);

  @ExceptionHandler({LayerNotFoundException.class, TileOutOfRangeException.class})
  public ResponseEntity<Map<String, Object>> notFound(RuntimeException e) {
    return error(HttpStatus.NOT_FOUND, e.getMessage());
  }

  /**
   * Covers invalid render parameters and image formats, and unparseable query values.
   */
  @ExceptionHandler({InvalidRenderParametersException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  /**
   * Any other illegal argument is an internal check failing, not a fault of the request.
   */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> internalError(IllegalArgumentException e) {
    LOG.error("Internal argument check failed", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");
  }

  @ExceptionHandler(DataUnavailableException.class)
  public ResponseEntity<Map<String, Object>> dataUnavailable(DataUnavailableException e) {
    LOG.error("Data unavailable for layer {}", e.getLayerId(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "Data unavailable for layer " + e.getLayerId());
  }

  @ExceptionHandler(TileComputationException.class)
  public ResponseEntity<Map<String, Object>> computationFailed(TileComputationException e) {
    LOG.error("Tile computation failed", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
    return ResponseEntity.status(status)
      .contentType(MediaType.APPLICATION_JSON)
      .body(ImmutableMap.<String, Object>of("status", status.value(), "message", String.valueOf(message)));
  }
}
