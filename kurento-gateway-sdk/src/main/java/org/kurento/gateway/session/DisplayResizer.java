/*
 * (C) Copyright 2016 Kurento (http://kurento.org/)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.kurento.gateway.session;

import org.kurento.gateway.pipeline.PipelineHandle;
import org.kurento.gateway.signaling.SessionMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts the display to the viewer before the video pipeline starts. Once a resize fails no other
 * resize is tried until {@link #reset()}.
 */
public class DisplayResizer {
  private static final Logger log = LoggerFactory.getLogger(DisplayResizer.class);

  public static final double MIN_SCALE = 0.75;
  public static final double MAX_SCALE = 2.5;
  public static final int BASE_DPI = 96;
  public static final int BASE_CURSOR_SIZE = 16;

  private final DisplayController display;

  private boolean lastResizeSuccess = true;

  public DisplayResizer(DisplayController display) {
    this.display = display;
  }

  /**
   * Resizes the display to {@code resolution} and tells the viewer through {@code pipeline}.
   *
   * @return true if the display was resized
   */
  public boolean resize(String resolution, PipelineHandle pipeline) {
    if (!SessionMetadata.isValidResolution(resolution)) {
      log.warn("Ignoring invalid resolution '{}'", resolution);
      return false;
    }
    String current = display.currentResolution();
    if (resolution.equals(current)) {
      log.info("Display already at {}, not resizing", resolution);
      return false;
    }
    if (!lastResizeSuccess) {
      log.warn("Skipping resize to {}, the last resize failed", resolution);
      return false;
    }
    log.info("Resizing display from {} to {}", current, resolution);
    boolean resized;
    try {
      resized = display.resize(resolution);
    } catch (RuntimeException e) {
      log.warn("Error resizing display to {}: {}", resolution, e.getMessage());
      resized = false;
    }
    lastResizeSuccess = resized;
    if (resized) {
      pipeline.sendRemoteResolution(resolution);
    } else {
      log.error("Failed to resize display to {}", resolution);
    }
    return resized;
  }

  /**
   * Applies the viewer's device pixel ratio to the DPI and the cursor size.
   *
   * @return false if the ratio is out of bounds
   */
  public boolean scale(double scale) {
    if (scale < MIN_SCALE || scale > MAX_SCALE) {
      log.error("Requested scale ratio out of bounds: {}", scale);
      return false;
    }
    int dpi = (int) (BASE_DPI * scale);
    log.info("Setting DPI to {}", dpi);
    try {
      if (!display.setDpi(dpi)) {
        log.error("Failed to set DPI to {}", dpi);
      }
    } catch (RuntimeException e) {
      log.error("Error setting DPI to {}: {}", dpi, e.getMessage());
    }
    int cursorSize = (int) (BASE_CURSOR_SIZE * scale);
    log.info("Setting cursor size to {}", cursorSize);
    try {
      if (!display.setCursorSize(cursorSize)) {
        log.error("Failed to set cursor size to {}", cursorSize);
      }
    } catch (RuntimeException e) {
      log.error("Error setting cursor size to {}: {}", cursorSize, e.getMessage());
    }
    return true;
  }

  public boolean isLastResizeSuccess() {
    return lastResizeSuccess;
  }

  public void reset() {
    lastResizeSuccess = true;
  }
}
