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

/**
 * The display the video pipeline captures.
 */
public interface DisplayController {

  /**
   * @return the current resolution as "WxH"
   */
  String currentResolution();

  /**
   * @return true if the display now has the given resolution
   */
  boolean resize(String resolution);

  boolean setDpi(int dpi);

  boolean setCursorSize(int size);
}
