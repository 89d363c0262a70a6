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

package org.kurento.gateway.signaling;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Viewer information attached to a session-established event: the viewer's resolution and its
 * device pixel ratio.
 */
public final class SessionMetadata {
  private static final Logger log = LoggerFactory.getLogger(SessionMetadata.class);

  public static final SessionMetadata EMPTY = new SessionMetadata(null, null);

  private static final Pattern RESOLUTION = Pattern.compile("^\\d+x\\d+$");

  private final String res;
  private final Double scale;

  public SessionMetadata(String res, Double scale) {
    this.res = res;
    this.scale = scale;
  }

  /**
   * Decodes the base64 JSON metadata sent with {@code SESSION_OK}. Malformed metadata is logged
   * and treated as absent.
   */
  public static SessionMetadata decode(String base64Json) {
    if (base64Json == null || base64Json.trim().isEmpty()) {
      return EMPTY;
    }
    try {
      String json = new String(Base64.getDecoder().decode(base64Json.trim()),
          StandardCharsets.UTF_8);
      JsonObject meta = JsonParser.parseString(json).getAsJsonObject();
      String res = null;
      Double scale = null;
      JsonElement resValue = meta.get("res");
      if (resValue != null && !resValue.isJsonNull()) {
        res = resValue.getAsString();
      }
      JsonElement scaleValue = meta.get("scale");
      if (scaleValue != null && !scaleValue.isJsonNull()) {
        scale = scaleValue.getAsDouble();
      }
      return new SessionMetadata(res, scale);
    } catch (RuntimeException e) {
      log.warn("Ignoring malformed session metadata '{}': {}", base64Json, e.getMessage());
      return EMPTY;
    }
  }

  public static boolean isValidResolution(String res) {
    return res != null && RESOLUTION.matcher(res).matches();
  }

  public String getRes() {
    return res;
  }

  public Double getScale() {
    return scale;
  }

  public boolean hasRes() {
    return res != null;
  }

  public boolean hasScale() {
    return scale != null;
  }

  @Override
  public String toString() {
    return "SessionMetadata{res=" + res + ", scale=" + scale + "}";
  }
}
