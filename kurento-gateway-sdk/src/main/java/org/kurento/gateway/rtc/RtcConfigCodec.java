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

package org.kurento.gateway.rtc;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.exception.GatewayException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Parses and generates RTC configuration documents (the {@code iceServers} JSON served to
 * browsers) and converts them into the STUN/TURN URIs consumed by the media pipeline.
 */
public final class RtcConfigCodec {
  private static final Logger log = LoggerFactory.getLogger(RtcConfigCodec.class);

  public static final String PUBLIC_STUN_HOST = "stun.l.google.com";
  public static final int PUBLIC_STUN_PORT = 19302;

  static final int DEFAULT_STUN_PORT = 3478;
  static final int DEFAULT_TURNS_PORT = 5349;

  private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping()
      .create();

  private RtcConfigCodec() {
  }

  /**
   * Decodes an RTC configuration document.
   *
   * @param document the JSON document
   * @return STUN URIs, TURN URIs with percent-encoded credentials, and the document unchanged
   * @throws GatewayException with {@link Code#CONFIG_FORMAT_ERROR_CODE} if the document is not
   *                          valid JSON, has no {@code iceServers} array, or a TURN entry has no
   *                          username/credential
   */
  public static RtcConfig decode(String document) throws GatewayException {
    IceServerDescriptor descriptor = parseDescriptor(document);
    List<String> stunUris = new ArrayList<String>();
    List<String> turnUris = new ArrayList<String>();
    for (IceServer server : descriptor.getIceServers()) {
      for (String url : server.getUrls()) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("stun:")) {
          stunUris.add("stun://" + parseHostPort(url, DEFAULT_STUN_PORT));
        } else if (lower.startsWith("turn:")) {
          turnUris.add(turnUri("turn", url, server, DEFAULT_STUN_PORT));
        } else if (lower.startsWith("turns:")) {
          turnUris.add(turnUri("turns", url, server, DEFAULT_TURNS_PORT));
        } else {
          log.debug("Ignoring ICE server url with unsupported scheme: {}", url);
        }
      }
    }
    return new RtcConfig(stunUris, turnUris, document);
  }

  /**
   * Parses the document into its immutable model. {@code urls} may be an array or a single
   * string, as browsers accept both.
   */
  public static IceServerDescriptor parseDescriptor(String document) throws GatewayException {
    if (document == null) {
      throw new GatewayException(Code.CONFIG_FORMAT_ERROR_CODE, "RTC config document is null");
    }
    JsonElement root;
    try {
      root = JsonParser.parseString(document);
    } catch (JsonParseException e) {
      throw new GatewayException(Code.CONFIG_FORMAT_ERROR_CODE,
          "RTC config is not valid JSON: " + e.getMessage(), e);
    }
    if (!root.isJsonObject()) {
      throw new GatewayException(Code.CONFIG_FORMAT_ERROR_CODE, "RTC config is not a JSON object");
    }
    JsonObject json = root.getAsJsonObject();
    JsonElement servers = json.get("iceServers");
    if (servers == null || !servers.isJsonArray()) {
      throw new GatewayException(Code.CONFIG_FORMAT_ERROR_CODE,
          "RTC config has no 'iceServers' array");
    }
    List<IceServer> iceServers = new ArrayList<IceServer>();
    for (JsonElement element : servers.getAsJsonArray()) {
      if (!element.isJsonObject()) {
        throw new GatewayException(Code.CONFIG_FORMAT_ERROR_CODE,
            "ICE server entry is not a JSON object: " + element);
      }
      JsonObject server = element.getAsJsonObject();
      iceServers.add(new IceServer(readUrls(server), optString(server, "username"),
          optString(server, "credential")));
    }
    return new IceServerDescriptor(iceServers,
        optString(json, "lifetimeDuration"),
        optString(json, "blockStatus"),
        optString(json, "iceTransportPolicy"));
  }

  /**
   * Serializes a descriptor in the document format read by {@link #decode(String)}.
   */
  public static String encode(IceServerDescriptor descriptor) {
    JsonObject json = new JsonObject();
    if (descriptor.getLifetimeDuration() != null) {
      json.addProperty("lifetimeDuration", descriptor.getLifetimeDuration());
    }
    JsonArray servers = new JsonArray();
    for (IceServer server : descriptor.getIceServers()) {
      JsonObject entry = new JsonObject();
      JsonArray urls = new JsonArray();
      for (String url : server.getUrls()) {
        urls.add(url);
      }
      entry.add("urls", urls);
      if (server.getUsername() != null) {
        entry.addProperty("username", server.getUsername());
      }
      if (server.getCredential() != null) {
        entry.addProperty("credential", server.getCredential());
      }
      servers.add(entry);
    }
    json.add("iceServers", servers);
    if (descriptor.getBlockStatus() != null) {
      json.addProperty("blockStatus", descriptor.getBlockStatus());
    }
    if (descriptor.getIceTransportPolicy() != null) {
      json.addProperty("iceTransportPolicy", descriptor.getIceTransportPolicy());
    }
    return gson.toJson(json);
  }

  /**
   * Builds the descriptor for a TURN server using the coturn REST API ephemeral credential
   * convention.
   *
   * <p>The caller must pass {@code username} already in its ephemeral form
   * {@code "<expiry-epoch-seconds>:<user>"}, see
   * {@link TurnCredentials#ephemeralUsername(String, java.time.Instant)}. The TURN server checks
   * the expiry prefix; this method only derives the credential as
   * {@code base64(HMAC-SHA1(secret, username))}.
   *
   * @return a two-entry document: STUN servers ({@code host:port} and the public Google STUN
   *         server) and the TURN server with the derived credential
   */
  public static String encodeHmac(String host, int port, String secret, String username,
                                  String protocol, boolean tls) {
    String credential = TurnCredentials.hmacCredential(secret, username);
    return encode(turnDescriptor(host, port, username, credential, protocol, tls));
  }

  /**
   * Builds the descriptor for a TURN server with long-term (non-HMAC) credentials.
   */
  public static String encodeStatic(String host, int port, String username, String password,
                                    String protocol, boolean tls) {
    return encode(turnDescriptor(host, port, username, password, protocol, tls));
  }

  /**
   * @return the fallback document, public STUN only
   */
  public static String defaultDocument() {
    List<IceServer> servers = new ArrayList<IceServer>();
    servers.add(new IceServer(Arrays.asList("stun:" + PUBLIC_STUN_HOST + ":" + PUBLIC_STUN_PORT)));
    return encode(new IceServerDescriptor(servers));
  }

  /**
   * Percent-encodes every character outside the RFC 3986 unreserved set, so that user names and
   * passwords can be embedded in the userinfo part of a TURN URI.
   */
  public static String percentEncode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8)
        .replace("+", "%20")
        .replace("*", "%2A")
        .replace("%7E", "~");
  }

  private static IceServerDescriptor turnDescriptor(String host, int port, String username,
                                                    String credential, String protocol,
                                                    boolean tls) {
    List<String> stunUrls = new ArrayList<String>();
    stunUrls.add("stun:" + host + ":" + port);
    if (!PUBLIC_STUN_HOST.equals(host)) {
      stunUrls.add("stun:" + PUBLIC_STUN_HOST + ":" + PUBLIC_STUN_PORT);
    }
    String turnUrl = (tls ? "turns" : "turn") + ":" + host + ":" + port + "?transport=" + protocol;

    List<IceServer> servers = new ArrayList<IceServer>();
    servers.add(new IceServer(stunUrls));
    servers.add(new IceServer(Arrays.asList(turnUrl), username, credential));
    return new IceServerDescriptor(servers);
  }

  private static String turnUri(String scheme, String url, IceServer server, int defaultPort) {
    if (server.getUsername() == null || server.getCredential() == null) {
      throw new GatewayException(Code.CONFIG_FORMAT_ERROR_CODE,
          "TURN server " + url + " has no username or credential");
    }
    return scheme + "://" + percentEncode(server.getUsername()) + ":"
        + percentEncode(server.getCredential()) + "@" + parseHostPort(url, defaultPort);
  }

  /**
   * Extracts {@code host:port} from an ICE url such as {@code turn:[::1]:3478?transport=udp}.
   * IPv6 literals keep their brackets.
   */
  static String parseHostPort(String url, int defaultPort) {
    try {
      String rest = new URI(url).getRawSchemeSpecificPart();
      if (rest.startsWith("//")) {
        rest = rest.substring(2);
      }
      int query = rest.indexOf('?');
      if (query >= 0) {
        rest = rest.substring(0, query);
      }
      URI authority = new URI("ice://" + rest);
      String host = authority.getHost();
      if (host == null || host.isEmpty()) {
        throw new GatewayException(Code.CONFIG_FORMAT_ERROR_CODE,
            "ICE server url has no valid host: " + url);
      }
      int port = authority.getPort() == -1 ? defaultPort : authority.getPort();
      return host + ":" + port;
    } catch (URISyntaxException e) {
      throw new GatewayException(Code.CONFIG_FORMAT_ERROR_CODE,
          "Malformed ICE server url: " + url, e);
    }
  }

  private static List<String> readUrls(JsonObject server) {
    List<String> urls = new ArrayList<String>();
    JsonElement value = server.get("urls");
    if (value == null || value.isJsonNull()) {
      return urls;
    }
    try {
      if (value.isJsonArray()) {
        for (JsonElement url : value.getAsJsonArray()) {
          urls.add(url.getAsString());
        }
      } else {
        urls.add(value.getAsString());
      }
    } catch (RuntimeException e) {
      throw new GatewayException(Code.CONFIG_FORMAT_ERROR_CODE,
          "ICE server 'urls' must be strings: " + value, e);
    }
    return urls;
  }

  private static String optString(JsonObject json, String name) {
    JsonElement value = json.get(name);
    if (value == null || value.isJsonNull()) {
      return null;
    }
    if (!value.isJsonPrimitive()) {
      throw new GatewayException(Code.CONFIG_FORMAT_ERROR_CODE,
          "'" + name + "' must be a string: " + value);
    }
    return value.getAsString();
  }
}
