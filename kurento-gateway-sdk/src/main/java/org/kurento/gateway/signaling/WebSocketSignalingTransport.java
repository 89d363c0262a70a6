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
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.kurento.client.IceCandidate;
import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.exception.GatewayException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client of the signaling relay over a WebSocket. The relay speaks a line protocol:
 *
 * <pre>
 * -&gt; HELLO &lt;localId&gt;          &lt;- HELLO
 * -&gt; SESSION &lt;peerId&gt;         &lt;- SESSION_OK [base64 json meta] | ERROR peer '&lt;peerId&gt;' not found
 * &lt;-&gt; {"sdp":{"type":..,"sdp":..}}
 * &lt;-&gt; {"ice":{"candidate":..,"sdpMid":..,"sdpMLineIndex":..}}
 * </pre>
 */
public class WebSocketSignalingTransport implements SignalingTransport {
  private static final Logger log = LoggerFactory.getLogger(WebSocketSignalingTransport.class);

  private static final int NORMAL_CLOSURE = 1000;

  private final OkHttpClient client;
  private final String serverUri;
  private final int localId;
  private final String authorization;
  private final AtomicInteger connection = new AtomicInteger();

  private volatile WebSocket webSocket;
  private volatile SignalingListener listener;
  private volatile int requestedPeerId = -1;

  public WebSocketSignalingTransport(OkHttpClient client, String serverUri, int localId) {
    this(client, serverUri, localId, null, null);
  }

  /**
   * @param username basic authentication user, or null to connect without authentication
   */
  public WebSocketSignalingTransport(OkHttpClient client, String serverUri, int localId,
      String username, String password) {
    this.client = client;
    this.serverUri = serverUri;
    this.localId = localId;
    this.authorization = username == null || username.isEmpty() ? null
        : Credentials.basic(username, password == null ? "" : password);
  }

  @Override
  public void connect(SignalingListener listener) {
    this.listener = listener;
    Request.Builder request = new Request.Builder().url(serverUri);
    if (authorization != null) {
      request.header("Authorization", authorization);
    }
    log.debug("Connecting to signaling server {} as {}", serverUri, localId);
    int id = connection.incrementAndGet();
    webSocket = client.newWebSocket(request.build(), new RelayListener(id));
  }

  @Override
  public void setupCall(int peerId) {
    requestedPeerId = peerId;
    send("SESSION " + peerId);
  }

  @Override
  public void sendSdp(String type, String sdp) {
    JsonObject body = new JsonObject();
    body.addProperty("type", type);
    body.addProperty("sdp", sdp);
    JsonObject message = new JsonObject();
    message.add("sdp", body);
    send(message.toString());
  }

  @Override
  public void sendIce(IceCandidate candidate) {
    JsonObject body = new JsonObject();
    body.addProperty("candidate", candidate.getCandidate());
    body.addProperty("sdpMid", candidate.getSdpMid());
    body.addProperty("sdpMLineIndex", candidate.getSdpMLineIndex());
    JsonObject message = new JsonObject();
    message.add("ice", body);
    send(message.toString());
  }

  @Override
  public void close() {
    connection.incrementAndGet();
    WebSocket current = webSocket;
    webSocket = null;
    if (current != null) {
      current.close(NORMAL_CLOSURE, null);
    }
  }

  private void send(String text) {
    WebSocket current = webSocket;
    if (current == null || !current.send(text)) {
      log.warn("Unable to send message, not connected to signaling server");
    }
  }

  /**
   * Handles one text frame from the relay.
   */
  void dispatch(String text) {
    SignalingListener target = listener;
    if (target == null) {
      return;
    }
    if ("HELLO".equals(text)) {
      target.onConnect();
    } else if (text.startsWith("SESSION_OK")) {
      String meta = text.substring("SESSION_OK".length()).trim();
      target.onSession(requestedPeerId, SessionMetadata.decode(meta));
    } else if (text.startsWith("ERROR")) {
      if (text.contains("not found")) {
        target.onError(new GatewayException(Code.SIGNALING_PEER_ABSENT_ERROR_CODE, text));
      } else {
        target.onError(new GatewayException(Code.SIGNALING_FATAL_ERROR_CODE, text));
      }
    } else {
      dispatchJson(target, text);
    }
  }

  private void dispatchJson(SignalingListener target, String text) {
    try {
      JsonObject message = JsonParser.parseString(text).getAsJsonObject();
      if (message.has("sdp")) {
        JsonObject sdp = message.getAsJsonObject("sdp");
        target.onSdp(sdp.get("type").getAsString(), sdp.get("sdp").getAsString());
      } else if (message.has("ice")) {
        JsonObject ice = message.getAsJsonObject("ice");
        JsonElement mid = ice.get("sdpMid");
        target.onIce(new IceCandidate(ice.get("candidate").getAsString(),
            mid == null || mid.isJsonNull() ? null : mid.getAsString(),
            ice.get("sdpMLineIndex").getAsInt()));
      } else {
        target.onError(new GatewayException(Code.SIGNALING_FATAL_ERROR_CODE,
            "unhandled JSON message: " + text));
      }
    } catch (RuntimeException e) {
      target.onError(new GatewayException(Code.SIGNALING_FATAL_ERROR_CODE,
          "error parsing message as JSON: " + text, e));
    }
  }

  /**
   * Delivers the events of one connection, until a newer one is opened or it is closed locally.
   */
  private class RelayListener extends WebSocketListener {
    private final int id;

    RelayListener(int id) {
      this.id = id;
    }

    private boolean isCurrent() {
      return connection.get() == id;
    }

    @Override
    public void onOpen(WebSocket socket, Response response) {
      if (!isCurrent()) {
        return;
      }
      log.info("Connected to signaling server {}", serverUri);
      socket.send("HELLO " + localId);
    }

    @Override
    public void onMessage(WebSocket socket, String text) {
      if (!isCurrent()) {
        return;
      }
      log.debug("Received signaling message: {}", text);
      dispatch(text);
    }

    @Override
    public void onClosing(WebSocket socket, int code, String reason) {
      socket.close(NORMAL_CLOSURE, null);
    }

    @Override
    public void onClosed(WebSocket socket, int code, String reason) {
      if (!isCurrent()) {
        return;
      }
      connection.incrementAndGet();
      webSocket = null;
      log.info("Signaling connection closed: {} {}", code, reason);
      SignalingListener target = listener;
      if (target != null) {
        target.onDisconnect();
      }
    }

    @Override
    public void onFailure(WebSocket socket, Throwable t, Response response) {
      if (!isCurrent()) {
        return;
      }
      connection.incrementAndGet();
      webSocket = null;
      log.warn("Signaling connection failed: {}", t.getMessage());
      SignalingListener target = listener;
      if (target != null) {
        target.onDisconnect();
      }
    }
  }
}
