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

import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.Before;
import org.junit.Test;
import org.kurento.client.IceCandidate;
import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.exception.GatewayException.Code;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class WebSocketSignalingTransportTest {

  private SignalingListener listener;
  private WebSocketSignalingTransport transport;

  @Before
  public void setUp() {
    listener = mock(SignalingListener.class);
    transport = new WebSocketSignalingTransport(new OkHttpClient(), "ws://127.0.0.1:1/ws", 0);
    // no server: only the listener is registered, dispatch is driven by hand
    transport.connect(listener);
    transport.close();
  }

  @Test
  public void helloReplyMeansConnected() {
    transport.dispatch("HELLO");

    verify(listener).onConnect();
  }

  @Test
  public void sessionOkCarriesRequestedPeerAndMetadata() {
    transport.setupCall(1);
    String meta = Base64.getEncoder().encodeToString(
        "{\"res\":\"1280x720\",\"scale\":2.0}".getBytes(StandardCharsets.UTF_8));

    transport.dispatch("SESSION_OK " + meta);

    ArgumentCaptor<SessionMetadata> captor = ArgumentCaptor.forClass(SessionMetadata.class);
    verify(listener).onSession(eq(1), captor.capture());
    assertEquals("1280x720", captor.getValue().getRes());
    assertEquals(2.0, captor.getValue().getScale(), 0.0001);
  }

  @Test
  public void peerNotFoundIsPeerAbsent() {
    transport.dispatch("ERROR peer '1' not found");

    assertEquals(Code.SIGNALING_PEER_ABSENT_ERROR_CODE, capturedError().getCode());
  }

  @Test
  public void otherErrorsAreFatal() {
    transport.dispatch("ERROR invalid msg, already in session");

    assertEquals(Code.SIGNALING_FATAL_ERROR_CODE, capturedError().getCode());
  }

  @Test
  public void sdpAndIceMessagesAreDecoded() {
    transport.dispatch("{\"sdp\":{\"type\":\"answer\",\"sdp\":\"v=0\"}}");
    transport.dispatch("{\"ice\":{\"candidate\":\"candidate:1 1 UDP 1 10.0.0.1 9 typ host\","
        + "\"sdpMid\":\"0\",\"sdpMLineIndex\":0}}");

    verify(listener).onSdp("answer", "v=0");
    ArgumentCaptor<IceCandidate> captor = ArgumentCaptor.forClass(IceCandidate.class);
    verify(listener).onIce(captor.capture());
    assertEquals("0", captor.getValue().getSdpMid());
    assertEquals(0, captor.getValue().getSdpMLineIndex());
  }

  @Test
  public void unparsableMessageIsFatal() {
    transport.dispatch("{\"sdp\":");

    assertEquals(Code.SIGNALING_FATAL_ERROR_CODE, capturedError().getCode());
  }

  @Test(timeout = 10000)
  public void handshakeOverWebSocket() throws Exception {
    final List<String> serverReceived = new CopyOnWriteArrayList<String>();
    final String meta = Base64.getEncoder().encodeToString(
        "{\"res\":\"1024x768\"}".getBytes(StandardCharsets.UTF_8));
    MockWebServer server = new MockWebServer();
    server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
      @Override
      public void onMessage(WebSocket webSocket, String text) {
        serverReceived.add(text);
        if (text.startsWith("HELLO")) {
          webSocket.send("HELLO");
        } else if (text.startsWith("SESSION")) {
          webSocket.send("SESSION_OK " + meta);
        }
      }
    }));
    server.start();
    try {
      final WebSocketSignalingTransport client = new WebSocketSignalingTransport(
          new OkHttpClient(), "ws://" + server.getHostName() + ":" + server.getPort() + "/ws", 2,
          "viewer", "pass");
      final CountDownLatch session = new CountDownLatch(1);
      final AtomicReference<SessionMetadata> received = new AtomicReference<SessionMetadata>();
      final AtomicReference<Integer> peer = new AtomicReference<Integer>();
      client.connect(new SignalingListener() {
        @Override
        public void onConnect() {
          client.setupCall(3);
        }

        @Override
        public void onDisconnect() {
        }

        @Override
        public void onError(GatewayException error) {
        }

        @Override
        public void onSdp(String type, String sdp) {
        }

        @Override
        public void onIce(IceCandidate candidate) {
        }

        @Override
        public void onSession(int peerId, SessionMetadata metadata) {
          peer.set(peerId);
          received.set(metadata);
          session.countDown();
        }
      });

      assertTrue(session.await(5, TimeUnit.SECONDS));
      client.close();

      assertEquals(Integer.valueOf(3), peer.get());
      assertEquals("1024x768", received.get().getRes());
      assertEquals("HELLO 2", serverReceived.get(0));
      assertEquals("SESSION 3", serverReceived.get(1));
      RecordedRequest request = server.takeRequest();
      assertEquals(Credentials.basic("viewer", "pass"), request.getHeader("Authorization"));
    } finally {
      server.shutdown();
    }
  }

  private GatewayException capturedError() {
    ArgumentCaptor<GatewayException> captor = ArgumentCaptor.forClass(GatewayException.class);
    verify(listener).onError(captor.capture());
    return captor.getValue();
  }
}
