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

import org.kurento.client.IceCandidate;
import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.exception.GatewayException.Code;
import org.kurento.gateway.internal.EventLoop;
import org.kurento.gateway.pipeline.PipelineHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One logical signaling connection between a local id and the remote peer it expects. Every
 * transport event is marshaled onto the negotiation {@link EventLoop}, so all state below is
 * confined to the loop thread.
 *
 * <p>A peer that has not registered with the relay yet is not an error: the session setup is
 * retried every {@link #PEER_ABSENT_RETRY_MILLIS} until the peer shows up. Any other error, or a
 * disconnection, stops the bound pipeline and completes the future returned by
 * {@link #connect()}.
 */
public class SignalingChannel implements SignalingListener {
  private static final Logger log = LoggerFactory.getLogger(SignalingChannel.class);

  public static final long PEER_ABSENT_RETRY_MILLIS = 2000;

  private final String name;
  private final int localId;
  private final int remotePeerId;
  private final SignalingTransport transport;
  private final EventLoop loop;
  private final long retryDelayMillis;

  private PipelineHandle pipeline;
  private SessionListener sessionListener;
  private CompletableFuture<Void> exit;
  private ScheduledFuture<?> pendingRetry;
  private boolean pipelineStopped;

  private volatile SessionState state = SessionState.DISCONNECTED;

  public SignalingChannel(String name, int localId, int remotePeerId,
      SignalingTransport transport, EventLoop loop) {
    this(name, localId, remotePeerId, transport, loop, PEER_ABSENT_RETRY_MILLIS);
  }

  public SignalingChannel(String name, int localId, int remotePeerId,
      SignalingTransport transport, EventLoop loop, long retryDelayMillis) {
    this.name = name;
    this.localId = localId;
    this.remotePeerId = remotePeerId;
    this.transport = transport;
    this.loop = loop;
    this.retryDelayMillis = retryDelayMillis;
  }

  public String getName() {
    return name;
  }

  public int getLocalId() {
    return localId;
  }

  public int getRemotePeerId() {
    return remotePeerId;
  }

  public SessionState getState() {
    return state;
  }

  public PipelineHandle getPipeline() {
    return pipeline;
  }

  /**
   * @return true if this channel stopped its pipeline since the last {@link #connect()}. Read on
   *         the loop.
   */
  public boolean isPipelineStopped() {
    return pipelineStopped;
  }

  /**
   * Binds the pipeline that receives the inbound SDP and ICE of this channel, and the listener
   * told when the session is established. Must be called on the loop.
   */
  public void bind(PipelineHandle pipeline, SessionListener sessionListener) {
    this.pipeline = pipeline;
    this.sessionListener = sessionListener;
  }

  /**
   * Opens the transport and requests the session once connected.
   *
   * @return completes when this connection ends, for whatever reason
   */
  public CompletableFuture<Void> connect() {
    final CompletableFuture<Void> future = new CompletableFuture<Void>();
    loop.execute(new Runnable() {
      @Override
      public void run() {
        if (exit != null) {
          future.completeExceptionally(new IllegalStateException(
              "Channel " + name + " is already connected"));
          return;
        }
        exit = future;
        pipelineStopped = false;
        state = SessionState.CONNECTING;
        log.info("[{}] Connecting to signaling server as peer {}", name, localId);
        try {
          transport.connect(SignalingChannel.this);
        } catch (RuntimeException e) {
          fail(new GatewayException(Code.SIGNALING_FATAL_ERROR_CODE,
              "Unable to connect to signaling server: " + e.getMessage(), e));
        }
      }
    });
    return future;
  }

  /**
   * Closes the transport without touching the pipeline.
   */
  public void close() {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        if (!isOpen()) {
          return;
        }
        log.debug("[{}] Closing signaling channel", name);
        transport.close();
        finish();
      }
    });
  }

  /**
   * Reports an error raised outside the transport, for instance by the bound pipeline. Handled
   * like a fatal signaling error.
   */
  public void reportError(final GatewayException error) {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        if (isOpen()) {
          fail(error);
        }
      }
    });
  }

  public void sendSdp(String type, String sdp) {
    if (!isOpen()) {
      log.debug("[{}] Dropping local {} SDP, channel is closed", name, type);
      return;
    }
    log.info("[{}] Sending {} SDP", name, type);
    transport.sendSdp(type, sdp);
  }

  public void sendIce(IceCandidate candidate) {
    if (!isOpen()) {
      log.debug("[{}] Dropping local ICE candidate, channel is closed", name);
      return;
    }
    transport.sendIce(candidate);
  }

  @Override
  public void onConnect() {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        if (!isOpen()) {
          return;
        }
        state = SessionState.CONNECTED;
        log.info("[{}] Connected to signaling server", name);
        requestSession();
      }
    });
  }

  @Override
  public void onDisconnect() {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        if (!isOpen()) {
          return;
        }
        log.warn("[{}] Disconnected from signaling server", name);
        state = SessionState.RECONNECTING;
        stopPipeline();
        finish();
      }
    });
  }

  @Override
  public void onError(final GatewayException error) {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        if (!isOpen()) {
          return;
        }
        if (error.getCode() != Code.SIGNALING_PEER_ABSENT_ERROR_CODE) {
          fail(error);
          return;
        }
        if (pendingRetry != null) {
          log.debug("[{}] Peer {} still absent, retry already scheduled", name, remotePeerId);
          return;
        }
        log.info("[{}] Peer {} not connected yet, retrying in {} ms", name, remotePeerId,
            retryDelayMillis);
        pendingRetry = loop.schedule(new Runnable() {
          @Override
          public void run() {
            pendingRetry = null;
            if (isOpen()) {
              requestSession();
            }
          }
        }, retryDelayMillis, TimeUnit.MILLISECONDS);
      }
    });
  }

  @Override
  public void onSdp(final String type, final String sdp) {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        if (!isOpen()) {
          return;
        }
        if (pipeline == null) {
          log.warn("[{}] Received {} SDP but no pipeline is bound", name, type);
          return;
        }
        try {
          pipeline.setSdp(type, sdp);
        } catch (RuntimeException e) {
          fail(asGatewayException(e));
        }
      }
    });
  }

  @Override
  public void onIce(final IceCandidate candidate) {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        if (!isOpen() || pipeline == null) {
          return;
        }
        try {
          pipeline.setIce(candidate);
        } catch (RuntimeException e) {
          fail(asGatewayException(e));
        }
      }
    });
  }

  @Override
  public void onSession(final int peerId, final SessionMetadata metadata) {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        if (!isOpen()) {
          return;
        }
        if (peerId != remotePeerId) {
          GatewayException error = new GatewayException(Code.ROUTING_ERROR_CODE,
              "Session established with peer " + peerId + " but expected peer " + remotePeerId);
          log.error("[{}] {}", name, error.getMessage());
          return;
        }
        state = SessionState.ACTIVE;
        log.info("[{}] Session established with peer {} {}", name, peerId, metadata);
        if (sessionListener == null) {
          return;
        }
        try {
          sessionListener.onSessionEstablished(SignalingChannel.this, peerId, metadata);
        } catch (RuntimeException e) {
          fail(asGatewayException(e));
        }
      }
    });
  }

  private void requestSession() {
    state = SessionState.NEGOTIATING;
    log.info("[{}] Requesting session with peer {}", name, remotePeerId);
    transport.setupCall(remotePeerId);
  }

  private void fail(GatewayException error) {
    log.error("[{}] Signaling error, ending session: {}", name, error.toString());
    stopPipeline();
    transport.close();
    finish();
  }

  private void stopPipeline() {
    if (pipeline == null || !pipeline.isRunning()) {
      return;
    }
    pipelineStopped = true;
    try {
      pipeline.stop();
    } catch (RuntimeException e) {
      log.warn("[{}] Error stopping pipeline: {}", name, e.getMessage());
    }
  }

  private void finish() {
    if (pendingRetry != null) {
      pendingRetry.cancel(false);
      pendingRetry = null;
    }
    state = SessionState.DISCONNECTED;
    CompletableFuture<Void> done = exit;
    exit = null;
    if (done != null) {
      done.complete(null);
    }
  }

  private boolean isOpen() {
    return exit != null;
  }

  private static GatewayException asGatewayException(RuntimeException e) {
    if (e instanceof GatewayException) {
      return (GatewayException) e;
    }
    return new GatewayException(Code.MEDIA_PIPELINE_ERROR_CODE, e.getMessage(), e);
  }
}
