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

import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.exception.GatewayException.Code;
import org.kurento.gateway.internal.EventLoop;
import org.kurento.gateway.monitor.RtcConfigListener;
import org.kurento.gateway.monitor.RtcConfigMonitor;
import org.kurento.gateway.monitor.RtcConfigMonitorSupervisor;
import org.kurento.gateway.pipeline.PipelineHandle;
import org.kurento.gateway.rtc.RtcConfig;
import org.kurento.gateway.rtc.RtcConfigHolder;
import org.kurento.gateway.signaling.SessionListener;
import org.kurento.gateway.signaling.SessionMetadata;
import org.kurento.gateway.signaling.SignalingChannel;
import org.kurento.gateway.signaling.SignalingTransport;
import org.kurento.gateway.telemetry.SystemMonitor;
import org.kurento.gateway.telemetry.TelemetryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps the video and audio sessions alive. Each iteration connects both signaling channels and
 * waits for the video channel to end; then both pipelines are stopped and negotiation starts
 * again. Session establishment starts the pipeline of the matching peer, and refreshed
 * credentials are applied to both pipelines.
 *
 * <p>All callbacks of this class run on the negotiation loop.
 */
public class SessionSupervisor implements SessionListener, RtcConfigListener, TelemetryListener {
  private static final Logger log = LoggerFactory.getLogger(SessionSupervisor.class);

  private static final long SHUTDOWN_STEP_TIMEOUT_SECONDS = 5;

  public static final String DEFAULT_ENCODER = "vp8";

  private final EventLoop loop;
  private final SignalingChannel videoChannel;
  private final SignalingChannel audioChannel;
  private final PipelineHandle videoPipeline;
  private final PipelineHandle audioPipeline;
  private final RtcConfigMonitorSupervisor monitorSupervisor;
  private final RtcConfig initialRtcConfig;
  private final RtcConfigHolder rtcConfigHolder;
  private final SystemMonitor systemMonitor;
  private final boolean enableResize;
  private final DisplayResizer resizer;
  private final int videoBitrate;
  private final int audioBitrate;
  private final int framerate;
  private final String encoder;
  private final int maxIterations;
  private final long restartDelayMillis;

  private final AtomicBoolean shutdown = new AtomicBoolean(false);
  private volatile boolean stopRequested = false;
  private volatile SupervisorState state = SupervisorState.IDLE;
  private volatile int iterations = 0;

  // loop confined
  private boolean videoStopped = false;
  private boolean audioStopped = false;
  private String lastCursorData;

  private SessionSupervisor(Builder builder) {
    this.loop = builder.loop;
    this.videoPipeline = builder.videoPipeline;
    this.audioPipeline = builder.audioPipeline;
    this.videoChannel = new SignalingChannel("video", builder.videoLocalId, builder.videoPeerId,
        builder.videoTransport, loop, builder.peerAbsentRetryMillis);
    this.audioChannel = new SignalingChannel("audio", builder.audioLocalId, builder.audioPeerId,
        builder.audioTransport, loop, builder.peerAbsentRetryMillis);
    this.monitorSupervisor = new RtcConfigMonitorSupervisor(builder.monitors, loop, this);
    this.initialRtcConfig = builder.initialRtcConfig;
    this.rtcConfigHolder = builder.rtcConfigHolder != null ? builder.rtcConfigHolder
        : new RtcConfigHolder();
    this.systemMonitor = builder.systemMonitor;
    this.enableResize = builder.enableResize;
    this.resizer = builder.displayController != null
        ? new DisplayResizer(builder.displayController) : null;
    this.videoBitrate = builder.videoBitrate;
    this.audioBitrate = builder.audioBitrate;
    this.framerate = builder.framerate;
    this.encoder = builder.encoder;
    this.maxIterations = builder.maxIterations;
    this.restartDelayMillis = builder.restartDelayMillis;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs the negotiation cycle until {@link #requestStop()} or the iteration cap, then releases
   * every owned resource.
   *
   * @return the process exit status, 0 on an orderly stop and 1 if the cycle failed
   */
  public int run() {
    int status = 0;
    try {
      startup();
      while (!stopRequested && (maxIterations <= 0 || iterations < maxIterations)) {
        iterations++;
        runIteration();
        if (restartDelayMillis > 0 && !stopRequested) {
          Thread.sleep(restartDelayMillis);
        }
      }
    } catch (InterruptedException e) {
      log.info("Session supervisor interrupted");
      Thread.currentThread().interrupt();
    } catch (ExecutionException | RuntimeException e) {
      log.error("Session supervisor failed", e);
      status = 1;
    } finally {
      shutdown();
    }
    return status;
  }

  /**
   * Makes {@link #run()} return after the current iteration. The signaling channels are closed so
   * the iteration ends promptly.
   */
  public void requestStop() {
    if (stopRequested) {
      return;
    }
    log.info("Stop requested");
    stopRequested = true;
    videoChannel.close();
    audioChannel.close();
  }

  private void startup() throws InterruptedException, ExecutionException {
    log.info("Starting session supervisor, video peer {} -> {}, audio peer {} -> {}",
        videoChannel.getLocalId(), videoChannel.getRemotePeerId(), audioChannel.getLocalId(),
        audioChannel.getRemotePeerId());
    onLoop(new Runnable() {
      @Override
      public void run() {
        configurePipelines();
      }
    });
    monitorSupervisor.start();
    if (systemMonitor != null) {
      systemMonitor.setListener(this);
      systemMonitor.start();
    }
  }

  private void configurePipelines() {
    if (framerate > 0) {
      videoPipeline.setFramerate(framerate);
    }
    if (videoBitrate > 0) {
      videoPipeline.setVideoBitrate(videoBitrate);
    }
    if (audioBitrate > 0) {
      audioPipeline.setAudioBitrate(audioBitrate);
    }
    if (initialRtcConfig != null) {
      rtcConfigHolder.publish(initialRtcConfig);
      videoPipeline.setIceServers(initialRtcConfig.getStunUris(), initialRtcConfig.getTurnUris());
      audioPipeline.setIceServers(initialRtcConfig.getStunUris(), initialRtcConfig.getTurnUris());
    }
  }

  private void runIteration() throws InterruptedException, ExecutionException {
    state = SupervisorState.NEGOTIATING;
    log.debug("Negotiation iteration {}", iterations);
    onLoop(new Runnable() {
      @Override
      public void run() {
        if (resizer != null) {
          resizer.reset();
        }
        videoStopped = false;
        audioStopped = false;
        videoChannel.bind(videoPipeline, SessionSupervisor.this);
        audioChannel.bind(audioPipeline, SessionSupervisor.this);
        videoPipeline.setEventListener(
            new ChannelPipelineBridge(videoChannel, loop, SessionSupervisor.this));
        audioPipeline.setEventListener(
            new ChannelPipelineBridge(audioChannel, loop, SessionSupervisor.this));
      }
    });

    CompletableFuture<Void> audioDone = audioChannel.connect();
    CompletableFuture<Void> videoDone = videoChannel.connect();
    if (stopRequested) {
      videoChannel.close();
      audioChannel.close();
    }
    videoDone.get();

    state = SupervisorState.RESTARTING;
    log.info("Video session ended, restarting negotiation");
    onLoop(new Runnable() {
      @Override
      public void run() {
        stopPipelines();
      }
    });
    audioChannel.close();
    audioDone.get();
  }

  /**
   * Stops each pipeline unless it was already stopped since the iteration began, either here or
   * by its signaling channel.
   */
  private void stopPipelines() {
    if (!videoStopped && !videoChannel.isPipelineStopped()) {
      stopPipeline("video", videoPipeline);
    }
    videoStopped = true;
    if (!audioStopped && !audioChannel.isPipelineStopped()) {
      stopPipeline("audio", audioPipeline);
    }
    audioStopped = true;
  }

  private void stopPipeline(String name, PipelineHandle pipeline) {
    try {
      pipeline.stop();
    } catch (RuntimeException e) {
      log.warn("Error stopping {} pipeline: {}", name, e.getMessage());
    }
  }

  /**
   * Releases everything in order: pipelines, background workers, signaling, loop. Safe to call
   * more than once.
   */
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    stopRequested = true;
    log.info("Shutting down session supervisor");
    try {
      onLoop(new Runnable() {
        @Override
        public void run() {
          stopPipelines();
        }
      }, SHUTDOWN_STEP_TIMEOUT_SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException | TimeoutException e) {
      log.warn("Unable to stop pipelines on the loop: {}", e.toString());
    }
    if (systemMonitor != null) {
      systemMonitor.stop();
    }
    monitorSupervisor.stop();
    videoChannel.close();
    audioChannel.close();
    loop.shutdown();
    state = SupervisorState.STOPPED;
    log.info("Session supervisor stopped");
  }

  @Override
  public void onSessionEstablished(SignalingChannel channel, int peerId,
      SessionMetadata metadata) {
    if (peerId == videoChannel.getRemotePeerId()) {
      if (enableResize && resizer != null) {
        if (metadata.hasRes()) {
          resizer.resize(metadata.getRes(), videoPipeline);
        }
        if (metadata.hasScale()) {
          resizer.scale(metadata.getScale());
        }
      }
      log.info("Starting video pipeline");
      state = SupervisorState.ACTIVE;
      videoPipeline.start(false);
    } else if (peerId == audioChannel.getRemotePeerId()) {
      log.info("Starting audio pipeline");
      audioPipeline.start(true);
    } else {
      GatewayException error = new GatewayException(Code.ROUTING_ERROR_CODE,
          "failed to start pipeline for peer_id: " + peerId);
      log.error(error.getMessage());
    }
  }

  @Override
  public void onRtcConfig(RtcConfig config) {
    log.info("Applying refreshed RTC config {}", config);
    rtcConfigHolder.publish(config);
    applyRtcConfig("video", videoPipeline, config);
    applyRtcConfig("audio", audioPipeline, config);
  }

  private void applyRtcConfig(String name, PipelineHandle pipeline, RtcConfig config) {
    try {
      if (pipeline.isRunning()) {
        for (String turnUri : config.getTurnUris()) {
          pipeline.addTurnServer(turnUri);
        }
      } else {
        pipeline.setIceServers(config.getStunUris(), config.getTurnUris());
      }
    } catch (RuntimeException e) {
      log.warn("Unable to apply RTC config to {} pipeline: {}", name, e.getMessage());
    }
  }

  /**
   * Sends the viewer the current stream settings once the video data channel opens.
   */
  void onDataChannelOpen(SignalingChannel channel) {
    if (channel != videoChannel) {
      log.debug("Data channel open on {} channel, nothing to send", channel.getName());
      return;
    }
    log.info("Opened peer data channel for user input");
    try {
      if (framerate > 0) {
        videoPipeline.sendFramerate(framerate);
      }
      if (videoBitrate > 0) {
        videoPipeline.sendVideoBitrate(videoBitrate);
      }
      if (audioBitrate > 0) {
        videoPipeline.sendAudioBitrate(audioBitrate);
      }
      videoPipeline.sendResizeEnabled(enableResize);
      videoPipeline.sendEncoder(encoder);
      if (lastCursorData != null) {
        videoPipeline.sendCursorData(lastCursorData);
      }
    } catch (RuntimeException e) {
      log.warn("Unable to send stream settings to the viewer: {}", e.getMessage());
    }
  }

  /**
   * Forwards a cursor image to the viewer and keeps it for viewers whose data channel opens later.
   */
  public void onCursorChange(final String cursorData) {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        lastCursorData = cursorData;
        if (videoPipeline.isRunning()) {
          videoPipeline.sendCursorData(cursorData);
        }
      }
    });
  }

  @Override
  public void onSystemStats(final double cpuPercent, final long memoryTotal,
      final long memoryUsed, final long timestampMillis) {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        if (!videoPipeline.isRunning()) {
          return;
        }
        videoPipeline.sendSystemStats(cpuPercent, memoryTotal, memoryUsed);
        videoPipeline.sendPing(timestampMillis);
      }
    });
  }

  private void onLoop(Runnable task) throws InterruptedException, ExecutionException {
    CompletableFuture.runAsync(task, loop).get();
  }

  private void onLoop(Runnable task, long timeoutSeconds)
      throws InterruptedException, ExecutionException, TimeoutException {
    CompletableFuture.runAsync(task, loop).get(timeoutSeconds, TimeUnit.SECONDS);
  }

  public SupervisorState getState() {
    return state;
  }

  public int getIterations() {
    return iterations;
  }

  public SignalingChannel getVideoChannel() {
    return videoChannel;
  }

  public SignalingChannel getAudioChannel() {
    return audioChannel;
  }

  public RtcConfigHolder getRtcConfigHolder() {
    return rtcConfigHolder;
  }

  public static class Builder {
    private EventLoop loop;
    private SignalingTransport videoTransport;
    private SignalingTransport audioTransport;
    private PipelineHandle videoPipeline;
    private PipelineHandle audioPipeline;
    private int videoLocalId = 0;
    private int videoPeerId = 1;
    private int audioLocalId = 2;
    private int audioPeerId = 3;
    private List<RtcConfigMonitor> monitors = Collections.emptyList();
    private RtcConfig initialRtcConfig;
    private RtcConfigHolder rtcConfigHolder;
    private SystemMonitor systemMonitor;
    private boolean enableResize = false;
    private DisplayController displayController;
    private int videoBitrate;
    private int audioBitrate;
    private int framerate;
    private String encoder = DEFAULT_ENCODER;
    private int maxIterations = 0;
    private long restartDelayMillis = 0;
    private long peerAbsentRetryMillis = SignalingChannel.PEER_ABSENT_RETRY_MILLIS;

    public Builder loop(EventLoop loop) {
      this.loop = loop;
      return this;
    }

    public Builder video(SignalingTransport transport, PipelineHandle pipeline) {
      this.videoTransport = transport;
      this.videoPipeline = pipeline;
      return this;
    }

    public Builder audio(SignalingTransport transport, PipelineHandle pipeline) {
      this.audioTransport = transport;
      this.audioPipeline = pipeline;
      return this;
    }

    public Builder videoPeers(int localId, int peerId) {
      this.videoLocalId = localId;
      this.videoPeerId = peerId;
      return this;
    }

    public Builder audioPeers(int localId, int peerId) {
      this.audioLocalId = localId;
      this.audioPeerId = peerId;
      return this;
    }

    public Builder monitors(List<RtcConfigMonitor> monitors) {
      this.monitors = new ArrayList<RtcConfigMonitor>(monitors);
      return this;
    }

    public Builder initialRtcConfig(RtcConfig initialRtcConfig) {
      this.initialRtcConfig = initialRtcConfig;
      return this;
    }

    public Builder rtcConfigHolder(RtcConfigHolder rtcConfigHolder) {
      this.rtcConfigHolder = rtcConfigHolder;
      return this;
    }

    public Builder systemMonitor(SystemMonitor systemMonitor) {
      this.systemMonitor = systemMonitor;
      return this;
    }

    /**
     * @param displayController may be null when resizing is disabled
     */
    public Builder resize(boolean enableResize, DisplayController displayController) {
      this.enableResize = enableResize;
      this.displayController = displayController;
      return this;
    }

    /**
     * Values of 0 keep the pipeline defaults.
     */
    public Builder encoding(int videoBitrate, int audioBitrate, int framerate) {
      this.videoBitrate = videoBitrate;
      this.audioBitrate = audioBitrate;
      this.framerate = framerate;
      return this;
    }

    /**
     * @param encoder name reported to the viewer
     */
    public Builder encoder(String encoder) {
      this.encoder = encoder;
      return this;
    }

    /**
     * @param maxIterations 0 to restart forever
     */
    public Builder maxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    public Builder restartDelayMillis(long restartDelayMillis) {
      this.restartDelayMillis = restartDelayMillis;
      return this;
    }

    public Builder peerAbsentRetryMillis(long peerAbsentRetryMillis) {
      this.peerAbsentRetryMillis = peerAbsentRetryMillis;
      return this;
    }

    public SessionSupervisor build() {
      if (loop == null || videoTransport == null || audioTransport == null
          || videoPipeline == null || audioPipeline == null) {
        throw new IllegalStateException(
            "Event loop, transports and pipelines are required to build a session supervisor");
      }
      return new SessionSupervisor(this);
    }
  }
}
