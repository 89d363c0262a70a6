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

package org.kurento.gateway.kms;

import org.kurento.client.DataChannelOpenedEvent;
import org.kurento.client.ErrorEvent;
import org.kurento.client.EventListener;
import org.kurento.client.IceCandidate;
import org.kurento.client.IceCandidateFoundEvent;
import org.kurento.client.KurentoClient;
import org.kurento.client.MediaPipeline;
import org.kurento.client.MediaType;
import org.kurento.client.PlayerEndpoint;
import org.kurento.client.WebRtcEndpoint;
import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.exception.GatewayException.Code;
import org.kurento.gateway.pipeline.PipelineEventListener;
import org.kurento.gateway.pipeline.PipelineHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link PipelineHandle} backed by a Kurento {@link MediaPipeline}: a {@link PlayerEndpoint}
 * reading the media source feeds a {@link WebRtcEndpoint} that offers the stream to the viewer.
 *
 * <p>The WebRTC endpoint only supports one TURN server, so the last one added wins. Messages for
 * the viewer's data channel are not supported by the endpoint and are dropped.
 */
public class KurentoPipelineHandle implements PipelineHandle {
    private static final Logger log = LoggerFactory.getLogger(KurentoPipelineHandle.class);

    private final String name;
    private final KurentoClientProvider provider;
    private final String sourceUri;

    private volatile PipelineEventListener eventListener;

    private MediaPipeline pipeline;
    private PlayerEndpoint player;
    private WebRtcEndpoint webEndpoint;
    private final List<IceCandidate> candidates = new ArrayList<IceCandidate>();

    private List<String> stunUris = Collections.emptyList();
    private List<String> turnUris = Collections.emptyList();
    private int videoBitrate;
    private int audioBitrate;
    private int framerate;
    private volatile boolean running = false;

    public KurentoPipelineHandle(String name, KurentoClientProvider provider, String sourceUri) {
        this.name = name;
        this.provider = provider;
        this.sourceUri = sourceUri;
    }

    @Override
    public void start(boolean audioOnly) throws GatewayException {
        if (running) {
            log.warn("PIPELINE {}: already running", name);
            return;
        }
        try {
            KurentoClient kurentoClient = provider.getKurentoClient();
            pipeline = kurentoClient.createMediaPipeline();
            pipeline.addErrorListener(errorListener());
            player = new PlayerEndpoint.Builder(pipeline, sourceUri).build();
            player.addErrorListener(errorListener());
            webEndpoint = new WebRtcEndpoint.Builder(pipeline).useDataChannels().build();
            webEndpoint.addErrorListener(errorListener());
            applyIceServers();
            if (videoBitrate > 0 && !audioOnly) {
                webEndpoint.setMaxVideoSendBandwidth(videoBitrate);
            }
            webEndpoint.addIceCandidateFoundListener(new EventListener<IceCandidateFoundEvent>() {
                @Override
                public void onEvent(IceCandidateFoundEvent event) {
                    PipelineEventListener listener = eventListener;
                    if (listener != null) {
                        listener.onLocalIceCandidate(event.getCandidate());
                    }
                }
            });
            webEndpoint.addDataChannelOpenedListener(new EventListener<DataChannelOpenedEvent>() {
                @Override
                public void onEvent(DataChannelOpenedEvent event) {
                    log.info("PIPELINE {}: data channel {} opened", name, event.getChannelId());
                    PipelineEventListener listener = eventListener;
                    if (listener != null) {
                        listener.onDataChannelOpen();
                    }
                }
            });
            if (audioOnly) {
                player.connect(webEndpoint, MediaType.AUDIO);
            } else {
                player.connect(webEndpoint);
            }
            String offer = webEndpoint.generateOffer();
            running = true;
            for (IceCandidate candidate : candidates) {
                webEndpoint.addIceCandidate(candidate);
            }
            candidates.clear();
            player.play();
            log.info("PIPELINE {}: started (audioOnly={}, framerate={}, audioBitrate={})", name,
                    audioOnly, framerate, audioBitrate);
            PipelineEventListener listener = eventListener;
            if (listener != null) {
                listener.onLocalSdp("offer", offer);
            }
            webEndpoint.gatherCandidates();
        } catch (RuntimeException e) {
            release();
            if (e instanceof GatewayException) {
                throw e;
            }
            throw new GatewayException(Code.MEDIA_PIPELINE_ERROR_CODE,
                    "Unable to start pipeline " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void stop() {
        if (!running && pipeline == null) {
            return;
        }
        log.info("PIPELINE {}: stopping", name);
        release();
    }

    private void release() {
        running = false;
        candidates.clear();
        MediaPipeline current = pipeline;
        pipeline = null;
        player = null;
        webEndpoint = null;
        if (current != null) {
            try {
                current.release();
            } catch (RuntimeException e) {
                log.warn("PIPELINE {}: error releasing media pipeline: {}", name, e.getMessage());
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void setVideoBitrate(int kbps) {
        this.videoBitrate = kbps;
        if (running && webEndpoint != null) {
            webEndpoint.setMaxVideoSendBandwidth(kbps);
        }
    }

    @Override
    public void setAudioBitrate(int bitsPerSecond) {
        this.audioBitrate = bitsPerSecond;
    }

    @Override
    public void setFramerate(int fps) {
        this.framerate = fps;
    }

    @Override
    public void addTurnServer(String turnUri) {
        if (webEndpoint == null) {
            log.debug("PIPELINE {}: not running, TURN server {} not added", name, hideCredentials(turnUri));
            return;
        }
        log.info("PIPELINE {}: adding TURN server {}", name, hideCredentials(turnUri));
        webEndpoint.setTurnUrl(toKurentoTurnUrl(turnUri));
    }

    @Override
    public void setIceServers(List<String> stunUris, List<String> turnUris) {
        this.stunUris = new ArrayList<String>(stunUris);
        this.turnUris = new ArrayList<String>(turnUris);
    }

    private void applyIceServers() {
        if (!stunUris.isEmpty()) {
            URI stun = URI.create(stunUris.get(0));
            webEndpoint.setStunServerAddress(resolve(stun.getHost()));
            webEndpoint.setStunServerPort(stun.getPort());
        }
        if (!turnUris.isEmpty()) {
            webEndpoint.setTurnUrl(toKurentoTurnUrl(turnUris.get(0)));
        }
    }

    @Override
    public void sendRemoteResolution(String resolution) {
        log.trace("PIPELINE {}: remote resolution {} not sent, no data channel", name, resolution);
    }

    @Override
    public void sendCursorData(String data) {
        log.trace("PIPELINE {}: cursor data not sent, no data channel", name);
    }

    @Override
    public void sendFramerate(int fps) {
        log.trace("PIPELINE {}: framerate {} not sent, no data channel", name, fps);
    }

    @Override
    public void sendVideoBitrate(int kbps) {
        log.trace("PIPELINE {}: video bitrate {} not sent, no data channel", name, kbps);
    }

    @Override
    public void sendAudioBitrate(int bitsPerSecond) {
        log.trace("PIPELINE {}: audio bitrate {} not sent, no data channel", name, bitsPerSecond);
    }

    @Override
    public void sendResizeEnabled(boolean enabled) {
        log.trace("PIPELINE {}: resize enabled={} not sent, no data channel", name, enabled);
    }

    @Override
    public void sendEncoder(String encoder) {
        log.trace("PIPELINE {}: encoder {} not sent, no data channel", name, encoder);
    }

    @Override
    public void sendGpuStats(double load, long memoryTotal, long memoryUsed) {
        log.trace("PIPELINE {}: gpu stats load={} used={}/{}", name, load, memoryUsed, memoryTotal);
    }

    @Override
    public void sendSystemStats(double cpuPercent, long memoryTotal, long memoryUsed) {
        log.trace("PIPELINE {}: system stats cpu={}% used={}/{}", name, cpuPercent, memoryUsed,
                memoryTotal);
    }

    @Override
    public void sendPing(long timestampMillis) {
        log.trace("PIPELINE {}: ping {}", name, timestampMillis);
    }

    @Override
    public void sendLatency(long latencyMillis) {
        log.trace("PIPELINE {}: latency {}ms", name, latencyMillis);
    }

    @Override
    public void setSdp(String type, String sdp) throws GatewayException {
        if (webEndpoint == null) {
            throw new GatewayException(Code.MEDIA_PIPELINE_ERROR_CODE,
                    "Can't process " + type + " when WebRtcEndpoint is null (pipeline: " + name + ")");
        }
        if ("answer".equals(type)) {
            log.info("PIPELINE {}: processing SDP answer", name);
            webEndpoint.processAnswer(sdp);
        } else if ("offer".equals(type)) {
            log.info("PIPELINE {}: processing SDP offer", name);
            String answer = webEndpoint.processOffer(sdp);
            PipelineEventListener listener = eventListener;
            if (listener != null) {
                listener.onLocalSdp("answer", answer);
            }
        } else {
            throw new GatewayException(Code.MEDIA_PIPELINE_ERROR_CODE,
                    "Unsupported SDP type '" + type + "'");
        }
    }

    @Override
    public void setIce(IceCandidate candidate) throws GatewayException {
        if (webEndpoint == null) {
            candidates.add(candidate);
        } else {
            webEndpoint.addIceCandidate(candidate);
        }
    }

    @Override
    public void setEventListener(PipelineEventListener listener) {
        this.eventListener = listener;
    }

    int getPendingCandidateCount() {
        return candidates.size();
    }

    private EventListener<ErrorEvent> errorListener() {
        return new EventListener<ErrorEvent>() {
            @Override
            public void onEvent(ErrorEvent event) {
                log.error("PIPELINE {}: media error {}: {}", name, event.getErrorCode(),
                        event.getDescription());
                PipelineEventListener listener = eventListener;
                if (listener != null) {
                    listener.onPipelineError(new GatewayException(Code.MEDIA_PIPELINE_ERROR_CODE,
                            event.getDescription()));
                }
            }
        };
    }

    /**
     * Converts {@code turn(s)://user:password@host:port} into the
     * {@code user:password@host:port[?transport=tls]} form of {@link WebRtcEndpoint#setTurnUrl}.
     */
    static String toKurentoTurnUrl(String turnUri) {
        if (turnUri.startsWith("turns://")) {
            return turnUri.substring("turns://".length()) + "?transport=tls";
        }
        if (turnUri.startsWith("turn://")) {
            return turnUri.substring("turn://".length());
        }
        throw new GatewayException(Code.CONFIG_FORMAT_ERROR_CODE, "Not a TURN uri: " + turnUri);
    }

    static String hideCredentials(String turnUri) {
        int at = turnUri.lastIndexOf('@');
        int scheme = turnUri.indexOf("://");
        if (at < 0 || scheme < 0) {
            return turnUri;
        }
        return turnUri.substring(0, scheme + 3) + "***@" + turnUri.substring(at + 1);
    }

    private static String resolve(String host) {
        try {
            return InetAddress.getByName(host).getHostAddress();
        } catch (UnknownHostException e) {
            log.warn("Unable to resolve STUN server {}, using it as is", host);
            return host;
        }
    }
}
