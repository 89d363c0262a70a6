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

package org.kurento.gateway;

import okhttp3.OkHttpClient;
import org.kurento.gateway.internal.EventLoop;
import org.kurento.gateway.internal.SingleThreadEventLoop;
import org.kurento.gateway.kms.FixedKurentoClientProvider;
import org.kurento.gateway.kms.KurentoClientProvider;
import org.kurento.gateway.kms.KurentoPipelineHandle;
import org.kurento.gateway.monitor.CredentialSettings;
import org.kurento.gateway.monitor.CredentialSourceResolver;
import org.kurento.gateway.monitor.RtcConfigMonitorSupervisor;
import org.kurento.gateway.rtc.CoturnWebClient;
import org.kurento.gateway.rtc.RtcConfigHolder;
import org.kurento.gateway.session.DisplayController;
import org.kurento.gateway.session.SessionSupervisor;
import org.kurento.gateway.signaling.WebSocketSignalingTransport;
import org.kurento.gateway.telemetry.SystemMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Wires the gateway from {@code gateway.properties}. Every key can be overridden by a system
 * property or by the matching environment variable, e.g. {@code turn.host} by {@code TURN_HOST}.
 */
@Configuration
@PropertySource("classpath:gateway.properties")
public class GatewayConfig {
    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Value("${port:8080}")
    private int port;

    @Value("${enable.https:false}")
    private boolean enableHttps;

    @Value("${signaling.uri:}")
    private String signalingUri;

    @Value("${enable.basic.auth:true}")
    private boolean enableBasicAuth;

    @Value("${basic.auth.user:}")
    private String basicAuthUser;

    @Value("${basic.auth.password:}")
    private String basicAuthPassword;

    @Value("${coturn.web.uri:}")
    private String coturnWebUri;

    @Value("${coturn.web.username:gateway}")
    private String coturnWebUsername;

    @Value("${coturn.auth.header.name:x-auth-user}")
    private String coturnAuthHeaderName;

    @Value("${rtc.config.json:/tmp/rtc.json}")
    private String rtcConfigJson;

    @Value("${turn.host:}")
    private String turnHost;

    @Value("${turn.port:}")
    private String turnPort;

    @Value("${turn.protocol:udp}")
    private String turnProtocol;

    @Value("${turn.tls:false}")
    private boolean turnTls;

    @Value("${turn.shared.secret:}")
    private String turnSharedSecret;

    @Value("${turn.username:}")
    private String turnUsername;

    @Value("${turn.password:}")
    private String turnPassword;

    @Value("${rtc.monitor.period.seconds:60}")
    private long monitorPeriodSeconds;

    @Value("${kms.uri:ws://localhost:8888/kurento}")
    private String kmsUri;

    @Value("${media.source.uri:}")
    private String mediaSourceUri;

    @Value("${app.auto.init:true}")
    private boolean appAutoInit;

    @Value("${app.ready.file:/var/run/appconfig/appready}")
    private String appReadyFile;

    @Value("${webrtc.framerate:30}")
    private int framerate;

    @Value("${webrtc.video.bitrate:2000}")
    private int videoBitrate;

    @Value("${webrtc.audio.bitrate:64000}")
    private int audioBitrate;

    @Value("${webrtc.encoder:vp8}")
    private String encoder;

    @Value("${webrtc.enable.resize:false}")
    private boolean enableResize;

    @Value("${display.initial.resolution:1920x1080}")
    private String initialResolution;

    @Value("${system.monitor.period.ms:1000}")
    private long systemMonitorPeriodMillis;

    @Value("${signaling.video.local.id:0}")
    private int videoLocalId;

    @Value("${signaling.video.peer.id:1}")
    private int videoPeerId;

    @Value("${signaling.audio.local.id:2}")
    private int audioLocalId;

    @Value("${signaling.audio.peer.id:3}")
    private int audioPeerId;

    @Value("${session.max.iterations:0}")
    private int maxIterations;

    @Value("${session.restart.delay.ms:1000}")
    private long restartDelayMillis;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventLoop negotiationLoop() {
        return new SingleThreadEventLoop("negotiation");
    }

    @Bean
    public OkHttpClient httpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .pingInterval(20, TimeUnit.SECONDS)
                .build();
    }

    @Bean
    public CoturnWebClient coturnWebClient(OkHttpClient httpClient) {
        return new CoturnWebClient(httpClient);
    }

    @Bean
    public CredentialSettings credentialSettings() {
        CredentialSettings settings = new CredentialSettings();
        settings.setRtcConfigFile(rtcConfigJson);
        settings.setTurnHost(turnHost);
        settings.setTurnPort(parsePort(turnPort));
        settings.setTurnProtocol(turnProtocol);
        settings.setTurnTls(turnTls);
        settings.setTurnSharedSecret(turnSharedSecret);
        settings.setTurnUsername(turnUsername);
        settings.setTurnPassword(turnPassword);
        settings.setCoturnWebUri(coturnWebUri);
        settings.setCoturnWebUsername(coturnWebUsername);
        settings.setCoturnAuthHeaderName(coturnAuthHeaderName);
        settings.setPeriodSeconds(monitorPeriodSeconds);
        log.debug("Credential settings: {}", settings);
        return settings;
    }

    @Bean
    public CredentialSourceResolver credentialSourceResolver(CoturnWebClient coturnWebClient,
                                                             Clock clock) {
        return new CredentialSourceResolver(coturnWebClient, clock);
    }

    @Bean
    public CredentialSourceResolver.Resolution rtcConfigResolution(
            CredentialSourceResolver resolver, CredentialSettings settings) {
        return resolver.bootstrap(settings);
    }

    @Bean
    public RtcConfigHolder rtcConfigHolder(CredentialSourceResolver.Resolution resolution) {
        return new RtcConfigHolder(resolution.getInitialConfig());
    }

    @Bean
    public KurentoClientProvider kurentoClientProvider() {
        return new FixedKurentoClientProvider(kmsUri);
    }

    @Bean
    public KurentoPipelineHandle videoPipeline(KurentoClientProvider kurentoClientProvider) {
        return new KurentoPipelineHandle("video", kurentoClientProvider, mediaSourceUri);
    }

    @Bean
    public KurentoPipelineHandle audioPipeline(KurentoClientProvider kurentoClientProvider) {
        return new KurentoPipelineHandle("audio", kurentoClientProvider, mediaSourceUri);
    }

    @Bean
    public SystemMonitor systemMonitor() {
        return new SystemMonitor(systemMonitorPeriodMillis, true);
    }

    @Bean
    public DisplayController displayController() {
        return new VirtualDisplayController(initialResolution);
    }

    @Bean
    public AppReadyWaiter appReadyWaiter() {
        return new AppReadyWaiter(appAutoInit, appReadyFile);
    }

    @Bean
    public SessionSupervisor sessionSupervisor(EventLoop negotiationLoop, OkHttpClient httpClient,
                                               CoturnWebClient coturnWebClient,
                                               CredentialSettings settings,
                                               CredentialSourceResolver.Resolution resolution,
                                               RtcConfigHolder rtcConfigHolder,
                                               @Qualifier("videoPipeline") KurentoPipelineHandle videoPipeline,
                                               @Qualifier("audioPipeline") KurentoPipelineHandle audioPipeline,
                                               SystemMonitor systemMonitor,
                                               DisplayController displayController,
                                               Clock clock) {
        String uri = getSignalingUri();
        String user = enableBasicAuth ? basicAuthUser : null;
        String password = enableBasicAuth ? basicAuthPassword : null;
        log.info("Signaling server {}, credential source {}", uri, resolution.getSource());
        return SessionSupervisor.builder()
                .loop(negotiationLoop)
                .video(new WebSocketSignalingTransport(httpClient, uri, videoLocalId, user, password),
                        videoPipeline)
                .audio(new WebSocketSignalingTransport(httpClient, uri, audioLocalId, user, password),
                        audioPipeline)
                .videoPeers(videoLocalId, videoPeerId)
                .audioPeers(audioLocalId, audioPeerId)
                .monitors(RtcConfigMonitorSupervisor.createMonitors(settings,
                        resolution.getSource().getType(), coturnWebClient, clock))
                .initialRtcConfig(resolution.getInitialConfig())
                .rtcConfigHolder(rtcConfigHolder)
                .systemMonitor(systemMonitor)
                .resize(enableResize, displayController)
                .encoding(videoBitrate, audioBitrate, framerate)
                .encoder(encoder)
                .maxIterations(maxIterations)
                .restartDelayMillis(restartDelayMillis)
                .build();
    }

    /**
     * @return the configured signaling uri, or the relay on the local listen port
     */
    String getSignalingUri() {
        if (signalingUri != null && !signalingUri.trim().isEmpty()) {
            return signalingUri.trim();
        }
        return (enableHttps ? "wss" : "ws") + "://127.0.0.1:" + port + "/ws";
    }

    static int parsePort(String value) {
        if (value == null || value.trim().isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid TURN port '{}'", value);
            return 0;
        }
    }
}
