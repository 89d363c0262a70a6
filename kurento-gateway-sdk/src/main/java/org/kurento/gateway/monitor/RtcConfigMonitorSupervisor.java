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

package org.kurento.gateway.monitor;

import org.kurento.gateway.internal.BackgroundService;
import org.kurento.gateway.internal.EventLoop;
import org.kurento.gateway.internal.NamedThreadFactory;
import org.kurento.gateway.rtc.CoturnWebClient;
import org.kurento.gateway.rtc.RtcConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs every credential adapter on its own worker thread and hands each configuration they
 * produce to the listener on the negotiation {@link EventLoop}.
 */
public class RtcConfigMonitorSupervisor implements BackgroundService {
    private static final Logger log = LoggerFactory.getLogger(RtcConfigMonitorSupervisor.class);

    private static final long STOP_TIMEOUT_SECONDS = 5;

    private final List<RtcConfigMonitor> monitors;
    private final EventLoop loop;

    private ExecutorService workers;

    public RtcConfigMonitorSupervisor(List<RtcConfigMonitor> monitors, EventLoop loop,
                                      final RtcConfigListener listener) {
        this.monitors = Collections.unmodifiableList(new ArrayList<RtcConfigMonitor>(monitors));
        this.loop = loop;
        for (final RtcConfigMonitor monitor : this.monitors) {
            monitor.setListener(new RtcConfigListener() {
                @Override
                public void onRtcConfig(final RtcConfig config) {
                    log.info("Sending refreshed {} RTC config", monitor.getName());
                    RtcConfigMonitorSupervisor.this.loop.execute(new Runnable() {
                        @Override
                        public void run() {
                            listener.onRtcConfig(config);
                        }
                    });
                }
            });
        }
    }

    /**
     * Builds the three adapters. Only the one matching {@code active} is enabled.
     */
    public static List<RtcConfigMonitor> createMonitors(CredentialSettings settings,
                                                        CredentialSource.Type active,
                                                        CoturnWebClient client, Clock clock) {
        List<RtcConfigMonitor> monitors = new ArrayList<RtcConfigMonitor>();
        monitors.add(new HmacRtcConfigMonitor(settings.getTurnHost(), settings.getTurnPort(),
                settings.getTurnSharedSecret(), settings.getCoturnWebUsername(),
                settings.getTurnProtocol(), settings.isTurnTls(), settings.getPeriodSeconds(),
                active == CredentialSource.Type.HMAC, clock));
        monitors.add(new CoturnRtcConfigMonitor(client, settings.getCoturnWebUri(),
                settings.getCoturnWebUsername(), settings.getCoturnAuthHeaderName(),
                settings.getPeriodSeconds(), active == CredentialSource.Type.REST_API, clock));
        String file = settings.getRtcConfigFile();
        if (file == null || file.trim().isEmpty()) {
            file = CredentialSettings.DEFAULT_RTC_CONFIG_FILE;
        }
        monitors.add(new FileRtcConfigMonitor(Paths.get(file),
                active == CredentialSource.Type.STATIC_FILE));
        return monitors;
    }

    public List<RtcConfigMonitor> getMonitors() {
        return monitors;
    }

    @Override
    public synchronized void start() {
        if (workers != null || monitors.isEmpty()) {
            return;
        }
        workers = Executors.newFixedThreadPool(monitors.size(), new NamedThreadFactory("rtc-monitor"));
        for (final RtcConfigMonitor monitor : monitors) {
            workers.submit(new Runnable() {
                @Override
                public void run() {
                    try {
                        monitor.start();
                    } catch (RuntimeException e) {
                        log.error("{} RTC monitor terminated unexpectedly", monitor.getName(), e);
                    }
                }
            });
        }
        log.debug("Started {} RTC monitors", monitors.size());
    }

    @Override
    public synchronized void stop() {
        for (RtcConfigMonitor monitor : monitors) {
            monitor.stop();
        }
        if (workers == null) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("RTC monitors did not stop in {}s, interrupting", STOP_TIMEOUT_SECONDS);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        workers = null;
    }
}
