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

import org.kurento.gateway.rtc.CoturnWebClient;
import org.kurento.gateway.rtc.RtcConfig;

import java.time.Clock;

/**
 * Periodically refetches the RTC configuration from the coturn web service.
 */
public class CoturnRtcConfigMonitor extends AbstractPeriodicRtcConfigMonitor {
    private final CoturnWebClient client;
    private final String uri;
    private final String username;
    private final String authHeaderName;

    public CoturnRtcConfigMonitor(CoturnWebClient client, String uri, String username,
                                  String authHeaderName, long periodSeconds, boolean enabled,
                                  Clock clock) {
        this(client, uri, username, authHeaderName, periodSeconds, enabled, clock,
                DEFAULT_TICK_MILLIS);
    }

    public CoturnRtcConfigMonitor(CoturnWebClient client, String uri, String username,
                                  String authHeaderName, long periodSeconds, boolean enabled,
                                  Clock clock, long tickMillis) {
        super("coturn", periodSeconds, enabled, clock, tickMillis);
        this.client = client;
        this.uri = uri;
        this.username = username;
        this.authHeaderName = authHeaderName;
    }

    @Override
    protected RtcConfig fetch() {
        return client.fetch(uri, username, authHeaderName);
    }
}
