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

import org.kurento.gateway.rtc.RtcConfig;
import org.kurento.gateway.rtc.RtcConfigCodec;
import org.kurento.gateway.rtc.TurnCredentials;

import java.time.Clock;

/**
 * Periodically regenerates ephemeral TURN credentials from the shared secret, each valid for
 * {@link TurnCredentials#DEFAULT_LIFETIME} from the moment of generation.
 */
public class HmacRtcConfigMonitor extends AbstractPeriodicRtcConfigMonitor {
    private final Clock clock;
    private final String turnHost;
    private final int turnPort;
    private final String sharedSecret;
    private final String user;
    private final String protocol;
    private final boolean tls;

    public HmacRtcConfigMonitor(String turnHost, int turnPort, String sharedSecret, String user,
                                String protocol, boolean tls, long periodSeconds, boolean enabled,
                                Clock clock) {
        this(turnHost, turnPort, sharedSecret, user, protocol, tls, periodSeconds, enabled, clock,
                DEFAULT_TICK_MILLIS);
    }

    public HmacRtcConfigMonitor(String turnHost, int turnPort, String sharedSecret, String user,
                                String protocol, boolean tls, long periodSeconds, boolean enabled,
                                Clock clock, long tickMillis) {
        super("HMAC", periodSeconds, enabled, clock, tickMillis);
        this.clock = clock;
        this.turnHost = turnHost;
        this.turnPort = turnPort;
        this.sharedSecret = sharedSecret;
        this.user = user;
        this.protocol = protocol;
        this.tls = tls;
    }

    @Override
    protected RtcConfig fetch() {
        String username = TurnCredentials.ephemeralUsername(user,
                clock.instant().plus(TurnCredentials.DEFAULT_LIFETIME));
        return RtcConfigCodec.decode(
                RtcConfigCodec.encodeHmac(turnHost, turnPort, sharedSecret, username, protocol, tls));
    }
}
