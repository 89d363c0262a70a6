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

import org.kurento.gateway.exception.CredentialFetchException;
import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.exception.GatewayException.Code;
import org.kurento.gateway.rtc.CoturnWebClient;
import org.kurento.gateway.rtc.RtcConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Chooses the credential source by precedence: an existing RTC config file, then an HMAC shared
 * secret, then legacy long-term TURN credentials, then the coturn web service.
 */
public class CredentialSourceResolver {
    private static final Logger log = LoggerFactory.getLogger(CredentialSourceResolver.class);

    private final CoturnWebClient client;
    private final Clock clock;

    public CredentialSourceResolver(CoturnWebClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    /**
     * @throws GatewayException with {@link Code#CREDENTIAL_SOURCE_ERROR_CODE} if TURN credentials
     *                          are given without TURN host and port
     */
    public CredentialSource resolve(CredentialSettings settings) throws GatewayException {
        String file = settings.getRtcConfigFile();
        if (!isEmpty(file)) {
            Path path = Paths.get(file);
            if (Files.exists(path)) {
                log.warn("Using file for RTC config: {}", path);
                return CredentialSource.staticFile(path);
            }
        }
        if (!isEmpty(settings.getTurnSharedSecret())) {
            requireTurnEndpoint(settings);
            return CredentialSource.hmac(settings);
        }
        if (!isEmpty(settings.getTurnUsername()) && !isEmpty(settings.getTurnPassword())) {
            requireTurnEndpoint(settings);
            log.warn("using legacy non-HMAC TURN credentials.");
            return CredentialSource.legacyStatic(settings);
        }
        return CredentialSource.restApi(settings);
    }

    /**
     * Resolves the source and loads its first configuration. When the coturn web service cannot
     * be reached at startup the public STUN default is used and no source is monitored.
     */
    public Resolution bootstrap(CredentialSettings settings) throws GatewayException {
        CredentialSource source = resolve(settings);
        RtcConfig config;
        try {
            config = source.load(client, clock);
        } catch (CredentialFetchException e) {
            if (source.getType() != CredentialSource.Type.REST_API) {
                throw e;
            }
            log.warn("error fetching coturn RTC config, using default RTC config: {}",
                    e.getMessage());
            source = CredentialSource.defaults();
            config = source.load(client, clock);
        }
        log.info("initial server RTC config from {}: {}", source, config);
        return new Resolution(source, config);
    }

    private static void requireTurnEndpoint(CredentialSettings settings) {
        if (isEmpty(settings.getTurnHost()) || settings.getTurnPort() <= 0) {
            throw new GatewayException(Code.CREDENTIAL_SOURCE_ERROR_CODE,
                    "missing turn host and turn port");
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static class Resolution {
        private final CredentialSource source;
        private final RtcConfig initialConfig;

        public Resolution(CredentialSource source, RtcConfig initialConfig) {
            this.source = source;
            this.initialConfig = initialConfig;
        }

        public CredentialSource getSource() {
            return source;
        }

        public RtcConfig getInitialConfig() {
            return initialConfig;
        }
    }
}
