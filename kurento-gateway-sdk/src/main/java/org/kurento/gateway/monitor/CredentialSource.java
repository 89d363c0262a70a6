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

import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.exception.GatewayException.Code;
import org.kurento.gateway.rtc.CoturnWebClient;
import org.kurento.gateway.rtc.RtcConfig;
import org.kurento.gateway.rtc.RtcConfigCodec;
import org.kurento.gateway.rtc.TurnCredentials;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * The single credential source the process uses, resolved once at startup. Each variant carries
 * only the parameters it needs and knows how to produce its first configuration.
 */
public abstract class CredentialSource {

    public static enum Type {
        STATIC_FILE, HMAC, LEGACY_STATIC, REST_API, DEFAULT
    }

    private final Type type;

    protected CredentialSource(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    /**
     * Produces the initial configuration of this source.
     */
    public abstract RtcConfig load(CoturnWebClient client, Clock clock) throws GatewayException;

    public static CredentialSource staticFile(Path path) {
        return new StaticFile(path);
    }

    public static CredentialSource hmac(CredentialSettings settings) {
        return new Hmac(settings.getTurnHost(), settings.getTurnPort(),
                settings.getTurnSharedSecret(), settings.getCoturnWebUsername(),
                settings.getTurnProtocol(), settings.isTurnTls());
    }

    public static CredentialSource legacyStatic(CredentialSettings settings) {
        return new LegacyStatic(settings.getTurnHost(), settings.getTurnPort(),
                settings.getTurnUsername(), settings.getTurnPassword(), settings.getTurnProtocol(),
                settings.isTurnTls());
    }

    public static CredentialSource restApi(CredentialSettings settings) {
        return new RestApi(settings.getCoturnWebUri(), settings.getCoturnWebUsername(),
                settings.getCoturnAuthHeaderName());
    }

    public static CredentialSource defaults() {
        return new Default();
    }

    public static final class StaticFile extends CredentialSource {
        private final Path path;

        private StaticFile(Path path) {
            super(Type.STATIC_FILE);
            this.path = path;
        }

        public Path getPath() {
            return path;
        }

        @Override
        public RtcConfig load(CoturnWebClient client, Clock clock) {
            try {
                return RtcConfigCodec.decode(
                        new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new GatewayException(Code.CREDENTIAL_SOURCE_ERROR_CODE,
                        "Unable to read RTC config file " + path, e);
            }
        }

        @Override
        public String toString() {
            return "StaticFile{" + path + "}";
        }
    }

    public static final class Hmac extends CredentialSource {
        private final String host;
        private final int port;
        private final String secret;
        private final String user;
        private final String protocol;
        private final boolean tls;

        private Hmac(String host, int port, String secret, String user, String protocol,
                     boolean tls) {
            super(Type.HMAC);
            this.host = host;
            this.port = port;
            this.secret = secret;
            this.user = user;
            this.protocol = protocol;
            this.tls = tls;
        }

        @Override
        public RtcConfig load(CoturnWebClient client, Clock clock) {
            String username = TurnCredentials.ephemeralUsername(user,
                    clock.instant().plus(TurnCredentials.DEFAULT_LIFETIME));
            return RtcConfigCodec.decode(
                    RtcConfigCodec.encodeHmac(host, port, secret, username, protocol, tls));
        }

        @Override
        public String toString() {
            return "Hmac{" + host + ":" + port + ", user=" + user + ", protocol=" + protocol
                    + ", tls=" + tls + "}";
        }
    }

    public static final class LegacyStatic extends CredentialSource {
        private final String host;
        private final int port;
        private final String username;
        private final String password;
        private final String protocol;
        private final boolean tls;

        private LegacyStatic(String host, int port, String username, String password,
                             String protocol, boolean tls) {
            super(Type.LEGACY_STATIC);
            this.host = host;
            this.port = port;
            this.username = username;
            this.password = password;
            this.protocol = protocol;
            this.tls = tls;
        }

        @Override
        public RtcConfig load(CoturnWebClient client, Clock clock) {
            return RtcConfigCodec.decode(
                    RtcConfigCodec.encodeStatic(host, port, username, password, protocol, tls));
        }

        @Override
        public String toString() {
            return "LegacyStatic{" + host + ":" + port + ", user=" + username + "}";
        }
    }

    public static final class RestApi extends CredentialSource {
        private final String uri;
        private final String username;
        private final String authHeaderName;

        private RestApi(String uri, String username, String authHeaderName) {
            super(Type.REST_API);
            this.uri = uri;
            this.username = username;
            this.authHeaderName = authHeaderName;
        }

        @Override
        public RtcConfig load(CoturnWebClient client, Clock clock) {
            return client.fetch(uri, username, authHeaderName);
        }

        @Override
        public String toString() {
            return "RestApi{" + uri + ", " + authHeaderName + "=" + username + "}";
        }
    }

    public static final class Default extends CredentialSource {

        private Default() {
            super(Type.DEFAULT);
        }

        @Override
        public RtcConfig load(CoturnWebClient client, Clock clock) {
            return RtcConfigCodec.decode(RtcConfigCodec.defaultDocument());
        }

        @Override
        public String toString() {
            return "Default{public STUN only}";
        }
    }
}
