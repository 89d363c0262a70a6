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

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.kurento.gateway.exception.CredentialFetchException;
import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.rtc.CoturnWebClient;
import org.kurento.gateway.rtc.RtcConfig;
import org.kurento.gateway.rtc.RtcConfigCodec;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class CredentialSourceResolverTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private CoturnWebClient client;
    private CredentialSourceResolver resolver;
    private CredentialSettings settings;

    @Before
    public void setUp() {
        client = mock(CoturnWebClient.class);
        resolver = new CredentialSourceResolver(client,
                new MutableClock(Instant.ofEpochSecond(1700000000L)));
        settings = new CredentialSettings();
        settings.setRtcConfigFile(new File(folder.getRoot(), "rtc.json").getPath());
        settings.setCoturnWebUri("http://localhost:8081");
        settings.setCoturnWebUsername("host-1");
    }

    @Test
    public void existingFileWinsOverEverything() throws Exception {
        File file = folder.newFile("existing.json");
        settings.setRtcConfigFile(file.getPath());
        settings.setTurnHost("turn.example.com");
        settings.setTurnPort(3478);
        settings.setTurnSharedSecret("secret");

        assertEquals(CredentialSource.Type.STATIC_FILE, resolver.resolve(settings).getType());
    }

    @Test
    public void sharedSecretSelectsHmac() {
        settings.setTurnHost("turn.example.com");
        settings.setTurnPort(3478);
        settings.setTurnSharedSecret("secret");
        settings.setTurnUsername("legacy");
        settings.setTurnPassword("pass");

        assertEquals(CredentialSource.Type.HMAC, resolver.resolve(settings).getType());
    }

    @Test
    public void sharedSecretWithoutTurnHostIsRejected() {
        settings.setTurnSharedSecret("secret");
        settings.setTurnPort(3478);

        assertSourceError();
    }

    @Test
    public void legacyCredentialsSelectLegacyStatic() {
        settings.setTurnHost("turn.example.com");
        settings.setTurnPort(3478);
        settings.setTurnUsername("legacy");
        settings.setTurnPassword("pass");

        assertEquals(CredentialSource.Type.LEGACY_STATIC, resolver.resolve(settings).getType());
    }

    @Test
    public void legacyCredentialsWithoutTurnPortAreRejected() {
        settings.setTurnHost("turn.example.com");
        settings.setTurnUsername("legacy");
        settings.setTurnPassword("pass");

        assertSourceError();
    }

    @Test
    public void usernameWithoutPasswordFallsThroughToRest() {
        settings.setTurnUsername("legacy");

        assertEquals(CredentialSource.Type.REST_API, resolver.resolve(settings).getType());
    }

    @Test
    public void bootstrapLoadsStaticFile() throws Exception {
        File file = folder.newFile("static.json");
        Files.write(file.toPath(), ("{\"iceServers\":[{\"urls\":[\"turn:relay.example.com:3478\"],"
                + "\"username\":\"u\",\"credential\":\"p\"}]}").getBytes(StandardCharsets.UTF_8));
        settings.setRtcConfigFile(file.getPath());

        CredentialSourceResolver.Resolution resolution = resolver.bootstrap(settings);

        assertEquals(CredentialSource.Type.STATIC_FILE, resolution.getSource().getType());
        assertEquals(Arrays.asList("turn://u:p@relay.example.com:3478"),
                resolution.getInitialConfig().getTurnUris());
    }

    @Test
    public void bootstrapGeneratesHmacCredentials() {
        settings.setTurnHost("turn.example.com");
        settings.setTurnPort(3478);
        settings.setTurnSharedSecret("secret");

        RtcConfig config = resolver.bootstrap(settings).getInitialConfig();

        assertEquals(1, config.getTurnUris().size());
        assertTrue(config.getTurnUris().get(0).startsWith("turn://1700086400%3Ahost-1:"));
    }

    @Test
    public void bootstrapFallsBackToDefaultWhenRestFails() {
        when(client.fetch(anyString(), anyString(), anyString()))
                .thenThrow(new CredentialFetchException(500, "Internal Server Error", "oops"));

        CredentialSourceResolver.Resolution resolution = resolver.bootstrap(settings);

        assertEquals(CredentialSource.Type.DEFAULT, resolution.getSource().getType());
        assertEquals(RtcConfigCodec.decode(RtcConfigCodec.defaultDocument()),
                resolution.getInitialConfig());
    }

    @Test
    public void bootstrapUsesRestConfig() {
        RtcConfig fetched = new RtcConfig(Collections.singletonList("stun://a.example.com:3478"),
                Collections.<String>emptyList(), "{}");
        when(client.fetch("http://localhost:8081", "host-1", "x-auth-user")).thenReturn(fetched);

        CredentialSourceResolver.Resolution resolution = resolver.bootstrap(settings);

        assertEquals(CredentialSource.Type.REST_API, resolution.getSource().getType());
        assertEquals(fetched, resolution.getInitialConfig());
    }

    @Test
    public void malformedStaticFileFailsBootstrap() throws Exception {
        File file = folder.newFile("broken.json");
        Files.write(file.toPath(), "[]".getBytes(StandardCharsets.UTF_8));
        settings.setRtcConfigFile(file.getPath());

        try {
            resolver.bootstrap(settings);
            fail("Expected a format error");
        } catch (GatewayException e) {
            assertEquals(GatewayException.Code.CONFIG_FORMAT_ERROR_CODE, e.getCode());
        }
        verify(client, never()).fetch(anyString(), anyString(), anyString());
    }

    private void assertSourceError() {
        try {
            resolver.resolve(settings);
            fail("Expected a credential source error");
        } catch (GatewayException e) {
            assertEquals(GatewayException.Code.CREDENTIAL_SOURCE_ERROR_CODE, e.getCode());
        }
    }
}
