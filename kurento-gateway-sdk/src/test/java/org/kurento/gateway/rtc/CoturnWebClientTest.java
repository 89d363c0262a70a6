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

package org.kurento.gateway.rtc;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.kurento.gateway.exception.CredentialFetchException;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class CoturnWebClientTest {

  private MockWebServer server;
  private CoturnWebClient client;

  @Before
  public void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    client = new CoturnWebClient(new OkHttpClient());
  }

  @After
  public void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  public void fetchSendsAuthHeaderAndDecodesBody() throws Exception {
    server.enqueue(new MockResponse().setBody(
        "{\"iceServers\":[{\"urls\":[\"turn:relay.example.com:3478\"],\"username\":\"u\","
            + "\"credential\":\"p\"}]}"));

    RtcConfig config = client.fetch(server.url("/").toString(), "host-1", "x-auth-user");

    assertEquals(Arrays.asList("turn://u:p@relay.example.com:3478"), config.getTurnUris());
    RecordedRequest request = server.takeRequest();
    assertEquals("GET", request.getMethod());
    assertEquals("host-1", request.getHeader("x-auth-user"));
  }

  @Test
  public void forbiddenRaisesFetchErrorWithStatus() {
    server.enqueue(new MockResponse().setResponseCode(403).setBody("denied"));

    try {
      client.fetch(server.url("/").toString(), "host-1", "x-auth-user");
      fail("Expected CredentialFetchException");
    } catch (CredentialFetchException e) {
      assertEquals(403, e.getStatus());
      assertEquals("denied", e.getBody());
    }
  }

  @Test
  public void emptyBodyRaisesFetchError() {
    server.enqueue(new MockResponse().setResponseCode(200));

    try {
      client.fetch(server.url("/").toString(), "host-1", "x-auth-user");
      fail("Expected CredentialFetchException");
    } catch (CredentialFetchException e) {
      assertEquals(200, e.getStatus());
      assertEquals("", e.getBody());
    }
  }

  @Test
  public void unreachableServiceRaisesFetchErrorWithoutStatus() throws Exception {
    String uri = server.url("/").toString();
    server.shutdown();

    try {
      client.fetch(uri, "host-1", "x-auth-user");
      fail("Expected CredentialFetchException");
    } catch (CredentialFetchException e) {
      assertEquals(-1, e.getStatus());
    }
  }

  @Test
  public void invalidUriRaisesFetchError() {
    try {
      client.fetch("", "host-1", "x-auth-user");
      fail("Expected CredentialFetchException");
    } catch (CredentialFetchException e) {
      assertEquals(-1, e.getStatus());
    }
  }
}
