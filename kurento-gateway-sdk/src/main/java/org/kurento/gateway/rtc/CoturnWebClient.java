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
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.kurento.gateway.exception.CredentialFetchException;
import org.kurento.gateway.exception.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Fetches the RTC configuration from a coturn web service. The service identifies the caller by
 * a configurable header (for example {@code x-auth-user: <hostname>}) and answers with a
 * complete RTC configuration document.
 */
public class CoturnWebClient {
  private static final Logger log = LoggerFactory.getLogger(CoturnWebClient.class);

  private final OkHttpClient httpClient;

  public CoturnWebClient(OkHttpClient httpClient) {
    this.httpClient = httpClient;
  }

  /**
   * Performs a single GET to {@code uri}.
   *
   * @param uri            coturn web service uri, for example {@code http://localhost:8081/}
   * @param username       value of the auth header
   * @param authHeaderName name of the auth header
   * @return the decoded configuration
   * @throws CredentialFetchException if the request fails, the status is 400 or above, or the
   *                                  body is empty
   * @throws GatewayException         if the body is not a valid RTC configuration
   */
  public RtcConfig fetch(String uri, String username, String authHeaderName)
      throws GatewayException {
    Request request;
    try {
      request = new Request.Builder()
          .url(uri)
          .header(authHeaderName, username)
          .get()
          .build();
    } catch (IllegalArgumentException e) {
      throw new CredentialFetchException("Invalid coturn web uri '" + uri + "'", e);
    }

    log.debug("Request [FETCH_RTC_CONFIG] uri={} {}={}", uri, authHeaderName, username);
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String data = body != null ? body.string() : "";
      if (response.code() >= 400) {
        throw new CredentialFetchException(response.code(), response.message(), data);
      }
      if (data.isEmpty()) {
        throw new CredentialFetchException(response.code(),
            "data from coturn web service was empty", data);
      }
      return RtcConfigCodec.decode(data);
    } catch (IOException e) {
      throw new CredentialFetchException("Could not reach coturn web service at " + uri, e);
    }
  }
}
