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

import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.exception.GatewayException.Code;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Ephemeral TURN credentials as defined by the coturn "TURN REST API": the username is
 * {@code <expiry-epoch-seconds>:<user>} and the password is
 * {@code base64(HMAC-SHA1(shared-secret, username))}.
 */
public final class TurnCredentials {
  public static final Duration DEFAULT_LIFETIME = Duration.ofHours(24);

  private static final String HMAC_ALGORITHM = "HmacSHA1";

  private TurnCredentials() {
  }

  /**
   * @param user   the account name; any ':' is replaced by '-' since ':' separates the expiry
   * @param expiry the instant after which the TURN server rejects the credential
   * @return the ephemeral username {@code "<expiry-epoch-seconds>:<user>"}
   */
  public static String ephemeralUsername(String user, Instant expiry) {
    return expiry.getEpochSecond() + ":" + user.replace(":", "-");
  }

  public static String hmacCredential(String secret, String username) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      byte[] digest = mac.doFinal(username.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(digest);
    } catch (GeneralSecurityException e) {
      throw new GatewayException(Code.CREDENTIAL_SOURCE_ERROR_CODE,
          "Unable to compute HMAC TURN credential", e);
    }
  }
}
