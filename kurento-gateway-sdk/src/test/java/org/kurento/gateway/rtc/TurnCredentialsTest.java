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

import org.junit.Test;

import java.time.Instant;

import static org.junit.Assert.assertEquals;

public class TurnCredentialsTest {

  @Test
  public void usernameCarriesExpiryAndSanitizedUser() {
    assertEquals("1700000000:user-name",
        TurnCredentials.ephemeralUsername("user:name", Instant.ofEpochSecond(1700000000L)));
  }

  @Test
  public void credentialIsBase64HmacSha1() {
    assertEquals("3nybhbi3iqa8ino29wqQcBydtNk=",
        TurnCredentials.hmacCredential("key", "The quick brown fox jumps over the lazy dog"));
  }
}
