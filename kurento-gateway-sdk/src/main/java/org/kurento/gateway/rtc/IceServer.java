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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One entry of the {@code iceServers} array of an RTC configuration document.
 */
public final class IceServer {
  private final List<String> urls;
  private final String username;
  private final String credential;

  public IceServer(List<String> urls) {
    this(urls, null, null);
  }

  public IceServer(List<String> urls, String username, String credential) {
    this.urls = Collections.unmodifiableList(new ArrayList<String>(urls));
    this.username = username;
    this.credential = credential;
  }

  public List<String> getUrls() {
    return urls;
  }

  /**
   * @return the TURN username, or null for STUN-only entries
   */
  public String getUsername() {
    return username;
  }

  /**
   * @return the TURN credential, or null for STUN-only entries
   */
  public String getCredential() {
    return credential;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IceServer)) {
      return false;
    }
    IceServer that = (IceServer) o;
    return urls.equals(that.urls) && Objects.equals(username, that.username)
        && Objects.equals(credential, that.credential);
  }

  @Override
  public int hashCode() {
    return Objects.hash(urls, username, credential);
  }

  @Override
  public String toString() {
    return "IceServer{" +
        "urls=" + urls +
        ", username='" + username + '\'' +
        '}';
  }
}
