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

/**
 * Immutable RTC configuration document, as served to browsers and read from the RTC config file.
 *
 * <pre>
 * {"iceServers":[{"urls":[...], "username"?, "credential"?}],
 *  "lifetimeDuration": "86400s", "blockStatus": "NOT_BLOCKED", "iceTransportPolicy": "all"}
 * </pre>
 */
public final class IceServerDescriptor {
  public static final String DEFAULT_LIFETIME_DURATION = "86400s";
  public static final String NOT_BLOCKED = "NOT_BLOCKED";
  public static final String POLICY_ALL = "all";

  private final List<IceServer> iceServers;
  private final String lifetimeDuration;
  private final String blockStatus;
  private final String iceTransportPolicy;

  public IceServerDescriptor(List<IceServer> iceServers) {
    this(iceServers, DEFAULT_LIFETIME_DURATION, NOT_BLOCKED, POLICY_ALL);
  }

  public IceServerDescriptor(List<IceServer> iceServers, String lifetimeDuration,
                             String blockStatus, String iceTransportPolicy) {
    this.iceServers = Collections.unmodifiableList(new ArrayList<IceServer>(iceServers));
    this.lifetimeDuration = lifetimeDuration;
    this.blockStatus = blockStatus;
    this.iceTransportPolicy = iceTransportPolicy;
  }

  public List<IceServer> getIceServers() {
    return iceServers;
  }

  public String getLifetimeDuration() {
    return lifetimeDuration;
  }

  public String getBlockStatus() {
    return blockStatus;
  }

  public String getIceTransportPolicy() {
    return iceTransportPolicy;
  }

  @Override
  public String toString() {
    return "IceServerDescriptor{" +
        "iceServers=" + iceServers +
        ", lifetimeDuration='" + lifetimeDuration + '\'' +
        ", blockStatus='" + blockStatus + '\'' +
        ", iceTransportPolicy='" + iceTransportPolicy + '\'' +
        '}';
  }
}
