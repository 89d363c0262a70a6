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

import org.kurento.gateway.monitor.RtcConfigListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latest RTC configuration, published for viewers that join after a credential refresh. Listeners,
 * such as the relay serving new viewers, are told of every publication on the publishing thread.
 */
public class RtcConfigHolder {
  private static final Logger log = LoggerFactory.getLogger(RtcConfigHolder.class);

  private final AtomicReference<RtcConfig> current = new AtomicReference<RtcConfig>();
  private final List<RtcConfigListener> listeners = new CopyOnWriteArrayList<RtcConfigListener>();

  public RtcConfigHolder() {
  }

  public RtcConfigHolder(RtcConfig initial) {
    current.set(initial);
  }

  public void publish(RtcConfig config) {
    current.set(config);
    for (RtcConfigListener listener : listeners) {
      try {
        listener.onRtcConfig(config);
      } catch (RuntimeException e) {
        log.warn("RTC config listener failed: {}", e.getMessage());
      }
    }
  }

  public void addListener(RtcConfigListener listener) {
    listeners.add(listener);
  }

  public void removeListener(RtcConfigListener listener) {
    listeners.remove(listener);
  }

  public RtcConfig get() {
    return current.get();
  }

  /**
   * @return the raw descriptor document, or null if nothing was published yet
   */
  public String getDocument() {
    RtcConfig config = current.get();
    return config == null ? null : config.getDocument();
  }
}
