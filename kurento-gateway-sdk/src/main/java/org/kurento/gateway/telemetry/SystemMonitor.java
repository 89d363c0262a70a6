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

package org.kurento.gateway.telemetry;

import org.kurento.gateway.internal.BackgroundService;
import org.kurento.gateway.internal.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;

/**
 * Samples system CPU load and memory usage on its own thread every period.
 */
public class SystemMonitor implements BackgroundService {
  private static final Logger log = LoggerFactory.getLogger(SystemMonitor.class);

  public static final long DEFAULT_PERIOD_MILLIS = 1000;

  private final long periodMillis;
  private final boolean enabled;
  private final com.sun.management.OperatingSystemMXBean os;

  private volatile TelemetryListener listener;
  private volatile boolean stopRequested = false;
  private Thread worker;

  public SystemMonitor(long periodMillis, boolean enabled) {
    this.periodMillis = periodMillis;
    this.enabled = enabled;
    this.os = (com.sun.management.OperatingSystemMXBean) ManagementFactory
        .getOperatingSystemMXBean();
  }

  public void setListener(TelemetryListener listener) {
    this.listener = listener;
  }

  public boolean isEnabled() {
    return enabled;
  }

  @Override
  public synchronized void start() {
    if (!enabled || worker != null) {
      return;
    }
    stopRequested = false;
    worker = new NamedThreadFactory("system-monitor").newThread(new Runnable() {
      @Override
      public void run() {
        loop();
      }
    });
    worker.start();
  }

  @Override
  public synchronized void stop() {
    stopRequested = true;
    if (worker == null) {
      return;
    }
    try {
      worker.join(periodMillis * 2);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (worker.isAlive()) {
      log.warn("System monitor did not stop in time");
    }
    worker = null;
  }

  /**
   * Takes one sample and hands it to the listener.
   */
  public void sample() {
    TelemetryListener current = listener;
    if (current == null) {
      return;
    }
    double load = os.getCpuLoad();
    double cpuPercent = load < 0 ? 0 : load * 100;
    long total = os.getTotalMemorySize();
    long used = total - os.getFreeMemorySize();
    current.onSystemStats(cpuPercent, total, used, System.currentTimeMillis());
  }

  private void loop() {
    log.info("System monitor started");
    while (!stopRequested) {
      try {
        sample();
      } catch (RuntimeException e) {
        log.warn("Error sampling system stats: {}", e.getMessage());
      }
      try {
        Thread.sleep(periodMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    log.info("System monitor stopped");
  }
}
