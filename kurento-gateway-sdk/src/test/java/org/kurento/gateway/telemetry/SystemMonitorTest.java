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

import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SystemMonitorTest {

  private static class RecordingListener implements TelemetryListener {
    private final CountDownLatch samples;
    private volatile double cpuPercent = -1;
    private volatile long memoryTotal;
    private volatile long memoryUsed;
    private volatile long timestamp;

    RecordingListener(int expected) {
      this.samples = new CountDownLatch(expected);
    }

    @Override
    public void onSystemStats(double cpuPercent, long memoryTotal, long memoryUsed,
        long timestampMillis) {
      this.cpuPercent = cpuPercent;
      this.memoryTotal = memoryTotal;
      this.memoryUsed = memoryUsed;
      this.timestamp = timestampMillis;
      samples.countDown();
    }
  }

  @Test
  public void sampleReportsCpuAndMemory() {
    SystemMonitor monitor = new SystemMonitor(1000, true);
    RecordingListener listener = new RecordingListener(1);
    monitor.setListener(listener);
    long before = System.currentTimeMillis();

    monitor.sample();

    assertEquals(0, listener.samples.getCount());
    assertTrue(listener.cpuPercent >= 0 && listener.cpuPercent <= 100);
    assertTrue(listener.memoryTotal > 0);
    assertTrue(listener.memoryUsed >= 0 && listener.memoryUsed <= listener.memoryTotal);
    assertTrue(listener.timestamp >= before);
  }

  @Test
  public void samplesPeriodicallyUntilStopped() throws InterruptedException {
    SystemMonitor monitor = new SystemMonitor(20, true);
    RecordingListener listener = new RecordingListener(3);
    monitor.setListener(listener);

    monitor.start();
    try {
      assertTrue(listener.samples.await(5, TimeUnit.SECONDS));
    } finally {
      monitor.stop();
    }
  }

  @Test
  public void disabledMonitorNeverSamples() throws InterruptedException {
    SystemMonitor monitor = new SystemMonitor(10, false);
    RecordingListener listener = new RecordingListener(1);
    monitor.setListener(listener);

    monitor.start();
    Thread.sleep(100);
    monitor.stop();

    assertEquals(1, listener.samples.getCount());
  }
}
