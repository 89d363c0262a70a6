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

import org.junit.Test;
import org.kurento.gateway.rtc.RtcConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PeriodicRtcConfigMonitorTest {

    // 1700000040 is a multiple of 60
    private static final Instant ALIGNED = Instant.ofEpochSecond(1700000040L);

    private final List<RtcConfig> received = new CopyOnWriteArrayList<RtcConfig>();

    private final RtcConfigListener recorder = new RtcConfigListener() {
        @Override
        public void onRtcConfig(RtcConfig config) {
            received.add(config);
        }
    };

    private HmacRtcConfigMonitor hmacMonitor(MutableClock clock, boolean enabled) {
        HmacRtcConfigMonitor monitor = new HmacRtcConfigMonitor("turn.example.com", 3478,
                "secret", "host-1", "udp", false, 60, enabled, clock);
        monitor.setListener(recorder);
        return monitor;
    }

    @Test
    public void disabledMonitorNeverDelivers() {
        MutableClock clock = new MutableClock(ALIGNED);
        HmacRtcConfigMonitor monitor = hmacMonitor(clock, false);

        for (int i = 0; i < 300; i++) {
            assertFalse(monitor.pollIfDue());
            clock.advanceMillis(500);
        }
        assertTrue(received.isEmpty());
    }

    @Test
    public void firesOncePerAlignedSecond() {
        MutableClock clock = new MutableClock(ALIGNED);
        HmacRtcConfigMonitor monitor = hmacMonitor(clock, true);

        assertTrue(monitor.pollIfDue());
        clock.advanceMillis(500);
        assertFalse(monitor.pollIfDue());
        clock.advanceMillis(500);
        assertFalse(monitor.pollIfDue());
        clock.set(ALIGNED.plusSeconds(59));
        assertFalse(monitor.pollIfDue());
        clock.set(ALIGNED.plusSeconds(60));
        assertTrue(monitor.pollIfDue());

        assertEquals(2, received.size());
    }

    @Test
    public void hmacCredentialsExpireOneDayAfterGeneration() {
        MutableClock clock = new MutableClock(ALIGNED);
        HmacRtcConfigMonitor monitor = hmacMonitor(clock, true);

        monitor.pollIfDue();

        RtcConfig config = received.get(0);
        assertEquals(1, config.getTurnUris().size());
        String expiry = String.valueOf(ALIGNED.getEpochSecond() + TimeUnit.DAYS.toSeconds(1));
        assertTrue(config.getTurnUris().get(0),
                config.getTurnUris().get(0).startsWith("turn://" + expiry + "%3Ahost-1:"));
        assertTrue(config.getTurnUris().get(0).endsWith("@turn.example.com:3478"));
    }

    @Test
    public void failedFetchKeepsSchedule() {
        final MutableClock clock = new MutableClock(ALIGNED);
        final List<Integer> attempts = new ArrayList<Integer>();
        AbstractPeriodicRtcConfigMonitor monitor =
                new AbstractPeriodicRtcConfigMonitor("flaky", 60, true, clock, 10) {
                    @Override
                    protected RtcConfig fetch() {
                        attempts.add(attempts.size());
                        if (attempts.size() == 1) {
                            throw new IllegalStateException("service down");
                        }
                        return new RtcConfig(Collections.<String>emptyList(),
                                Collections.<String>emptyList(), "{}");
                    }
                };
        monitor.setListener(recorder);

        assertTrue(monitor.pollIfDue());
        assertTrue(received.isEmpty());
        clock.set(ALIGNED.plusSeconds(60));
        assertTrue(monitor.pollIfDue());

        assertEquals(2, attempts.size());
        assertEquals(1, received.size());
    }

    @Test(timeout = 5000)
    public void startReturnsAfterStop() throws Exception {
        MutableClock clock = new MutableClock(ALIGNED.plusSeconds(1));
        final HmacRtcConfigMonitor monitor = new HmacRtcConfigMonitor("turn.example.com", 3478,
                "secret", "host-1", "udp", false, 60, true, clock, 10);
        Thread worker = new Thread(new Runnable() {
            @Override
            public void run() {
                monitor.start();
            }
        });
        worker.start();

        monitor.stop();
        worker.join();

        assertFalse(worker.isAlive());
    }
}
