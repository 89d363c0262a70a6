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

import org.kurento.gateway.rtc.RtcConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Wall-clock aligned poller: every {@link #DEFAULT_TICK_MILLIS} it checks whether the current
 * epoch second is a multiple of the period and, if so, fetches once. A failed fetch is logged
 * and waits for the next aligned second, so a failure can leave a gap of one full period.
 */
public abstract class AbstractPeriodicRtcConfigMonitor implements RtcConfigMonitor {
    private static final Logger log = LoggerFactory.getLogger(AbstractPeriodicRtcConfigMonitor.class);

    public static final long DEFAULT_TICK_MILLIS = 500;

    private final String name;
    private final long periodSeconds;
    private final boolean enabled;
    private final Clock clock;
    private final long tickMillis;

    private volatile RtcConfigListener listener;
    private volatile boolean stopRequested = false;

    // Only touched by the polling thread
    private long lastPollSecond = -1;

    protected AbstractPeriodicRtcConfigMonitor(String name, long periodSeconds, boolean enabled,
                                               Clock clock, long tickMillis) {
        if (periodSeconds <= 0) {
            throw new IllegalArgumentException("period must be positive: " + periodSeconds);
        }
        this.name = name;
        this.periodSeconds = periodSeconds;
        this.enabled = enabled;
        this.clock = clock;
        this.tickMillis = tickMillis;
    }

    /**
     * Produces one fresh configuration. Any exception is logged by the caller.
     */
    protected abstract RtcConfig fetch();

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    public long getPeriodSeconds() {
        return periodSeconds;
    }

    @Override
    public void setListener(RtcConfigListener listener) {
        this.listener = listener;
    }

    @Override
    public void start() {
        log.info("{} RTC monitor started (enabled={}, period={}s)", name, enabled, periodSeconds);
        while (!stopRequested) {
            pollIfDue();
            try {
                Thread.sleep(tickMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("{} RTC monitor stopped", name);
    }

    @Override
    public void stop() {
        stopRequested = true;
    }

    /**
     * One tick of the schedule.
     *
     * @return true if a fetch was attempted
     */
    public boolean pollIfDue() {
        if (!enabled) {
            return false;
        }
        long second = clock.millis() / 1000;
        if (second % periodSeconds != 0 || second == lastPollSecond) {
            return false;
        }
        lastPollSecond = second;
        try {
            RtcConfig config = fetch();
            RtcConfigListener current = listener;
            if (current == null) {
                log.warn("{} RTC monitor: unhandled RTC config", name);
            } else {
                current.onRtcConfig(config);
            }
        } catch (RuntimeException e) {
            log.warn("could not fetch {} RTC config in periodic monitor: {}", name, e.getMessage());
        }
        return true;
    }
}
