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

import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.rtc.RtcConfig;
import org.kurento.gateway.rtc.RtcConfigCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.TimeUnit;

/**
 * Watches the RTC config JSON file and re-reads it whenever it is written. A file that cannot be
 * read or parsed is logged and skipped until the next write.
 */
public class FileRtcConfigMonitor implements RtcConfigMonitor {
    private static final Logger log = LoggerFactory.getLogger(FileRtcConfigMonitor.class);

    public static final long DEFAULT_POLL_MILLIS = 500;

    private final Path rtcFile;
    private final boolean enabled;
    private final long pollMillis;

    private volatile RtcConfigListener listener;
    private volatile boolean stopRequested = false;

    public FileRtcConfigMonitor(Path rtcFile, boolean enabled) {
        this(rtcFile, enabled, DEFAULT_POLL_MILLIS);
    }

    public FileRtcConfigMonitor(Path rtcFile, boolean enabled, long pollMillis) {
        this.rtcFile = rtcFile.toAbsolutePath();
        this.enabled = enabled;
        this.pollMillis = pollMillis;
    }

    @Override
    public String getName() {
        return "RTC config file";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    public Path getRtcFile() {
        return rtcFile;
    }

    @Override
    public void setListener(RtcConfigListener listener) {
        this.listener = listener;
    }

    @Override
    public void start() {
        if (!enabled) {
            log.debug("RTC config file monitor disabled, not watching {}", rtcFile);
            return;
        }
        Path directory = rtcFile.getParent();
        try (WatchService watchService = rtcFile.getFileSystem().newWatchService()) {
            directory.register(watchService, StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
            log.info("Watching RTC config file {}", rtcFile);
            watch(watchService);
        } catch (IOException e) {
            log.error("Unable to watch RTC config file {}: {}", rtcFile, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Watch service for {} closed", rtcFile);
        }
        log.info("RTC config file monitor stopped");
    }

    private void watch(WatchService watchService) throws InterruptedException {
        while (!stopRequested) {
            WatchKey key = watchService.poll(pollMillis, TimeUnit.MILLISECONDS);
            if (key == null) {
                continue;
            }
            boolean changed = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    changed = true;
                    continue;
                }
                Path name = (Path) event.context();
                if (rtcFile.getFileName().equals(name)) {
                    changed = true;
                }
            }
            if (changed) {
                log.info("Detected RTC JSON file change: {}", rtcFile);
                reload();
            }
            if (!key.reset()) {
                log.warn("Directory of RTC config file {} is no longer accessible", rtcFile);
                return;
            }
        }
    }

    @Override
    public void stop() {
        stopRequested = true;
    }

    /**
     * Reads and parses the file once, delivering the result to the listener.
     *
     * @return true if a configuration was delivered
     */
    public boolean reload() {
        try {
            String data = new String(Files.readAllBytes(rtcFile), StandardCharsets.UTF_8);
            RtcConfig config = RtcConfigCodec.decode(data);
            RtcConfigListener current = listener;
            if (current == null) {
                log.warn("RTC config file monitor: unhandled RTC config");
                return false;
            }
            current.onRtcConfig(config);
            return true;
        } catch (IOException | GatewayException e) {
            log.warn("could not read RTC JSON file: {}: {}", rtcFile, e.getMessage());
            return false;
        }
    }
}
