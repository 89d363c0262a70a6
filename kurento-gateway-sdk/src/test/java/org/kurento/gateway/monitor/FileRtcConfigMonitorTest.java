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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.kurento.gateway.rtc.RtcConfig;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FileRtcConfigMonitorTest {

    private static final String DOCUMENT =
            "{\"iceServers\":[{\"urls\":[\"stun:stun.example.com:3478\"]}]}";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final List<RtcConfig> received = new CopyOnWriteArrayList<RtcConfig>();

    private void write(File file, String content) throws Exception {
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
    }

    private FileRtcConfigMonitor monitor(File file, boolean enabled) {
        FileRtcConfigMonitor monitor = new FileRtcConfigMonitor(file.toPath(), enabled, 50);
        monitor.setListener(new RtcConfigListener() {
            @Override
            public void onRtcConfig(RtcConfig config) {
                received.add(config);
            }
        });
        return monitor;
    }

    @Test
    public void reloadDeliversParsedFile() throws Exception {
        File file = new File(folder.getRoot(), "rtc.json");
        write(file, DOCUMENT);

        assertTrue(monitor(file, true).reload());

        assertEquals(1, received.size());
        assertEquals(Arrays.asList("stun://stun.example.com:3478"), received.get(0).getStunUris());
    }

    @Test
    public void malformedFileIsSkipped() throws Exception {
        File file = new File(folder.getRoot(), "rtc.json");
        write(file, "{\"iceServers\": ");

        assertFalse(monitor(file, true).reload());
        assertTrue(received.isEmpty());
    }

    @Test
    public void missingFileIsSkipped() {
        assertFalse(monitor(new File(folder.getRoot(), "absent.json"), true).reload());
        assertTrue(received.isEmpty());
    }

    @Test(timeout = 5000)
    public void disabledMonitorDoesNotWatch() throws Exception {
        File file = new File(folder.getRoot(), "rtc.json");
        FileRtcConfigMonitor monitor = monitor(file, false);

        monitor.start();
        write(file, DOCUMENT);

        assertTrue(received.isEmpty());
    }

    @Test(timeout = 30000)
    public void writeToWatchedFileIsDelivered() throws Exception {
        File file = new File(folder.getRoot(), "rtc.json");
        final CountDownLatch delivered = new CountDownLatch(1);
        final FileRtcConfigMonitor monitor = new FileRtcConfigMonitor(file.toPath(), true, 50);
        monitor.setListener(new RtcConfigListener() {
            @Override
            public void onRtcConfig(RtcConfig config) {
                received.add(config);
                delivered.countDown();
            }
        });
        Thread worker = new Thread(new Runnable() {
            @Override
            public void run() {
                monitor.start();
            }
        });
        worker.start();
        try {
            // writing to another file of the directory is ignored
            write(new File(folder.getRoot(), "other.json"), DOCUMENT);
            while (delivered.getCount() > 0) {
                write(file, DOCUMENT);
                delivered.await(500, TimeUnit.MILLISECONDS);
            }
        } finally {
            monitor.stop();
            worker.join();
        }
        assertEquals(Arrays.asList("stun://stun.example.com:3478"), received.get(0).getStunUris());
    }
}
