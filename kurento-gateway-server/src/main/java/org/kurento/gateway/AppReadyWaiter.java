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

package org.kurento.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Blocks until the streamed application signals it is ready by creating the ready file. Returns
 * at once when the application is auto-initialized.
 */
public class AppReadyWaiter {
    private static final Logger log = LoggerFactory.getLogger(AppReadyWaiter.class);

    static final long POLL_MILLIS = 200;

    private final boolean autoInit;
    private final Path readyFile;

    public AppReadyWaiter(boolean autoInit, String readyFile) {
        this.autoInit = autoInit;
        this.readyFile = Paths.get(readyFile);
    }

    public void await() throws InterruptedException {
        log.info("Waiting for streaming app ready");
        log.debug("autoInit={}, readyFile={}", autoInit, readyFile);
        while (!(autoInit || Files.exists(readyFile))) {
            Thread.sleep(POLL_MILLIS);
        }
    }
}
