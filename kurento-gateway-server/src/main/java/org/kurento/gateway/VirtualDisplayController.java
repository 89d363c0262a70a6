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

import org.kurento.gateway.session.DisplayController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Display of a media source whose geometry is decided by the gateway itself, as is the case for
 * a player source that is scaled by the pipeline.
 */
public class VirtualDisplayController implements DisplayController {
    private static final Logger log = LoggerFactory.getLogger(VirtualDisplayController.class);

    private volatile String resolution;
    private volatile int dpi = 96;
    private volatile int cursorSize = 16;

    public VirtualDisplayController(String initialResolution) {
        this.resolution = initialResolution;
    }

    @Override
    public String currentResolution() {
        return resolution;
    }

    @Override
    public boolean resize(String resolution) {
        log.debug("Display resolution {} -> {}", this.resolution, resolution);
        this.resolution = resolution;
        return true;
    }

    @Override
    public boolean setDpi(int dpi) {
        this.dpi = dpi;
        return true;
    }

    @Override
    public boolean setCursorSize(int size) {
        this.cursorSize = size;
        return true;
    }

    public int getDpi() {
        return dpi;
    }

    public int getCursorSize() {
        return cursorSize;
    }
}
