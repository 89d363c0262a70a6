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

/**
 * A credential source adapter. {@link #start()} blocks the calling worker thread until
 * {@link #stop()} is called, delivering fresh configurations to the listener meanwhile.
 */
public interface RtcConfigMonitor {

    String getName();

    boolean isEnabled();

    void setListener(RtcConfigListener listener);

    void start();

    void stop();
}
