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

package org.kurento.gateway.internal;

/**
 * A service running on its own worker thread(s), started and stopped by the session supervisor.
 */
public interface BackgroundService {

    /**
     * Starts the worker threads and returns immediately.
     */
    void start();

    /**
     * Requests the workers to stop and waits a bounded time for them. Workers observe the request
     * at their next poll, so this may take up to one poll interval.
     */
    void stop();
}
