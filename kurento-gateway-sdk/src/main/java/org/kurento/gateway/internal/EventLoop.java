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

import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The negotiation context. Every signaling callback, pipeline event and credential refresh is
 * executed here, one task at a time, so session state needs no locking.
 */
public interface EventLoop extends Executor {

    /**
     * Queues a task for execution on the loop.
     */
    @Override
    void execute(Runnable task);

    /**
     * Runs a task on the loop after the given delay, without blocking the loop meanwhile.
     */
    ScheduledFuture<?> schedule(Runnable task, long delay, TimeUnit unit);

    /**
     * Stops accepting tasks. Tasks already queued still run.
     */
    void shutdown();
}
