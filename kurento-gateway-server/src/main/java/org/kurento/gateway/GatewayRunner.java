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

import org.kurento.gateway.session.SessionSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs the session supervisor of an application context and closes the context when it returns.
 * {@link #stop(long)} is meant for the JVM shutdown hook: it returns once the context is closed.
 */
class GatewayRunner {
    private static final Logger log = LoggerFactory.getLogger(GatewayRunner.class);

    private final ConfigurableApplicationContext context;
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile SessionSupervisor supervisor;

    GatewayRunner(ConfigurableApplicationContext context) {
        this.context = context;
    }

    int run() {
        try {
            context.getBean(AppReadyWaiter.class).await();
            supervisor = context.getBean(SessionSupervisor.class);
            return supervisor.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        } catch (RuntimeException e) {
            log.error("Gateway failed", e);
            return 1;
        } finally {
            context.close();
            finished.countDown();
        }
    }

    /**
     * Asks the supervisor to stop and waits until the context has been closed.
     *
     * @return false if the context was not closed in time
     */
    boolean stop(long timeoutSeconds) {
        SessionSupervisor current = supervisor;
        if (current != null) {
            current.requestStop();
        }
        try {
            return finished.await(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    boolean isFinished() {
        return finished.getCount() == 0;
    }
}
