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
import org.springframework.beans.BeansException;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

/**
 * Entry point of the streaming gateway.
 */
public class GatewayApp {
    private static final Logger log = LoggerFactory.getLogger(GatewayApp.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    public static void main(String[] args) {
        System.exit(run());
    }

    static int run() {
        AnnotationConfigApplicationContext context;
        try {
            context = new AnnotationConfigApplicationContext(GatewayConfig.class);
        } catch (BeansException e) {
            Throwable cause = e.getMostSpecificCause();
            log.error("Unable to start gateway: {}", cause.getMessage(), e);
            return 1;
        }
        final GatewayRunner runner = new GatewayRunner(context);
        Runtime.getRuntime().addShutdownHook(new Thread(new Runnable() {
            @Override
            public void run() {
                if (!runner.stop(SHUTDOWN_WAIT_SECONDS)) {
                    log.warn("Gateway did not stop in {}s", SHUTDOWN_WAIT_SECONDS);
                }
            }
        }, "gateway-shutdown"));
        int status = runner.run();
        log.info("Gateway exiting with status {}", status);
        return status;
    }
}
