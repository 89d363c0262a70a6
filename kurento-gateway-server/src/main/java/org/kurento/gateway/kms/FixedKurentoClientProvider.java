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

package org.kurento.gateway.kms;

import org.kurento.client.KurentoClient;
import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.exception.GatewayException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;

/**
 * Connects to a single media server, on first use.
 */
public class FixedKurentoClientProvider implements KurentoClientProvider {
    private static final Logger log = LoggerFactory.getLogger(FixedKurentoClientProvider.class);

    private final String kmsUri;
    private KurentoClient kurentoClient;

    public FixedKurentoClientProvider(String kmsUri) {
        this.kmsUri = kmsUri;
    }

    @Override
    public synchronized KurentoClient getKurentoClient() throws GatewayException {
        if (kurentoClient == null) {
            try {
                log.info("Connecting to KMS at {}", kmsUri);
                kurentoClient = KurentoClient.create(kmsUri);
            } catch (RuntimeException e) {
                throw new GatewayException(Code.MEDIA_PIPELINE_ERROR_CODE,
                        "Unable to connect to KMS at " + kmsUri + ": " + e.getMessage(), e);
            }
        }
        return kurentoClient;
    }

    @PreDestroy
    public synchronized void close() {
        if (kurentoClient != null) {
            log.info("Closing connection to KMS at {}", kmsUri);
            kurentoClient.destroy();
            kurentoClient = null;
        }
    }
}
