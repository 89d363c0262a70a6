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

/**
 * Gives the media pipelines a {@link KurentoClient} without them knowing where the media server
 * runs.
 */
public interface KurentoClientProvider {

  /**
   * @return the {@link KurentoClient} instance
   * @throws GatewayException with {@link GatewayException.Code#MEDIA_PIPELINE_ERROR_CODE} in case
   *                          there is an error obtaining a {@link KurentoClient} instance
   */
  KurentoClient getKurentoClient() throws GatewayException;
}
