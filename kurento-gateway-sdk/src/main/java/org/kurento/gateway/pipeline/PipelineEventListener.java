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

package org.kurento.gateway.pipeline;

import org.kurento.client.IceCandidate;
import org.kurento.gateway.exception.GatewayException;

/**
 * Events raised by a {@link PipelineHandle}. May be called from any thread.
 */
public interface PipelineEventListener {

  void onLocalSdp(String type, String sdp);

  void onLocalIceCandidate(IceCandidate candidate);

  void onPipelineError(GatewayException error);

  /**
   * The viewer's data channel is open, messages sent from now on reach it.
   */
  void onDataChannelOpen();
}
