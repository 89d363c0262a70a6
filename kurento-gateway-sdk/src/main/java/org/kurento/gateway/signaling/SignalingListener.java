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

package org.kurento.gateway.signaling;

import org.kurento.client.IceCandidate;
import org.kurento.gateway.exception.GatewayException;

/**
 * Events emitted by a {@link SignalingTransport}. Implementations must not assume the calling
 * thread.
 */
public interface SignalingListener {

  void onConnect();

  void onDisconnect();

  /**
   * @param error {@link GatewayException.Code#SIGNALING_PEER_ABSENT_ERROR_CODE} if the requested
   *              peer is not registered with the relay yet, any other code is fatal for the
   *              current connection
   */
  void onError(GatewayException error);

  void onSdp(String type, String sdp);

  void onIce(IceCandidate candidate);

  /**
   * The relay paired this connection with {@code peerId}.
   */
  void onSession(int peerId, SessionMetadata metadata);
}
