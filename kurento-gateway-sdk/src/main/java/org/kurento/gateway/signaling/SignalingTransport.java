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

/**
 * Connection to the signaling relay. A transport can be connected again after it was closed or
 * disconnected; events of a previous connection are not delivered.
 */
public interface SignalingTransport {

  /**
   * Opens a new connection, registering the local id. Completion is reported by
   * {@link SignalingListener#onConnect()}.
   */
  void connect(SignalingListener listener);

  /**
   * Asks the relay to pair this connection with {@code peerId}.
   */
  void setupCall(int peerId);

  void sendSdp(String type, String sdp);

  void sendIce(IceCandidate candidate);

  void close();
}
