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

import java.util.List;

/**
 * A media pipeline owned by the session supervisor, either the video or the audio one. All
 * methods are invoked from the negotiation loop.
 */
public interface PipelineHandle {

  /**
   * Builds the media elements and starts producing a local offer, reported through
   * {@link PipelineEventListener#onLocalSdp(String, String)}.
   *
   * @param audioOnly true for the audio pipeline
   * @throws GatewayException with {@link GatewayException.Code#MEDIA_PIPELINE_ERROR_CODE}
   */
  void start(boolean audioOnly) throws GatewayException;

  /**
   * Releases the media elements. Calling it on a stopped pipeline has no effect.
   */
  void stop();

  boolean isRunning();

  void setVideoBitrate(int kbps);

  void setAudioBitrate(int bitsPerSecond);

  void setFramerate(int fps);

  /**
   * Tells the viewer the resolution the display was resized to, "WxH".
   */
  void sendRemoteResolution(String resolution);

  /**
   * Adds a TURN server to a running pipeline without renegotiating.
   *
   * @param turnUri {@code turn(s)://user:password@host:port}, credentials percent-encoded
   */
  void addTurnServer(String turnUri);

  /**
   * Replaces the STUN/TURN servers used by the next offer.
   */
  void setIceServers(List<String> stunUris, List<String> turnUris);

  void sendCursorData(String data);

  void sendFramerate(int fps);

  void sendVideoBitrate(int kbps);

  void sendAudioBitrate(int bitsPerSecond);

  void sendResizeEnabled(boolean enabled);

  void sendEncoder(String encoder);

  void sendGpuStats(double load, long memoryTotal, long memoryUsed);

  void sendSystemStats(double cpuPercent, long memoryTotal, long memoryUsed);

  void sendPing(long timestampMillis);

  void sendLatency(long latencyMillis);

  /**
   * Remote session description received from the viewer.
   */
  void setSdp(String type, String sdp) throws GatewayException;

  void setIce(IceCandidate candidate) throws GatewayException;

  void setEventListener(PipelineEventListener listener);
}
