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

package org.kurento.gateway.session;

import org.kurento.client.IceCandidate;
import org.kurento.gateway.exception.GatewayException;
import org.kurento.gateway.internal.EventLoop;
import org.kurento.gateway.pipeline.PipelineEventListener;
import org.kurento.gateway.signaling.SignalingChannel;

/**
 * Pumps the local SDP and ICE of a pipeline into its signaling channel, on the loop. Data channel
 * readiness goes to the supervisor, also on the loop.
 */
class ChannelPipelineBridge implements PipelineEventListener {
  private final SignalingChannel channel;
  private final EventLoop loop;
  private final SessionSupervisor supervisor;

  ChannelPipelineBridge(SignalingChannel channel, EventLoop loop, SessionSupervisor supervisor) {
    this.channel = channel;
    this.loop = loop;
    this.supervisor = supervisor;
  }

  @Override
  public void onLocalSdp(final String type, final String sdp) {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        channel.sendSdp(type, sdp);
      }
    });
  }

  @Override
  public void onLocalIceCandidate(final IceCandidate candidate) {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        channel.sendIce(candidate);
      }
    });
  }

  @Override
  public void onPipelineError(GatewayException error) {
    channel.reportError(error);
  }

  @Override
  public void onDataChannelOpen() {
    loop.execute(new Runnable() {
      @Override
      public void run() {
        supervisor.onDataChannelOpen(channel);
      }
    });
  }
}
