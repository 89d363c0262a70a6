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

package org.kurento.gateway.exception;

/**
 * Unchecked exception raised by the gateway negotiation layer. The {@link Code} tells the caller
 * whether the condition is transient (peer absent), local to one credential source, or terminal
 * for the current signaling session.
 */
public class GatewayException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public static enum Code {
    GENERIC_ERROR_CODE(999),

    CONFIG_FORMAT_ERROR_CODE(101),
    CREDENTIAL_FETCH_ERROR_CODE(102),
    CREDENTIAL_SOURCE_ERROR_CODE(103),

    SIGNALING_PEER_ABSENT_ERROR_CODE(201),
    SIGNALING_FATAL_ERROR_CODE(202),
    ROUTING_ERROR_CODE(203),

    MEDIA_PIPELINE_ERROR_CODE(301);

    private int value;

    private Code(int value) {
      this.value = value;
    }

    public int getValue() {
      return this.value;
    }
  }

  private Code code = Code.GENERIC_ERROR_CODE;

  public GatewayException(Code code, String message) {
    super(message);
    this.code = code;
  }

  public GatewayException(Code code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public int getCodeValue() {
    return code.getValue();
  }

  @Override
  public String toString() {
    return "Code: " + getCodeValue() + " " + super.toString();
  }
}
