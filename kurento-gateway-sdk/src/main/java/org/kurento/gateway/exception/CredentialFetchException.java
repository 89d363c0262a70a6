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
 * Transport or HTTP failure while fetching an RTC configuration from a coturn web service.
 * Status is {@code -1} when no HTTP response was received at all.
 */
public class CredentialFetchException extends GatewayException {

  private static final long serialVersionUID = 1L;

  private final int status;
  private final String reason;
  private final String body;

  public CredentialFetchException(int status, String reason, String body) {
    super(Code.CREDENTIAL_FETCH_ERROR_CODE,
        "error fetching coturn web config. Status code: " + status + ". " + reason + ", " + body);
    this.status = status;
    this.reason = reason;
    this.body = body;
  }

  public CredentialFetchException(String message, Throwable cause) {
    super(Code.CREDENTIAL_FETCH_ERROR_CODE, message, cause);
    this.status = -1;
    this.reason = cause.getMessage();
    this.body = null;
  }

  public int getStatus() {
    return status;
  }

  public String getReason() {
    return reason;
  }

  public String getBody() {
    return body;
  }
}
