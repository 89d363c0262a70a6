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

package org.kurento.gateway.monitor;

/**
 * Raw credential parameters as configured for the process. Which of them matter is decided once
 * by {@link CredentialSourceResolver}.
 */
public class CredentialSettings {
    public static final long DEFAULT_PERIOD_SECONDS = 60;
    public static final String DEFAULT_RTC_CONFIG_FILE = "/tmp/rtc.json";

    private String rtcConfigFile = DEFAULT_RTC_CONFIG_FILE;
    private String turnHost;
    private int turnPort;
    private String turnProtocol = "udp";
    private boolean turnTls;
    private String turnSharedSecret;
    private String turnUsername;
    private String turnPassword;
    private String coturnWebUri;
    private String coturnWebUsername;
    private String coturnAuthHeaderName = "x-auth-user";
    private long periodSeconds = DEFAULT_PERIOD_SECONDS;

    public String getRtcConfigFile() {
        return rtcConfigFile;
    }

    public void setRtcConfigFile(String rtcConfigFile) {
        this.rtcConfigFile = rtcConfigFile;
    }

    public String getTurnHost() {
        return turnHost;
    }

    public void setTurnHost(String turnHost) {
        this.turnHost = turnHost;
    }

    public int getTurnPort() {
        return turnPort;
    }

    public void setTurnPort(int turnPort) {
        this.turnPort = turnPort;
    }

    /**
     * @return "tcp" if configured so, "udp" otherwise
     */
    public String getTurnProtocol() {
        return "tcp".equalsIgnoreCase(turnProtocol) ? "tcp" : "udp";
    }

    public void setTurnProtocol(String turnProtocol) {
        this.turnProtocol = turnProtocol;
    }

    public boolean isTurnTls() {
        return turnTls;
    }

    public void setTurnTls(boolean turnTls) {
        this.turnTls = turnTls;
    }

    public String getTurnSharedSecret() {
        return turnSharedSecret;
    }

    public void setTurnSharedSecret(String turnSharedSecret) {
        this.turnSharedSecret = turnSharedSecret;
    }

    public String getTurnUsername() {
        return turnUsername;
    }

    public void setTurnUsername(String turnUsername) {
        this.turnUsername = turnUsername;
    }

    public String getTurnPassword() {
        return turnPassword;
    }

    public void setTurnPassword(String turnPassword) {
        this.turnPassword = turnPassword;
    }

    public String getCoturnWebUri() {
        return coturnWebUri;
    }

    public void setCoturnWebUri(String coturnWebUri) {
        this.coturnWebUri = coturnWebUri;
    }

    /**
     * Also used as the user part of HMAC generated credentials.
     */
    public String getCoturnWebUsername() {
        return coturnWebUsername;
    }

    public void setCoturnWebUsername(String coturnWebUsername) {
        this.coturnWebUsername = coturnWebUsername;
    }

    public String getCoturnAuthHeaderName() {
        return coturnAuthHeaderName;
    }

    public void setCoturnAuthHeaderName(String coturnAuthHeaderName) {
        this.coturnAuthHeaderName = coturnAuthHeaderName;
    }

    public long getPeriodSeconds() {
        return periodSeconds;
    }

    public void setPeriodSeconds(long periodSeconds) {
        this.periodSeconds = periodSeconds;
    }

    @Override
    public String toString() {
        return "CredentialSettings{" +
                "rtcConfigFile='" + rtcConfigFile + '\'' +
                ", turnHost='" + turnHost + '\'' +
                ", turnPort=" + turnPort +
                ", turnProtocol='" + getTurnProtocol() + '\'' +
                ", turnTls=" + turnTls +
                ", coturnWebUri='" + coturnWebUri + '\'' +
                ", coturnWebUsername='" + coturnWebUsername + '\'' +
                ", periodSeconds=" + periodSeconds +
                '}';
    }
}
