package com.calcsheet.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

public class VerificationStatus {

    public enum State {
        UNVERIFIED("unverified"),
        PENDING("pending"),
        VERIFIED("verified"),
        FAILED("failed");

        private final String wireName;

        State(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }
    }

    private State status;
    private String reason;
    private String timestamp;
    private String engineVersion;

    public VerificationStatus() {
        this.status = State.UNVERIFIED;
    }

    private VerificationStatus(State status, String reason, String timestamp, String engineVersion) {
        this.status = status;
        this.reason = reason;
        this.timestamp = timestamp;
        this.engineVersion = engineVersion;
    }

    public static VerificationStatus unverified() {
        return new VerificationStatus();
    }

    public static VerificationStatus pending() {
        return new VerificationStatus(State.PENDING, null, null, null);
    }

    public static VerificationStatus verified(String engineVersion) {
        return new VerificationStatus(State.VERIFIED, null, Instant.now().toString(), engineVersion);
    }

    public static VerificationStatus failed(String reason) {
        return new VerificationStatus(State.FAILED, reason, Instant.now().toString(), null);
    }

    public State getStatus() {
        return status;
    }

    public void setStatus(State status) {
        this.status = status;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getEngineVersion() {
        return engineVersion;
    }

    public void setEngineVersion(String engineVersion) {
        this.engineVersion = engineVersion;
    }
}
