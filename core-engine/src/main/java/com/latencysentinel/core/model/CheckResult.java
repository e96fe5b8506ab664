package com.latencysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single probe result handed over by the check scheduler.
 *
 * <p>
 * Only the fields the detection engine cares about are modelled; any other
 * property in the scheduler's JSON payload is ignored.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code serviceId} and {@code status} are required;
 * {@code checkedAt} defaults to the build instant. A {@code null}
 * {@code responseTimeMs} means the probe produced no latency measurement
 * (typically a connection failure).
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CheckResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String serviceId;
    private final CheckStatus status;
    private final Double responseTimeMs;
    private final Instant checkedAt;

    @JsonCreator
    CheckResult(@JsonProperty("serviceId") String serviceId,
            @JsonProperty("status") CheckStatus status,
            @JsonProperty("responseTimeMs") Double responseTimeMs,
            @JsonProperty("checkedAt") Instant checkedAt) {
        this.serviceId = Objects.requireNonNull(serviceId, "serviceId must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.responseTimeMs = responseTimeMs;
        this.checkedAt = checkedAt != null ? checkedAt : Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String serviceId;
        private CheckStatus status;
        private Double responseTimeMs;
        private Instant checkedAt;

        public Builder serviceId(String serviceId) {
            this.serviceId = serviceId;
            return this;
        }

        public Builder status(CheckStatus status) {
            this.status = status;
            return this;
        }

        public Builder responseTimeMs(Double responseTimeMs) {
            this.responseTimeMs = responseTimeMs;
            return this;
        }

        public Builder checkedAt(Instant checkedAt) {
            this.checkedAt = checkedAt;
            return this;
        }

        /**
         * @return a new {@link CheckResult}
         * @throws NullPointerException if {@code serviceId} or {@code status} is
         *                              {@code null}
         */
        public CheckResult build() {
            return new CheckResult(serviceId, status, responseTimeMs, checkedAt);
        }
    }

    @JsonProperty("serviceId")
    public String getServiceId() {
        return serviceId;
    }

    @JsonProperty("status")
    public CheckStatus getStatus() {
        return status;
    }

    /**
     * @return the measured latency in milliseconds, or {@code null} if the
     *         probe did not produce one
     */
    @JsonProperty("responseTimeMs")
    public Double getResponseTimeMs() {
        return responseTimeMs;
    }

    public boolean hasResponseTime() {
        return responseTimeMs != null;
    }

    @JsonProperty("checkedAt")
    public Instant getCheckedAt() {
        return checkedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CheckResult that))
            return false;
        return Objects.equals(serviceId, that.serviceId)
                && status == that.status
                && Objects.equals(responseTimeMs, that.responseTimeMs)
                && Objects.equals(checkedAt, that.checkedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceId, status, responseTimeMs, checkedAt);
    }

    @Override
    public String toString() {
        return "CheckResult{" +
                "serviceId='" + serviceId + '\'' +
                ", status=" + status +
                ", responseTimeMs=" + responseTimeMs +
                ", checkedAt=" + checkedAt +
                '}';
    }
}
