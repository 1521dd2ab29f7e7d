package com.dnssentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A single DNS query observation as produced by a collector.
 *
 * <p>
 * Instances are immutable. The numeric {@code status} follows the Pi-hole FTL
 * convention (2 = forwarded, 3 = cached, 1 and 4..11 = blocked variants).
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class QueryRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Status codes that denote a blocked query. */
    private static final Set<Integer> BLOCKED_STATUSES = Set.of(1, 4, 5, 6, 7, 8, 9, 10, 11);

    /** Status used by {@link #of(Instant, String, String)}: forwarded upstream. */
    public static final int STATUS_FORWARDED = 2;

    private final Instant timestamp;
    private final String client;
    private final String domain;
    private final String queryType;
    private final int status;
    private final String hardwareAddress;

    @JsonCreator
    public QueryRecord(@JsonProperty("timestamp") Instant timestamp,
                       @JsonProperty("client") String client,
                       @JsonProperty("domain") String domain,
                       @JsonProperty("queryType") String queryType,
                       @JsonProperty("status") int status,
                       @JsonProperty("hardwareAddress") String hardwareAddress) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.queryType = queryType != null ? queryType : "A";
        this.status = status;
        this.hardwareAddress = hardwareAddress;
    }

    /**
     * Shorthand for a forwarded {@code A} query without a hardware address.
     */
    public static QueryRecord of(Instant timestamp, String client, String domain) {
        return new QueryRecord(timestamp, client, domain, "A", STATUS_FORWARDED, null);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getClient() {
        return client;
    }

    public String getDomain() {
        return domain;
    }

    public String getQueryType() {
        return queryType;
    }

    public int getStatus() {
        return status;
    }

    /**
     * @return the client's hardware address, or {@code null} when the collector
     *         did not resolve one
     */
    public String getHardwareAddress() {
        return hardwareAddress;
    }

    /**
     * @return domain lower-cased with {@link Locale#ROOT}, the form used for all
     *         per-domain statistics
     */
    @JsonIgnore
    public String normalizedDomain() {
        return domain.toLowerCase(Locale.ROOT);
    }

    @JsonIgnore
    public boolean isBlocked() {
        return BLOCKED_STATUSES.contains(status);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QueryRecord that))
            return false;
        return status == that.status
                && timestamp.equals(that.timestamp)
                && client.equals(that.client)
                && domain.equals(that.domain)
                && queryType.equals(that.queryType)
                && Objects.equals(hardwareAddress, that.hardwareAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, client, domain, queryType, status, hardwareAddress);
    }

    @Override
    public String toString() {
        return "QueryRecord{" +
                "timestamp=" + timestamp +
                ", client='" + client + '\'' +
                ", domain='" + domain + '\'' +
                ", queryType='" + queryType + '\'' +
                ", status=" + status +
                '}';
    }
}
