package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Aggregate view of a manufacturer's history. Derived from the entry log and
 * only ever cached, never the source of truth.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ManufacturerProfile {
    private final String manufacturerKey;
    private final int count;
    private final double meanScore;
    private final TrendDirection trend;
    private final Double lastScore;
    private final Instant firstSeen;
    private final Instant lastSeen;

    @JsonCreator
    public ManufacturerProfile(@JsonProperty("manufacturerKey") String manufacturerKey,
                               @JsonProperty("count") int count,
                               @JsonProperty("meanScore") double meanScore,
                               @JsonProperty("trend") TrendDirection trend,
                               @JsonProperty("lastScore") Double lastScore,
                               @JsonProperty("firstSeen") Instant firstSeen,
                               @JsonProperty("lastSeen") Instant lastSeen) {
        this.manufacturerKey = manufacturerKey;
        this.count = count;
        this.meanScore = meanScore;
        this.trend = trend == null ? TrendDirection.INSUFFICIENT_DATA : trend;
        this.lastScore = lastScore;
        this.firstSeen = firstSeen;
        this.lastSeen = lastSeen;
    }

    public static ManufacturerProfile unknown(String manufacturerKey) {
        return new ManufacturerProfile(manufacturerKey, 0, 0.0, TrendDirection.INSUFFICIENT_DATA, null, null, null);
    }

    public String getManufacturerKey() { return manufacturerKey; }
    public int getCount() { return count; }
    public double getMeanScore() { return meanScore; }
    public TrendDirection getTrend() { return trend; }
    public Double getLastScore() { return lastScore; }
    public Instant getFirstSeen() { return firstSeen; }
    public Instant getLastSeen() { return lastSeen; }

    @JsonIgnore
    public TrackingState getState() {
        return count > 0 ? TrackingState.TRACKED : TrackingState.UNKNOWN;
    }

    @Override
    public String toString() {
        return "ManufacturerProfile{" + manufacturerKey + " count=" + count + " mean=" + meanScore + " trend=" + trend + "}";
    }
}
