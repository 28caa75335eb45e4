package com.ble.cube.dto;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.util.Optional;

/**
 * Conjunctive query over the four indexed dimensions. Every filter is optional; a filter left
 * unset matches every record.
 *
 * <p>Filters are read through the {@link Optional} accessors only; the raw fields have no
 * generated getters.</p>
 */
@Value
@Builder
public class MultiDimensionalQuery {

    /** Matches every record. */
    public static final MultiDimensionalQuery ALL = MultiDimensionalQuery.builder().build();

    @Getter(AccessLevel.NONE)
    MacAddress mac;
    @Getter(AccessLevel.NONE)
    RssiRange rssiRange;
    @Getter(AccessLevel.NONE)
    TimeRange timeRange;
    @Getter(AccessLevel.NONE)
    GeoRadius geoRadius;

    public Optional<MacAddress> mac() {
        return Optional.ofNullable(mac);
    }

    public Optional<RssiRange> rssiRange() {
        return Optional.ofNullable(rssiRange);
    }

    public Optional<TimeRange> timeRange() {
        return Optional.ofNullable(timeRange);
    }

    public Optional<GeoRadius> geoRadius() {
        return Optional.ofNullable(geoRadius);
    }

    /** True when no filter is set, so the query is a full scan. */
    public boolean isUnfiltered() {
        return mac == null && rssiRange == null && timeRange == null && geoRadius == null;
    }
}
