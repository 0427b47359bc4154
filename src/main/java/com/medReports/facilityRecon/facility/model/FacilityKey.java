package com.medReports.facilityRecon.facility.model;

import java.util.Objects;

/**
 * Canonical identity of one physical facility.
 *
 * Many raw labels map to one key. A key flagged {@code verbatim} is a label the normalizer
 * could not reduce and kept as-is, so it never merges with any other label.
 */
public record FacilityKey(String value, boolean verbatim) implements Comparable<FacilityKey> {

    public static final String UNLABELED = "(unlabeled)";

    public FacilityKey {
        Objects.requireNonNull(value, "value is required");
    }

    public static FacilityKey of(String value) {
        return new FacilityKey(value, false);
    }

    public static FacilityKey verbatim(String value) {
        return new FacilityKey(value, true);
    }

    @Override
    public int compareTo(FacilityKey other) {
        int byValue = value.compareTo(other.value);
        return byValue != 0 ? byValue : Boolean.compare(verbatim, other.verbatim);
    }

    @Override
    public String toString() {
        return value;
    }
}
