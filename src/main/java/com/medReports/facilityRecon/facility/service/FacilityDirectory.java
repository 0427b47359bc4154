package com.medReports.facilityRecon.facility.service;

import com.medReports.facilityRecon.facility.model.FacilityKey;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Run-scoped cache of raw label to facility key resolutions.
 *
 * Created fresh for every reconciliation run and discarded with it. Not thread-safe:
 * labels are resolved during the sequential normalization stage only.
 */
public class FacilityDirectory {

    private final FacilityNormalizer normalizer;
    private final Set<FacilityKey> expectedKeys;
    private final Map<String, FacilityKey> resolved = new HashMap<>();
    private final Map<FacilityKey, Set<String>> labelsByKey = new LinkedHashMap<>();

    FacilityDirectory(FacilityNormalizer normalizer, Collection<String> knownLabels) {
        this.normalizer = normalizer;
        this.expectedKeys = knownLabels.stream()
                .map(normalizer::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Resolves a raw label, remembering every label seen for the resulting key.
     */
    public FacilityKey resolve(String rawLabel) {
        String cacheKey = rawLabel == null ? "" : rawLabel;
        FacilityKey key = resolved.computeIfAbsent(cacheKey, normalizer::normalize);
        labelsByKey.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(cacheKey);
        return key;
    }

    /**
     * Whether the key belongs to the configured facility list. Always true when no list is configured.
     */
    public boolean isExpected(FacilityKey key) {
        return expectedKeys.isEmpty() || expectedKeys.contains(key);
    }

    public String displayName(FacilityKey key) {
        return normalizer.displayName(key);
    }

    public Set<String> labelsFor(FacilityKey key) {
        return Set.copyOf(labelsByKey.getOrDefault(key, Set.of()));
    }
}
