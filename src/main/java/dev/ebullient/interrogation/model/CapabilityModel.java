package dev.ebullient.interrogation.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What a character may legitimately give away: the evidence it holds and the
 * locations it can grant access to. Fixed when the agent is spawned.
 */
public record CapabilityModel(
        Set<String> heldEvidenceIds,
        Set<String> knownLocationIds) {

    public CapabilityModel {
        heldEvidenceIds = freeze(heldEvidenceIds);
        knownLocationIds = freeze(knownLocationIds);
    }

    public static CapabilityModel of(Collection<String> evidenceIds, Collection<String> locationIds) {
        return new CapabilityModel(
                evidenceIds == null ? Set.of() : new LinkedHashSet<>(evidenceIds),
                locationIds == null ? Set.of() : new LinkedHashSet<>(locationIds));
    }

    public boolean holds(String evidenceId) {
        return evidenceId != null && heldEvidenceIds.contains(evidenceId);
    }

    public boolean knows(String locationId) {
        return locationId != null && knownLocationIds.contains(locationId);
    }

    // keeps declaration order
    private static Set<String> freeze(Set<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }
}
