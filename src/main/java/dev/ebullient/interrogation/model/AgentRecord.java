package dev.ebullient.interrogation.model;

import java.time.Instant;
import java.util.List;

/**
 * Static fields of an agent, stored next to its conversation log.
 */
public record AgentRecord(
        String id,
        String storyRef,
        String characterRef,
        String characterName,
        String personality,
        List<String> heldEvidenceIds,
        List<String> knownLocationIds,
        Instant createdAt) {

    public AgentRecord {
        heldEvidenceIds = heldEvidenceIds == null ? List.of() : List.copyOf(heldEvidenceIds);
        knownLocationIds = knownLocationIds == null ? List.of() : List.copyOf(knownLocationIds);
    }

    public AgentRecord withId(String newId) {
        return new AgentRecord(newId, storyRef, characterRef, characterName, personality,
                heldEvidenceIds, knownLocationIds, createdAt);
    }

    public CapabilityModel capability() {
        return CapabilityModel.of(heldEvidenceIds, knownLocationIds);
    }
}
