package dev.ebullient.interrogation.model;

import java.util.List;

public record StoryCharacter(
        String id,
        String name,
        String appearance,
        String personality,
        String knowledge,
        List<Evidence> holdsEvidence,
        List<String> knowsLocationIds) {

    public StoryCharacter {
        holdsEvidence = holdsEvidence == null ? List.of() : List.copyOf(holdsEvidence);
        knowsLocationIds = knowsLocationIds == null ? List.of() : List.copyOf(knowsLocationIds);
    }

    public List<String> heldEvidenceIds() {
        return holdsEvidence.stream().map(Evidence::id).toList();
    }

    public CapabilityModel capability() {
        return CapabilityModel.of(heldEvidenceIds(), knowsLocationIds);
    }
}
