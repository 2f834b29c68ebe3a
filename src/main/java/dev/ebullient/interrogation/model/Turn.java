package dev.ebullient.interrogation.model;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record Turn(
        int index,
        Role role,
        String fullText,
        String clientText,
        Instant timestamp,
        List<String> revealedEvidenceIds,
        List<String> revealedLocationIds) {

    public Turn {
        fullText = fullText == null ? "" : fullText;
        clientText = clientText == null ? "" : clientText;
        revealedEvidenceIds = revealedEvidenceIds == null ? List.of() : List.copyOf(revealedEvidenceIds);
        revealedLocationIds = revealedLocationIds == null ? List.of() : List.copyOf(revealedLocationIds);
    }

    @JsonIgnore
    public boolean isBlank() {
        return fullText.isBlank();
    }

    public Turn withIndex(int newIndex) {
        return new Turn(newIndex, role, fullText, clientText, timestamp, revealedEvidenceIds, revealedLocationIds);
    }
}
