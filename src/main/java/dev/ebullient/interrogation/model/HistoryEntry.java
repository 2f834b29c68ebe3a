package dev.ebullient.interrogation.model;

import java.time.Instant;
import java.util.List;

public record HistoryEntry(
        Role role,
        String content,
        Instant timestamp,
        List<String> revealedEvidenceIds,
        List<String> revealedLocationIds) {
}
