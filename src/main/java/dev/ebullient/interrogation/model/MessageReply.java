package dev.ebullient.interrogation.model;

import java.util.List;

public record MessageReply(
        String replyText,
        List<String> revealedEvidenceIds,
        List<String> revealedLocationIds) {
}
