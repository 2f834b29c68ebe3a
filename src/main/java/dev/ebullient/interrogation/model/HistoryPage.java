package dev.ebullient.interrogation.model;

import java.util.List;

public record HistoryPage(
        String agentId,
        List<HistoryEntry> messages,
        long total,
        boolean hasMore) {
}
