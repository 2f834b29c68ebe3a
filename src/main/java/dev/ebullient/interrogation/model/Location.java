package dev.ebullient.interrogation.model;

public record Location(
        String id,
        String name,
        String description) {
}
