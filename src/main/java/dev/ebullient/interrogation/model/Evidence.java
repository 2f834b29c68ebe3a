package dev.ebullient.interrogation.model;

public record Evidence(
        String id,
        String title,
        String description,
        String visualDescription,
        String imageUrl) {
}
