package dev.ebullient.interrogation.chat;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured reply requested from the generator. The reveal lists are
 * self-reported and only ever treated as hints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CharacterReply(
        @JsonProperty("reply") @JsonAlias({ "replyText", "response" }) String reply,
        @JsonProperty("revealed_evidences") @JsonAlias({ "revealedEvidenceIds", "revealedEvidences" }) List<String> revealedEvidences,
        @JsonProperty("revealed_locations") @JsonAlias({ "revealedLocationIds", "revealedLocations" }) List<String> revealedLocations) {

    public CharacterReply {
        reply = reply == null ? "" : reply;
        revealedEvidences = revealedEvidences == null ? List.of() : revealedEvidences;
        revealedLocations = revealedLocations == null ? List.of() : revealedLocations;
    }

    public static CharacterReply of(String reply) {
        return new CharacterReply(reply, List.of(), List.of());
    }
}
