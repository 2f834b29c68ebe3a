package dev.ebullient.interrogation.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import dev.ebullient.interrogation.model.CapabilityModel;

class RevealValidatorTest {

    final RevealValidator validator = new RevealValidator();
    final CapabilityModel capability = CapabilityModel.of(List.of("ev_1", "ev_2"), List.of("loc_1"));

    @Test
    void validateEvidence_dropsUnheldIds() {
        assertEquals(List.of("ev_1"), validator.validateEvidence(List.of("ev_1", "ev_99"), capability));
    }

    @Test
    void validate_preservesCandidateOrderAndDeduplicates() {
        List<String> result = validator.validate(List.of("c", "x", "a", "c", "b", "a"), Set.of("a", "b", "c"));
        assertEquals(List.of("c", "a", "b"), result);
    }

    @Test
    void validate_resultIsSubsetOfAllowed() {
        Set<String> allowed = Set.of("a", "b");
        List<String> result = validator.validate(List.of("a", "z", "b", "y"), allowed);
        assertTrue(allowed.containsAll(result));
    }

    @Test
    void validate_isIdempotent() {
        List<String> candidates = List.of("ev_2", "ev_3", "ev_1");
        List<String> once = validator.validateEvidence(candidates, capability);
        assertEquals(once, validator.validateEvidence(candidates, capability));
        assertEquals(once, validator.validateEvidence(once, capability));
    }

    @Test
    void validate_nullsAndEmpties() {
        assertEquals(List.of(), validator.validate(null, Set.of("a")));
        assertEquals(List.of(), validator.validate(List.of("a"), Set.of()));
        assertEquals(List.of("a"), validator.validate(Arrays.asList(null, "a"), Set.of("a")));
    }

    @Test
    void validateLocations_usesKnownLocations() {
        assertEquals(List.of("loc_1"), validator.validateLocations(List.of("loc_2", "loc_1"), capability));
    }
}
