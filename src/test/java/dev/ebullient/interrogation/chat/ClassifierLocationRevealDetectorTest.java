package dev.ebullient.interrogation.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.interrogation.TestStories;
import dev.ebullient.interrogation.model.Location;

class ClassifierLocationRevealDetectorTest {

    final List<Location> known = List.of(TestStories.SECRET_LAB, TestStories.ENGINE_ROOM);

    private ClassifierLocationRevealDetector detector(LocationRevealClassifier classifier) {
        ClassifierLocationRevealDetector detector = new ClassifierLocationRevealDetector();
        detector.classifier = classifier;
        detector.validator = new RevealValidator();
        detector.objectMapper = new ObjectMapper();
        return detector;
    }

    @Test
    void detect_keepsOnlyCandidateIds() {
        ClassifierLocationRevealDetector detector = detector((locations, dialogue) -> "[\"loc_3\", \"loc_2\", \"loc_99\"]");
        assertEquals(Set.of("loc_3"), detector.detect("Meet me in the engine room.", known));
    }

    @Test
    void detect_sendsCandidateList() {
        List<String> seen = new ArrayList<>();
        ClassifierLocationRevealDetector detector = detector((locations, dialogue) -> {
            seen.add(locations);
            return "[]";
        });
        assertTrue(detector.detect("Nothing to see here.", known).isEmpty());
        assertTrue(seen.get(0).contains("Secret Lab (ID: loc_1)"));
        assertTrue(seen.get(0).contains("Engine Room (ID: loc_3)"));
    }

    @Test
    void detect_fencedArray() {
        ClassifierLocationRevealDetector detector = detector((locations, dialogue) -> "```json\n[\"loc_1\"]\n```");
        assertEquals(Set.of("loc_1"), detector.detect("The secret lab is open to you.", known));
    }

    @Test
    void detect_malformedOutput_revealsNothing() {
        ClassifierLocationRevealDetector detector = detector((locations, dialogue) -> "The engine room, probably.");
        assertTrue(detector.detect("Head to the engine room.", known).isEmpty());
    }

    @Test
    void detect_classifierFailure_revealsNothing() {
        ClassifierLocationRevealDetector detector = detector((locations, dialogue) -> {
            throw new IllegalStateException("model offline");
        });
        assertTrue(detector.detect("Head to the engine room.", known).isEmpty());
    }

    @Test
    void detect_noCandidates_skipsClassifier() {
        ClassifierLocationRevealDetector detector = detector((locations, dialogue) -> {
            throw new AssertionError("should not be called");
        });
        assertTrue(detector.detect("Head to the engine room.", List.of()).isEmpty());
    }
}
