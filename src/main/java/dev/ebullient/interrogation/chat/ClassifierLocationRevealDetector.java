package dev.ebullient.interrogation.chat;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.interrogation.model.Location;

/**
 * Delegates the mention-versus-grant decision to the language model, then
 * filters the answer against the candidate IDs. The model's list is never used unfiltered.
 */
@ApplicationScoped
@Typed(ClassifierLocationRevealDetector.class)
public class ClassifierLocationRevealDetector implements LocationRevealDetector {
    private static final Logger log = Logger.getLogger(ClassifierLocationRevealDetector.class);

    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {
    };

    @Inject
    LocationRevealClassifier classifier;

    @Inject
    RevealValidator validator;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public Set<String> detect(String dialogue, List<Location> candidates) {
        if (dialogue == null || dialogue.isBlank() || candidates == null || candidates.isEmpty()) {
            return Set.of();
        }
        String raw;
        try {
            raw = classifier.classify(CharacterPrompts.locationCandidates(candidates), dialogue);
        } catch (RuntimeException e) {
            log.warnf(e, "Location classifier failed; treating reply as revealing nothing");
            return Set.of();
        }

        List<String> proposed;
        try {
            proposed = objectMapper.readValue(stripFence(raw), ID_LIST);
        } catch (Exception e) {
            log.warnf("Could not parse location classifier output: %s", raw);
            return Set.of();
        }

        Set<String> allowed = candidates.stream()
                .map(Location::id)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        List<String> valid = validator.validate(proposed, allowed);
        if (valid.size() < proposed.size()) {
            log.debugf("Classifier proposed unknown location IDs: %s", proposed);
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(valid));
    }

    private static String stripFence(String raw) {
        if (raw == null) {
            return "[]";
        }
        String text = raw.trim();
        if (text.startsWith("```")) {
            text = text.replaceFirst("^```(?:json)?\\s*", "").replaceFirst("\\s*```$", "");
        }
        return text.isEmpty() ? "[]" : text;
    }
}
