package dev.ebullient.interrogation.chat;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import dev.ebullient.interrogation.model.CapabilityModel;

/**
 * Filters what the generator claims a character gave away against what the
 * character actually holds or knows. Mismatches are dropped without error:
 * prompt text asks the model to report reveals honestly, this is what enforces it.
 */
@ApplicationScoped
public class RevealValidator {
    private static final Logger log = Logger.getLogger(RevealValidator.class);

    /**
     * @return the members of {@code candidates} that are in {@code allowed},
     *         in candidate order, without duplicates
     */
    public List<String> validate(Collection<String> candidates, Set<String> allowed) {
        if (candidates == null || candidates.isEmpty() || allowed == null || allowed.isEmpty()) {
            return List.of();
        }
        Set<String> kept = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (candidate != null && allowed.contains(candidate)) {
                kept.add(candidate);
            }
        }
        return List.copyOf(kept);
    }

    public List<String> validateEvidence(Collection<String> candidates, CapabilityModel capability) {
        List<String> valid = validate(candidates, capability.heldEvidenceIds());
        if (candidates != null && valid.size() < candidates.size()) {
            log.debugf("Dropped %d evidence reveal(s) outside %s", candidates.size() - valid.size(),
                    capability.heldEvidenceIds());
        }
        return valid;
    }

    public List<String> validateLocations(Collection<String> candidates, CapabilityModel capability) {
        return validate(candidates, capability.knownLocationIds());
    }
}
