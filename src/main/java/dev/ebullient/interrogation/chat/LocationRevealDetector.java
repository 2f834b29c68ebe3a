package dev.ebullient.interrogation.chat;

import java.util.List;
import java.util.Set;

import dev.ebullient.interrogation.model.Location;

/**
 * Decides, from the dialogue alone, which locations a character is actively
 * granting access to. A location that is only mentioned is not revealed.
 */
public interface LocationRevealDetector {

    /**
     * @param dialogue the character's reply
     * @param candidates the locations the character knows
     * @return IDs drawn from {@code candidates}, without duplicates
     */
    Set<String> detect(String dialogue, List<Location> candidates);
}
