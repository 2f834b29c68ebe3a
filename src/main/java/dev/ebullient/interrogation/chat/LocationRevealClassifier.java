package dev.ebullient.interrogation.chat;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import io.quarkiverse.langchain4j.RegisterAiService;

@RegisterAiService(chatMemoryProviderSupplier = RegisterAiService.NoChatMemoryProviderSupplier.class)
public interface LocationRevealClassifier {

    @SystemMessage("""
            You are a location reveal detector. Decide which locations a story character is
            ACTIVELY REVEALING or GRANTING ACCESS TO in one line of dialogue.

            A location is revealed when the character:
            1. gives directions or shows how to get there
            2. grants access, permission or clearance
            3. provides keys, codes or passwords
            4. schedules a meeting there
            5. sends or transfers location data or coordinates

            Simply mentioning a location is NOT revealing it. Refusing or denying access is NOT
            revealing it.

            Respond ONLY with a JSON array of location IDs taken from the list you are given,
            for example ["loc_1", "loc_3"] or [].
            """)
    @UserMessage("""
            ## Locations the character knows
            {locations}

            ## Character's dialogue
            "{dialogue}"
            """)
    String classify(String locations, String dialogue);
}
