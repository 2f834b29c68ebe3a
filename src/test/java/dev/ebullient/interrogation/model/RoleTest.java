package dev.ebullient.interrogation.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class RoleTest {

    @Test
    void fromValue_acceptsLegacyNames() {
        assertEquals(Role.CHARACTER, Role.fromValue("model"));
        assertEquals(Role.INSTRUCTION, Role.fromValue("System"));
        assertEquals(Role.USER, Role.fromValue(" user "));
        assertThrows(IllegalArgumentException.class, () -> Role.fromValue("narrator"));
    }

    @Test
    void fromValue_ignoresDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(Role.INSTRUCTION, Role.fromValue("INSTRUCTION"));
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void turn_serializesRoleAsLowerCase() throws Exception {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        Turn turn = new Turn(3, Role.CHARACTER, "Hello", "Hello", Instant.parse("2024-05-01T10:00:00Z"),
                List.of("ev_1"), null);

        String json = mapper.writeValueAsString(turn);
        Turn read = mapper.readValue(json.replace("\"character\"", "\"model\""), Turn.class);

        assertEquals(turn, read);
    }
}
