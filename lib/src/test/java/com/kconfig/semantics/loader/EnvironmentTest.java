package com.kconfig.semantics.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentTest {

    @Test
    void substitutesBothReferenceForms() {
        Map<String, String> variables = Map.of("ARCH", "arm", "BOARD", "nrf52");

        assertEquals("boards/arm/nrf52/Kconfig", Environment.substitute("boards/$(ARCH)/${BOARD}/Kconfig", variables));
        assertEquals("$(UNKNOWN)/Kconfig", Environment.substitute("$(UNKNOWN)/Kconfig", variables));
        assertEquals("plain", Environment.substitute("plain", variables));
    }

    @Test
    void replacementTextIsTakenLiterally() {
        assertEquals("cost $5", Environment.substitute("cost $(PRICE)", Map.of("PRICE", "$5")));
    }

    @Test
    void resolvesReferencesBetweenVariables() {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("BOARD_DIR", "${ROOT}/boards");
        variables.put("ROOT", "${HOME}/zephyr");
        variables.put("HOME", "/home/dev");

        Map<String, String> resolved = Environment.resolve(variables);

        assertEquals("/home/dev/zephyr/boards", resolved.get("BOARD_DIR"));
        assertEquals("/home/dev/zephyr", resolved.get("ROOT"));
    }

    @Test
    void leavesUnknownReferencesInPlace() {
        assertEquals("${MISSING}/x", Environment.resolve(Map.of("A", "${MISSING}/x")).get("A"));
    }

    @Test
    void rejectsCircularVariables() {
        assertThrows(IllegalArgumentException.class, () -> Environment.resolve(Map.of("A", "${A}")));

        Map<String, String> loop = new LinkedHashMap<>();
        loop.put("A", "${B}");
        loop.put("B", "${C}");
        loop.put("C", "${B}");
        assertThrows(IllegalArgumentException.class, () -> Environment.resolve(loop));
    }
}
