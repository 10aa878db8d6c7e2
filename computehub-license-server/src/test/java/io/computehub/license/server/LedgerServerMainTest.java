package io.computehub.license.server;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LedgerServerMainTest {

    @Test
    @DisplayName("absent --limit uses the default")
    void parseLimit_absent() {
        assertEquals(LedgerServerMain.DEFAULT_LOG_LIMIT, LedgerServerMain.parseLimit(null));
    }

    @Test
    @DisplayName("--limit accepts zero and positive numbers")
    void parseLimit_valid() {
        assertEquals(0, LedgerServerMain.parseLimit("0"));
        assertEquals(50, LedgerServerMain.parseLimit(" 50 "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"-1", "ten", "", "1.5"})
    @DisplayName("--limit rejects negative and non-numeric values")
    void parseLimit_invalid(String value) {
        var ex = assertThrows(IllegalArgumentException.class, () -> LedgerServerMain.parseLimit(value));

        assertTrue(ex.getMessage().startsWith("--limit must be a non-negative whole number"));
    }
}
