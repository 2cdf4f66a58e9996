package com.pathhound.app.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LogSetupTest {

    @Test
    void levelOf_parses_names_and_falls_back_to_info() {
        assertEquals(Level.FINE, LogSetup.levelOf("fine"));
        assertEquals(Level.WARNING, LogSetup.levelOf(" warning "));
        assertEquals(Level.INFO, LogSetup.levelOf("loud"));
        assertEquals(Level.INFO, LogSetup.levelOf(null));
    }
}
