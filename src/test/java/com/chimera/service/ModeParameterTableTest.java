package com.chimera.service;

import com.chimera.config.ChimeraProperties;
import com.chimera.model.Mode;
import com.chimera.model.ModeParameters;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ModeParameterTable and mode resolution.
 */
class ModeParameterTableTest {

    @Test
    void testEveryModeHasDefaults() {
        ModeParameterTable table = new ModeParameterTable(new ChimeraProperties());

        for (Mode mode : Mode.values()) {
            assertNotNull(table.resolve(mode));
        }
        assertEquals(ModeParameterTable.BASE_DEFAULTS, table.resolve(Mode.BASE));
        assertEquals(0.82, table.resolve(Mode.BASE).getTemperature());
        assertEquals(1800, table.resolve(Mode.BASE).getMaxTokens());
    }

    @Test
    void testUnknownModeResolvesToBase() {
        ModeParameterTable table = new ModeParameterTable(new ChimeraProperties());

        assertEquals(table.resolve(Mode.BASE), table.resolve("pirate"));
        assertEquals(table.resolve(Mode.BASE), table.resolve((String) null));
        assertEquals(table.resolve(Mode.EXPERT), table.resolve("Expert"));
    }

    @Test
    void testConfiguredValuesOverrideDefaultsFieldByField() {
        ChimeraProperties properties = new ChimeraProperties();
        ChimeraProperties.ModeParametersConfig talk = new ChimeraProperties.ModeParametersConfig();
        talk.setTemperature(0.3);
        talk.setMaxTokens(500);
        properties.getModes().put("talk", talk);

        ModeParameters resolved = new ModeParameterTable(properties).resolve(Mode.TALK);

        assertEquals(0.3, resolved.getTemperature());
        assertEquals(500, resolved.getMaxTokens());
        assertEquals(ModeParameterTable.defaultsFor(Mode.TALK).getTopP(), resolved.getTopP());
        assertEquals(ModeParameterTable.defaultsFor(Mode.TALK).getPresencePenalty(), resolved.getPresencePenalty());
    }

    @Test
    void testModeResolution() {
        assertEquals(Mode.BASE, Mode.resolve(null));
        assertEquals(Mode.BASE, Mode.resolve(""));
        assertEquals(Mode.BASE, Mode.resolve("unknown"));
        assertEquals(Mode.TALK, Mode.resolve(" talk "));
        assertEquals(Mode.CREATIVE, Mode.resolve("CREATIVE"));

        assertTrue(Mode.isKnown("base"));
        assertTrue(Mode.isKnown("Expert"));
        assertFalse(Mode.isKnown("pirate"));
        assertFalse(Mode.isKnown(null));
    }
}
