package com.chimera.service;

import com.chimera.config.ChimeraProperties;
import com.chimera.model.Message;
import com.chimera.model.Mode;
import com.chimera.model.PromptPhase;
import com.chimera.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PromptComposer.
 */
class PromptComposerTest {

    private ChimeraProperties properties;
    private PromptComposer composer;

    @BeforeEach
    void setUp() {
        properties = TestProperties.create();
        composer = new PromptComposer(properties);
    }

    @Test
    void testWithoutPromptOnlyUserMessage() {
        List<Message> messages = composer.compose("hello", false, Mode.TALK, PromptPhase.STRUCTURED);

        assertEquals(1, messages.size());
        assertEquals(Message.ROLE_USER, messages.get(0).getRole());
        assertEquals("hello", messages.get(0).getContent());
    }

    @Test
    void testBaseModeUsesPhasePrompt() {
        List<Message> structured = composer.compose("hello", true, Mode.BASE, PromptPhase.STRUCTURED);
        List<Message> fallback = composer.compose("hello", true, Mode.BASE, PromptPhase.FALLBACK);

        assertEquals(2, structured.size());
        assertEquals(Message.ROLE_SYSTEM, structured.get(0).getRole());
        assertEquals(TestProperties.BASE_STRUCTURED, structured.get(0).getContent());
        assertEquals(TestProperties.BASE_FALLBACK, fallback.get(0).getContent());
        assertEquals("hello", structured.get(1).getContent());
    }

    @Test
    void testStructuredModifierAndSchemaInstructionsAppended() {
        List<Message> messages = composer.compose("hi", true, Mode.TALK, PromptPhase.STRUCTURED);

        assertEquals(TestProperties.BASE_STRUCTURED + "\n\n" + TestProperties.TALK_STRUCTURED
                        + "\n\n" + TestProperties.TALK_SCHEMA,
                messages.get(0).getContent());
    }

    @Test
    void testFallbackModifierWithoutSchemaInstructions() {
        List<Message> messages = composer.compose("hi", true, Mode.TALK, PromptPhase.FALLBACK);

        assertEquals(TestProperties.BASE_FALLBACK + "\n\n" + TestProperties.TALK_FALLBACK,
                messages.get(0).getContent());
    }

    @Test
    void testPlaceholderModifierFallsBackToBasePrompt() {
        // creative has schema instructions registered, but its modifier is a placeholder
        for (PromptPhase phase : PromptPhase.values()) {
            List<Message> base = composer.compose("x", true, Mode.BASE, phase);
            List<Message> creative = composer.compose("x", true, Mode.CREATIVE, phase);
            assertEquals(base.get(0).getContent(), creative.get(0).getContent());
        }
    }

    @Test
    void testUnregisteredModifierFallsBackToBasePrompt() {
        properties.getPrompts().remove("expert");

        for (PromptPhase phase : PromptPhase.values()) {
            List<Message> base = composer.compose("x", true, Mode.BASE, phase);
            List<Message> expert = composer.compose("x", true, Mode.EXPERT, phase);
            assertEquals(base.get(0).getContent(), expert.get(0).getContent());
        }
    }

    @Test
    void testBlankModifierFallsBackToBasePrompt() {
        properties.getPrompts().get("expert").setStructured("   ");

        List<Message> messages = composer.compose("x", true, Mode.EXPERT, PromptPhase.STRUCTURED);

        assertEquals(TestProperties.BASE_STRUCTURED, messages.get(0).getContent());
    }

    @Test
    void testModifierWithoutSchemaInstructions() {
        List<Message> messages = composer.compose("x", true, Mode.EXPERT, PromptPhase.STRUCTURED);

        assertEquals(TestProperties.BASE_STRUCTURED + "\n\nBe precise.", messages.get(0).getContent());
    }

    @Test
    void testUserMessageIsAlwaysLast() {
        for (Mode mode : Mode.values()) {
            List<Message> messages = composer.compose("last", true, mode, PromptPhase.STRUCTURED);
            Message last = messages.get(messages.size() - 1);
            assertEquals(Message.ROLE_USER, last.getRole());
            assertEquals("last", last.getContent());
        }
    }
}
