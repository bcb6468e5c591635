package com.chimera.service;

import com.chimera.config.ChimeraProperties;
import com.chimera.model.Message;
import com.chimera.model.Mode;
import com.chimera.model.PromptPhase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the message list sent to the provider.
 * <p>
 * The system prompt is the base prompt for the phase, optionally followed by the mode's
 * modifier and, in the structured phase, the mode's schema instructions. A mode without a
 * usable modifier gets the unmodified base prompt.
 */
@Slf4j
@Component
public class PromptComposer {

    /**
     * Modifiers containing this marker are not written yet and are skipped.
     */
    static final String PLACEHOLDER_MARKER = "TODO";

    private static final String SECTION_SEPARATOR = "\n\n";

    private final ChimeraProperties properties;

    public PromptComposer(ChimeraProperties properties) {
        this.properties = properties;
        if (!properties.getPrompts().containsKey(Mode.BASE.getId())) {
            log.warn("No base prompt configured, system messages will be empty");
        }
    }

    public List<Message> compose(String text, boolean includePrompt, Mode mode, PromptPhase phase) {
        List<Message> messages = new ArrayList<>();

        if (includePrompt) {
            String basePrompt = promptFor(Mode.BASE, phase);
            messages.add(Message.system(buildModePrompt(basePrompt, mode, phase)));
        }

        // Conversation history is not injected yet, the user turn follows the system prompt directly

        messages.add(Message.user(text));
        return messages;
    }

    String buildModePrompt(String basePrompt, Mode mode, PromptPhase phase) {
        if (mode == Mode.BASE) {
            return basePrompt;
        }

        String modifier = promptFor(mode, phase);
        if (modifier == null || modifier.isBlank() || modifier.contains(PLACEHOLDER_MARKER)) {
            log.debug("No usable {} prompt modifier for mode '{}', using base prompt", phase, mode);
            return basePrompt;
        }

        StringBuilder prompt = new StringBuilder(basePrompt).append(SECTION_SEPARATOR).append(modifier);

        if (phase == PromptPhase.STRUCTURED) {
            String schemaInstructions = properties.getSchemaInstructions().get(mode.getId());
            if (schemaInstructions != null && !schemaInstructions.isBlank()) {
                prompt.append(SECTION_SEPARATOR).append(schemaInstructions);
            }
        }

        return prompt.toString();
    }

    private String promptFor(Mode mode, PromptPhase phase) {
        ChimeraProperties.PromptConfig prompts = properties.getPrompts().get(mode.getId());
        if (prompts == null) {
            return mode == Mode.BASE ? "" : null;
        }
        String prompt = phase == PromptPhase.STRUCTURED ? prompts.getStructured() : prompts.getFallback();
        if (prompt == null && mode == Mode.BASE) {
            return "";
        }
        return prompt;
    }
}
