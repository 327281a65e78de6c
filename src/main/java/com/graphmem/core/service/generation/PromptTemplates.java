package com.graphmem.core.service.generation;

import com.graphmem.core.service.model.ConversationLine;
import com.graphmem.core.service.simulation.SimulationParticipant;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt shapes for the three uses of the text-completion capability.
 */
public final class PromptTemplates {

    private static final String SUMMARY_INSTRUCTION =
            "Summarize the following conversation focusing on stable knowledge.";

    private PromptTemplates() {
    }

    public static String summary(List<? extends ConversationLine> lines) {
        return SUMMARY_INSTRUCTION + "\n" + render(lines);
    }

    public static String chatReply(List<? extends ConversationLine> history) {
        String context = render(history);
        return context.isEmpty() ? "assistant:" : context + "\nassistant:";
    }

    public static String dialogueTurn(DialogueContext context, String stopMarker) {
        SimulationParticipant speaker = context.speaker();
        String persona = speaker.persona() != null && !speaker.persona().isBlank()
                ? "\nPersona guidance: " + speaker.persona().strip()
                : "";
        return "You are " + speaker.role()
                + ", participating in a round-table discussion with other expert agents."
                + persona + "\n"
                + "Respond with a single, well-formed message that reflects your expertise "
                + "and advances the conversation.\n"
                + "Do not narrate actions or mention that you are an AI model.\n"
                + "If the discussion has reached a natural conclusion, end your message with "
                + stopMarker + ".\n"
                + "Conversation so far:\n" + conversation(context) + "\n\n"
                + speaker.role() + ":";
    }

    private static String conversation(DialogueContext context) {
        StringBuilder history = new StringBuilder();
        if (context.seedContext() != null && !context.seedContext().isBlank()) {
            history.append("Scenario: ").append(context.seedContext());
        }
        String transcript = render(context.transcript());
        if (!transcript.isEmpty()) {
            if (history.length() > 0) history.append('\n');
            history.append(transcript);
        }
        return history.length() > 0 ? history.toString() : "(no previous dialogue)";
    }

    private static String render(List<? extends ConversationLine> lines) {
        return lines.stream()
                .map(line -> line.role() + ": " + line.content())
                .collect(Collectors.joining("\n"));
    }
}
