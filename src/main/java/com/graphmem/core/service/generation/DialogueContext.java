package com.graphmem.core.service.generation;

import com.graphmem.core.service.model.DialogueLine;
import com.graphmem.core.service.simulation.SimulationParticipant;

import java.util.List;

/**
 * Input of a single dialogue turn: scenario, transcript so far and the next speaker.
 */
public record DialogueContext(String seedContext, List<DialogueLine> transcript, SimulationParticipant speaker) {

    public DialogueContext {
        transcript = List.copyOf(transcript);
    }
}
