package com.graphmem.core.service.simulation;

import com.graphmem.core.service.error.GeneratorException;
import com.graphmem.core.service.generation.DialogueContext;
import com.graphmem.core.service.generation.DialogueGenerator;
import com.graphmem.core.service.generation.GeneratedTurn;
import com.graphmem.core.service.generation.Summarizer;
import com.graphmem.core.service.model.DialogueLine;
import com.graphmem.core.service.model.GraphDelta;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Execution loop of one simulation job.
 *
 * Participants speak in rotating order until the turn limit is reached or
 * the generator signals the end of the dialogue. Cancellation and the
 * timeout are observed between turns; a turn in flight is allowed to finish
 * and its result is dropped.
 */
@Slf4j
class SimulationRun implements Runnable {

    private final SimulationJob job;
    private final DialogueGenerator generator;
    private final Summarizer summarizer;
    private final Clock clock;
    private final Duration timeout;
    private final boolean deltaSnapshots;
    private final Consumer<SimulationJob> onFinished;

    SimulationRun(SimulationJob job, DialogueGenerator generator, Summarizer summarizer, Clock clock,
                  Duration timeout, boolean deltaSnapshots, Consumer<SimulationJob> onFinished) {
        this.job = job;
        this.generator = generator;
        this.summarizer = summarizer;
        this.clock = clock;
        this.timeout = timeout;
        this.deltaSnapshots = deltaSnapshots;
        this.onFinished = onFinished;
    }

    @Override
    public void run() {
        try {
            if (!job.start(clock.instant())) {
                log.debug("Simulation {} left the queue as {} before starting", job.getId(), job.getStatus().value());
                return;
            }
            log.info("Simulation {} running: {} participants, turn limit {}",
                    job.getId(), job.getParticipants().size(), job.getTurnLimit());

            if (!converse()) {
                return;
            }

            List<DialogueLine> transcript = job.transcript();
            String summary = summarizer.summarize(transcript);
            Instant now = clock.instant();
            GraphDelta proposed = GraphDeltaBuilder.build(job, transcript, summary, now);

            if (!isStillRunning()) {
                return;
            }
            if (job.complete(proposed, summary, now)) {
                log.info("Simulation {} completed after {} turns", job.getId(), transcript.size());
            }
        } catch (GeneratorException e) {
            if (job.fail("Generator failed: " + e.getMessage(), clock.instant())) {
                log.warn("Simulation {} failed: {}", job.getId(), e.getMessage());
            }
        } catch (RuntimeException e) {
            if (job.fail("Unexpected error: " + e.getMessage(), clock.instant())) {
                log.error("Simulation {} failed unexpectedly", job.getId(), e);
            }
        } finally {
            onFinished.accept(job);
        }
    }

    /**
     * @return true if the dialogue ended normally and the job is still running
     */
    private boolean converse() {
        List<SimulationParticipant> participants = job.getParticipants();
        List<DialogueLine> transcript = new ArrayList<>();

        for (int turn = 0; turn < job.getTurnLimit(); turn++) {
            if (!isStillRunning()) {
                return false;
            }

            SimulationParticipant speaker = participants.get(turn % participants.size());
            GeneratedTurn generated = generator.nextTurn(
                    new DialogueContext(job.getSeedContext(), transcript, speaker));

            Instant timestamp = clock.instant();
            transcript.add(new DialogueLine(speaker.role(), generated.content(), timestamp));
            GraphDelta snapshot = deltaSnapshots ? GraphDeltaBuilder.build(job, transcript, null, timestamp) : null;

            if (!job.appendProgress(new ProgressRecord(turn, speaker.role(), generated.content(), timestamp, snapshot))) {
                log.debug("Simulation {} stopped, turn {} dropped", job.getId(), turn);
                return false;
            }
            if (generated.finished()) {
                log.debug("Simulation {} reached a natural end at turn {}", job.getId(), turn);
                break;
            }
        }
        return isStillRunning();
    }

    private boolean isStillRunning() {
        if (job.failIfOverdue(clock.instant(), timeout)) {
            log.warn("Simulation {} exceeded its timeout of {}s", job.getId(), timeout.toSeconds());
        }
        return job.isRunning();
    }
}
