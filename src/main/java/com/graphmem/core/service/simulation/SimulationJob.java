package com.graphmem.core.service.simulation;

import com.graphmem.core.service.error.AlreadyCommittedException;
import com.graphmem.core.service.error.InvalidStateException;
import com.graphmem.core.service.model.DialogueLine;
import com.graphmem.core.service.model.GraphDelta;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one simulation job.
 *
 * Every mutation and every read goes through the job's monitor, so a poller
 * always sees a whole progress record and a status consistent with it.
 * Progress is only appended while the job is running; once the status is
 * terminal nothing else is appended.
 */
public class SimulationJob {

    private final String id;
    private final List<SimulationParticipant> participants;
    private final int turnLimit;
    private final String seedContext;
    private final Instant createdAt;

    private final List<ProgressRecord> progress = new ArrayList<>();
    private SimulationStatus status = SimulationStatus.QUEUED;
    private Instant startedAt;
    private Instant finishedAt;
    private GraphDelta latestDelta;
    private GraphDelta proposedDelta;
    private String summary;
    private String error;

    private boolean commitInProgress;
    private boolean committed;
    private String committedSessionId;

    public SimulationJob(String id, List<SimulationParticipant> participants, int turnLimit,
                         String seedContext, Instant createdAt) {
        this.id = id;
        this.participants = List.copyOf(participants);
        this.turnLimit = turnLimit;
        this.seedContext = seedContext;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public List<SimulationParticipant> getParticipants() {
        return participants;
    }

    public int getTurnLimit() {
        return turnLimit;
    }

    public String getSeedContext() {
        return seedContext;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    // ==================== Lifecycle ====================

    public synchronized SimulationStatus getStatus() {
        return status;
    }

    public synchronized boolean isRunning() {
        return status == SimulationStatus.RUNNING;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * @return false if the job left the queued state before its run began
     */
    public synchronized boolean start(Instant now) {
        if (!transition(SimulationStatus.RUNNING)) {
            return false;
        }
        startedAt = now;
        return true;
    }

    /**
     * Appends the record of the next turn.
     *
     * @return false if the job is no longer running; the record is dropped
     */
    public synchronized boolean appendProgress(ProgressRecord record) {
        if (status != SimulationStatus.RUNNING) {
            return false;
        }
        if (record.turnIndex() != progress.size()) {
            throw new IllegalStateException("Job " + id + " expected turn " + progress.size()
                    + " but got " + record.turnIndex());
        }
        progress.add(record);
        if (record.delta() != null) {
            latestDelta = record.delta();
        }
        return true;
    }

    public synchronized boolean complete(GraphDelta delta, String jobSummary, Instant now) {
        if (!transition(SimulationStatus.COMPLETED)) {
            return false;
        }
        proposedDelta = delta;
        latestDelta = delta;
        summary = jobSummary;
        finishedAt = now;
        return true;
    }

    public synchronized boolean fail(String detail, Instant now) {
        if (!transition(SimulationStatus.FAILED)) {
            return false;
        }
        error = detail;
        finishedAt = now;
        return true;
    }

    /**
     * @return false if the job was already terminal
     */
    public synchronized boolean cancel(Instant now) {
        if (!transition(SimulationStatus.CANCELLED)) {
            return false;
        }
        finishedAt = now;
        return true;
    }

    /**
     * Fails a running job whose run time exceeds {@code timeout}.
     *
     * @return true if the job was failed by this call
     */
    public synchronized boolean failIfOverdue(Instant now, Duration timeout) {
        if (status != SimulationStatus.RUNNING || timeout.isZero() || startedAt == null) {
            return false;
        }
        if (Duration.between(startedAt, now).compareTo(timeout) <= 0) {
            return false;
        }
        return fail("Simulation exceeded the configured timeout of " + timeout.toSeconds() + " seconds", now);
    }

    private boolean transition(SimulationStatus next) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        status = next;
        return true;
    }

    // ==================== Commit ====================

    /**
     * Reserves the job for a commit.
     *
     * @return the proposed delta to apply
     * @throws InvalidStateException if the job is not completed or a commit is in flight
     * @throws AlreadyCommittedException if the job was committed before
     */
    public synchronized GraphDelta beginCommit() {
        if (committed) {
            throw new AlreadyCommittedException(id);
        }
        if (status != SimulationStatus.COMPLETED) {
            throw new InvalidStateException("Simulation job " + id + " is " + status.value()
                    + "; only completed jobs can be committed", id);
        }
        if (commitInProgress) {
            throw new InvalidStateException("Simulation job " + id + " is already being committed", id);
        }
        commitInProgress = true;
        return proposedDelta;
    }

    public synchronized void markCommitted(String sessionId) {
        commitInProgress = false;
        committed = true;
        committedSessionId = sessionId;
    }

    /**
     * Releases a commit reservation after a failed apply; the job stays committable.
     */
    public synchronized void abortCommit() {
        commitInProgress = false;
    }

    // ==================== Views ====================

    public synchronized List<DialogueLine> transcript() {
        return progress.stream()
                .map(record -> new DialogueLine(record.speaker(), record.content(), record.timestamp()))
                .toList();
    }

    public synchronized int progressCount() {
        return progress.size();
    }

    public synchronized SimulationJobSnapshot snapshot() {
        return new SimulationJobSnapshot(id, status, participants, turnLimit, seedContext,
                progress, latestDelta, proposedDelta, summary, error, committed, committedSessionId,
                createdAt, startedAt, finishedAt);
    }
}
