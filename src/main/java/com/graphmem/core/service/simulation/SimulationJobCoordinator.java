package com.graphmem.core.service.simulation;

import com.graphmem.core.service.config.MetricsConfig;
import com.graphmem.core.service.config.RetentionConfig;
import com.graphmem.core.service.config.SimulationConfig;
import com.graphmem.core.service.error.InvalidStateException;
import com.graphmem.core.service.error.NotFoundException;
import com.graphmem.core.service.generation.DialogueGenerator;
import com.graphmem.core.service.generation.Summarizer;
import com.graphmem.core.service.memory.AppliedDialogue;
import com.graphmem.core.service.memory.GraphMemoryService;
import com.graphmem.core.service.model.DialogueLine;
import com.graphmem.core.service.model.GraphDelta;
import com.graphmem.core.service.model.GraphNode;
import com.graphmem.core.service.model.ShortTermMessage;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the lifecycle of simulation jobs.
 *
 * Submission only registers the job and hands a {@link SimulationRun} to the
 * simulation executor, so callers never wait on dialogue generation. Jobs run
 * independently of each other and are observed by polling snapshots.
 */
@Slf4j
@Service
public class SimulationJobCoordinator {

    private final DialogueGenerator dialogueGenerator;
    private final Summarizer summarizer;
    private final GraphMemoryService memoryService;
    private final SimulationConfig simulationConfig;
    private final RetentionConfig retentionConfig;
    private final MetricsConfig metricsConfig;
    private final Executor executor;
    private final Clock clock;

    private final Map<String, SimulationJob> jobs = new ConcurrentHashMap<>();

    public SimulationJobCoordinator(DialogueGenerator dialogueGenerator,
                                    Summarizer summarizer,
                                    GraphMemoryService memoryService,
                                    SimulationConfig simulationConfig,
                                    RetentionConfig retentionConfig,
                                    MetricsConfig metricsConfig,
                                    @Qualifier("simulationExecutor") Executor executor,
                                    Clock clock) {
        this.dialogueGenerator = dialogueGenerator;
        this.summarizer = summarizer;
        this.memoryService = memoryService;
        this.simulationConfig = simulationConfig;
        this.retentionConfig = retentionConfig;
        this.metricsConfig = metricsConfig;
        this.executor = executor;
        this.clock = clock;
    }

    @PostConstruct
    public void initMetrics() {
        metricsConfig.registerStoreGauge("graphmem.simulation.jobs.retained",
                "Number of retained simulation jobs", jobs::size);
    }

    // ==================== Submission ====================

    /**
     * Registers a job in {@code queued} and schedules its run.
     *
     * @return the job identifier
     * @throws IllegalArgumentException if the participants or turn limit are invalid
     */
    public String submit(List<SimulationParticipant> participants, int turnLimit, String seedContext) {
        List<SimulationParticipant> cast = validateParticipants(participants);
        if (turnLimit < 1 || turnLimit > simulationConfig.getMaxTurnLimit()) {
            throw new IllegalArgumentException("turnLimit must be between 1 and " + simulationConfig.getMaxTurnLimit());
        }

        String jobId = UUID.randomUUID().toString();
        var job = new SimulationJob(jobId, cast, turnLimit, seedContext, clock.instant());
        jobs.put(jobId, job);
        metricsConfig.getSimulationsSubmitted().increment();

        try {
            executor.execute(new SimulationRun(job, dialogueGenerator, summarizer, clock,
                    Duration.ofSeconds(simulationConfig.getTimeoutSeconds()),
                    simulationConfig.isDeltaSnapshotsEnabled(), this::onRunFinished));
        } catch (RejectedExecutionException e) {
            if (job.fail("Simulation could not be scheduled: " + e.getMessage(), clock.instant())) {
                metricsConfig.getSimulationsFailed().increment();
            }
            log.warn("Simulation {} rejected by the executor: {}", jobId, e.getMessage());
        }

        log.info("Simulation {} queued with {} participants and turn limit {}", jobId, cast.size(), turnLimit);
        evictSuperseded();
        return jobId;
    }

    // ==================== Polling ====================

    /**
     * Consistent snapshot of a job. Enforces the timeout on running jobs.
     *
     * @throws NotFoundException for unknown ids
     */
    public SimulationJobSnapshot status(String jobId) {
        SimulationJob job = requireJob(jobId);
        enforceTimeout(job);
        return job.snapshot();
    }

    public List<SimulationJobSnapshot> list() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(SimulationJob::getCreatedAt))
                .map(SimulationJob::snapshot)
                .toList();
    }

    // ==================== Control ====================

    /**
     * Cancels a queued or running job; no-op on terminal jobs.
     * A turn in flight finishes but is not recorded.
     */
    public SimulationJobSnapshot cancel(String jobId) {
        SimulationJob job = requireJob(jobId);
        if (job.cancel(clock.instant())) {
            log.info("Simulation {} cancelled after {} turns", jobId, job.progressCount());
        }
        return job.snapshot();
    }

    /**
     * Removes a job, cancelling it first if it is still active.
     */
    public void discard(String jobId) {
        SimulationJob job = requireJob(jobId);
        job.cancel(clock.instant());
        jobs.remove(jobId, job);
        log.info("Simulation {} discarded", jobId);
    }

    /**
     * Applies the proposed delta of a completed job through the memory service.
     * A job is committed at most once; a failed apply leaves it committable.
     *
     * The persisted nodes keep the identifiers of the proposed delta.
     *
     * @param targetSessionId session receiving the dialogue; defaults to the delta's session node
     *                        {@code simulation-session-<jobId>}
     * @throws InvalidStateException if the job is not completed
     * @throws com.graphmem.core.service.error.AlreadyCommittedException on a repeated commit
     */
    public CommitResult commit(String jobId, String targetSessionId, String note) {
        SimulationJob job = requireJob(jobId);
        enforceTimeout(job);
        GraphDelta delta = job.beginCommit();
        String sessionId = targetSessionId != null && !targetSessionId.isBlank()
                ? targetSessionId.strip()
                : GraphDeltaBuilder.sessionNodeId(jobId);

        try {
            List<GraphNode> messageNodes = delta.messageNodes();
            List<DialogueLine> lines = messageNodes.stream()
                    .map(SimulationJobCoordinator::toDialogueLine)
                    .toList();
            List<String> messageIds = messageNodes.stream().map(GraphNode::id).toList();
            GraphNode knowledgeNode = delta.knowledgeNode()
                    .orElseThrow(() -> new InvalidStateException(
                            "Simulation job " + jobId + " has no proposed knowledge", jobId));
            String summary = (String) knowledgeNode.properties().get("summary");

            AppliedDialogue applied = memoryService.applyDialogue(sessionId, lines, messageIds,
                    knowledgeNode.id(), summary, note);
            job.markCommitted(sessionId);
            metricsConfig.getSimulationsCommitted().increment();

            CommitResult result = toCommitResult(jobId, sessionId, applied);
            log.info("Simulation {} committed to session {}: {} messages, knowledge {}",
                    jobId, sessionId, result.messagesApplied(), result.knowledgeId());
            return result;
        } catch (RuntimeException e) {
            job.abortCommit();
            throw e;
        }
    }

    // ==================== Background Maintenance ====================

    /**
     * Fails running jobs that exceeded the timeout even if nobody polls them.
     */
    @Scheduled(fixedDelayString = "${graphmem.simulation.sweep-interval-ms:1000}")
    public void sweepOverdue() {
        jobs.values().forEach(this::enforceTimeout);
    }

    private void enforceTimeout(SimulationJob job) {
        Duration timeout = Duration.ofSeconds(simulationConfig.getTimeoutSeconds());
        if (job.failIfOverdue(clock.instant(), timeout)) {
            log.warn("Simulation {} exceeded its timeout of {}s", job.getId(), timeout.toSeconds());
        }
    }

    /**
     * Drops the oldest terminal jobs once more than the configured number is retained.
     */
    private void evictSuperseded() {
        int maxRetained = retentionConfig.getJobs().getMaxRetained();
        int excess = jobs.size() - maxRetained;
        if (excess <= 0) {
            return;
        }

        List<SimulationJob> terminal = new ArrayList<>(jobs.values().stream()
                .filter(SimulationJob::isTerminal)
                .sorted(Comparator.comparing(SimulationJob::getCreatedAt))
                .toList());

        Set<String> evicted = new HashSet<>();
        for (SimulationJob job : terminal) {
            if (evicted.size() >= excess) break;
            if (jobs.remove(job.getId(), job)) {
                evicted.add(job.getId());
            }
        }
        if (!evicted.isEmpty()) {
            log.debug("Superseded {} simulation jobs", evicted.size());
        }
    }

    private void onRunFinished(SimulationJob job) {
        switch (job.getStatus()) {
            case COMPLETED -> metricsConfig.getSimulationsCompleted().increment();
            case FAILED -> metricsConfig.getSimulationsFailed().increment();
            case CANCELLED -> metricsConfig.getSimulationsCancelled().increment();
            default -> log.warn("Simulation {} run ended while {}", job.getId(), job.getStatus().value());
        }
    }

    // ==================== Helpers ====================

    private SimulationJob requireJob(String jobId) {
        SimulationJob job = jobId != null ? jobs.get(jobId) : null;
        if (job == null) {
            throw new NotFoundException("Simulation job", jobId);
        }
        return job;
    }

    private static List<SimulationParticipant> validateParticipants(List<SimulationParticipant> participants) {
        if (participants == null || participants.size() < 2) {
            throw new IllegalArgumentException("At least two participants are required");
        }
        Set<String> roles = new HashSet<>();
        List<SimulationParticipant> cast = new ArrayList<>();
        for (SimulationParticipant participant : participants) {
            if (participant == null || participant.role() == null || participant.role().isBlank()) {
                throw new IllegalArgumentException("Every participant needs a role");
            }
            String role = participant.role().strip();
            if (!roles.add(role)) {
                throw new IllegalArgumentException("Participant roles must be distinct: " + role);
            }
            cast.add(new SimulationParticipant(role, participant.persona()));
        }
        return cast;
    }

    private static DialogueLine toDialogueLine(GraphNode node) {
        Map<String, Object> properties = node.properties();
        Object createdAt = properties.get("createdAt");
        return new DialogueLine(
                (String) properties.get("role"),
                (String) properties.get("content"),
                createdAt instanceof Number number ? Instant.ofEpochMilli(number.longValue()) : null);
    }

    private static CommitResult toCommitResult(String jobId, String sessionId, AppliedDialogue applied) {
        List<ShortTermMessage> messages = applied.messages();
        int count = messages.size();
        boolean linkedToExistingChain = !messages.isEmpty() && messages.get(0).sequence() > 0;
        int nextEdges = Math.max(0, count - 1) + (linkedToExistingChain ? 1 : 0);
        // HAS_MESSAGE and CONTRIBUTED_TO per message, NEXT along the chain, one YIELDED
        int edges = count * 2 + nextEdges + 1;
        // messages, the knowledge node, and the session node when the chain starts here
        int nodes = count + 1 + (linkedToExistingChain ? 0 : 1);
        return new CommitResult(jobId, sessionId, applied.knowledge().id(), count, nodes, edges);
    }
}
