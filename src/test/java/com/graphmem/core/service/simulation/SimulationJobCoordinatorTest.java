package com.graphmem.core.service.simulation;

import com.graphmem.core.service.config.AsyncConfig;
import com.graphmem.core.service.config.MemoryConfig;
import com.graphmem.core.service.config.MetricsConfig;
import com.graphmem.core.service.config.RetentionConfig;
import com.graphmem.core.service.config.SimulationConfig;
import com.graphmem.core.service.error.AlreadyCommittedException;
import com.graphmem.core.service.error.GeneratorException;
import com.graphmem.core.service.error.InvalidStateException;
import com.graphmem.core.service.error.NotFoundException;
import com.graphmem.core.service.error.StorageUnavailableException;
import com.graphmem.core.service.generation.DialogueGenerator;
import com.graphmem.core.service.generation.GeneratedTurn;
import com.graphmem.core.service.generation.Summarizer;
import com.graphmem.core.service.memory.GraphMemoryService;
import com.graphmem.core.service.memory.InMemoryFallbackCache;
import com.graphmem.core.service.memory.SessionLocks;
import com.graphmem.core.service.memory.StoreConnectionMonitor;
import com.graphmem.core.service.model.GraphDelta;
import com.graphmem.core.service.model.GraphLabels;
import com.graphmem.core.service.model.GraphNode;
import com.graphmem.core.service.model.GraphView;
import com.graphmem.core.service.persistence.InMemoryGraphStore;
import com.graphmem.core.service.support.ScriptedCompletionClient;
import com.graphmem.core.service.support.ToggleableGraphStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static com.graphmem.core.service.support.GraphAssertions.chainOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SimulationJobCoordinatorTest {

    private static final List<SimulationParticipant> PANEL = List.of(
            new SimulationParticipant("Economist", "Focus on costs"),
            new SimulationParticipant("Engineer", null));

    private ToggleableGraphStore store;
    private GraphMemoryService memoryService;
    private ScriptedCompletionClient completion;
    private SimulationConfig simulationConfig;
    private RetentionConfig retention;
    private ExecutorService executor;
    private Summarizer summarizer;
    private MetricsConfig metrics;
    private SimulationJobCoordinator coordinator;

    private volatile DialogueGenerator script;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        metrics = new MetricsConfig(new SimpleMeterRegistry());
        var memoryConfig = new MemoryConfig();
        memoryConfig.getStore().setRetryBackoffMs(0);
        retention = new RetentionConfig();
        simulationConfig = new SimulationConfig();

        completion = new ScriptedCompletionClient(prompt -> "The panel agreed on costs");
        summarizer = new Summarizer(completion);
        store = new ToggleableGraphStore(new InMemoryGraphStore(metrics));
        memoryService = new GraphMemoryService(store, new InMemoryFallbackCache(retention, metrics, clock),
                new StoreConnectionMonitor(memoryConfig, clock), new SessionLocks(), summarizer,
                memoryConfig, retention, metrics, clock);

        script = context -> new GeneratedTurn(context.speaker().role() + " turn " + context.transcript().size(), false);
        executor = Executors.newFixedThreadPool(4);
        coordinator = new SimulationJobCoordinator(context -> script.nextTurn(context), summarizer, memoryService,
                simulationConfig, retention, metrics, executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ==================== Execution ====================

    @Test
    @DisplayName("A well-behaved run completes with exactly turnLimit progress records")
    void completesWithExactlyTurnLimitRecords() {
        String jobId = coordinator.submit(PANEL, 5, "Budget meeting");

        SimulationJobSnapshot snapshot = awaitStatus(jobId, SimulationStatus.COMPLETED);

        assertThat(snapshot.progress()).extracting(ProgressRecord::turnIndex).containsExactly(0, 1, 2, 3, 4);
        assertThat(snapshot.progress()).extracting(ProgressRecord::speaker)
                .containsExactly("Economist", "Engineer", "Economist", "Engineer", "Economist");
        assertThat(snapshot.progress().get(4).delta().messageNodes()).hasSize(5);
        assertThat(snapshot.summary()).isEqualTo("The panel agreed on costs");
        assertThat(snapshot.proposedDelta().messageNodes()).hasSize(5);
        assertThat(snapshot.proposedDelta().knowledgeNode()).isPresent();
        assertThat(snapshot.proposedDelta().edges())
                .filteredOn(edge -> GraphLabels.CONTRIBUTED_TO.equals(edge.type()))
                .hasSize(5);
        assertThat(snapshot.startedAt()).isNotNull();
        assertThat(snapshot.finishedAt()).isNotNull();
    }

    @Test
    @DisplayName("Submission returns while the generator is still working")
    void submitNeverWaitsForGeneration() throws Exception {
        var release = new CountDownLatch(1);
        script = context -> {
            awaitQuietly(release);
            return new GeneratedTurn("done", false);
        };

        String jobId = coordinator.submit(PANEL, 2, null);

        assertThat(coordinator.status(jobId).status()).isIn(SimulationStatus.QUEUED, SimulationStatus.RUNNING);
        release.countDown();
        awaitStatus(jobId, SimulationStatus.COMPLETED);
    }

    @Test
    @DisplayName("The generator signalling completion ends the dialogue early")
    void naturalCompletionStopsTheLoop() {
        script = context -> new GeneratedTurn("turn " + context.transcript().size(), context.transcript().size() == 2);

        String jobId = coordinator.submit(PANEL, 10, null);

        assertThat(awaitStatus(jobId, SimulationStatus.COMPLETED).progress()).hasSize(3);
    }

    @Test
    @DisplayName("A generator failure fails only its own job")
    void generatorFailureFailsJob() {
        script = context -> {
            if ("Engineer".equals(context.speaker().role())) {
                throw new GeneratorException("model unavailable", false);
            }
            return new GeneratedTurn("fine", false);
        };
        String failing = coordinator.submit(PANEL, 4, null);

        SimulationJobSnapshot snapshot = awaitStatus(failing, SimulationStatus.FAILED);
        assertThat(snapshot.error()).contains("model unavailable");
        assertThat(snapshot.progress()).hasSize(1);

        script = context -> new GeneratedTurn("fine", false);
        String healthy = coordinator.submit(PANEL, 2, null);
        awaitStatus(healthy, SimulationStatus.COMPLETED);
    }

    @Test
    @DisplayName("A running job past its timeout is failed with an exceeded error")
    void timeoutFailsRunningJob() {
        simulationConfig.setTimeoutSeconds(1);
        script = context -> {
            sleepQuietly(200);
            return new GeneratedTurn("slow", false);
        };

        String jobId = coordinator.submit(PANEL, 50, null);

        SimulationJobSnapshot snapshot = awaitStatus(jobId, SimulationStatus.FAILED);
        assertThat(snapshot.error()).contains("exceeded");
        assertThat(snapshot.progress().size()).isLessThan(50);
    }

    @Test
    @DisplayName("Jobs beyond the warm worker count start without waiting for earlier jobs")
    void everyJobRunsOnItsOwnThread() {
        simulationConfig.setWorkerThreads(2);
        var perJobExecutor = (ThreadPoolTaskExecutor) new AsyncConfig(simulationConfig).simulationExecutor();
        var release = new CountDownLatch(1);
        script = context -> {
            awaitQuietly(release);
            return new GeneratedTurn("turn", false);
        };
        var perJobCoordinator = new SimulationJobCoordinator(context -> script.nextTurn(context), summarizer,
                memoryService, simulationConfig, retention, metrics, perJobExecutor, Clock.systemUTC());

        try {
            List<String> jobIds = IntStream.range(0, 5)
                    .mapToObj(i -> perJobCoordinator.submit(PANEL, 1, "job " + i))
                    .toList();

            await().atMost(5, TimeUnit.SECONDS).until(() -> jobIds.stream()
                    .allMatch(id -> perJobCoordinator.status(id).status() == SimulationStatus.RUNNING));

            release.countDown();
            await().atMost(10, TimeUnit.SECONDS).until(() -> jobIds.stream()
                    .allMatch(id -> perJobCoordinator.status(id).status() == SimulationStatus.COMPLETED));
        } finally {
            release.countDown();
            perJobExecutor.shutdown();
        }
    }

    // ==================== Cancellation ====================

    @Test
    @DisplayName("Cancelling a running job drops the turn in flight and records nothing more")
    void cancelStopsProgress() {
        var permits = new Semaphore(0);
        var calls = new AtomicInteger();
        script = context -> {
            calls.incrementAndGet();
            permits.acquireUninterruptibly();
            return new GeneratedTurn("turn", false);
        };
        String jobId = coordinator.submit(PANEL, 10, null);

        permits.release(2);
        await().atMost(5, TimeUnit.SECONDS).until(() -> calls.get() == 3);
        assertThat(coordinator.status(jobId).progress()).hasSize(2);

        SimulationJobSnapshot cancelled = coordinator.cancel(jobId);
        permits.release(10);

        assertThat(cancelled.status()).isEqualTo(SimulationStatus.CANCELLED);
        await().pollDelay(200, TimeUnit.MILLISECONDS).atMost(5, TimeUnit.SECONDS)
                .until(() -> coordinator.status(jobId).progress().size() == 2);
        assertThat(calls.get()).isEqualTo(3);
        assertThat(coordinator.status(jobId).status()).isEqualTo(SimulationStatus.CANCELLED);
    }

    @Test
    @DisplayName("Cancelling a terminal job is a no-op")
    void cancelOnTerminalJobIsNoOp() {
        String jobId = coordinator.submit(PANEL, 1, null);
        awaitStatus(jobId, SimulationStatus.COMPLETED);

        assertThat(coordinator.cancel(jobId).status()).isEqualTo(SimulationStatus.COMPLETED);
    }

    // ==================== Commit ====================

    @Test
    @DisplayName("A job is committed once; the second commit fails and duplicates nothing")
    void commitTwiceFailsTheSecondTime() {
        String jobId = coordinator.submit(PANEL, 4, "Budget meeting");
        awaitStatus(jobId, SimulationStatus.COMPLETED);

        CommitResult result = coordinator.commit(jobId, null, "reviewed");

        assertThat(result.sessionId()).isEqualTo("simulation-session-" + jobId);
        assertThat(result.messagesApplied()).isEqualTo(4);
        assertThat(result.nodesCreated()).isEqualTo(6);
        assertThat(result.edgesCreated()).isEqualTo(4 + 4 + 3 + 1);

        GraphView view = memoryService.exportGraph(result.sessionId());
        assertThat(chainOf(view, result.sessionId())).hasSize(4);
        assertThat(view.countNodes(GraphLabels.KNOWLEDGE)).isEqualTo(1);

        assertThatThrownBy(() -> coordinator.commit(jobId, null, null))
                .isInstanceOf(AlreadyCommittedException.class);
        GraphView after = memoryService.exportGraph(result.sessionId());
        assertThat(after.nodes()).hasSameSizeAs(view.nodes());
        assertThat(coordinator.status(jobId).committed()).isTrue();
    }

    @Test
    @DisplayName("Commit targets an existing session when asked to")
    void commitIntoExistingSession() {
        var earlier = memoryService.recordMessage("live", "user", "earlier");
        String jobId = coordinator.submit(PANEL, 2, null);
        awaitStatus(jobId, SimulationStatus.COMPLETED);

        CommitResult result = coordinator.commit(jobId, "live", null);

        assertThat(result.sessionId()).isEqualTo("live");
        assertThat(result.nodesCreated()).isEqualTo(3);
        assertThat(result.edgesCreated()).isEqualTo(2 + 2 + 2 + 1);
        assertThat(chainOf(memoryService.exportGraph("live"), "live")).hasSize(3).startsWith(earlier.id());
        assertThat(coordinator.status(jobId).committedSessionId()).isEqualTo("live");
    }

    @Test
    @DisplayName("Committed nodes keep the identifiers of the proposed delta")
    void commitPersistsTheProposedNodeIds() {
        String jobId = coordinator.submit(PANEL, 3, "Budget meeting");
        GraphDelta proposed = awaitStatus(jobId, SimulationStatus.COMPLETED).proposedDelta();

        CommitResult result = coordinator.commit(jobId, null, null);

        GraphView view = memoryService.exportGraph(result.sessionId());
        List<String> proposedIds = proposed.nodes().stream().map(GraphNode::id).toList();
        assertThat(view.nodes()).extracting(GraphNode::id).containsExactlyInAnyOrderElementsOf(proposedIds);
        assertThat(chainOf(view, result.sessionId()))
                .containsExactlyElementsOf(proposed.messageNodes().stream().map(GraphNode::id).toList());
        assertThat(result.knowledgeId()).isEqualTo(proposed.knowledgeNode().orElseThrow().id());
        assertThat(view.edges()).containsAll(proposed.edges());
    }

    @Test
    @DisplayName("Only completed jobs can be committed")
    void commitBeforeCompletionFails() {
        var release = new CountDownLatch(1);
        script = context -> {
            awaitQuietly(release);
            return new GeneratedTurn("turn", false);
        };
        String jobId = coordinator.submit(PANEL, 2, null);

        assertThatThrownBy(() -> coordinator.commit(jobId, null, null))
                .isInstanceOf(InvalidStateException.class);

        release.countDown();
        awaitStatus(jobId, SimulationStatus.COMPLETED);
    }

    @Test
    @DisplayName("A commit that cannot reach the store leaves the job committable")
    void failedCommitCanBeRetried() {
        String jobId = coordinator.submit(PANEL, 2, null);
        awaitStatus(jobId, SimulationStatus.COMPLETED);

        store.setReachable(false);
        assertThatThrownBy(() -> coordinator.commit(jobId, null, null))
                .isInstanceOf(StorageUnavailableException.class);
        assertThat(coordinator.status(jobId).committed()).isFalse();

        store.setReachable(true);
        assertThat(coordinator.commit(jobId, null, null).messagesApplied()).isEqualTo(2);
    }

    // ==================== Validation and Retention ====================

    @Test
    void rejectsInvalidSubmissions() {
        var solo = List.of(new SimulationParticipant("Economist", null));
        var twins = List.of(new SimulationParticipant("Economist", null), new SimulationParticipant(" Economist ", null));
        var nameless = List.of(new SimulationParticipant("Economist", null), new SimulationParticipant(" ", null));

        assertThatThrownBy(() -> coordinator.submit(solo, 2, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> coordinator.submit(twins, 2, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> coordinator.submit(nameless, 2, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> coordinator.submit(PANEL, 0, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> coordinator.submit(PANEL, simulationConfig.getMaxTurnLimit() + 1, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(coordinator.list()).isEmpty();
    }

    @Test
    void unknownJobsAreNotFound() {
        assertThatThrownBy(() -> coordinator.status("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> coordinator.cancel("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> coordinator.commit("missing", null, null)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> coordinator.discard("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void discardRemovesTheJob() {
        String jobId = coordinator.submit(PANEL, 1, null);
        awaitStatus(jobId, SimulationStatus.COMPLETED);

        coordinator.discard(jobId);

        assertThat(coordinator.list()).isEmpty();
        assertThatThrownBy(() -> coordinator.status(jobId)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void oldestTerminalJobsAreSuperseded() {
        retention.getJobs().setMaxRetained(2);
        String first = coordinator.submit(PANEL, 1, null);
        awaitStatus(first, SimulationStatus.COMPLETED);
        String second = coordinator.submit(PANEL, 1, null);
        awaitStatus(second, SimulationStatus.COMPLETED);

        String third = coordinator.submit(PANEL, 1, null);

        assertThat(coordinator.list()).extracting(SimulationJobSnapshot::jobId).containsExactly(second, third);
        assertThatThrownBy(() -> coordinator.status(first)).isInstanceOf(NotFoundException.class);
    }

    // ==================== Helpers ====================

    private SimulationJobSnapshot awaitStatus(String jobId, SimulationStatus expected) {
        await().atMost(10, TimeUnit.SECONDS)
                .pollInterval(Duration.ofMillis(20))
                .until(() -> coordinator.status(jobId).status() == expected);
        return coordinator.status(jobId);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
