package com.canonicalsync.api.rest;

import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;
import com.canonicalsync.core.test.TimeController;
import com.canonicalsync.engine.coordinator.SyncJobDispatcher;
import com.canonicalsync.engine.coordinator.SyncOrchestrator;
import com.canonicalsync.engine.hashing.CollisionWarning;
import com.canonicalsync.engine.metrics.SyncMetrics;
import com.canonicalsync.engine.persistence.InMemoryEnvironmentRepository;
import com.canonicalsync.engine.persistence.InMemorySyncJobRepository;
import com.canonicalsync.engine.reconcile.PairwiseReconcileResult;
import com.canonicalsync.engine.reconcile.ReconcileResult;
import com.canonicalsync.engine.service.ReconciliationService;
import com.canonicalsync.engine.sync.JobProgressSink;
import com.canonicalsync.engine.sync.SyncError;
import com.canonicalsync.engine.sync.SyncResult;
import com.canonicalsync.engine.sync.SyncStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SyncControllerTest {

    private static final String TENANT = "acme";

    private InMemoryEnvironmentRepository environments;
    private SyncOrchestrator orchestrator;
    private ExecutorService executor;
    private CountDownLatch release;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        TimeController time = TimeController.frozenAt(Instant.parse("2024-03-01T10:00:00Z"));
        environments = new InMemoryEnvironmentRepository();
        release = new CountDownLatch(1);
        orchestrator = new SyncOrchestrator(environments, new InMemorySyncJobRepository(environments),
            List.of(new BlockingStrategy(release)), event -> { }, new SyncMetrics(), new ObjectMapper(), time);
        executor = Executors.newSingleThreadExecutor();
        SyncJobDispatcher dispatcher = new SyncJobDispatcher(orchestrator, new NoopReconciliation(), executor);

        mockMvc = MockMvcBuilders.standaloneSetup(new SyncController(orchestrator, dispatcher))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();

        environments.save(new Environment(TENANT, "dev", "Development", "dev", "https://dev.acme.io", "key", null));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        release.countDown();
        executor.shutdown();
        executor.awaitTermination(10, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("POST sync returns 202 with the new job")
    void testRequestSyncAccepted() throws Exception {
        mockMvc.perform(post("/api/v1/environments/dev/sync").header(SyncController.TENANT_HEADER, TENANT))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.isNew").value(true))
            .andExpect(jsonPath("$.job.jobKind").value("ENV_SYNC"))
            .andExpect(jsonPath("$.job.trigger").value(SyncJob.TRIGGER_MANUAL))
            .andExpect(jsonPath("$.job.progress.message").value("Sync queued..."));
    }

    @Test
    @DisplayName("Second POST while the job is active returns the same job with isNew false")
    void testRequestSyncReturnsActiveJob() throws Exception {
        mockMvc.perform(post("/api/v1/environments/dev/sync").header(SyncController.TENANT_HEADER, TENANT))
            .andExpect(status().isAccepted());
        SyncJob active = orchestrator.getSyncStatus(TENANT, "dev").kinds().get(SyncJobKind.ENV_SYNC).latestJob();

        mockMvc.perform(post("/api/v1/environments/dev/sync").header(SyncController.TENANT_HEADER, TENANT))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.isNew").value(false))
            .andExpect(jsonPath("$.job.jobId").value(active.jobId().toString()));
    }

    @Test
    @DisplayName("Repo sync for an environment without Git is a configuration error")
    void testRepoSyncWithoutGitRejected() throws Exception {
        mockMvc.perform(post("/api/v1/environments/dev/sync")
                .param("kind", "REPO_SYNC")
                .header(SyncController.TENANT_HEADER, TENANT))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("CONFIGURATION_ERROR"));
    }

    @Test
    @DisplayName("Unknown environment is 404")
    void testUnknownEnvironment() throws Exception {
        mockMvc.perform(post("/api/v1/environments/qa/sync").header(SyncController.TENANT_HEADER, TENANT))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Missing tenant header and bad kind are 400")
    void testBadRequests() throws Exception {
        mockMvc.perform(post("/api/v1/environments/dev/sync"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value(ApiExceptionHandler.BAD_REQUEST));

        mockMvc.perform(post("/api/v1/environments/dev/sync")
                .param("kind", "FULL_SYNC")
                .header(SyncController.TENANT_HEADER, TENANT))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET job and sync status")
    void testGetJobAndStatus() throws Exception {
        SyncJob job = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();

        mockMvc.perform(get("/api/v1/sync-jobs/" + job.jobId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value(SyncJobStatus.PENDING.name()))
            .andExpect(jsonPath("$.environmentId").value("dev"));

        mockMvc.perform(get("/api/v1/environments/dev/sync-status").header(SyncController.TENANT_HEADER, TENANT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.kinds.ENV_SYNC.latestJob.jobId").value(job.jobId().toString()))
            .andExpect(jsonPath("$.kinds.ENV_SYNC.lastSyncAttemptedAt").exists());

        mockMvc.perform(get("/api/v1/sync-jobs/" + UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Dispatched job completes in the background")
    void testDispatchedJobCompletes() throws Exception {
        mockMvc.perform(post("/api/v1/environments/dev/sync").header(SyncController.TENANT_HEADER, TENANT))
            .andExpect(status().isAccepted());
        release.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        SyncJob latest = orchestrator.getSyncStatus(TENANT, "dev").kinds().get(SyncJobKind.ENV_SYNC).latestJob();
        assertThat(latest.status()).isEqualTo(SyncJobStatus.COMPLETED);
    }

    record EmptyResult(int processed) implements SyncResult {
        @Override
        public List<SyncError> errors() {
            return List.of();
        }

        @Override
        public List<CollisionWarning> collisionWarnings() {
            return List.of();
        }
    }

    /**
     * Holds the job in RUNNING until released, so requests can observe it as active.
     */
    static final class BlockingStrategy implements SyncStrategy {
        private final CountDownLatch release;

        BlockingStrategy(CountDownLatch release) {
            this.release = release;
        }

        @Override
        public SyncJobKind kind() {
            return SyncJobKind.ENV_SYNC;
        }

        @Override
        public SyncResult sync(Environment environment, JobProgressSink sink) {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new EmptyResult(0);
        }
    }

    static final class NoopReconciliation implements ReconciliationService {
        @Override
        public ReconcileResult reconcilePair(String tenantId, String sourceEnvironmentId,
                                             String targetEnvironmentId, boolean force) {
            return ReconcileResult.debounced(sourceEnvironmentId, targetEnvironmentId);
        }

        @Override
        public PairwiseReconcileResult reconcileAllPairsFor(String tenantId, String changedEnvironmentId) {
            return new PairwiseReconcileResult(changedEnvironmentId, List.of(), List.of());
        }
    }
}
