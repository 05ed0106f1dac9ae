package com.canonicalsync.api.config;

import com.canonicalsync.api.client.GitHubGitClient;
import com.canonicalsync.api.client.N8nRuntimeClient;
import com.canonicalsync.core.client.GitClient;
import com.canonicalsync.core.client.RuntimeClient;
import com.canonicalsync.core.repository.CanonicalGitStateRepository;
import com.canonicalsync.core.repository.CanonicalWorkflowRepository;
import com.canonicalsync.core.repository.EnvironmentRepository;
import com.canonicalsync.core.repository.SyncJobRepository;
import com.canonicalsync.core.repository.WorkflowDiffStateRepository;
import com.canonicalsync.core.repository.WorkflowMappingRepository;
import com.canonicalsync.engine.coordinator.SyncJobDispatcher;
import com.canonicalsync.engine.coordinator.SyncOrchestrator;
import com.canonicalsync.engine.hashing.HashingService;
import com.canonicalsync.engine.metrics.SyncMetrics;
import com.canonicalsync.engine.progress.LoggingSyncProgressPublisher;
import com.canonicalsync.engine.progress.SyncProgressPublisher;
import com.canonicalsync.engine.reconcile.ReconciliationEngine;
import com.canonicalsync.engine.sync.GitSyncEngine;
import com.canonicalsync.engine.sync.RuntimeSyncEngine;
import com.canonicalsync.engine.sync.SyncStrategy;
import com.canonicalsync.recovery.StaleJobRecovery;
import com.canonicalsync.scheduler.SchedulerSettings;
import com.canonicalsync.scheduler.SyncScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;

/**
 * Wires the sync engines, orchestrator and background loops.
 * Repositories come from the JDBC implementations picked up by component scanning.
 */
@Configuration
public class SyncEngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient syncHttpClient(SyncProperties properties) {
        return HttpClient.newBuilder()
            .connectTimeout(properties.getHttp().getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Bean
    public RuntimeClient runtimeClient(HttpClient syncHttpClient, ObjectMapper objectMapper, SyncProperties properties) {
        return new N8nRuntimeClient(syncHttpClient, objectMapper,
            properties.getHttp().getRequestTimeout(), properties.getHttp().getRuntimePageSize());
    }

    @Bean
    public GitClient gitClient(HttpClient syncHttpClient, ObjectMapper objectMapper, SyncProperties properties) {
        return new GitHubGitClient(syncHttpClient, objectMapper,
            properties.getHttp().getGithubApiUrl(), properties.getHttp().getRequestTimeout());
    }

    @Bean
    public HashingService hashingService(ObjectMapper objectMapper) {
        return new HashingService(objectMapper);
    }

    @Bean
    public RuntimeSyncEngine runtimeSyncEngine(
            RuntimeClient runtimeClient,
            WorkflowMappingRepository mappingRepository,
            CanonicalGitStateRepository gitStateRepository,
            HashingService hashingService,
            SyncMetrics metrics,
            Clock clock,
            SyncProperties properties) {
        return new RuntimeSyncEngine(runtimeClient, mappingRepository, gitStateRepository, hashingService,
            metrics, clock, properties.getRuntimeBatchSize(), properties.getFullPayloadEnvironmentClass());
    }

    @Bean
    public GitSyncEngine gitSyncEngine(
            GitClient gitClient,
            CanonicalWorkflowRepository canonicalWorkflowRepository,
            CanonicalGitStateRepository gitStateRepository,
            WorkflowMappingRepository mappingRepository,
            HashingService hashingService,
            ObjectMapper objectMapper,
            SyncMetrics metrics,
            Clock clock) {
        return new GitSyncEngine(gitClient, canonicalWorkflowRepository, gitStateRepository, mappingRepository,
            hashingService, objectMapper, metrics, clock);
    }

    @Bean
    public ReconciliationEngine reconciliationEngine(
            EnvironmentRepository environmentRepository,
            CanonicalWorkflowRepository canonicalWorkflowRepository,
            CanonicalGitStateRepository gitStateRepository,
            WorkflowMappingRepository mappingRepository,
            WorkflowDiffStateRepository diffStateRepository,
            SyncMetrics metrics,
            Clock clock,
            SyncProperties properties) {
        return new ReconciliationEngine(environmentRepository, canonicalWorkflowRepository, gitStateRepository,
            mappingRepository, diffStateRepository, metrics, clock,
            properties.getReconcile().getDebounceWindow(), properties.getFullPayloadEnvironmentClass());
    }

    @Bean
    public SyncProgressPublisher syncProgressPublisher() {
        return new LoggingSyncProgressPublisher();
    }

    @Bean
    public SyncOrchestrator syncOrchestrator(
            EnvironmentRepository environmentRepository,
            SyncJobRepository jobRepository,
            List<SyncStrategy> strategies,
            SyncProgressPublisher progressPublisher,
            SyncMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        return new SyncOrchestrator(environmentRepository, jobRepository, strategies, progressPublisher,
            metrics, objectMapper, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public SyncJobDispatcher syncJobDispatcher(
            SyncOrchestrator syncOrchestrator,
            ReconciliationEngine reconciliationEngine,
            SyncProperties properties) {
        return new SyncJobDispatcher(syncOrchestrator, reconciliationEngine, properties.getDispatcher().getPoolSize());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SyncScheduler syncScheduler(
            EnvironmentRepository environmentRepository,
            SyncOrchestrator syncOrchestrator,
            ReconciliationEngine reconciliationEngine,
            Clock clock,
            SyncProperties properties) {
        SyncProperties.Scheduler scheduler = properties.getScheduler();
        SchedulerSettings settings = new SchedulerSettings(
            scheduler.isEnabled(),
            scheduler.getPollInterval(),
            scheduler.getRepoSyncInterval(),
            scheduler.getEnvSyncInterval(),
            scheduler.getDebounceWindow()
        );
        return new SyncScheduler(environmentRepository, syncOrchestrator, reconciliationEngine, settings, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "sync.recovery", name = "enabled", havingValue = "true", matchIfMissing = true)
    public StaleJobRecovery staleJobRecovery(
            SyncJobRepository jobRepository,
            SyncOrchestrator syncOrchestrator,
            Clock clock,
            SyncProperties properties) {
        return new StaleJobRecovery(jobRepository, syncOrchestrator, clock,
            properties.getRecovery().getLivenessTimeout(), properties.getRecovery().getCheckInterval());
    }
}
