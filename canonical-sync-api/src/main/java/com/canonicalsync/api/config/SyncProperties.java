package com.canonicalsync.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code sync} prefix.
 */
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    private int runtimeBatchSize = 25;
    private String fullPayloadEnvironmentClass = "dev";

    private final Scheduler scheduler = new Scheduler();
    private final Reconcile reconcile = new Reconcile();
    private final Recovery recovery = new Recovery();
    private final Dispatcher dispatcher = new Dispatcher();
    private final Http http = new Http();

    public int getRuntimeBatchSize() {
        return runtimeBatchSize;
    }

    public void setRuntimeBatchSize(int runtimeBatchSize) {
        this.runtimeBatchSize = runtimeBatchSize;
    }

    public String getFullPayloadEnvironmentClass() {
        return fullPayloadEnvironmentClass;
    }

    public void setFullPayloadEnvironmentClass(String fullPayloadEnvironmentClass) {
        this.fullPayloadEnvironmentClass = fullPayloadEnvironmentClass;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Reconcile getReconcile() {
        return reconcile;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Http getHttp() {
        return http;
    }

    public static class Scheduler {
        private boolean enabled = false;
        private Duration pollInterval = Duration.ofMinutes(1);
        private Duration repoSyncInterval = Duration.ofMinutes(30);
        private Duration envSyncInterval = Duration.ofMinutes(30);
        private Duration debounceWindow = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getRepoSyncInterval() {
            return repoSyncInterval;
        }

        public void setRepoSyncInterval(Duration repoSyncInterval) {
            this.repoSyncInterval = repoSyncInterval;
        }

        public Duration getEnvSyncInterval() {
            return envSyncInterval;
        }

        public void setEnvSyncInterval(Duration envSyncInterval) {
            this.envSyncInterval = envSyncInterval;
        }

        public Duration getDebounceWindow() {
            return debounceWindow;
        }

        public void setDebounceWindow(Duration debounceWindow) {
            this.debounceWindow = debounceWindow;
        }
    }

    public static class Reconcile {
        private Duration debounceWindow = Duration.ofSeconds(60);

        public Duration getDebounceWindow() {
            return debounceWindow;
        }

        public void setDebounceWindow(Duration debounceWindow) {
            this.debounceWindow = debounceWindow;
        }
    }

    public static class Recovery {
        private boolean enabled = true;
        private Duration livenessTimeout = Duration.ofMinutes(30);
        private Duration checkInterval = Duration.ofMinutes(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getLivenessTimeout() {
            return livenessTimeout;
        }

        public void setLivenessTimeout(Duration livenessTimeout) {
            this.livenessTimeout = livenessTimeout;
        }

        public Duration getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
        }
    }

    public static class Dispatcher {
        private int poolSize = 4;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    /**
     * Outbound calls to the runtime API and the Git host.
     */
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private String githubApiUrl = "https://api.github.com";
        private int runtimePageSize = 100;

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public String getGithubApiUrl() {
            return githubApiUrl;
        }

        public void setGithubApiUrl(String githubApiUrl) {
            this.githubApiUrl = githubApiUrl;
        }

        public int getRuntimePageSize() {
            return runtimePageSize;
        }

        public void setRuntimePageSize(int runtimePageSize) {
            this.runtimePageSize = runtimePageSize;
        }
    }
}
