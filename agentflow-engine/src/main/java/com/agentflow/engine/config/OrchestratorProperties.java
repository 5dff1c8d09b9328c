package com.agentflow.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine settings bound from the {@code agentflow} prefix.
 */
@ConfigurationProperties(prefix = "agentflow")
public class OrchestratorProperties {

    /**
     * Threads available for worker invocations across all runs.
     */
    private int workerPoolSize = 8;

    /**
     * Threads available for runs started in the background.
     */
    private int runPoolSize = 4;

    /**
     * Deadline of a worker invocation when neither the worker nor the run sets one.
     */
    private Duration defaultWorkerTimeout = Duration.ofMinutes(5);

    /**
     * How long an interactive run waits at an approval gate before treating it as declined.
     */
    private Duration approvalTimeout = Duration.ofMinutes(30);

    /**
     * YAML catalogs loaded at startup.
     */
    private List<String> catalogLocations = new ArrayList<>(List.of("classpath*:workflows/*.yml"));

    /**
     * Number of terminal runs kept for inspection.
     */
    private int runRetention = 100;

    /**
     * How long shutdown waits for active runs before cancelling them.
     */
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    public int getRunPoolSize() {
        return runPoolSize;
    }

    public void setRunPoolSize(int runPoolSize) {
        this.runPoolSize = runPoolSize;
    }

    public Duration getDefaultWorkerTimeout() {
        return defaultWorkerTimeout;
    }

    public void setDefaultWorkerTimeout(Duration defaultWorkerTimeout) {
        this.defaultWorkerTimeout = defaultWorkerTimeout;
    }

    public Duration getApprovalTimeout() {
        return approvalTimeout;
    }

    public void setApprovalTimeout(Duration approvalTimeout) {
        this.approvalTimeout = approvalTimeout;
    }

    public List<String> getCatalogLocations() {
        return catalogLocations;
    }

    public void setCatalogLocations(List<String> catalogLocations) {
        this.catalogLocations = catalogLocations;
    }

    public int getRunRetention() {
        return runRetention;
    }

    public void setRunRetention(int runRetention) {
        this.runRetention = runRetention;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }
}
