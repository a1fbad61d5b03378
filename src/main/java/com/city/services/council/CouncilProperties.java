package com.city.services.council;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * =====================================================================
 * CouncilProperties
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Every tunable of the council: supervision cadence and restart budget,
 * how department processes are launched, where department templates are
 * discovered, the analysis schedule and the decision policy table.
 *
 * CONFIGURATION PREFIX
 * --------------------
 * city.council.*
 *
 * The decision policy is configuration, not business truth: the
 * thresholds and lists below may be changed per city, but every policy
 * keeps the approved / deferred / rejected split.
 */
@ConfigurationProperties(prefix = "city.council")
public class CouncilProperties {

    private Supervision supervision = new Supervision();
    private Launch launch = new Launch();
    private Registry registry = new Registry();
    private Analysis analysis = new Analysis();
    private Policy policy = new Policy();

    /**
     * Routing-aware consumers that receive every department change notification.
     */
    private List<String> routingConsumers = new ArrayList<>(List.of("emergency_dispatch_center"));

    public Supervision getSupervision() { return supervision; }
    public void setSupervision(Supervision supervision) { this.supervision = supervision; }

    public Launch getLaunch() { return launch; }
    public void setLaunch(Launch launch) { this.launch = launch; }

    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }

    public Analysis getAnalysis() { return analysis; }
    public void setAnalysis(Analysis analysis) { this.analysis = analysis; }

    public Policy getPolicy() { return policy; }
    public void setPolicy(Policy policy) { this.policy = policy; }

    public List<String> getRoutingConsumers() { return routingConsumers; }
    public void setRoutingConsumers(List<String> routingConsumers) { this.routingConsumers = routingConsumers; }

    public static class Supervision {

        /** Time between supervision ticks. */
        private Duration tickInterval = Duration.ofSeconds(30);

        /**
         * Time a health request may stay unanswered before it counts as a health failure.
         */
        private Duration silenceWindow = Duration.ofSeconds(60);

        /** Consecutive failures (either counter) that trigger a restart. */
        private int failureThreshold = 3;

        /** Restarts allowed before a department is permanently failed. */
        private int maxRestarts = 3;

        public Duration getTickInterval() { return tickInterval; }
        public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }

        public Duration getSilenceWindow() { return silenceWindow; }
        public void setSilenceWindow(Duration silenceWindow) { this.silenceWindow = silenceWindow; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public int getMaxRestarts() { return maxRestarts; }
        public void setMaxRestarts(int maxRestarts) { this.maxRestarts = maxRestarts; }
    }

    public static class Launch {

        /**
         * Command used to launch a department; {@code {name}} is replaced by the department name.
         */
        private List<String> command = new ArrayList<>(List.of("ruby", "generic_department.rb", "{name}"));

        /** Working directory of launched departments; defaults to the registry directory. */
        private String workingDirectory;

        /** Time between a polite stop request and a forced kill. */
        private Duration terminationGrace = Duration.ofSeconds(5);

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }

        public String getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }

        public Duration getTerminationGrace() { return terminationGrace; }
        public void setTerminationGrace(Duration terminationGrace) { this.terminationGrace = terminationGrace; }
    }

    public static class Registry {

        /** Directory scanned for {@code *_department.yml} and {@code *_department.rb} templates. */
        private String directory = ".";

        /** Names always reported, whether or not a template file exists. */
        private List<String> staticDepartments = new ArrayList<>();

        /** Template files that are not departments themselves. */
        private List<String> excludedFiles = new ArrayList<>(List.of("generic_department.rb"));

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public List<String> getStaticDepartments() { return staticDepartments; }
        public void setStaticDepartments(List<String> staticDepartments) { this.staticDepartments = staticDepartments; }

        public List<String> getExcludedFiles() { return excludedFiles; }
        public void setExcludedFiles(List<String> excludedFiles) { this.excludedFiles = excludedFiles; }
    }

    public static class Analysis {

        private boolean enabled = true;

        /** Minimum time between two analysis requests. */
        private Duration interval = Duration.ofMinutes(5);

        /** Below this many departments there is nothing worth analyzing. */
        private int minimumDepartments = 3;

        private List<String> analyzers = new ArrayList<>(List.of("doge", "doge_vsm"));

        private List<String> focusAreas = new ArrayList<>(List.of("cost_reduction", "service_overlap", "utilization"));

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        public int getMinimumDepartments() { return minimumDepartments; }
        public void setMinimumDepartments(int minimumDepartments) { this.minimumDepartments = minimumDepartments; }

        public List<String> getAnalyzers() { return analyzers; }
        public void setAnalyzers(List<String> analyzers) { this.analyzers = analyzers; }

        public List<String> getFocusAreas() { return focusAreas; }
        public void setFocusAreas(List<String> focusAreas) { this.focusAreas = focusAreas; }
    }

    public static class Policy {

        /** Consolidation is approved above this similarity (exclusive) when savings also qualify. */
        private double approveSimilarityAbove = 70.0;

        /** Consolidation savings must exceed this for approval. */
        private double approveSavingsAbove = 100_000.0;

        /**
         * Consolidation with similarity above this value (exclusive) and at most
         * {@link #approveSimilarityAbove} is deferred. Higher similarity that misses the savings bar is rejected.
         */
        private double deferSimilarityAbove = 50.0;

        /** Substrings marking departments that are never terminated. */
        private List<String> protectedDepartments = new ArrayList<>(
                List.of("police", "fire", "health", "emergency_dispatch_center"));

        /** Termination reasons approved without further review. */
        private List<String> autoApprovedTerminationReasons = new ArrayList<>(
                List.of("redundant", "obsolete", "unused"));

        /** Days between a decision and its effective date. */
        private int effectiveAfterDays = 30;

        /**
         * Delay between broadcasting an approved change and the change becoming binding for
         * routing-aware consumers. Zero means immediately.
         */
        private Duration changeEffectiveDelay = Duration.ZERO;

        /** Decisions remembered for redelivery detection. */
        private int ledgerCapacity = 1024;

        public double getApproveSimilarityAbove() { return approveSimilarityAbove; }
        public void setApproveSimilarityAbove(double approveSimilarityAbove) { this.approveSimilarityAbove = approveSimilarityAbove; }

        public double getApproveSavingsAbove() { return approveSavingsAbove; }
        public void setApproveSavingsAbove(double approveSavingsAbove) { this.approveSavingsAbove = approveSavingsAbove; }

        public double getDeferSimilarityAbove() { return deferSimilarityAbove; }
        public void setDeferSimilarityAbove(double deferSimilarityAbove) { this.deferSimilarityAbove = deferSimilarityAbove; }

        public List<String> getProtectedDepartments() { return protectedDepartments; }
        public void setProtectedDepartments(List<String> protectedDepartments) { this.protectedDepartments = protectedDepartments; }

        public List<String> getAutoApprovedTerminationReasons() { return autoApprovedTerminationReasons; }
        public void setAutoApprovedTerminationReasons(List<String> autoApprovedTerminationReasons) { this.autoApprovedTerminationReasons = autoApprovedTerminationReasons; }

        public int getEffectiveAfterDays() { return effectiveAfterDays; }
        public void setEffectiveAfterDays(int effectiveAfterDays) { this.effectiveAfterDays = effectiveAfterDays; }

        public Duration getChangeEffectiveDelay() { return changeEffectiveDelay; }
        public void setChangeEffectiveDelay(Duration changeEffectiveDelay) { this.changeEffectiveDelay = changeEffectiveDelay; }

        public int getLedgerCapacity() { return ledgerCapacity; }
        public void setLedgerCapacity(int ledgerCapacity) { this.ledgerCapacity = ledgerCapacity; }
    }
}
