package com.city.services.bus.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * =====================================================================
 * BusProperties
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Declarative definition of the single JetStream stream backing the city
 * bus, how strictly an existing stream is validated at startup, and how
 * the pull consumers poll it.
 *
 * CONFIGURATION PREFIX
 * --------------------
 * city.bus.*
 *
 * DEFAULTS
 * --------
 *   name:       CITY_BUS
 *   subjects:   city.>
 *   retention:  Limits   (several services read the same subject space)
 *   storage:    File
 *   maxAge:     1 day
 */
@ConfigurationProperties(prefix = "city.bus")
public class BusProperties {

    private StreamSpec stream = StreamSpec.defaults();

    /**
     * WHEN TRUE: startup fails when an existing stream differs from {@link #stream}.
     * WHEN FALSE: a warning is logged and startup continues.
     *
     * This flag never modifies or migrates an existing stream.
     */
    private boolean failOnMismatch = false;

    private Consumer consumer = new Consumer();

    public StreamSpec getStream() { return stream; }
    public void setStream(StreamSpec stream) { this.stream = stream; }

    public boolean isFailOnMismatch() { return failOnMismatch; }
    public void setFailOnMismatch(boolean failOnMismatch) { this.failOnMismatch = failOnMismatch; }

    public Consumer getConsumer() { return consumer; }
    public void setConsumer(Consumer consumer) { this.consumer = consumer; }

    /**
     * Pull loop tuning shared by every bus consumer.
     */
    public static class Consumer {

        /** Time between pull requests. */
        private Duration pollInterval = Duration.ofSeconds(1);

        /** Messages requested per pull. */
        private int batchSize = 10;

        /** Time between subscription attempts while the stream does not exist yet. */
        private Duration subscribeRetryInterval = Duration.ofSeconds(2);

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public Duration getSubscribeRetryInterval() { return subscribeRetryInterval; }
        public void setSubscribeRetryInterval(Duration subscribeRetryInterval) { this.subscribeRetryInterval = subscribeRetryInterval; }
    }

    public static class StreamSpec {

        private String name;
        private List<String> subjects = new ArrayList<>();
        private Duration maxAge;
        private String retentionPolicy = "Limits";
        private String storageType = "File";
        private int replicas = 1;
        private List<String> placementTags = new ArrayList<>();

        public static StreamSpec defaults() {
            StreamSpec s = new StreamSpec();
            s.name = "CITY_BUS";
            s.subjects = List.of("city.>");
            s.maxAge = Duration.ofDays(1);
            return s;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<String> getSubjects() { return subjects; }
        public void setSubjects(List<String> subjects) { this.subjects = subjects; }

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

        public String getRetentionPolicy() { return retentionPolicy; }
        public void setRetentionPolicy(String retentionPolicy) { this.retentionPolicy = retentionPolicy; }

        public String getStorageType() { return storageType; }
        public void setStorageType(String storageType) { this.storageType = storageType; }

        public int getReplicas() { return replicas; }
        public void setReplicas(int replicas) { this.replicas = replicas; }

        public List<String> getPlacementTags() { return placementTags; }
        public void setPlacementTags(List<String> placementTags) { this.placementTags = placementTags; }
    }
}
