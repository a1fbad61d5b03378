package com.city.services.bus.bootstrap;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import com.city.services.bus.config.BusProperties;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.Placement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;

/**
 * =====================================================================
 * BusBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Ensures the city bus stream exists at startup.
 *
 *  - Missing stream: created from {@link BusProperties#getStream()}.
 *  - Existing stream: compared field by field; a mismatch fails startup or
 *    logs a warning depending on {@code city.bus.fail-on-mismatch}.
 *  - Never modifies an existing stream.
 *
 * On success a {@link BusBootstrapCompleteEvent} is published so the bus
 * consumers can subscribe immediately instead of waiting for their retry.
 */
@Component
@ConditionalOnProperty(prefix = "city.bus.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = false)
public class BusBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BusBootstrapper.class);

    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStreamManagement jsm;
    private final BusProperties props;
    private final ApplicationEventPublisher publisher;

    public BusBootstrapper(JetStreamManagement jsm, BusProperties props, ApplicationEventPublisher publisher) {
        this.jsm = jsm;
        this.props = props;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        StreamConfiguration desired = toStreamConfig(props.getStream());
        ensureStream(desired);
        publisher.publishEvent(new BusBootstrapCompleteEvent(desired.getName()));
        log.info("Bus bootstrap complete: stream={}", desired.getName());
    }

    void ensureStream(StreamConfiguration desired) throws Exception {
        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            validateExisting(desired, existing.getConfiguration());
            return;
        } catch (JetStreamApiException e) {
            // Only a missing stream is created; permission and server failures propagate.
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
        }

        jsm.addStream(desired);

        log.info("Created JetStream stream: {} (subjects={}, maxAge={}, retention={}, storage={}, replicas={})",
                desired.getName(),
                desired.getSubjects(),
                desired.getMaxAge(),
                desired.getRetentionPolicy(),
                desired.getStorageType(),
                desired.getReplicas());
    }

    void validateExisting(StreamConfiguration desired, StreamConfiguration actual) {
        List<String> diffs = new ArrayList<>();

        if (!Objects.equals(actual.getRetentionPolicy(), desired.getRetentionPolicy())) {
            diffs.add("retentionPolicy actual=" + actual.getRetentionPolicy() + " expected=" + desired.getRetentionPolicy());
        }
        if (!Objects.equals(actual.getStorageType(), desired.getStorageType())) {
            diffs.add("storageType actual=" + actual.getStorageType() + " expected=" + desired.getStorageType());
        }
        if (!Objects.equals(actual.getMaxAge(), desired.getMaxAge())) {
            diffs.add("maxAge actual=" + actual.getMaxAge() + " expected=" + desired.getMaxAge());
        }
        if (actual.getReplicas() != desired.getReplicas()) {
            diffs.add("replicas actual=" + actual.getReplicas() + " expected=" + desired.getReplicas());
        }
        if (!setEquals(actual.getSubjects(), desired.getSubjects())) {
            diffs.add("subjects actual=" + actual.getSubjects() + " expected=" + desired.getSubjects());
        }

        if (diffs.isEmpty()) {
            log.info("JetStream stream exists and matches config: {} (subjects={})",
                    desired.getName(), actual.getSubjects());
            return;
        }

        String msg = "JetStream stream exists but differs from expected: "
                + desired.getName() + " :: " + String.join("; ", diffs);

        if (props.isFailOnMismatch()) {
            throw new IllegalStateException(msg);
        }
        log.warn(msg);
    }

    static StreamConfiguration toStreamConfig(BusProperties.StreamSpec spec) {
        String name = spec.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        List<String> subjects = spec.getSubjects();
        if (subjects == null || subjects.isEmpty()) {
            throw new IllegalArgumentException("subjects is required for stream " + name);
        }
        Duration maxAge = Objects.requireNonNull(spec.getMaxAge(), "maxAge is required for stream " + name);

        StreamConfiguration.Builder b = StreamConfiguration.builder()
                .name(name)
                .subjects(subjects.toArray(String[]::new))
                .retentionPolicy(parseRetentionPolicy(spec.getRetentionPolicy()))
                .storageType(parseStorageType(spec.getStorageType()))
                .maxAge(maxAge)
                .replicas(spec.getReplicas());

        List<String> tags = spec.getPlacementTags();
        if (tags != null && !tags.isEmpty()) {
            b.placement(Placement.builder().tags(tags.toArray(String[]::new)).build());
        }
        return b.build();
    }

    private static boolean setEquals(List<String> a, List<String> b) {
        Set<String> sa = new HashSet<>(a == null ? List.of() : a);
        Set<String> sb = new HashSet<>(b == null ? List.of() : b);
        return sa.equals(sb);
    }

    static RetentionPolicy parseRetentionPolicy(String value) {
        if (value == null || value.isBlank()) {
            return RetentionPolicy.Limits;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "workqueue", "work_queue", "work-queue" -> RetentionPolicy.WorkQueue;
            case "limits" -> RetentionPolicy.Limits;
            case "interest" -> RetentionPolicy.Interest;
            default -> throw new IllegalArgumentException("Unsupported retentionPolicy: " + value);
        };
    }

    static StorageType parseStorageType(String value) {
        if (value == null || value.isBlank()) {
            return StorageType.File;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new IllegalArgumentException("Unsupported storageType: " + value);
        };
    }
}
