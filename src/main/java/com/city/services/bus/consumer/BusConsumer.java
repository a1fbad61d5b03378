package com.city.services.bus.consumer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.city.services.bus.codec.MalformedMessageException;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.ReplayPolicy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Durable, explicit-ack pull consumer feeding one {@link MessageDispatchTable}.
 *
 * <h2>Operational behavior</h2>
 * <ul>
 *   <li>Never crashes the Spring context if the stream does not exist yet; subscription is
 *       retried on a fixed interval.</li>
 *   <li>New durables start at {@link DeliverPolicy#New}: health probes and announcements from
 *       before this process started are stale.</li>
 *   <li>Malformed messages are acked and dropped; handler failures are left unacked for
 *       redelivery.</li>
 * </ul>
 */
public class BusConsumer {

    private static final Logger log = LoggerFactory.getLogger(BusConsumer.class);

    /** JetStream API error code for "stream not found". */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    /**
     * Max wait per nextMessage() so shutdown stays responsive.
     */
    private static final Duration NEXT_MESSAGE_POLL = Duration.ofMillis(250);

    private final JetStream js;
    private final String stream;
    private final String durable;
    private final String filterSubject;
    private final MessageDispatchTable table;
    private final Duration pollInterval;
    private final Duration subscribeRetryInterval;
    private final int batchSize;

    private final AtomicReference<Disposable> running = new AtomicReference<>();

    public BusConsumer(JetStream js,
                       String stream,
                       String durable,
                       String filterSubject,
                       MessageDispatchTable table,
                       Duration pollInterval,
                       Duration subscribeRetryInterval,
                       int batchSize) {
        this.js = js;
        this.stream = stream;
        this.durable = durable;
        this.filterSubject = filterSubject;
        this.table = table;
        this.pollInterval = pollInterval;
        this.subscribeRetryInterval = subscribeRetryInterval;
        this.batchSize = batchSize;
    }

    /**
     * Idempotently starts the subscribe / pull / ack loop.
     */
    public void start() {
        if (running.get() != null) {
            return;
        }

        ConsumerConfiguration consumerConfig = ConsumerConfiguration.builder()
                .durable(durable)
                .deliverPolicy(DeliverPolicy.New)
                .replayPolicy(ReplayPolicy.Instant)
                .ackPolicy(AckPolicy.Explicit)
                .filterSubject(filterSubject)
                .build();

        PullSubscribeOptions pso = PullSubscribeOptions.builder()
                .stream(stream)
                .configuration(consumerConfig)
                .build();

        Disposable d = Flux.interval(Duration.ZERO, subscribeRetryInterval)
                .publishOn(Schedulers.boundedElastic())
                .concatMap(tick -> subscribeAndConsumeOnce(pso)
                        .onErrorResume(err -> {
                            log.warn("Consumer loop ended with error. Will retry subscription. stream={} durable={} err={}",
                                    stream, durable, err.toString());
                            return Mono.empty();
                        }))
                .subscribe(
                        v -> { },
                        err -> log.error("Consumer supervisor terminated unexpectedly: durable={} err={}",
                                durable, err.toString(), err)
                );

        if (!running.compareAndSet(null, d)) {
            d.dispose();
        }
    }

    private Mono<Void> subscribeAndConsumeOnce(PullSubscribeOptions pso) {
        return Mono.fromCallable(() -> {
                    try {
                        JetStreamSubscription sub = js.subscribe(filterSubject, pso);
                        log.info("Subscribed: stream={} filter={} durable={}", stream, filterSubject, durable);
                        return sub;
                    } catch (JetStreamApiException jse) {
                        if (jse.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR) {
                            log.warn("Waiting for stream to exist: stream={}. Will retry...", stream);
                            return null;
                        }
                        throw jse;
                    }
                })
                .flatMap(sub -> consumePullLoop(sub)
                        .doFinally(sig -> {
                            try {
                                sub.unsubscribe();
                            } catch (Exception e) {
                                log.debug("Unsubscribe failed (ignored): {}", e.toString());
                            }
                        }));
    }

    private Mono<Void> consumePullLoop(JetStreamSubscription sub) {
        return Flux.interval(pollInterval)
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(t -> sub.pull(batchSize))
                .concatMap(t -> Flux.<Message>generate(sink -> {
                    try {
                        Message m = sub.nextMessage(NEXT_MESSAGE_POLL);
                        if (m == null) {
                            sink.complete();
                        } else {
                            sink.next(m);
                        }
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        sink.complete();
                    } catch (Exception e) {
                        sink.error(e);
                    }
                }))
                .doOnNext(this::handle)
                .then();
    }

    /**
     * Per-message handling; never propagates so one bad message cannot stop the loop.
     */
    void handle(Message msg) {
        String subject = msg.getSubject();
        try {
            MessageDispatchTable.Outcome outcome = table.dispatch(subject, msg.getData());
            msg.ack();
            log.debug("Consumed durable={} subject={} outcome={}", durable, subject, outcome);
        } catch (MalformedMessageException e) {
            log.warn("Dropping malformed message durable={} subject={} reason={}", durable, subject, e.getMessage());
            msg.ack();
        } catch (RuntimeException e) {
            log.warn("Message handling failed; message not acked. durable={} subject={} err={}",
                    durable, subject, e.toString(), e);
        }
    }

    public String durable() {
        return durable;
    }

    public void stop() {
        Disposable d = running.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
