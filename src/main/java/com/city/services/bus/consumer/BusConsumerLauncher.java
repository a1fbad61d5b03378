package com.city.services.bus.consumer;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.city.services.bus.bootstrap.BusBootstrapCompleteEvent;
import com.city.services.bus.codec.EnvelopeCodec;
import com.city.services.bus.config.BusProperties;
import com.city.services.bus.config.CityProperties;
import com.city.services.bus.naming.ConsumerName;

import io.nats.client.JetStream;

/**
 * Creates and starts one {@link BusConsumer} per subscription of every {@link BusEndpoint} bean.
 *
 * <p>Starts on application ready and again on bootstrap completion; start is idempotent, so
 * consumers also come up when stream bootstrapping is disabled.</p>
 */
@Component
public class BusConsumerLauncher implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(BusConsumerLauncher.class);

    private final JetStream js;
    private final EnvelopeCodec codec;
    private final CityProperties cityProps;
    private final BusProperties busProps;
    private final List<BusEndpoint> endpoints;

    private final List<BusConsumer> consumers = new ArrayList<>();

    public BusConsumerLauncher(JetStream js,
                               EnvelopeCodec codec,
                               CityProperties cityProps,
                               BusProperties busProps,
                               List<BusEndpoint> endpoints) {
        this.js = js;
        this.codec = codec;
        this.cityProps = cityProps;
        this.busProps = busProps;
        this.endpoints = endpoints;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        startAll();
    }

    @EventListener(BusBootstrapCompleteEvent.class)
    public void onBootstrapComplete() {
        startAll();
    }

    synchronized void startAll() {
        if (consumers.isEmpty()) {
            for (BusEndpoint endpoint : endpoints) {
                MessageDispatchTable table = new MessageDispatchTable(endpoint.role(), codec, endpoint.handlers());
                for (BusEndpoint.Subscription s : endpoint.subscriptions()) {
                    consumers.add(new BusConsumer(
                            js,
                            busProps.getStream().getName(),
                            ConsumerName.of(cityProps.getId(), endpoint.role(), s.channel()),
                            s.filterSubject(),
                            table,
                            busProps.getConsumer().getPollInterval(),
                            busProps.getConsumer().getSubscribeRetryInterval(),
                            busProps.getConsumer().getBatchSize()));
                }
            }
            log.info("Bus consumers prepared: endpoints={} consumers={}", endpoints.size(), consumers.size());
        }
        consumers.forEach(BusConsumer::start);
    }

    @Override
    public synchronized void destroy() {
        consumers.forEach(BusConsumer::stop);
    }
}
