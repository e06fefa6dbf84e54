package com.aporkolab.deadletter.routing;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.deadletter.exception.TransportException;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Makes sure the dead letter exchange, queue and binding of a mapping exist on the broker.
 * 
 * Design decisions:
 * - Declarations are idempotent on the broker, so the cache only saves round trips
 * - Declaring happens outside any lock; two concurrent first failures may both declare
 * - The cache only grows; destinations are never deleted by this process
 */
public class TopologyProvisioner {

    private static final Logger log = LoggerFactory.getLogger(TopologyProvisioner.class);

    static final boolean DURABLE = true;
    static final boolean EXCLUSIVE = false;
    static final boolean AUTO_DELETE = false;
    static final String BINDING_KEY = "#";

    private final QueueNamingConvention namingConvention;
    private final DeadLetterRoutingListener listener;

    // queue name -> exchange name
    private final Map<String, String> provisioned = new ConcurrentHashMap<>();

    public TopologyProvisioner(QueueNamingConvention namingConvention) {
        this(namingConvention, DeadLetterRoutingListener.NOOP);
    }

    public TopologyProvisioner(QueueNamingConvention namingConvention, DeadLetterRoutingListener listener) {
        this.namingConvention = namingConvention;
        this.listener = DeadLetterRoutingListener.composite(listener);
    }

    /**
     * Ensure the destination exists and return the exchange to publish to.
     *
     * @throws com.aporkolab.deadletter.exception.ConfigurationException if the dead letter
     *         type has no naming metadata
     * @throws TransportException if a declaration fails
     */
    public String ensure(Channel channel, DeadLetterMapping mapping) {
        DeadLetterTarget target = mapping.target();
        String queueName = namingConvention.queueName(target);
        String exchangeName = namingConvention.exchangeName(target);

        String cached = provisioned.get(queueName);
        if (cached != null) {
            return cached;
        }

        declare(channel, queueName, exchangeName);

        String existing = provisioned.putIfAbsent(queueName, exchangeName);
        if (existing != null) {
            return existing;
        }

        log.info("Provisioned dead letter queue '{}' bound to exchange '{}' for message type '{}'",
                queueName, exchangeName, mapping.messageType());
        listener.onProvisioned(mapping, queueName, exchangeName);
        return exchangeName;
    }

    /**
     * Dead letter queue name of a mapping under this provisioner's naming convention.
     */
    public String queueName(DeadLetterMapping mapping) {
        return namingConvention.queueName(mapping.target());
    }

    public boolean isProvisioned(String queueName) {
        return provisioned.containsKey(queueName);
    }

    /**
     * Snapshot of provisioned destinations, queue name to exchange name.
     */
    public Map<String, String> provisionedDestinations() {
        return Map.copyOf(provisioned);
    }

    public int provisionedCount() {
        return provisioned.size();
    }

    private void declare(Channel channel, String queueName, String exchangeName) {
        try {
            channel.exchangeDeclare(exchangeName, BuiltinExchangeType.TOPIC, DURABLE, AUTO_DELETE, null);
        } catch (IOException | ShutdownSignalException e) {
            throw TransportException.declareExchange(exchangeName, e);
        }

        try {
            channel.queueDeclare(queueName, DURABLE, EXCLUSIVE, AUTO_DELETE, null);
        } catch (IOException | ShutdownSignalException e) {
            throw TransportException.declareQueue(queueName, e);
        }

        try {
            channel.queueBind(queueName, exchangeName, BINDING_KEY);
        } catch (IOException | ShutdownSignalException e) {
            throw TransportException.bindQueue(queueName, e);
        }
    }
}
