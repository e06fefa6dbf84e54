package com.aporkolab.deadletter.spring.autoconfigure;

import com.aporkolab.deadletter.metrics.DeadLetterMetrics;
import com.aporkolab.deadletter.routing.ConsumerErrorStrategy;
import com.aporkolab.deadletter.routing.DeadLetterRegistry;
import com.aporkolab.deadletter.routing.DeadLetterRoutingListener;
import com.aporkolab.deadletter.routing.DefaultConsumerErrorStrategy;
import com.aporkolab.deadletter.routing.QueueNamingConvention;
import com.aporkolab.deadletter.routing.Republisher;
import com.aporkolab.deadletter.routing.RetryGate;
import com.aporkolab.deadletter.routing.TopologyProvisioner;
import com.aporkolab.deadletter.routing.TypedDeadLetterStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ResourceLoader;

/**
 * Spring Boot Auto-Configuration for typed dead letter routing.
 * 
 * Automatically configures:
 * - Dead letter registry from scanned {@code @DeadLetter} types and configured mappings
 * - Topology provisioner, republisher and retry gate
 * - Default error-queue strategy as the fallback
 * - Typed dead letter strategy as the primary {@link ConsumerErrorStrategy}
 * - Routing metrics when a MeterRegistry is present
 * 
 * Every {@link DeadLetterRoutingListener} bean, metrics included, is notified of routing events.
 * 
 * Requires a Spring AMQP ConnectionFactory bean. Disable with: dead-letter.enabled=false
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@ConditionalOnClass(ConnectionFactory.class)
@ConditionalOnBean(ConnectionFactory.class)
@EnableConfigurationProperties(DeadLetterProperties.class)
@ConditionalOnProperty(prefix = "dead-letter", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DeadLetterAutoConfiguration {

    // ==================== REGISTRY ====================

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterRegistry deadLetterRegistry(DeadLetterProperties properties, ResourceLoader resourceLoader) {
        ClassLoader classLoader = resourceLoader.getClassLoader();
        DeadLetterRegistry.Builder builder = DeadLetterRegistry.builder();

        if (!properties.getScanPackages().isEmpty()) {
            for (String className : new DeadLetterTypeScanner(classLoader).scan(properties.getScanPackages())) {
                builder.registerClassName(className, classLoader);
            }
        }

        for (DeadLetterProperties.MappingProperties mapping : properties.getMappings()) {
            builder.register(mapping.getMessageType(), mapping.getDeadLetterType(),
                    mapping.getQueueName(), mapping.getExchangeName());
        }

        return builder.build();
    }

    // ==================== ROUTING ====================

    @Bean
    @ConditionalOnMissingBean
    public QueueNamingConvention deadLetterQueueNamingConvention() {
        return QueueNamingConvention.typeSuffixed();
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologyProvisioner deadLetterTopologyProvisioner(QueueNamingConvention namingConvention,
                                                             ObjectProvider<DeadLetterRoutingListener> listeners) {
        return new TopologyProvisioner(namingConvention, allListeners(listeners));
    }

    @Bean
    @ConditionalOnMissingBean
    public Republisher deadLetterRepublisher() {
        return new Republisher();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryGate deadLetterRetryGate(DeadLetterRegistry registry) {
        return new RetryGate(registry);
    }

    // ==================== STRATEGIES ====================

    @Bean
    @ConditionalOnMissingBean(name = "defaultConsumerErrorStrategy")
    public DefaultConsumerErrorStrategy defaultConsumerErrorStrategy(ConnectionFactory connectionFactory,
                                                                     ObjectProvider<ObjectMapper> objectMapper,
                                                                     DeadLetterProperties properties) {
        var errorQueue = properties.getErrorQueue();
        return new DefaultConsumerErrorStrategy(connectionFactory,
                objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules()),
                errorQueue.getName(),
                errorQueue.getExchangePrefix());
    }

    @Bean
    @Primary
    @ConditionalOnMissingBean(TypedDeadLetterStrategy.class)
    public TypedDeadLetterStrategy typedDeadLetterStrategy(
            ConnectionFactory connectionFactory,
            RetryGate retryGate,
            TopologyProvisioner provisioner,
            Republisher republisher,
            @Qualifier("defaultConsumerErrorStrategy") ConsumerErrorStrategy fallback,
            ObjectProvider<DeadLetterRoutingListener> listeners) {
        return new TypedDeadLetterStrategy(connectionFactory, retryGate, provisioner, republisher, fallback,
                allListeners(listeners));
    }

    private static DeadLetterRoutingListener allListeners(ObjectProvider<DeadLetterRoutingListener> listeners) {
        return DeadLetterRoutingListener.composite(listeners.orderedStream().toList());
    }

    // ==================== METRICS ====================

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "dead-letter.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public DeadLetterMetrics deadLetterMetrics(MeterRegistry registry) {
            return new DeadLetterMetrics(registry);
        }
    }
}
