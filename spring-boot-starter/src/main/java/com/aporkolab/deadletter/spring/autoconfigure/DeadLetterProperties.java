package com.aporkolab.deadletter.spring.autoconfigure;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.aporkolab.deadletter.routing.DefaultConsumerErrorStrategy;

/**
 * Configuration properties for typed dead letter routing.
 * 
 * Example application.yml:
 * <pre>
 * dead-letter:
 *   enabled: true
 *   scan-packages:
 *     - com.example.orders.messages
 *   mappings:
 *     - message-type: InvoiceIssued
 *       dead-letter-type: InvoiceIssuedDeadLetter
 *       queue-name: Invoice.Issued.DeadLetter
 *       exchange-name: Invoice.Issued.DeadLetter
 *   error-queue:
 *     name: default_error_queue
 *     exchange-prefix: ErrorExchange_
 *   metrics:
 *     enabled: true
 * </pre>
 */
@ConfigurationProperties(prefix = "dead-letter")
public class DeadLetterProperties {

    private boolean enabled = true;
    private List<String> scanPackages = new ArrayList<>();
    private List<MappingProperties> mappings = new ArrayList<>();
    private ErrorQueueProperties errorQueue = new ErrorQueueProperties();
    private MetricsProperties metrics = new MetricsProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getScanPackages() {
        return scanPackages;
    }

    public void setScanPackages(List<String> scanPackages) {
        this.scanPackages = scanPackages;
    }

    public List<MappingProperties> getMappings() {
        return mappings;
    }

    public void setMappings(List<MappingProperties> mappings) {
        this.mappings = mappings;
    }

    public ErrorQueueProperties getErrorQueue() {
        return errorQueue;
    }

    public void setErrorQueue(ErrorQueueProperties errorQueue) {
        this.errorQueue = errorQueue;
    }

    public MetricsProperties getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsProperties metrics) {
        this.metrics = metrics;
    }

    // ==================== NESTED PROPERTIES CLASSES ====================

    /**
     * A mapping declared in configuration, for message types the consumer cannot annotate.
     */
    public static class MappingProperties {
        private String messageType;
        private String deadLetterType;
        private String queueName;
        private String exchangeName;

        public String getMessageType() {
            return messageType;
        }

        public void setMessageType(String messageType) {
            this.messageType = messageType;
        }

        public String getDeadLetterType() {
            return deadLetterType;
        }

        public void setDeadLetterType(String deadLetterType) {
            this.deadLetterType = deadLetterType;
        }

        public String getQueueName() {
            return queueName;
        }

        public void setQueueName(String queueName) {
            this.queueName = queueName;
        }

        public String getExchangeName() {
            return exchangeName;
        }

        public void setExchangeName(String exchangeName) {
            this.exchangeName = exchangeName;
        }
    }

    public static class ErrorQueueProperties {
        private String name = DefaultConsumerErrorStrategy.DEFAULT_ERROR_QUEUE;
        private String exchangePrefix = DefaultConsumerErrorStrategy.DEFAULT_ERROR_EXCHANGE_PREFIX;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getExchangePrefix() {
            return exchangePrefix;
        }

        public void setExchangePrefix(String exchangePrefix) {
            this.exchangePrefix = exchangePrefix;
        }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
