package com.aporkolab.deadletter.routing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.deadletter.exception.InitializationException;

/**
 * Immutable mapping from message type id to its dead letter mapping.
 * 
 * Design decisions:
 * - Populated through explicit registration, never by scanning every loaded class
 * - Built once before consumers start; lookups need no locking afterwards
 * - A failed build leaves nothing behind: either every registration is applied or
 *   {@link InitializationException} is thrown and no registry exists
 */
public final class DeadLetterRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterRegistry.class);

    private static final DeadLetterRegistry EMPTY = new DeadLetterRegistry(Map.of());

    private final Map<String, DeadLetterMapping> mappings;

    private DeadLetterRegistry(Map<String, DeadLetterMapping> mappings) {
        this.mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DeadLetterRegistry empty() {
        return EMPTY;
    }

    public Optional<DeadLetterMapping> find(String messageType) {
        if (messageType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mappings.get(messageType));
    }

    public Set<String> messageTypes() {
        return mappings.keySet();
    }

    public int size() {
        return mappings.size();
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    public static final class Builder {

        private final List<Registration> registrations = new ArrayList<>();
        private final Map<String, DeadLetterMapping> entries = new LinkedHashMap<>();
        private boolean built;

        private Builder() {}

        /**
         * Register an explicit mapping.
         */
        public Builder register(String messageType, DeadLetterTarget target) {
            registrations.add(new Registration(messageType, () -> explicitMapping(messageType, () -> target)));
            return this;
        }

        /**
         * Register an explicit mapping from plain names, e.g. bound from configuration.
         * The target is validated when {@link #build()} runs.
         */
        public Builder register(String messageType, String deadLetterType, String queueName, String exchangeName) {
            registrations.add(new Registration(messageType, () -> explicitMapping(messageType,
                    () -> DeadLetterTarget.of(deadLetterType, queueName, exchangeName))));
            return this;
        }

        public Builder register(DeadLetterMapping mapping) {
            String source = mapping != null ? mapping.messageType() : null;
            registrations.add(new Registration(source, () -> {
                if (mapping == null) {
                    throw InitializationException.invalidMapping(null,
                            new IllegalArgumentException("mapping must not be null"));
                }
                return mapping;
            }));
            return this;
        }

        /**
         * Register a message type annotated with {@link DeadLetter}.
         * The annotation is read when {@link #build()} runs.
         */
        public Builder register(Class<?> messageType) {
            registrations.add(new Registration(messageType.getName(), () -> mappingOf(messageType)));
            return this;
        }

        public Builder registerAll(Collection<? extends Class<?>> messageTypes) {
            messageTypes.forEach(this::register);
            return this;
        }

        /**
         * Register an annotated message type by class name, loaded when {@link #build()} runs.
         */
        public Builder registerClassName(String className, ClassLoader classLoader) {
            registrations.add(new Registration(className, () -> mappingOf(load(className, classLoader))));
            return this;
        }

        public DeadLetterRegistry build() {
            if (built) {
                throw new IllegalStateException("DeadLetterRegistry.Builder can only be built once");
            }
            built = true;

            for (Registration registration : registrations) {
                try {
                    add(registration.mapping().get());
                } catch (InitializationException e) {
                    entries.clear();
                    throw e;
                } catch (RuntimeException | LinkageError e) {
                    entries.clear();
                    throw InitializationException.introspectionFailed(registration.source(), e);
                }
            }

            log.info("Dead letter registry built with {} mapping(s): {}", entries.size(), entries.keySet());
            return new DeadLetterRegistry(entries);
        }

        private void add(DeadLetterMapping mapping) {
            if (entries.containsKey(mapping.messageType())) {
                throw InitializationException.duplicateMessageType(mapping.messageType());
            }
            entries.put(mapping.messageType(), mapping);
        }

        private static DeadLetterMapping mappingOf(Class<?> type) {
            DeadLetter annotation = type.getAnnotation(DeadLetter.class);
            if (annotation == null) {
                InitializationException exception = new InitializationException(
                        String.format("Type '%s' is not annotated with @DeadLetter", type.getName()));
                exception.with("type", type.getName());
                throw exception;
            }
            String messageType = annotation.messageType().isBlank()
                    ? type.getSimpleName()
                    : annotation.messageType();
            return new DeadLetterMapping(messageType, DeadLetterTarget.of(annotation.value()));
        }

        private static DeadLetterMapping explicitMapping(String messageType, Supplier<DeadLetterTarget> target) {
            try {
                return new DeadLetterMapping(messageType, target.get());
            } catch (IllegalArgumentException e) {
                throw InitializationException.invalidMapping(messageType, e);
            }
        }

        private static Class<?> load(String className, ClassLoader classLoader) {
            try {
                return Class.forName(className, false, classLoader);
            } catch (ClassNotFoundException e) {
                throw InitializationException.introspectionFailed(className, e);
            }
        }
    }

    private record Registration(String source, Supplier<DeadLetterMapping> mapping) {}
}
