package com.health.checker.registry;

import com.health.checker.core.model.Cadence;
import com.health.checker.core.model.RegisteredChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Immutable registration table of all known checkers, built once at process start and
 * handed to the runner and dispatcher.
 *
 * <p>Registration order is preserved. Names must be unique; {@link Builder#build()} fails
 * with a {@link DuplicateCheckerException} otherwise.</p>
 */
public class CheckerRegistry {
    private static final Logger log = LoggerFactory.getLogger(CheckerRegistry.class);

    private final Map<String, RegisteredChecker> checkers;

    private CheckerRegistry(Map<String, RegisteredChecker> checkers) {
        this.checkers = Collections.unmodifiableMap(new LinkedHashMap<>(checkers));
    }

    public static CheckerRegistry of(RegisteredChecker... checkers) {
        Builder builder = builder();
        for (RegisteredChecker checker : checkers) {
            builder.register(checker);
        }
        return builder.build();
    }

    /**
     * Builds a registry from every {@link CheckerProvider} visible to the given class loader.
     */
    public static CheckerRegistry fromServiceLoader(ClassLoader classLoader) {
        Builder builder = builder();
        int providers = 0;
        for (CheckerProvider provider : ServiceLoader.load(CheckerProvider.class, classLoader)) {
            builder.registerAll(provider.checkers());
            providers++;
        }
        CheckerRegistry registry = builder.build();
        log.info("registry.loaded providers={} checkers={}", providers, registry.size());
        return registry;
    }

    public Optional<RegisteredChecker> get(String name) {
        return Optional.ofNullable(checkers.get(name));
    }

    public boolean contains(String name) {
        return checkers.containsKey(name);
    }

    /**
     * Returns the checkers of the given cadence in registration order.
     */
    public List<RegisteredChecker> forCadence(Cadence cadence) {
        return checkers.values().stream()
                .filter(c -> c.cadence() == cadence)
                .toList();
    }

    public Collection<RegisteredChecker> all() {
        return checkers.values();
    }

    public int size() {
        return checkers.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, RegisteredChecker> checkers = new LinkedHashMap<>();
        private final List<RegisteredChecker> duplicates = new ArrayList<>();

        public Builder register(RegisteredChecker checker) {
            if (checkers.putIfAbsent(checker.name(), checker) != null) {
                duplicates.add(checker);
            }
            return this;
        }

        public Builder registerAll(Collection<RegisteredChecker> toRegister) {
            toRegister.forEach(this::register);
            return this;
        }

        public CheckerRegistry build() {
            if (!duplicates.isEmpty()) {
                throw new DuplicateCheckerException(duplicates);
            }
            return new CheckerRegistry(checkers);
        }
    }
}
