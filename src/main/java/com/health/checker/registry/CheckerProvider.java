package com.health.checker.registry;

import com.health.checker.core.model.RegisteredChecker;

import java.util.List;

/**
 * Service provider contributing checkers to the registry.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader}; list them in
 * {@code META-INF/services/com.health.checker.registry.CheckerProvider}.</p>
 */
public interface CheckerProvider {

    /**
     * Returns the checkers this provider contributes.
     */
    List<RegisteredChecker> checkers();
}
