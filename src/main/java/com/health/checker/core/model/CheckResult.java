package com.health.checker.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Result of invoking a check function: either success, or a lazy stream of failures.
 *
 * <p>The failure stream may be infinite. The runner consumes it only up to its failure
 * cap and closes it afterwards. An empty stream counts as success.</p>
 */
public sealed interface CheckResult permits CheckResult.Success, CheckResult.Failures {

    static CheckResult success() {
        return Success.INSTANCE;
    }

    static CheckResult failures(Stream<CheckerFailure> failures) {
        return new Failures(failures);
    }

    static CheckResult failures(List<CheckerFailure> failures) {
        return new Failures(failures.stream());
    }

    static CheckResult failures(CheckerFailure... failures) {
        return new Failures(Stream.of(failures));
    }

    final class Success implements CheckResult {
        private static final Success INSTANCE = new Success();

        private Success() {
        }

        @Override
        public String toString() {
            return "Success";
        }
    }

    record Failures(Stream<CheckerFailure> stream) implements CheckResult {
        public Failures {
            Objects.requireNonNull(stream, "stream is required");
        }
    }
}
