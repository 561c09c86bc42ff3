package com.stockbook.application.config;

import com.stockbook.domain.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Problems found in a configuration, each tied to the {@link ConfigKey} it concerns.
 */
public final class ConfigValidationResult {

    /** One rejected setting. */
    public record Problem(ConfigKey key, String message) {
        public Problem {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String toString() {
            return key.key() + ": " + message;
        }
    }

    private final List<Problem> problems = new ArrayList<>();

    void reject(ConfigKey key, String message) {
        problems.add(new Problem(key, message));
    }

    public boolean isValid() {
        return problems.isEmpty();
    }

    public List<Problem> problems() {
        return Collections.unmodifiableList(problems);
    }

    public boolean rejected(ConfigKey key) {
        return problems.stream().anyMatch(p -> p.key() == key);
    }

    /**
     * @throws ValidationException naming the first rejected key and listing every problem
     */
    public void throwIfInvalid() {
        if (isValid()) return;
        throw new ValidationException(problems.get(0).key().key(), toString());
    }

    @Override
    public String toString() {
        if (isValid()) return "config OK";
        return "Invalid configuration: " + problems.stream().map(Problem::toString).collect(Collectors.joining("; "));
    }
}
