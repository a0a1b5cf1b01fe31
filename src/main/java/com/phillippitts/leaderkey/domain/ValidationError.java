package com.phillippitts.leaderkey.domain;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Validation finding for one node, addressed by the child indices leading to it from the root.
 */
public record ValidationError(List<Integer> path, ValidationErrorType type) {

    public ValidationError {
        Objects.requireNonNull(type, "type must not be null");
        path = path == null ? List.of() : List.copyOf(path);
    }

    /** {@code "/"}-joined index path, e.g. {@code "2/0"}. The root is {@code ""}. */
    public String pathKey() {
        return pathKey(path);
    }

    public static String pathKey(List<Integer> path) {
        return path.stream().map(String::valueOf).collect(Collectors.joining("/"));
    }
}
