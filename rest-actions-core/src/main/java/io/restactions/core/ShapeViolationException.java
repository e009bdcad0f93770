package io.restactions.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised by a {@link ResultShape} when a value does not fit the declared type.
 */
public class ShapeViolationException extends Exception {

    /**
     * One problem found during validation.
     *
     * @param path    JSON path of the offending value ({@code $} for the root)
     * @param message what is wrong with it
     */
    public record Violation(String path, String message) {
        @Override
        public String toString() {
            return path + ": " + message;
        }
    }

    private final List<Violation> violations;

    public ShapeViolationException(List<Violation> violations, Throwable cause) {
        super(describe(violations), cause);
        this.violations = List.copyOf(violations);
    }

    public ShapeViolationException(String path, String message) {
        this(List.of(new Violation(path, message)), null);
    }

    public List<Violation> violations() {
        return violations;
    }

    /**
     * Returns a copy whose violation paths are nested under {@code prefix}.
     */
    public ShapeViolationException under(String prefix) {
        List<Violation> nested = violations.stream()
                .map(v -> new Violation(join(prefix, v.path()), v.message()))
                .collect(Collectors.toList());
        return new ShapeViolationException(nested, getCause());
    }

    private static String join(String prefix, String path) {
        if (path == null || path.equals("$")) return prefix;
        return path.startsWith("[") ? prefix + path : prefix + "." + path;
    }

    private static String describe(List<Violation> violations) {
        if (violations.size() == 1) {
            return violations.get(0).toString();
        }
        return violations.size() + " problems: " + violations.stream()
                .map(Violation::toString)
                .collect(Collectors.joining("; "));
    }
}
