package io.restactions.core;

import io.restactions.json.spi.JsonException;
import io.restactions.json.spi.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * Structural validator that turns an untyped {@link JsonNode} into a typed value.
 *
 * <p>Every configured action names a shape. {@link #unvalidated()} is the explicit
 * opt-out and returns the node itself.
 *
 * @param <T> the validated type
 */
public interface ResultShape<T> {

    /**
     * The Java type produced by {@link #validate(JsonNode)}.
     */
    Class<T> type();

    /**
     * Validates and converts a candidate value.
     *
     * @throws ShapeViolationException if the candidate does not fit
     */
    T validate(JsonNode candidate) throws ShapeViolationException;

    /**
     * False only for the pass-through shape.
     */
    default boolean validates() {
        return true;
    }

    /**
     * Shape backed by the codec's data binding ({@link JsonNode#toObject(Class)}).
     * JSON {@code null} is rejected rather than bound to a null value.
     */
    static <T> ResultShape<T> of(Class<T> type) {
        return new BoundShape<>(type);
    }

    /**
     * Shape with a hand written validator.
     */
    static <T> ResultShape<T> custom(Class<T> type, Validator<T> validator) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(validator, "validator");
        return new ResultShape<>() {
            @Override
            public Class<T> type() {
                return type;
            }

            @Override
            public T validate(JsonNode candidate) throws ShapeViolationException {
                return validator.validate(candidate);
            }
        };
    }

    /**
     * Explicit opt-out: the candidate is returned as is.
     */
    static ResultShape<JsonNode> unvalidated() {
        return PassThrough.INSTANCE;
    }

    @FunctionalInterface
    interface Validator<T> {
        T validate(JsonNode candidate) throws ShapeViolationException;
    }

    final class BoundShape<T> implements ResultShape<T> {
        private final Class<T> type;

        private BoundShape(Class<T> type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        @Override
        public Class<T> type() {
            return type;
        }

        @Override
        public T validate(JsonNode candidate) throws ShapeViolationException {
            if (candidate == null || candidate.isNull()) {
                throw new ShapeViolationException("$", "expected " + type.getSimpleName() + " but found null");
            }
            try {
                return candidate.toObject(type);
            } catch (JsonException e) {
                String path = e.path() == null ? "$" : e.path();
                throw new ShapeViolationException(List.of(new ShapeViolationException.Violation(path, e.getMessage())), e);
            }
        }

        @Override
        public String toString() {
            return "ResultShape[" + type.getName() + "]";
        }
    }

    final class PassThrough implements ResultShape<JsonNode> {
        static final PassThrough INSTANCE = new PassThrough();

        private PassThrough() {}

        @Override
        public Class<JsonNode> type() {
            return JsonNode.class;
        }

        @Override
        public JsonNode validate(JsonNode candidate) {
            return candidate;
        }

        @Override
        public boolean validates() {
            return false;
        }

        @Override
        public String toString() {
            return "ResultShape[unvalidated]";
        }
    }
}
