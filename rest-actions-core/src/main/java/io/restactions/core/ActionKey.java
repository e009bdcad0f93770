package io.restactions.core;

import java.util.Objects;

/**
 * Identifies an action within a resource's {@link ActionRegistry}.
 *
 * <p>The string form is the kind's wire name ({@code get}, {@code list}, ...) or
 * {@code perform__<subaction>} for subactions.
 */
public record ActionKey(ActionKind kind, String subaction) {

    static final String PERFORM_PREFIX = "perform__";

    public static final ActionKey GET = new ActionKey(ActionKind.GET, null);
    public static final ActionKey CREATE = new ActionKey(ActionKind.CREATE, null);
    public static final ActionKey UPDATE = new ActionKey(ActionKind.UPDATE, null);
    public static final ActionKey DELETE = new ActionKey(ActionKind.DELETE, null);
    public static final ActionKey LIST = new ActionKey(ActionKind.LIST, null);

    public ActionKey {
        Objects.requireNonNull(kind, "kind");
        if (kind == ActionKind.PERFORM) {
            if (subaction == null || subaction.isBlank()) {
                throw new IllegalArgumentException("subaction name is required for perform actions");
            }
        } else if (subaction != null) {
            throw new IllegalArgumentException("subaction name is only valid for perform actions");
        }
    }

    public static ActionKey of(ActionKind kind) {
        return switch (kind) {
            case GET -> GET;
            case CREATE -> CREATE;
            case UPDATE -> UPDATE;
            case DELETE -> DELETE;
            case LIST -> LIST;
            case PERFORM -> throw new IllegalArgumentException("perform actions need a subaction name");
        };
    }

    public static ActionKey perform(String subaction) {
        return new ActionKey(ActionKind.PERFORM, subaction);
    }

    /**
     * Parses the string form produced by {@link #toString()}.
     */
    public static ActionKey parse(String key) {
        Objects.requireNonNull(key, "key");
        if (key.startsWith(PERFORM_PREFIX)) {
            return perform(key.substring(PERFORM_PREFIX.length()));
        }
        for (ActionKind kind : ActionKind.values()) {
            if (kind != ActionKind.PERFORM && kind.wireName().equals(key)) {
                return of(kind);
            }
        }
        throw new IllegalArgumentException("Unknown action '" + key + "'");
    }

    public boolean isSubaction() {
        return kind == ActionKind.PERFORM;
    }

    public HttpVerb defaultVerb() {
        return kind.verbFor(subaction);
    }

    @Override
    public String toString() {
        return isSubaction() ? PERFORM_PREFIX + subaction : kind.wireName();
    }
}
