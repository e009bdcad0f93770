package io.restactions.core;

import java.util.Set;

/**
 * The operations a resource can expose.
 */
public enum ActionKind {
    GET("get", HttpVerb.GET),
    CREATE("create", HttpVerb.POST),
    UPDATE("update", HttpVerb.PATCH),
    DELETE("delete", HttpVerb.DELETE),
    LIST("list", HttpVerb.GET),
    PERFORM("perform", HttpVerb.GET);

    /** Subactions that mutate server state and are therefore posted. */
    static final Set<String> POSTED_SUBACTIONS = Set.of("replace", "cancel");

    private final String wireName;
    private final HttpVerb defaultVerb;

    ActionKind(String wireName, HttpVerb defaultVerb) {
        this.wireName = wireName;
        this.defaultVerb = defaultVerb;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Verb used when a config does not override it.
     *
     * @param subaction subaction name for {@link #PERFORM}, ignored otherwise
     */
    public HttpVerb verbFor(String subaction) {
        if (this == PERFORM && subaction != null && POSTED_SUBACTIONS.contains(subaction)) {
            return HttpVerb.POST;
        }
        return defaultVerb;
    }
}
