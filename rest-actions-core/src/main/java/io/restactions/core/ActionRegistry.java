package io.restactions.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The actions one resource allows, keyed by {@link ActionKey}.
 *
 * <p>Get, create, update and list produce the resource's entity type {@code E}; subactions
 * declare their own shapes. A key absent from the registry is not allowed for the resource.
 *
 * <pre>{@code
 * ActionRegistry<Payroll> payrolls = ActionRegistry.builder(Payroll.class)
 *         .get("payroll")
 *         .create("payroll")
 *         .list("payrolls")
 *         .subaction("cancel", "payroll")
 *         .build();
 * }</pre>
 *
 * @param <E> the entity type
 */
public final class ActionRegistry<E> {

    private final ResultShape<E> entityShape;
    private final Map<ActionKey, ActionConfig<?>> actions;

    private ActionRegistry(ResultShape<E> entityShape, Map<ActionKey, ActionConfig<?>> actions) {
        this.entityShape = entityShape;
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    public static <E> Builder<E> builder(Class<E> entityType) {
        return new Builder<>(ResultShape.of(entityType));
    }

    public static <E> Builder<E> builder(ResultShape<E> entityShape) {
        return new Builder<>(entityShape);
    }

    public ResultShape<E> entityShape() {
        return entityShape;
    }

    public boolean allows(ActionKey key) {
        return actions.containsKey(key);
    }

    public Optional<ActionConfig<?>> find(ActionKey key) {
        return Optional.ofNullable(actions.get(key));
    }

    /**
     * Lookup for the entity producing kinds (get, create, update, list) and delete.
     */
    @SuppressWarnings("unchecked")
    Optional<ActionConfig<E>> entityAction(ActionKey key) {
        if (key.isSubaction()) {
            throw new IllegalArgumentException("subactions are not entity actions: " + key);
        }
        // the builder only admits entity-shaped configs for these keys
        return Optional.ofNullable((ActionConfig<E>) actions.get(key));
    }

    public Set<ActionKey> keys() {
        return actions.keySet();
    }

    @Override
    public String toString() {
        return "ActionRegistry" + actions.keySet();
    }

    public static final class Builder<E> {
        private final ResultShape<E> entityShape;
        private final Map<ActionKey, ActionConfig<?>> actions = new LinkedHashMap<>();

        private Builder(ResultShape<E> entityShape) {
            this.entityShape = Objects.requireNonNull(entityShape, "entityShape");
        }

        public Builder<E> get(String unwrapKey) {
            return entity(ActionKey.GET, unwrapKey);
        }

        public Builder<E> create(String unwrapKey) {
            return entity(ActionKey.CREATE, unwrapKey);
        }

        public Builder<E> update(String unwrapKey) {
            return entity(ActionKey.UPDATE, unwrapKey);
        }

        /**
         * Enables list; the unwrapped value must be an array whose elements fit the entity shape.
         */
        public Builder<E> list(String unwrapKey) {
            return entity(ActionKey.LIST, unwrapKey);
        }

        /**
         * Enables delete. The response body is not inspected.
         */
        public Builder<E> delete() {
            return put(ActionConfig.of(ActionKey.DELETE, entityShape));
        }

        /**
         * Adds an entity action with a non default verb or other overrides.
         */
        public Builder<E> action(ActionConfig<E> config) {
            if (config.key().isSubaction()) {
                throw RestActionException.configuration("Use subaction(...) for '" + config.key() + "'");
            }
            return put(config);
        }

        /**
         * Subaction producing the entity type.
         */
        public Builder<E> subaction(String name, String unwrapKey) {
            return put(ActionConfig.subaction(name, entityShape).withUnwrapKey(unwrapKey));
        }

        public Builder<E> subaction(ActionConfig<?> config) {
            if (!config.key().isSubaction()) {
                throw RestActionException.configuration("The action '" + config.key() + "' is not a subaction");
            }
            return put(config);
        }

        private Builder<E> entity(ActionKey key, String unwrapKey) {
            return put(ActionConfig.of(key, entityShape).withUnwrapKey(unwrapKey));
        }

        private Builder<E> put(ActionConfig<?> config) {
            if (actions.putIfAbsent(config.key(), config) != null) {
                throw RestActionException.configuration("The action '" + config.key() + "' is configured twice");
            }
            return this;
        }

        public ActionRegistry<E> build() {
            return new ActionRegistry<>(entityShape, actions);
        }
    }
}
