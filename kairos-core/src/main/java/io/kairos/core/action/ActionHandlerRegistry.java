package io.kairos.core.action;

import io.kairos.core.job.ActionType;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class ActionHandlerRegistry {
    private final Map<ActionType, ActionHandler> handlers = new ConcurrentHashMap<>();

    public void register(ActionHandler handler) {
        handlers.put(handler.type(), handler);
    }

    public Optional<ActionHandler> find(ActionType type) {
        return type == null ? Optional.empty() : Optional.ofNullable(handlers.get(type));
    }

    public Collection<ActionHandler> all() {
        return handlers.values();
    }
}
