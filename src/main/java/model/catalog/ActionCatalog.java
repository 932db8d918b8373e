package model.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Closed, immutable set of actions keyed by id. Built once; broken entries fail construction. */
public final class ActionCatalog {
    private final Map<String, ActionDefinition> byId;

    public ActionCatalog(List<ActionDefinition> actions, Set<String> knownFactionIds) {
        Map<String, ActionDefinition> map = new LinkedHashMap<>();
        for (ActionDefinition a : actions) {
            if (a.id() == null || a.id().isBlank()) {
                throw new IllegalStateException("action without id: " + a);
            }
            if (a.kind() == null || !a.kind().id().equals(a.id())) {
                throw new IllegalStateException("action " + a.id() + " has kind " + a.kind() + "; kind must equal id");
            }
            if (a.allowedFor().isEmpty()) {
                throw new IllegalStateException("action " + a.id() + " is allowed for nobody");
            }
            if (a.isFactionSpecific() && !knownFactionIds.contains(a.factionSpecific())) {
                throw new IllegalStateException("action " + a.id() + " is specific to unknown faction " + a.factionSpecific());
            }
            if (map.put(a.id(), a) != null) {
                throw new IllegalStateException("duplicate action id: " + a.id());
            }
        }
        this.byId = Collections.unmodifiableMap(map);
    }

    public Optional<ActionDefinition> find(String id) {
        return Optional.ofNullable((id == null) ? null : byId.get(id));
    }

    /** @throws IllegalArgumentException for an id outside the catalog */
    public ActionDefinition require(String id) {
        ActionDefinition a = (id == null) ? null : byId.get(id);
        if (a == null) throw new IllegalArgumentException("Unknown action: " + id);
        return a;
    }

    public boolean contains(String id) { return id != null && byId.containsKey(id); }

    public Collection<ActionDefinition> all() { return byId.values(); }
}
