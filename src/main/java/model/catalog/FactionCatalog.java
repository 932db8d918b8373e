package model.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class FactionCatalog {
    private final Map<String, FactionTemplate> byId;

    public FactionCatalog(List<FactionTemplate> templates) {
        Map<String, FactionTemplate> map = new LinkedHashMap<>();
        for (FactionTemplate t : templates) {
            if (t.id() == null || t.id().isBlank()) throw new IllegalStateException("faction without id: " + t);
            if (t.type() == null) throw new IllegalStateException("faction " + t.id() + " has no type");
            if (t.strategy() == null) throw new IllegalStateException("Missing strategy for " + t.id());
            if (map.put(t.id(), t) != null) throw new IllegalStateException("duplicate faction id: " + t.id());
        }
        this.byId = Collections.unmodifiableMap(map);
    }

    public Collection<FactionTemplate> all() { return byId.values(); }
    public Set<String> ids() { return byId.keySet(); }
    public FactionTemplate template(String id) { return byId.get(id); }

    /** @throws IllegalStateException when the faction has no template */
    public StrategyProfile strategyFor(String factionId) {
        FactionTemplate t = byId.get(factionId);
        if (t == null) throw new IllegalStateException("Missing strategy for " + factionId);
        return t.strategy();
    }
}
