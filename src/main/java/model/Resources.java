package model;

import java.util.EnumMap;
import java.util.Map;

/**
 * The six faction resources. Raw setters do not clamp; gameplay code goes through
 * {@code engine.Stats} which keeps every value inside [0,100].
 */
public final class Resources {
    private final EnumMap<ResourceKey, Double> values = new EnumMap<>(ResourceKey.class);

    public Resources() {
        for (ResourceKey k : ResourceKey.values()) values.put(k, 0.0);
    }

    public static Resources of(Map<ResourceKey, Double> initial) {
        Resources r = new Resources();
        if (initial != null) initial.forEach((k, v) -> { if (k != null && v != null) r.set(k, v); });
        return r;
    }

    public double get(ResourceKey key) { return values.get(key); }
    public void   set(ResourceKey key, double value) { values.put(key, value); }

    public double compute()   { return get(ResourceKey.COMPUTE); }
    public double talent()    { return get(ResourceKey.TALENT); }
    public double capital()   { return get(ResourceKey.CAPITAL); }
    public double data()      { return get(ResourceKey.DATA); }
    public double influence() { return get(ResourceKey.INFLUENCE); }
    public double trust()     { return get(ResourceKey.TRUST); }

    public Map<ResourceKey, Double> view() { return java.util.Collections.unmodifiableMap(new EnumMap<>(values)); }

    public Resources copy() { return of(values); }

    @Override public boolean equals(Object o) {
        return o instanceof Resources r && r.values.equals(values);
    }
    @Override public int hashCode() { return values.hashCode(); }
    @Override public String toString() { return values.toString(); }
}
