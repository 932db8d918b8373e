package model.catalog;

import model.Branch;
import model.FactionType;
import model.ResourceKey;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/** Static, read-only description of one selectable action. */
public record ActionDefinition(
        String id,
        String name,
        ActionKind kind,
        Set<FactionType> allowedFor,
        String factionSpecific,               // null = any faction of an allowed type
        Map<Branch, Double> baseResearch,
        Map<ResourceKey, Double> baseResourceDelta,
        double exposure,
        ScoreEffects scoreEffects,            // null = none
        int securityLevelDelta
) {
    public ActionDefinition {
        allowedFor = (allowedFor == null || allowedFor.isEmpty())
                ? Collections.unmodifiableSet(EnumSet.noneOf(FactionType.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(allowedFor));
        baseResearch = enumMap(Branch.class, baseResearch);
        baseResourceDelta = enumMap(ResourceKey.class, baseResourceDelta);
    }

    /** Immutable copy that iterates in enum declaration order. */
    static <K extends Enum<K>> Map<K, Double> enumMap(Class<K> keyType, Map<K, Double> src) {
        EnumMap<K, Double> out = new EnumMap<>(keyType);
        if (src != null) src.forEach((k, v) -> { if (k != null && v != null) out.put(k, v); });
        return Collections.unmodifiableMap(out);
    }

    public boolean isAllowedFor(FactionType type) { return allowedFor.contains(type); }

    public boolean isFactionSpecific() { return factionSpecific != null && !factionSpecific.isBlank(); }

    /** Capability / safety score deltas applied when the action resolves. */
    public record ScoreEffects(double capabilityDelta, double safetyDelta) { }
}
