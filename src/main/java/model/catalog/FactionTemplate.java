package model.catalog;

import model.FactionType;
import model.ResourceKey;

import java.util.Map;

/** Starting roster entry. {@code publicOpinion} / {@code securityLevel} may be absent. */
public record FactionTemplate(
        String id,
        String name,
        FactionType type,
        Map<ResourceKey, Double> resources,
        double safetyCulture,
        double opsec,
        double capabilityScore,
        double safetyScore,
        Double publicOpinion,
        Integer securityLevel,
        StrategyProfile strategy
) {
    public FactionTemplate {
        resources = ActionDefinition.enumMap(ResourceKey.class, resources);
    }
}
