package common.dto;

import model.Branch;
import model.FactionType;
import model.ResourceKey;

import java.util.List;
import java.util.Map;

public record FactionDTO(
        String id,
        String name,
        FactionType type,
        Map<ResourceKey, Double> resources,
        Map<Branch, Double> research,
        List<String> unlockedTechs,
        double safetyCulture,
        double opsec,
        double capabilityScore,
        double safetyScore,
        double exposure,
        boolean canDeployAgi,
        double publicOpinion,
        int securityLevel
) { }
