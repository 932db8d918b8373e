package model.catalog;

import model.Branch;

import java.util.List;

public record TechNode(
        String id,
        String name,
        Branch branch,
        double cost,
        List<String> prereqs,
        List<TechEffect> effects
) {
    public TechNode {
        prereqs = (prereqs == null) ? List.of() : List.copyOf(prereqs);
        effects = (effects == null) ? List.of() : List.copyOf(effects);
    }
}
