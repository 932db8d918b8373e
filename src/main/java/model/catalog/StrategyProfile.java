package model.catalog;

/** Behavioural leanings (0-100) a decision policy reads for one faction. */
public record StrategyProfile(
        double riskTolerance,
        double safetyFocus,
        double opennessPreference,
        double espionageFocus
) { }
