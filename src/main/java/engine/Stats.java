package engine;

import model.Branch;
import model.FactionState;
import model.GameState;
import model.ResourceKey;
import model.ScoreKey;
import model.StatKey;

import java.util.Map;

/**
 * The clamped mutation path for resources, culture stats and scores. Anything that changes
 * those fields during a turn goes through here so every value stays inside [0,100].
 */
public final class Stats {
    public static final double MIN_STAT = 0;
    public static final double MAX_STAT = 100;

    private Stats() {}

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }

    /** Adds each present delta and clamps; absent or null entries are no-ops. */
    public static void applyResourceDelta(FactionState f, Map<ResourceKey, Double> deltas) {
        if (deltas == null) return;
        for (Map.Entry<ResourceKey, Double> e : deltas.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            applyResourceDelta(f, e.getKey(), e.getValue());
        }
    }

    public static void applyResourceDelta(FactionState f, ResourceKey key, double delta) {
        f.resources().set(key, clamp(f.resources().get(key) + delta, MIN_STAT, MAX_STAT));
    }

    public static void applyStatDelta(FactionState f, StatKey key, double delta) {
        f.setStat(key, clamp(f.stat(key) + delta, MIN_STAT, MAX_STAT));
    }

    public static void applyScoreDelta(FactionState f, ScoreKey key, double delta) {
        f.setScore(key, clamp(f.score(key) + delta, MIN_STAT, MAX_STAT));
    }

    public static void applyPublicOpinionDelta(FactionState f, double delta) {
        f.setPublicOpinion(clamp(f.publicOpinion() + delta, MIN_STAT, MAX_STAT));
    }

    public static void applySecurityLevelDelta(FactionState f, int delta) {
        int next = f.securityLevel() + delta;
        f.setSecurityLevel(Math.max(FactionState.MIN_SECURITY_LEVEL, Math.min(FactionState.MAX_SECURITY_LEVEL, next)));
    }

    /** Research pools never drop below zero. */
    public static void addResearch(FactionState f, Branch branch, double gain) {
        f.research().set(branch, Math.max(0, f.research().get(branch) + gain));
    }

    /**
     * Base research grant scaled by the resources that feed the branch:
     * compute/talent/data for capabilities, talent/safetyCulture/trust for safety,
     * capital/compute/talent for ops, influence/trust for policy.
     */
    public static double computeResearchGain(FactionState f, Branch branch, double base) {
        var r = f.resources();
        return switch (branch) {
            case CAPABILITIES -> base + r.compute() * 0.15 + r.talent() * 0.12 + r.data() * 0.1;
            case SAFETY       -> base + r.talent() * 0.1 + f.safetyCulture() * 0.15 + r.trust() * 0.05;
            case OPS          -> base + r.capital() * 0.1 + r.compute() * 0.05 + r.talent() * 0.05;
            case POLICY       -> base + r.influence() * 0.1 + r.trust() * 0.05;
        };
    }

    public static double computeGlobalSafety(GameState state) {
        return state.computeGlobalSafety();
    }
}
