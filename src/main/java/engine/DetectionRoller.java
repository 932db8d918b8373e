package engine;

import config.RulesConfig;
import model.FactionState;
import model.ResourceKey;
import model.ScoreKey;

import java.util.function.DoubleSupplier;

/** End-of-phase exposure check. Factions with no exposure are skipped without drawing a roll. */
public final class DetectionRoller {

    private final RulesConfig.Detection cfg;

    public DetectionRoller(RulesConfig.Detection cfg) {
        this.cfg = cfg;
    }

    public double chance(FactionState f) {
        double raw = cfg.baseChance() + f.exposure() * cfg.perExposure() - f.opsec() * cfg.opsecFactor();
        return Stats.clamp(raw, 0, cfg.maxChance());
    }

    /** @return true when the faction's secret activity was exposed */
    public boolean roll(FactionState f, DoubleSupplier rng, TurnLog log) {
        if (f.exposure() <= 0) return false;
        if (rng.getAsDouble() >= chance(f)) return false;

        Stats.applyResourceDelta(f, ResourceKey.TRUST, -cfg.trustPenalty());
        Stats.applyResourceDelta(f, ResourceKey.INFLUENCE, -cfg.influencePenalty());
        Stats.applyScoreDelta(f, ScoreKey.SAFETY, -cfg.safetyPenalty());
        Stats.applyPublicOpinionDelta(f, -cfg.trustPenalty());
        f.setExposure(0);
        log.add(f.name() + " was exposed for secret activity.");
        return true;
    }
}
