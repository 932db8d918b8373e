package engine;

import config.RulesConfig;
import model.Branch;
import model.FactionState;
import model.GameState;
import model.ResourceKey;

import java.util.function.DoubleSupplier;

/** Research theft between factions. One success roll, then one independent detection roll. */
public final class Espionage {

    private final RulesConfig.Espionage cfg;

    public Espionage(RulesConfig.Espionage cfg) {
        this.cfg = cfg;
    }

    /** Success probability from the attacker's offense against the target's opsec, clamped. */
    public double successChance(FactionState attacker, FactionState target) {
        double raw = cfg.baseSuccess()
                + attacker.opsec() * cfg.attackFactor()
                - target.opsec() * cfg.defenseFactor();
        return Stats.clamp(raw, cfg.minChance(), cfg.maxChance());
    }

    public void resolve(GameState state, FactionState attacker, FactionState target,
                        DoubleSupplier rng, TurnLog log) {
        if (rng.getAsDouble() < successChance(attacker, target)) {
            Branch branch = target.research().largest();
            double stolen = Math.min(cfg.maxSteal(), target.research().get(branch));
            target.research().set(branch, target.research().get(branch) - stolen);
            Stats.addResearch(attacker, branch, stolen);
            log.addf("%s stole %.1f %s research from %s.", attacker.name(), stolen,
                    branch.name().toLowerCase(java.util.Locale.ROOT), target.name());
        } else {
            log.add(attacker.name() + "'s espionage against " + target.name() + " came up empty.");
        }

        if (rng.getAsDouble() < cfg.detectionChance()) {
            Stats.applyResourceDelta(attacker, ResourceKey.TRUST, -cfg.attackerTrustPenalty());
            Stats.applyResourceDelta(attacker, ResourceKey.INFLUENCE, -cfg.attackerInfluencePenalty());
            Stats.applyResourceDelta(target, ResourceKey.TRUST, cfg.targetTrustGain());
            Stats.applyPublicOpinionDelta(attacker, -cfg.attackerTrustPenalty() / 2);
            double tension = state.tension(attacker.id(), target.id()) + cfg.tensionOnDetection();
            state.setTension(attacker.id(), target.id(), Stats.clamp(tension, Stats.MIN_STAT, Stats.MAX_STAT));
            log.add(attacker.name() + " was caught conducting espionage against " + target.name() + ".");
        }
    }
}
