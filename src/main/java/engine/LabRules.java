package engine;

import config.RulesConfig;
import model.Branch;
import model.FactionState;
import model.GameState;
import model.LossType;
import model.ResourceKey;
import model.VictoryType;

import java.util.Optional;

/** Labs: capital and research income, dominance / public-trust wins, obsolescence / collapse losses. */
public final class LabRules implements FactionRules {

    private final RulesConfig.Victory v;

    public LabRules(RulesConfig.Victory victory) {
        this.v = victory;
    }

    @Override
    public void applyIncome(FactionState f) {
        var r = f.resources();
        Stats.applyResourceDelta(f, ResourceKey.CAPITAL, 4 + r.trust() * 0.04 + r.influence() * 0.02);

        double base = 8 + r.compute() * 0.08 + r.data() * 0.05;
        double cap = f.capabilityScore();
        double safety = f.safetyScore();
        double capShare = (cap + safety > 0) ? cap / (cap + safety) : 0.5;

        Stats.addResearch(f, Branch.CAPABILITIES, 0.6 * base * (0.5 + capShare));
        // the flat +2 keeps safety research flowing for capability-heavy labs
        Stats.addResearch(f, Branch.SAFETY, 0.4 * base * (1.5 - capShare) + 2);
        Stats.addResearch(f, Branch.OPS, 0.25 * base);
    }

    @Override
    public Optional<Verdict> checkVictory(GameState state, FactionState f) {
        if (state.turn() < v.minVictoryTurn()) return Optional.empty();

        double cap = f.capabilityScore();
        if (cap >= v.dominant().minCapability()) {
            double best = maxRivalCapability(state, f);
            if (best <= 0 || (cap - best) / best * 100 >= v.dominant().capabilityLeadPercent()) {
                return Optional.of(Verdict.win(f.id(), VictoryType.DOMINANT,
                        f.name() + " achieved a dominant capability lead and wins."));
            }
        }
        if (f.resources().trust() >= v.publicTrust().minTrust() && cap >= v.publicTrust().minCapability()) {
            return Optional.of(Verdict.win(f.id(), VictoryType.PUBLIC_TRUST,
                    f.name() + " earned overwhelming public trust and wins."));
        }
        return Optional.empty();
    }

    @Override
    public Optional<Verdict> checkLoss(GameState state, FactionState f) {
        if (state.turn() < v.minVictoryTurn()) return Optional.empty();

        if (f.resources().trust() < v.collapse().minTrust()) {
            return Optional.of(Verdict.lose(f.id(), LossType.COLLAPSE,
                    f.name() + " lost public trust and collapsed."));
        }
        if (hasRival(state, f)
                && maxRivalCapability(state, f) - f.capabilityScore() >= v.obsolescence().capabilityGap()) {
            return Optional.of(Verdict.lose(f.id(), LossType.OBSOLESCENCE,
                    f.name() + " fell hopelessly behind and became obsolete."));
        }
        return Optional.empty();
    }

    private static boolean hasRival(GameState state, FactionState f) {
        for (FactionState lab : state.labs()) if (!lab.id().equals(f.id())) return true;
        return false;
    }

    private static double maxRivalCapability(GameState state, FactionState f) {
        double best = 0;
        for (FactionState lab : state.labs()) {
            if (!lab.id().equals(f.id())) best = Math.max(best, lab.capabilityScore());
        }
        return best;
    }
}
