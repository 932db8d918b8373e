package engine;

import config.RulesConfig;
import model.Branch;
import model.FactionState;
import model.GameState;
import model.LossType;
import model.ResourceKey;
import model.VictoryType;

import java.util.Optional;

/**
 * Governments: capital and policy income, regulatory / alliance / control wins,
 * collapse / coup losses. The regulatory win only becomes available at the turn limit.
 */
public final class GovernmentRules implements FactionRules {

    private final RulesConfig.Victory v;
    private final int maxTurn;

    public GovernmentRules(RulesConfig.Victory victory, int maxTurn) {
        this.v = victory;
        this.maxTurn = maxTurn;
    }

    @Override
    public void applyIncome(FactionState f) {
        var r = f.resources();
        Stats.applyResourceDelta(f, ResourceKey.CAPITAL, 5 + r.influence() * 0.03 + r.trust() * 0.02);
        Stats.addResearch(f, Branch.POLICY, 5 + r.influence() * 0.05);
    }

    @Override
    public Optional<Verdict> checkVictory(GameState state, FactionState f) {
        if (state.turn() < v.minVictoryTurn()) return Optional.empty();

        if (state.turn() >= maxTurn && labsAreSafe(state)) {
            return Optional.of(Verdict.win(f.id(), VictoryType.REGULATORY,
                    f.name() + " secured a regulatory victory."));
        }
        double influence = f.resources().influence();
        if (influence >= v.alliance().minInfluence() && countAllies(state, f) >= v.alliance().minAllies()) {
            return Optional.of(Verdict.win(f.id(), VictoryType.ALLIANCE,
                    f.name() + " built a winning coalition."));
        }
        if (influence >= v.control().minInfluence() && labsAreContained(state)) {
            return Optional.of(Verdict.win(f.id(), VictoryType.CONTROL,
                    f.name() + " established control over AI development."));
        }
        return Optional.empty();
    }

    @Override
    public Optional<Verdict> checkLoss(GameState state, FactionState f) {
        if (f.resources().trust() < v.collapse().minTrust()) {
            return Optional.of(Verdict.lose(f.id(), LossType.COLLAPSE,
                    f.name() + " lost public trust and collapsed."));
        }
        if (f.resources().influence() < v.coup().minInfluence()) {
            for (FactionState lab : state.labs()) {
                if (lab.capabilityScore() >= v.coup().labCapabilityDanger()) {
                    return Optional.of(Verdict.lose(f.id(), LossType.COUP,
                            f.name() + " was overpowered by " + lab.name() + "."));
                }
            }
        }
        return Optional.empty();
    }

    /** Every lab at or above the lab safety floor and global safety at or above its floor. */
    boolean labsAreSafe(GameState state) {
        if (state.globalSafety() < v.regulatory().globalSafetyMin()) return false;
        for (FactionState lab : state.labs()) {
            if (lab.safetyScore() < v.regulatory().labSafetyMin()) return false;
        }
        return true;
    }

    private boolean labsAreContained(GameState state) {
        for (FactionState lab : state.labs()) {
            if (lab.capabilityScore() > v.control().labCapabilityMax()) return false;
        }
        return true;
    }

    private int countAllies(GameState state, FactionState f) {
        int n = 0;
        for (FactionState other : state.factions()) {
            if (!other.id().equals(f.id()) && other.resources().trust() >= v.alliance().minTrust()) n++;
        }
        return n;
    }
}
