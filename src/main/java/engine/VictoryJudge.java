package engine;

import config.RulesConfig;
import model.FactionState;
import model.GameState;
import model.LossType;
import model.VictoryType;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides how a game ends. Checks run in priority order: AGI deployments first, then each
 * faction's own win and loss conditions in roster order, then the turn-limit fallback.
 */
public final class VictoryJudge {

    private final RulesConfig.Victory v;
    private final int maxTurn;
    private final LabRules labRules;
    private final GovernmentRules govRules;

    public VictoryJudge(RulesConfig.Victory victory, int maxTurn) {
        this.v = victory;
        this.maxTurn = maxTurn;
        this.labRules = new LabRules(victory);
        this.govRules = new GovernmentRules(victory, maxTurn);
    }

    public LabRules labRules()        { return labRules; }
    public GovernmentRules govRules() { return govRules; }

    public FactionRules rulesFor(FactionState f) {
        return FactionRules.of(f.type(), labRules, govRules);
    }

    /**
     * Deployment succeeds as safe AGI above both safety thresholds, ends in catastrophe below
     * either catastrophe threshold, and is otherwise held back. Deployment verdicts apply from
     * the first turn; the minimum victory turn only gates the per-faction checks.
     */
    public Optional<Verdict> judgeDeployment(GameState state, FactionState lab) {
        double safety = lab.safetyScore();
        double global = state.globalSafety();
        if (safety >= v.safeAgi().factionSafety() && global >= v.safeAgi().globalSafety()) {
            return Optional.of(Verdict.win(lab.id(), VictoryType.SAFE_AGI,
                    lab.name() + " deployed safe AGI and wins."));
        }
        if (safety < v.catastrophe().safetyThreshold() || global < v.catastrophe().globalSafetyThreshold()) {
            return Optional.of(Verdict.lose(lab.id(), LossType.CATASTROPHE,
                    lab.name() + " deployed unsafe AGI. Global catastrophe."));
        }
        return Optional.empty();
    }

    /**
     * Applies the first decisive result to {@code state} and logs it.
     *
     * @param deployers labs that attempted AGI deployment this turn, in resolution order
     */
    public void evaluate(GameState state, List<FactionState> deployers, TurnLog log) {
        for (FactionState lab : deployers) {
            Optional<Verdict> d = judgeDeployment(state, lab);
            if (d.isEmpty()) {
                log.add(lab.name() + " held back AGI deployment: safety is not sufficient yet.");
                continue;
            }
            Verdict verdict = d.get();
            log.add(verdict.message());
            if (verdict.isVictory()) state.declareVictory(verdict.factionId(), verdict.victory());
            else state.declareLoss(verdict.factionId(), verdict.loss());
            return;
        }

        for (FactionState f : state.factions()) {
            FactionRules rules = rulesFor(f);
            Optional<Verdict> win = rules.checkVictory(state, f);
            if (win.isPresent()) {
                log.add(win.get().message());
                state.declareVictory(f.id(), win.get().victory());
                return;
            }
            Optional<Verdict> loss = rules.checkLoss(state, f);
            if (loss.isPresent()) {
                if (f.id().equals(state.playerFactionId())) {
                    log.add(loss.get().message());
                    state.declareLoss(f.id(), loss.get().loss());
                    return;
                }
                log.add("Warning: " + loss.get().message());
            }
        }

        if (state.turn() >= maxTurn) decideAtTurnLimit(state, log);
    }

    /**
     * Reached only when no faction resolved at the horizon, which includes a minimum victory
     * turn configured past the turn limit.
     */
    private void decideAtTurnLimit(GameState state, TurnLog log) {
        List<FactionState> govs = state.governments();
        if (!govs.isEmpty() && govRules.labsAreSafe(state)) {
            FactionState best = govs.stream()
                    .max(Comparator.comparingDouble((FactionState g) -> g.resources().influence())
                            .thenComparingDouble(g -> g.resources().trust()))
                    .orElseThrow();
            log.add(best.name() + " secured a regulatory victory.");
            state.declareVictory(best.id(), VictoryType.REGULATORY);
            return;
        }
        log.add("The race ended in a stalemate.");
        state.declareStalemate();
    }
}
