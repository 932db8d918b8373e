package controller;

import config.RulesConfig;
import model.ActionChoice;
import model.FactionState;
import model.GameState;
import model.Openness;
import model.catalog.ActionCatalog;
import model.catalog.FactionCatalog;
import model.catalog.StrategyProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleSupplier;

/**
 * Rule-of-thumb opponent driven by each faction's {@link StrategyProfile}. Labs deploy when
 * safe, otherwise balance research with economy; governments regulate, sponsor their own labs
 * and spy or defend.
 */
public final class HeuristicPolicy implements DecisionPolicy {

    private static final Map<String, List<String>> SPONSORED_LABS = Map.of(
            "us_gov", List.of("us_lab_a", "us_lab_b"),
            "cn_gov", List.of("cn_lab"));

    private static final double LOW_CAPITAL = 40;
    private static final double LOW_COMPUTE = 60;
    private static final double SUBSIDY_CAPITAL = 30;
    private static final double SPY_FOCUS = 35;

    private final FactionCatalog roster;
    private final ActionCatalog actions;
    private final RulesConfig.SafeAgi safe;

    public HeuristicPolicy(FactionCatalog roster, ActionCatalog actions, RulesConfig rules) {
        this.roster = roster;
        this.actions = actions;
        this.safe = rules.victory().safeAgi();
    }

    @Override
    public List<ActionChoice> decide(GameState state, String factionId, DoubleSupplier rng) {
        FactionState f = state.faction(factionId);
        if (f == null) return List.of();
        StrategyProfile strategy = roster.strategyFor(factionId);
        Openness openness = (rng.getAsDouble() * 100 < strategy.opennessPreference()) ? Openness.OPEN : Openness.SECRET;

        List<ActionChoice> choices = new ArrayList<>();
        if (f.isLab()) {
            if (f.canDeployAgi()
                    && f.safetyScore() >= safe.factionSafety()
                    && state.globalSafety() >= safe.globalSafety()) {
                return List.of(ActionChoice.open("deploy_agi"));
            }
            boolean safetyFirst = f.safetyScore() < safe.factionSafety()
                    || strategy.safetyFocus() > strategy.riskTolerance();
            choices.add(new ActionChoice(safetyFirst ? "research_safety" : "research_capabilities", openness));

            if (f.resources().capital() < LOW_CAPITAL) {
                choices.add(ActionChoice.open("deploy_products"));
            } else if (f.resources().compute() < LOW_COMPUTE) {
                choices.add(ActionChoice.open("build_compute"));
            } else {
                List<String> options = new ArrayList<>();
                for (String id : List.of("policy", "deploy_products", "build_compute")) {
                    if (actions.contains(id)) options.add(id);
                }
                int pick = Math.min(options.size() - 1, (int) Math.floor(rng.getAsDouble() * options.size()));
                choices.add(ActionChoice.open(options.get(pick)));
            }
        } else {
            FactionState top = topCapabilityLab(state);
            if (state.globalSafety() < safe.globalSafety() && top != null) {
                choices.add(ActionChoice.open("regulate").targeting(top.id()));
            }

            FactionState weakest = SPONSORED_LABS.getOrDefault(factionId, List.of()).stream()
                    .map(state::faction)
                    .filter(lab -> lab != null)
                    .min(Comparator.comparingDouble(FactionState::capabilityScore))
                    .orElse(null);
            if (weakest != null && f.resources().capital() > SUBSIDY_CAPITAL) {
                choices.add(ActionChoice.open("subsidize").targeting(weakest.id()));
            } else {
                choices.add(ActionChoice.open("policy"));
            }

            if (strategy.espionageFocus() > SPY_FOCUS) {
                if (top != null && !top.id().equals(factionId)) {
                    choices.add(ActionChoice.secret("espionage").targeting(top.id()));
                }
            } else {
                choices.add(ActionChoice.open("counterintel"));
            }
        }
        return List.copyOf(choices.subList(0, Math.min(2, choices.size())));
    }

    /** Highest capability lab; the earliest in roster order wins ties. */
    static FactionState topCapabilityLab(GameState state) {
        FactionState best = null;
        for (FactionState lab : state.labs()) {
            if (best == null || lab.capabilityScore() > best.capabilityScore()) best = lab;
        }
        return best;
    }
}
