package engine;

import config.ConfigManager;
import config.RulesConfig;
import model.ActionChoice;
import model.FactionState;
import model.GameState;
import model.catalog.ActionCatalog;
import model.catalog.TechNode;
import model.catalog.TechTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleSupplier;

/**
 * Resolves one quarter: calendar, income, actions, detection, tech unlocks, then the
 * end-of-turn verdict. Every random draw comes from the supplied {@link DoubleSupplier},
 * so a fixed sequence of draws gives a fixed outcome.
 */
public final class TurnEngine {

    private final RulesConfig rules;
    private final ActionResolver actions;
    private final DetectionRoller detection;
    private final TechUnlocker unlocker;
    private final VictoryJudge judge;

    public TurnEngine(RulesConfig rules, ActionCatalog catalog, TechTree tree) {
        this.rules = rules;
        this.actions = new ActionResolver(rules, catalog);
        this.detection = new DetectionRoller(rules.detection());
        this.unlocker = new TechUnlocker(tree);
        this.judge = new VictoryJudge(rules.victory(), rules.calendar().maxTurn());
    }

    /** Engine wired to the bundled rules and catalogs. */
    public static TurnEngine standard() {
        ConfigManager cfg = ConfigManager.getInstance();
        return new TurnEngine(cfg.getRules(), cfg.getActions(), cfg.getTechTree());
    }

    public RulesConfig rules()  { return rules; }
    public VictoryJudge judge() { return judge; }

    /**
     * Advances {@code state} by one turn and appends the turn's entries to its log.
     * A finished game is left untouched.
     *
     * @param choices ordered choices keyed by faction id; missing factions act not at all
     * @return this turn's log entries
     */
    public List<String> resolveTurn(GameState state, Map<String, List<ActionChoice>> choices, DoubleSupplier rng) {
        if (state.isGameOver()) return List.of();
        Map<String, List<ActionChoice>> byFaction = (choices != null) ? choices : Collections.emptyMap();

        TurnLog log = new TurnLog();
        state.advanceCalendar();
        log.add("Turn " + state.turn() + ": " + state.year() + " Q" + state.quarter());

        for (FactionState f : state.factions()) judge.rulesFor(f).applyIncome(f);
        state.refreshGlobalSafety();

        for (String id : byFaction.keySet()) {
            if (state.faction(id) == null) log.add("Ignoring choices for unknown faction " + id + ".");
        }

        List<FactionState> deployers = new ArrayList<>();
        int limit = rules.calendar().actionsPerTurn();
        for (FactionState f : state.factions()) {
            List<ActionChoice> picked = byFaction.get(f.id());
            if (picked == null || picked.isEmpty()) continue;
            if (picked.size() > limit) {
                log.add(f.name() + " chose " + picked.size() + " actions; only the first " + limit + " resolve.");
            }
            for (ActionChoice choice : picked.subList(0, Math.min(limit, picked.size()))) {
                if (choice == null || choice.actionId() == null) {
                    log.add(f.name() + " submitted an empty action choice.");
                    continue;
                }
                try {
                    actions.resolve(state, f, choice, rng, log, deployers);
                } catch (RuntimeException ex) {
                    log.add(f.name() + "'s " + choice.actionId() + " failed: " + ex.getMessage());
                }
            }
        }
        state.refreshGlobalSafety();

        for (FactionState f : state.factions()) detection.roll(f, rng, log);
        state.refreshGlobalSafety();

        for (FactionState f : state.factions()) {
            for (TechNode node : unlocker.unlockAvailable(f)) {
                log.add(f.name() + " unlocked " + node.name() + ".");
            }
        }
        state.refreshGlobalSafety();

        judge.evaluate(state, deployers, log);

        List<String> entries = List.copyOf(log.entries());
        state.appendLog(entries);
        return entries;
    }
}
