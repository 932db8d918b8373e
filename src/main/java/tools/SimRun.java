// src/main/java/tools/SimRun.java
package tools;

import config.ConfigManager;
import controller.DecisionPolicy;
import controller.HeuristicPolicy;
import engine.GameSetup;
import engine.ProgressReport;
import engine.Rng;
import engine.Stats;
import engine.TurnEngine;
import model.ActionChoice;
import model.FactionState;
import model.GameState;
import storage.SaveStore;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleSupplier;

/** Headless simulation: every faction played by the heuristic policy. */
public final class SimRun {

    public record Options(int turns, long seed, boolean showLog, String player, Path load, Path save) {

        public static Options parse(String[] args) {
            List<String> a = List.of(args);
            return new Options(
                    Integer.parseInt(value(a, "--turns", "32")),
                    Long.parseLong(value(a, "--seed", "42")),
                    a.contains("--log"),
                    value(a, "--player", null),
                    pathOrNull(value(a, "--load", null)),
                    pathOrNull(value(a, "--save", null)));
        }

        private static String value(List<String> args, String flag, String fallback) {
            int i = args.indexOf(flag);
            return (i == -1 || i == args.size() - 1) ? fallback : args.get(i + 1);
        }

        private static Path pathOrNull(String s) { return (s == null) ? null : Path.of(s); }
    }

    public static void main(String[] args) {
        Options opts;
        try {
            opts = Options.parse(args);
        } catch (NumberFormatException e) {
            System.err.println("Usage: SimRun [--turns 32] [--seed 42] [--log] [--player id] [--load file] [--save file]");
            System.exit(2);
            return;
        }
        try {
            run(opts, System.out);
        } catch (Exception e) {
            System.err.println("[Sim] failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    public static GameState run(Options opts, PrintStream out) throws IOException {
        ConfigManager cfg = ConfigManager.getInstance();
        TurnEngine engine = new TurnEngine(cfg.getRules(), cfg.getActions(), cfg.getTechTree());
        DecisionPolicy policy = new HeuristicPolicy(cfg.getFactions(), cfg.getActions(), cfg.getRules());
        DoubleSupplier rng = Rng.seeded(opts.seed());

        GameState state = (opts.load() != null)
                ? SaveStore.load(opts.load())
                : GameSetup.createInitialState(cfg.getFactions(), cfg.getRules().calendar(), opts.player());
        out.println("[Sim] seed=" + opts.seed() + " turns=" + opts.turns() + " start=" + state.year() + " Q" + state.quarter());

        for (int i = 0; i < opts.turns() && !state.isGameOver(); i++) {
            Map<String, List<ActionChoice>> choices = new LinkedHashMap<>();
            for (FactionState f : state.factions()) choices.put(f.id(), policy.decide(state, f.id(), rng));
            List<String> entries = engine.resolveTurn(state, choices, rng);
            if (opts.showLog()) entries.forEach(out::println);
        }

        printSummary(state, new ProgressReport(cfg.getRules()), out);
        if (opts.save() != null) SaveStore.save(state, opts.save());
        return state;
    }

    static void printSummary(GameState state, ProgressReport report, PrintStream out) {
        out.println("--- Summary ---");
        for (FactionState f : state.factions()) {
            out.println(f.name() + ": cap " + Stats.round1(f.capabilityScore())
                    + " / safety " + Stats.round1(f.safetyScore())
                    + " / trust " + Stats.round1(f.resources().trust())
                    + " / compute " + Stats.round1(f.resources().compute()));
            report.closestVictory(state, f.id()).ifPresent(p ->
                    out.println("    closest: " + p.label() + " " + p.progress() + "%"));
            report.mostUrgentThreat(state, f.id()).ifPresent(p ->
                    out.println("    threat:  " + p.label() + " " + p.progress() + "%"));
        }
        out.println("Global Safety: " + Stats.round1(state.globalSafety()));
        if (!state.isGameOver()) {
            out.println("Outcome: still running at turn " + state.turn());
        } else if (state.winnerId() != null) {
            out.println("Winner: " + state.faction(state.winnerId()).name() + " (" + state.victoryType() + ")");
        } else if (state.loserId() != null) {
            out.println("Loser: " + state.faction(state.loserId()).name() + " (" + state.lossType() + ")");
        } else {
            out.println("Outcome: " + state.lossType());
        }
    }
}
