package engine;

import config.ConfigManager;
import config.RulesConfig;
import model.FactionState;
import model.FactionType;
import model.GameState;
import model.ResourceKey;
import model.Resources;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.DoubleSupplier;

/** Hand-built factions and scripted random sources for engine tests. */
public final class Fixtures {
    private Fixtures() {}

    public static RulesConfig rules() {
        return ConfigManager.getInstance().getRules();
    }

    public static TurnEngine engine() {
        ConfigManager cfg = ConfigManager.getInstance();
        return new TurnEngine(cfg.getRules(), cfg.getActions(), cfg.getTechTree());
    }

    public static GameState freshGame() {
        ConfigManager cfg = ConfigManager.getInstance();
        return GameSetup.createInitialState(cfg.getFactions(), cfg.getRules().calendar(), null);
    }

    /** Every resource at 50, both culture stats at 50, scores at zero. */
    public static FactionState faction(String id, FactionType type) {
        Map<ResourceKey, Double> res = new EnumMap<>(ResourceKey.class);
        for (ResourceKey k : ResourceKey.values()) res.put(k, 50.0);
        FactionState f = new FactionState(id, id.toUpperCase(), type, Resources.of(res));
        f.setSafetyCulture(50);
        f.setOpsec(50);
        f.setPublicOpinion(50);
        f.setSecurityLevel(1);
        return f;
    }

    public static FactionState lab(String id) { return faction(id, FactionType.LAB); }

    public static FactionState gov(String id) { return faction(id, FactionType.GOVERNMENT); }

    public static GameState world(int turn, FactionState... factions) {
        GameState s = new GameState(turn, 2026, 1);
        for (FactionState f : factions) s.addFaction(f);
        s.refreshGlobalSafety();
        return s;
    }

    /** Returns the given draws in order and fails on any extra draw. */
    public static DoubleSupplier script(double... draws) {
        double[] copy = Arrays.copyOf(draws, draws.length);
        int[] next = {0};
        return () -> {
            if (next[0] >= copy.length) throw new IllegalStateException("unexpected random draw #" + (next[0] + 1));
            return copy[next[0]++];
        };
    }
}
