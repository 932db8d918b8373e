package engine;

import common.util.Canon;
import config.ConfigManager;
import controller.DecisionPolicy;
import controller.HeuristicPolicy;
import mapper.Mapper;
import model.ActionChoice;
import model.Branch;
import model.FactionState;
import model.GameState;
import model.ResourceKey;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleSupplier;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TurnEngineTest {

    private final TurnEngine engine = Fixtures.engine();
    private final DecisionPolicy policy = new HeuristicPolicy(
            ConfigManager.getInstance().getFactions(),
            ConfigManager.getInstance().getActions(),
            ConfigManager.getInstance().getRules());

    private GameState play(long seed, int turns) {
        GameState s = Fixtures.freshGame();
        DoubleSupplier rng = Rng.seeded(seed);
        for (int i = 0; i < turns && !s.isGameOver(); i++) {
            Map<String, List<ActionChoice>> choices = new LinkedHashMap<>();
            for (FactionState f : s.factions()) choices.put(f.id(), policy.decide(s, f.id(), rng));
            engine.resolveTurn(s, choices, rng);
        }
        return s;
    }

    private static boolean logged(List<String> entries, String fragment) {
        return entries.stream().anyMatch(e -> e.contains(fragment));
    }

    @Test
    void sameSeedSameGame() {
        GameState a = play(7, 12);
        GameState b = play(7, 12);

        assertArrayEquals(Canon.bytes(Mapper.toDto(a)), Canon.bytes(Mapper.toDto(b)));
    }

    @Test
    void calendarAdvancesOneQuarterPerTurn() {
        GameState s = Fixtures.freshGame();
        for (int i = 0; i < 4; i++) engine.resolveTurn(s, Map.of(), Rng.seeded(1));

        assertEquals(4, s.turn());
        assertEquals(2027, s.year());
        assertEquals(1, s.quarter());
    }

    @Test
    void valuesStayInBoundsOverWholeGames() {
        for (long seed = 1; seed <= 5; seed++) {
            GameState s = play(seed, 40);
            assertTrue(s.isGameOver(), "a full game always reaches a verdict");
            for (FactionState f : s.factions()) {
                for (ResourceKey k : ResourceKey.values()) {
                    double v = f.resources().get(k);
                    assertTrue(v >= 0 && v <= 100, f.id() + " " + k + "=" + v);
                }
                for (Branch b : Branch.values()) assertTrue(f.research().get(b) >= 0);
                assertTrue(f.capabilityScore() >= 0 && f.capabilityScore() <= 100);
                assertTrue(f.safetyScore() >= 0 && f.safetyScore() <= 100);
                assertTrue(f.securityLevel() >= 1 && f.securityLevel() <= 5);
            }
            assertTrue(s.globalSafety() >= 0 && s.globalSafety() <= 100);
        }
    }

    @Test
    void unlockedTechsOnlyGrow() {
        GameState s = Fixtures.freshGame();
        DoubleSupplier rng = Rng.seeded(3);
        Map<String, Set<String>> seen = new LinkedHashMap<>();
        for (int i = 0; i < 20 && !s.isGameOver(); i++) {
            Map<String, List<ActionChoice>> choices = new LinkedHashMap<>();
            for (FactionState f : s.factions()) choices.put(f.id(), policy.decide(s, f.id(), rng));
            engine.resolveTurn(s, choices, rng);
            for (FactionState f : s.factions()) {
                Set<String> before = seen.getOrDefault(f.id(), Set.of());
                assertTrue(f.unlockedTechs().containsAll(before));
                seen.put(f.id(), new HashSet<>(f.unlockedTechs()));
            }
        }
        assertTrue(seen.values().stream().anyMatch(t -> !t.isEmpty()));
    }

    @Test
    void finishedGameIsLeftAlone() {
        GameState s = Fixtures.freshGame();
        s.declareStalemate();
        byte[] before = Canon.bytes(Mapper.toDto(s));

        List<String> entries = engine.resolveTurn(s, Map.of("us_lab_a", List.of(ActionChoice.open("deploy_products"))),
                Fixtures.script());

        assertTrue(entries.isEmpty());
        assertArrayEquals(before, Canon.bytes(Mapper.toDto(s)));
    }

    @Test
    void badChoicesAreLoggedAndSkipped() {
        GameState s = Fixtures.freshGame();
        Map<String, List<ActionChoice>> choices = new LinkedHashMap<>();
        choices.put("us_lab_a", List.of(ActionChoice.open("warp_drive")));
        choices.put("us_gov", List.of(ActionChoice.open("research_capabilities")));
        choices.put("us_lab_b", List.of(ActionChoice.open("open_research")));
        choices.put("nobody", List.of(ActionChoice.open("policy")));

        List<String> entries = engine.resolveTurn(s, choices, Rng.seeded(5));

        assertTrue(logged(entries, "unknown action warp_drive"));
        assertTrue(logged(entries, "invalid action"));
        assertTrue(logged(entries, "not available"));
        assertTrue(logged(entries, "unknown faction nobody"));
        assertEquals(1, s.turn());
    }

    @Test
    void onlyTheFirstTwoChoicesResolve() {
        GameState s = Fixtures.freshGame();
        List<ActionChoice> three = List.of(
                ActionChoice.open("deploy_products"),
                ActionChoice.open("deploy_products"),
                ActionChoice.open("deploy_products"));

        List<String> entries = engine.resolveTurn(s, Map.of("us_lab_a", three), Rng.seeded(5));

        assertTrue(logged(entries, "only the first 2 resolve"));
        assertEquals(2, entries.stream().filter(e -> e.contains("took Deploy Products")).count());
    }

    @Test
    void returnedEntriesAreAppendedToTheLog() {
        GameState s = Fixtures.freshGame();

        List<String> first = engine.resolveTurn(s, Map.of(), Rng.seeded(2));
        List<String> second = engine.resolveTurn(s, Map.of(), Rng.seeded(2));

        assertEquals(first.size() + second.size(), s.log().size());
        assertEquals(second, s.log().subList(first.size(), s.log().size()));
    }

    @Test
    void globalSafetyIsRecomputedAfterTheTurn() {
        GameState s = Fixtures.freshGame();
        engine.resolveTurn(s, Map.of("us_lab_a", List.of(ActionChoice.open("safety_pause"))), Rng.seeded(9));

        assertEquals(s.computeGlobalSafety(), s.globalSafety(), 1e-9);
    }
}
