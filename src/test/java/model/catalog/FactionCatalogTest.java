package model.catalog;

import model.FactionType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FactionCatalogTest {

    private static final StrategyProfile BALANCED = new StrategyProfile(50, 50, 50, 50);

    private static FactionTemplate template(String id, StrategyProfile strategy) {
        return new FactionTemplate(id, id, FactionType.LAB, Map.of(), 50, 50, 0, 0, null, null, strategy);
    }

    @Test
    void strategyLookup() {
        FactionCatalog roster = new FactionCatalog(List.of(template("a", BALANCED)));

        assertEquals(BALANCED, roster.strategyFor("a"));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> roster.strategyFor("b"));
        assertEquals("Missing strategy for b", e.getMessage());
    }

    @Test
    void templateWithoutStrategyIsRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new FactionCatalog(List.of(template("a", null))));
        assertEquals("Missing strategy for a", e.getMessage());
    }
}
