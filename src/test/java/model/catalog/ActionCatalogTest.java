package model.catalog;

import model.FactionType;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionCatalogTest {

    private static ActionDefinition action(String id, ActionKind kind, String specificTo) {
        return new ActionDefinition(id, id, kind, Set.of(FactionType.LAB), specificTo,
                Map.of(), Map.of(), 0, null, 0);
    }

    @Test
    void findsAndRequiresById() {
        ActionCatalog catalog = new ActionCatalog(java.util.List.of(action("policy", ActionKind.POLICY, null)), Set.of());

        assertTrue(catalog.find("policy").isPresent());
        assertTrue(catalog.find("nope").isEmpty());
        assertTrue(catalog.contains("policy"));
        assertFalse(catalog.contains(null));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> catalog.require("nope"));
        assertEquals("Unknown action: nope", e.getMessage());
    }

    @Test
    void kindMustMatchId() {
        assertThrows(IllegalStateException.class,
                () -> new ActionCatalog(java.util.List.of(action("policy", ActionKind.ESPIONAGE, null)), Set.of()));
    }

    @Test
    void factionSpecificActionNeedsKnownFaction() {
        assertThrows(IllegalStateException.class,
                () -> new ActionCatalog(java.util.List.of(action("move_fast", ActionKind.MOVE_FAST, "ghost")), Set.of("us_lab_b")));
    }

    @Test
    void duplicateIdsAreRejected() {
        assertThrows(IllegalStateException.class, () -> new ActionCatalog(java.util.List.of(
                action("policy", ActionKind.POLICY, null),
                action("policy", ActionKind.POLICY, null)), Set.of()));
    }

    @Test
    void definitionNormalizesMissingMaps() {
        ActionDefinition d = new ActionDefinition("policy", "Policy", ActionKind.POLICY, Set.of(FactionType.LAB),
                null, null, null, 0, null, 0);

        assertTrue(d.baseResearch().isEmpty());
        assertTrue(d.baseResourceDelta().isEmpty());
        assertFalse(d.isFactionSpecific());
        assertTrue(d.isAllowedFor(FactionType.LAB));
        assertFalse(d.isAllowedFor(FactionType.GOVERNMENT));
    }
}
