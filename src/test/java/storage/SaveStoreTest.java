package storage;

import common.util.Canon;
import engine.Fixtures;
import engine.Rng;
import mapper.Mapper;
import model.GameState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SaveStoreTest {

    @Test
    void saveAndLoadThroughFile(@TempDir Path dir) throws IOException {
        GameState s = Fixtures.freshGame();
        Fixtures.engine().resolveTurn(s, Map.of(), Rng.seeded(1));
        Path file = dir.resolve("saves").resolve("game.json");

        SaveStore.save(s, file);
        GameState loaded = SaveStore.load(file);

        assertTrue(Files.exists(file));
        assertFalse(Files.exists(dir.resolve("saves").resolve("game.json.tmp")));
        assertEquals(1, loaded.turn());
        assertArrayEquals(Canon.bytes(Mapper.toDto(s)), Canon.bytes(Mapper.toDto(loaded)));
    }

    @Test
    void savedJsonUsesLowercaseNames() throws IOException {
        String json = SaveStore.encode(Fixtures.freshGame());

        assertTrue(json.contains("\"type\" : \"lab\""));
        assertTrue(json.contains("\"compute\""));
        assertTrue(json.contains("\"checksum\""));
    }

    @Test
    void editedSaveStillLoads() throws IOException {
        String json = SaveStore.encode(Fixtures.freshGame()).replace("\"turn\" : 0", "\"turn\" : 3");

        assertEquals(3, SaveStore.decode(json).turn());
    }

    @Test
    void garbageIsAnIOException() {
        assertThrows(IOException.class, () -> SaveStore.decode("{ not json"));
    }
}
