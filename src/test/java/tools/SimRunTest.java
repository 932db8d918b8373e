package tools;

import model.GameState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimRunTest {

    @Test
    void parsesFlagsWithDefaults() {
        SimRun.Options o = SimRun.Options.parse(new String[]{"--seed", "9", "--log"});

        assertEquals(32, o.turns());
        assertEquals(9, o.seed());
        assertTrue(o.showLog());
        assertNull(o.save());
    }

    @Test
    void shortRunPrintsSummaryAndSaves(@TempDir Path dir) throws Exception {
        Path save = dir.resolve("run.json");
        ByteArrayOutputStream buf = new ByteArrayOutputStream();

        GameState s = SimRun.run(new SimRun.Options(3, 42, true, null, null, save),
                new PrintStream(buf, true, StandardCharsets.UTF_8));

        String out = buf.toString(StandardCharsets.UTF_8);
        assertEquals(3, s.turn());
        assertTrue(out.contains("Turn 1: 2026 Q2"));
        assertTrue(out.contains("--- Summary ---"));
        assertTrue(out.contains("OpenBrain: cap"));
        assertTrue(Files.exists(save));
    }

    @Test
    void resumesFromSave(@TempDir Path dir) throws Exception {
        Path save = dir.resolve("run.json");
        PrintStream quiet = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
        SimRun.run(new SimRun.Options(2, 1, false, null, null, save), quiet);

        GameState resumed = SimRun.run(new SimRun.Options(2, 1, false, null, save, null), quiet);

        assertEquals(4, resumed.turn());
    }
}
