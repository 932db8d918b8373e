package storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import common.dto.Json;
import common.dto.SavedGameDTO;
import common.util.Canon;
import mapper.Mapper;
import model.GameState;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes and reads saved games as JSON. A write goes to a temp file first and is moved over
 * the target, so an interrupted save never leaves a half-written file behind.
 */
public final class SaveStore {
    private static final ObjectMapper M = Json.mapper().enable(SerializationFeature.INDENT_OUTPUT);

    private SaveStore() {}

    public static String encode(GameState state) throws IOException {
        SavedGameDTO dto = Mapper.toDto(state);
        return M.writeValueAsString(dto.withChecksum(Canon.digest(dto)));
    }

    /**
     * @throws IOException when the text is not a readable save
     * @throws IllegalArgumentException when the save parses but holds no usable game
     */
    public static GameState decode(String json) throws IOException {
        SavedGameDTO dto = M.readValue(json, SavedGameDTO.class);
        if (dto.version() != Mapper.SAVE_VERSION) {
            System.err.println("[Save] version " + dto.version() + " differs from "
                    + Mapper.SAVE_VERSION + ", loading anyway");
        }
        if (dto.checksum() != null && !dto.checksum().equals(Canon.digest(dto.withChecksum(null)))) {
            System.err.println("[Save] checksum mismatch, the file was edited or damaged");
        }
        return Mapper.fromDto(dto);
    }

    public static void save(GameState state, Path file) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, encode(state));
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        System.out.println("[Save] wrote turn " + state.turn() + " to " + file.toAbsolutePath());
    }

    public static GameState load(Path file) throws IOException {
        return decode(Files.readString(file));
    }
}
