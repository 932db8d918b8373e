// src/main/java/config/ConfigLoader.java
package config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import common.dto.Json;
import model.catalog.ActionDefinition;
import model.catalog.FactionTemplate;
import model.catalog.TechNode;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Jackson readers for rules.json and the three catalog files. Catalog files may be either a
 * wrapper object ({ "actions": [...] }) or a bare array.
 */
public final class ConfigLoader {
    private static final ObjectMapper M = Json.mapper();

    record ActionPack(List<ActionDefinition> actions) { }
    record TechPack(List<TechNode> techs) { }
    record FactionPack(List<FactionTemplate> factions) { }

    public static RulesConfig loadRules(Path json) throws Exception {
        return M.readValue(Files.readAllBytes(json), RulesConfig.class);
    }

    public static RulesConfig loadRules(InputStream in) throws Exception {
        return M.readValue(in.readAllBytes(), RulesConfig.class);
    }

    public static List<ActionDefinition> loadActions(InputStream in) throws Exception {
        byte[] data = in.readAllBytes();
        try {
            ActionPack pack = M.readValue(data, ActionPack.class);
            if (pack != null && pack.actions() != null) return pack.actions();
        } catch (MismatchedInputException ignore) { /* bare array below */ }
        return M.readValue(data, new TypeReference<List<ActionDefinition>>() {});
    }

    public static List<TechNode> loadTechs(InputStream in) throws Exception {
        byte[] data = in.readAllBytes();
        try {
            TechPack pack = M.readValue(data, TechPack.class);
            if (pack != null && pack.techs() != null) return pack.techs();
        } catch (MismatchedInputException ignore) { /* bare array below */ }
        return M.readValue(data, new TypeReference<List<TechNode>>() {});
    }

    public static List<FactionTemplate> loadFactions(InputStream in) throws Exception {
        byte[] data = in.readAllBytes();
        try {
            FactionPack pack = M.readValue(data, FactionPack.class);
            if (pack != null && pack.factions() != null) return pack.factions();
        } catch (MismatchedInputException ignore) { /* bare array below */ }
        return M.readValue(data, new TypeReference<List<FactionTemplate>>() {});
    }

    private ConfigLoader() {}
}
