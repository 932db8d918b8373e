// src/main/java/config/ConfigManager.java
package config;

import model.catalog.ActionCatalog;
import model.catalog.FactionCatalog;
import model.catalog.TechTree;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads rules.json (editable copy in the working directory first, then the bundled one) and
 * the bundled catalogs. Anything that fails to load or validate aborts construction.
 */
public final class ConfigManager {
    private static final Path   RULES_PATH     = Paths.get("rules.json");
    private static final String RULES_RESOURCE = "rules.json";

    private static ConfigManager instance;

    private final Object reloadLock = new Object();

    private volatile RulesConfig rules;
    private final FactionCatalog factions;
    private final ActionCatalog actions;
    private final TechTree techTree;

    private ConfigManager() {
        try (InputStream f = open("factions.json");
             InputStream a = open("actions.json");
             InputStream t = open("techTree.json")) {
            this.factions = new FactionCatalog(ConfigLoader.loadFactions(f));
            this.actions  = new ActionCatalog(ConfigLoader.loadActions(a), factions.ids());
            this.techTree = new TechTree(ConfigLoader.loadTechs(t));
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to load catalogs", e);
        }
        forceReload();
    }

    public static synchronized ConfigManager getInstance() {
        if (instance == null) instance = new ConfigManager();
        return instance;
    }

    /** Re-reads rules.json; catalogs are fixed for the lifetime of the process. */
    public void forceReload() {
        synchronized (reloadLock) {
            RulesConfig loaded = loadRulesPreferringDiskThenClasspath();
            if (loaded == null) {
                throw new IllegalStateException("No usable rules.json (disk or classpath).");
            }
            rules = loaded;
        }
    }

    public RulesConfig getRules()        { return rules; }
    public FactionCatalog getFactions()  { return factions; }
    public ActionCatalog getActions()    { return actions; }
    public TechTree getTechTree()        { return techTree; }

    // ---------- Internals ----------

    private static RulesConfig loadRulesPreferringDiskThenClasspath() {
        if (Files.exists(RULES_PATH)) {
            try {
                return ConfigLoader.loadRules(RULES_PATH);
            } catch (Exception e) {
                System.err.println("[Config] Failed to load rules from disk: " + RULES_PATH.toAbsolutePath()
                        + " (" + e.getMessage() + "), falling back to bundled rules");
            }
        }
        try (InputStream in = resource(RULES_RESOURCE)) {
            if (in != null) return ConfigLoader.loadRules(in);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load bundled " + RULES_RESOURCE, e);
        }
        return null;
    }

    private static InputStream open(String name) throws IOException {
        InputStream in = resource(name);
        if (in == null) throw new IOException("missing classpath resource " + name);
        return in;
    }

    private static InputStream resource(String name) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        InputStream in = (cl != null) ? cl.getResourceAsStream(name) : null;
        return (in != null) ? in : ConfigManager.class.getClassLoader().getResourceAsStream(name);
    }
}
