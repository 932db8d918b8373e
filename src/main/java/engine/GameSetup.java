package engine;

import config.RulesConfig;
import model.FactionState;
import model.GameState;
import model.Resources;
import model.catalog.FactionCatalog;
import model.catalog.FactionTemplate;

/** Builds the turn-0 world from the faction roster. */
public final class GameSetup {
    static final double GOVERNMENT_PUBLIC_OPINION = 50;
    static final int GOVERNMENT_SECURITY_LEVEL = 3;
    static final int LAB_SECURITY_LEVEL = 2;

    private GameSetup() {}

    public static GameState createInitialState(FactionCatalog roster, RulesConfig.Calendar calendar, String playerFactionId) {
        if (playerFactionId != null && roster.template(playerFactionId) == null) {
            throw new IllegalArgumentException("Unknown player faction: " + playerFactionId);
        }
        GameState state = new GameState(0, calendar.startYear(), calendar.startQuarter());
        for (FactionTemplate t : roster.all()) state.addFaction(fromTemplate(t));
        state.setPlayerFactionId(playerFactionId);
        state.refreshGlobalSafety();
        return state;
    }

    static FactionState fromTemplate(FactionTemplate t) {
        FactionState f = new FactionState(t.id(), t.name(), t.type(), Resources.of(t.resources()));
        f.setSafetyCulture(t.safetyCulture());
        f.setOpsec(t.opsec());
        f.setCapabilityScore(t.capabilityScore());
        f.setSafetyScore(t.safetyScore());
        // labs start out as popular as they are trusted
        double opinion = f.isGovernment() ? GOVERNMENT_PUBLIC_OPINION : f.resources().trust();
        int security = f.isGovernment() ? GOVERNMENT_SECURITY_LEVEL : LAB_SECURITY_LEVEL;
        f.setPublicOpinion(Stats.clamp(t.publicOpinion() != null ? t.publicOpinion() : opinion, Stats.MIN_STAT, Stats.MAX_STAT));
        f.setSecurityLevel(Math.max(FactionState.MIN_SECURITY_LEVEL,
                Math.min(FactionState.MAX_SECURITY_LEVEL, t.securityLevel() != null ? t.securityLevel() : security)));
        return f;
    }
}
