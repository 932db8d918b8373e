// mapper/Mapper.java
package mapper;

import common.dto.FactionDTO;
import common.dto.SavedGameDTO;
import model.Branch;
import model.FactionState;
import model.GameState;
import model.Resources;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Mapper {
    public static final int SAVE_VERSION = 1;
    public static final int SAVED_LOG_LINES = 50;

    private Mapper() {}

    /* ------------ model -> dto ------------ */
    public static SavedGameDTO toDto(GameState s) {
        var factions = new ArrayList<FactionDTO>();
        for (FactionState f : s.factions()) factions.add(toFactionDTO(f));

        var alliances = new LinkedHashMap<String, List<String>>();
        s.alliances().forEach((id, allies) -> alliances.put(id, List.copyOf(allies)));

        List<String> log = s.log();
        List<String> tail = List.copyOf(log.subList(Math.max(0, log.size() - SAVED_LOG_LINES), log.size()));

        return new SavedGameDTO(
                SAVE_VERSION,
                s.turn(), s.year(), s.quarter(),
                s.globalSafety(),
                s.isGameOver(), s.winnerId(), s.loserId(), s.victoryType(), s.lossType(),
                s.playerFactionId(),
                factions,
                alliances,
                new LinkedHashMap<>(s.tensions()),
                List.copyOf(s.treaties()),
                tail,
                null);
    }

    public static FactionDTO toFactionDTO(FactionState f) {
        return new FactionDTO(
                f.id(), f.name(), f.type(),
                f.resources().view(),
                f.research().view(),
                List.copyOf(f.unlockedTechs()),
                f.safetyCulture(), f.opsec(),
                f.capabilityScore(), f.safetyScore(),
                f.exposure(), f.canDeployAgi(),
                f.publicOpinion(), f.securityLevel());
    }

    /* ------------ dto -> model ------------ */
    /** Global safety is derived, so it is recomputed rather than trusted. */
    public static GameState fromDto(SavedGameDTO d) {
        if (d.factions() == null || d.factions().isEmpty()) {
            throw new IllegalArgumentException("saved game has no factions");
        }
        GameState s = new GameState(d.turn(), d.year(), d.quarter());
        for (FactionDTO fd : d.factions()) s.addFaction(fromFactionDTO(fd));

        s.restoreOutcome(d.gameOver(), d.winnerId(), d.loserId(), d.victoryType(), d.lossType());
        s.setPlayerFactionId(d.playerFactionId());
        if (d.alliances() != null) d.alliances().forEach(s::restoreAlliances);
        if (d.tensions() != null) d.tensions().forEach(s::restoreTension);
        if (d.treaties() != null) d.treaties().forEach(s::addTreaty);
        if (d.log() != null) s.appendLog(d.log());
        s.refreshGlobalSafety();
        return s;
    }

    public static FactionState fromFactionDTO(FactionDTO d) {
        if (d.id() == null || d.type() == null) {
            throw new IllegalArgumentException("saved faction needs id and type: " + d);
        }
        FactionState f = new FactionState(d.id(), d.name() != null ? d.name() : d.id(), d.type(),
                Resources.of(d.resources()));
        Map<Branch, Double> research = d.research();
        if (research != null) research.forEach((b, v) -> { if (b != null && v != null) f.research().set(b, v); });
        if (d.unlockedTechs() != null) d.unlockedTechs().forEach(f::unlockTech);
        f.setSafetyCulture(d.safetyCulture());
        f.setOpsec(d.opsec());
        f.setCapabilityScore(d.capabilityScore());
        f.setSafetyScore(d.safetyScore());
        f.setExposure(d.exposure());
        f.restoreAgiCapability(d.canDeployAgi());
        f.setPublicOpinion(d.publicOpinion());
        f.setSecurityLevel(d.securityLevel());
        return f;
    }
}
