package common.dto;

import model.LossType;
import model.VictoryType;

import java.util.List;
import java.util.Map;

/**
 * On-disk shape of a game. {@code checksum} covers every other field and is null while
 * the digest is being computed.
 */
public record SavedGameDTO(
        int version,
        int turn,
        int year,
        int quarter,
        double globalSafety,
        boolean gameOver,
        String winnerId,
        String loserId,
        VictoryType victoryType,
        LossType lossType,
        String playerFactionId,
        List<FactionDTO> factions,
        Map<String, List<String>> alliances,
        Map<String, Double> tensions,
        List<String> treaties,
        List<String> log,
        String checksum
) {
    public SavedGameDTO withChecksum(String value) {
        return new SavedGameDTO(version, turn, year, quarter, globalSafety, gameOver, winnerId, loserId,
                victoryType, lossType, playerFactionId, factions, alliances, tensions, treaties, log, value);
    }
}
