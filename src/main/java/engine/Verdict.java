package engine;

import model.LossType;
import model.VictoryType;

/** Outcome of one win/loss check. Exactly one of {@code victory} and {@code loss} is set. */
public record Verdict(String factionId, VictoryType victory, LossType loss, String message) {

    public static Verdict win(String factionId, VictoryType type, String message) {
        return new Verdict(factionId, type, null, message);
    }

    public static Verdict lose(String factionId, LossType type, String message) {
        return new Verdict(factionId, null, type, message);
    }

    public boolean isVictory() { return victory != null; }
}
