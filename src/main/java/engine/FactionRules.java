package engine;

import model.FactionState;
import model.FactionType;
import model.GameState;

import java.util.Optional;

/** Per-faction-type behaviour: passive income and the win/loss conditions that type can meet. */
public interface FactionRules {

    void applyIncome(FactionState faction);

    Optional<Verdict> checkVictory(GameState state, FactionState faction);

    Optional<Verdict> checkLoss(GameState state, FactionState faction);

    static FactionRules of(FactionType type, LabRules lab, GovernmentRules gov) {
        return (type == FactionType.LAB) ? lab : gov;
    }
}
