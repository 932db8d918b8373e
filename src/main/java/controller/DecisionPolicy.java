package controller;

import model.ActionChoice;
import model.GameState;

import java.util.List;
import java.util.function.DoubleSupplier;

/** Chooses a faction's actions for the coming turn. Reads the state, never mutates it. */
public interface DecisionPolicy {

    List<ActionChoice> decide(GameState state, String factionId, DoubleSupplier rng);
}
