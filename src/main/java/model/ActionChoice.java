package model;

/**
 * One action picked for one faction for one turn. Produced by a decision policy,
 * consumed once by the engine. {@code targetFactionId} may be null.
 */
public record ActionChoice(String actionId, Openness openness, String targetFactionId) {

    public ActionChoice(String actionId, Openness openness) {
        this(actionId, openness, null);
    }

    public static ActionChoice open(String actionId) {
        return new ActionChoice(actionId, Openness.OPEN, null);
    }

    public static ActionChoice secret(String actionId) {
        return new ActionChoice(actionId, Openness.SECRET, null);
    }

    public ActionChoice targeting(String factionId) {
        return new ActionChoice(actionId, openness, factionId);
    }
}
