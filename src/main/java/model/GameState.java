package model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Whole-world state for one game. Mutated in place by {@code engine.TurnEngine};
 * callers must not touch it while a turn is resolving.
 */
public final class GameState {

    private int turn;
    private int year;
    private int quarter;

    private final Map<String, FactionState> factions = new LinkedHashMap<>();
    private double globalSafety;

    private boolean gameOver;
    private String winnerId;
    private String loserId;
    private VictoryType victoryType;
    private LossType lossType;
    private String playerFactionId;

    private final List<String> log = new ArrayList<>();

    // ---- relationships ----
    private final Map<String, List<String>> alliances = new LinkedHashMap<>();
    private final Map<String, Double> tensions = new LinkedHashMap<>();
    private final Set<String> treaties = new LinkedHashSet<>();

    public GameState(int turn, int year, int quarter) {
        this.turn = turn;
        this.year = year;
        this.quarter = quarter;
    }

    // ---- calendar ----
    public int turn()    { return turn; }
    public int year()    { return year; }
    public int quarter() { return quarter; }

    public void setCalendar(int turn, int year, int quarter) {
        this.turn = turn;
        this.year = year;
        this.quarter = quarter;
    }

    /** One quarter forward; the fifth quarter rolls into Q1 of the next year. */
    public void advanceCalendar() {
        turn++;
        quarter++;
        if (quarter > 4) {
            quarter = 1;
            year++;
        }
    }

    // ---- factions ----
    public void addFaction(FactionState faction) {
        if (factions.putIfAbsent(faction.id(), faction) != null) {
            throw new IllegalArgumentException("duplicate faction id: " + faction.id());
        }
    }
    public FactionState faction(String id) { return (id == null) ? null : factions.get(id); }
    public Collection<FactionState> factions() { return Collections.unmodifiableCollection(factions.values()); }
    public List<FactionState> labs() { return ofType(FactionType.LAB); }
    public List<FactionState> governments() { return ofType(FactionType.GOVERNMENT); }

    private List<FactionState> ofType(FactionType type) {
        List<FactionState> out = new ArrayList<>();
        for (FactionState f : factions.values()) if (f.type() == type) out.add(f);
        return out;
    }

    // ---- global safety (derived) ----
    public double globalSafety() { return globalSafety; }

    /**
     * Capability-weighted mean of every faction's safety score, each weight floored at 10,
     * rounded to one decimal.
     */
    public double computeGlobalSafety() {
        double totalWeight = 0, weighted = 0;
        for (FactionState f : factions.values()) {
            double w = Math.max(10, f.capabilityScore());
            totalWeight += w;
            weighted += f.safetyScore() * w;
        }
        if (totalWeight == 0) return 0;
        return Math.round(weighted / totalWeight * 10) / 10.0;
    }

    public void refreshGlobalSafety() { this.globalSafety = computeGlobalSafety(); }

    // ---- outcome ----
    public boolean isGameOver()        { return gameOver; }
    public String winnerId()           { return winnerId; }
    public String loserId()            { return loserId; }
    public VictoryType victoryType()   { return victoryType; }
    public LossType lossType()         { return lossType; }

    public void declareVictory(String factionId, VictoryType type) {
        gameOver = true;
        winnerId = factionId;
        victoryType = type;
    }

    public void declareLoss(String factionId, LossType type) {
        gameOver = true;
        winnerId = null;
        loserId = factionId;
        lossType = type;
    }

    public void declareStalemate() {
        gameOver = true;
        winnerId = null;
        lossType = LossType.STALEMATE;
    }

    /** Restore path only. */
    public void restoreOutcome(boolean over, String winner, String loser, VictoryType vt, LossType lt) {
        this.gameOver = over;
        this.winnerId = winner;
        this.loserId = loser;
        this.victoryType = vt;
        this.lossType = lt;
    }

    public String playerFactionId() { return playerFactionId; }
    public void setPlayerFactionId(String id) { this.playerFactionId = id; }

    // ---- log (append-only) ----
    public List<String> log() { return Collections.unmodifiableList(log); }
    public void appendLog(List<String> entries) { log.addAll(entries); }

    // ---- relationships ----
    public Map<String, List<String>> alliances() { return Collections.unmodifiableMap(alliances); }

    public List<String> alliesOf(String factionId) {
        List<String> allies = alliances.get(factionId);
        return (allies == null) ? List.of() : Collections.unmodifiableList(allies);
    }

    /** Symmetric and idempotent. @return true if a new edge was added. */
    public boolean addAlliance(String a, String b) {
        if (a.equals(b)) return false;
        boolean added = link(a, b);
        added |= link(b, a);
        return added;
    }

    /** Restore path only: replays one side's ordered ally list. */
    public void restoreAlliances(String from, List<String> allies) {
        for (String to : allies) link(from, to);
    }

    private boolean link(String from, String to) {
        List<String> list = alliances.computeIfAbsent(from, k -> new ArrayList<>());
        if (list.contains(to)) return false;
        list.add(to);
        return true;
    }

    public Map<String, Double> tensions() { return Collections.unmodifiableMap(tensions); }

    public double tension(String a, String b) { return tensions.getOrDefault(pairKey(a, b), 0.0); }

    public void setTension(String a, String b, double value) { tensions.put(pairKey(a, b), value); }

    /** Restore path only: key as produced by {@link #pairKey}. */
    public void restoreTension(String key, double value) { tensions.put(key, value); }

    public Set<String> treaties() { return Collections.unmodifiableSet(treaties); }
    public boolean addTreaty(String id) { return treaties.add(id); }

    /** Order-independent key for a faction pair. */
    public static String pairKey(String a, String b) {
        return (a.compareTo(b) <= 0) ? a + "|" + b : b + "|" + a;
    }
}
