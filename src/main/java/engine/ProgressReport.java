package engine;

import config.RulesConfig;
import model.FactionState;
import model.GameState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Read-only summary of how close each faction is to its win and loss conditions. */
public final class ProgressReport {

    private final RulesConfig.Victory v;
    private final int maxTurn;

    public ProgressReport(RulesConfig rules) {
        this.v = rules.victory();
        this.maxTurn = rules.calendar().maxTurn();
    }

    public List<VictoryProgress> progressFor(GameState state, String factionId) {
        FactionState f = state.faction(factionId);
        if (f == null) return List.of();
        return f.isLab() ? labProgress(state, f) : governmentProgress(state, f);
    }

    /** Highest-progress victory condition, if any. */
    public Optional<VictoryProgress> closestVictory(GameState state, String factionId) {
        return progressFor(state, factionId).stream()
                .filter(p -> !p.warning())
                .max(Comparator.comparingInt(VictoryProgress::progress));
    }

    /** Highest-progress loss warning, if any is active. */
    public Optional<VictoryProgress> mostUrgentThreat(GameState state, String factionId) {
        return progressFor(state, factionId).stream()
                .filter(VictoryProgress::warning)
                .max(Comparator.comparingInt(VictoryProgress::progress));
    }

    private List<VictoryProgress> labProgress(GameState state, FactionState f) {
        List<VictoryProgress> out = new ArrayList<>();
        double trust = f.resources().trust();
        double cap = f.capabilityScore();

        double safety = pct(f.safetyScore(), v.safeAgi().factionSafety());
        double global = pct(state.globalSafety(), v.safeAgi().globalSafety());
        double agi = f.canDeployAgi() ? 100 : 0;
        out.add(new VictoryProgress("safe_agi", "Safe AGI Victory", avg(safety, global, agi), false,
                List.of("Safety >= " + n(v.safeAgi().factionSafety()),
                        "Global Safety >= " + n(v.safeAgi().globalSafety()),
                        "AGI Capability unlocked"),
                "Safety: " + n(f.safetyScore()) + ", Global: " + n(state.globalSafety())
                        + ", AGI: " + (f.canDeployAgi() ? "Ready" : "Not ready")));

        double maxOther = 0;
        for (FactionState lab : state.labs()) {
            if (!lab.id().equals(f.id())) maxOther = Math.max(maxOther, lab.capabilityScore());
        }
        double lead = (maxOther > 0) ? (cap - maxOther) / maxOther * 100 : 100;
        out.add(new VictoryProgress("dominant", "Dominant Victory",
                (int) Math.round(Stats.clamp(lead / v.dominant().capabilityLeadPercent() * 100, 0, 100)), false,
                List.of(n(v.dominant().capabilityLeadPercent()) + "%+ capability lead over competitors",
                        "Capability >= " + n(v.dominant().minCapability())),
                "Lead: " + n(lead) + "%, Capability: " + n(cap)));

        out.add(new VictoryProgress("public_trust", "Public Trust Victory",
                avg(pct(trust, v.publicTrust().minTrust()), pct(cap, v.publicTrust().minCapability())), false,
                List.of("Trust >= " + n(v.publicTrust().minTrust()),
                        "Capability >= " + n(v.publicTrust().minCapability())),
                "Trust: " + n(trust) + ", Capability: " + n(cap)));

        double margin = trust - v.collapse().minTrust();
        double collapse = Stats.clamp(100 - margin / 30 * 100, 0, 100);
        if (collapse > 50) {
            out.add(new VictoryProgress("collapse", "Trust Collapse Warning", (int) Math.round(collapse), true,
                    List.of("Trust must stay above " + n(v.collapse().minTrust())),
                    "Trust: " + n(trust) + " (margin: " + n(margin) + ")"));
        }

        double gap = maxOther - cap;
        double obsolete = Stats.clamp(gap / v.obsolescence().capabilityGap() * 100, 0, 100);
        if (obsolete > 40) {
            out.add(new VictoryProgress("obsolescence", "Obsolescence Warning", (int) Math.round(obsolete), true,
                    List.of("Don't fall " + n(v.obsolescence().capabilityGap()) + "+ points behind"),
                    "Gap: " + n(gap) + " points behind leader"));
        }
        return out;
    }

    private List<VictoryProgress> governmentProgress(GameState state, FactionState f) {
        List<VictoryProgress> out = new ArrayList<>();
        List<FactionState> labs = state.labs();
        double influence = f.resources().influence();

        long compliant = labs.stream().filter(l -> l.safetyScore() >= v.regulatory().labSafetyMin()).count();
        double compliance = labs.isEmpty() ? 100 : compliant * 100.0 / labs.size();
        double time = pct(state.turn(), maxTurn);
        out.add(new VictoryProgress("regulatory", "Regulatory Victory",
                avg(compliance, pct(state.globalSafety(), v.regulatory().globalSafetyMin()), time), false,
                List.of("All labs safety >= " + n(v.regulatory().labSafetyMin()),
                        "Global Safety >= " + n(v.regulatory().globalSafetyMin()),
                        "Survive to turn " + maxTurn),
                "Labs: " + compliant + "/" + labs.size() + " compliant, "
                        + Math.max(0, maxTurn - state.turn()) + " turns remaining"));

        long allies = state.factions().stream()
                .filter(o -> !o.id().equals(f.id()) && o.resources().trust() >= v.alliance().minTrust())
                .count();
        out.add(new VictoryProgress("alliance", "Alliance Victory",
                avg(pct(allies, v.alliance().minAllies()), pct(influence, v.alliance().minInfluence())), false,
                List.of(v.alliance().minAllies() + "+ factions with trust >= " + n(v.alliance().minTrust()),
                        "Influence >= " + n(v.alliance().minInfluence())),
                "Allies: " + allies + "/" + v.alliance().minAllies() + ", Influence: " + n(influence)));

        long controlled = labs.stream().filter(l -> l.capabilityScore() <= v.control().labCapabilityMax()).count();
        double control = labs.isEmpty() ? 100 : controlled * 100.0 / labs.size();
        out.add(new VictoryProgress("control", "Control Victory",
                avg(control, pct(influence, v.control().minInfluence())), false,
                List.of("All labs capability <= " + n(v.control().labCapabilityMax()),
                        "Influence >= " + n(v.control().minInfluence())),
                "Labs controlled: " + controlled + "/" + labs.size() + ", Influence: " + n(influence)));

        long dangerous = labs.stream()
                .filter(l -> l.capabilityScore() >= v.coup().labCapabilityDanger() - 10)
                .count();
        if (influence < v.coup().minInfluence() + 20 && dangerous > 0) {
            double coup = Stats.clamp(100 - (influence - v.coup().minInfluence()) / 20 * 100, 0, 100);
            out.add(new VictoryProgress("coup", "Coup Risk Warning", (int) Math.round(coup), true,
                    List.of("Influence must stay above " + n(v.coup().minInfluence()),
                            "Keep labs below capability " + n(v.coup().labCapabilityDanger())),
                    "Influence: " + n(influence) + ", Dangerous labs: " + dangerous));
        }
        return out;
    }

    private static double pct(double value, double threshold) {
        if (threshold <= 0) return 100;
        return Math.min(100, value / threshold * 100);
    }

    private static int avg(double... parts) {
        double sum = 0;
        for (double p : parts) sum += p;
        return (int) Math.round(sum / parts.length);
    }

    private static String n(double value) {
        return String.format(Locale.ROOT, "%.0f", value);
    }
}
