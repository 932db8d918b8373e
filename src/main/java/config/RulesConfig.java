// src/main/java/config/RulesConfig.java
package config;

import model.Openness;

import java.util.Map;
import java.util.Objects;

/** Tunable numbers of the turn engine, loaded from rules.json. */
public record RulesConfig(
        Calendar calendar,
        Map<Openness, OpennessModifier> openness,
        Detection detection,
        Espionage espionage,
        Victory victory
) {
    public RulesConfig {
        Objects.requireNonNull(calendar,  "rules.calendar");
        Objects.requireNonNull(openness,  "rules.openness");
        Objects.requireNonNull(detection, "rules.detection");
        Objects.requireNonNull(espionage, "rules.espionage");
        Objects.requireNonNull(victory,   "rules.victory");
        for (Openness o : Openness.values()) {
            if (!openness.containsKey(o)) throw new IllegalStateException("rules.openness is missing " + o);
        }
        openness = Map.copyOf(openness);
    }

    public OpennessModifier opennessFor(Openness o) { return openness.get(o); }

    public record Calendar(int startYear, int startQuarter, int maxTurn, int actionsPerTurn) { }

    /** Score/trust nudges and research multiplier tied to declaring an action open or secret. */
    public record OpennessModifier(double research, double trustDelta, double safetyDelta, double capabilityDelta) { }

    public record Detection(
            double baseChance,
            double perExposure,
            double opsecFactor,
            double maxChance,
            double trustPenalty,
            double influencePenalty,
            double safetyPenalty
    ) { }

    public record Espionage(
            double baseSuccess,
            double attackFactor,
            double defenseFactor,
            double minChance,
            double maxChance,
            double maxSteal,
            double detectionChance,
            double attackerTrustPenalty,
            double attackerInfluencePenalty,
            double targetTrustGain,
            double tensionOnDetection
    ) { }

    public record Victory(
            int minVictoryTurn,
            SafeAgi safeAgi,
            Dominant dominant,
            PublicTrust publicTrust,
            Regulatory regulatory,
            Alliance alliance,
            Control control,
            Catastrophe catastrophe,
            Obsolescence obsolescence,
            Collapse collapse,
            Coup coup
    ) {
        public Victory {
            Objects.requireNonNull(safeAgi, "victory.safeAgi");
            Objects.requireNonNull(dominant, "victory.dominant");
            Objects.requireNonNull(publicTrust, "victory.publicTrust");
            Objects.requireNonNull(regulatory, "victory.regulatory");
            Objects.requireNonNull(alliance, "victory.alliance");
            Objects.requireNonNull(control, "victory.control");
            Objects.requireNonNull(catastrophe, "victory.catastrophe");
            Objects.requireNonNull(obsolescence, "victory.obsolescence");
            Objects.requireNonNull(collapse, "victory.collapse");
            Objects.requireNonNull(coup, "victory.coup");
        }
    }

    public record SafeAgi(double factionSafety, double globalSafety) { }
    public record Dominant(double capabilityLeadPercent, double minCapability) { }
    public record PublicTrust(double minTrust, double minCapability) { }
    public record Regulatory(double labSafetyMin, double globalSafetyMin) { }
    public record Alliance(double minTrust, int minAllies, double minInfluence) { }
    public record Control(double minInfluence, double labCapabilityMax) { }
    public record Catastrophe(double safetyThreshold, double globalSafetyThreshold) { }
    public record Obsolescence(double capabilityGap) { }
    public record Collapse(double minTrust) { }
    public record Coup(double minInfluence, double labCapabilityDanger) { }
}
