package engine;

import config.RulesConfig;
import model.ActionChoice;
import model.Branch;
import model.FactionState;
import model.GameState;
import model.Openness;
import model.ResourceKey;
import model.ScoreKey;
import model.StatKey;
import model.catalog.ActionCatalog;
import model.catalog.ActionDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleSupplier;

/**
 * Validates and applies one chosen action. Choices can come from an untrusted policy, so an
 * invalid choice is logged and skipped; nothing here throws for bad input.
 */
public final class ActionResolver {

    static final double SUBSIDY_CAPITAL = 6;
    static final double INITIATIVE_COMPUTE = 8;
    static final double INITIATIVE_CAPITAL = 5;
    static final double REGULATE_COMPUTE = 6;
    static final double REGULATE_INFLUENCE = 2;
    static final double REGULATE_CAPABILITY = 4;
    static final double ORDER_COMPUTE = 8;
    static final double ORDER_INFLUENCE = 3;
    static final double ORDER_CAPABILITY = 6;
    static final double ORDER_SAFETY_GAIN = 2;
    static final double COUNTERINTEL_OPSEC = 6;
    static final double DEFENSIVE_OPSEC = 4;
    static final double ALLIANCE_TENSION_RELIEF = 5;
    static final double OPEN_SOURCE_LEAK = 2;

    private final RulesConfig rules;
    private final ActionCatalog catalog;
    private final Espionage espionage;

    public ActionResolver(RulesConfig rules, ActionCatalog catalog) {
        this.rules = rules;
        this.catalog = catalog;
        this.espionage = new Espionage(rules.espionage());
    }

    /**
     * @param deployers collects labs that made a valid AGI deployment attempt
     * @return true when the action passed validation and was applied
     */
    public boolean resolve(GameState state, FactionState f, ActionChoice choice, DoubleSupplier rng,
                           TurnLog log, List<FactionState> deployers) {
        Optional<ActionDefinition> found = catalog.find(choice.actionId());
        if (found.isEmpty()) {
            log.add(f.name() + " attempted unknown action " + choice.actionId() + ".");
            return false;
        }
        ActionDefinition def = found.get();
        if (!def.isAllowedFor(f.type())) {
            log.add(f.name() + " attempted invalid action " + def.name() + ".");
            return false;
        }
        if (def.isFactionSpecific() && !def.factionSpecific().equals(f.id())) {
            log.add(def.name() + " is not available to " + f.name() + ".");
            return false;
        }
        if (choice.openness() == null) {
            log.add(f.name() + " attempted " + def.name() + " without declaring openness.");
            return false;
        }

        applyBase(f, def, choice.openness());
        log.add(f.name() + " took " + def.name() + " (" + label(choice.openness()) + ").");
        applyKind(state, f, def, choice, rng, log, deployers);
        return true;
    }

    private void applyBase(FactionState f, ActionDefinition def, Openness openness) {
        RulesConfig.OpennessModifier mod = rules.opennessFor(openness);

        Stats.applyResourceDelta(f, def.baseResourceDelta());
        Stats.applyResourceDelta(f, ResourceKey.TRUST, mod.trustDelta());
        Stats.applyScoreDelta(f, ScoreKey.SAFETY, mod.safetyDelta());
        Stats.applyScoreDelta(f, ScoreKey.CAPABILITY, mod.capabilityDelta());

        for (Map.Entry<Branch, Double> e : def.baseResearch().entrySet()) {
            double gain = Stats.computeResearchGain(f, e.getKey(), e.getValue()) * mod.research();
            Stats.addResearch(f, e.getKey(), gain);
        }

        ActionDefinition.ScoreEffects fx = def.scoreEffects();
        if (fx != null) {
            Stats.applyScoreDelta(f, ScoreKey.CAPABILITY, fx.capabilityDelta());
            Stats.applyScoreDelta(f, ScoreKey.SAFETY, fx.safetyDelta());
        }
        if (def.securityLevelDelta() != 0) Stats.applySecurityLevelDelta(f, def.securityLevelDelta());
        if (openness == Openness.SECRET) f.setExposure(f.exposure() + def.exposure());
    }

    private void applyKind(GameState state, FactionState f, ActionDefinition def, ActionChoice choice,
                           DoubleSupplier rng, TurnLog log, List<FactionState> deployers) {
        switch (def.kind()) {
            case DEPLOY_AGI -> {
                if (!f.canDeployAgi()) {
                    log.add(f.name() + " attempted AGI deployment without the breakthrough.");
                } else {
                    log.add(f.name() + " is attempting to deploy AGI.");
                    deployers.add(f);
                }
            }
            case ESPIONAGE -> {
                FactionState target = otherFaction(state, f, choice);
                if (target == null) {
                    log.add(f.name() + "'s espionage had no valid target.");
                } else {
                    espionage.resolve(state, f, target, rng, log);
                }
            }
            case SUBSIDIZE -> {
                FactionState lab = targetLab(state, f, choice, def, log);
                if (lab != null) {
                    Stats.applyResourceDelta(lab, ResourceKey.CAPITAL, SUBSIDY_CAPITAL);
                    log.add(f.name() + " subsidized " + lab.name() + ".");
                }
            }
            case STRATEGIC_INITIATIVE -> {
                FactionState lab = targetLab(state, f, choice, def, log);
                if (lab != null) {
                    Stats.applyResourceDelta(lab, ResourceKey.COMPUTE, INITIATIVE_COMPUTE);
                    Stats.applyResourceDelta(lab, ResourceKey.CAPITAL, INITIATIVE_CAPITAL);
                    log.add(f.name() + " directed state resources to " + lab.name() + ".");
                }
            }
            case REGULATE -> {
                FactionState lab = targetLab(state, f, choice, def, log);
                if (lab != null) {
                    penalize(lab, REGULATE_COMPUTE, REGULATE_INFLUENCE, REGULATE_CAPABILITY);
                    log.add(f.name() + " regulated " + lab.name() + ".");
                }
            }
            case EXECUTIVE_ORDER -> {
                FactionState lab = targetLab(state, f, choice, def, log);
                if (lab != null) {
                    penalize(lab, ORDER_COMPUTE, ORDER_INFLUENCE, ORDER_CAPABILITY);
                    Stats.applyScoreDelta(f, ScoreKey.SAFETY, ORDER_SAFETY_GAIN);
                    log.add(f.name() + " issued an executive order restricting " + lab.name() + ".");
                }
            }
            case COUNTERINTEL -> Stats.applyStatDelta(f, StatKey.OPSEC, COUNTERINTEL_OPSEC);
            case DEFENSIVE_MEASURES -> Stats.applyStatDelta(f, StatKey.OPSEC, DEFENSIVE_OPSEC);
            case FORM_ALLIANCE -> formAlliance(state, f, choice, log);
            case OPEN_SOURCE_RELEASE -> {
                for (FactionState lab : state.labs()) {
                    if (!lab.id().equals(f.id())) Stats.applyScoreDelta(lab, ScoreKey.CAPABILITY, OPEN_SOURCE_LEAK);
                }
                log.add(f.name() + "'s open-source release lifted rival labs' capabilities.");
            }
            default -> { }
        }
    }

    private void formAlliance(GameState state, FactionState f, ActionChoice choice, TurnLog log) {
        FactionState partner = otherFaction(state, f, choice);
        if (partner == null) {
            log.add(f.name() + "'s alliance offer had no valid partner.");
            return;
        }
        boolean added = state.addAlliance(f.id(), partner.id());
        double tension = Math.max(0, state.tension(f.id(), partner.id()) - ALLIANCE_TENSION_RELIEF);
        state.setTension(f.id(), partner.id(), tension);
        if (f.isGovernment() && partner.isGovernment()) {
            state.addTreaty("treaty:" + GameState.pairKey(f.id(), partner.id()));
        }
        log.add(f.name() + (added ? " formed an alliance with " : " reaffirmed its alliance with ")
                + partner.name() + ".");
    }

    private static void penalize(FactionState lab, double compute, double influence, double capability) {
        Stats.applyResourceDelta(lab, ResourceKey.COMPUTE, -compute);
        Stats.applyResourceDelta(lab, ResourceKey.INFLUENCE, -influence);
        Stats.applyScoreDelta(lab, ScoreKey.CAPABILITY, -capability);
    }

    /** Target present in the roster and different from the acting faction, else null. */
    private static FactionState otherFaction(GameState state, FactionState f, ActionChoice choice) {
        FactionState target = state.faction(choice.targetFactionId());
        return (target == null || target.id().equals(f.id())) ? null : target;
    }

    private static FactionState targetLab(GameState state, FactionState f, ActionChoice choice,
                                          ActionDefinition def, TurnLog log) {
        FactionState target = otherFaction(state, f, choice);
        if (target == null || !target.isLab()) {
            log.add(f.name() + "'s " + def.name() + " needs a lab target.");
            return null;
        }
        return target;
    }

    private static String label(Openness o) {
        return (o == Openness.SECRET) ? "secret" : "open";
    }
}
