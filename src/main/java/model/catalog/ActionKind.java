package model.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Dispatch tag of an action. Every catalog action's id equals its kind's id. */
public enum ActionKind {
    RESEARCH_CAPABILITIES("research_capabilities"),
    RESEARCH_SAFETY("research_safety"),
    BUILD_COMPUTE("build_compute"),
    DEPLOY_PRODUCTS("deploy_products"),
    DEPLOY_AGI("deploy_agi"),
    POLICY("policy"),
    ESPIONAGE("espionage"),
    SUBSIDIZE("subsidize"),
    REGULATE("regulate"),
    COUNTERINTEL("counterintel"),
    HIRE_TALENT("hire_talent"),
    PUBLISH_RESEARCH("publish_research"),
    FORM_ALLIANCE("form_alliance"),
    SECURE_FUNDING("secure_funding"),
    HARDWARE_PARTNERSHIP("hardware_partnership"),
    OPEN_SOURCE_RELEASE("open_source_release"),
    DEFENSIVE_MEASURES("defensive_measures"),
    ACCELERATE_TIMELINE("accelerate_timeline"),
    SAFETY_PAUSE("safety_pause"),
    OPEN_RESEARCH("open_research"),
    MOVE_FAST("move_fast"),
    STATE_RESOURCES("state_resources"),
    EXECUTIVE_ORDER("executive_order"),
    STRATEGIC_INITIATIVE("strategic_initiative");

    private final String id;

    ActionKind(String id) { this.id = id; }

    @JsonValue
    public String id() { return id; }

    @JsonCreator
    public static ActionKind fromId(String id) {
        for (ActionKind k : values()) if (k.id.equals(id)) return k;
        throw new IllegalArgumentException("Unknown action kind: " + id);
    }
}
