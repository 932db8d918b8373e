package model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum VictoryType {
    @JsonProperty("safe_agi")     SAFE_AGI,
    @JsonProperty("dominant")     DOMINANT,
    @JsonProperty("public_trust") PUBLIC_TRUST,
    @JsonProperty("regulatory")   REGULATORY,
    @JsonProperty("alliance")     ALLIANCE,
    @JsonProperty("control")      CONTROL
}
