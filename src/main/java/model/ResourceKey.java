package model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ResourceKey {
    @JsonProperty("compute")   COMPUTE,
    @JsonProperty("talent")    TALENT,
    @JsonProperty("capital")   CAPITAL,
    @JsonProperty("data")      DATA,
    @JsonProperty("influence") INFLUENCE,
    @JsonProperty("trust")     TRUST
}
