package model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum LossType {
    @JsonProperty("catastrophe")  CATASTROPHE,
    @JsonProperty("obsolescence") OBSOLESCENCE,
    @JsonProperty("collapse")     COLLAPSE,
    @JsonProperty("coup")         COUP,
    @JsonProperty("stalemate")    STALEMATE
}
