package model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum FactionType {
    @JsonProperty("lab")        LAB,
    @JsonProperty("government") GOVERNMENT
}
