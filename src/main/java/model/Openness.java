package model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Openness {
    @JsonProperty("open")   OPEN,
    @JsonProperty("secret") SECRET
}
