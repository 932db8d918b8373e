package model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Culture stats carried next to the resources. */
public enum StatKey {
    @JsonProperty("safetyCulture") SAFETY_CULTURE,
    @JsonProperty("opsec")         OPSEC
}
