package model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Research pools. Declaration order is the tie-break order wherever branches are compared. */
public enum Branch {
    @JsonProperty("capabilities") CAPABILITIES,
    @JsonProperty("safety")       SAFETY,
    @JsonProperty("ops")          OPS,
    @JsonProperty("policy")       POLICY
}
