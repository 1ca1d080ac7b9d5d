package com.acme.identity.capl.emit;

import com.acme.identity.capl.ast.BranchState;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Canonical flat policy record, one per leaf. Property names match the record the downstream
 * JSON/YAML converters already read; absent aggregates are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"DisplayName", "State", "Conditions", "GrantControls", "SessionControls"})
public record GeneratedPolicy(
    @JsonProperty("DisplayName") String displayName,
    @JsonProperty("State") BranchState state,
    @JsonProperty("Conditions") PolicyConditions conditions,
    @JsonProperty("GrantControls") GrantControls grantControls,
    @JsonProperty("SessionControls") SessionControls sessionControls
) {
    public GeneratedPolicy {
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(conditions, "conditions");
    }
}
