package com.acme.identity.capl.emit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"Operator", "BuiltInControls", "TermsOfUse"})
public record GrantControls(
    @JsonProperty("Operator") String operator,
    @JsonProperty("BuiltInControls") List<String> builtInControls,
    @JsonProperty("TermsOfUse") List<String> termsOfUse
) {
    public GrantControls {
        builtInControls = PolicyConditions.copy(builtInControls);
        termsOfUse = PolicyConditions.copy(termsOfUse);
    }
}
