package com.acme.identity.capl.emit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"SignInFrequency", "PersistentBrowser", "CloudAppSecurity", "ApplicationEnforcedRestrictions"})
public record SessionControls(
    @JsonProperty("SignInFrequency") SignInFrequency signInFrequency,
    @JsonProperty("PersistentBrowser") PersistentBrowser persistentBrowser,
    @JsonProperty("CloudAppSecurity") CloudAppSecurity cloudAppSecurity,
    @JsonProperty("ApplicationEnforcedRestrictions") ApplicationEnforcedRestrictions applicationEnforcedRestrictions
) {
    @JsonPropertyOrder({"Value", "Type", "IsEnabled"})
    public record SignInFrequency(
        @JsonProperty("Value") int value,
        @JsonProperty("Type") String type,
        @JsonProperty("IsEnabled") boolean enabled
    ) {}

    @JsonPropertyOrder({"Mode", "IsEnabled"})
    public record PersistentBrowser(
        @JsonProperty("Mode") String mode,
        @JsonProperty("IsEnabled") boolean enabled
    ) {}

    @JsonPropertyOrder({"CloudAppSecurityType", "IsEnabled"})
    public record CloudAppSecurity(
        @JsonProperty("CloudAppSecurityType") String cloudAppSecurityType,
        @JsonProperty("IsEnabled") boolean enabled
    ) {}

    public record ApplicationEnforcedRestrictions(@JsonProperty("IsEnabled") boolean enabled) {}
}
