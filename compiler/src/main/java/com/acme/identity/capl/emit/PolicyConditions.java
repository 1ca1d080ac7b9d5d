package com.acme.identity.capl.emit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"Users", "Applications", "Platforms", "Locations", "DeviceStates",
    "ClientAppTypes", "SignInRiskLevels", "UserRiskLevels"})
public record PolicyConditions(
    @JsonProperty("Users") Users users,
    @JsonProperty("Applications") Applications applications,
    @JsonProperty("Platforms") Platforms platforms,
    @JsonProperty("Locations") Locations locations,
    @JsonProperty("DeviceStates") DeviceStates deviceStates,
    @JsonProperty("ClientAppTypes") List<String> clientAppTypes,
    @JsonProperty("SignInRiskLevels") List<String> signInRiskLevels,
    @JsonProperty("UserRiskLevels") List<String> userRiskLevels
) {
    public PolicyConditions {
        clientAppTypes = copy(clientAppTypes);
        signInRiskLevels = copy(signInRiskLevels);
        userRiskLevels = copy(userRiskLevels);
    }

    static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonPropertyOrder({"IncludeUsers", "ExcludeUsers", "IncludeGroups", "ExcludeGroups", "IncludeRoles", "ExcludeRoles"})
    public record Users(
        @JsonProperty("IncludeUsers") List<String> includeUsers,
        @JsonProperty("ExcludeUsers") List<String> excludeUsers,
        @JsonProperty("IncludeGroups") List<String> includeGroups,
        @JsonProperty("ExcludeGroups") List<String> excludeGroups,
        @JsonProperty("IncludeRoles") List<String> includeRoles,
        @JsonProperty("ExcludeRoles") List<String> excludeRoles
    ) {
        public Users {
            includeUsers = copy(includeUsers);
            excludeUsers = copy(excludeUsers);
            includeGroups = copy(includeGroups);
            excludeGroups = copy(excludeGroups);
            includeRoles = copy(includeRoles);
            excludeRoles = copy(excludeRoles);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonPropertyOrder({"IncludeApplications", "ExcludeApplications"})
    public record Applications(
        @JsonProperty("IncludeApplications") List<String> includeApplications,
        @JsonProperty("ExcludeApplications") List<String> excludeApplications
    ) {
        public Applications {
            includeApplications = copy(includeApplications);
            excludeApplications = copy(excludeApplications);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonPropertyOrder({"IncludePlatforms", "ExcludePlatforms"})
    public record Platforms(
        @JsonProperty("IncludePlatforms") List<String> includePlatforms,
        @JsonProperty("ExcludePlatforms") List<String> excludePlatforms
    ) {
        public Platforms {
            includePlatforms = copy(includePlatforms);
            excludePlatforms = copy(excludePlatforms);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonPropertyOrder({"IncludeLocations", "ExcludeLocations"})
    public record Locations(
        @JsonProperty("IncludeLocations") List<String> includeLocations,
        @JsonProperty("ExcludeLocations") List<String> excludeLocations
    ) {
        public Locations {
            includeLocations = copy(includeLocations);
            excludeLocations = copy(excludeLocations);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonPropertyOrder({"IncludeStates", "ExcludeStates"})
    public record DeviceStates(
        @JsonProperty("IncludeStates") List<String> includeStates,
        @JsonProperty("ExcludeStates") List<String> excludeStates
    ) {
        public DeviceStates {
            includeStates = copy(includeStates);
            excludeStates = copy(excludeStates);
        }
    }
}
