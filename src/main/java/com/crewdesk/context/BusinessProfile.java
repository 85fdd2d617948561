package com.crewdesk.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Operator business profile, read from {@code profile.json}. Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BusinessProfile(
    String businessName,
    String industry,
    Integer teamSize,
    Map<String, RoleConfig> roles
) {

    public BusinessProfile {
        roles = roles == null ? Map.of() : Map.copyOf(roles);
    }

    public static BusinessProfile empty() {
        return new BusinessProfile(null, null, null, Map.of());
    }
}
