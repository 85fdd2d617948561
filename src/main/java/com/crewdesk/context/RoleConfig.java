package com.crewdesk.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Per-role scoping within the business profile.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoleConfig(
    List<String> allowedDomains,
    List<String> documentAccess,
    Integer contextBudget
) {}
