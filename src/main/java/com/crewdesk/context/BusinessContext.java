package com.crewdesk.context;

import java.util.List;

/**
 * Business context scoped to one role.
 */
public record BusinessContext(
    BusinessProfile profile,
    String role,
    List<String> allowedDomains,
    List<String> documentAccess,
    int contextBudget
) {

    public BusinessContext {
        allowedDomains = allowedDomains == null ? List.of() : List.copyOf(allowedDomains);
        documentAccess = documentAccess == null ? List.of() : List.copyOf(documentAccess);
    }

    public static BusinessContext empty(String role) {
        return new BusinessContext(BusinessProfile.empty(), role, List.of(), List.of(),
                BusinessContextLoader.DEFAULT_CONTEXT_BUDGET);
    }

    public boolean hasBusinessName() {
        return profile.businessName() != null && !profile.businessName().isBlank();
    }

    public boolean hasIndustry() {
        return profile.industry() != null && !profile.industry().isBlank();
    }
}
