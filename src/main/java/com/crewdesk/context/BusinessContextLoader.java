package com.crewdesk.context;

import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.persistence.JsonFiles;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Reads the business profile on every call so edits apply to the next task
 * without a restart. A missing or unreadable profile is an empty one.
 */
@Service
public class BusinessContextLoader {

    public static final int DEFAULT_CONTEXT_BUDGET = 2000;

    private final Path profilePath;

    @Autowired
    public BusinessContextLoader(CrewdeskProperties properties) {
        this(properties.homePath().resolve("profile.json"));
    }

    public BusinessContextLoader(Path profilePath) {
        this.profilePath = profilePath;
    }

    public BusinessProfile loadProfile() {
        return JsonFiles.read(profilePath, BusinessProfile.class).orElse(BusinessProfile.empty());
    }

    public BusinessContext loadContext(String role) {
        BusinessProfile profile = loadProfile();
        RoleConfig roleConfig = profile.roles().get(role);
        if (roleConfig == null) {
            return new BusinessContext(profile, role, null, null, DEFAULT_CONTEXT_BUDGET);
        }
        return new BusinessContext(
                profile,
                role,
                roleConfig.allowedDomains(),
                roleConfig.documentAccess(),
                roleConfig.contextBudget() != null ? roleConfig.contextBudget() : DEFAULT_CONTEXT_BUDGET);
    }
}
