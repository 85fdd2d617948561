package com.crewdesk.backend;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the environment handed to backend subprocesses, dropping variables
 * that look like credentials.
 */
public final class SafeEnvironment {

    private static final List<Pattern> BLOCKED = List.of(
            Pattern.compile("^OPENCLAW_GATEWAY_TOKEN$"),
            Pattern.compile("^AWS_SECRET"),
            Pattern.compile("^AWS_SESSION"),
            Pattern.compile("^OPENAI_API_KEY$"),
            Pattern.compile("^ANTHROPIC_API_KEY$"),
            Pattern.compile("^GOOGLE_APPLICATION_CREDENTIALS$"),
            Pattern.compile("^DATABASE_URL$"),
            Pattern.compile("^REDIS_URL$"),
            Pattern.compile("SECRET", Pattern.CASE_INSENSITIVE),
            Pattern.compile("PASSWORD", Pattern.CASE_INSENSITIVE),
            Pattern.compile("CREDENTIAL", Pattern.CASE_INSENSITIVE),
            Pattern.compile("PRIVATE_KEY", Pattern.CASE_INSENSITIVE)
    );

    private static final Set<String> ALWAYS_ALLOW = Set.of(
            "PATH", "HOME", "USER", "SHELL", "LANG", "TERM",
            "CLAUDE_CODE_EXPERIMENTAL_AGENT_TEAMS", "CLAUDECODE"
    );

    private SafeEnvironment() {}

    public static Map<String, String> filter(Map<String, String> env) {
        return filter(env, List.of());
    }

    /**
     * @param allowlist names passed through even when they match a blocked pattern
     */
    public static Map<String, String> filter(Map<String, String> env, Collection<String> allowlist) {
        Map<String, String> safe = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : env.entrySet()) {
            String key = entry.getKey();
            if (entry.getValue() == null) continue;
            if (ALWAYS_ALLOW.contains(key) || allowlist.contains(key) || !isBlocked(key)) {
                safe.put(key, entry.getValue());
            }
        }
        return safe;
    }

    static boolean isBlocked(String key) {
        for (Pattern p : BLOCKED) {
            if (p.matcher(key).find()) return true;
        }
        return false;
    }
}
