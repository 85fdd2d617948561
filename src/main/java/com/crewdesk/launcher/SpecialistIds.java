package com.crewdesk.launcher;

import com.crewdesk.core.model.SpecialistSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * File-safe specialist ids, used for prompt and result file names.
 */
public final class SpecialistIds {

    private SpecialistIds() {}

    /**
     * Lowercases, replaces anything outside {@code [a-z0-9_-]} with '-', and
     * collapses runs of '-'.
     */
    public static String sanitize(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_-]", "-")
                .replaceAll("-+", "-");
    }

    /**
     * One id per specialist, in order. Colliding ids get a numeric suffix.
     */
    public static List<String> assign(List<SpecialistSpec> specialists) {
        Set<String> used = new HashSet<>();
        List<String> ids = new ArrayList<>(specialists.size());
        for (SpecialistSpec s : specialists) {
            String base = sanitize(s.role());
            String id = base;
            for (int n = 2; !used.add(id); n++) {
                id = base + "-" + n;
            }
            ids.add(id);
        }
        return ids;
    }
}
