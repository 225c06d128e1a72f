package com.seedfund.tracker.metrics;

import com.seedfund.tracker.resolve.ProjectEntity;

import java.util.Locale;

/**
 * Named award-type track selecting entities by their award-type value. With neither
 * {@code matchExact} nor {@code matchContains} set, every entity is selected.
 */
public record EntityFilter(String name, String label, String field, String matchExact, String matchContains) {

    public static final String ALL = "all";

    public EntityFilter {
        matchExact = blankToNull(matchExact);
        matchContains = blankToNull(matchContains);
        label = label == null || label.isBlank() ? name : label;
    }

    public static EntityFilter all() {
        return new EntityFilter(ALL, "All Projects", null, null, null);
    }

    public boolean matches(ProjectEntity entity) {
        if (matchExact == null && matchContains == null) {
            return true;
        }
        String value = entity.text(field);
        if (value == null) {
            return false;
        }
        if (matchExact != null) {
            return value.equalsIgnoreCase(matchExact);
        }
        return value.toLowerCase(Locale.ROOT).contains(matchContains.toLowerCase(Locale.ROOT));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
