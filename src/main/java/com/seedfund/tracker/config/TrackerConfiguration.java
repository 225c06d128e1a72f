package com.seedfund.tracker.config;

import com.seedfund.tracker.metrics.EntityFilter;
import com.seedfund.tracker.metrics.MetricFields;
import com.seedfund.tracker.metrics.PeriodWindow;
import com.seedfund.tracker.resolve.InstitutionAliasTable;
import com.seedfund.tracker.schema.CanonicalField;
import com.seedfund.tracker.schema.HeaderAlias;
import com.seedfund.tracker.temporal.YearPattern;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validated, read-only configuration tables loaded once at startup.
 *
 * @param fields canonical fields in policy-table order
 * @param tracks award-type tracks by name, in declaration order
 */
public record TrackerConfiguration(
        String keyField,
        Map<String, CanonicalField> fields,
        List<HeaderAlias> headerAliases,
        InstitutionAliasTable institutionAliases,
        List<YearPattern> yearPatterns,
        int minYear,
        int maxYear,
        MetricFields metricFields,
        List<PeriodWindow> windows,
        Map<String, EntityFilter> tracks
) {

    public TrackerConfiguration {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        headerAliases = List.copyOf(headerAliases);
        yearPatterns = List.copyOf(yearPatterns);
        windows = List.copyOf(windows);
        tracks = Collections.unmodifiableMap(new LinkedHashMap<>(tracks));
    }

    public CanonicalField field(String name) {
        return fields.get(name);
    }

    /**
     * Returns the named track; {@code null} or blank selects all projects.
     */
    public EntityFilter track(String name) {
        if (name == null || name.isBlank()) {
            return tracks.getOrDefault(EntityFilter.ALL, EntityFilter.all());
        }
        EntityFilter filter = tracks.get(name.trim().toLowerCase(Locale.ROOT));
        if (filter == null) {
            if (EntityFilter.ALL.equalsIgnoreCase(name.trim())) {
                return EntityFilter.all();
            }
            throw new IllegalArgumentException(TrackerConstants.MSG_UNKNOWN_TRACK.formatted(name));
        }
        return filter;
    }
}
