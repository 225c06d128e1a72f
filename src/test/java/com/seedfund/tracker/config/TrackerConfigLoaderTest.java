package com.seedfund.tracker.config;

import com.seedfund.tracker.TrackerTestSupport;
import com.seedfund.tracker.metrics.EntityFilter;
import com.seedfund.tracker.metrics.PeriodWindow;
import com.seedfund.tracker.schema.AggregationPolicy;
import com.seedfund.tracker.schema.FieldType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrackerConfigLoaderTest {

    @Test
    void shouldLoadPackagedTables() {
        TrackerConfiguration configuration = TrackerTestSupport.configuration();

        assertEquals("project_id", configuration.keyField());
        assertEquals(AggregationPolicy.IDENTITY, configuration.field("project_id").policy());
        assertEquals(AggregationPolicy.SUM_SAFE, configuration.field("award_amount").policy());
        assertEquals(FieldType.CURRENCY, configuration.field("monetary_benefit").type());
        assertEquals("award_description", configuration.field("monetary_benefit").fallbackField());
        assertTrue(configuration.field("institution").controlledVocabulary());
        assertNull(configuration.field("award_amount").fallbackField());
        assertEquals("science_priority", configuration.metricFields().sciencePriorityField());
        assertEquals("keyword_primary", configuration.metricFields().keywordField());
        assertEquals(2, configuration.yearPatterns().size());
        assertEquals("University of Illinois at Urbana-Champaign",
                configuration.institutionAliases().canonicalize("univeristy  of illinois"));
    }

    @Test
    void shouldSortWindowsAndLowerCaseTracks() {
        TrackerProperties properties = TrackerTestSupport.properties();
        properties.getWindows().put("early", "2010-2014");
        TrackerProperties.Track track = new TrackerProperties.Track();
        track.setMatchExact("104g - PFAS");
        properties.getTracks().put("104G_PFAS", track);

        TrackerConfiguration configuration = new TrackerConfigLoader(properties).load();

        assertEquals(List.of("early", "10yr", "5yr"),
                configuration.windows().stream().map(PeriodWindow::label).toList());
        EntityFilter pfas = configuration.track("104g_pfas");
        assertEquals("104g_pfas", pfas.name());
        assertEquals("104g_pfas", pfas.label());
        assertEquals("award_type", pfas.field());
    }

    @Test
    void shouldResolveTracksByName() {
        TrackerConfiguration configuration = TrackerTestSupport.configuration();

        assertEquals(EntityFilter.ALL, configuration.track(null).name());
        assertEquals(EntityFilter.ALL, configuration.track(" ").name());
        assertEquals("Base Grant (104b)", configuration.track("104B").matchExact());
        assertThrows(IllegalArgumentException.class, () -> configuration.track("104z"));
    }

    @Test
    void shouldFailWhenMetricFieldHasNoPolicy() {
        TrackerProperties properties = TrackerTestSupport.properties();
        properties.getMetrics().setFollowOnField("follow_on_funding");

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new TrackerConfigLoader(properties).load());
        assertTrue(ex.getMessage().contains("follow_on_funding"));
    }

    @Test
    void shouldFailWhenMetricFieldHasWrongType() {
        TrackerProperties properties = TrackerTestSupport.properties();
        properties.getMetrics().setInvestmentField("project_title");

        assertThrows(IllegalStateException.class, () -> new TrackerConfigLoader(properties).load());

        TrackerProperties numericTopic = TrackerTestSupport.properties();
        numericTopic.getMetrics().setKeywordField("award_amount");
        assertThrows(IllegalStateException.class, () -> new TrackerConfigLoader(numericTopic).load());
    }

    @Test
    void shouldFailWhenAliasTargetsUndeclaredField() {
        TrackerProperties properties = TrackerTestSupport.properties();
        properties.setHeaderAliasFile("classpath:invalid-config/header-aliases-unknown-field.csv");

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new TrackerConfigLoader(properties).load());
        assertTrue(ex.getMessage().contains("program_officer"));
    }

    @Test
    void shouldFailWhenFallbackIsDeclaredOnNonParsedPolicy() {
        TrackerProperties properties = TrackerTestSupport.properties();
        properties.setFieldPolicyFile("classpath:invalid-config/field-policies-bad-fallback.csv");

        assertThrows(IllegalStateException.class, () -> new TrackerConfigLoader(properties).load());
    }

    @Test
    void shouldFailWhenNumericFieldUsesUnionPolicy() {
        TrackerProperties properties = TrackerTestSupport.properties();
        properties.setFieldPolicyFile("classpath:invalid-config/field-policies-union-amount.csv");

        assertThrows(IllegalStateException.class, () -> new TrackerConfigLoader(properties).load());
    }

    @Test
    void shouldFailOnMissingTableOrBadWindow() {
        TrackerProperties missing = TrackerTestSupport.properties();
        missing.setYearPatternFile("classpath:config/absent.csv");
        assertThrows(IllegalStateException.class, () -> new TrackerConfigLoader(missing).load());

        TrackerProperties inverted = TrackerTestSupport.properties();
        inverted.getWindows().put("bad", "2024-2015");
        assertThrows(IllegalStateException.class, () -> new TrackerConfigLoader(inverted).load());
    }
}
