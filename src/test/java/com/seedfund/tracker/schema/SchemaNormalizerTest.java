package com.seedfund.tracker.schema;

import com.seedfund.tracker.TrackerTestSupport;
import com.seedfund.tracker.config.TrackerConfiguration;
import com.seedfund.tracker.quality.IssueType;
import com.seedfund.tracker.quality.QualityIssue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaNormalizerTest {

    private final SchemaNormalizer normalizer = normalizer();

    @Test
    void shouldMapHeadersDifferingOnlyInWhitespaceAndCase() {
        HeaderMapping mapping = normalizer.mapHeaders("IWRC_2016.csv", List.of(
                "Project ID ",
                "AWARD TYPE",
                "Award Amount Allocated ($) this must be filled in\n for all lines"
        ));

        assertEquals("project_id", mapping.columnFields().get(0));
        assertEquals("award_type", mapping.columnFields().get(1));
        assertEquals("award_amount", mapping.columnFields().get(2));
        assertTrue(mapping.issues().isEmpty());
    }

    @Test
    void shouldMapRewordedHeaderBySharedSignificantWords() {
        HeaderMapping mapping = normalizer.mapHeaders("IWRC_2022.csv", List.of(
                "Project ID",
                "Monetary Benefit of the Award (enter NA where not applicable)"
        ));

        assertEquals("monetary_benefit", mapping.columnFields().get(1));
    }

    @Test
    void shouldDropAndReportUnknownHeaders() {
        HeaderMapping mapping = normalizer.mapHeaders("IWRC_2016.csv", List.of("Project ID", "Internal Notes", ""));

        assertEquals(1, mapping.columnFields().size());
        assertEquals(1, mapping.issues().size());
        QualityIssue issue = mapping.issues().get(0);
        assertEquals(IssueType.UNMAPPED_HEADER, issue.type());
        assertEquals("Internal Notes", issue.field());
    }

    @Test
    void shouldKeepFirstColumnWhenTwoHeadersClaimTheSameField() {
        HeaderMapping mapping = normalizer.mapHeaders("IWRC_2016.csv", List.of("Project ID", "Project Identifiers"));

        assertEquals("project_id", mapping.columnFields().get(0));
        assertFalse(mapping.columnFields().containsKey(1));
        assertEquals(IssueType.DUPLICATE_HEADER, mapping.issues().get(0).type());
    }

    @Test
    void shouldRenameRowsIntoRawRecords() {
        SourceTable table = new SourceTable("IWRC_2020.csv",
                List.of("Project ID", "Award Type", "Internal Notes"),
                List.of(
                        List.of("2020IL103AIS", "104g - AIS", "ignore me"),
                        List.of("2020IL104B", "")
                ));

        NormalizedTable normalized = normalizer.normalize(table);

        assertEquals(2, normalized.records().size());
        RawRecord first = normalized.records().get(0);
        assertEquals("IWRC_2020.csv", first.provenance());
        assertEquals(1, first.rowNumber());
        assertEquals("104g - AIS", first.value("award_type"));
        assertNull(first.value("Internal Notes"));
        RawRecord second = normalized.records().get(1);
        assertEquals(2, second.rowNumber());
        assertFalse(second.has("award_type"));
    }

    @Test
    void shouldKeepShortWordsAndDropStopwordsFromSignificantTokens() {
        assertEquals(Set.of("number", "phd", "students", "supported", "wrra"),
                SchemaNormalizer.significantTokens("Number of PhD Students Supported by WRRA $"));
    }

    @Test
    void shouldTellDegreeLevelsApartInRewordedTraineeHeaders() {
        HeaderMapping mapping = normalizer.mapHeaders("IWRC_2023.csv", List.of(
                "Project ID",
                "Number of MS Students Supported by WRRA Funds",
                "Number of PhD Students Supported by WRRA Funds",
                "Number of Post Docs Supported by WRRA Funds"
        ));

        assertEquals("ms_students", mapping.columnFields().get(1));
        assertEquals("phd_students", mapping.columnFields().get(2));
        assertEquals("postdoc_students", mapping.columnFields().get(3));
        assertTrue(mapping.issues().isEmpty());
    }

    @Test
    void shouldReportHeaderMatchingSeveralFieldsEquallyWell() {
        HeaderMapping mapping = normalizer.mapHeaders("IWRC_2023.csv", List.of(
                "Project ID",
                "Number of Students Supported by WRRA Funds"
        ));

        assertFalse(mapping.columnFields().containsKey(1));
        assertEquals(1, mapping.issues().size());
        assertEquals(IssueType.UNMAPPED_HEADER, mapping.issues().get(0).type());
        assertEquals("Number of Students Supported by WRRA Funds", mapping.issues().get(0).field());
    }

    private static SchemaNormalizer normalizer() {
        TrackerConfiguration configuration = TrackerTestSupport.configuration();
        return new SchemaNormalizer(configuration.headerAliases(), configuration.fields().keySet());
    }
}
