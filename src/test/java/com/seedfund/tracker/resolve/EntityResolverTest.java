package com.seedfund.tracker.resolve;

import com.seedfund.tracker.TrackerTestSupport;
import com.seedfund.tracker.config.TrackerConfiguration;
import com.seedfund.tracker.parse.AmountParser;
import com.seedfund.tracker.parse.AmountSource;
import com.seedfund.tracker.quality.IssueType;
import com.seedfund.tracker.quality.QualityIssue;
import com.seedfund.tracker.schema.RawRecord;
import com.seedfund.tracker.temporal.YearExtractor;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.seedfund.tracker.TrackerTestSupport.record;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityResolverTest {

    private static final String SOURCE = "IWRC_2020.csv";

    private final EntityResolver resolver = resolver();

    @Test
    void shouldTakeRepeatedAwardAmountOnce() {
        List<RawRecord> records = List.of(
                record(SOURCE, 1, "project_id", "2019IL101B", "award_amount", "50000"),
                record(SOURCE, 2, "project_id", "2019IL101B", "award_amount", "50000"),
                record(SOURCE, 3, "project_id", "2019IL101B", "award_amount", "$50,000")
        );

        ResolutionResult result = resolver.resolve(records);

        assertEquals(1, result.entities().size());
        ProjectEntity entity = result.entities().get(0);
        assertEquals(new BigDecimal("50000.00"), entity.amount("award_amount"));
        assertEquals(AmountSource.DIRECT, entity.amountSource("award_amount"));
        assertEquals(3, entity.recordCount());
    }

    @Test
    void shouldCollapseNineOutputRowsIntoOneProject() {
        List<RawRecord> records = new ArrayList<>();
        for (int row = 1; row <= 9; row++) {
            records.add(record(SOURCE, row,
                    "project_id", "2020IL103AIS",
                    "award_type", "104g - AIS",
                    "award_amount", "249,000",
                    "phd_students", "2"));
        }

        ResolutionResult result = resolver.resolve(records);

        assertEquals(1, result.entities().size());
        ProjectEntity entity = result.entities().get(0);
        assertEquals("2020IL103AIS", entity.key());
        assertEquals(Integer.valueOf(2020), entity.projectYear());
        assertEquals(9, entity.recordCount());
        assertEquals(new BigDecimal("249000.00"), entity.amount("award_amount"));
        assertEquals(new BigDecimal("2"), entity.amount("phd_students"));
        assertEquals(9, result.rawRecordCount());
    }

    @Test
    void shouldTakeLargestParsedFollowOnAmount() {
        List<RawRecord> records = List.of(
                record(SOURCE, 1, "project_id", "2021IL105B", "monetary_benefit", "NA"),
                record(SOURCE, 2, "project_id", "2021IL105B", "monetary_benefit", "$250,000"),
                record(SOURCE, 3, "project_id", "2021IL105B", "monetary_benefit", "Received $5,000 travel grant"),
                record(SOURCE, 4, "project_id", "2021IL105B", "monetary_benefit", "$250,000")
        );

        ProjectEntity entity = resolver.resolve(records).entities().get(0);

        assertEquals(new BigDecimal("250000.00"), entity.amount("monetary_benefit"));
        assertEquals(AmountSource.DIRECT, entity.amountSource("monetary_benefit"));
    }

    @Test
    void shouldNotSumSameGrantReportedInDifferentWording() {
        List<RawRecord> records = List.of(
                record(SOURCE, 1, "project_id", "2023IL112B", "monetary_benefit", "NSF grant $250,000"),
                record(SOURCE, 2, "project_id", "2023IL112B", "monetary_benefit",
                        "Awarded $250,000 from NSF (continuation)")
        );

        ProjectEntity entity = resolver.resolve(records).entities().get(0);

        assertEquals(new BigDecimal("250000.00"), entity.amount("monetary_benefit"));
        assertEquals(AmountSource.SUMMED_FROM_TEXT, entity.amountSource("monetary_benefit"));
    }

    @Test
    void shouldRecoverFollowOnAmountFromSwappedDescription() {
        List<RawRecord> records = List.of(
                record(SOURCE, 1, "project_id", "2022IL110B", "awards_grants", "Grant", "award_description", "250000")
        );

        ProjectEntity entity = resolver.resolve(records).entities().get(0);

        assertEquals(new BigDecimal("250000.00"), entity.amount("monetary_benefit"));
        assertEquals(AmountSource.RECOVERED_FROM_SWAP, entity.amountSource("monetary_benefit"));
    }

    @Test
    void shouldNotDependOnRecordOrder() {
        List<RawRecord> records = List.of(
                record("IWRC_2016.csv", 4, "project_id", "FY16-003", "project_title", "Wetland nitrogen", "award_amount", "NA"),
                record("IWRC_2016.csv", 5, "project_id", "FY16-003", "project_title", "Wetland Nitrogen Removal", "award_amount", "30000"),
                record(SOURCE, 1, "project_id", "2020IL103AIS", "institution", "University of Illinois"),
                record(SOURCE, 2, "project_id", "2020IL103AIS", "institution", "Southern Illinois University Carbondale"),
                record(SOURCE, 3, "project_id", "2020IL103AIS", "monetary_benefit", "1.2 million")
        );
        List<RawRecord> reversed = new ArrayList<>(records);
        Collections.reverse(reversed);

        ResolutionResult forward = resolver.resolve(records);

        assertEquals(forward, resolver.resolve(reversed));
        assertEquals(forward, resolver.resolve(records));
    }

    @Test
    void shouldFlagDisagreeingIdentityFields() {
        List<RawRecord> records = List.of(
                record(SOURCE, 1, "project_id", "2023IL120B", "project_title", "Lake Michigan sediment", "pi_name", "J. Smith"),
                record(SOURCE, 2, "project_id", "2023IL120B", "project_title", "Lake  michigan SEDIMENT", "pi_name", "A. Jones")
        );

        ResolutionResult result = resolver.resolve(records);
        ProjectEntity entity = result.entities().get(0);

        assertFalse(entity.consistent());
        assertEquals(List.of("pi_name"), entity.inconsistentFields());
        assertEquals("J. Smith", entity.text("pi_name"));
        assertEquals("Lake Michigan sediment", entity.text("project_title"));
        assertEquals(1, count(result.issues(), IssueType.INCONSISTENT_IDENTITY_FIELD));
    }

    @Test
    void shouldUnionInstitutionsThroughAliasTable() {
        List<RawRecord> records = List.of(
                record(SOURCE, 1, "project_id", "2020IL103AIS", "institution", "University of Illinois "),
                record(SOURCE, 2, "project_id", "2020IL103AIS", "institution", "Univeristy of Illinois"),
                record(SOURCE, 3, "project_id", "2020IL103AIS", "institution", "Southern Illinois University Carbondale")
        );

        ProjectEntity entity = resolver.resolve(records).entities().get(0);

        assertEquals(List.of("University of Illinois at Urbana-Champaign", "Southern Illinois University"),
                entity.variantsOf("institution"));
        assertEquals("University of Illinois at Urbana-Champaign", entity.text("institution"));
        assertTrue(entity.consistent());
    }

    @Test
    void shouldSkipRecordsWithoutIdentifier() {
        List<RawRecord> records = List.of(
                record(SOURCE, 1, "project_id", "2020IL103AIS", "award_amount", "1000"),
                record(SOURCE, 2, "project_id", "  ", "award_amount", "9999")
        );

        ResolutionResult result = resolver.resolve(records);

        assertEquals(1, result.entities().size());
        assertEquals(1, count(result.issues(), IssueType.MISSING_IDENTIFIER));
        assertEquals(2, result.rawRecordCount());
    }

    @Test
    void shouldKeepEntitiesWhoseYearCannotBeExtracted() {
        ResolutionResult result = resolver.resolve(List.of(
                record(SOURCE, 1, "project_id", "SEED-ABC", "award_amount", "1000")));

        ProjectEntity entity = result.entities().get(0);
        assertNull(entity.projectYear());
        assertFalse(entity.hasYear());
        assertEquals(1, count(result.issues(), IssueType.UNEXTRACTABLE_IDENTIFIER));
    }

    @Test
    void shouldReportUnparsedValuesAndDefaultThemToZero() {
        ResolutionResult result = resolver.resolve(List.of(
                record(SOURCE, 1, "project_id", "2020IL140B", "award_amount", "pending"),
                record(SOURCE, 2, "project_id", "2020IL140B", "ms_students", "one")));

        ProjectEntity entity = result.entities().get(0);
        assertEquals(0, entity.amount("award_amount").signum());
        assertEquals(AmountSource.DEFAULTED_TO_ZERO, entity.amountSource("award_amount"));
        assertEquals(2, count(result.issues(), IssueType.UNPARSED_VALUE));
    }

    private static long count(List<QualityIssue> issues, IssueType type) {
        return issues.stream().filter(issue -> issue.type() == type).count();
    }

    private static EntityResolver resolver() {
        TrackerConfiguration configuration = TrackerTestSupport.configuration();
        YearExtractor yearExtractor = new YearExtractor(
                configuration.yearPatterns(), configuration.minYear(), configuration.maxYear());
        return new EntityResolver(configuration, new AmountParser(), yearExtractor);
    }
}
