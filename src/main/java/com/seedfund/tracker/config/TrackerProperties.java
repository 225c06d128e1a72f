package com.seedfund.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized tracking configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {

    private String extractFilePattern = TrackerConstants.DEFAULT_EXTRACT_FILE_PATTERN;
    private int headerRowIndex = 0;
    private Map<String, Integer> headerRowOverrides = new LinkedHashMap<>();
    private String headerAliasFile = TrackerConstants.DEFAULT_HEADER_ALIAS_FILE;
    private String fieldPolicyFile = TrackerConstants.DEFAULT_FIELD_POLICY_FILE;
    private String institutionAliasFile = TrackerConstants.DEFAULT_INSTITUTION_ALIAS_FILE;
    private String yearPatternFile = TrackerConstants.DEFAULT_YEAR_PATTERN_FILE;
    private String keyField = TrackerConstants.DEFAULT_KEY_FIELD;
    private int minYear = TrackerConstants.DEFAULT_MIN_YEAR;
    private int maxYear = TrackerConstants.DEFAULT_MAX_YEAR;
    private Metrics metrics = new Metrics();
    private Map<String, String> windows = new LinkedHashMap<>();
    private Map<String, Track> tracks = new LinkedHashMap<>();

    public String getExtractFilePattern() {
        return extractFilePattern;
    }

    public void setExtractFilePattern(String extractFilePattern) {
        this.extractFilePattern = extractFilePattern;
    }

    public int getHeaderRowIndex() {
        return headerRowIndex;
    }

    public void setHeaderRowIndex(int headerRowIndex) {
        this.headerRowIndex = headerRowIndex;
    }

    public Map<String, Integer> getHeaderRowOverrides() {
        return headerRowOverrides;
    }

    public void setHeaderRowOverrides(Map<String, Integer> headerRowOverrides) {
        this.headerRowOverrides = headerRowOverrides;
    }

    public String getHeaderAliasFile() {
        return headerAliasFile;
    }

    public void setHeaderAliasFile(String headerAliasFile) {
        this.headerAliasFile = headerAliasFile;
    }

    public String getFieldPolicyFile() {
        return fieldPolicyFile;
    }

    public void setFieldPolicyFile(String fieldPolicyFile) {
        this.fieldPolicyFile = fieldPolicyFile;
    }

    public String getInstitutionAliasFile() {
        return institutionAliasFile;
    }

    public void setInstitutionAliasFile(String institutionAliasFile) {
        this.institutionAliasFile = institutionAliasFile;
    }

    public String getYearPatternFile() {
        return yearPatternFile;
    }

    public void setYearPatternFile(String yearPatternFile) {
        this.yearPatternFile = yearPatternFile;
    }

    public String getKeyField() {
        return keyField;
    }

    public void setKeyField(String keyField) {
        this.keyField = keyField;
    }

    public int getMinYear() {
        return minYear;
    }

    public void setMinYear(int minYear) {
        this.minYear = minYear;
    }

    public int getMaxYear() {
        return maxYear;
    }

    public void setMaxYear(int maxYear) {
        this.maxYear = maxYear;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public Map<String, String> getWindows() {
        return windows;
    }

    public void setWindows(Map<String, String> windows) {
        this.windows = windows;
    }

    public Map<String, Track> getTracks() {
        return tracks;
    }

    public void setTracks(Map<String, Track> tracks) {
        this.tracks = tracks;
    }

    /**
     * Canonical fields feeding the aggregate metrics.
     */
    public static class Metrics {

        private String investmentField = "award_amount";
        private String followOnField = "monetary_benefit";
        private List<String> traineeFields = new ArrayList<>(
                List.of("phd_students", "ms_students", "undergrad_students", "postdoc_students"));
        private String institutionField = "institution";
        private String awardTypeField = "award_type";
        private String achievementCategoryField = "awards_grants";
        private String sciencePriorityField = "science_priority";
        private String keywordField = "keyword_primary";

        public String getInvestmentField() {
            return investmentField;
        }

        public void setInvestmentField(String investmentField) {
            this.investmentField = investmentField;
        }

        public String getFollowOnField() {
            return followOnField;
        }

        public void setFollowOnField(String followOnField) {
            this.followOnField = followOnField;
        }

        public List<String> getTraineeFields() {
            return traineeFields;
        }

        public void setTraineeFields(List<String> traineeFields) {
            this.traineeFields = traineeFields;
        }

        public String getInstitutionField() {
            return institutionField;
        }

        public void setInstitutionField(String institutionField) {
            this.institutionField = institutionField;
        }

        public String getAwardTypeField() {
            return awardTypeField;
        }

        public void setAwardTypeField(String awardTypeField) {
            this.awardTypeField = awardTypeField;
        }

        public String getAchievementCategoryField() {
            return achievementCategoryField;
        }

        public void setAchievementCategoryField(String achievementCategoryField) {
            this.achievementCategoryField = achievementCategoryField;
        }

        public String getSciencePriorityField() {
            return sciencePriorityField;
        }

        public void setSciencePriorityField(String sciencePriorityField) {
            this.sciencePriorityField = sciencePriorityField;
        }

        public String getKeywordField() {
            return keywordField;
        }

        public void setKeywordField(String keywordField) {
            this.keywordField = keywordField;
        }
    }

    /**
     * Named award-type track; an empty match selects every project.
     */
    public static class Track {

        private String label;
        private String matchExact;
        private String matchContains;

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public String getMatchExact() {
            return matchExact;
        }

        public void setMatchExact(String matchExact) {
            this.matchExact = matchExact;
        }

        public String getMatchContains() {
            return matchContains;
        }

        public void setMatchContains(String matchContains) {
            this.matchContains = matchContains;
        }
    }
}
