package com.seedfund.tracker.schema;

import com.seedfund.tracker.config.TrackerConstants;
import com.seedfund.tracker.quality.QualityIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps the literal headers of a source extract onto canonical field names.
 *
 * <p>Headers differ between reporting vintages: trailing spaces, wrapped lines, reworded
 * instructions in parentheses. A header is matched first by its whitespace-collapsed,
 * case-insensitive text against the alias table, then by sharing at least two significant words
 * with an alias. Headers matching nothing, or matching aliases of different fields equally well,
 * are dropped and reported, never raised.
 */
public class SchemaNormalizer {

    private static final Logger log = LoggerFactory.getLogger(SchemaNormalizer.class);

    private final List<HeaderAlias> aliases;
    private final Map<String, String> fieldByHeaderKey;

    public SchemaNormalizer(List<HeaderAlias> aliases, Set<String> canonicalFields) {
        this.aliases = List.copyOf(aliases);
        Map<String, String> exact = new LinkedHashMap<>();
        for (String field : canonicalFields) {
            exact.put(headerKey(field), field);
        }
        for (HeaderAlias alias : aliases) {
            exact.putIfAbsent(headerKey(alias.literal()), alias.field());
        }
        this.fieldByHeaderKey = exact;
    }

    public HeaderMapping mapHeaders(String sourceName, List<String> headers) {
        Map<Integer, String> columnFields = new TreeMap<>();
        Set<String> claimed = new HashSet<>();
        List<QualityIssue> issues = new ArrayList<>();
        List<Integer> unmatched = new ArrayList<>();

        for (int i = 0; i < headers.size(); i++) {
            String field = fieldByHeaderKey.get(headerKey(headers.get(i)));
            if (field == null) {
                unmatched.add(i);
            } else if (!claimed.add(field)) {
                issues.add(QualityIssue.duplicateHeader(sourceName, headers.get(i), field));
            } else {
                columnFields.put(i, field);
            }
        }

        for (int index : unmatched) {
            String header = headers.get(index);
            if (header == null || header.isBlank()) {
                continue;
            }
            String field = bestOverlapMatch(sourceName, header, claimed);
            if (field == null) {
                log.warn("Dropping unmapped header in {}: '{}'", sourceName, headerKey(header));
                issues.add(QualityIssue.unmappedHeader(sourceName, header));
            } else {
                log.debug("Header '{}' in {} matched {} by word overlap", headerKey(header), sourceName, field);
                claimed.add(field);
                columnFields.put(index, field);
            }
        }

        return new HeaderMapping(sourceName, columnFields, issues);
    }

    /**
     * Renames a source table into raw records carrying canonical field names only.
     */
    public NormalizedTable normalize(SourceTable table) {
        HeaderMapping mapping = mapHeaders(table.sourceName(), table.headers());
        List<RawRecord> records = new ArrayList<>(table.rows().size());
        int rowNumber = 0;
        for (List<String> row : table.rows()) {
            rowNumber++;
            Map<String, String> values = new LinkedHashMap<>();
            for (Map.Entry<Integer, String> column : mapping.columnFields().entrySet()) {
                int index = column.getKey();
                if (index < row.size()) {
                    values.put(column.getValue(), row.get(index));
                }
            }
            records.add(new RawRecord(table.sourceName(), rowNumber, values));
        }
        return new NormalizedTable(records, mapping);
    }

    private String bestOverlapMatch(String sourceName, String header, Set<String> claimed) {
        Set<String> headerTokens = significantTokens(header);
        if (headerTokens.size() < TrackerConstants.MIN_SHARED_TOKENS) {
            return null;
        }

        String best = null;
        boolean ambiguous = false;
        int bestShared = 0;
        int bestUnion = 1;
        for (HeaderAlias alias : aliases) {
            if (claimed.contains(alias.field())) {
                continue;
            }
            Set<String> aliasTokens = significantTokens(alias.literal());
            Set<String> shared = new HashSet<>(headerTokens);
            shared.retainAll(aliasTokens);
            if (shared.size() < TrackerConstants.MIN_SHARED_TOKENS) {
                continue;
            }
            Set<String> union = new HashSet<>(headerTokens);
            union.addAll(aliasTokens);
            // Jaccard ratios compared by cross-multiplication
            long ratioOrder = (long) shared.size() * bestUnion - (long) bestShared * union.size();
            if (shared.size() > bestShared || (shared.size() == bestShared && ratioOrder > 0)) {
                best = alias.field();
                ambiguous = false;
                bestShared = shared.size();
                bestUnion = union.size();
            } else if (shared.size() == bestShared && ratioOrder == 0 && !alias.field().equals(best)) {
                ambiguous = true;
            }
        }
        if (ambiguous) {
            log.warn("Header '{}' in {} matches several fields equally well", headerKey(header), sourceName);
            return null;
        }
        return best;
    }

    static String headerKey(String header) {
        if (header == null) {
            return "";
        }
        return header.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }

    static Set<String> significantTokens(String header) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : headerKey(header).split("[^a-z0-9]+")) {
            if (token.length() >= TrackerConstants.SIGNIFICANT_TOKEN_MIN_LENGTH
                    && !TrackerConstants.HEADER_STOPWORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
