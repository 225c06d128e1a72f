package com.seedfund.tracker.ingest;

import com.seedfund.tracker.config.TrackerConstants;
import com.seedfund.tracker.config.TrackerProperties;
import com.seedfund.tracker.schema.SourceTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Turns a CSV extract into a {@link SourceTable}. Older vintages stack several header rows; the
 * configured header row (per file, default {@code tracker.header-row-index}) is taken as the
 * effective header and everything above it is ignored.
 */
public class CsvExtractReader {

    private static final Logger log = LoggerFactory.getLogger(CsvExtractReader.class);

    private static final Set<String> HEADER_ECHO_VALUES = Set.of("project id", "project identifiers");

    private static final CSVFormat EXTRACT_FORMAT = CSVFormat.DEFAULT.builder()
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final TrackerProperties trackerProperties;

    public CsvExtractReader(TrackerProperties trackerProperties) {
        this.trackerProperties = trackerProperties;
    }

    public SourceTable read(SourceExtract extract) {
        ExtractContent content = extractContent(extract);
        int headerRow = trackerProperties.getHeaderRowOverrides()
                .getOrDefault(content.fileName(), trackerProperties.getHeaderRowIndex());

        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(content.content()), StandardCharsets.UTF_8);
             CSVParser parser = EXTRACT_FORMAT.parse(reader)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.size() <= headerRow) {
                throw new IllegalStateException(TrackerConstants.MSG_CSV_HEADER_NOT_FOUND.formatted(headerRow, content.fileName()));
            }

            List<String> headers = cells(records.get(headerRow));
            List<List<String>> rows = new ArrayList<>();
            int skipped = 0;
            for (int i = headerRow + 1; i < records.size(); i++) {
                List<String> row = cells(records.get(i));
                if (isBlank(row)) {
                    continue;
                }
                if (isHeaderEcho(row, headers)) {
                    skipped++;
                    continue;
                }
                rows.add(row);
            }
            if (skipped > 0) {
                log.warn("Skipped {} repeated header rows in {}", skipped, content.fileName());
            }
            return new SourceTable(content.fileName(), headers, rows);
        } catch (IOException | UncheckedIOException ex) {
            throw new IllegalStateException(TrackerConstants.MSG_CSV_PARSE_FAILED.formatted(content.fileName()), ex);
        }
    }

    /**
     * Returns CSV bytes either directly or from the first text entry of a ZIP payload.
     */
    private ExtractContent extractContent(SourceExtract extract) {
        if (extract.fileName() != null
                && extract.fileName().toLowerCase(Locale.ROOT).endsWith(TrackerConstants.FILE_EXT_ZIP)) {
            return extractFromZip(extract);
        }
        return new ExtractContent(extract.fileName(), extract.content());
    }

    private ExtractContent extractFromZip(SourceExtract extract) {
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(extract.content()))) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (!entry.isDirectory() && isTextFile(entry.getName())) {
                    return new ExtractContent(entry.getName(), zis.readAllBytes());
                }
            }
        } catch (IOException ex) {
            throw new IllegalStateException(TrackerConstants.MSG_ZIP_READ_FAILED.formatted(extract.fileName()), ex);
        }
        throw new IllegalStateException(TrackerConstants.MSG_ZIP_NO_TEXT_FILE.formatted(extract.fileName()));
    }

    private boolean isTextFile(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(TrackerConstants.FILE_EXT_CSV) || lower.endsWith(TrackerConstants.FILE_EXT_TXT);
    }

    private List<String> cells(CSVRecord record) {
        List<String> cells = new ArrayList<>(record.size());
        for (String value : record) {
            cells.add(value == null ? "" : value.trim());
        }
        return cells;
    }

    private boolean isBlank(List<String> row) {
        for (String cell : row) {
            if (!cell.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private boolean isHeaderEcho(List<String> row, List<String> headers) {
        String first = row.isEmpty() ? "" : normalize(row.get(0));
        if (HEADER_ECHO_VALUES.contains(first)) {
            return true;
        }
        if (row.size() != headers.size()) {
            return false;
        }
        for (int i = 0; i < row.size(); i++) {
            if (!normalize(row.get(i)).equals(normalize(headers.get(i)))) {
                return false;
            }
        }
        return true;
    }

    private String normalize(String value) {
        return value.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }

    private record ExtractContent(String fileName, byte[] content) {
    }
}
