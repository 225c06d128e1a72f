package com.seedfund.tracker.pipeline;

import com.seedfund.tracker.config.TrackerConfiguration;
import com.seedfund.tracker.config.TrackerConstants;
import com.seedfund.tracker.ingest.CsvExtractReader;
import com.seedfund.tracker.ingest.ExtractSource;
import com.seedfund.tracker.ingest.SourceExtract;
import com.seedfund.tracker.metrics.EntityFilter;
import com.seedfund.tracker.metrics.PeriodWindow;
import com.seedfund.tracker.schema.SourceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Loads the current extracts and runs the tracking pipeline for the configured windows, an ad-hoc
 * window, or a single uploaded extract.
 */
@Service
public class TrackingService {

    private static final Logger log = LoggerFactory.getLogger(TrackingService.class);

    private static final Pattern UPLOAD_FILE_PATTERN = Pattern.compile("(?i)^.+\\.(csv|zip)$");

    private final ExtractSource extractSource;
    private final CsvExtractReader csvExtractReader;
    private final TrackingPipeline trackingPipeline;
    private final TrackerConfiguration configuration;

    public TrackingService(
            ExtractSource extractSource,
            CsvExtractReader csvExtractReader,
            TrackingPipeline trackingPipeline,
            TrackerConfiguration configuration) {
        this.extractSource = extractSource;
        this.csvExtractReader = csvExtractReader;
        this.trackingPipeline = trackingPipeline;
        this.configuration = configuration;
    }

    /**
     * Runs every configured window over the full extract set for one track.
     */
    public TrackingReport buildReport(String trackName) {
        EntityFilter track = configuration.track(trackName);
        return trackingPipeline.run(loadTables(), configuration.windows(), track);
    }

    public TrackingReport metricsFor(int startYear, int endYear, String trackName) {
        EntityFilter track = configuration.track(trackName);
        PeriodWindow window = PeriodWindow.of(startYear, endYear);
        return trackingPipeline.run(loadTables(), List.of(window), track);
    }

    /**
     * Runs the configured windows over one uploaded CSV or ZIP extract only.
     */
    public TrackingReport reportForUpload(String fileName, byte[] content, String trackName) {
        validateUploadFileName(fileName);
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException(TrackerConstants.MSG_EMPTY_UPLOAD);
        }
        EntityFilter track = configuration.track(trackName);
        SourceTable table = csvExtractReader.read(new SourceExtract(fileName, content));
        log.info("Processing uploaded extract {} with {} rows", fileName, table.rows().size());
        return trackingPipeline.run(List.of(table), configuration.windows(), track);
    }

    public List<EntityFilter> tracks() {
        return List.copyOf(configuration.tracks().values());
    }

    public List<PeriodWindow> windows() {
        return configuration.windows();
    }

    private List<SourceTable> loadTables() {
        List<SourceExtract> extracts = extractSource.loadAll();
        List<SourceTable> tables = new ArrayList<>(extracts.size());
        for (SourceExtract extract : extracts) {
            tables.add(csvExtractReader.read(extract));
        }
        log.debug("Loaded {} extracts", tables.size());
        return tables;
    }

    private void validateUploadFileName(String fileName) {
        if (fileName == null || !UPLOAD_FILE_PATTERN.matcher(fileName).matches()) {
            throw new IllegalArgumentException(TrackerConstants.MSG_INVALID_UPLOAD_FILE_NAME);
        }
    }
}
