package com.seedfund.tracker.pipeline;

import com.seedfund.tracker.metrics.EntityFilter;
import com.seedfund.tracker.metrics.PeriodWindow;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

/**
 * Exposes deduplicated funding metrics and their data-quality report.
 */
@RestController
@RequestMapping("/api/tracker")
public class TrackingController {

    private final TrackingService trackingService;

    public TrackingController(TrackingService trackingService) {
        this.trackingService = trackingService;
    }

    /**
     * Returns metrics for every configured window, optionally restricted to one award-type track.
     */
    @GetMapping("/report")
    public ResponseEntity<TrackingReport> getReport(@RequestParam(required = false) String track) {
        try {
            return ResponseEntity.ok(trackingService.buildReport(track));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @GetMapping("/metrics")
    public ResponseEntity<TrackingReport> getMetrics(
            @RequestParam int startYear,
            @RequestParam int endYear,
            @RequestParam(required = false) String track) {
        try {
            return ResponseEntity.ok(trackingService.metricsFor(startYear, endYear, track));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TrackingReport> uploadExtract(
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) String track) {
        try {
            return ResponseEntity.ok(trackingService.reportForUpload(file.getOriginalFilename(), file.getBytes(), track));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (IOException | IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to process uploaded extract", ex);
        }
    }

    @GetMapping("/tracks")
    public ResponseEntity<List<EntityFilter>> getTracks() {
        return ResponseEntity.ok(trackingService.tracks());
    }

    @GetMapping("/windows")
    public ResponseEntity<List<PeriodWindow>> getWindows() {
        return ResponseEntity.ok(trackingService.windows());
    }
}
