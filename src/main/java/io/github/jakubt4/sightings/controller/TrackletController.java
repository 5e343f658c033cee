package io.github.jakubt4.sightings.controller;

import io.github.jakubt4.sightings.dto.ArcReport;
import io.github.jakubt4.sightings.dto.ParseFailureReport;
import io.github.jakubt4.sightings.dto.SegmentationResponse;
import io.github.jakubt4.sightings.dto.TrackletReport;
import io.github.jakubt4.sightings.model.Arc;
import io.github.jakubt4.sightings.model.ArcTracklets;
import io.github.jakubt4.sightings.model.Tracklet;
import io.github.jakubt4.sightings.service.SegmentationReport;
import io.github.jakubt4.sightings.service.TrackletPipeline;
import io.github.jakubt4.sightings.service.arc.ArcResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.StringReader;

/**
 * REST endpoint for segmenting MPC 80-column observation records.
 *
 * <p>Accepts records via {@code POST /api/observations/tracklets}, one per line and
 * grouped by designation, and answers with the arcs found and their tracklets.
 */
@Slf4j
@RestController
@RequestMapping("/api/observations")
@RequiredArgsConstructor
public class TrackletController {

    private final TrackletPipeline trackletPipeline;

    /**
     * @param records plain-text block of 80-column records
     * @return {@code 200 OK} with SEGMENTED status, undecodable lines listed as failures;
     *         {@code 400 Bad Request} for an empty body; {@code 500 Internal Server Error}
     *         with FAILED status if segmentation stopped early. The body is already in
     *         memory, so that only happens when the arc producer itself fails.
     */
    @PostMapping(value = "/tracklets", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<SegmentationResponse> segment(@RequestBody(required = false) final String records) {
        if (records == null || records.isBlank()) {
            return ResponseEntity.badRequest()
                    .body(SegmentationResponse.rejected("Observation records are required"));
        }

        final var report = trackletPipeline.segment(new StringReader(records));
        final var arcs = report.arcs().stream().map(TrackletController::toArcReport).toList();
        final var failures = report.failures().stream().map(TrackletController::toFailureReport).toList();

        if (report.readError() != null) {
            log.error("Segmentation stopped early: {}", report.readError().getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new SegmentationResponse("FAILED",
                            "Segmentation failed: " + report.readError().getMessage(), arcs, failures));
        }
        log.info("Segmented {} arcs into {} tracklets, {} records rejected",
                arcs.size(), report.trackletCount(), failures.size());
        return ResponseEntity.ok(new SegmentationResponse("SEGMENTED", message(report), arcs, failures));
    }

    private static String message(final SegmentationReport report) {
        return report.arcs().size() + " arcs, " + report.trackletCount() + " tracklets";
    }

    private static ArcReport toArcReport(final ArcTracklets arcTracklets) {
        final var arc = arcTracklets.arc();
        return new ArcReport(arc.designation(), arc.size(),
                arcTracklets.tracklets().stream().map(t -> toTrackletReport(arc, t)).toList());
    }

    private static TrackletReport toTrackletReport(final Arc arc, final Tracklet tracklet) {
        final var observer = arc.observations().get(tracklet.indices().get(0)).observer();
        return new TrackletReport(observer, tracklet.meanTime(), tracklet.indices());
    }

    private static ParseFailureReport toFailureReport(final ArcResult.ParseFailure failure) {
        return new ParseFailureReport(failure.error().getKind().name(), failure.error().getMessage(),
                failure.partialArc().map(Arc::designation).orElse(null));
    }
}
