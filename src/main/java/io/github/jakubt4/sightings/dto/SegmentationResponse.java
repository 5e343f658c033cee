package io.github.jakubt4.sightings.dto;

import java.util.List;

/**
 * Response returned after segmenting a block of observation records.
 *
 * @param status   {@code "SEGMENTED"}, {@code "REJECTED"} or {@code "FAILED"}
 * @param message  human-readable detail about the result
 * @param arcs     arcs in input order with their tracklets
 * @param failures records that could not be decoded
 */
public record SegmentationResponse(String status,
                                   String message,
                                   List<ArcReport> arcs,
                                   List<ParseFailureReport> failures) {

    public static SegmentationResponse rejected(final String message) {
        return new SegmentationResponse("REJECTED", message, List.of(), List.of());
    }
}
