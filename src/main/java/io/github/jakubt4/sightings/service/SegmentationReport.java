package io.github.jakubt4.sightings.service;

import io.github.jakubt4.sightings.model.ArcTracklets;
import io.github.jakubt4.sightings.service.arc.ArcResult;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Everything one segmentation run produced.
 *
 * @param arcs      arcs in stream order, each with its tracklets; arcs cut short by a
 *                  parse failure are included
 * @param failures  lines that could not be decoded, in stream order
 * @param readError failure of the underlying source, {@code null} if the stream ended normally
 */
public record SegmentationReport(List<ArcTracklets> arcs,
                                 List<ArcResult.ParseFailure> failures,
                                 IOException readError) {

    public SegmentationReport {
        arcs = List.copyOf(arcs);
        failures = List.copyOf(failures);
    }

    public Optional<IOException> readFailure() {
        return Optional.ofNullable(readError);
    }

    public int trackletCount() {
        return arcs.stream().mapToInt(a -> a.tracklets().size()).sum();
    }
}
