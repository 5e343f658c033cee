package io.github.jakubt4.sightings.service.arc;

import io.github.jakubt4.sightings.model.Arc;
import io.github.jakubt4.sightings.model.Observation;
import io.github.jakubt4.sightings.model.SatelliteObservation;
import io.github.jakubt4.sightings.observatory.ParallaxLookup;
import io.github.jakubt4.sightings.service.decode.Obs80Decoder;
import io.github.jakubt4.sightings.service.decode.ObservationFormatException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static io.github.jakubt4.sightings.service.decode.ObservationFormatException.ErrorKind.LENGTH;
import static io.github.jakubt4.sightings.service.decode.ObservationFormatException.ErrorKind.MISMATCH;

/**
 * Splits a stream of 80-column records into arcs by designation.
 *
 * <p>The stream must already be grouped by designation; records are never sorted or
 * accumulated across groups, the stream is simply cut where the designation changes.
 * A change is only visible once the first record of the next arc has been decoded, so
 * that observation is held over and opens the arc returned by the following call.
 *
 * <p>Each instance owns the state of one stream and must not be stepped concurrently.
 */
@Slf4j
public class ArcSplitter {

    private final LineSource source;
    private final ParallaxLookup lookup;

    // first observation of the next arc, read while closing the previous one
    private Observation pending;

    private String designation;
    private final List<Observation> observations = new ArrayList<>();

    private boolean endOfStream;
    private boolean failed;

    public ArcSplitter(final LineSource source, final ParallaxLookup lookup) {
        this.source = source;
        this.lookup = lookup;
    }

    /**
     * Reads until an arc is complete, a line fails to decode or the source ends.
     *
     * @throws IllegalStateException if called after a {@link ArcResult.FatalReadError}
     */
    public ArcResult next() {
        if (failed) {
            throw new IllegalStateException("Arc splitter stopped after a read error");
        }
        if (endOfStream) {
            return ArcResult.EndOfStream.INSTANCE;
        }

        startArc();
        while (true) {
            final String line;
            try {
                line = source.readLine();
            } catch (final IOException e) {
                failed = true;
                log.error("Observation stream read failed: {}", e.getMessage());
                return new ArcResult.FatalReadError(e, takeArc());
            }
            if (line == null) {
                endOfStream = true;
                final var last = takeArc();
                return last == null ? ArcResult.EndOfStream.INSTANCE : new ArcResult.Complete(last);
            }

            try {
                final var completed = accept(line);
                if (completed != null) {
                    return new ArcResult.Complete(completed);
                }
            } catch (final ObservationFormatException e) {
                log.debug("Skipping record [{}]: {}", line, e.getMessage());
                return new ArcResult.ParseFailure(e, takeArc());
            }
        }
    }

    /**
     * Adds one record to the arc in progress.
     *
     * @return the finished arc when {@code line} starts a new designation, else {@code null}
     */
    private Arc accept(final String line) throws ObservationFormatException {
        if (line.length() != Obs80Decoder.RECORD_LENGTH) {
            throw new ObservationFormatException(LENGTH,
                    "Observation line length = " + line.length() + ", want " + Obs80Decoder.RECORD_LENGTH);
        }
        if (Obs80Decoder.isSatelliteContinuation(line)) {
            mergeContinuation(line);
            return null;
        }

        final var observation = Obs80Decoder.decode(line, lookup);
        if (observations.isEmpty()) {
            designation = observation.designation();
        } else if (!observation.designation().equals(designation)) {
            pending = observation;
            return takeArc();
        }
        observations.add(observation);
        return null;
    }

    private void mergeContinuation(final String line) throws ObservationFormatException {
        final var last = observations.isEmpty() ? null : observations.get(observations.size() - 1);
        if (!(last instanceof SatelliteObservation first) || first.isComplete()) {
            throw new ObservationFormatException(MISMATCH, "Space-based observation line 2 without line 1");
        }
        observations.set(observations.size() - 1,
                Obs80Decoder.mergeSatelliteContinuation(line, designation, first));
    }

    private void startArc() {
        if (pending != null) {
            designation = pending.designation();
            observations.add(pending);
            pending = null;
        }
    }

    private Arc takeArc() {
        if (observations.isEmpty()) {
            return null;
        }
        final var arc = new Arc(designation, observations);
        observations.clear();
        designation = null;
        return arc;
    }
}
