package io.github.jakubt4.sightings.service.arc;

import io.github.jakubt4.sightings.model.Arc;
import io.github.jakubt4.sightings.service.decode.ObservationFormatException;

import java.io.IOException;
import java.util.Optional;

/**
 * Outcome of one {@link ArcSplitter#next()} step. Callers branch on {@link #tag()}:
 * {@code ARC} and {@code PARSE_FAILURE} mean keep reading, {@code END_OF_STREAM} and
 * {@code FATAL_READ_ERROR} mean stop.
 */
public sealed interface ArcResult
        permits ArcResult.Complete, ArcResult.ParseFailure, ArcResult.EndOfStream, ArcResult.FatalReadError {

    enum Tag {
        ARC,
        PARSE_FAILURE,
        END_OF_STREAM,
        FATAL_READ_ERROR
    }

    Tag tag();

    default boolean isTerminal() {
        return tag() == Tag.END_OF_STREAM || tag() == Tag.FATAL_READ_ERROR;
    }

    /** A finished arc holding at least one observation. */
    record Complete(Arc arc) implements ArcResult {

        @Override
        public Tag tag() {
            return Tag.ARC;
        }
    }

    /**
     * A line failed to decode. The arc in progress at that point, if any, is handed
     * over as {@code partial} and the splitter starts afresh on the next line.
     */
    record ParseFailure(ObservationFormatException error, Arc partial) implements ArcResult {

        @Override
        public Tag tag() {
            return Tag.PARSE_FAILURE;
        }

        public Optional<Arc> partialArc() {
            return Optional.ofNullable(partial);
        }
    }

    record EndOfStream() implements ArcResult {

        static final EndOfStream INSTANCE = new EndOfStream();

        @Override
        public Tag tag() {
            return Tag.END_OF_STREAM;
        }
    }

    /** The line source failed. The splitter must not be stepped again. */
    record FatalReadError(IOException cause, Arc partial) implements ArcResult {

        @Override
        public Tag tag() {
            return Tag.FATAL_READ_ERROR;
        }

        public Optional<Arc> partialArc() {
            return Optional.ofNullable(partial);
        }
    }
}
