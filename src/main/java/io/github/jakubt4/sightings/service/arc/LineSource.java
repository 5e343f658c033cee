package io.github.jakubt4.sightings.service.arc;

import java.io.IOException;

/**
 * Supplies successive record lines with the line terminator stripped.
 * {@link java.io.BufferedReader#readLine()} fits as a method reference.
 */
@FunctionalInterface
public interface LineSource {

    /**
     * @return the next line, or {@code null} when the source is exhausted
     * @throws IOException if the underlying source fails
     */
    String readLine() throws IOException;
}
