package io.github.jakubt4.sightings.dto;

/**
 * @param kind              error category, e.g. {@code LENGTH} or {@code UNKNOWN_SITE}
 * @param message           human-readable detail
 * @param truncatedArc      designation of the arc the failure cut short, {@code null} if none
 */
public record ParseFailureReport(String kind, String message, String truncatedArc) {
}
