package io.github.jakubt4.sightings.model;

import java.util.OptionalDouble;

/**
 * Astrometric quantities shared by every observation kind.
 *
 * @param designation    trimmed object identifier, the arc grouping key
 * @param mjd            epoch as Modified Julian Date
 * @param rightAscension right ascension in radians
 * @param declination    declination in radians
 * @param magnitude      band-corrected magnitude, empty when not reported
 * @param quality        provenance tag, currently the observatory code
 */
public record Measurement(String designation,
                          double mjd,
                          double rightAscension,
                          double declination,
                          OptionalDouble magnitude,
                          String quality) {
}
