package io.github.jakubt4.sightings.service.decode;

import io.github.jakubt4.sightings.model.Measurement;
import io.github.jakubt4.sightings.model.Observation;
import io.github.jakubt4.sightings.model.SatelliteObservation;
import io.github.jakubt4.sightings.model.SiteObservation;
import io.github.jakubt4.sightings.observatory.ParallaxLookup;
import lombok.experimental.UtilityClass;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.orekit.utils.Constants;

import java.util.OptionalDouble;

import static io.github.jakubt4.sightings.service.decode.ObservationFormatException.ErrorKind.ANGLE;
import static io.github.jakubt4.sightings.service.decode.ObservationFormatException.ErrorKind.DATE;
import static io.github.jakubt4.sightings.service.decode.ObservationFormatException.ErrorKind.LENGTH;
import static io.github.jakubt4.sightings.service.decode.ObservationFormatException.ErrorKind.MAGNITUDE;
import static io.github.jakubt4.sightings.service.decode.ObservationFormatException.ErrorKind.MISMATCH;
import static io.github.jakubt4.sightings.service.decode.ObservationFormatException.ErrorKind.OFFSET;
import static io.github.jakubt4.sightings.service.decode.ObservationFormatException.ErrorKind.UNKNOWN_SITE;

/**
 * Decoder for the MPC 80-column optical observation format.
 *
 * <p>Column layout (1-indexed):
 * <pre>
 *   1-12   designation
 *   15     'S' satellite line 1, 's' satellite continuation
 *   16-32  date, YYYY MM DD.dddddd
 *   33-44  RA  HH MM SS.ddd
 *   45-56  Dec sDD MM SS.dd
 *   66-70  magnitude, 71 band
 *   78-80  observatory code
 * </pre>
 * Stateless; safe to call from any thread as long as the lookup is not mutated.
 */
@UtilityClass
public class Obs80Decoder {

    public static final int RECORD_LENGTH = 80;

    private static final char SATELLITE_MARKER = 'S';
    private static final char CONTINUATION_MARKER = 's';
    private static final char KILOMETRE_UNITS = '1';

    // Day offsets of each month in a March-based year, indexed by month number.
    private static final int[] MONTH_OFFSET = {0, 306, 337, 0, 31, 61, 92, 122, 153, 184, 214, 245, 275};
    private static final int MJD_OFFSET = 678882;

    private static final double HOUR_SECONDS_TO_RADIANS = FastMath.PI / (12 * 3600);
    private static final double ARC_SECONDS_TO_RADIANS = FastMath.PI / (180 * 3600);
    private static final double KILOMETRES_TO_AU = 1000.0 / Constants.IAU_2012_ASTRONOMICAL_UNIT;

    private static final double B_BAND_CORRECTION = -0.8;
    private static final double DEFAULT_BAND_CORRECTION = 0.4;

    /**
     * Decodes one record into a site or satellite observation.
     *
     * <p>A satellite observation is returned when the site has no parallax constants or
     * column 15 carries the satellite marker; its offset stays unset until
     * {@link #mergeSatelliteContinuation} is applied.
     *
     * @param line   exactly 80 characters, newline already stripped
     * @param lookup observatory table the site code must exist in
     * @throws ObservationFormatException if any field is malformed or the site is unknown
     */
    public static Observation decode(final String line, final ParallaxLookup lookup)
            throws ObservationFormatException {
        requireRecordLength(line);

        final var designation = designation(line);
        final var mjd = parseDate(line.substring(15, 32));
        final var rightAscension = parseRightAscension(line);
        final var declination = parseDeclination(line);
        final var magnitude = parseMagnitude(line);

        final var siteCode = line.substring(77, 80);
        final var observatory = lookup.find(siteCode)
                .orElseThrow(() -> new ObservationFormatException(UNKNOWN_SITE,
                        "Unknown observatory code (" + siteCode + ")"));

        final var measurement = new Measurement(designation, mjd, rightAscension, declination, magnitude, siteCode);
        if (observatory.parallax() == null || line.charAt(14) == SATELLITE_MARKER) {
            return new SatelliteObservation(measurement, siteCode);
        }
        return new SiteObservation(measurement, siteCode, observatory.parallax());
    }

    public static boolean isSatelliteContinuation(final String line) {
        return line.length() == RECORD_LENGTH && line.charAt(14) == CONTINUATION_MARKER;
    }

    /**
     * Applies the second line of a space-based observation.
     *
     * <p>Designation, date and observatory code must match the first line. Offsets are in
     * kilometres when column 33 is {@code '1'} and are converted to AU, otherwise they are
     * taken as AU already.
     *
     * @param line        the continuation record
     * @param designation designation decoded from the first line
     * @param first       observation decoded from the first line
     * @return a copy of {@code first} carrying the geocentric offset
     * @throws ObservationFormatException {@code MISMATCH} when the identity fields differ
     *                                    from the first line or the date does not parse,
     *                                    {@code OFFSET} for malformed offsets
     */
    public static SatelliteObservation mergeSatelliteContinuation(final String line,
                                                                  final String designation,
                                                                  final SatelliteObservation first)
            throws ObservationFormatException {
        requireRecordLength(line);

        final var lineDesignation = designation(line);
        if (!lineDesignation.equals(designation)) {
            throw new ObservationFormatException(MISMATCH, "Satellite line 2 designation = "
                    + lineDesignation + ", line 1 was " + designation);
        }
        final var dateField = line.substring(15, 32);
        final double mjd;
        try {
            mjd = parseDate(dateField);
        } catch (final ObservationFormatException e) {
            throw new ObservationFormatException(MISMATCH,
                    "Satellite line 2 invalid date (" + dateField.trim() + ")", e);
        }
        if (mjd != first.mjd()) {
            throw new ObservationFormatException(MISMATCH,
                    "Satellite line 2 date " + dateField.trim() + " different from line 1");
        }
        final var siteCode = line.substring(77, 80);
        if (!siteCode.equals(first.siteCode())) {
            throw new ObservationFormatException(MISMATCH, "Satellite line 2 observatory code = "
                    + siteCode + ", line 1 was " + first.siteCode());
        }

        final var offset = new Vector3D(
                parseOffset(line.substring(34, 46)),
                parseOffset(line.substring(46, 58)),
                parseOffset(line.substring(58, 70)));
        return first.withOffset(line.charAt(32) == KILOMETRE_UNITS
                ? offset.scalarMultiply(KILOMETRES_TO_AU)
                : offset);
    }

    /**
     * Converts a {@code YYYY MM DD.ddd} date field to Modified Julian Date.
     *
     * <p>The field needs at least ten characters; longer fields carry a decimal day. A
     * blank-padded single digit month or day is accepted.
     *
     * @throws ObservationFormatException if a component does not parse, the month is out
     *                                    of range or the result precedes MJD 0
     */
    public static double parseDate(final String field) throws ObservationFormatException {
        if (field.length() < 10) {
            throw new ObservationFormatException(DATE, "Invalid date (" + field + ")");
        }
        final int year;
        final int month;
        final double day;
        try {
            year = Integer.parseInt(field.substring(0, 4));
            month = Integer.parseInt(field.substring(5, 7).trim());
            day = Double.parseDouble(field.substring(8).trim());
        } catch (final NumberFormatException e) {
            throw new ObservationFormatException(DATE, "Invalid date (" + field + ")", e);
        }
        if (month < 1 || month > 12 || !Double.isFinite(day)) {
            throw new ObservationFormatException(DATE, "Invalid date (" + field + ")");
        }

        // January and February count towards the previous year.
        final var z = year + (month - 14) / 12;
        final var mjd = MONTH_OFFSET[month] + 365 * z + z / 4 - z / 100 + z / 400 - MJD_OFFSET + day;
        if (mjd < 0) {
            throw new ObservationFormatException(DATE, "Date before MJD epoch (" + field + ")");
        }
        return mjd;
    }

    /** Lenient form of {@link #parseDate}, empty when the field is invalid. */
    public static OptionalDouble parseObs80Date(final String field) {
        try {
            return OptionalDouble.of(parseDate(field));
        } catch (final ObservationFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static void requireRecordLength(final String line) throws ObservationFormatException {
        if (line.length() != RECORD_LENGTH) {
            throw new ObservationFormatException(LENGTH,
                    "Observation line length = " + line.length() + ", want " + RECORD_LENGTH);
        }
    }

    private static String designation(final String line) {
        return line.substring(0, 12).trim();
    }

    private static double parseRightAscension(final String line) throws ObservationFormatException {
        try {
            final var hours = Integer.parseInt(line.substring(32, 34).trim());
            final var minutes = Integer.parseInt(line.substring(35, 37).trim());
            final var seconds = Double.parseDouble(line.substring(38, 44).trim());
            return ((hours * 60 + minutes) * 60 + seconds) * HOUR_SECONDS_TO_RADIANS;
        } catch (final NumberFormatException e) {
            throw new ObservationFormatException(ANGLE, "Invalid RA (" + line.substring(32, 44) + ")", e);
        }
    }

    private static double parseDeclination(final String line) throws ObservationFormatException {
        try {
            final var degrees = Integer.parseInt(line.substring(45, 47).trim());
            final var minutes = Integer.parseInt(line.substring(48, 50).trim());
            final var seconds = Double.parseDouble(line.substring(51, 56).trim());
            final var declination = ((degrees * 60 + minutes) * 60 + seconds) * ARC_SECONDS_TO_RADIANS;
            return line.charAt(44) == '-' ? -declination : declination;
        } catch (final NumberFormatException e) {
            throw new ObservationFormatException(ANGLE, "Invalid Dec (" + line.substring(44, 56) + ")", e);
        }
    }

    private static OptionalDouble parseMagnitude(final String line) throws ObservationFormatException {
        final var field = line.substring(65, 70).trim();
        if (field.isEmpty()) {
            return OptionalDouble.empty();
        }
        final double magnitude;
        try {
            magnitude = Double.parseDouble(field);
        } catch (final NumberFormatException e) {
            throw new ObservationFormatException(MAGNITUDE, "Invalid magnitude (" + field + ")", e);
        }
        return OptionalDouble.of(switch (line.charAt(70)) {
            case 'V' -> magnitude;
            case 'B' -> magnitude + B_BAND_CORRECTION;
            default -> magnitude + DEFAULT_BAND_CORRECTION;
        });
    }

    private static double parseOffset(final String field) throws ObservationFormatException {
        final double value;
        try {
            value = Double.parseDouble(field.substring(1).trim());
        } catch (final NumberFormatException e) {
            throw new ObservationFormatException(OFFSET, "Satellite line 2 invalid offset: " + field, e);
        }
        return switch (field.charAt(0)) {
            case '-' -> -value;
            case '+', ' ' -> value;
            default -> throw new ObservationFormatException(OFFSET, "Satellite line 2 invalid offset: " + field);
        };
    }
}
