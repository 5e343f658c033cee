package io.github.jakubt4.sightings.observatory;

import io.github.jakubt4.sightings.model.Observatory;
import io.github.jakubt4.sightings.model.ParallaxConstant;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.orekit.utils.Constants;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Reads the MPC observatory code list ({@code obscode.dat}, or the ObsCodes.html page).
 *
 * <p>Data lines look like
 * <pre>
 *   644 243.140220.836325+0.546877Palomar Mountain/NEAT
 *   [0-3) code  [4-13) longitude  [13-21) ρcosφ  [21-30) ρsinφ  [30-) name
 * </pre>
 * Headings, HTML markup and other lines that do not parse as data are skipped.
 */
@Slf4j
@UtilityClass
public class ObscodeParser {

    private static final int MIN_DATA_LINE = 30;

    // Earth radii to AU
    private static final double RHO_SCALE =
            Constants.WGS84_EARTH_EQUATORIAL_RADIUS / Constants.IAU_2012_ASTRONOMICAL_UNIT;

    public static ObservatoryCodes parse(final String text) {
        try {
            return parse(new StringReader(text));
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses a whole table. Sites whose ρcosφ and ρsinφ are both zero, or blank, are
     * stored without parallax constants.
     *
     * @throws IOException               if the reader fails
     * @throws ObservatoryCodesException if no data line was recognised
     */
    public static ObservatoryCodes parse(final Reader reader) throws IOException {
        final var observatories = new ArrayList<Observatory>();
        final var lines = new BufferedReader(reader);
        String line;
        while ((line = lines.readLine()) != null) {
            parseLine(line).ifPresent(observatories::add);
        }
        if (observatories.isEmpty()) {
            throw new ObservatoryCodesException("Obscode data unreadable");
        }
        log.debug("Parsed {} observatory codes", observatories.size());
        return new ObservatoryCodes(observatories);
    }

    static Optional<Observatory> parseLine(final String line) {
        if (line.length() < MIN_DATA_LINE) {
            return Optional.empty();
        }
        try {
            final var longitude = field(line, 4, 13);
            final var rhoCosPhi = field(line, 13, 21);
            final var rhoSinPhi = field(line, 21, 30);
            if (!(longitude >= 0 && longitude < 360)
                    || !(rhoCosPhi >= 0 && rhoCosPhi <= 1)
                    || !(rhoSinPhi >= -1 && rhoSinPhi <= 1)) {
                return Optional.empty();
            }

            final var code = line.substring(0, 3);
            final var name = line.substring(MIN_DATA_LINE).trim();
            if (rhoCosPhi == 0 && rhoSinPhi == 0) {
                return Optional.of(new Observatory(code, name, null));
            }
            return Optional.of(new Observatory(code, name, new ParallaxConstant(
                    FastMath.toRadians(longitude),
                    rhoCosPhi * RHO_SCALE,
                    rhoSinPhi * RHO_SCALE)));
        } catch (final NumberFormatException e) {
            // column headings and markup
            return Optional.empty();
        }
    }

    private static double field(final String line, final int start, final int end) {
        final var text = line.substring(start, end).trim();
        return text.isEmpty() ? 0 : Double.parseDouble(text);
    }
}
