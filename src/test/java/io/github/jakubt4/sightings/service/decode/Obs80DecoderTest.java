package io.github.jakubt4.sightings.service.decode;

import io.github.jakubt4.sightings.model.SatelliteObservation;
import io.github.jakubt4.sightings.model.SiteObservation;
import io.github.jakubt4.sightings.service.decode.ObservationFormatException.ErrorKind;
import org.junit.jupiter.api.Test;

import static io.github.jakubt4.sightings.ObservationFixtures.OBSERVATORIES;
import static io.github.jakubt4.sightings.ObservationFixtures.SAT_LINE_1;
import static io.github.jakubt4.sightings.ObservationFixtures.SAT_LINE_2;
import static io.github.jakubt4.sightings.ObservationFixtures.SITE_OBS;
import static io.github.jakubt4.sightings.ObservationFixtures.withColumns;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class Obs80DecoderTest {

    @Test
    void parseDateConvertsCivilDateToMjd() throws Exception {
        assertThat(Obs80Decoder.parseDate("2014 09 04.8")).isCloseTo(56904.8, within(1e-9));
        assertThat(Obs80Decoder.parseObs80Date("2014 09 04.8")).hasValueCloseTo(56904.8, within(1e-9));
    }

    @Test
    void parseDateCountsJanuaryAndFebruaryInPreviousYear() throws Exception {
        // 2000-01-01.0 is MJD 51544, 2000-03-01.0 is MJD 51604 (leap year)
        assertThat(Obs80Decoder.parseDate("2000 01 01.0")).isCloseTo(51544.0, within(1e-9));
        assertThat(Obs80Decoder.parseDate("2000 02 29.0")).isCloseTo(51603.0, within(1e-9));
        assertThat(Obs80Decoder.parseDate("2000 03 01.0")).isCloseTo(51604.0, within(1e-9));
    }

    @Test
    void parseDateAcceptsBlankPaddedFields() throws Exception {
        assertThat(Obs80Decoder.parseDate("2015  1  6.5")).isCloseTo(Obs80Decoder.parseDate("2015 01 06.5"), within(1e-9));
    }

    @Test
    void parseDateRejectsMalformedFields() {
        assertThat(Obs80Decoder.parseObs80Date("2014 09")).isEmpty();
        assertThat(Obs80Decoder.parseObs80Date("20x4 09 04.8")).isEmpty();
        assertThat(Obs80Decoder.parseObs80Date("2014 13 04.8")).isEmpty();
        assertThat(Obs80Decoder.parseObs80Date("2014 00 04.8")).isEmpty();
        assertThat(Obs80Decoder.parseObs80Date("2014 09 oops")).isEmpty();
        assertThat(Obs80Decoder.parseObs80Date("1800 01 01.0")).isEmpty();
    }

    @Test
    void decodesSiteObservation() throws Exception {
        final var observation = Obs80Decoder.decode(SITE_OBS, OBSERVATORIES);

        assertThat(observation).isInstanceOf(SiteObservation.class);
        final var site = (SiteObservation) observation;
        assertThat(site.designation()).isEqualTo("K11Q14F");
        assertThat(site.siteCode()).isEqualTo("703");
        assertThat(site.parallax()).isSameAs(OBSERVATORIES.find("703").orElseThrow().parallax());

        final var measurement = site.measurement();
        assertThat(measurement.mjd()).isCloseTo(56903.40285, within(1e-6));
        assertThat(measurement.rightAscension()).isCloseTo(0.7549058069240641, within(1e-8));
        assertThat(measurement.declination()).isCloseTo(0.1857335756741066, within(1e-8));
        assertThat(measurement.magnitude()).hasValueCloseTo(19.2, within(1e-9));
        assertThat(measurement.quality()).isEqualTo("703");
    }

    @Test
    void decodesSatelliteObservationAndMergesContinuation() throws Exception {
        final var observation = Obs80Decoder.decode(SAT_LINE_1, OBSERVATORIES);

        assertThat(observation).isInstanceOf(SatelliteObservation.class);
        final var first = (SatelliteObservation) observation;
        assertThat(first.designation()).isEqualTo("03620");
        assertThat(first.siteCode()).isEqualTo("250");
        assertThat(first.isComplete()).isFalse();

        final var merged = Obs80Decoder.mergeSatelliteContinuation(SAT_LINE_2, "03620", first);

        assertThat(merged.isComplete()).isTrue();
        assertThat(merged.mjd()).isCloseTo(50325.51477, within(1e-6));
        assertThat(merged.measurement().rightAscension()).isCloseTo(5.530651548153087, within(1e-8));
        assertThat(merged.measurement().declination()).isCloseTo(-0.09366997866254745, within(1e-8));
        assertThat(merged.measurement().magnitude()).isEmpty();
        assertThat(merged.measurement().quality()).isEqualTo("250");
        assertThat(merged.offset().getX()).isCloseTo(-2.301873014635837e-06, within(1e-8));
        assertThat(merged.offset().getY()).isCloseTo(-4.625148673574028e-05, within(1e-8));
        assertThat(merged.offset().getZ()).isCloseTo(5.830930614185884e-06, within(1e-8));
    }

    @Test
    void continuationWithoutKilometreFlagIsTakenAsAu() throws Exception {
        final var first = (SatelliteObservation) Obs80Decoder.decode(SAT_LINE_1, OBSERVATORIES);
        final var line2 = withColumns(withColumns(SAT_LINE_2, 33, "2"), 35, "+  0.0012345");

        final var merged = Obs80Decoder.mergeSatelliteContinuation(line2, "03620", first);

        assertThat(merged.offset().getX()).isCloseTo(0.0012345, within(1e-12));
        assertThat(merged.offset().getY()).isCloseTo(-6919.1239, within(1e-9));
    }

    @Test
    void satelliteMarkerForcesSatelliteObservationAtFixedSite() throws Exception {
        final var line = withColumns(SITE_OBS, 15, "S");

        assertThat(Obs80Decoder.decode(line, OBSERVATORIES)).isInstanceOf(SatelliteObservation.class);
    }

    @Test
    void appliesBandCorrections() throws Exception {
        final var bBand = Obs80Decoder.decode(withColumns(SITE_OBS, 71, "B"), OBSERVATORIES);
        final var rBand = Obs80Decoder.decode(withColumns(SITE_OBS, 71, "R"), OBSERVATORIES);
        final var noMag = Obs80Decoder.decode(withColumns(SITE_OBS, 66, "     "), OBSERVATORIES);

        assertThat(bBand.measurement().magnitude()).hasValueCloseTo(18.4, within(1e-9));
        assertThat(rBand.measurement().magnitude()).hasValueCloseTo(19.6, within(1e-9));
        assertThat(noMag.measurement().magnitude()).isEmpty();
    }

    @Test
    void negativeDeclinationSignFlipsAngle() throws Exception {
        final var south = Obs80Decoder.decode(withColumns(SITE_OBS, 45, "-"), OBSERVATORIES);

        assertThat(south.measurement().declination()).isCloseTo(-0.1857335756741066, within(1e-8));
    }

    @Test
    void rejectsWrongLength() {
        assertThatThrownBy(() -> Obs80Decoder.decode(SITE_OBS.substring(1), OBSERVATORIES))
                .isInstanceOf(ObservationFormatException.class)
                .extracting("kind").isEqualTo(ErrorKind.LENGTH);
    }

    @Test
    void rejectsMalformedFieldsWithTheirKind() {
        assertKind(withColumns(SITE_OBS, 21, "1x"), ErrorKind.DATE);
        assertKind(withColumns(SITE_OBS, 36, "ab"), ErrorKind.ANGLE);
        assertKind(withColumns(SITE_OBS, 52, "3x.3 "), ErrorKind.ANGLE);
        assertKind(withColumns(SITE_OBS, 66, "19.x "), ErrorKind.MAGNITUDE);
        assertKind(withColumns(SITE_OBS, 78, "XXX"), ErrorKind.UNKNOWN_SITE);
    }

    @Test
    void continuationMustMatchFirstLine() throws Exception {
        final var first = (SatelliteObservation) Obs80Decoder.decode(SAT_LINE_1, OBSERVATORIES);

        assertMergeKind(SAT_LINE_2, "03621", first, ErrorKind.MISMATCH);
        assertMergeKind(withColumns(SAT_LINE_2, 24, "31"), "03620", first, ErrorKind.MISMATCH);
        assertMergeKind(withColumns(SAT_LINE_2, 21, "1x"), "03620", first, ErrorKind.MISMATCH);
        assertMergeKind(withColumns(SAT_LINE_2, 24, "xx.x"), "03620", first, ErrorKind.MISMATCH);
        assertMergeKind(withColumns(SAT_LINE_2, 78, "248"), "03620", first, ErrorKind.MISMATCH);
        assertMergeKind(withColumns(SAT_LINE_2, 35, "*"), "03620", first, ErrorKind.OFFSET);
        assertMergeKind(withColumns(SAT_LINE_2, 47, "- 69x9.1239"), "03620", first, ErrorKind.OFFSET);
    }

    @Test
    void identifiesContinuationLines() {
        assertThat(Obs80Decoder.isSatelliteContinuation(SAT_LINE_2)).isTrue();
        assertThat(Obs80Decoder.isSatelliteContinuation(SAT_LINE_1)).isFalse();
        assertThat(Obs80Decoder.isSatelliteContinuation("short s")).isFalse();
    }

    private static void assertKind(final String line, final ErrorKind kind) {
        assertThatThrownBy(() -> Obs80Decoder.decode(line, OBSERVATORIES))
                .isInstanceOf(ObservationFormatException.class)
                .extracting("kind").isEqualTo(kind);
    }

    private static void assertMergeKind(final String line, final String designation,
                                        final SatelliteObservation first, final ErrorKind kind) {
        assertThatThrownBy(() -> Obs80Decoder.mergeSatelliteContinuation(line, designation, first))
                .isInstanceOf(ObservationFormatException.class)
                .extracting("kind").isEqualTo(kind);
    }
}
