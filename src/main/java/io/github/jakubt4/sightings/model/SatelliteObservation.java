package io.github.jakubt4.sightings.model;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Observation made from a spacecraft.
 *
 * <p>The first record line carries the measurement; the continuation line supplies the
 * observer's geocentric offset in AU. Until that line is merged {@code offset} is
 * {@code null}.
 */
public record SatelliteObservation(Measurement measurement, String siteCode, Vector3D offset)
        implements Observation {

    public SatelliteObservation(final Measurement measurement, final String siteCode) {
        this(measurement, siteCode, null);
    }

    public boolean isComplete() {
        return offset != null;
    }

    public SatelliteObservation withOffset(final Vector3D geocentricOffset) {
        return new SatelliteObservation(measurement, siteCode, geocentricOffset);
    }
}
