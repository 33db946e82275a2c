/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.tinemuz.suncalc;

import static com.github.tinemuz.suncalc.util.ExtendedMath.equatorialToHorizontal;
import static com.github.tinemuz.suncalc.util.ExtendedMath.refraction;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.Math.toDegrees;

import com.github.tinemuz.suncalc.util.JulianDate;
import com.github.tinemuz.suncalc.util.Sun;
import com.github.tinemuz.suncalc.util.Vector;

/**
 * Position of the sun in the sky, as seen from an observer.
 *
 * <pre>{@code
 * SunPosition pos = SunPosition.request()
 *         .at(50.938056, 6.956944)
 *         .on(2017, 7, 12, 13, 37, 0)
 *         .timezone("Europe/Berlin")
 *         .execute();
 * }</pre>
 */
public final class SunPosition {
    /** Azimuth in degrees, north-based: north 0°, east 90°, south 180°, west 270°. */
    public final double azimuth;
    /** Altitude above the horizon in degrees, corrected by atmospheric refraction. */
    public final double altitude;
    /** Geometric altitude above the horizon in degrees, no refraction. */
    public final double trueAltitude;
    /** Distance to the sun in km. */
    public final double distance;

    private SunPosition(double azimuth, double altitude, double trueAltitude, double distance) {
        this.azimuth = azimuth;
        this.altitude = altitude;
        this.trueAltitude = trueAltitude;
        this.distance = distance;
    }

    /**
     * Starts a new request.
     */
    public static Builder request() {
        return new Builder();
    }

    /**
     * Computes the sun position for an observation.
     */
    public static SunPosition compute(Observation observation) {
        checkNotNull(observation, "observation");
        JulianDate t = observation.julianDate();
        double lat = observation.position().latitudeRad();
        double lng = observation.position().longitudeRad();

        Vector c = Sun.position(t);
        double h = t.getGreenwichMeanSiderealTime() + lng - c.getPhi();
        Vector horizontal = equatorialToHorizontal(h, c.getTheta(), c.getR(), lat);

        double hRef = refraction(horizontal.getTheta());

        return new SunPosition(
                (toDegrees(horizontal.getPhi()) + 180.0) % 360.0,
                toDegrees(horizontal.getTheta() + hRef),
                toDegrees(horizontal.getTheta()),
                horizontal.getR());
    }

    @Override
    public String toString() {
        return "SunPosition[azimuth=" + azimuth + "°, altitude=" + altitude
                + "°, trueAltitude=" + trueAltitude + "°, distance=" + distance + " km]";
    }

    /**
     * Builds an {@link Observation} for a sun position.
     */
    public static final class Builder extends ObservationBuilder<Builder> {

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Observation build() {
            return observation();
        }

        public SunPosition execute() {
            return compute(build());
        }
    }
}
