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
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.tan;
import static java.lang.Math.toDegrees;

import com.github.tinemuz.suncalc.util.JulianDate;
import com.github.tinemuz.suncalc.util.Moon;
import com.github.tinemuz.suncalc.util.Vector;

/**
 * Position of the moon in the sky, as seen from an observer.
 */
public final class MoonPosition {
    /** Azimuth in degrees, north-based. */
    public final double azimuth;
    /** Altitude above the horizon in degrees, corrected by atmospheric refraction. */
    public final double altitude;
    /** Geometric altitude above the horizon in degrees. */
    public final double trueAltitude;
    /** Distance to the moon in km. */
    public final double distance;
    /** Parallactic angle in degrees. */
    public final double parallacticAngle;

    private MoonPosition(double azimuth, double altitude, double trueAltitude,
            double distance, double parallacticAngle) {
        this.azimuth = azimuth;
        this.altitude = altitude;
        this.trueAltitude = trueAltitude;
        this.distance = distance;
        this.parallacticAngle = parallacticAngle;
    }

    public static Builder request() {
        return new Builder();
    }

    /**
     * Computes the moon position for an observation.
     */
    public static MoonPosition compute(Observation observation) {
        checkNotNull(observation, "observation");
        JulianDate t = observation.julianDate();
        double phi = observation.position().latitudeRad();
        double lambda = observation.position().longitudeRad();

        Vector mc = Moon.position(t);
        double h = t.getGreenwichMeanSiderealTime() + lambda - mc.getPhi();
        Vector horizontal = equatorialToHorizontal(h, mc.getTheta(), mc.getR(), phi);

        double hRef = refraction(horizontal.getTheta());
        double pa = atan2(sin(h), tan(phi) * cos(mc.getTheta())) - sin(mc.getTheta()) * cos(h);

        return new MoonPosition(
                (toDegrees(horizontal.getPhi()) + 180.0) % 360.0,
                toDegrees(horizontal.getTheta() + hRef),
                toDegrees(horizontal.getTheta()),
                mc.getR(),
                toDegrees(pa));
    }

    @Override
    public String toString() {
        return "MoonPosition[azimuth=" + azimuth + "°, altitude=" + altitude
                + "°, trueAltitude=" + trueAltitude + "°, distance=" + distance
                + " km, parallacticAngle=" + parallacticAngle + "°]";
    }

    /**
     * Builds an {@link Observation} for a moon position.
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

        public MoonPosition execute() {
            return compute(build());
        }
    }
}
