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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.Math.PI;
import static java.lang.Math.acos;
import static java.lang.Math.cos;
import static java.lang.Math.signum;
import static java.lang.Math.toDegrees;

import com.github.tinemuz.suncalc.util.JulianDate;
import com.github.tinemuz.suncalc.util.Moon;
import com.github.tinemuz.suncalc.util.Sun;
import com.github.tinemuz.suncalc.util.Vector;

/**
 * Illuminated fraction and phase of the moon at a given time.
 */
public final class MoonIllumination {
    /** Illuminated fraction, 0.0 (new moon) to 1.0 (full moon). */
    public final double fraction;
    /**
     * Phase angle in degrees, -180 to 180. Negative while waxing, positive
     * while waning, 0 at full moon.
     */
    public final double phase;
    /** Angle of the bright limb in degrees. */
    public final double angle;

    private MoonIllumination(double fraction, double phase, double angle) {
        this.fraction = fraction;
        this.phase = phase;
        this.angle = angle;
    }

    public static Builder request() {
        return new Builder();
    }

    /**
     * Computes the illumination at the time of the observation. The observer
     * position does not affect the result.
     */
    public static MoonIllumination compute(Observation observation) {
        checkNotNull(observation, "observation");
        JulianDate t = observation.julianDate();
        Vector s = Sun.position(t);
        Vector m = Moon.position(t);

        double phi = PI - acos(m.dot(s) / (m.getR() * s.getR()));
        Vector sunMoon = m.cross(s);

        return new MoonIllumination(
                (1 + cos(phi)) / 2,
                toDegrees(phi * signum(sunMoon.getTheta())),
                toDegrees(sunMoon.getTheta()));
    }

    /**
     * The named phase closest to the current one.
     */
    public Phase getClosestPhase() {
        return Phase.toPhase(phase + 180.0);
    }

    @Override
    public String toString() {
        return "MoonIllumination[fraction=" + fraction + ", phase=" + phase
                + "°, angle=" + angle + "°]";
    }

    /**
     * Builds an {@link Observation} for a moon illumination.
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

        public MoonIllumination execute() {
            return compute(build());
        }
    }
}
