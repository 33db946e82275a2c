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

import com.github.tinemuz.suncalc.util.ExtendedMath;
import com.github.tinemuz.suncalc.util.JulianDate;
import com.github.tinemuz.suncalc.util.Moon;
import com.github.tinemuz.suncalc.util.Pegasus;
import com.github.tinemuz.suncalc.util.Sun;
import com.github.tinemuz.suncalc.util.Vector;
import java.time.ZonedDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Next occurrence of a moon phase.
 */
public final class MoonPhase {
    private static final Logger log = LoggerFactory.getLogger(MoonPhase.class);

    // all in Julian centuries
    private static final double STEP = 7.0 / 36525.0;
    private static final double ACCURACY = (0.5 / 1440.0) / 36525.0;
    private static final double SUN_LIGHT_TIME_TAU = 8.32 / (1440.0 * 36525.0);

    /** Time of the phase, in the zone of the request. */
    public final ZonedDateTime time;
    /** Distance to the moon at that time, km. */
    public final double distance;

    private MoonPhase(ZonedDateTime time, double distance) {
        this.time = time;
        this.distance = distance;
    }

    public static Builder request() {
        return new Builder();
    }

    /**
     * Finds the first time at or after the request time when the moon
     * reaches the requested phase.
     *
     * @throws ArithmeticException if the phase angle could not be solved
     */
    public static MoonPhase compute(Request request) {
        checkNotNull(request, "request");
        JulianDate jd = new JulianDate(request.time());
        double phase = request.phase().getAngleRad();

        double t0 = jd.getJulianCentury();
        double t1 = t0 + STEP;
        double d0 = moonPhase(jd, t0, phase);
        double d1 = moonPhase(jd, t1, phase);

        // skip the wrap-around from +π to -π, only an ascending zero crossing counts
        while (d0 * d1 > 0.0 || d1 < d0) {
            t0 = t1;
            d0 = d1;
            t1 += STEP;
            d1 = moonPhase(jd, t1, phase);
        }
        log.debug("Phase {} bracketed between {} and {}", request.phase(), t0, t1);

        double tPhase = Pegasus.calculate(t0, t1, ACCURACY, t -> moonPhase(jd, t, phase));
        JulianDate tjd = jd.atJulianCentury(tPhase);
        return new MoonPhase(tjd.getDateTime(), Moon.positionEquatorial(tjd).getR());
    }

    /**
     * Difference between the moon's elongation and the phase angle at the
     * given Julian century, in (-π, π].
     */
    private static double moonPhase(JulianDate jd, double t, double phase) {
        Vector sun = Sun.positionEquatorial(jd.atJulianCentury(t - SUN_LIGHT_TIME_TAU));
        Vector moon = Moon.positionEquatorial(jd.atJulianCentury(t));
        double diff = moon.getPhi() - sun.getPhi() - phase;
        while (diff < 0.0) {
            diff += ExtendedMath.PI2;
        }
        return ((diff + Math.PI) % ExtendedMath.PI2) - Math.PI;
    }

    /**
     * Closer than the configured supermoon distance, 360,000 km by default.
     * Only meaningful for full and new moons.
     */
    public boolean isSuperMoon() {
        return distance < SunCalcConfig.superMoonDistance();
    }

    /**
     * Farther than the configured micromoon distance, 405,000 km by default.
     * Only meaningful for full and new moons.
     */
    public boolean isMicroMoon() {
        return distance > SunCalcConfig.microMoonDistance();
    }

    @Override
    public String toString() {
        return "MoonPhase[time=" + time + ", distance=" + distance + " km]";
    }

    /**
     * Parameters of a moon phase search.
     *
     * @param time  start of the search
     * @param phase phase to look for
     */
    public record Request(ZonedDateTime time, Phase phase) {
        public Request {
            checkNotNull(time, "time");
            checkNotNull(phase, "phase");
        }
    }

    /**
     * Builds a {@link Request}. The observer position does not affect the
     * result and is ignored.
     */
    public static final class Builder extends ObservationBuilder<Builder> {
        private Phase phase = Phase.NEW_MOON;

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        /**
         * Sets the phase. Defaults to {@link Phase#NEW_MOON}.
         */
        public Builder phase(Phase phase) {
            this.phase = checkNotNull(phase, "phase");
            return this;
        }

        /**
         * Sets a free phase angle in degrees.
         */
        public Builder phase(double angle) {
            return phase(Phase.of(angle));
        }

        public Request build() {
            return new Request(dateTime(), phase);
        }

        public MoonPhase execute() {
            return compute(build());
        }
    }
}
