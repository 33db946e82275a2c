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

import static com.github.tinemuz.suncalc.util.ExtendedMath.apparentRefraction;
import static com.github.tinemuz.suncalc.util.ExtendedMath.parallax;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.github.tinemuz.suncalc.util.JulianDate;
import com.github.tinemuz.suncalc.util.Moon;
import com.github.tinemuz.suncalc.util.Vector;
import java.time.Duration;
import java.time.ZonedDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moonrise and moonset within a time window. The upper edge of the moon
 * disc is used, corrected for refraction and parallax.
 */
public final class MoonTimes {
    private static final Logger log = LoggerFactory.getLogger(MoonTimes.class);
    private static final double REFRACTION = apparentRefraction(0.0);

    public final ZonedDateTime rise;
    public final ZonedDateTime set;
    public final boolean alwaysUp;
    public final boolean alwaysDown;

    private MoonTimes(ZonedDateTime rise, ZonedDateTime set, boolean alwaysUp, boolean alwaysDown) {
        this.rise = rise;
        this.set = set;
        this.alwaysUp = alwaysUp;
        this.alwaysDown = alwaysDown;
    }

    public static Builder request() {
        return new Builder();
    }

    /**
     * Searches moonrise and moonset, starting at the time of the observation.
     */
    public static MoonTimes compute(Request request) {
        checkNotNull(request, "request");
        JulianDate jd = request.observation().julianDate();
        GeoPosition pos = request.observation().position();
        double limitHours = RiseSetSearch.toHours(request.limit());

        if (limitHours == 0.0) {
            log.warn("Search window is empty, no moon events will be found");
        }

        RiseSetSearch search = RiseSetSearch.run(limitHours,
                hour -> correctedMoonHeight(jd.atHour(hour), pos), false);

        return new MoonTimes(
                RiseSetSearch.toDateTime(jd, search.rise),
                RiseSetSearch.toDateTime(jd, search.set),
                search.alwaysUp,
                search.alwaysDown);
    }

    private static double correctedMoonHeight(JulianDate jd, GeoPosition pos) {
        Vector horizontal = Moon.positionHorizontal(jd, pos.latitudeRad(), pos.longitudeRad());
        double hc = parallax(pos.height(), horizontal.getR())
                - REFRACTION
                - Moon.angularRadius(horizontal.getR());
        return horizontal.getTheta() - hc;
    }

    @Override
    public String toString() {
        return "MoonTimes[rise=" + rise + ", set=" + set
                + ", alwaysUp=" + alwaysUp + ", alwaysDown=" + alwaysDown + "]";
    }

    /**
     * Parameters of a moon times search.
     *
     * @param observation place and start of the window
     * @param limit       window length, not negative
     */
    public record Request(Observation observation, Duration limit) {
        public Request {
            checkNotNull(observation, "observation");
            checkArgument(limit != null && !limit.isNegative(), "Duration is null or negative");
        }
    }

    /**
     * Builds a {@link Request}.
     */
    public static final class Builder extends ObservationBuilder<Builder> {
        private Duration limit = SunCalcConfig.defaultLimit();

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        /**
         * Sets the length of the search window.
         *
         * @throws IllegalArgumentException if {@code duration} is null or negative
         */
        public Builder limit(Duration duration) {
            checkArgument(duration != null && !duration.isNegative(), "Duration is null or negative");
            this.limit = duration;
            return this;
        }

        public Builder oneDay() {
            return limit(Duration.ofDays(1));
        }

        /**
         * Searches a full year. This is always 365 days, also when the
         * default window is configured differently.
         */
        public Builder fullCycle() {
            return limit(RiseSetSearch.FULL_CYCLE);
        }

        public Request build() {
            return new Request(observation(), limit);
        }

        public MoonTimes execute() {
            return compute(build());
        }
    }
}
