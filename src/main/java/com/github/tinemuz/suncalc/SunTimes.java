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

import com.github.tinemuz.suncalc.util.ExtendedMath;
import com.github.tinemuz.suncalc.util.JulianDate;
import com.github.tinemuz.suncalc.util.Sun;
import com.github.tinemuz.suncalc.util.Vector;
import java.time.Duration;
import java.time.ZonedDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sunrise, sunset, noon and nadir within a time window.
 *
 * <p>Events that do not occur within the window are {@code null}. If the
 * sun neither rises nor sets within the window, {@link #alwaysUp} or
 * {@link #alwaysDown} tells which side of the horizon it stayed on. A short
 * window like {@link Builder#oneDay()} only reports what happens inside it.</p>
 */
public final class SunTimes {
    private static final Logger log = LoggerFactory.getLogger(SunTimes.class);
    private static final double READJUST_FRAME_HOURS = 2.0;
    private static final int READJUST_DEPTH = 14;

    public final ZonedDateTime rise;
    public final ZonedDateTime set;
    /** Highest sun position, or {@code null}. */
    public final ZonedDateTime noon;
    /** Lowest sun position, or {@code null}. */
    public final ZonedDateTime nadir;
    /** The sun stays above the twilight angle during the whole window. */
    public final boolean alwaysUp;
    /** The sun stays below the twilight angle during the whole window. */
    public final boolean alwaysDown;

    private SunTimes(ZonedDateTime rise, ZonedDateTime set, ZonedDateTime noon, ZonedDateTime nadir,
            boolean alwaysUp, boolean alwaysDown) {
        this.rise = rise;
        this.set = set;
        this.noon = noon;
        this.nadir = nadir;
        this.alwaysUp = alwaysUp;
        this.alwaysDown = alwaysDown;
    }

    /**
     * Starts a new request.
     */
    public static Builder request() {
        return new Builder();
    }

    /**
     * Searches the sun events, starting at the time of the observation.
     */
    public static SunTimes compute(Request request) {
        checkNotNull(request, "request");
        JulianDate jd = request.observation().julianDate();
        GeoPosition pos = request.observation().position();
        Twilight twilight = request.twilight();
        double limitHours = RiseSetSearch.toHours(request.limit());

        if (limitHours == 0.0) {
            log.warn("Search window is empty, no sun events will be found");
        }

        RiseSetSearch search = RiseSetSearch.run(limitHours,
                hour -> correctedSunHeight(jd.atHour(hour), pos, twilight), true);

        Double noon = search.noon;
        if (noon != null) {
            noon = ExtendedMath.readjustMax(noon, READJUST_FRAME_HOURS, READJUST_DEPTH,
                    t -> correctedSunHeight(jd.atHour(t), pos, twilight));
            if (!RiseSetSearch.isInWindow(noon, limitHours)) {
                noon = null;
            }
        }

        Double nadir = search.nadir;
        if (nadir != null) {
            nadir = ExtendedMath.readjustMin(nadir, READJUST_FRAME_HOURS, READJUST_DEPTH,
                    t -> correctedSunHeight(jd.atHour(t), pos, twilight));
            if (!RiseSetSearch.isInWindow(nadir, limitHours)) {
                nadir = null;
            }
        }

        return new SunTimes(
                RiseSetSearch.toDateTime(jd, search.rise),
                RiseSetSearch.toDateTime(jd, search.set),
                RiseSetSearch.toDateTime(jd, noon),
                RiseSetSearch.toDateTime(jd, nadir),
                search.alwaysUp,
                search.alwaysDown);
    }

    /**
     * Sun altitude minus the twilight angle, in radians.
     */
    private static double correctedSunHeight(JulianDate jd, GeoPosition pos, Twilight twilight) {
        Vector horizontal = Sun.positionHorizontal(jd, pos.latitudeRad(), pos.longitudeRad());

        double hc = twilight.getAngleRad();
        if (twilight.isTopocentric()) {
            hc -= apparentRefraction(hc);
            hc += parallax(pos.height(), horizontal.getR());
            hc -= twilight.getPosition() * Sun.angularRadius(horizontal.getR());
        }

        return horizontal.getTheta() - hc;
    }

    @Override
    public String toString() {
        return "SunTimes[rise=" + rise + ", set=" + set + ", noon=" + noon + ", nadir=" + nadir
                + ", alwaysUp=" + alwaysUp + ", alwaysDown=" + alwaysDown + "]";
    }

    /**
     * Parameters of a sun times search.
     *
     * @param observation place and start of the window
     * @param twilight    sun altitude that counts as rise and set
     * @param limit       window length, not negative
     */
    public record Request(Observation observation, Twilight twilight, Duration limit) {
        public Request {
            checkNotNull(observation, "observation");
            checkNotNull(twilight, "twilight");
            checkArgument(limit != null && !limit.isNegative(), "Duration is null or negative");
        }
    }

    /**
     * Builds a {@link Request}.
     */
    public static final class Builder extends ObservationBuilder<Builder> {
        private Twilight twilight = Twilight.VISUAL;
        private Duration limit = SunCalcConfig.defaultLimit();

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        /**
         * Sets the twilight. Defaults to {@link Twilight#VISUAL}.
         */
        public Builder twilight(Twilight twilight) {
            this.twilight = checkNotNull(twilight, "twilight");
            return this;
        }

        /**
         * Uses a geocentric twilight at the given sun altitude in degrees.
         */
        public Builder twilight(double angle) {
            return twilight(Twilight.of(angle));
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

        /**
         * Limits the window to 24 hours.
         */
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
            return new Request(observation(), twilight, limit);
        }

        public SunTimes execute() {
            return compute(build());
        }
    }
}
