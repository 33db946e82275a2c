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

import com.github.tinemuz.suncalc.util.JulianDate;
import com.github.tinemuz.suncalc.util.QuadraticInterpolation;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.function.DoubleUnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hour-by-hour scan for the horizon crossings of a body.
 *
 * <p>The height function takes an hour offset from the start of the window
 * and returns the body's altitude minus the altitude that counts as the
 * horizon, in radians. Three consecutive samples are fitted by a parabola,
 * whose roots are the crossings and whose extremum is the culmination.</p>
 */
final class RiseSetSearch {
    private static final Logger log = LoggerFactory.getLogger(RiseSetSearch.class);

    /** Window of {@code fullCycle()}, one year regardless of the configured default. */
    static final Duration FULL_CYCLE = Duration.ofDays(365);

    // hour offsets from the start of the window, null if not found
    Double rise;
    Double set;
    Double noon;
    Double nadir;
    boolean alwaysUp;
    boolean alwaysDown;

    private RiseSetSearch() {
    }

    /**
     * Runs the scan.
     *
     * @param limitHours    window length in hours; events at or beyond it are ignored
     * @param height        corrected height function
     * @param trackExtrema  also look for the upper and lower culmination
     */
    static RiseSetSearch run(double limitHours, DoubleUnaryOperator height, boolean trackExtrema) {
        RiseSetSearch result = new RiseSetSearch();
        double maxHours = Math.ceil(limitHours);
        double hour = 0;

        double yMinus = height.applyAsDouble(hour - 1.0);
        double y0 = height.applyAsDouble(hour);
        double yPlus = height.applyAsDouble(hour + 1.0);

        if (y0 > 0.0) {
            result.alwaysUp = true;
        } else {
            result.alwaysDown = true;
        }

        while (hour <= maxHours) {
            QuadraticInterpolation qi = new QuadraticInterpolation(yMinus, y0, yPlus);
            double ye = qi.getYe();

            if (qi.getNumberOfRoots() == 1) {
                double rt = qi.getRoot1() + hour;
                if (yMinus < 0.0) {
                    if (result.rise == null && isInWindow(rt, limitHours)) {
                        result.rise = rt;
                        result.alwaysDown = false;
                    }
                } else {
                    if (result.set == null && isInWindow(rt, limitHours)) {
                        result.set = rt;
                        result.alwaysUp = false;
                    }
                }
            } else if (qi.getNumberOfRoots() == 2) {
                if (result.rise == null) {
                    double rt = hour + (ye < 0.0 ? qi.getRoot2() : qi.getRoot1());
                    if (isInWindow(rt, limitHours)) {
                        result.rise = rt;
                        result.alwaysDown = false;
                    }
                }
                if (result.set == null) {
                    double rt = hour + (ye < 0.0 ? qi.getRoot1() : qi.getRoot2());
                    if (isInWindow(rt, limitHours)) {
                        result.set = rt;
                        result.alwaysUp = false;
                    }
                }
            }

            if (trackExtrema && Math.abs(qi.getXe()) <= 1.0) {
                double xeHour = qi.getXe() + hour;
                if (xeHour >= 0.0) {
                    if (qi.isMaximum()) {
                        if (result.noon == null) {
                            result.noon = xeHour;
                        }
                    } else {
                        if (result.nadir == null) {
                            result.nadir = xeHour;
                        }
                    }
                }
            }

            if (result.isComplete(trackExtrema)) {
                break;
            }

            hour += 1.0;
            yMinus = y0;
            y0 = yPlus;
            yPlus = height.applyAsDouble(hour + 1.0);
        }

        if (log.isDebugEnabled()) {
            log.debug("Scanned {} of {} hours: rise={}, set={}, noon={}, nadir={}",
                    hour, maxHours, result.rise, result.set, result.noon, result.nadir);
        }
        return result;
    }

    static boolean isInWindow(double hour, double limitHours) {
        return hour >= 0.0 && hour < limitHours;
    }

    /**
     * Window length in hours. Works for any duration, including those too
     * long to be expressed in milliseconds.
     */
    static double toHours(Duration limit) {
        return limit.getSeconds() / 3600.0 + limit.getNano() / 3.6e12;
    }

    /**
     * Converts an hour offset from the start of the window to a date-time,
     * or returns {@code null} if the event was not found.
     */
    static ZonedDateTime toDateTime(JulianDate jd, Double hour) {
        return hour != null ? jd.atHour(hour).getDateTime() : null;
    }

    private boolean isComplete(boolean trackExtrema) {
        if (rise == null || set == null) {
            return false;
        }
        return !trackExtrema || (noon != null && nadir != null);
    }
}
