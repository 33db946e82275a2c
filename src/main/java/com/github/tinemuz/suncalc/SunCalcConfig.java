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

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Library defaults, read from the classpath resource
 * <code>suncalc.properties</code> on first use. Call {@link #preload()} at
 * startup to surface a broken resource early.
 */
public final class SunCalcConfig {
    private static final Logger log = LoggerFactory.getLogger(SunCalcConfig.class);
    private static final String RESOURCE = "suncalc.properties";

    static final String KEY_LIMIT_DAYS = "times.limit.days";
    static final String KEY_SUPERMOON = "moon.supermoon.distance";
    static final String KEY_MICROMOON = "moon.micromoon.distance";

    // largest day count a Duration can hold
    static final long MAX_LIMIT_DAYS = Long.MAX_VALUE / 86_400L;

    private static volatile boolean loaded = false;
    private static Duration defaultLimit;
    private static double superMoonDistance;
    private static double microMoonDistance;

    private SunCalcConfig() {
        // static access only
    }

    /**
     * Loads the configuration, if not done already.
     *
     * @throws IllegalStateException if the resource is missing or invalid
     */
    public static void preload() {
        ensureLoaded();
    }

    /**
     * Search window used by rise/set calculations when none is given.
     */
    public static Duration defaultLimit() {
        ensureLoaded();
        return defaultLimit;
    }

    /**
     * Moon distance in km below which a full or new moon is a supermoon.
     */
    public static double superMoonDistance() {
        ensureLoaded();
        return superMoonDistance;
    }

    /**
     * Moon distance in km above which a full or new moon is a micromoon.
     */
    public static double microMoonDistance() {
        ensureLoaded();
        return microMoonDistance;
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        apply(loadFromResource());
        loaded = true;
    }

    private static Properties loadFromResource() {
        InputStream in = SunCalcConfig.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Configuration file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Configuration file '" + RESOURCE + "' not found on classpath");
        }
        try (InputStream stream = in) {
            Properties props = new Properties();
            props.load(stream);
            return props;
        } catch (IOException e) {
            log.error("Failed to read configuration file '{}'", RESOURCE, e);
            throw new IllegalStateException("Failed to read configuration file '" + RESOURCE + "'", e);
        }
    }

    /**
     * Validates and publishes a set of configuration values.
     */
    static synchronized void apply(Properties props) {
        long limitDays = parseLong(props, KEY_LIMIT_DAYS);
        double superMoon = parseDouble(props, KEY_SUPERMOON);
        double microMoon = parseDouble(props, KEY_MICROMOON);

        if (limitDays < 0 || limitDays > MAX_LIMIT_DAYS
                || !isPositiveDistance(superMoon) || !isPositiveDistance(microMoon)) {
            log.error("Invalid configuration: {}={}, {}={}, {}={}",
                    KEY_LIMIT_DAYS, limitDays, KEY_SUPERMOON, superMoon, KEY_MICROMOON, microMoon);
            throw new IllegalStateException("Invalid values in configuration file '" + RESOURCE + "'");
        }

        defaultLimit = Duration.ofDays(limitDays);
        superMoonDistance = superMoon;
        microMoonDistance = microMoon;
        log.debug("Configuration loaded: limit={}, supermoon<{}km, micromoon>{}km",
                defaultLimit, superMoonDistance, microMoonDistance);
    }

    // NaN and infinity parse fine but are no distance
    private static boolean isPositiveDistance(double km) {
        return Double.isFinite(km) && km > 0.0;
    }

    private static long parseLong(Properties props, String key) {
        String value = require(props, key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.error("Failed to parse configuration key '{}' value '{}' as whole number", key, value, e);
            throw new IllegalStateException("Failed to parse configuration key '" + key + "'", e);
        }
    }

    private static double parseDouble(Properties props, String key) {
        String value = require(props, key);
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.error("Failed to parse configuration key '{}' value '{}'", key, value, e);
            throw new IllegalStateException("Failed to parse configuration key '" + key + "'", e);
        }
    }

    private static String require(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null) {
            log.error("Missing configuration key '{}' in '{}'", key, RESOURCE);
            throw new IllegalStateException("Missing configuration key '" + key + "'");
        }
        return value;
    }
}
