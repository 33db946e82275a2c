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

import static com.github.tinemuz.suncalc.Locations.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SunTimesTest {

    private static final long ERROR_SECONDS = 3;

    @Nested
    @DisplayName("Cologne on 2017-08-10")
    class CologneTests {

        private final Map<Twilight, Long> riseTimes = Map.of(
                Twilight.ASTRONOMICAL, 1502329458L,   // 01:44:18Z
                Twilight.NAUTICAL, 1502333097L,       // 02:44:57Z
                Twilight.NIGHT_HOUR, 1502335102L,     // 03:18:22Z
                Twilight.CIVIL, 1502336041L,          // 03:34:01Z
                Twilight.BLUE_HOUR, 1502336939L,      // 03:48:59Z
                Twilight.VISUAL, 1502338309L,         // 04:11:49Z
                Twilight.VISUAL_LOWER, 1502338533L,   // 04:15:33Z
                Twilight.HORIZON, 1502338664L,        // 04:17:44Z
                Twilight.GOLDEN_HOUR, 1502341113L);   // 04:58:33Z

        private final Map<Twilight, Long> setTimes = Map.of(
                Twilight.GOLDEN_HOUR, 1502388949L,    // 18:15:49Z
                Twilight.HORIZON, 1502391390L,        // 18:56:30Z
                Twilight.VISUAL_LOWER, 1502391519L,   // 18:58:39Z
                Twilight.VISUAL, 1502391740L,         // 19:02:20Z
                Twilight.BLUE_HOUR, 1502393116L,      // 19:25:16Z
                Twilight.CIVIL, 1502394013L,          // 19:40:13Z
                Twilight.NIGHT_HOUR, 1502394935L,     // 19:55:35Z
                Twilight.NAUTICAL, 1502396936L,       // 20:28:56Z
                Twilight.ASTRONOMICAL, 1502400523L);  // 21:28:43Z

        private static final long NOON = 1502365042L;  // 11:37:22Z
        private static final long NADIR = 1502408265L; // 23:37:45Z

        @Test
        @DisplayName("All predefined twilights")
        void allTwilights() {
            for (Twilight twilight : Twilight.values()) {
                SunTimes times = SunTimes.request()
                        .at(COLOGNE)
                        .on(2017, 8, 10)
                        .utc()
                        .twilight(twilight)
                        .execute();

                assertTime(riseTimes.get(twilight), times.rise, twilight + " rise");
                assertTime(setTimes.get(twilight), times.set, twilight + " set");
                assertTime(NOON, times.noon, twilight + " noon");
                assertTime(NADIR, times.nadir, twilight + " nadir");
                assertFalse(times.alwaysUp);
                assertFalse(times.alwaysDown);
            }
        }

        @Test
        @DisplayName("Free angle matches the blue hour")
        void freeAngle() {
            SunTimes times = SunTimes.request()
                    .at(COLOGNE)
                    .on(2017, 8, 10)
                    .utc()
                    .twilight(-4.0)
                    .execute();

            assertTime(1502336939L, times.rise, "rise");
            assertTime(1502393116L, times.set, "set");
            assertTime(NOON, times.noon, "noon");
            assertTime(NADIR, times.nadir, "nadir");
        }

        @Test
        @DisplayName("Results are projected into the requested zone")
        void zone() {
            SunTimes times = SunTimes.request()
                    .at(COLOGNE)
                    .on(2017, 8, 10)
                    .timezone(COLOGNE_TZ)
                    .execute();
            assertEquals(COLOGNE_TZ, times.rise.getZone());
            assertEquals(6, times.rise.getHour());
            assertEquals(21, times.set.getHour());
        }
    }

    @Nested
    @DisplayName("Polar days and nights in Alert")
    class AlertTests {

        @Test
        @DisplayName("Midnight sun within one day")
        void midnightSun() {
            SunTimes times = SunTimes.request().at(ALERT).on(2017, 8, 10).utc().oneDay().execute();
            assertTimes(times, null, null, 1502381594L, true);
        }

        @Test
        @DisplayName("Regular day near the equinox")
        void equinox() {
            SunTimes times = SunTimes.request().at(ALERT).on(2017, 9, 24).utc().execute();
            assertTimes(times, 1506246869L, 1506290521L, 1506268756L, null);
        }

        @Test
        @DisplayName("Polar night within one day")
        void polarNight() {
            SunTimes times = SunTimes.request().at(ALERT).on(2017, 2, 10).utc().oneDay().execute();
            assertTimes(times, null, null, 1486743909L, false);
        }

        @Test
        @DisplayName("End of the midnight sun")
        void endOfMidnightSun() {
            SunTimes times = SunTimes.request().at(ALERT).on(2017, 8, 10).utc().execute();
            assertTimes(times, 1504674795L, 1504667162L, 1502381594L, null);
        }

        @Test
        @DisplayName("End of the polar night")
        void endOfPolarNight() {
            SunTimes times = SunTimes.request().at(ALERT).on(2017, 2, 10).utc().execute();
            assertTimes(times, 1488209058L, 1488216226L, 1486743909L, null);
        }

        @Test
        @DisplayName("Set before rise on the first day")
        void setBeforeRise() {
            SunTimes times = SunTimes.request().at(ALERT).on(2017, 9, 6).utc().execute();
            assertTimes(times, 1504674795L, 1504667162L, 1504713941L, null);
        }

        @Test
        @DisplayName("Midnight sun around the solstice within two days")
        void solstice() {
            SunTimes times = SunTimes.request().at(ALERT).on(2020, 6, 20).utc()
                    .limit(Duration.ofDays(2)).execute();
            assertTimes(times, null, null, 1592669462L, true);
        }
    }

    @Nested
    @DisplayName("Other places")
    class PlaceTests {

        @Test
        @DisplayName("Wellington")
        void wellington() {
            SunTimes times = SunTimes.request().at(WELLINGTON).on(2017, 8, 10).timezone(WELLINGTON_TZ).execute();
            assertTimes(times, 1502306313L, 1502343290L, 1502324793L, null);
        }

        @Test
        @DisplayName("Puerto Williams")
        void puertoWilliams() {
            SunTimes times = SunTimes.request().at(PUERTO_WILLIAMS).on(2017, 8, 10)
                    .timezone(PUERTO_WILLIAMS_TZ).execute();
            assertTimes(times, 1502366511L, 1502399436L, 1502382967L, null);
        }

        @Test
        @DisplayName("Singapore")
        void singapore() {
            SunTimes times = SunTimes.request().at(SINGAPORE).on(2017, 8, 10).timezone(SINGAPORE_TZ).execute();
            assertTimes(times, 1502319913L, 1502363696L, 1502341807L, null);
        }

        @Test
        @DisplayName("Martinique, sunset close to midnight UTC")
        void martinique() {
            SunTimes times = SunTimes.request().at(MARTINIQUE).on(2019, 7, 1).timezone(MARTINIQUE_TZ).execute();
            assertTimes(times, 1561973915L, 1562020643L, 1561997277L, null);
        }

        @Test
        @DisplayName("Sydney, sunrise on the previous UTC day")
        void sydney() {
            SunTimes times = SunTimes.request().at(SYDNEY).on(2019, 7, 3).timezone(SYDNEY_TZ).execute();
            assertTimes(times, 1562101235L, 1562137082L, 1562119158L, null);
        }

        @Test
        @DisplayName("Observer height moves rise earlier and set later")
        void height() {
            SunTimes skytree = SunTimes.request()
                    .at(35.710046, 139.810718)
                    .on(2020, 6, 25)
                    .timezone("Asia/Tokyo")
                    .height(634.0)
                    .execute();
            assertTimes(skytree, 1593026506L, 1593079517L, 1593053008L, null);

            SunTimes ground = SunTimes.request()
                    .at(35.710046, 139.810718)
                    .on(2020, 6, 25)
                    .timezone("Asia/Tokyo")
                    .execute();
            assertTrue(skytree.rise.isBefore(ground.rise));
            assertTrue(skytree.set.isAfter(ground.set));
        }
    }

    @Nested
    @DisplayName("Search window")
    class WindowTests {

        @Test
        @DisplayName("Noon just before and just after the start")
        void justBeforeJustAfter() {
            long acceptableSeconds = 65;
            SunTimes.Builder param = SunTimes.request()
                    .at(SANTA_MONICA)
                    .timezone(SANTA_MONICA_TZ)
                    .on(2020, 5, 3);

            ZonedDateTime noon = param.execute().noon;
            ZonedDateTime noonNextDay = param.plusDays(1).execute().noon;
            assertNotNull(noon);
            assertNotNull(noonNextDay);

            ZonedDateTime wellBeforeNoon = santaMonicaFrom(noon.minusMinutes(3)).noon;
            assertClose(noon, wellBeforeNoon, acceptableSeconds);

            ZonedDateTime justBeforeNoon = santaMonicaFrom(noon.minusMinutes(2)).noon;
            assertClose(noon, justBeforeNoon, acceptableSeconds);

            ZonedDateTime wellAfterNoon = santaMonicaFrom(noon.plusMinutes(3)).noon;
            assertClose(noonNextDay, wellAfterNoon, acceptableSeconds);

            ZonedDateTime nadirWellAfterNoon = santaMonicaFrom(wellAfterNoon).nadir;
            assertNotNull(nadirWellAfterNoon);
            ZonedDateTime nadirJustBefore = santaMonicaFrom(nadirWellAfterNoon.minusMinutes(2)).nadir;
            assertClose(nadirWellAfterNoon, nadirJustBefore, acceptableSeconds);
        }

        @Test
        @DisplayName("Sun is due south at noon and due north at nadir")
        void noonNadirAzimuth() {
            assertNoonNadirAzimuth(ZonedDateTime.of(2020, 6, 2, 3, 30, 0, 0, SANTA_MONICA_TZ));
            assertNoonNadirAzimuth(ZonedDateTime.of(2020, 6, 16, 4, 11, 0, 0, SANTA_MONICA_TZ));
        }

        @Test
        @DisplayName("Rise and set are stable for every start minute of a day")
        void sequence() {
            long acceptableSeconds = 62;
            ZonedDateTime riseBefore = utc(2017, 11, 25, 7, 4);
            ZonedDateTime riseAfter = utc(2017, 11, 26, 7, 6);
            ZonedDateTime setBefore = utc(2017, 11, 25, 15, 33);
            ZonedDateTime setAfter = utc(2017, 11, 26, 15, 32);

            for (int hour = 0; hour < 24; hour++) {
                for (int minute = 0; minute < 60; minute++) {
                    SunTimes times = SunTimes.request()
                            .at(COLOGNE)
                            .on(2017, 11, 25, hour, minute, 0)
                            .utc()
                            .fullCycle()
                            .execute();

                    boolean beforeRise = hour < 7 || (hour == 7 && minute <= 4);
                    assertClose(beforeRise ? riseBefore : riseAfter, times.rise, acceptableSeconds);

                    boolean beforeSet = hour < 15 || (hour == 15 && minute <= 33);
                    assertClose(beforeSet ? setBefore : setAfter, times.set, acceptableSeconds);
                }
            }
        }

        @Test
        @DisplayName("Empty window finds nothing")
        void emptyWindow() {
            SunTimes times = SunTimes.request().at(COLOGNE).on(2017, 8, 10).utc()
                    .limit(Duration.ZERO).execute();
            assertNull(times.rise);
            assertNull(times.set);
            assertNull(times.noon);
            assertNull(times.nadir);
        }

        @Test
        @DisplayName("Events outside a short window are dropped")
        void shortWindow() {
            SunTimes times = SunTimes.request().at(COLOGNE).on(2017, 8, 10).utc()
                    .limit(Duration.ofHours(6)).execute();
            assertNotNull(times.rise);
            assertNull(times.set);
            assertNull(times.noon);
            assertNull(times.nadir);
        }

        @Test
        @DisplayName("Negative window is rejected")
        void negativeWindow() {
            SunTimes.Builder builder = SunTimes.request();
            assertThrows(IllegalArgumentException.class, () -> builder.limit(Duration.ofHours(-1)));
            assertThrows(IllegalArgumentException.class, () -> builder.limit(null));
        }

        @Test
        @DisplayName("Default window and twilight")
        void defaults() {
            SunTimes.Request request = SunTimes.request().at(COLOGNE).on(2017, 8, 10).utc().build();
            assertEquals(Duration.ofDays(365), request.limit());
            assertEquals(Twilight.VISUAL, request.twilight());
            assertEquals(Duration.ofDays(1), SunTimes.request().oneDay().build().limit());
            assertEquals(Duration.ofDays(365), SunTimes.request().fullCycle().build().limit());
        }

        @Test
        @DisplayName("Longest possible window behaves like the default one")
        void longestWindow() {
            SunTimes.Request request = SunTimes.request().at(COLOGNE).on(2017, 8, 10).utc()
                    .limit(Duration.ofSeconds(Long.MAX_VALUE, 999_999_999)).build();
            SunTimes longest = assertDoesNotThrow(() -> SunTimes.compute(request));
            SunTimes regular = SunTimes.request().at(COLOGNE).on(2017, 8, 10).utc().execute();
            assertEquals(regular.rise, longest.rise);
            assertEquals(regular.set, longest.set);
            assertEquals(regular.noon, longest.noon);
            assertEquals(regular.nadir, longest.nadir);
        }
    }

    // Helper methods

    private static SunTimes santaMonicaFrom(ZonedDateTime start) {
        return SunTimes.request()
                .at(SANTA_MONICA)
                .timezone(SANTA_MONICA_TZ)
                .on(start)
                .execute();
    }

    private static void assertNoonNadirAzimuth(ZonedDateTime start) {
        SunTimes times = SunTimes.request().at(SANTA_MONICA).on(start).execute();
        assertNotNull(times.noon);
        assertNotNull(times.nadir);

        SunPosition atNoon = SunPosition.request().at(SANTA_MONICA).on(times.noon).execute();
        SunPosition atNadir = SunPosition.request().at(SANTA_MONICA).on(times.nadir).execute();

        assertTrue(Math.abs(atNoon.azimuth - 180.0) < 0.1, "noon azimuth " + atNoon.azimuth);
        // the nadir azimuth is just below 360 or just above 0
        double nadirAzimuth = atNadir.azimuth < 180.0 ? atNadir.azimuth + 360.0 : atNadir.azimuth;
        assertTrue(Math.abs(nadirAzimuth - 360.0) < 0.1, "nadir azimuth " + atNadir.azimuth);
    }

    private static void assertTimes(SunTimes times, Long rise, Long set, long noon, Boolean alwaysUp) {
        if (rise == null) {
            assertNull(times.rise, "rise");
        } else {
            assertTime(rise, times.rise, "rise");
        }
        if (set == null) {
            assertNull(times.set, "set");
        } else {
            assertTime(set, times.set, "set");
        }
        assertTime(noon, times.noon, "noon");

        if (alwaysUp != null) {
            assertEquals(alwaysUp, times.alwaysUp, "alwaysUp");
            assertEquals(!alwaysUp, times.alwaysDown, "alwaysDown");
        } else {
            assertFalse(times.alwaysUp, "alwaysUp");
            assertFalse(times.alwaysDown, "alwaysDown");
        }
    }

    private static void assertTime(long expectedEpochSecond, ZonedDateTime actual, String what) {
        assertNotNull(actual, what);
        long diff = Math.abs(actual.toEpochSecond() - expectedEpochSecond);
        assertTrue(diff <= ERROR_SECONDS, what + " was " + actual + ", off by " + diff + " s");
    }

    private static void assertClose(ZonedDateTime expected, ZonedDateTime actual, long seconds) {
        assertNotNull(actual);
        long diff = Math.abs(Duration.between(expected, actual).getSeconds());
        assertTrue(diff < seconds, "expected " + expected + " but was " + actual);
    }

    private static ZonedDateTime utc(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, ZoneOffset.UTC);
    }
}
