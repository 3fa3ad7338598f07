package com.forecastsync.service.provider;

import com.forecastsync.core.model.ForecastPoint;
import com.forecastsync.core.model.WeatherIcon;
import com.forecastsync.core.model.Wind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NwsPeriodPairingTest {
    private static final Instant START = Instant.parse("2026-03-02T11:00:00Z");

    @Test
    void pairsDayWithFollowingNight() {
        List<ForecastPoint> daily = NwsPeriodPairing.pair(List.of(
                period(0, true, 60.0, 10.0),
                period(12, false, 40.0, 30.0),
                period(24, true, 62.0, 0.0),
                period(36, false, 45.0, 0.0)
        ));

        assertEquals(2, daily.size());
        assertEquals(60.0, daily.get(0).high());
        assertEquals(40.0, daily.get(0).low());
        assertEquals(30.0, daily.get(0).precipitationChance());
        assertEquals(START, daily.get(0).time());
        assertTrue(daily.get(0).daytime());
    }

    @Test
    void leadingNightBecomesLowOnlyDay() {
        List<ForecastPoint> daily = NwsPeriodPairing.pair(List.of(
                period(0, false, 38.0, 20.0),
                period(12, true, 58.0, 0.0),
                period(24, false, 41.0, 0.0)
        ));

        assertEquals(2, daily.size());
        assertNull(daily.get(0).high());
        assertEquals(38.0, daily.get(0).low());
        assertFalse(daily.get(0).daytime());
        assertEquals(58.0, daily.get(1).high());
        assertEquals(41.0, daily.get(1).low());
    }

    @Test
    void trailingDayKeepsNullLow() {
        List<ForecastPoint> daily = NwsPeriodPairing.pair(List.of(
                period(0, true, 60.0, 0.0),
                period(12, false, 40.0, 0.0),
                period(24, true, 64.0, 0.0)
        ));

        assertEquals(2, daily.size());
        assertEquals(64.0, daily.get(1).high());
        assertNull(daily.get(1).low());
    }

    @Test
    void capsAtSevenDays() {
        List<NwsPeriod> periods = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            periods.add(period(12 * i, i % 2 == 0, 50.0 + i, 0.0));
        }

        assertEquals(NwsPeriodPairing.MAX_DAYS, NwsPeriodPairing.pair(periods).size());
    }

    private static NwsPeriod period(int hoursFromStart, boolean daytime, Double temperature, Double precipitation) {
        return new NwsPeriod(START.plusSeconds(3600L * hoursFromStart), daytime, temperature, precipitation,
                new Wind(5.0, "N"), WeatherIcon.CLOUDY, "Cloudy", null, null, null, 100.0);
    }
}
