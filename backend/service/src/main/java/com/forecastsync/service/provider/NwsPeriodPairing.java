package com.forecastsync.service.provider;

import com.forecastsync.core.model.ForecastPoint;

import java.util.ArrayList;
import java.util.List;

// day period + following night = one daily point; a leading night stands alone with only a low
final class NwsPeriodPairing {
    static final int MAX_DAYS = 7;

    private NwsPeriodPairing() {
    }

    static List<ForecastPoint> pair(List<NwsPeriod> periods) {
        List<ForecastPoint> daily = new ArrayList<>();
        int i = 0;
        while (i < periods.size() && daily.size() < MAX_DAYS) {
            NwsPeriod period = periods.get(i);
            if (!period.daytime()) {
                daily.add(loneNight(period));
                i++;
                continue;
            }
            NwsPeriod night = i + 1 < periods.size() && !periods.get(i + 1).daytime() ? periods.get(i + 1) : null;
            daily.add(dayWithNight(period, night));
            i += night == null ? 1 : 2;
        }
        return daily;
    }

    private static ForecastPoint dayWithNight(NwsPeriod day, NwsPeriod night) {
        return ForecastPoint.daily(
                day.start(),
                day.temperature(),
                night == null ? null : night.temperature(),
                combinedPrecipitation(day, night),
                day.wind(),
                day.icon(),
                day.shortForecast()
        ).withDetails(day.humidity(), day.dewpoint(), null, day.skyCover(),
                NwsPeriods.uvIndex(day.detailedForecast()), day.detailedForecast());
    }

    private static ForecastPoint loneNight(NwsPeriod night) {
        return new ForecastPoint(night.start(), null, null, night.temperature(), night.precipitationChance(),
                night.wind(), night.humidity(), night.dewpoint(), null, night.skyCover(),
                NwsPeriods.uvIndex(night.detailedForecast()), night.icon(),
                night.shortForecast(), night.detailedForecast(), Boolean.FALSE);
    }

    private static Double combinedPrecipitation(NwsPeriod day, NwsPeriod night) {
        if (night == null || night.precipitationChance() == null) {
            return day.precipitationChance();
        }
        if (day.precipitationChance() == null) {
            return night.precipitationChance();
        }
        return Math.max(day.precipitationChance(), night.precipitationChance());
    }
}
