package com.forecastsync.core.events;

import java.time.Instant;
import java.util.Map;

public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String CATEGORY_WEATHER = "weather_alert";
    public static final String CATEGORY_REFRESH = "refresh";

    @Override
    public String type() {
        return "AlertRaised";
    }
}
