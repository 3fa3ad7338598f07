package com.forecastsync.engine.routing;

import com.forecastsync.core.error.InvalidInputException;
import com.forecastsync.core.model.Coordinate;
import com.forecastsync.core.model.ProviderId;

import java.util.List;

public final class ProviderSelector {
    public static final BoundingBox CONTINENTAL_US =
            new BoundingBox("continental-us", 24.396308, 49.384358, -125.0, -66.93457);
    public static final BoundingBox ALASKA = new BoundingBox("alaska", 51.0, 71.5, -180.0, -129.0);
    public static final BoundingBox HAWAII = new BoundingBox("hawaii", 18.0, 23.0, -160.0, -154.0);
    public static final List<BoundingBox> NWS_COVERAGE = List.of(CONTINENTAL_US, ALASKA, HAWAII);

    private final List<BoundingBox> nationalCoverage;

    public ProviderSelector() {
        this(NWS_COVERAGE);
    }

    public ProviderSelector(List<BoundingBox> nationalCoverage) {
        this.nationalCoverage = List.copyOf(nationalCoverage);
    }

    public ProviderId select(Coordinate coordinate) {
        if (coordinate == null) {
            throw new InvalidInputException("Coordinate is required");
        }
        for (BoundingBox box : nationalCoverage) {
            if (box.contains(coordinate)) {
                return ProviderId.NWS;
            }
        }
        return ProviderId.OPEN_WEATHER;
    }
}
