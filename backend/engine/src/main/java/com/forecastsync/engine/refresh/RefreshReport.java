package com.forecastsync.engine.refresh;

import java.util.List;
import java.util.Objects;

public record RefreshReport(List<String> succeeded, List<String> servedStale, List<Failure> failed) {
    public RefreshReport {
        succeeded = List.copyOf(succeeded);
        servedStale = List.copyOf(servedStale);
        failed = List.copyOf(failed);
    }

    public static RefreshReport empty() {
        return new RefreshReport(List.of(), List.of(), List.of());
    }

    public int total() {
        return succeeded.size() + failed.size();
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }

    public record Failure(String locationId, Throwable error) {
        public Failure {
            Objects.requireNonNull(locationId, "locationId is required");
            Objects.requireNonNull(error, "error is required");
        }

        public String message() {
            Throwable current = error;
            while (current.getCause() != null && current.getMessage() == null) {
                current = current.getCause();
            }
            return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
        }
    }
}
