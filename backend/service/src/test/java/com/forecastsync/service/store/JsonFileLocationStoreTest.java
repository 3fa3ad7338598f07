package com.forecastsync.service.store;

import com.forecastsync.core.error.InvalidInputException;
import com.forecastsync.core.model.Location;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileLocationStoreTest {
    @TempDir
    Path tempDir;

    @Test
    void upsertFindAndDeleteArePersisted() {
        Path file = tempDir.resolve("locations.json");
        JsonFileLocationStore store = new JsonFileLocationStore(file);
        Location boston = new Location("boston", "Boston", 42.3601, -71.0589, false);
        Location austin = new Location("austin", "Austin", 30.2672, -97.7431, true);

        store.upsert(boston);
        store.upsert(austin);
        store.upsert(boston.withFavorite(true));

        JsonFileLocationStore reloaded = new JsonFileLocationStore(file);
        assertEquals(List.of("austin", "boston"), reloaded.listAll().stream().map(Location::id).toList());
        assertTrue(reloaded.find("boston").orElseThrow().favorite());

        assertTrue(reloaded.delete("austin"));
        assertFalse(reloaded.delete("austin"));
        assertEquals(1, new JsonFileLocationStore(file).listAll().size());
    }

    @Test
    void rejectsMissingLocation() {
        JsonFileLocationStore store = new JsonFileLocationStore(tempDir.resolve("locations.json"));

        assertThrows(InvalidInputException.class, () -> store.upsert(null));
        assertTrue(store.listAll().isEmpty());
    }

    @Test
    void coordinatesOfExistingLocationCannotChange() {
        Path file = tempDir.resolve("locations.json");
        JsonFileLocationStore store = new JsonFileLocationStore(file);
        store.upsert(new Location("home", "Home", 42.3601, -71.0589, false));

        assertThrows(InvalidInputException.class,
                () -> store.upsert(new Location("home", "Home", 51.5074, -0.1278, false)));
        store.upsert(new Location("home", "Boston Home", 42.3601, -71.0589, true));

        Location stored = new JsonFileLocationStore(file).find("home").orElseThrow();
        assertEquals(42.3601, stored.latitude());
        assertEquals(-71.0589, stored.longitude());
        assertEquals("Boston Home", stored.name());
        assertTrue(stored.favorite());
    }

    @Test
    void failedWriteLeavesLocationsUntouched() throws Exception {
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "x");
        JsonFileLocationStore store = new JsonFileLocationStore(blocker.resolve("locations.json"));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> store.upsert(new Location("boston", "Boston", 42.3601, -71.0589, false)));

        assertTrue(error.getMessage().contains("locations.json"));
        assertTrue(store.listAll().isEmpty());
        assertTrue(store.find("boston").isEmpty());
    }

    @Test
    void corruptFileFailsFastWithPath() throws Exception {
        Path file = tempDir.resolve("locations.json");
        Files.writeString(file, "[oops");

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> new JsonFileLocationStore(file));
        assertTrue(error.getMessage().contains("locations.json"));
    }
}
