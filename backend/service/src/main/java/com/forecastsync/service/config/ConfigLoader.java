package com.forecastsync.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.forecastsync.core.model.Location;
import com.forecastsync.core.util.JsonUtils;
import com.forecastsync.engine.config.EngineConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static EngineConfig loadEngine(Path configDir) {
        Path path = configDir.resolve("engine.json");
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + "; using engine defaults");
            return EngineConfig.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    public static ProvidersConfig loadProviders(Path configDir) {
        Path path = configDir.resolve("providers.json");
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + "; using provider defaults");
            return ProvidersConfig.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    public static List<Location> loadSeedLocations(Path configDir) {
        Path path = configDir.resolve("locations.json");
        if (!Files.exists(path)) {
            return List.of();
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
