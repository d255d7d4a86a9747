package com.dailybrief.service.config;

import com.dailybrief.core.util.JsonUtils;
import com.dailybrief.curation.config.RankingConfig;
import com.dailybrief.curation.config.SourceConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

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

    public static RankingConfig loadRanking(Path configDir) {
        return read(configDir.resolve("ranking.json"), new TypeReference<>() {
        });
    }

    public static List<SourceConfig> loadSources(Path configDir, String fileName) {
        SourcesFile file = read(configDir.resolve(fileName), new TypeReference<>() {
        });
        return file.sources() == null ? List.of() : List.copyOf(file.sources());
    }

    /**
     * Reads {@code profiles/<name>.json}; top-level keys of an optional
     * {@code profiles/<name>.local.json} replace the shared values.
     */
    public static ProfileConfig loadProfile(Path configDir, String name) {
        Path profiles = configDir.resolve("profiles");
        Path shared = profiles.resolve(name + ".json");
        Path local = profiles.resolve(name + ".local.json");

        JsonNode merged = readTree(shared);
        if (!(merged instanceof ObjectNode profile)) {
            throw new IllegalStateException("Failed loading config from " + shared + ": expected a JSON object");
        }
        if (Files.exists(local)) {
            JsonNode overrides = readTree(local);
            if (!(overrides instanceof ObjectNode overrideFields)) {
                throw new IllegalStateException("Failed loading config from " + local + ": expected a JSON object");
            }
            profile.setAll(overrideFields);
            LOGGER.info("Merged local overrides from " + local.getFileName());
        }
        if (!profile.hasNonNull("name")) {
            profile.put("name", name);
        }
        try {
            return JsonUtils.objectMapper().treeToValue(profile, ProfileConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + shared, e);
        }
    }

    private static JsonNode readTree(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private record SourcesFile(List<SourceConfig> sources) {
    }
}
