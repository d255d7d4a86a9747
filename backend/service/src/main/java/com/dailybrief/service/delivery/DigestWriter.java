package com.dailybrief.service.delivery;

import com.dailybrief.core.model.ClusterSelection;
import com.dailybrief.core.util.JsonUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.logging.Logger;

/**
 * Writes the selected clusters as {@code <prefix>-<date>.json} in the output
 * directory, and {@code <prefix>-<date>-error.json} when a run fails.
 */
public class DigestWriter {
    private static final Logger LOGGER = Logger.getLogger(DigestWriter.class.getName());

    private final Path outputDir;
    private final String prefix;
    private final String profile;
    private final Clock clock;

    public DigestWriter(Path outputDir, String prefix, String profile, Clock clock) {
        this.outputDir = outputDir;
        this.prefix = prefix;
        this.profile = profile;
        this.clock = clock;
    }

    public Path write(List<ClusterSelection> clusters, LocalDate runDate) {
        Path file = outputDir.resolve(prefix + "-" + runDate + ".json");
        writeJson(file, DigestDocument.from(profile, runDate, clock.instant(), clusters));
        LOGGER.info("Digest saved to " + file);
        return file;
    }

    public Path writeError(LocalDate runDate, String message) {
        Path file = outputDir.resolve(prefix + "-" + runDate + "-error.json");
        writeJson(file, new ErrorDocument(profile, runDate, clock.instant(), message));
        LOGGER.severe("Error digest saved to " + file);
        return file;
    }

    private static void writeJson(Path file, Object document) {
        try {
            Files.createDirectories(file.getParent());
            try (OutputStream out = Files.newOutputStream(file)) {
                JsonUtils.prettyWriter().writeValue(out, document);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing digest to " + file, e);
        }
    }

    record ErrorDocument(String profile, LocalDate runDate, Instant generatedAt, String error) {
    }
}
