package com.dailybrief.service.config;

import java.nio.file.Path;

/**
 * One digest audience. Each profile keeps its own data directory, so runs of
 * different profiles never share items.
 */
public record ProfileConfig(
        String name,
        Integer maxAgeDays,
        String outputPrefix,
        String sourcesFile,
        String dataDir,
        String outputDir
) {
    public ProfileConfig {
        name = name == null || name.isBlank() ? "brief" : name;
        maxAgeDays = maxAgeDays == null || maxAgeDays < 1 ? 7 : maxAgeDays;
        outputPrefix = outputPrefix == null || outputPrefix.isBlank() ? "brief" : outputPrefix;
        sourcesFile = sourcesFile == null || sourcesFile.isBlank() ? "sources.json" : sourcesFile;
        dataDir = dataDir == null || dataDir.isBlank() ? "data/" + name : dataDir;
        outputDir = outputDir == null || outputDir.isBlank() ? "briefs" : outputDir;
    }

    public Path storeFile(Path base) {
        return base.resolve(dataDir).resolve("store.json");
    }

    public Path inboxDir(Path base) {
        return base.resolve(dataDir).resolve("inbox");
    }

    public Path annotationsFile(Path base) {
        return base.resolve(dataDir).resolve("annotations.json");
    }

    public Path eventLogFile(Path base) {
        return base.resolve(dataDir).resolve("events.jsonl");
    }

    public Path outputPath(Path base) {
        return base.resolve(outputDir);
    }
}
