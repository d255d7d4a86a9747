package com.dailybrief.service;

import com.dailybrief.core.bus.EventBus;
import com.dailybrief.core.model.PipelineRun;
import com.dailybrief.core.model.RunStatus;
import com.dailybrief.curation.api.CurationContext;
import com.dailybrief.curation.config.RankingConfig;
import com.dailybrief.curation.config.SourceConfig;
import com.dailybrief.curation.enrich.EnrichmentStage;
import com.dailybrief.curation.ingest.IngestionStage;
import com.dailybrief.curation.ranking.RankingStage;
import com.dailybrief.curation.ranking.TrustLookup;
import com.dailybrief.curation.security.ContentSanitizer;
import com.dailybrief.curation.security.EnrichmentValidator;
import com.dailybrief.curation.security.UrlVerifier;
import com.dailybrief.service.annotate.JsonAnnotationFeed;
import com.dailybrief.service.config.ConfigLoader;
import com.dailybrief.service.config.ProfileConfig;
import com.dailybrief.service.delivery.DigestWriter;
import com.dailybrief.service.runtime.DigestPipeline;
import com.dailybrief.service.source.JsonInboxSource;
import com.dailybrief.service.store.EventCodec;
import com.dailybrief.service.store.JsonFileBriefStore;
import com.dailybrief.service.store.JsonlEventStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    static final String ALL_PROFILES = "all";

    private Main() {
    }

    public static void main(String[] args) {
        configureLogging();
        CliOptions options = parseArgs(args, LOGGER::warning);
        Clock clock = Clock.systemDefaultZone();
        LocalDate runDate = options.runDate() == null ? LocalDate.now(clock) : options.runDate();

        boolean failed = false;
        for (String profile : resolveProfiles(options.configDir(), options.profile())) {
            try {
                PipelineRun run = buildPipeline(options.configDir(), Path.of(""), profile, clock).run(runDate);
                failed |= run.status() != RunStatus.COMPLETED;
            } catch (RuntimeException e) {
                // one profile's broken setup must not block the others
                LOGGER.severe("Profile '" + profile + "' failed: " + e.getMessage());
                failed = true;
            }
        }
        if (failed) {
            System.exit(1);
        }
    }

    static DigestPipeline buildPipeline(Path configDir, Path baseDir, String profileName, Clock clock) {
        ProfileConfig profile = ConfigLoader.loadProfile(configDir, profileName);
        RankingConfig rankingConfig = ConfigLoader.loadRanking(configDir);
        List<SourceConfig> sources = ConfigLoader.loadSources(configDir, profile.sourcesFile());

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(profile.eventLogFile(baseDir));
        EventCodec.subscribeAll(eventBus, eventStore::append);

        JsonFileBriefStore store = new JsonFileBriefStore(profile.storeFile(baseDir));
        CurationContext ctx = new CurationContext(eventBus, store, clock);
        ContentSanitizer sanitizer = new ContentSanitizer();

        IngestionStage ingestion = new IngestionStage(
                ctx,
                new JsonInboxSource(profile.inboxDir(baseDir)),
                sanitizer,
                UrlVerifier.fromSources(sources),
                profile.maxAgeDays()
        );
        EnrichmentStage enrichment = new EnrichmentStage(
                ctx,
                new JsonAnnotationFeed(profile.annotationsFile(baseDir)),
                sanitizer,
                new EnrichmentValidator(rankingConfig.lanes())
        );
        RankingStage ranking = new RankingStage(ctx, rankingConfig, TrustLookup.fromSources(sources));
        DigestWriter writer = new DigestWriter(profile.outputPath(baseDir), profile.outputPrefix(), profile.name(), clock);

        return new DigestPipeline(profile.name(), ctx, store, sources, ingestion, enrichment, ranking, writer);
    }

    static CliOptions parseArgs(String[] args, Consumer<String> warn) {
        Path configDir = Path.of("config");
        String profile = "technical";
        LocalDate runDate = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String value = i + 1 < args.length ? args[i + 1] : null;
            switch (arg) {
                case "--config" -> {
                    configDir = Path.of(requireValue(arg, value));
                    i++;
                }
                case "--profile" -> {
                    profile = requireValue(arg, value);
                    i++;
                }
                case "--date" -> {
                    try {
                        runDate = LocalDate.parse(requireValue(arg, value));
                    } catch (DateTimeParseException e) {
                        throw new IllegalArgumentException("--date must be yyyy-MM-dd, got " + value, e);
                    }
                    i++;
                }
                default -> warn.accept("Ignoring unknown argument " + arg);
            }
        }
        return new CliOptions(configDir, profile, runDate);
    }

    static List<String> resolveProfiles(Path configDir, String profile) {
        if (!ALL_PROFILES.equals(profile)) {
            return List.of(profile);
        }
        try (Stream<Path> files = Files.list(configDir.resolve("profiles"))) {
            List<String> names = new ArrayList<>();
            files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(".json") && !name.endsWith(".local.json"))
                    .sorted()
                    .forEach(name -> names.add(name.substring(0, name.length() - ".json".length())));
            return names;
        } catch (IOException e) {
            throw new IllegalStateException("Failed listing profiles in " + configDir.resolve("profiles"), e);
        }
    }

    private static String requireValue(String flag, String value) {
        if (value == null || value.startsWith("--")) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return value;
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Could not read logging.properties: " + e.getMessage());
        }
    }

    record CliOptions(Path configDir, String profile, LocalDate runDate) {
    }
}
