package com.crisisnavigator.service;

import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.classify.ClassificationCollector;
import com.crisisnavigator.collectors.config.ClassificationConfig;
import com.crisisnavigator.collectors.config.FeedsConfig;
import com.crisisnavigator.collectors.eonet.EonetFeedSource;
import com.crisisnavigator.collectors.feed.FeedCollector;
import com.crisisnavigator.collectors.feed.FeedSource;
import com.crisisnavigator.collectors.gdacs.GdacsFeedSource;
import com.crisisnavigator.collectors.reliefweb.ReliefWebFeedSource;
import com.crisisnavigator.core.bus.EventBus;
import com.crisisnavigator.core.geo.CoordinateResolver;
import com.crisisnavigator.core.geo.CountryCentroids;
import com.crisisnavigator.core.model.CollectorConfig;
import com.crisisnavigator.core.severity.SeverityReconciler;
import com.crisisnavigator.service.analysis.GeminiAnalysisClient;
import com.crisisnavigator.service.analysis.GeminiConfig;
import com.crisisnavigator.service.api.ApiServer;
import com.crisisnavigator.service.api.DiagnosticsTracker;
import com.crisisnavigator.service.api.SseBroadcaster;
import com.crisisnavigator.service.config.ConfigLoader;
import com.crisisnavigator.service.http.HttpClientFactory;
import com.crisisnavigator.service.runtime.SchedulerService;
import com.crisisnavigator.service.store.InMemoryActivityLog;
import com.crisisnavigator.service.store.InMemoryDisasterStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    static final int DEFAULT_PORT = 8080;

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("CONFIG_DIR", "config"));
        Clock clock = Clock.systemUTC();

        List<CollectorConfig> collectorConfigs = ConfigLoader.loadCollectors(configDir);
        FeedsConfig feeds = applyEnvironment(ConfigLoader.loadFeeds(configDir), env);
        ClassificationConfig classification = ConfigLoader.loadClassification(configDir);
        GeminiConfig gemini = ConfigLoader.loadGemini(configDir);

        Map<String, CollectorConfig> collectorConfigByName = new HashMap<>();
        for (CollectorConfig cfg : collectorConfigs) {
            collectorConfigByName.put(cfg.name(), cfg);
        }

        EventBus eventBus = new EventBus();
        InMemoryDisasterStore disasterStore = new InMemoryDisasterStore(clock);
        InMemoryActivityLog activityLog = new InMemoryActivityLog(eventBus, clock);
        HttpClient sharedHttpClient = HttpClientFactory.create(Duration.ofSeconds(10));
        CoordinateResolver resolver = new CoordinateResolver(CountryCentroids.loadDefault());

        CollectorContext context = new CollectorContext(
                sharedHttpClient,
                eventBus,
                disasterStore,
                activityLog,
                clock,
                Duration.ofSeconds(30),
                Map.of(
                        FeedsConfig.CONFIG_KEY, feeds,
                        ClassificationConfig.CONFIG_KEY, classification
                )
        );

        List<SchedulerService.ScheduledCollector> scheduledCollectors = new ArrayList<>();
        List<String> feedCollectorNames = new ArrayList<>();
        addFeed(scheduledCollectors, feedCollectorNames, collectorConfigByName, new EonetFeedSource(), resolver, Duration.ofMinutes(10));
        addFeed(scheduledCollectors, feedCollectorNames, collectorConfigByName, new ReliefWebFeedSource(), resolver, Duration.ofMinutes(30));
        addFeed(scheduledCollectors, feedCollectorNames, collectorConfigByName, new GdacsFeedSource(), resolver, Duration.ofMinutes(15));

        String analysisCollector = null;
        Optional<String> apiKey = GeminiAnalysisClient.apiKey(env);
        if (apiKey.isPresent()) {
            ClassificationCollector classifier = new ClassificationCollector(
                    new GeminiAnalysisClient(sharedHttpClient, gemini, apiKey.get(), classification.analysisTimeout()),
                    new SeverityReconciler(),
                    intervalFor(collectorConfigByName, ClassificationCollector.NAME, Duration.ofMinutes(1))
            );
            scheduledCollectors.add(new SchedulerService.ScheduledCollector(
                    classifier,
                    classifier.interval(),
                    isEnabled(collectorConfigByName, ClassificationCollector.NAME, true)
            ));
            analysisCollector = classifier.name();
        } else {
            LOGGER.warning(GeminiAnalysisClient.API_KEY_ENV + " is not set; severity classification is disabled.");
        }

        SchedulerService scheduler = new SchedulerService(scheduledCollectors, context);
        SseBroadcaster broadcaster = new SseBroadcaster(eventBus);
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, clock, broadcaster::clientCount);
        ApiServer apiServer = new ApiServer(
                port(env),
                disasterStore,
                activityLog,
                scheduler,
                broadcaster,
                diagnosticsTracker,
                feedCollectorNames,
                analysisCollector
        );

        scheduler.start();
        apiServer.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            apiServer.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static FeedsConfig applyEnvironment(FeedsConfig feeds, Map<String, String> env) {
        String appName = env.get("RELIEFWEB_APPNAME");
        if (appName == null || appName.isBlank()) {
            return feeds;
        }
        return feeds.withReliefWeb(feeds.reliefWeb().withAppName(appName.trim()));
    }

    static int port(Map<String, String> env) {
        String raw = env.get("API_PORT");
        if (raw == null || raw.isBlank()) {
            return DEFAULT_PORT;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            LOGGER.warning("Invalid API_PORT=" + raw + ", defaulting to " + DEFAULT_PORT);
            return DEFAULT_PORT;
        }
    }

    private static void addFeed(
            List<SchedulerService.ScheduledCollector> scheduled,
            List<String> names,
            Map<String, CollectorConfig> configs,
            FeedSource source,
            CoordinateResolver resolver,
            Duration defaultInterval
    ) {
        FeedCollector collector = new FeedCollector(source, resolver, intervalFor(configs, source.name() + "Collector", defaultInterval));
        boolean enabled = isEnabled(configs, collector.name(), true);
        scheduled.add(new SchedulerService.ScheduledCollector(collector, collector.interval(), enabled));
        if (enabled) {
            names.add(collector.name());
        }
    }

    private static Duration intervalFor(Map<String, CollectorConfig> map, String name, Duration fallback) {
        CollectorConfig config = map.get(name);
        if (config == null || config.intervalSeconds() <= 0) {
            return fallback;
        }
        return Duration.ofSeconds(config.intervalSeconds());
    }

    private static boolean isEnabled(Map<String, CollectorConfig> map, String name, boolean fallback) {
        CollectorConfig config = map.get(name);
        return config == null ? fallback : config.enabled();
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Unable to load logging.properties: " + e.getMessage());
        }
    }
}
