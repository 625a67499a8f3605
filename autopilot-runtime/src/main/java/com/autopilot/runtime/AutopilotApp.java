package com.autopilot.runtime;

import com.autopilot.exchange.ExchangeClient;
import com.autopilot.exchange.ExchangeClientFactory;
import com.autopilot.exchange.feed.MarketDataFeed;
import com.autopilot.exchange.feed.PriceSource;
import com.autopilot.exchange.feed.TickerCache;
import com.autopilot.exchange.model.TradingConfig;
import com.autopilot.exchange.model.TradingConfig.InstanceConfig;
import com.autopilot.execution.config.YamlConfigProvider;
import com.autopilot.execution.harness.ExecutionHarness;
import com.autopilot.execution.journal.ExecutionJournal;
import com.autopilot.execution.journal.JournalPersistenceStore;
import com.autopilot.execution.notify.LoggingNotificationSink;
import com.autopilot.execution.spi.ConfigProvider;
import com.autopilot.execution.spi.NotificationSink;
import com.autopilot.execution.spi.PersistenceStore;
import com.autopilot.runtime.watchdog.ResourceSampler;
import com.autopilot.runtime.watchdog.Watchdog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point. Usage: {@code AutopilotApp [config.yaml]}.
 */
public class AutopilotApp {

    private static final Logger log = LoggerFactory.getLogger(AutopilotApp.class);

    static final String DEFAULT_INSTANCE = "main";

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public static void main(String[] args) {
        log.info("Starting Autopilot...");
        try {
            Path configPath = args.length > 0 ? Path.of(args[0]) : TradingConfig.defaultPath();
            ConfigProvider configProvider = new YamlConfigProvider(configPath);
            TradingConfig config = configProvider.get();
            log.info("Loaded configuration from {}", configPath);

            List<String> problems = config.validate();
            if (!problems.isEmpty()) {
                problems.forEach(p -> log.error("Configuration problem: {}", p));
                System.exit(1);
                return;
            }

            ExchangeClient client = ExchangeClientFactory.create(config);
            MarketDataFeed feed = null;
            PriceSource prices;
            if (config.getExchange().isWebsocketEnabled()) {
                feed = MarketDataFeed.create(config.getExchange());
                TickerCache tickers = new TickerCache();
                feed.onChannel(TickerCache.CHANNEL, tickers);
                prices = new PriceSource(feed, tickers, client, config.getExchange().getPriceStalenessMs());
            } else {
                prices = PriceSource.restOnly(client);
            }

            Path dataDir = Path.of(config.getTrading().getDataDir());
            Clock clock = Clock.systemUTC();
            ExecutionJournal journal = new ExecutionJournal(dataDir, clock);
            PersistenceStore store = new JournalPersistenceStore(journal, dataDir);
            NotificationSink notifier = new LoggingNotificationSink();

            InstanceRegistry registry = new InstanceRegistry();
            MarketDataFeed tickerFeed = feed;
            InstanceFactory factory = id -> {
                TradingConfig instanceConfig = instanceConfig(configProvider.get(), id);
                if (tickerFeed != null) {
                    tickerFeed.subscribe(TickerCache.CHANNEL, Map.of("symbol", instanceConfig.getTrading().getPair()));
                }
                ExecutionHarness harness = new ExecutionHarness(id, instanceConfig, client, prices, journal,
                        store, notifier, clock);
                return new TradingInstance(id, instanceConfig, harness, store, notifier, clock);
            };
            TradingControlService control = new TradingControlService(registry, factory, store, notifier);

            Set<String> toStart = new HashSet<>();
            if (config.getInstances().isEmpty()) {
                control.createInstance(DEFAULT_INSTANCE);
                if (registry.require(DEFAULT_INSTANCE).isEnabled()) {
                    toStart.add(DEFAULT_INSTANCE);
                }
            } else {
                for (InstanceConfig ic : config.getInstances()) {
                    control.createInstance(ic.getId());
                    if (ic.isEnabled()) {
                        toStart.add(ic.getId());
                    }
                }
            }

            if (feed != null) {
                feed.start();
            }
            for (String id : toStart) {
                control.enable(id);
            }

            Watchdog watchdog = new Watchdog(registry, config.getWatchdog(), notifier, ResourceSampler.jvm(), clock,
                    dataDir.resolve(config.getWatchdog().getHeartbeatFile()));
            if (config.getWatchdog().isEnabled()) {
                watchdog.start();
            }

            MarketDataFeed feedToStop = feed;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutting down Autopilot...");
                watchdog.close();
                for (TradingInstance instance : registry.all()) {
                    instance.close();
                }
                if (feedToStop != null) {
                    feedToStop.stop();
                }
                client.close();
                shutdownLatch.countDown();
            }, "autopilot-shutdown"));

            log.info("Autopilot running {} instance(s): {}", registry.size(), control.listInstances());
            shutdownLatch.await();
        } catch (Exception e) {
            log.error("Failed to start Autopilot", e);
            System.exit(1);
        }
    }

    /**
     * The shared config with the pair and strategy of the matching {@code instances} entry applied.
     */
    static TradingConfig instanceConfig(TradingConfig base, String instanceId) {
        TradingConfig config = base.copy();
        for (InstanceConfig ic : base.getInstances()) {
            if (instanceId.equals(ic.getId())) {
                if (ic.getPair() != null && !ic.getPair().isBlank()) {
                    config.getTrading().setPair(ic.getPair());
                }
                if (ic.getStrategy() != null && !ic.getStrategy().isBlank()) {
                    config.getTrading().setStrategy(ic.getStrategy());
                }
            }
        }
        return config;
    }
}
