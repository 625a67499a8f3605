package com.autopilot.exchange.model;

import com.autopilot.core.model.OrderType;
import com.autopilot.core.strategy.RsiFilter;
import com.autopilot.core.strategy.StrategyParameters;
import com.autopilot.core.strategy.StrategyType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TradingConfig {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_]+)(?::([^}]*))?}");

    private ExchangeConfig exchange = new ExchangeConfig();
    private PaperConfig paperTrading = new PaperConfig();
    private TradingSection trading = new TradingSection();
    private TradingHoursConfig tradingHours = new TradingHoursConfig();
    private StrategyConfig strategy = new StrategyConfig();
    private ExitConfig exits = new ExitConfig();
    private RiskConfig risk = new RiskConfig();
    private WatchdogConfig watchdog = new WatchdogConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private List<InstanceConfig> instances = new ArrayList<>();

    public ExchangeConfig getExchange() { return exchange; }
    public void setExchange(ExchangeConfig exchange) { this.exchange = exchange; }

    public PaperConfig getPaperTrading() { return paperTrading; }
    public void setPaperTrading(PaperConfig paperTrading) { this.paperTrading = paperTrading; }

    public TradingSection getTrading() { return trading; }
    public void setTrading(TradingSection trading) { this.trading = trading; }

    public TradingHoursConfig getTradingHours() { return tradingHours; }
    public void setTradingHours(TradingHoursConfig tradingHours) { this.tradingHours = tradingHours; }

    public StrategyConfig getStrategy() { return strategy; }
    public void setStrategy(StrategyConfig strategy) { this.strategy = strategy; }

    public ExitConfig getExits() { return exits; }
    public void setExits(ExitConfig exits) { this.exits = exits; }

    public RiskConfig getRisk() { return risk; }
    public void setRisk(RiskConfig risk) { this.risk = risk; }

    public WatchdogConfig getWatchdog() { return watchdog; }
    public void setWatchdog(WatchdogConfig watchdog) { this.watchdog = watchdog; }

    public NotificationConfig getNotifications() { return notifications; }
    public void setNotifications(NotificationConfig notifications) { this.notifications = notifications; }

    public List<InstanceConfig> getInstances() { return instances; }
    public void setInstances(List<InstanceConfig> instances) { this.instances = instances; }

    /**
     * Lists required settings that are missing or invalid. Empty means the config is usable.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (!paperTrading.isEnabled()) {
            if (isBlank(exchange.getApiKey())) problems.add("exchange.apiKey is required for live trading");
            if (isBlank(exchange.getApiSecret())) problems.add("exchange.apiSecret is required for live trading");
        }
        if (isBlank(trading.getPair())) problems.add("trading.pair is required");
        try {
            StrategyType.parse(trading.getStrategy());
        } catch (IllegalArgumentException e) {
            problems.add("trading.strategy is invalid: " + trading.getStrategy());
        }
        if (trading.getLeverage() <= 0) problems.add("trading.leverage must be positive");
        try {
            strategy.toParameters();
        } catch (IllegalArgumentException e) {
            problems.add("strategy: " + e.getMessage());
        }
        return problems;
    }

    /**
     * Deep copy, so callers can never mutate a shared instance.
     */
    public TradingConfig copy() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try {
            return mapper.readValue(mapper.writeValueAsBytes(this), TradingConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy trading config", e);
        }
    }

    public static TradingConfig load(Path path) throws IOException {
        return load(path, System::getenv);
    }

    /**
     * Load YAML, substituting {@code ${NAME}} and {@code ${NAME:default}} placeholders first.
     */
    public static TradingConfig load(Path path, UnaryOperator<String> env) throws IOException {
        if (!Files.exists(path)) {
            return new TradingConfig();
        }
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        return parse(resolvePlaceholders(raw, env));
    }

    public static TradingConfig parse(String yaml) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        TradingConfig config = mapper.readValue(yaml, TradingConfig.class);
        return config != null ? config : new TradingConfig();
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writeValue(path.toFile(), this);
    }

    public static Path defaultPath() {
        String override = System.getProperty("autopilot.config");
        if (isBlank(override)) {
            override = System.getenv("AUTOPILOT_CONFIG");
        }
        if (!isBlank(override)) {
            return Path.of(override);
        }
        return Path.of(System.getProperty("user.home"), ".autopilot", "config.yaml");
    }

    static String resolvePlaceholders(String text, UnaryOperator<String> env) {
        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = env.apply(m.group(1));
            if (value == null) {
                value = m.group(2) != null ? m.group(2) : "";
            }
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExchangeConfig {
        private String baseUrl = "https://api.pionex.com";
        private String apiKey;
        private String apiSecret;
        private String dialect = "spot";
        private String quoteCurrency = "USDT";
        private String leveragePath = "/api/v1/account/leverage";
        private int connectTimeoutSeconds = 10;
        private int timeoutSeconds = 30;
        private int retryAttempts = 3;
        private double retryBackoff = 1.5;
        private long rateLimitDelayMs = 100;
        private int maxRateLimitRetries = 5;
        private long defaultRetryAfterSeconds = 60;
        private long clockSyncIntervalMs = 60_000;
        private boolean websocketEnabled = true;
        private List<String> websocketUrls = new ArrayList<>(List.of(
                "wss://ws.pionex.com/ws",
                "wss://api.pionex.com/ws",
                "wss://api.pionex.com/stream",
                "wss://ws.pionex.com"));
        private long reconnectDelayMs = 5000;
        private int maxReconnectAttempts = 10;
        private long priceStalenessMs = 10_000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiSecret() { return apiSecret; }
        public void setApiSecret(String apiSecret) { this.apiSecret = apiSecret; }

        public String getDialect() { return dialect; }
        public void setDialect(String dialect) { this.dialect = dialect; }

        public String getQuoteCurrency() { return quoteCurrency; }
        public void setQuoteCurrency(String quoteCurrency) { this.quoteCurrency = quoteCurrency; }

        public String getLeveragePath() { return leveragePath; }
        public void setLeveragePath(String leveragePath) { this.leveragePath = leveragePath; }

        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int v) { this.connectTimeoutSeconds = v; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int v) { this.timeoutSeconds = v; }

        public int getRetryAttempts() { return retryAttempts; }
        public void setRetryAttempts(int v) { this.retryAttempts = v; }

        public double getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(double v) { this.retryBackoff = v; }

        public long getRateLimitDelayMs() { return rateLimitDelayMs; }
        public void setRateLimitDelayMs(long v) { this.rateLimitDelayMs = v; }

        public int getMaxRateLimitRetries() { return maxRateLimitRetries; }
        public void setMaxRateLimitRetries(int v) { this.maxRateLimitRetries = v; }

        public long getDefaultRetryAfterSeconds() { return defaultRetryAfterSeconds; }
        public void setDefaultRetryAfterSeconds(long v) { this.defaultRetryAfterSeconds = v; }

        public long getClockSyncIntervalMs() { return clockSyncIntervalMs; }
        public void setClockSyncIntervalMs(long v) { this.clockSyncIntervalMs = v; }

        public boolean isWebsocketEnabled() { return websocketEnabled; }
        public void setWebsocketEnabled(boolean v) { this.websocketEnabled = v; }

        public List<String> getWebsocketUrls() { return websocketUrls; }
        public void setWebsocketUrls(List<String> v) { this.websocketUrls = v; }

        public long getReconnectDelayMs() { return reconnectDelayMs; }
        public void setReconnectDelayMs(long v) { this.reconnectDelayMs = v; }

        public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
        public void setMaxReconnectAttempts(int v) { this.maxReconnectAttempts = v; }

        public long getPriceStalenessMs() { return priceStalenessMs; }
        public void setPriceStalenessMs(long v) { this.priceStalenessMs = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PaperConfig {
        private boolean enabled;
        private double initialBalance = 10000.0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getInitialBalance() { return initialBalance; }
        public void setInitialBalance(double initialBalance) { this.initialBalance = initialBalance; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TradingSection {
        private String pair = "BTC_USDT";
        private String strategy = "ADVANCED";
        private String interval = "5M";
        private String higherInterval = "1H";
        private int candleLimit = 100;
        private int leverage = 10;
        private MarginMode marginMode = MarginMode.ISOLATED;
        private OrderType orderType = OrderType.MARKET;
        private TimeInForce timeInForce = TimeInForce.IOC;
        private double minBalance = 10;
        private int heartbeatIntervalSeconds = 60;
        private int errorBackoffSeconds = 30;
        private int strategyTimeoutSeconds = 30;
        private int joinTimeoutSeconds = 10;
        private int restartDelaySeconds = 2;
        private String dataDir = Path.of(System.getProperty("user.home"), ".autopilot").toString();

        public String getPair() { return pair; }
        public void setPair(String pair) { this.pair = pair; }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public String getInterval() { return interval; }
        public void setInterval(String interval) { this.interval = interval; }

        public String getHigherInterval() { return higherInterval; }
        public void setHigherInterval(String higherInterval) { this.higherInterval = higherInterval; }

        public int getCandleLimit() { return candleLimit; }
        public void setCandleLimit(int candleLimit) { this.candleLimit = candleLimit; }

        public int getLeverage() { return leverage; }
        public void setLeverage(int leverage) { this.leverage = leverage; }

        public MarginMode getMarginMode() { return marginMode; }
        public void setMarginMode(MarginMode marginMode) { this.marginMode = marginMode; }

        public OrderType getOrderType() { return orderType; }
        public void setOrderType(OrderType orderType) { this.orderType = orderType; }

        public TimeInForce getTimeInForce() { return timeInForce; }
        public void setTimeInForce(TimeInForce timeInForce) { this.timeInForce = timeInForce; }

        public double getMinBalance() { return minBalance; }
        public void setMinBalance(double minBalance) { this.minBalance = minBalance; }

        public int getHeartbeatIntervalSeconds() { return heartbeatIntervalSeconds; }
        public void setHeartbeatIntervalSeconds(int v) { this.heartbeatIntervalSeconds = v; }

        public int getErrorBackoffSeconds() { return errorBackoffSeconds; }
        public void setErrorBackoffSeconds(int v) { this.errorBackoffSeconds = v; }

        public int getStrategyTimeoutSeconds() { return strategyTimeoutSeconds; }
        public void setStrategyTimeoutSeconds(int v) { this.strategyTimeoutSeconds = v; }

        public int getJoinTimeoutSeconds() { return joinTimeoutSeconds; }
        public void setJoinTimeoutSeconds(int v) { this.joinTimeoutSeconds = v; }

        public int getRestartDelaySeconds() { return restartDelaySeconds; }
        public void setRestartDelaySeconds(int v) { this.restartDelaySeconds = v; }

        public String getDataDir() { return dataDir; }
        public void setDataDir(String dataDir) { this.dataDir = dataDir; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TradingHoursConfig {
        private boolean enabled;
        private String start = "19:30";
        private String end = "01:30";
        private String timezone = "UTC-5";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getStart() { return start; }
        public void setStart(String start) { this.start = start; }

        public String getEnd() { return end; }
        public void setEnd(String end) { this.end = end; }

        public String getTimezone() { return timezone; }
        public void setTimezone(String timezone) { this.timezone = timezone; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StrategyConfig {
        private int rsiPeriod = 14;
        private double rsiOverbought = 70;
        private double rsiOversold = 30;
        private double positionSize = 0.1;
        private double stopLossPercent = 1.5;
        private double takeProfitPercent = 2.5;
        private int volumeEmaPeriod = 20;
        private double volumeMultiplier = 1.5;
        private int emaPeriod = 20;
        private int macdFast = 12;
        private int macdSlow = 26;
        private int macdSignal = 9;
        private int bollingerPeriod = 20;
        private double bollingerStdDev = 2.0;
        private int gridLevels = 10;
        private double gridSpacing = 0.01;
        private int gridAnchorPeriod = 20;
        private double dcaAmount = 100;
        private int breakoutLookback = 20;
        private double breakoutBufferPercent = 1.0;
        private RsiFilterConfig rsiFilter = new RsiFilterConfig();

        public StrategyParameters toParameters() {
            return StrategyParameters.builder()
                    .rsiPeriod(rsiPeriod).rsiOverbought(rsiOverbought).rsiOversold(rsiOversold)
                    .positionSize(positionSize).stopLossPercent(stopLossPercent).takeProfitPercent(takeProfitPercent)
                    .volumeEmaPeriod(volumeEmaPeriod).volumeMultiplier(volumeMultiplier)
                    .emaPeriod(emaPeriod).macd(macdFast, macdSlow, macdSignal)
                    .bollinger(bollingerPeriod, bollingerStdDev)
                    .gridLevels(gridLevels).gridSpacing(gridSpacing).gridAnchorPeriod(gridAnchorPeriod)
                    .dcaAmount(dcaAmount)
                    .breakoutLookback(breakoutLookback).breakoutBufferPercent(breakoutBufferPercent)
                    .rsiFilter(rsiFilter.toSettings())
                    .build();
        }

        public int getRsiPeriod() { return rsiPeriod; }
        public void setRsiPeriod(int v) { this.rsiPeriod = v; }

        public double getRsiOverbought() { return rsiOverbought; }
        public void setRsiOverbought(double v) { this.rsiOverbought = v; }

        public double getRsiOversold() { return rsiOversold; }
        public void setRsiOversold(double v) { this.rsiOversold = v; }

        public double getPositionSize() { return positionSize; }
        public void setPositionSize(double v) { this.positionSize = v; }

        public double getStopLossPercent() { return stopLossPercent; }
        public void setStopLossPercent(double v) { this.stopLossPercent = v; }

        public double getTakeProfitPercent() { return takeProfitPercent; }
        public void setTakeProfitPercent(double v) { this.takeProfitPercent = v; }

        public int getVolumeEmaPeriod() { return volumeEmaPeriod; }
        public void setVolumeEmaPeriod(int v) { this.volumeEmaPeriod = v; }

        public double getVolumeMultiplier() { return volumeMultiplier; }
        public void setVolumeMultiplier(double v) { this.volumeMultiplier = v; }

        public int getEmaPeriod() { return emaPeriod; }
        public void setEmaPeriod(int v) { this.emaPeriod = v; }

        public int getMacdFast() { return macdFast; }
        public void setMacdFast(int v) { this.macdFast = v; }

        public int getMacdSlow() { return macdSlow; }
        public void setMacdSlow(int v) { this.macdSlow = v; }

        public int getMacdSignal() { return macdSignal; }
        public void setMacdSignal(int v) { this.macdSignal = v; }

        public int getBollingerPeriod() { return bollingerPeriod; }
        public void setBollingerPeriod(int v) { this.bollingerPeriod = v; }

        public double getBollingerStdDev() { return bollingerStdDev; }
        public void setBollingerStdDev(double v) { this.bollingerStdDev = v; }

        public int getGridLevels() { return gridLevels; }
        public void setGridLevels(int v) { this.gridLevels = v; }

        public double getGridSpacing() { return gridSpacing; }
        public void setGridSpacing(double v) { this.gridSpacing = v; }

        public int getGridAnchorPeriod() { return gridAnchorPeriod; }
        public void setGridAnchorPeriod(int v) { this.gridAnchorPeriod = v; }

        public double getDcaAmount() { return dcaAmount; }
        public void setDcaAmount(double v) { this.dcaAmount = v; }

        public int getBreakoutLookback() { return breakoutLookback; }
        public void setBreakoutLookback(int v) { this.breakoutLookback = v; }

        public double getBreakoutBufferPercent() { return breakoutBufferPercent; }
        public void setBreakoutBufferPercent(double v) { this.breakoutBufferPercent = v; }

        public RsiFilterConfig getRsiFilter() { return rsiFilter; }
        public void setRsiFilter(RsiFilterConfig v) { this.rsiFilter = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RsiFilterConfig {
        private boolean enabled;
        private RsiFilter.Mode mode = RsiFilter.Mode.NORMAL;
        private double longPrimaryMax = 30;
        private double longHigherMax = 50;
        private double shortPrimaryMin = 70;
        private double shortHigherMin = 50;

        @JsonIgnore
        public RsiFilter.Settings toSettings() {
            return new RsiFilter.Settings(enabled, mode, longPrimaryMax, longHigherMax, shortPrimaryMin, shortHigherMin);
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public RsiFilter.Mode getMode() { return mode; }
        public void setMode(RsiFilter.Mode mode) { this.mode = mode; }

        public double getLongPrimaryMax() { return longPrimaryMax; }
        public void setLongPrimaryMax(double v) { this.longPrimaryMax = v; }

        public double getLongHigherMax() { return longHigherMax; }
        public void setLongHigherMax(double v) { this.longHigherMax = v; }

        public double getShortPrimaryMin() { return shortPrimaryMin; }
        public void setShortPrimaryMin(double v) { this.shortPrimaryMin = v; }

        public double getShortHigherMin() { return shortHigherMin; }
        public void setShortHigherMin(double v) { this.shortHigherMin = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExitConfig {
        private double tp1Percent = 2.5;
        private double tp2Percent = 5.0;
        private boolean breakevenEnabled = true;
        private double breakevenPercent = 1.5;
        private boolean trailingEnabled = true;
        private double trailingStepPercent = 0.5;
        private double trailingDistancePercent = 1.0;

        public double getTp1Percent() { return tp1Percent; }
        public void setTp1Percent(double v) { this.tp1Percent = v; }

        public double getTp2Percent() { return tp2Percent; }
        public void setTp2Percent(double v) { this.tp2Percent = v; }

        public boolean isBreakevenEnabled() { return breakevenEnabled; }
        public void setBreakevenEnabled(boolean v) { this.breakevenEnabled = v; }

        public double getBreakevenPercent() { return breakevenPercent; }
        public void setBreakevenPercent(double v) { this.breakevenPercent = v; }

        public boolean isTrailingEnabled() { return trailingEnabled; }
        public void setTrailingEnabled(boolean v) { this.trailingEnabled = v; }

        public double getTrailingStepPercent() { return trailingStepPercent; }
        public void setTrailingStepPercent(double v) { this.trailingStepPercent = v; }

        public double getTrailingDistancePercent() { return trailingDistancePercent; }
        public void setTrailingDistancePercent(double v) { this.trailingDistancePercent = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RiskConfig {
        private double maxDailyLoss = 500;
        private int maxDailyTrades = 50;
        private double minConfidence = 0.6;
        private double marginBuffer = 1.2;
        private double maxConcentration = 0.8;
        private double minLiquidationDistance = 0.1;
        private int maxPositionsToReduce = 2;
        private boolean autoReduce;

        public double getMaxDailyLoss() { return maxDailyLoss; }
        public void setMaxDailyLoss(double v) { this.maxDailyLoss = v; }

        public int getMaxDailyTrades() { return maxDailyTrades; }
        public void setMaxDailyTrades(int v) { this.maxDailyTrades = v; }

        public double getMinConfidence() { return minConfidence; }
        public void setMinConfidence(double v) { this.minConfidence = v; }

        public double getMarginBuffer() { return marginBuffer; }
        public void setMarginBuffer(double v) { this.marginBuffer = v; }

        public double getMaxConcentration() { return maxConcentration; }
        public void setMaxConcentration(double v) { this.maxConcentration = v; }

        public double getMinLiquidationDistance() { return minLiquidationDistance; }
        public void setMinLiquidationDistance(double v) { this.minLiquidationDistance = v; }

        public int getMaxPositionsToReduce() { return maxPositionsToReduce; }
        public void setMaxPositionsToReduce(int v) { this.maxPositionsToReduce = v; }

        public boolean isAutoReduce() { return autoReduce; }
        public void setAutoReduce(boolean v) { this.autoReduce = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WatchdogConfig {
        private boolean enabled = true;
        private int intervalSeconds = 60;
        private int maxFailures = 3;
        private boolean autoRestart = true;
        private int maxRestarts = 5;
        private int restartSanityThreshold = 10;
        private int heartbeatTimeoutSeconds = 300;
        private long memoryThresholdMb = 512;
        private double cpuThresholdPercent = 80;
        private String heartbeatFile = "heartbeat.json";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }

        public int getIntervalSeconds() { return intervalSeconds; }
        public void setIntervalSeconds(int v) { this.intervalSeconds = v; }

        public int getMaxFailures() { return maxFailures; }
        public void setMaxFailures(int v) { this.maxFailures = v; }

        public boolean isAutoRestart() { return autoRestart; }
        public void setAutoRestart(boolean v) { this.autoRestart = v; }

        public int getMaxRestarts() { return maxRestarts; }
        public void setMaxRestarts(int v) { this.maxRestarts = v; }

        public int getRestartSanityThreshold() { return restartSanityThreshold; }
        public void setRestartSanityThreshold(int v) { this.restartSanityThreshold = v; }

        public int getHeartbeatTimeoutSeconds() { return heartbeatTimeoutSeconds; }
        public void setHeartbeatTimeoutSeconds(int v) { this.heartbeatTimeoutSeconds = v; }

        public long getMemoryThresholdMb() { return memoryThresholdMb; }
        public void setMemoryThresholdMb(long v) { this.memoryThresholdMb = v; }

        public double getCpuThresholdPercent() { return cpuThresholdPercent; }
        public void setCpuThresholdPercent(double v) { this.cpuThresholdPercent = v; }

        public String getHeartbeatFile() { return heartbeatFile; }
        public void setHeartbeatFile(String v) { this.heartbeatFile = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NotificationConfig {
        private boolean enabled = true;
        private boolean trades = true;
        private boolean errors = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }

        public boolean isTrades() { return trades; }
        public void setTrades(boolean v) { this.trades = v; }

        public boolean isErrors() { return errors; }
        public void setErrors(boolean v) { this.errors = v; }
    }

    /**
     * One independently supervised trading instance. Unset fields inherit from the trading section.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InstanceConfig {
        private String id;
        private String pair;
        private String strategy;
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getPair() { return pair; }
        public void setPair(String pair) { this.pair = pair; }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
