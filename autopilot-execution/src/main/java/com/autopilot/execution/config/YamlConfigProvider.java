package com.autopilot.execution.config;

import com.autopilot.exchange.model.TradingConfig;
import com.autopilot.execution.spi.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * YAML-file backed configuration with {@code ${VAR}} placeholders resolved from the environment.
 * Readers always receive a deep copy, so a reload never changes a config someone is holding.
 */
public class YamlConfigProvider implements ConfigProvider {

    private static final Logger log = LoggerFactory.getLogger(YamlConfigProvider.class);

    private final Path path;
    private final UnaryOperator<String> env;
    private volatile TradingConfig current;

    public YamlConfigProvider(Path path) throws IOException {
        this(path, System::getenv);
    }

    public YamlConfigProvider(Path path, UnaryOperator<String> env) throws IOException {
        this.path = path;
        this.env = env;
        this.current = read();
    }

    @Override
    public TradingConfig get() {
        return current.copy();
    }

    @Override
    public TradingConfig reload() throws IOException {
        current = read();
        log.info("Reloaded configuration from {}", path);
        return current.copy();
    }

    public Path getPath() {
        return path;
    }

    private TradingConfig read() throws IOException {
        TradingConfig config = TradingConfig.load(path, env);
        List<String> problems = config.validate();
        for (String problem : problems) {
            log.warn("Config {}: {}", path, problem);
        }
        return config;
    }
}
