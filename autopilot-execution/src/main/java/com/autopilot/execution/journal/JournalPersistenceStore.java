package com.autopilot.execution.journal;

import com.autopilot.execution.spi.PersistenceStore;
import com.autopilot.execution.spi.TradeRecord;
import com.autopilot.execution.spi.UserSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Persistence backed by the execution journal for trades and log lines, and one JSON file per
 * instance for user settings ({@code <dataDir>/settings/<instanceId>.json}).
 */
public class JournalPersistenceStore implements PersistenceStore {

    private static final Logger log = LoggerFactory.getLogger(JournalPersistenceStore.class);

    private final ExecutionJournal journal;
    private final Path settingsDir;
    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public JournalPersistenceStore(ExecutionJournal journal, Path dataDir) {
        this.journal = journal;
        this.settingsDir = dataDir.resolve("settings");
    }

    @Override
    public void appendTrade(TradeRecord trade) {
        journal.log(new TradeEvent(trade));
    }

    @Override
    public void appendLog(String instanceId, String level, String message) {
        journal.log(new LogEvent(instanceId, level, message));
    }

    @Override
    public UserSettings getUserSettings(String instanceId) {
        Path file = settingsFile(instanceId);
        if (!Files.exists(file)) {
            return UserSettings.defaults();
        }
        try {
            return mapper.readValue(file.toFile(), UserSettings.class);
        } catch (IOException e) {
            log.error("Failed to read settings for {} from {}, using defaults", instanceId, file, e);
            return UserSettings.defaults();
        }
    }

    @Override
    public void saveUserSettings(String instanceId, UserSettings settings) {
        Path file = settingsFile(instanceId);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(settingsDir);
            mapper.writeValue(tmp.toFile(), settings);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to save settings for {} to {}", instanceId, file, e);
        }
    }

    public ExecutionJournal getJournal() {
        return journal;
    }

    private Path settingsFile(String instanceId) {
        String safe = instanceId.replaceAll("[^A-Za-z0-9._-]", "_");
        return settingsDir.resolve(safe + ".json");
    }
}
