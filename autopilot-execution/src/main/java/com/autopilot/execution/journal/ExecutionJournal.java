package com.autopilot.execution.journal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Append-only JSONL daily execution log, shared by all instances of one process.
 * Files: ~/.autopilot/journal/2026-02-08.jsonl
 */
public class ExecutionJournal implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionJournal.class);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Path journalDir;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final List<Consumer<ExecutionEvent>> listeners = new CopyOnWriteArrayList<>();

    private LocalDate currentDate;
    private BufferedWriter currentWriter;

    public ExecutionJournal(Path dataDir) {
        this(dataDir, Clock.systemDefaultZone());
    }

    public ExecutionJournal(Path dataDir, Clock clock) {
        this.journalDir = dataDir.resolve("journal");
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        try {
            Files.createDirectories(journalDir);
        } catch (IOException e) {
            log.error("Failed to create journal directory: {}", journalDir, e);
        }
    }

    /**
     * Appends one event and hands it to subscribers. A write failure is logged, never thrown.
     */
    public void log(ExecutionEvent event) {
        synchronized (this) {
            try {
                ensureWriter();
                currentWriter.write(mapper.writeValueAsString(event));
                currentWriter.newLine();
                currentWriter.flush();
            } catch (IOException e) {
                log.error("Failed to write journal event: {}", e.getMessage());
            }
        }

        for (Consumer<ExecutionEvent> l : listeners) {
            try {
                l.accept(event);
            } catch (Exception e) {
                log.warn("Journal listener error", e);
            }
        }
    }

    public void subscribe(Consumer<ExecutionEvent> listener) {
        listeners.add(listener);
    }

    public List<ExecutionEvent> readToday() {
        return readDate(LocalDate.now(clock));
    }

    /**
     * Reads one day's entries. Lines that no longer parse are skipped.
     */
    public List<ExecutionEvent> readDate(LocalDate date) {
        Path file = fileFor(date);
        List<ExecutionEvent> events = new ArrayList<>();
        if (!Files.exists(file)) return events;

        List<String> lines;
        try {
            lines = Files.readAllLines(file);
        } catch (IOException e) {
            log.error("Failed to read journal file: {}", file, e);
            return events;
        }
        for (String line : lines) {
            if (line.isBlank()) continue;
            try {
                events.add(mapper.readValue(line, ExecutionEvent.class));
            } catch (IOException e) {
                log.warn("Skipping unreadable journal line in {}: {}", file, e.getMessage());
            }
        }
        return events;
    }

    public Path getJournalDir() {
        return journalDir;
    }

    @Override
    public synchronized void close() {
        if (currentWriter != null) {
            try {
                currentWriter.close();
            } catch (IOException e) {
                log.error("Failed to close journal writer", e);
            }
            currentWriter = null;
            currentDate = null;
        }
    }

    private Path fileFor(LocalDate date) {
        return journalDir.resolve(date.format(DATE_FORMAT) + ".jsonl");
    }

    private void ensureWriter() throws IOException {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(currentDate)) {
            if (currentWriter != null) {
                currentWriter.close();
            }
            Files.createDirectories(journalDir);
            currentWriter = Files.newBufferedWriter(fileFor(today),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            currentDate = today;
        }
    }
}
