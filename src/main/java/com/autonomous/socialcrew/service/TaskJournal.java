package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskEvent;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Appends every task snapshot to {@code tasks.jsonl} so the store can be rebuilt after a restart.
 * The last line written for a task id wins on replay.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "orchestrator.journal.enabled", havingValue = "true")
public class TaskJournal implements TaskTransitionListener {

    private static final String JOURNAL_FILE = "tasks.jsonl";

    @Value("${orchestrator.journal.path:data}")
    private String dataPath;

    private final ObjectMapper mapper;

    public TaskJournal() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    @Override
    public synchronized void onTaskEvent(Task snapshot, TaskEvent event) {
        try {
            Path journalFile = Paths.get(dataPath, JOURNAL_FILE);
            Files.createDirectories(journalFile.getParent());

            String json = mapper.writeValueAsString(snapshot);
            Files.writeString(journalFile, json + "\n",
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to journal task " + snapshot.getId(), e);
        }
    }

    /**
     * Latest journaled snapshot of every task, in journal order.
     */
    public synchronized List<Task> replay() {
        Path journalFile = Paths.get(dataPath, JOURNAL_FILE);
        if (!Files.exists(journalFile)) {
            return List.of();
        }

        Map<String, Task> latest = new LinkedHashMap<>();
        try (Stream<String> lines = Files.lines(journalFile)) {
            lines.filter(line -> !line.isBlank()).forEach(line -> {
                try {
                    Task task = mapper.readValue(line, Task.class);
                    latest.put(task.getId(), task);
                } catch (IOException e) {
                    log.warn("Skipping malformed journal line: {}", e.getMessage());
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read task journal " + journalFile, e);
        }
        log.info("Replayed {} tasks from {}", latest.size(), journalFile);
        return List.copyOf(latest.values());
    }
}
