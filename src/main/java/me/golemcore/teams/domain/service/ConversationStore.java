package me.golemcore.teams.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.exception.ConversationStoreException;
import me.golemcore.teams.domain.exception.TaskNotFoundException;
import me.golemcore.teams.domain.model.ConversationEntry;
import me.golemcore.teams.domain.model.ConversationRecord;
import me.golemcore.teams.domain.model.TaskEvent;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable append-only conversation log, one JSONL file per task.
 *
 * <p>
 * Every {@link #append(ConversationEntry)} writes exactly one line and forces it
 * to disk before returning, so an acknowledged entry survives a restart. Writes
 * are serialized per task through a per-task lock; different tasks append
 * concurrently. The store also re-checks that sequence numbers stay gapless,
 * independently of the caller's in-memory record.
 *
 * <p>
 * The last sequence number of a task is cached until its terminal event is
 * written. A failed write drops the cache, so the next append re-reads the file
 * and starts a fresh line after whatever fragment the failure left behind.
 *
 * <p>
 * Waiting on the storage future is uninterruptible: a cancelled task still gets
 * its final entries on disk.
 */
@Service
@Slf4j
public class ConversationStore {

    private static final String SUFFIX = ".jsonl";
    private static final int LOCK_STRIPES = 64;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final Object[] locks = new Object[LOCK_STRIPES];
    private final Map<String, Long> lastSeqByTask = new ConcurrentHashMap<>();
    private final Map<String, Boolean> tornTail = new ConcurrentHashMap<>();

    public ConversationStore(StoragePort storagePort, ObjectMapper objectMapper, TeamsProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = properties.getStorage().getTasksDirectory();
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    public void append(ConversationEntry entry) {
        String taskId = entry.taskId();
        synchronized (lockFor(taskId)) {
            long last = lastSeqByTask.computeIfAbsent(taskId, this::readLastSeq);
            if (entry.seq() != last + 1) {
                throw new ConversationStoreException("Task " + taskId + " expected seq " + (last + 1)
                        + " but got " + entry.seq());
            }
            String line;
            try {
                line = objectMapper.writeValueAsString(entry) + "\n";
                if (Boolean.TRUE.equals(tornTail.remove(taskId))) {
                    line = "\n" + line;
                }
            } catch (JsonProcessingException e) {
                throw new ConversationStoreException("Failed to serialize entry " + entry.seq()
                        + " of task " + taskId, e);
            }
            try {
                await(storagePort.appendTextDurable(directory, fileName(taskId), line),
                        "append to task " + taskId);
            } catch (ConversationStoreException e) {
                forget(taskId);
                throw e;
            }
            log.trace("[Store] {}#{} {}", taskId, entry.seq(), entry.getClass().getSimpleName());
            if (entry instanceof TaskEvent event && event.status() != null && event.status().isTerminal()) {
                forget(taskId);
            } else {
                lastSeqByTask.put(taskId, entry.seq());
            }
        }
    }

    public boolean exists(String taskId) {
        Boolean exists = await(storagePort.exists(directory, fileName(taskId)), "check task " + taskId);
        return Boolean.TRUE.equals(exists);
    }

    /**
     * Loads and re-validates a task's log. A torn line left by a crash in the
     * middle of a write was never acknowledged and is dropped; any lost
     * acknowledged entry shows up as a sequence gap and fails the load.
     */
    public ConversationRecord load(String taskId) {
        synchronized (lockFor(taskId)) {
            String text = await(storagePort.getText(directory, fileName(taskId)), "read task " + taskId);
            if (text == null) {
                throw new TaskNotFoundException(taskId);
            }
            List<ConversationEntry> entries = parseEntries(taskId, text);
            try {
                return ConversationRecord.of(taskId, entries);
            } catch (IllegalStateException e) {
                throw new ConversationStoreException("Corrupt conversation log for task " + taskId, e);
            }
        }
    }

    /**
     * Ids of every task with a stored log, sorted.
     */
    public List<String> listTaskIds() {
        List<String> files = await(storagePort.listObjects(directory, ""), "list tasks");
        List<String> ids = new ArrayList<>();
        for (String file : files) {
            if (file.endsWith(SUFFIX) && !file.contains("/")) {
                ids.add(file.substring(0, file.length() - SUFFIX.length()));
            }
        }
        return ids;
    }

    private List<ConversationEntry> parseEntries(String taskId, String text) {
        String[] lines = text.split("\n");
        List<ConversationEntry> entries = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, ConversationEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("[Store] Dropping torn line {} of task {}: {}", i + 1, taskId, e.getOriginalMessage());
            }
        }
        return entries;
    }

    private long readLastSeq(String taskId) {
        String text = await(storagePort.getText(directory, fileName(taskId)), "read task " + taskId);
        if (text == null || text.isEmpty()) {
            return 0L;
        }
        if (!text.endsWith("\n")) {
            tornTail.put(taskId, Boolean.TRUE);
        }
        List<ConversationEntry> entries = parseEntries(taskId, text);
        return entries.isEmpty() ? 0L : entries.get(entries.size() - 1).seq();
    }

    private void forget(String taskId) {
        lastSeqByTask.remove(taskId);
        tornTail.remove(taskId);
    }

    private Object lockFor(String taskId) {
        return locks[Math.floorMod(taskId.hashCode(), locks.length)];
    }

    private static String fileName(String taskId) {
        return taskId + SUFFIX;
    }

    private static <T> T await(CompletableFuture<T> future, String action) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConversationStoreException("Storage failed to " + action + ": " + cause.getMessage(), cause);
        }
    }
}
