package me.golemcore.teams.domain.model;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered in-memory log of one task. Every append is checked against the log
 * invariants: gapless {@code seq} starting at 1, one result per known tool
 * call, and monotonic task status. A violating entry is rejected with
 * {@link IllegalStateException} and the record stays unchanged.
 *
 * <p>
 * Not thread-safe; a record is owned by the single control flow running its
 * task.
 */
public class ConversationRecord {

    private final String taskId;
    private final List<ConversationEntry> entries = new ArrayList<>();
    private final Map<String, ToolCall> openCalls = new LinkedHashMap<>();
    private final Map<String, ToolResult> results = new LinkedHashMap<>();
    private TaskEvent created;
    private TaskEvent lastEvent;

    public ConversationRecord(String taskId) {
        this.taskId = taskId;
    }

    /**
     * Rebuilds a record from persisted entries, re-validating every invariant.
     */
    public static ConversationRecord of(String taskId, List<? extends ConversationEntry> entries) {
        ConversationRecord record = new ConversationRecord(taskId);
        for (ConversationEntry entry : entries) {
            record.append(entry);
        }
        return record;
    }

    public String getTaskId() {
        return taskId;
    }

    public long nextSeq() {
        return entries.size() + 1L;
    }

    public long lastSeq() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<ConversationEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public void append(ConversationEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry is null");
        }
        if (!taskId.equals(entry.taskId())) {
            throw new IllegalStateException("Entry for task " + entry.taskId() + " appended to " + taskId);
        }
        if (entry.seq() != nextSeq()) {
            throw new IllegalStateException("Task " + taskId + " expected seq " + nextSeq() + " but got "
                    + entry.seq());
        }
        if (entry instanceof ToolCall call) {
            checkCall(call);
            openCalls.put(call.callId(), call);
        } else if (entry instanceof ToolResult result) {
            checkResult(result);
            openCalls.remove(result.callId());
            results.put(result.callId(), result);
        } else if (entry instanceof TaskEvent event) {
            checkEvent(event);
            if (created == null) {
                created = event;
            }
            lastEvent = event;
        }
        entries.add(entry);
    }

    private void checkCall(ToolCall call) {
        if (call.callId() == null || openCalls.containsKey(call.callId()) || results.containsKey(call.callId())) {
            throw new IllegalStateException("Duplicate tool call id " + call.callId() + " in task " + taskId);
        }
    }

    private void checkResult(ToolResult result) {
        if (results.containsKey(result.callId())) {
            throw new IllegalStateException("Tool call " + result.callId() + " already has a result");
        }
        if (!openCalls.containsKey(result.callId())) {
            throw new IllegalStateException("Result for unknown tool call " + result.callId());
        }
    }

    private void checkEvent(TaskEvent event) {
        if (lastEvent == null) {
            if (event.status() != TaskStatus.PENDING) {
                throw new IllegalStateException("Task " + taskId + " must start PENDING, got " + event.status());
            }
            return;
        }
        if (!lastEvent.status().canTransitionTo(event.status())) {
            throw new IllegalStateException("Task " + taskId + " cannot move from " + lastEvent.status() + " to "
                    + event.status());
        }
    }

    /**
     * Current status projected from the latest task event.
     */
    public TaskStatus status() {
        return lastEvent != null ? lastEvent.status() : TaskStatus.PENDING;
    }

    public boolean isTerminal() {
        return status().isTerminal();
    }

    public Optional<TaskEvent> creationEvent() {
        return Optional.ofNullable(created);
    }

    public Optional<TaskEvent> lastEvent() {
        return Optional.ofNullable(lastEvent);
    }

    /**
     * Tool calls still waiting for their result, in issue order.
     */
    public List<ToolCall> danglingCalls() {
        return List.copyOf(openCalls.values());
    }

    public Optional<ToolResult> resultFor(String callId) {
        return Optional.ofNullable(results.get(callId));
    }

    /**
     * History as seen by one agent: broadcast entries plus notices addressed to
     * it, in global order.
     */
    public List<ConversationEntry> visibleTo(String agentName) {
        List<ConversationEntry> visible = new ArrayList<>();
        for (ConversationEntry entry : entries) {
            if (entry.visibleTo(agentName)) {
                visible.add(entry);
            }
        }
        return visible;
    }

    /**
     * Highest agent step number recorded so far.
     */
    public int turnCount() {
        int turns = 0;
        for (ConversationEntry entry : entries) {
            if (entry instanceof Message message) {
                turns = Math.max(turns, message.turn());
            } else if (entry instanceof ToolCall call) {
                turns = Math.max(turns, call.turn());
            }
        }
        return turns;
    }

    public <T extends ConversationEntry> List<T> entriesOf(Class<T> type) {
        List<T> matching = new ArrayList<>();
        for (ConversationEntry entry : entries) {
            if (type.isInstance(entry)) {
                matching.add(type.cast(entry));
            }
        }
        return matching;
    }

    /**
     * Task view derived from the task events.
     */
    public Task toTask() {
        Task.TaskBuilder builder = Task.builder().id(taskId).status(status());
        if (created != null) {
            builder.description(created.description())
                    .teamName(created.teamName())
                    .createdAt(created.timestamp());
        }
        if (lastEvent != null) {
            builder.failureReason(lastEvent.failureReason()).summary(lastEvent.summary());
        }
        return builder.build();
    }

    /**
     * Outcome of a finished task, empty while the task is still open.
     */
    public Optional<TaskOutcome> outcome() {
        if (lastEvent == null || !lastEvent.status().isTerminal()) {
            return Optional.empty();
        }
        return Optional.of(new TaskOutcome(taskId, lastEvent.status(), lastEvent.failureReason(),
                lastEvent.summary(), turnCount()));
    }
}
