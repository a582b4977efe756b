package me.golemcore.steward.domain.service;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.steward.domain.model.AuditEntry;
import me.golemcore.steward.domain.model.AuditStatus;
import me.golemcore.steward.domain.model.InboxStatus;
import me.golemcore.steward.domain.model.ProcessedIndexEntry;
import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import me.golemcore.steward.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only staging area for context updates.
 *
 * <p>
 * Every update is written to {@code inbox/pending/} before anything else
 * happens. Processing moves the entry to {@code inbox/processed/} and records
 * it in {@code processed/index.json}; entries are never deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditInbox {

    private static final String LOCK_NAME = "inbox";
    private static final String JSON_SUFFIX = ".json";
    private static final int RECENT_LIMIT = 5;
    private static final TypeReference<List<ProcessedIndexEntry>> INDEX_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final StewardProperties properties;
    private final Clock clock;

    public AuditEntry submit(ProjectLayout layout, String target, String intent, String content, String sessionId) {
        AuditEntry entry = AuditEntry.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(Instant.now(clock))
                .target(target)
                .intent(intent)
                .content(content)
                .sessionId(sessionId)
                .status(AuditStatus.PENDING)
                .build();
        writeJson(layout, pendingPath(entry.getId()), entry);
        log.debug("[Inbox] Staged {} for {} (session {})", entry.getId(), target, sessionId);
        return entry;
    }

    /**
     * Move a pending entry to the processed area.
     *
     * @throws IllegalStateException
     *             if the entry is unknown or already processed
     */
    public AuditEntry markProcessed(ProjectLayout layout, String id) {
        return storagePort.withExclusiveLock(layout.stateRoot(), layout.lockFile(LOCK_NAME),
                properties.getContext().getLockTimeout(), () -> {
                    Optional<AuditEntry> pending = read(layout, pendingPath(id));
                    if (pending.isEmpty()) {
                        boolean processed = Boolean.TRUE.equals(
                                storagePort.exists(layout.stateRoot(), processedPath(id)).join());
                        throw new IllegalStateException(processed
                                ? "Audit entry already processed: " + id
                                : "Unknown audit entry: " + id);
                    }

                    AuditEntry entry = pending.get();
                    if (entry.getStatus() != AuditStatus.PENDING) {
                        throw new IllegalStateException("Audit entry is not pending: " + id);
                    }
                    entry.setStatus(AuditStatus.PROCESSED);
                    entry.setProcessedAt(Instant.now(clock));

                    writeJson(layout, processedPath(id), entry);
                    storagePort.deleteObject(layout.stateRoot(), pendingPath(id)).join();

                    List<ProcessedIndexEntry> index = new ArrayList<>(readIndex(layout));
                    index.add(ProcessedIndexEntry.of(entry));
                    writeJson(layout, ProjectLayout.INBOX_INDEX_FILE, index);

                    log.debug("[Inbox] Processed {}", id);
                    return entry;
                });
    }

    public Optional<AuditEntry> find(ProjectLayout layout, String id) {
        Optional<AuditEntry> pending = read(layout, pendingPath(id));
        return pending.isPresent() ? pending : read(layout, processedPath(id));
    }

    public InboxStatus status(ProjectLayout layout) {
        int pending = countEntries(layout, ProjectLayout.INBOX_PENDING_DIR);
        List<ProcessedIndexEntry> index = readIndex(layout);
        List<ProcessedIndexEntry> recent = new ArrayList<>(index.subList(Math.max(0, index.size() - RECENT_LIMIT),
                index.size()));
        Collections.reverse(recent);
        return InboxStatus.builder()
                .pendingCount(pending)
                .processedCount(countEntries(layout, ProjectLayout.INBOX_PROCESSED_DIR))
                .recentProcessed(recent)
                .build();
    }

    private int countEntries(ProjectLayout layout, String dir) {
        String indexName = ProjectLayout.INBOX_INDEX_FILE;
        return (int) storagePort.listObjects(layout.stateRoot(), dir).join().stream()
                .filter(p -> p.endsWith(JSON_SUFFIX))
                .filter(p -> !p.equals(indexName))
                .count();
    }

    private List<ProcessedIndexEntry> readIndex(ProjectLayout layout) {
        String json = storagePort.getText(layout.stateRoot(), ProjectLayout.INBOX_INDEX_FILE).join();
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(json, INDEX_TYPE);
        } catch (JsonProcessingException e) {
            // the processed/*.json entries remain the source of truth
            log.warn("[Inbox] Corrupt processed index, starting a new one: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private Optional<AuditEntry> read(ProjectLayout layout, String path) {
        String json = storagePort.getText(layout.stateRoot(), path).join();
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, AuditEntry.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt audit entry " + path, e);
        }
    }

    private void writeJson(ProjectLayout layout, String path, Object value) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            storagePort.putTextAtomic(layout.stateRoot(), path, json).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + path, e);
        }
    }

    private static String pendingPath(String id) {
        return ProjectLayout.INBOX_PENDING_DIR + "/" + id + JSON_SUFFIX;
    }

    private static String processedPath(String id) {
        return ProjectLayout.INBOX_PROCESSED_DIR + "/" + id + JSON_SUFFIX;
    }
}
