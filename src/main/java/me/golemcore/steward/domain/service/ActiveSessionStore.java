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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.domain.model.Session;
import me.golemcore.steward.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads and writes {@code sessions/active/<id>/session.json}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActiveSessionStore {

    private static final int SESSION_ID_LENGTH = 8;
    private static final int MAX_ID_ATTEMPTS = 5;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    /**
     * Claim a fresh session directory.
     *
     * @return the new session id
     */
    public String allocateSessionDirectory(ProjectLayout layout) {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String id = UUID.randomUUID().toString().substring(0, SESSION_ID_LENGTH);
            if (Boolean.TRUE.equals(storagePort.createDirectory(layout.stateRoot(), layout.sessionDir(id)).join())) {
                return id;
            }
            log.debug("[Session] Session id collision: {}", id);
        }
        throw new IllegalStateException("Could not allocate a unique session directory");
    }

    public void save(ProjectLayout layout, Session session) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(session);
            storagePort.putTextAtomic(layout.stateRoot(), layout.sessionFile(session.getSessionId()), json).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session " + session.getSessionId(), e);
        }
    }

    /**
     * Load one session.
     *
     * @return empty if the session file does not exist
     * @throws UncheckedIOException
     *             if the file exists but cannot be parsed
     */
    public Optional<Session> load(ProjectLayout layout, String sessionId) {
        String json = storagePort.getText(layout.stateRoot(), layout.sessionFile(sessionId)).join();
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Session.class));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupt session file for " + sessionId, e);
        }
    }

    public boolean directoryExists(ProjectLayout layout, String sessionId) {
        return Boolean.TRUE.equals(storagePort.exists(layout.stateRoot(), layout.sessionDir(sessionId)).join());
    }

    public List<String> listSessionIds(ProjectLayout layout) {
        return storagePort.listDirectories(layout.stateRoot(), ProjectLayout.ACTIVE_SESSIONS_DIR).join();
    }

    /**
     * All readable active sessions. Corrupt or missing session files are
     * logged and skipped.
     */
    public List<Session> listActive(ProjectLayout layout) {
        List<Session> sessions = new ArrayList<>();
        for (String id : listSessionIds(layout)) {
            try {
                load(layout, id).ifPresent(sessions::add);
            } catch (RuntimeException e) { // NOSONAR - one bad session must not hide the others
                log.warn("[Session] Skipping unreadable session {}: {}", id, e.getMessage());
            }
        }
        return sessions;
    }

    public void delete(ProjectLayout layout, String sessionId) {
        storagePort.deleteTree(layout.stateRoot(), layout.sessionDir(sessionId)).join();
    }
}
