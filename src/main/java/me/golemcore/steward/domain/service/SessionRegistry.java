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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.domain.model.SessionRegistryEntry;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import me.golemcore.steward.port.outbound.StoragePort;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Registry of live sessions per project, stored in
 * {@code sessions/registry.json}.
 *
 * <p>
 * Every mutation is a read-modify-write under the project's registry lock and
 * ends with an atomic replace of the file. A corrupt registry is rebuilt from
 * the active session directories.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionRegistry {

    private static final String LOCK_NAME = "registry";

    private final StoragePort storagePort;
    private final ActiveSessionStore sessionStore;
    private final ObjectMapper objectMapper;
    private final StewardProperties properties;
    private final Clock clock;

    public Map<String, SessionRegistryEntry> list(ProjectLayout layout) {
        return new LinkedHashMap<>(load(layout).getSessions());
    }

    public void register(ProjectLayout layout, SessionRegistryEntry entry) {
        mutate(layout, sessions -> {
            sessions.put(entry.getSessionId(), entry);
            return true;
        });
        log.debug("[Session] Registered {}", entry.getSessionId());
    }

    public boolean unregister(ProjectLayout layout, String sessionId) {
        return removeAll(layout, List.of(sessionId)) > 0;
    }

    /**
     * Drop several entries in one write.
     *
     * @return number of entries actually removed
     */
    public int removeAll(ProjectLayout layout, Collection<String> sessionIds) {
        int[] removed = new int[1];
        mutate(layout, sessions -> {
            for (String id : sessionIds) {
                if (sessions.remove(id) != null) {
                    removed[0]++;
                }
            }
            return removed[0] > 0;
        });
        return removed[0];
    }

    private void mutate(ProjectLayout layout, Predicate<Map<String, SessionRegistryEntry>> change) {
        storagePort.withExclusiveLock(layout.stateRoot(), layout.lockFile(LOCK_NAME),
                properties.getContext().getLockTimeout(), () -> {
                    RegistryFile registry = load(layout);
                    if (change.test(registry.getSessions()) || registry.isRebuilt()) {
                        persist(layout, registry);
                    }
                    return null;
                });
    }

    private RegistryFile load(ProjectLayout layout) {
        String json = storagePort.getText(layout.stateRoot(), ProjectLayout.REGISTRY_FILE).join();
        if (json == null || json.isBlank()) {
            return new RegistryFile();
        }
        try {
            RegistryFile registry = objectMapper.readValue(json, RegistryFile.class);
            if (registry.getSessions() == null) {
                registry.setSessions(new LinkedHashMap<>());
            }
            return registry;
        } catch (JsonProcessingException e) {
            log.warn("[Session] Corrupt session registry in {}, rebuilding: {}", layout.stateRoot(), e.getMessage());
            return rebuild(layout);
        }
    }

    private RegistryFile rebuild(ProjectLayout layout) {
        RegistryFile registry = new RegistryFile();
        sessionStore.listActive(layout)
                .forEach(session -> registry.getSessions().put(session.getSessionId(),
                        SessionRegistryEntry.of(session)));
        registry.setRebuilt(true);
        return registry;
    }

    private void persist(ProjectLayout layout, RegistryFile registry) {
        try {
            registry.setUpdatedAt(Instant.now(clock));
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(registry);
            storagePort.putTextAtomic(layout.stateRoot(), ProjectLayout.REGISTRY_FILE, json).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to persist session registry", e);
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class RegistryFile {
        private int version = 1;
        private Instant updatedAt;
        private Map<String, SessionRegistryEntry> sessions = new LinkedHashMap<>();

        @JsonIgnore
        private boolean rebuilt;
    }
}
