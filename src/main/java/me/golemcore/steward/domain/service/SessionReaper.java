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

import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.domain.model.Session;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import me.golemcore.steward.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Removes abandoned sessions and expired archives.
 *
 * <p>
 * Runs on a cadence tracked by {@code sessions/last-cleanup}. Every step
 * tolerates files vanishing underneath it, so running twice (or next to a
 * concurrent clock-in) is harmless.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionReaper {

    private final StoragePort storagePort;
    private final ActiveSessionStore sessionStore;
    private final SessionRegistry sessionRegistry;
    private final StewardProperties properties;
    private final Clock clock;

    /**
     * Summary of one sweep.
     */
    public record ReapReport(List<String> removedSessions, List<String> removedArchives) {
    }

    /**
     * Reap if the configured interval has passed since the last sweep.
     *
     * @return the report, or empty when the sweep was not due
     */
    public Optional<ReapReport> sweepIfDue(ProjectLayout layout) {
        Instant now = Instant.now(clock);
        Optional<Instant> last = readLastCleanup(layout);
        if (last.isPresent() && last.get().plus(properties.getSessions().getCleanupInterval()).isAfter(now)) {
            return Optional.empty();
        }
        ReapReport report = reap(layout);
        storagePort.putTextAtomic(layout.stateRoot(), ProjectLayout.LAST_CLEANUP_FILE, now.toString()).join();
        return Optional.of(report);
    }

    public ReapReport reap(ProjectLayout layout) {
        Instant now = Instant.now(clock);
        Instant sessionCutoff = now.minus(properties.getSessions().getStaleAfter());
        Instant archiveCutoff = now.minus(properties.getSessions().getArchiveRetention());

        List<String> removedSessions = new ArrayList<>();
        for (String sessionId : sessionStore.listSessionIds(layout)) {
            try {
                Optional<Instant> startedAt = sessionStart(layout, sessionId);
                if (startedAt.isPresent() && startedAt.get().isBefore(sessionCutoff)) {
                    sessionStore.delete(layout, sessionId);
                    removedSessions.add(sessionId);
                }
            } catch (RuntimeException e) { // NOSONAR - a concurrent clock-out may remove it first
                log.debug("[Session] Reaper skipped {}: {}", sessionId, e.getMessage());
            }
        }
        if (!removedSessions.isEmpty()) {
            sessionRegistry.removeAll(layout, removedSessions);
        }

        List<String> removedArchives = new ArrayList<>();
        for (String archive : storagePort.listObjects(layout.stateRoot(), ProjectLayout.ARCHIVE_DIR).join()) {
            try {
                Instant modified = storagePort.lastModified(layout.stateRoot(), archive).join();
                if (modified.isBefore(archiveCutoff)) {
                    storagePort.deleteObject(layout.stateRoot(), archive).join();
                    removedArchives.add(archive);
                }
            } catch (RuntimeException e) { // NOSONAR - already gone
                log.debug("[Session] Reaper skipped archive {}: {}", archive, e.getMessage());
            }
        }

        if (!removedSessions.isEmpty() || !removedArchives.isEmpty()) {
            log.info("[Session] Reaped {} stale session(s) and {} expired archive(s) in {}",
                    removedSessions.size(), removedArchives.size(), layout.projectRoot());
        }
        return new ReapReport(removedSessions, removedArchives);
    }

    private Optional<Instant> sessionStart(ProjectLayout layout, String sessionId) {
        try {
            Optional<Session> session = sessionStore.load(layout, sessionId);
            if (session.isPresent() && session.get().getCreatedAt() != null) {
                return Optional.of(session.get().getCreatedAt());
            }
        } catch (RuntimeException e) { // NOSONAR - fall back to the directory timestamp
            log.debug("[Session] Unreadable session {}, using directory time", sessionId);
        }
        return Optional.of(storagePort.lastModified(layout.stateRoot(), layout.sessionDir(sessionId)).join());
    }

    private Optional<Instant> readLastCleanup(ProjectLayout layout) {
        String marker = storagePort.getText(layout.stateRoot(), ProjectLayout.LAST_CLEANUP_FILE).join();
        if (marker == null || marker.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(marker.trim()));
        } catch (DateTimeParseException e) {
            log.warn("[Session] Ignoring malformed cleanup marker: {}", marker.trim());
            return Optional.empty();
        }
    }
}
