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
import me.golemcore.steward.domain.model.AuditEntry;
import me.golemcore.steward.domain.model.ContextEvent;
import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Writes anchor-mode events to
 * {@code events/<yyyy-MM-dd>/<HHmmss>-<id>-context_update.json}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnchorEventWriter {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmmss").withZone(ZoneOffset.UTC);
    private static final int SHORT_ID_LENGTH = 8;

    private final StoragePort storagePort;
    private final PersistenceModeSelector modeSelector;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @return the event path relative to the state root
     */
    public String emit(ProjectLayout layout, AuditEntry entry) {
        Instant now = Instant.now(clock);
        String shortId = entry.getId().substring(0, Math.min(SHORT_ID_LENGTH, entry.getId().length()));
        String path = ProjectLayout.EVENTS_DIR + "/" + DAY.format(now) + "/" + TIME.format(now) + "-" + shortId
                + "-" + ContextEvent.TYPE_CONTEXT_UPDATE + ".json";
        modeSelector.assertWritable(layout, path);

        ContextEvent event = ContextEvent.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(now)
                .sessionId(entry.getSessionId())
                .payload(ContextEvent.Payload.builder()
                        .target(entry.getTarget())
                        .intent(entry.getIntent())
                        .content(entry.getContent())
                        .inboxUuid(entry.getId())
                        .build())
                .build();
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(event);
            storagePort.putTextAtomic(layout.stateRoot(), path, json).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event for " + entry.getId(), e);
        }
        log.info("[Merge] Anchor mode: emitted event {} for {}", path, entry.getTarget());
        return path;
    }
}
