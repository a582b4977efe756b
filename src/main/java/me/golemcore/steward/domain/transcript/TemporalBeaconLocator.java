package me.golemcore.steward.domain.transcript;

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

import me.golemcore.steward.infrastructure.config.StewardProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Finds the transcript by time: among transcripts modified since the session
 * started (minus the tolerance), take the newest one that mentions the session
 * id. A transcript without the id belongs to someone else and is never used.
 */
@Component
@Order(20)
@RequiredArgsConstructor
@Slf4j
public class TemporalBeaconLocator implements TranscriptLocator {

    private static final int SCAN_DEPTH = 2;

    private final StewardProperties properties;

    @Override
    public String getName() {
        return "temporal-beacon";
    }

    @Override
    public Optional<TranscriptCandidate> locate(TranscriptQuery query) {
        Instant startedAt = query.session().getCreatedAt();
        if (startedAt == null) {
            return Optional.empty();
        }
        StewardProperties.TranscriptsProperties config = properties.getTranscripts();
        Path root = Path.of(config.getRoot()).toAbsolutePath().normalize();
        Instant windowStart = startedAt.minus(config.getTolerance());

        List<Path> recent = TranscriptFiles.newestFirst(TranscriptFiles.listTranscripts(root, SCAN_DEPTH)).stream()
                .filter(p -> !TranscriptFiles.modified(p).isBefore(windowStart))
                .limit(config.getMaxProjectScan())
                .toList();
        if (recent.isEmpty()) {
            return Optional.empty();
        }

        String sessionId = query.session().getSessionId();
        Optional<Path> beacon = recent.stream()
                .filter(p -> TranscriptFiles.contains(p, sessionId))
                .findFirst();
        if (beacon.isEmpty()) {
            log.debug("[Transcript] No recent transcript mentions {}", sessionId);
            return Optional.empty();
        }
        log.debug("[Transcript] Beacon match for {}: {}", sessionId, beacon.get());
        return Optional.of(new TranscriptCandidate(beacon.get(), root, getName()));
    }
}
