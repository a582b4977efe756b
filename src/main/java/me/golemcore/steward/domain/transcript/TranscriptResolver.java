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

import me.golemcore.steward.domain.model.Session;
import me.golemcore.steward.security.PathGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Chain of responsibility over the registered {@link TranscriptLocator}s.
 *
 * <p>
 * Every candidate is validated before it is trusted; a locator that fails or
 * proposes an unsafe file is logged and the chain moves on.
 */
@Service
@Slf4j
public class TranscriptResolver {

    private final List<TranscriptLocator> locators;
    private final PathGuard pathGuard;

    public TranscriptResolver(List<TranscriptLocator> locators, PathGuard pathGuard) {
        this.locators = List.copyOf(locators);
        this.pathGuard = pathGuard;
    }

    public Optional<ResolvedTranscript> resolve(Session session, Path projectRoot) {
        TranscriptQuery query = new TranscriptQuery(session, projectRoot);
        for (TranscriptLocator locator : locators) {
            Optional<TranscriptCandidate> candidate;
            try {
                candidate = locator.locate(query);
            } catch (RuntimeException e) { // NOSONAR - a broken locator must not end the chain
                log.warn("[Transcript] Locator {} failed: {}", locator.getName(), e.getMessage());
                continue;
            }
            if (candidate.isEmpty()) {
                log.debug("[Transcript] Locator {} found nothing for {}", locator.getName(),
                        session.getSessionId());
                continue;
            }
            TranscriptCandidate found = candidate.get();
            if (!pathGuard.isContainedRegularFile(found.path(), found.allowedRoot())) {
                log.warn("[Transcript] Rejected candidate from {}: {} (allowed root {})",
                        locator.getName(), found.path(), found.allowedRoot());
                continue;
            }
            log.info("[Transcript] Resolved transcript for {} via {}: {}", session.getSessionId(),
                    found.source(), found.path());
            return Optional.of(new ResolvedTranscript(found.path(), found.source()));
        }
        log.warn("[Transcript] No transcript found for session {}", session.getSessionId());
        return Optional.empty();
    }
}
