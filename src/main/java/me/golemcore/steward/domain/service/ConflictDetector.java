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

import me.golemcore.steward.domain.model.ChangelogEntry;
import me.golemcore.steward.domain.model.ContextConflict;
import me.golemcore.steward.domain.model.ContextDocument;
import me.golemcore.steward.domain.model.ContextSection;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags recent changes to the same artifact by other sessions. Advisory only:
 * the merge proceeds either way.
 */
@Service
public class ConflictDetector {

    public List<ContextConflict> detect(List<ChangelogEntry> changelog, String target, String sessionId,
            String newContent, Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        Set<String> incoming = sectionTitles(newContent);

        List<ContextConflict> conflicts = new ArrayList<>();
        for (ChangelogEntry entry : changelog) {
            if (!target.equals(entry.getTarget())) {
                continue;
            }
            if (entry.getTimestamp() == null || !entry.getTimestamp().isAfter(cutoff)) {
                continue;
            }
            if (Objects.equals(sessionId, entry.getSessionId())) {
                continue;
            }
            List<String> overlap = entry.getSections().stream()
                    .filter(title -> incoming.contains(ContextSection.normalizeTitle(title)))
                    .toList();
            conflicts.add(new ContextConflict(entry.getSessionId(), entry.getTimestamp(), entry.getIntent(), overlap));
        }
        return conflicts;
    }

    private Set<String> sectionTitles(String content) {
        return ContextDocument.parse(content).getSections().stream()
                .map(ContextSection::normalizedTitle)
                .collect(Collectors.toSet());
    }
}
