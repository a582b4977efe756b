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
import me.golemcore.steward.domain.model.ContextDocument;
import me.golemcore.steward.domain.model.ContextSection;
import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.domain.model.StewardException;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import me.golemcore.steward.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Keeps live context artifacts under the line ceiling by relocating whole
 * sections to the history artifact.
 *
 * <p>
 * Victim order:
 * <ol>
 * <li>sections whose title marks them as historical (HISTORY, ACHIEVEMENT,
 * COMPLETED, OLD), in document order</li>
 * <li>any other unprotected section, in document order</li>
 * <li>the oldest changelog entries</li>
 * </ol>
 * Protected sections never move. Every relocation is verified against the
 * history file before the trimmed document is handed back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompactionGate {

    private static final List<String> HISTORICAL_KEYWORDS = List.of("HISTORY", "ACHIEVEMENT", "COMPLETED", "OLD");
    private static final DateTimeFormatter MARKER_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'");
    private static final String HISTORY_LOCK = "history";

    private final StoragePort storagePort;
    private final StewardProperties properties;
    private final Clock clock;

    /**
     * Result of a compaction pass.
     *
     * @param document
     *            the document to write (the input when nothing moved)
     * @param archivedTitles
     *            titles of relocated sections and changelog headings
     */
    public record CompactionOutcome(ContextDocument document, boolean compacted, List<String> archivedTitles) {
    }

    public CompactionOutcome compact(ProjectLayout layout, String target, ContextDocument document) {
        int maxLines = properties.getContext().getMaxLines();
        if (document.lineCount() <= maxLines) {
            return new CompactionOutcome(document, false, List.of());
        }

        ContextDocument work = document.copy();
        List<String> blocks = new ArrayList<>();
        List<String> titles = new ArrayList<>();
        while (work.lineCount() > maxLines) {
            OptionalInt victim = pickSection(work);
            if (victim.isPresent()) {
                ContextSection section = work.removeSection(victim.getAsInt());
                blocks.add(section.text());
                titles.add(section.title());
                continue;
            }
            Optional<ChangelogEntry> oldest = work.removeOldestChangelogEntry();
            if (oldest.isPresent()) {
                blocks.add(oldest.get().text());
                titles.add(oldest.get().getLines().get(0).substring("### ".length()));
                continue;
            }
            log.warn("[Compaction] {} still has {} lines after moving every movable section (ceiling {})",
                    target, work.lineCount(), maxLines);
            break;
        }

        if (blocks.isEmpty()) {
            return new CompactionOutcome(document, false, List.of());
        }
        archive(layout, target, blocks);
        log.info("[Compaction] Moved {} block(s) from {} to history: {}", blocks.size(), target, titles);
        return new CompactionOutcome(work, true, titles);
    }

    /**
     * Append blocks verbatim to the history artifact under an archival marker
     * and prove they landed.
     *
     * @throws StewardException
     *             GATE_VIOLATION if the history file did not grow or does not
     *             contain every block afterwards
     */
    public void archive(ProjectLayout layout, String target, List<String> blocks) {
        if (blocks.isEmpty()) {
            return;
        }
        String historyPath = historyPath();
        String chunk = renderChunk(target, blocks);

        storagePort.withExclusiveLock(layout.stateRoot(), layout.lockFile(HISTORY_LOCK),
                properties.getContext().getLockTimeout(), () -> {
                    long before = Math.max(0L, storagePort.size(layout.stateRoot(), historyPath).join());
                    storagePort.appendText(layout.stateRoot(), historyPath, chunk).join();
                    verifyGrowth(layout, historyPath, before, blocks);
                    return null;
                });
    }

    /**
     * Check that the history file grew past {@code sizeBefore} and contains
     * every block.
     */
    public void verifyGrowth(ProjectLayout layout, String historyPath, long sizeBefore, List<String> blocks) {
        long after = storagePort.size(layout.stateRoot(), historyPath).join();
        if (after <= sizeBefore) {
            log.warn("[Compaction] History did not grow ({} -> {} bytes), refusing trim", sizeBefore, after);
            throw StewardException.gateViolation("History artifact did not grow");
        }
        String history = storagePort.getText(layout.stateRoot(), historyPath).join();
        for (String block : blocks) {
            if (history == null || !history.contains(block)) {
                log.warn("[Compaction] History is missing archived text, refusing trim");
                throw StewardException.gateViolation("History artifact does not contain the archived text");
            }
        }
    }

    public String historyPath() {
        return ProjectLayout.CONTEXT_DIR + "/" + properties.getContext().getHistoryFile();
    }

    public String marker(String target) {
        return "*Archived from " + target + " on " + MARKER_DATE.format(Instant.now(clock).atOffset(ZoneOffset.UTC))
                + "*";
    }

    private String renderChunk(String target, List<String> blocks) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n---\n\n").append(marker(target)).append("\n\n");
        for (String block : blocks) {
            sb.append(block);
            if (!block.endsWith("\n")) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private OptionalInt pickSection(ContextDocument document) {
        List<ContextSection> sections = document.getSections();
        OptionalInt historical = OptionalInt.empty();
        OptionalInt ordinary = OptionalInt.empty();
        for (int i = 0; i < sections.size(); i++) {
            ContextSection section = sections.get(i);
            if (isProtected(section)) {
                continue;
            }
            if (historical.isEmpty() && isHistorical(section)) {
                historical = OptionalInt.of(i);
            }
            if (ordinary.isEmpty()) {
                ordinary = OptionalInt.of(i);
            }
        }
        return historical.isPresent() ? historical : ordinary;
    }

    private boolean isProtected(ContextSection section) {
        String title = section.normalizedTitle();
        return properties.getContext().getProtectedSections().stream()
                .map(ContextSection::normalizeTitle)
                .filter(keyword -> !keyword.isEmpty())
                .anyMatch(title::contains);
    }

    private boolean isHistorical(ContextSection section) {
        for (String token : section.normalizedTitle().split("_")) {
            String upper = token.toUpperCase(Locale.ROOT);
            if (HISTORICAL_KEYWORDS.stream().anyMatch(upper::startsWith)) {
                return true;
            }
        }
        return false;
    }
}
