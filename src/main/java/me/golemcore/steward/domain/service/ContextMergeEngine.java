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

import me.golemcore.steward.domain.model.AuditEntry;
import me.golemcore.steward.domain.model.ChangelogEntry;
import me.golemcore.steward.domain.model.ContextConflict;
import me.golemcore.steward.domain.model.ContextDocument;
import me.golemcore.steward.domain.model.ContextSection;
import me.golemcore.steward.domain.model.ContextUpdateCommand;
import me.golemcore.steward.domain.model.ContextUpdateResult;
import me.golemcore.steward.domain.model.ContextUpdateResult.MergeMode;
import me.golemcore.steward.domain.model.PersistenceMode;
import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.domain.model.StewardErrorKind;
import me.golemcore.steward.domain.model.StewardException;
import me.golemcore.steward.domain.model.SynthesisArtifact;
import me.golemcore.steward.domain.model.SynthesisOutcome;
import me.golemcore.steward.domain.model.SynthesisRequest;
import me.golemcore.steward.domain.model.SynthesisResult;
import me.golemcore.steward.domain.model.SynthesisTask;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import me.golemcore.steward.port.outbound.StoragePort;
import me.golemcore.steward.security.PathGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Applies context updates to live artifacts.
 *
 * <p>
 * Write path per update:
 * <ol>
 * <li>validate the target name (lexically, before any filesystem access)</li>
 * <li>stage the request in the {@link AuditInbox}</li>
 * <li>in anchor mode, emit an event and stop</li>
 * <li>under the target lock: load, detect conflicts, merge (delegated or
 * direct), append a changelog entry, compact, write atomically</li>
 * <li>mark the audit entry processed</li>
 * </ol>
 * A failure after staging leaves the audit entry pending for replay.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextMergeEngine {

    private static final DateTimeFormatter UPDATE_TITLE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);
    private static final String SIGNAL_PRIOR_CONFLICTS = "prior_conflicts";

    private final StoragePort storagePort;
    private final ProjectLayoutService layoutService;
    private final PersistenceModeSelector modeSelector;
    private final AuditInbox auditInbox;
    private final AnchorEventWriter anchorEventWriter;
    private final ConflictDetector conflictDetector;
    private final CompactionGate compactionGate;
    private final SynthesisInvoker synthesisInvoker;
    private final PathGuard pathGuard;
    private final StewardProperties properties;
    private final Clock clock;

    private record MergeOutcome(ContextDocument document, MergeMode mode, List<String> sections) {
    }

    private record Delegation(SynthesisOutcome outcome, MergeOutcome merge) {
    }

    public ContextUpdateResult update(ContextUpdateCommand command) {
        String target = validate(command);
        ProjectLayout layout = layoutService.resolve(command.getWorkingDir());

        AuditEntry entry = auditInbox.submit(layout, target, command.getIntent(), command.getContent(),
                command.getSessionId());

        if (modeSelector.detect(layout) == PersistenceMode.ANCHOR) {
            String eventPath = anchorEventWriter.emit(layout, entry);
            auditInbox.markProcessed(layout, entry.getId());
            return ContextUpdateResult.builder()
                    .auditId(entry.getId())
                    .target(target)
                    .outcome(ContextUpdateResult.Outcome.EVENT_EMITTED)
                    .path(eventPath)
                    .build();
        }

        return storagePort.withExclusiveLock(layout.stateRoot(), layout.lockFile(target),
                properties.getContext().getLockTimeout(),
                () -> mergeLocked(layout, target, command, entry));
    }

    private ContextUpdateResult mergeLocked(ProjectLayout layout, String target, ContextUpdateCommand command,
            AuditEntry entry) {
        String path = layout.contextFile(target);
        modeSelector.assertWritable(layout, path);

        String current = storagePort.getText(layout.stateRoot(), path).join();
        ContextDocument document = current == null ? ContextDocument.empty(target) : ContextDocument.parse(current);
        Instant now = Instant.now(clock);

        List<ContextConflict> conflicts = conflictDetector.detect(document.getChangelog(), target,
                command.getSessionId(), command.getContent(), now, properties.getContext().getConflictWindow());
        if (!conflicts.isEmpty()) {
            if (command.isAcknowledgeConflicts()) {
                log.info("[Merge] {} acknowledged {} conflicting change(s) on {}", command.getSessionId(),
                        conflicts.size(), target);
            } else {
                log.warn("[Merge] {} has {} recent change(s) by other sessions: {}", target, conflicts.size(),
                        conflicts.stream().map(ContextConflict::sessionId).distinct().toList());
            }
        }

        SynthesisOutcome synthesisOutcome = SynthesisOutcome.NOT_REQUESTED;
        MergeOutcome merge = null;
        if (command.isDelegated()) {
            Delegation delegation = tryDelegated(layout, target, command, document, conflicts);
            synthesisOutcome = delegation.outcome();
            merge = delegation.merge();
        }
        if (merge == null) {
            merge = directMerge(layout, target, command.getContent(), document, now);
        }

        ContextDocument merged = merge.document();
        merged.addChangelogEntry(ChangelogEntry.create(now, target, command.getSessionId(), command.getIntent(),
                describe(merge.mode()), merge.sections()));

        CompactionGate.CompactionOutcome compaction = compactionGate.compact(layout, target, merged);
        storagePort.putTextAtomic(layout.stateRoot(), path, compaction.document().render()).join();
        auditInbox.markProcessed(layout, entry.getId());

        log.info("[Merge] {} updated by {} ({}, synthesis {}, {} conflict(s){})", target, command.getSessionId(),
                merge.mode(), synthesisOutcome, conflicts.size(), compaction.compacted() ? ", compacted" : "");

        return ContextUpdateResult.builder()
                .auditId(entry.getId())
                .target(target)
                .outcome(ContextUpdateResult.Outcome.MERGED)
                .mergeMode(merge.mode())
                .synthesisOutcome(synthesisOutcome)
                .conflict(!conflicts.isEmpty())
                .conflicts(conflicts)
                .conflictsAcknowledged(command.isAcknowledgeConflicts())
                .compacted(compaction.compacted())
                .archivedSections(compaction.archivedTitles())
                .path(storagePort.resolve(layout.stateRoot(), path).toString())
                .build();
    }

    private Delegation tryDelegated(ProjectLayout layout, String target, ContextUpdateCommand command,
            ContextDocument document, List<ContextConflict> conflicts) {
        if (!synthesisInvoker.isAvailable()) {
            log.debug("[Merge] Delegated merge requested but no delegate configured");
            return new Delegation(SynthesisOutcome.FALLBACK, null);
        }

        Map<String, String> signals = new LinkedHashMap<>(command.getSignals());
        if (!conflicts.isEmpty()) {
            signals.put(SIGNAL_PRIOR_CONFLICTS, conflicts.stream()
                    .map(ContextConflict::sessionId)
                    .distinct()
                    .collect(Collectors.joining(",")));
        }
        SynthesisRequest request = SynthesisRequest.builder()
                .task(SynthesisTask.CONTEXT_MERGE)
                .target(target)
                .intent(command.getIntent())
                .currentContent(document.render())
                .newContent(command.getContent())
                .signals(signals)
                .build();

        Optional<SynthesisResult> answer = synthesisInvoker.invoke(request);
        if (answer.isEmpty()) {
            return new Delegation(SynthesisOutcome.FALLBACK, null);
        }
        SynthesisResult result = answer.get();

        Optional<SynthesisArtifact> update = result.findArtifact(SynthesisArtifact.Type.CONTEXT_UPDATE);
        int minChars = properties.getSynthesis().getMinMergedChars();
        if (update.isEmpty() || update.get().getContent() == null
                || update.get().getContent().strip().length() < minChars) {
            log.warn("[Merge] Delegate merge for {} rejected: merged content missing or shorter than {} chars",
                    target, minChars);
            return new Delegation(SynthesisOutcome.REJECTED, null);
        }

        if (result.isCompactionPerformed() && !verifyDelegatedArchive(layout, target, result)) {
            return new Delegation(SynthesisOutcome.REJECTED, null);
        }

        ContextDocument merged = ContextDocument.parse(update.get().getContent());
        if (!merged.getChangelog().isEmpty()) {
            log.debug("[Merge] Dropping {} changelog entries written by the delegate for {}",
                    merged.getChangelog().size(), target);
        }
        merged.keepChangelogOf(document);
        if (!archiveDroppedText(layout, target, document, merged, result)) {
            return new Delegation(SynthesisOutcome.REJECTED, null);
        }
        List<String> sections = ContextDocument.parse(command.getContent()).getSections().stream()
                .map(ContextSection::title)
                .toList();
        return new Delegation(SynthesisOutcome.APPLIED, new MergeOutcome(merged, MergeMode.DELEGATED, sections));
    }

    /**
     * A delegate that claims compaction must hand over the archived text, and
     * appending it must provably grow the history artifact.
     */
    private boolean verifyDelegatedArchive(ProjectLayout layout, String target, SynthesisResult result) {
        Optional<SynthesisArtifact> archive = result.findArtifact(SynthesisArtifact.Type.HISTORY_ARCHIVE);
        if (archive.isEmpty() || archive.get().getContent() == null || archive.get().getContent().isBlank()) {
            log.warn("[Merge] Delegate claimed compaction for {} without a history archive, rejecting", target);
            return false;
        }
        try {
            compactionGate.archive(layout, target, List.of(archive.get().getContent()));
            return true;
        } catch (StewardException e) {
            if (e.getKind() != StewardErrorKind.GATE_VIOLATION) {
                throw e;
            }
            log.warn("[Merge] Delegate history archive for {} failed verification: {}", target, e.getMessage());
            return false;
        }
    }

    /**
     * Live text the delegate neither kept verbatim nor handed over as history
     * is appended to the history artifact before the merged document replaces
     * the live one.
     */
    private boolean archiveDroppedText(ProjectLayout layout, String target, ContextDocument live,
            ContextDocument merged, SynthesisResult result) {
        String kept = merged.render();
        String delegatedArchive = result.findArtifact(SynthesisArtifact.Type.HISTORY_ARCHIVE)
                .map(SynthesisArtifact::getContent)
                .orElse("");
        List<String> blocks = new ArrayList<>();
        String preamble = String.join("\n", live.getPreamble()).strip();
        if (!preamble.isEmpty() && !kept.contains(preamble)) {
            blocks.add(preamble);
        }
        for (ContextSection section : live.getSections()) {
            String text = section.text().strip();
            if (!kept.contains(text) && !delegatedArchive.contains(text)) {
                blocks.add(text);
            }
        }
        if (blocks.isEmpty()) {
            return true;
        }
        log.info("[Merge] Delegate merge for {} dropped {} block(s), archiving them", target, blocks.size());
        try {
            compactionGate.archive(layout, target, blocks);
            return true;
        } catch (StewardException e) {
            if (e.getKind() != StewardErrorKind.GATE_VIOLATION) {
                throw e;
            }
            log.warn("[Merge] Archiving text dropped by the delegate for {} failed verification: {}", target,
                    e.getMessage());
            return false;
        }
    }

    private MergeOutcome directMerge(ProjectLayout layout, String target, String content, ContextDocument document,
            Instant now) {
        ContextDocument incoming = ContextDocument.parse(content);
        List<ContextSection> sections = new ArrayList<>();
        List<String> preamble = incoming.getPreamble();
        if (preamble.stream().anyMatch(line -> !line.isBlank())) {
            String title = "Update " + UPDATE_TITLE.format(now);
            List<String> lines = new ArrayList<>();
            lines.add("## " + title);
            lines.addAll(preamble);
            sections.add(new ContextSection(title, lines));
        }
        sections.addAll(incoming.getSections());

        ContextDocument work = document.copy();
        List<String> superseded = new ArrayList<>();
        boolean replaced = false;
        for (ContextSection section : sections) {
            OptionalInt index = work.indexOfSection(section.title());
            if (index.isPresent()) {
                ContextSection previous = work.replaceSection(index.getAsInt(), section);
                replaced = true;
                if (!previous.text().strip().equals(section.text().strip())) {
                    superseded.add(previous.text());
                }
            } else {
                work.appendSection(section);
            }
        }
        if (!superseded.isEmpty()) {
            compactionGate.archive(layout, target, superseded);
        }
        List<String> titles = sections.stream().map(ContextSection::title).toList();
        return new MergeOutcome(work, replaced ? MergeMode.DIRECT_REPLACE : MergeMode.DIRECT_APPEND, titles);
    }

    private String validate(ContextUpdateCommand command) {
        String target = pathGuard.requireTargetName(command.getTarget());
        if (!properties.getContext().getTargets().contains(target)) {
            throw StewardException.validation("Unknown context target: " + target);
        }
        if (command.getSessionId() != null && !command.getSessionId().isBlank()) {
            pathGuard.requireSessionId(command.getSessionId());
        }
        String content = command.getContent();
        if (content == null || content.isBlank()) {
            throw StewardException.validation("Content is required");
        }
        boolean embedsChangelog = content.lines().anyMatch(line -> ContextDocument.isSectionHeading(line)
                && ContextDocument.isChangelogTitle(line.substring(3)));
        if (embedsChangelog) {
            throw StewardException.validation("Content must not contain a CHANGELOG section");
        }
        return target;
    }

    private static String describe(MergeMode mode) {
        return switch (mode) {
        case DIRECT_APPEND -> "Direct append";
        case DIRECT_REPLACE -> "Direct replace";
        case DELEGATED -> "Delegated merge";
        };
    }
}
