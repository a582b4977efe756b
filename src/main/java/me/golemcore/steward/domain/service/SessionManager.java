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

import me.golemcore.steward.domain.model.ClockInResult;
import me.golemcore.steward.domain.model.ClockOutResult;
import me.golemcore.steward.domain.model.ContextPath;
import me.golemcore.steward.domain.model.ContextUpdateCommand;
import me.golemcore.steward.domain.model.FocusConflict;
import me.golemcore.steward.domain.model.ParsedTranscript;
import me.golemcore.steward.domain.model.PersistenceMode;
import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.domain.model.Session;
import me.golemcore.steward.domain.model.SessionRegistryEntry;
import me.golemcore.steward.domain.model.StewardException;
import me.golemcore.steward.domain.model.SynthesisArtifact;
import me.golemcore.steward.domain.model.SynthesisOutcome;
import me.golemcore.steward.domain.model.SynthesisRequest;
import me.golemcore.steward.domain.model.SynthesisResult;
import me.golemcore.steward.domain.model.SynthesisTask;
import me.golemcore.steward.domain.transcript.ResolvedTranscript;
import me.golemcore.steward.domain.transcript.TranscriptFormatter;
import me.golemcore.steward.domain.transcript.TranscriptParser;
import me.golemcore.steward.domain.transcript.TranscriptResolver;
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
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Session lifecycle: clock-in and clock-out.
 *
 * <p>
 * Clock-in hands the agent a consistent view of project context and warns
 * about focus collisions. Clock-out archives the raw transcript byte-for-byte
 * before anything else touches it, then derives the formatted transcript and
 * summary. Failures after the raw archive exists are reported as a degraded
 * result instead of an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionManager {

    private static final DateTimeFormatter ARCHIVE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd")
            .withZone(ZoneOffset.UTC);
    private static final int INLINE_NEGATIVES_LIMIT = 1024;
    private static final int MAX_FOCUS_SLUG = 40;
    private static final String UNKNOWN_FOCUS = "unknown";

    private final StoragePort storagePort;
    private final ProjectLayoutService layoutService;
    private final PersistenceModeSelector modeSelector;
    private final ActiveSessionStore sessionStore;
    private final SessionRegistry sessionRegistry;
    private final SessionReaper sessionReaper;
    private final TranscriptResolver transcriptResolver;
    private final TranscriptParser transcriptParser;
    private final TranscriptFormatter transcriptFormatter;
    private final SynthesisInvoker synthesisInvoker;
    private final ContextMergeEngine contextMergeEngine;
    private final PathGuard pathGuard;
    private final StewardProperties properties;
    private final Clock clock;

    public ClockInResult clockIn(String role, String focus, String workingDir, String model, String transcriptPath) {
        if (role == null || role.isBlank()) {
            throw StewardException.validation("Role is required");
        }
        if (focus == null || focus.isBlank()) {
            throw StewardException.validation("Focus is required");
        }
        ProjectLayout layout = layoutService.resolve(workingDir);

        try {
            sessionReaper.sweepIfDue(layout);
        } catch (RuntimeException e) { // NOSONAR - cleanup never blocks clock-in
            log.warn("[Session] Cleanup failed, continuing clock-in: {}", e.getMessage());
        }

        PersistenceMode mode = modeSelector.detect(layout);
        Optional<FocusConflict> conflict = findFocusConflict(layout, focus);

        String sessionId = sessionStore.allocateSessionDirectory(layout);
        Session session = Session.builder()
                .sessionId(sessionId)
                .role(role.trim())
                .focus(focus.trim())
                .createdAt(Instant.now(clock))
                .workingDir(layout.projectRoot().toString())
                .anchorMode(mode == PersistenceMode.ANCHOR)
                .model(model)
                .transcriptPath(transcriptPath)
                .build();
        sessionStore.save(layout, session);
        sessionRegistry.register(layout, SessionRegistryEntry.of(session));

        ClockInResult.ClockInResultBuilder result = ClockInResult.builder()
                .sessionId(sessionId)
                .persistenceMode(mode)
                .contextPaths(contextPaths(layout, mode))
                .focusConflict(conflict.orElse(null));
        attachNegatives(layout, mode, result);

        log.info("[Session] Clock-in {} ({} on '{}', {}){}", sessionId, session.getRole(), session.getFocus(), mode,
                conflict.map(c -> " - focus conflict with " + c.existingSessionId()).orElse(""));
        return result.build();
    }

    public ClockOutResult clockOut(String sessionId, String workingDir, String description) {
        pathGuard.requireSessionId(sessionId);
        ProjectLayout layout = layoutService.resolve(workingDir);
        if (!sessionStore.directoryExists(layout, sessionId)) {
            throw StewardException.unresolvable("Unknown session: " + sessionId);
        }

        List<String> warnings = new ArrayList<>();
        Session session = loadOrMinimal(layout, sessionId, warnings);

        ResolvedTranscript transcript = transcriptResolver.resolve(session, layout.projectRoot())
                .orElseThrow(() -> StewardException.unresolvable("Transcript unlocatable for session " + sessionId));

        Instant now = Instant.now(clock);
        String baseName = ProjectLayout.ARCHIVE_DIR + "/" + ARCHIVE_DATE.format(now) + "-"
                + focusSlug(session.getFocus()) + "-" + sessionId;
        String rawPath = baseName + "-raw.jsonl";
        long rawBytes = archiveRaw(layout, transcript, rawPath);

        ClockOutResult.ClockOutResultBuilder result = ClockOutResult.builder()
                .sessionId(sessionId)
                .transcriptSource(transcript.source())
                .rawArchivePath(storagePort.resolve(layout.stateRoot(), rawPath).toString())
                .rawArchiveBytes(rawBytes);

        ParsedTranscript parsed = null;
        try {
            parsed = transcriptParser.parse(transcript.path());
        } catch (RuntimeException e) { // NOSONAR - raw archive is safe, parsing is best effort
            log.warn("[Session] Transcript parse failed for {}: {}", sessionId, e.getMessage());
            warnings.add("Transcript parse failed: " + e.getMessage());
        }

        int recordCount = parsed != null ? parsed.getRecords().size() : 0;
        String summary = transcriptFormatter.summarize(session, recordCount, description);
        result.summary(summary).recordCount(recordCount);

        String formatted = null;
        if (parsed != null) {
            try {
                formatted = transcriptFormatter.format(session, parsed, now);
                String txtPath = baseName + ".txt";
                storagePort.putTextAtomic(layout.stateRoot(), txtPath, formatted).join();
                result.transcriptArchivePath(storagePort.resolve(layout.stateRoot(), txtPath).toString());
            } catch (RuntimeException e) { // NOSONAR - partial success
                log.warn("[Session] Formatted transcript for {} not written: {}", sessionId, e.getMessage());
                warnings.add("Formatted transcript not written: " + e.getMessage());
            }
        }

        if (formatted != null && synthesisInvoker.isAvailable()) {
            result.synthesisOutcome(compressSession(layout, session, formatted, description, baseName, result,
                    warnings));
        }

        try {
            sessionRegistry.unregister(layout, sessionId);
            sessionStore.delete(layout, sessionId);
        } catch (RuntimeException e) { // NOSONAR - the reaper removes leftovers later
            log.warn("[Session] Cleanup of session {} failed: {}", sessionId, e.getMessage());
            warnings.add("Session cleanup failed: " + e.getMessage());
        }

        boolean degraded = !warnings.isEmpty();
        log.info("[Session] Clock-out {} ({} record(s), raw {} bytes{})", sessionId, recordCount, rawBytes,
                degraded ? ", degraded" : "");
        return result.degraded(degraded).warnings(warnings).build();
    }

    private long archiveRaw(ProjectLayout layout, ResolvedTranscript transcript, String rawPath) {
        long copied;
        try {
            copied = storagePort.copyFrom(transcript.path(), layout.stateRoot(), rawPath).join();
        } catch (RuntimeException e) {
            log.error("[Session] Raw transcript archival failed: {}", e.getMessage());
            throw StewardException.transientFailure("Raw transcript archival failed: " + e.getMessage(), e);
        }
        long onDisk = storagePort.size(layout.stateRoot(), rawPath).join();
        if (onDisk != copied) {
            throw StewardException.transientFailure(
                    "Raw transcript archive size mismatch: expected " + copied + ", found " + onDisk, null);
        }
        log.debug("[Session] Archived raw transcript {} ({} bytes)", rawPath, copied);
        return copied;
    }

    private SynthesisOutcome compressSession(ProjectLayout layout, Session session, String formatted,
            String description, String baseName, ClockOutResult.ClockOutResultBuilder result, List<String> warnings) {
        String primary = properties.getContext().getPrimaryTarget();
        SynthesisRequest request = SynthesisRequest.builder()
                .task(SynthesisTask.SESSION_COMPRESSION)
                .target(primary)
                .intent(description)
                .currentContent(formatted)
                .newContent(description)
                .build();
        Optional<SynthesisResult> answer = synthesisInvoker.invoke(request);
        if (answer.isEmpty()) {
            return SynthesisOutcome.FALLBACK;
        }

        Optional<SynthesisArtifact> summary = answer.get().findArtifact(SynthesisArtifact.Type.SESSION_SUMMARY);
        int minChars = properties.getSynthesis().getMinSummaryChars();
        if (summary.isEmpty() || summary.get().getContent() == null
                || summary.get().getContent().strip().length() < minChars) {
            log.warn("[Session] Session summary for {} rejected: missing or shorter than {} chars",
                    session.getSessionId(), minChars);
            return SynthesisOutcome.REJECTED;
        }

        String content = summary.get().getContent().strip();
        try {
            String summaryPath = baseName + ".summary.md";
            storagePort.putTextAtomic(layout.stateRoot(), summaryPath, content + "\n").join();
            result.summaryPath(storagePort.resolve(layout.stateRoot(), summaryPath).toString());

            contextMergeEngine.update(ContextUpdateCommand.builder()
                    .target(primary)
                    .intent("Session summary for " + session.getSessionId())
                    .content("## Session " + session.getSessionId() + " (" + session.getRole() + ": "
                            + session.getFocus() + ")\n\n" + content + "\n")
                    .workingDir(layout.projectRoot().toString())
                    .sessionId(session.getSessionId())
                    .build());
        } catch (RuntimeException e) { // NOSONAR - partial success
            log.warn("[Session] Session summary for {} not merged: {}", session.getSessionId(), e.getMessage());
            warnings.add("Session summary not merged: " + e.getMessage());
            return SynthesisOutcome.FALLBACK;
        }
        return SynthesisOutcome.APPLIED;
    }

    private Session loadOrMinimal(ProjectLayout layout, String sessionId, List<String> warnings) {
        try {
            Optional<Session> stored = sessionStore.load(layout, sessionId);
            if (stored.isPresent()) {
                return stored.get();
            }
            warnings.add("Session file missing");
        } catch (RuntimeException e) { // NOSONAR - fall back to a minimal session
            log.warn("[Session] Corrupt session file for {}: {}", sessionId, e.getMessage());
            warnings.add("Session file unreadable: " + e.getMessage());
        }
        Instant createdAt = storagePort.lastModified(layout.stateRoot(), layout.sessionDir(sessionId)).join();
        return Session.builder()
                .sessionId(sessionId)
                .role("unknown")
                .focus(UNKNOWN_FOCUS)
                .createdAt(createdAt)
                .workingDir(layout.projectRoot().toString())
                .build();
    }

    private Optional<FocusConflict> findFocusConflict(ProjectLayout layout, String focus) {
        String wanted = normalizeFocus(focus);
        return sessionStore.listActive(layout).stream()
                .filter(s -> wanted.equals(normalizeFocus(s.getFocus())))
                .min(Comparator.comparing(Session::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(s -> new FocusConflict(s.getSessionId(), s.getRole(), s.getCreatedAt(),
                        "Focus '" + s.getFocus() + "' is already claimed by " + s.getRole() + " session "
                                + s.getSessionId() + " since " + s.getCreatedAt()));
    }

    private List<ContextPath> contextPaths(ProjectLayout layout, PersistenceMode mode) {
        List<ContextPath> paths = new ArrayList<>();
        for (String target : properties.getContext().getTargets()) {
            String relative = mode == PersistenceMode.ANCHOR ? layout.snapshotFile(target) : layout.contextFile(target);
            boolean exists = Boolean.TRUE.equals(storagePort.exists(layout.stateRoot(), relative).join());
            paths.add(new ContextPath(target, storagePort.resolve(layout.stateRoot(), relative).toString(), exists));
        }
        return paths;
    }

    private void attachNegatives(ProjectLayout layout, PersistenceMode mode,
            ClockInResult.ClockInResultBuilder result) {
        String dir = mode == PersistenceMode.ANCHOR ? ProjectLayout.SNAPSHOTS_DIR : ProjectLayout.CONTEXT_DIR;
        String relative = dir + "/" + properties.getContext().getNegativesFile();
        long size = storagePort.size(layout.stateRoot(), relative).join();
        if (size < 0) {
            return;
        }
        if (size < INLINE_NEGATIVES_LIMIT) {
            result.negativesContent(storagePort.getText(layout.stateRoot(), relative).join());
        } else {
            result.negativesPath(storagePort.resolve(layout.stateRoot(), relative).toString());
        }
    }

    static String normalizeFocus(String focus) {
        return focus == null ? "" : focus.trim().toLowerCase(Locale.ROOT);
    }

    static String focusSlug(String focus) {
        String slug = normalizeFocus(focus).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
        if (slug.length() > MAX_FOCUS_SLUG) {
            slug = slug.substring(0, MAX_FOCUS_SLUG).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? UNKNOWN_FOCUS : slug;
    }
}
