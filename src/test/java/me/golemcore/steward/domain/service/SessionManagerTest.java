package me.golemcore.steward.domain.service;

import me.golemcore.steward.domain.model.ClockInResult;
import me.golemcore.steward.domain.model.ClockOutResult;
import me.golemcore.steward.domain.model.ContextPath;
import me.golemcore.steward.domain.model.PersistenceMode;
import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.domain.model.StewardErrorKind;
import me.golemcore.steward.domain.model.StewardException;
import me.golemcore.steward.domain.model.SynthesisArtifact;
import me.golemcore.steward.domain.model.SynthesisOutcome;
import me.golemcore.steward.domain.model.SynthesisResult;
import me.golemcore.steward.testsupport.StewardFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class SessionManagerTest {

    private static final String ROLE = "backend";
    private static final String FOCUS = "refactor-auth";

    @TempDir
    Path tempDir;

    private StewardFixture fixture;
    private SessionManager sessionManager;

    @BeforeEach
    void setUp() {
        fixture = new StewardFixture(tempDir);
        sessionManager = fixture.sessionManager;
    }

    @Test
    void shouldClockInAndRegisterSession() {
        ClockInResult result = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), "model-x", null);

        assertEquals(8, result.getSessionId().length());
        assertEquals(PersistenceMode.DIRECT_WRITE, result.getPersistenceMode());
        assertFalse(result.hasFocusConflict());
        assertTrue(Files.exists(fixture.stateRoot().resolve("sessions/active/" + result.getSessionId()
                + "/session.json")));
        ProjectLayout layout = fixture.layoutService.resolve(fixture.workingDir());
        assertTrue(fixture.sessionRegistry.list(layout).containsKey(result.getSessionId()));

        List<String> targets = result.getContextPaths().stream().map(ContextPath::target).toList();
        assertEquals(List.of("PROJECT-CONTEXT", "PROJECT-CHECKLIST", "PROJECT-ROADMAP"), targets);
        assertTrue(result.getContextPaths().stream().noneMatch(ContextPath::exists));
        assertTrue(result.getContextPaths().get(0).path().endsWith("context/PROJECT-CONTEXT.md"));
    }

    @Test
    void shouldWarnAboutFocusConflictWithEarliestSession() {
        ClockInResult first = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, null);
        fixture.clock.advance(Duration.ofMinutes(5));
        sessionManager.clockIn("frontend", FOCUS, fixture.workingDir(), null, null);
        fixture.clock.advance(Duration.ofMinutes(5));

        ClockInResult third = sessionManager.clockIn("qa", "  Refactor-Auth ", fixture.workingDir(), null, null);

        assertTrue(third.hasFocusConflict());
        assertEquals(first.getSessionId(), third.getFocusConflict().existingSessionId());
        assertEquals(ROLE, third.getFocusConflict().role());
        assertTrue(third.getFocusConflict().message().contains(first.getSessionId()));
        assertNotEquals(first.getSessionId(), third.getSessionId());
    }

    @Test
    void shouldInlineSmallNegativesAndPointToLargeOnes() {
        fixture.write(fixture.stateRoot().resolve("context/CONTEXT-NEGATIVES.md"), "- never use global state\n");

        ClockInResult small = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, null);

        assertEquals("- never use global state\n", small.getNegativesContent());
        assertNull(small.getNegativesPath());

        fixture.write(fixture.stateRoot().resolve("context/CONTEXT-NEGATIVES.md"), "x".repeat(4096));
        ClockInResult large = sessionManager.clockIn(ROLE, "other", fixture.workingDir(), null, null);

        assertNull(large.getNegativesContent());
        assertTrue(large.getNegativesPath().endsWith("CONTEXT-NEGATIVES.md"));
    }

    @Test
    void shouldPointToSnapshotsInAnchorMode() {
        fixture.write(fixture.stateRoot().resolve("snapshots/PROJECT-CONTEXT.md"), "# snapshot\n");

        ClockInResult result = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, null);

        assertEquals(PersistenceMode.ANCHOR, result.getPersistenceMode());
        ContextPath context = result.getContextPaths().get(0);
        assertTrue(context.path().endsWith("snapshots/PROJECT-CONTEXT.md"));
        assertTrue(context.exists());
    }

    @Test
    void shouldRequireRoleAndFocus() {
        assertEquals(StewardErrorKind.VALIDATION, assertThrows(StewardException.class,
                () -> sessionManager.clockIn(" ", FOCUS, fixture.workingDir(), null, null)).getKind());
        assertEquals(StewardErrorKind.VALIDATION, assertThrows(StewardException.class,
                () -> sessionManager.clockIn(ROLE, null, fixture.workingDir(), null, null)).getKind());
    }

    @Test
    void shouldArchiveTranscriptAndCloseSessionOnClockOut() throws IOException {
        String sessionId = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, null).getSessionId();
        String transcript = transcriptLines(sessionId);
        fixture.write(fixture.transcriptsRoot.resolve("project/t.jsonl"), transcript);

        ClockOutResult result = sessionManager.clockOut(sessionId, fixture.workingDir(), "auth refactored");

        assertFalse(result.isDegraded(), String.valueOf(result.getWarnings()));
        assertEquals("temporal-beacon", result.getTranscriptSource());
        Path raw = Path.of(result.getRawArchivePath());
        assertEquals("2026-01-01-refactor-auth-" + sessionId + "-raw.jsonl", raw.getFileName().toString());
        assertEquals(transcript, Files.readString(raw));
        assertEquals(Files.size(raw), result.getRawArchiveBytes());

        String formatted = Files.readString(Path.of(result.getTranscriptArchivePath()));
        assertTrue(formatted.contains("[user] Please refactor auth " + sessionId));
        assertTrue(formatted.contains("[TOOL: Edit]"));
        assertEquals(3, result.getRecordCount());
        assertEquals("Session: backend focused on refactor-auth | Records: 3 | Description: auth refactored",
                result.getSummary());
        assertEquals(SynthesisOutcome.NOT_REQUESTED, result.getSynthesisOutcome());

        ProjectLayout layout = fixture.layoutService.resolve(fixture.workingDir());
        assertFalse(Files.exists(fixture.stateRoot().resolve("sessions/active/" + sessionId)));
        assertFalse(fixture.sessionRegistry.list(layout).containsKey(sessionId));
    }

    @Test
    void shouldUseExplicitTranscriptPath() {
        Path explicit = fixture.write(fixture.transcriptsRoot.resolve("p/explicit.jsonl"),
                "{\"type\":\"user\",\"message\":{\"content\":\"hi\"}}\n");
        fixture.write(fixture.transcriptsRoot.resolve("p/newer.jsonl"), "{}\n");
        String sessionId = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, explicit.toString())
                .getSessionId();

        ClockOutResult result = sessionManager.clockOut(sessionId, fixture.workingDir(), null);

        assertEquals("explicit", result.getTranscriptSource());
        assertEquals(1, result.getRecordCount());
    }

    @Test
    void shouldFailWithoutSideEffectsWhenTranscriptUnlocatable() throws IOException {
        String sessionId = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, null).getSessionId();

        StewardException ex = assertThrows(StewardException.class,
                () -> sessionManager.clockOut(sessionId, fixture.workingDir(), "done"));

        assertEquals(StewardErrorKind.UNRESOLVABLE, ex.getKind());
        assertTrue(Files.exists(fixture.stateRoot().resolve("sessions/active/" + sessionId)));
        try (Stream<Path> archive = Files.list(fixture.stateRoot().resolve("sessions/archive"))) {
            assertEquals(0, archive.count());
        }
    }

    @Test
    void shouldNotArchiveAnotherProjectsTranscript() throws IOException {
        String sessionId = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, null).getSessionId();
        fixture.write(fixture.transcriptsRoot.resolve("-some-other-project/other-agent.jsonl"),
                "{\"type\":\"user\",\"message\":{\"content\":\"other project work\"}}\n");

        StewardException ex = assertThrows(StewardException.class,
                () -> sessionManager.clockOut(sessionId, fixture.workingDir(), "done"));

        assertEquals(StewardErrorKind.UNRESOLVABLE, ex.getKind());
        try (Stream<Path> archive = Files.list(fixture.stateRoot().resolve("sessions/archive"))) {
            assertEquals(0, archive.count());
        }
    }

    @Test
    void shouldKeepRawArchiveWhenParsingFails() throws IOException {
        String sessionId = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, null).getSessionId();
        byte[] beacon = ("{\"text\":\"clock-in " + sessionId + "\"}\n").getBytes(StandardCharsets.UTF_8);
        byte[] broken = { '{', '"', 'x', '"', ':', '"', (byte) 0xC3, (byte) 0x28, '"', '}', '\n' };
        byte[] invalidUtf8 = new byte[beacon.length + broken.length];
        System.arraycopy(beacon, 0, invalidUtf8, 0, beacon.length);
        System.arraycopy(broken, 0, invalidUtf8, beacon.length, broken.length);
        Path transcript = fixture.transcriptsRoot.resolve("project/broken.jsonl");
        Files.createDirectories(transcript.getParent());
        Files.write(transcript, invalidUtf8);

        ClockOutResult result = sessionManager.clockOut(sessionId, fixture.workingDir(), "done");

        assertTrue(result.isDegraded());
        assertTrue(result.getWarnings().get(0).startsWith("Transcript parse failed"));
        assertArrayEquals(invalidUtf8, Files.readAllBytes(Path.of(result.getRawArchivePath())));
        assertNull(result.getTranscriptArchivePath());
        assertEquals(0, result.getRecordCount());
        assertFalse(Files.exists(fixture.stateRoot().resolve("sessions/active/" + sessionId)));
    }

    @Test
    void shouldClockOutWithMinimalSessionWhenSessionFileMissing() throws IOException {
        String sessionId = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, null).getSessionId();
        Files.delete(fixture.stateRoot().resolve("sessions/active/" + sessionId + "/session.json"));
        fixture.write(fixture.transcriptsRoot.resolve("project/t.jsonl"), transcriptLines(sessionId));

        ClockOutResult result = sessionManager.clockOut(sessionId, fixture.workingDir(), null);

        assertTrue(result.isDegraded());
        assertTrue(result.getWarnings().contains("Session file missing"));
        assertTrue(Path.of(result.getRawArchivePath()).getFileName().toString().contains("-unknown-"));
    }

    @Test
    void shouldRejectUnknownAndMalformedSessionIds() {
        fixture.layoutService.resolve(fixture.workingDir());

        assertEquals(StewardErrorKind.UNRESOLVABLE, assertThrows(StewardException.class,
                () -> sessionManager.clockOut("deadbeef", fixture.workingDir(), null)).getKind());
        assertEquals(StewardErrorKind.SECURITY, assertThrows(StewardException.class,
                () -> sessionManager.clockOut("../../etc", fixture.workingDir(), null)).getKind());
    }

    @Test
    void shouldMergeVerifiedSessionSummaryIntoPrimaryContext() {
        String summary = "Refactored the authentication module into a token service and a session store. "
                .repeat(5);
        when(fixture.synthesisPort.isAvailable()).thenReturn(true);
        when(fixture.synthesisPort.synthesize(any())).thenReturn(CompletableFuture.completedFuture(
                SynthesisResult.success("ok", List.of(SynthesisArtifact.builder()
                        .type(SynthesisArtifact.Type.SESSION_SUMMARY)
                        .content(summary)
                        .build()), false)));
        String sessionId = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, null).getSessionId();
        fixture.write(fixture.transcriptsRoot.resolve("project/t.jsonl"), transcriptLines(sessionId));

        ClockOutResult result = sessionManager.clockOut(sessionId, fixture.workingDir(), "done");

        assertEquals(SynthesisOutcome.APPLIED, result.getSynthesisOutcome());
        assertTrue(fixture.read(Path.of(result.getSummaryPath())).startsWith("Refactored the authentication"));
        String context = fixture.read(fixture.contextFile("PROJECT-CONTEXT"));
        assertTrue(context.contains("## Session " + sessionId + " (backend: refactor-auth)"));
        assertTrue(context.contains("token service"));
    }

    @Test
    void shouldRejectShortSessionSummary() {
        when(fixture.synthesisPort.isAvailable()).thenReturn(true);
        when(fixture.synthesisPort.synthesize(any())).thenReturn(CompletableFuture.completedFuture(
                SynthesisResult.success("ok", List.of(SynthesisArtifact.builder()
                        .type(SynthesisArtifact.Type.SESSION_SUMMARY)
                        .content("did stuff")
                        .build()), false)));
        String sessionId = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, null).getSessionId();
        fixture.write(fixture.transcriptsRoot.resolve("project/t.jsonl"), transcriptLines(sessionId));

        ClockOutResult result = sessionManager.clockOut(sessionId, fixture.workingDir(), "done");

        assertEquals(SynthesisOutcome.REJECTED, result.getSynthesisOutcome());
        assertNull(result.getSummaryPath());
        assertFalse(Files.exists(fixture.contextFile("PROJECT-CONTEXT")));
    }

    @Test
    void shouldReportFallbackWhenSummaryCannotBeMerged() {
        String summary = "Refactored the authentication module into a token service and a session store. "
                .repeat(5);
        when(fixture.synthesisPort.isAvailable()).thenReturn(true);
        when(fixture.synthesisPort.synthesize(any())).thenReturn(CompletableFuture.completedFuture(
                SynthesisResult.success("ok", List.of(SynthesisArtifact.builder()
                        .type(SynthesisArtifact.Type.SESSION_SUMMARY)
                        .content(summary)
                        .build()), false)));
        String sessionId = sessionManager.clockIn(ROLE, FOCUS, fixture.workingDir(), null, null).getSessionId();
        fixture.write(fixture.transcriptsRoot.resolve("project/t.jsonl"), transcriptLines(sessionId));
        fixture.properties.getContext().setPrimaryTarget("PROJECT-NOTES");

        ClockOutResult result = sessionManager.clockOut(sessionId, fixture.workingDir(), "done");

        assertEquals(SynthesisOutcome.FALLBACK, result.getSynthesisOutcome());
        assertTrue(result.getWarnings().stream().anyMatch(w -> w.startsWith("Session summary not merged")));
        assertFalse(Files.exists(fixture.contextFile("PROJECT-NOTES")));
    }

    @Test
    void shouldBuildFocusSlugs() {
        assertEquals("refactor-auth", SessionManager.focusSlug("  Refactor Auth!! "));
        assertEquals("unknown", SessionManager.focusSlug("***"));
        assertEquals(40, SessionManager.focusSlug("a".repeat(60)).length());
    }

    private static String transcriptLines(String sessionId) {
        return "{\"type\":\"user\",\"message\":{\"role\":\"user\",\"content\":\"Please refactor auth " + sessionId
                + "\"}}\n"
                + "{\"type\":\"assistant\",\"message\":{\"role\":\"assistant\",\"content\":[{\"type\":\"tool_use\","
                + "\"id\":\"t1\",\"name\":\"Edit\",\"input\":{\"file_path\":\"Auth.java\"}}]}}\n"
                + "{\"type\":\"user\",\"message\":{\"role\":\"user\",\"content\":[{\"type\":\"tool_result\","
                + "\"tool_use_id\":\"t1\",\"content\":\"ok\"}]}}\n";
    }
}
