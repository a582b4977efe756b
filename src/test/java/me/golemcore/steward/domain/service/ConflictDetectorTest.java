package me.golemcore.steward.domain.service;

import me.golemcore.steward.domain.model.ChangelogEntry;
import me.golemcore.steward.domain.model.ContextConflict;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConflictDetectorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final Duration WINDOW = Duration.ofMinutes(30);
    private static final String TARGET = "PROJECT-CONTEXT";
    private static final String CONTENT = "## Current State\nnew\n\n## Roadmap\nnext";

    private final ConflictDetector detector = new ConflictDetector();

    @Test
    void shouldFlagRecentChangeByOtherSessionWithOverlap() {
        ChangelogEntry recent = entry(NOW.minus(Duration.ofMinutes(10)), TARGET, "other", List.of("Current-State"));

        List<ContextConflict> conflicts = detector.detect(List.of(recent), TARGET, "mine", CONTENT, NOW, WINDOW);

        assertEquals(1, conflicts.size());
        ContextConflict conflict = conflicts.get(0);
        assertEquals("other", conflict.sessionId());
        assertEquals(List.of("Current-State"), conflict.overlappingSections());
        assertEquals("intent of other", conflict.intent());
    }

    @Test
    void shouldFlagRecentChangeEvenWithoutOverlap() {
        ChangelogEntry recent = entry(NOW.minus(Duration.ofMinutes(1)), TARGET, "other", List.of("Identity"));

        List<ContextConflict> conflicts = detector.detect(List.of(recent), TARGET, "mine", CONTENT, NOW, WINDOW);

        assertEquals(1, conflicts.size());
        assertTrue(conflicts.get(0).overlappingSections().isEmpty());
    }

    @Test
    void shouldIgnoreOwnOldAndForeignTargetEntries() {
        List<ChangelogEntry> changelog = List.of(
                entry(NOW.minus(Duration.ofMinutes(5)), TARGET, "mine", List.of("Roadmap")),
                entry(NOW.minus(Duration.ofMinutes(31)), TARGET, "other", List.of("Roadmap")),
                entry(NOW.minus(Duration.ofMinutes(30)), TARGET, "other", List.of("Roadmap")),
                entry(NOW.minus(Duration.ofMinutes(5)), "NOTES", "other", List.of("Roadmap")));

        assertTrue(detector.detect(changelog, TARGET, "mine", CONTENT, NOW, WINDOW).isEmpty());
    }

    private static ChangelogEntry entry(Instant at, String target, String sessionId, List<String> sections) {
        return ChangelogEntry.create(at, target, sessionId, "intent of " + sessionId, "Direct append", sections);
    }
}
