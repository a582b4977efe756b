package me.golemcore.steward.domain.service;

import me.golemcore.steward.domain.model.AuditEntry;
import me.golemcore.steward.domain.model.AuditStatus;
import me.golemcore.steward.domain.model.InboxStatus;
import me.golemcore.steward.domain.model.ProcessedIndexEntry;
import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.testsupport.StewardFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditInboxTest {

    private static final String TARGET = "PROJECT-CONTEXT";

    @TempDir
    Path tempDir;

    private StewardFixture fixture;
    private ProjectLayout layout;
    private AuditInbox inbox;

    @BeforeEach
    void setUp() {
        fixture = new StewardFixture(tempDir);
        layout = fixture.layoutService.resolve(fixture.workingDir());
        inbox = fixture.auditInbox;
    }

    @Test
    void shouldStageEntryAsPending() {
        AuditEntry entry = inbox.submit(layout, TARGET, "intent", "## A\nbody", "1a2b3c4d");

        Path pending = fixture.stateRoot().resolve("inbox/pending/" + entry.getId() + ".json");
        assertTrue(Files.exists(pending));
        assertTrue(fixture.read(pending).contains("\"session_id\" : \"1a2b3c4d\""));
        assertEquals(AuditStatus.PENDING, inbox.find(layout, entry.getId()).orElseThrow().getStatus());
        assertEquals(StewardFixture.START, entry.getTimestamp());
    }

    @Test
    void shouldMoveEntryToProcessedExactlyOnce() {
        AuditEntry entry = inbox.submit(layout, TARGET, "intent", "content", "1a2b3c4d");
        fixture.clock.advance(Duration.ofSeconds(5));

        AuditEntry processed = inbox.markProcessed(layout, entry.getId());

        assertEquals(AuditStatus.PROCESSED, processed.getStatus());
        assertEquals(StewardFixture.START.plusSeconds(5), processed.getProcessedAt());
        assertFalse(Files.exists(fixture.stateRoot().resolve("inbox/pending/" + entry.getId() + ".json")));
        assertTrue(Files.exists(fixture.stateRoot().resolve("inbox/processed/" + entry.getId() + ".json")));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> inbox.markProcessed(layout, entry.getId()));
        assertTrue(ex.getMessage().contains("already processed"));
    }

    @Test
    void shouldRejectUnknownEntry() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> inbox.markProcessed(layout, "no-such-entry"));

        assertTrue(ex.getMessage().contains("Unknown"));
    }

    @Test
    void shouldReportStatusWithRecentProcessedNewestFirst() {
        for (int i = 0; i < 7; i++) {
            AuditEntry entry = inbox.submit(layout, TARGET, "intent-" + i, "content", "s" + i);
            inbox.markProcessed(layout, entry.getId());
            fixture.clock.advance(Duration.ofMinutes(1));
        }
        inbox.submit(layout, TARGET, "still pending", "content", "s9");

        InboxStatus status = inbox.status(layout);

        assertEquals(1, status.getPendingCount());
        assertEquals(7, status.getProcessedCount());
        assertEquals(List.of("intent-6", "intent-5", "intent-4", "intent-3", "intent-2"),
                status.getRecentProcessed().stream().map(ProcessedIndexEntry::getIntent).toList());
    }

    @Test
    void shouldTolerateCorruptIndex() {
        fixture.write(fixture.stateRoot().resolve(ProjectLayout.INBOX_INDEX_FILE), "{not json");
        AuditEntry entry = inbox.submit(layout, TARGET, "intent", "content", "s1");

        inbox.markProcessed(layout, entry.getId());

        InboxStatus status = inbox.status(layout);
        assertEquals(1, status.getProcessedCount());
        assertEquals(entry.getId(), status.getRecentProcessed().get(0).getId());
    }
}
