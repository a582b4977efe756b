package me.golemcore.steward.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextDocumentTest {

    private static final String DOCUMENT = """
            # PROJECT-CONTEXT

            Shared state for all agents.

            ## Identity
            Steward engine.

            ## Current State
            - parser done
            - merge in progress

            ## CHANGELOG

            ### 2026-01-02 09:30 [PROJECT-CONTEXT] session=bbbbbbbb
            **wire merge**
            Direct replace | sections: Current State

            ### 2026-01-01 08:00 [PROJECT-CONTEXT] session=aaaaaaaa
            **bootstrap**
            Direct append | sections: Identity, Current State
            """;

    @Test
    void shouldRenderParsedDocumentUnchanged() {
        ContextDocument document = ContextDocument.parse(DOCUMENT);

        assertEquals(DOCUMENT, document.render());
        assertEquals(DOCUMENT.split("\n").length, document.lineCount());
    }

    @Test
    void shouldSplitSectionsAndChangelog() {
        ContextDocument document = ContextDocument.parse(DOCUMENT);

        assertEquals(List.of("Identity", "Current State"),
                document.getSections().stream().map(ContextSection::title).toList());
        assertEquals(2, document.getChangelog().size());

        ChangelogEntry newest = document.getChangelog().get(0);
        assertEquals("bbbbbbbb", newest.getSessionId());
        assertEquals("wire merge", newest.getIntent());
        assertEquals(List.of("Current State"), newest.getSections());
        assertEquals(Instant.parse("2026-01-02T09:30:00Z"), newest.getTimestamp());
        assertEquals(List.of("Identity", "Current State"), document.getChangelog().get(1).getSections());
    }

    @Test
    void shouldFindSectionsByNormalizedTitle() {
        ContextDocument document = ContextDocument.parse(DOCUMENT);

        assertTrue(document.findSection("current-state").isPresent());
        assertTrue(document.findSection("CURRENT_STATE").isPresent());
        assertEquals(1, document.indexOfSection("current state").getAsInt());
        assertTrue(document.findSection("Roadmap").isEmpty());
    }

    @Test
    void shouldPrependNewChangelogEntries() {
        ContextDocument document = ContextDocument.parse(DOCUMENT);
        ChangelogEntry entry = ChangelogEntry.create(Instant.parse("2026-01-03T10:15:00Z"), "PROJECT-CONTEXT",
                "cccccccc", "add roadmap", "Direct append", List.of("Roadmap"));

        document.addChangelogEntry(entry);

        ContextDocument reparsed = ContextDocument.parse(document.render());
        assertEquals(3, reparsed.getChangelog().size());
        assertEquals("cccccccc", reparsed.getChangelog().get(0).getSessionId());
        assertEquals("add roadmap", reparsed.getChangelog().get(0).getIntent());
    }

    @Test
    void shouldStartChangelogOnEmptyDocument() {
        ContextDocument document = ContextDocument.empty("NOTES");
        document.appendSection(new ContextSection("Ideas", List.of("## Ideas", "- one")));
        document.addChangelogEntry(ChangelogEntry.create(Instant.parse("2026-01-01T00:00:00Z"), "NOTES", "s1",
                "first", "Direct append", List.of("Ideas")));

        String rendered = document.render();

        assertTrue(rendered.startsWith("# NOTES\n\n## Ideas\n- one\n\n## CHANGELOG\n\n### 2026-01-01 00:00 [NOTES]"));
        ContextDocument reparsed = ContextDocument.parse(rendered);
        assertEquals(1, reparsed.getSections().size());
        assertEquals(1, reparsed.getChangelog().size());
    }

    @Test
    void shouldRemoveOldestChangelogEntry() {
        ContextDocument document = ContextDocument.parse(DOCUMENT);

        ChangelogEntry removed = document.removeOldestChangelogEntry().orElseThrow();

        assertEquals("aaaaaaaa", removed.getSessionId());
        assertEquals(1, document.getChangelog().size());
        assertFalse(document.render().contains("session=aaaaaaaa"));
    }

    @Test
    void shouldKeepStoredChangelogOverIncomingOne() {
        ContextDocument old = ContextDocument.parse(DOCUMENT);
        ContextDocument merged = ContextDocument.parse("# PROJECT-CONTEXT\n\n## Identity\nNew text.\n\n"
                + "## CHANGELOG\n\n### 2026-01-01 12:00 [PROJECT-CONTEXT] session=ffffffff\n**Rewritten**\n");

        merged.keepChangelogOf(old);

        assertEquals(List.of("bbbbbbbb", "aaaaaaaa"),
                merged.getChangelog().stream().map(ChangelogEntry::getSessionId).toList());
        assertFalse(merged.render().contains("ffffffff"));
        assertTrue(merged.render().contains("New text.\n\n## CHANGELOG\n"));

        merged.keepChangelogOf(ContextDocument.empty("PROJECT-CONTEXT"));
        assertTrue(merged.getChangelog().isEmpty());
    }

    @Test
    void shouldKeepUnparsableChangelogLinesVerbatim() {
        String text = "# T\n\n## CHANGELOG\nfree text note\n### 2026-01-01 10:00 [T] session=abc\n**x**\n";

        ContextDocument document = ContextDocument.parse(text);

        assertEquals(text, document.render());
        assertEquals(1, document.getChangelog().size());
    }

    @Test
    void shouldNormalizeCarriageReturns() {
        ContextDocument document = ContextDocument.parse("# T\r\n\r\n## A\r\nbody\r\n");

        assertEquals("# T\n\n## A\nbody\n", document.render());
    }
}
