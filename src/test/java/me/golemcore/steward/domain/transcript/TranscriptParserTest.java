package me.golemcore.steward.domain.transcript;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.steward.domain.model.ParsedTranscript;
import me.golemcore.steward.domain.model.Session;
import me.golemcore.steward.domain.model.TranscriptRecord;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import me.golemcore.steward.security.SecretRedactor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranscriptParserTest {

    private static final String TRANSCRIPT = """
            {"type":"user","message":{"role":"user","content":"Fix the login bug"}}
            {"type":"assistant","message":{"role":"assistant","content":[{"type":"text","text":"Looking at auth."},{"type":"tool_use","id":"t1","name":"Bash","input":{"command":"grep -r login","api_key":"k"}}]}}
            {"type":"user","message":{"role":"user","content":[{"type":"tool_result","tool_use_id":"t1","content":"src/Login.java"}]}}

            not json at all
            {"type":"user","message":{"role":"user","content":[{"type":"tool_result","tool_use_id":"t1","content":"duplicate"}]}}
            {"type":"summary","summary":"ignored"}
            {"type":"tool_result","tool_use_id":"t2","is_error":true,"content":[{"type":"text","text":"boom"}]}
            """;

    private StewardProperties properties;
    private TranscriptParser parser;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        properties = new StewardProperties();
        parser = new TranscriptParser(new ObjectMapper(), new SecretRedactor(), properties);
    }

    @Test
    void shouldParseTextToolUseAndToolResult() throws IOException {
        ParsedTranscript parsed = parse(TRANSCRIPT);

        List<TranscriptRecord> records = parsed.getRecords();
        assertEquals(5, records.size());
        assertEquals(TranscriptRecord.text("user", "Fix the login bug"), records.get(0));
        assertEquals(TranscriptRecord.Type.TEXT, records.get(1).getType());
        assertEquals("assistant", records.get(1).getRole());

        TranscriptRecord toolUse = records.get(2);
        assertEquals("Bash", toolUse.getToolName());
        assertEquals("t1", toolUse.getToolUseId());
        assertEquals("grep -r login", toolUse.getParameters().get("command"));
        assertEquals(SecretRedactor.REDACTED, toolUse.getParameters().get("api_key"));

        assertEquals("src/Login.java", records.get(3).getOutput());
        assertTrue(records.get(4).isError());
        assertEquals("boom", records.get(4).getOutput());
    }

    @Test
    void shouldCountMalformedBlankAndDuplicateLines() throws IOException {
        ParsedTranscript parsed = parse(TRANSCRIPT);

        assertEquals(8, parsed.getTotalLines());
        assertEquals(1, parsed.getBlankLines());
        assertEquals(1, parsed.getMalformedLines());
        assertEquals(1, parsed.getDuplicateResults());
        assertEquals(1, parsed.count(TranscriptRecord.Type.TOOL_USE));
        assertEquals(2, parsed.count(TranscriptRecord.Type.TOOL_RESULT));
    }

    @Test
    void shouldTruncateLongToolOutput() throws IOException {
        properties.getTranscripts().setMaxToolOutputChars(10);
        String line = "{\"type\":\"tool_result\",\"tool_use_id\":\"t9\",\"content\":\"" + "x".repeat(25) + "\"}";

        ParsedTranscript parsed = parse(line);

        assertEquals("xxxxxxxxxx... [truncated 15 chars]", parsed.getRecords().get(0).getOutput());
    }

    @Test
    void shouldRedactSecretsInToolOutput() throws IOException {
        ParsedTranscript parsed = parse(
                "{\"type\":\"tool_result\",\"tool_use_id\":\"t1\",\"content\":\"key sk-abcdef123456789\"}");

        assertEquals("key " + SecretRedactor.REDACTED, parsed.getRecords().get(0).getOutput());
    }

    @Test
    void shouldReadFromFileWithoutModifyingIt() throws IOException {
        Path file = Files.writeString(tempDir.resolve("t.jsonl"), TRANSCRIPT);
        long before = Files.size(file);

        ParsedTranscript parsed = parser.parse(file);

        assertEquals(5, parsed.getRecords().size());
        assertEquals(before, Files.size(file));
    }

    @Test
    void shouldFailForMissingFile() {
        assertThrows(UncheckedIOException.class, () -> parser.parse(tempDir.resolve("missing.jsonl")));
    }

    @Test
    void shouldFormatRecordsAndSummary() throws IOException {
        TranscriptFormatter formatter = new TranscriptFormatter(new ObjectMapper());
        Session session = Session.builder()
                .sessionId("1a2b3c4d")
                .role("backend")
                .focus("login bug")
                .createdAt(Instant.parse("2026-01-01T12:00:00Z"))
                .build();
        ParsedTranscript parsed = parse(TRANSCRIPT);

        String text = formatter.format(session, parsed, Instant.parse("2026-01-01T13:00:00Z"));

        assertTrue(text.startsWith("Session: 1a2b3c4d\nRole: backend\nFocus: login bug\n"));
        assertTrue(text.contains("(1 malformed line(s) skipped)"));
        assertTrue(text.contains("[user] Fix the login bug"));
        assertTrue(text.contains("[TOOL: Bash] {\"command\":\"grep -r login\",\"api_key\":\"[REDACTED]\"}"));
        assertTrue(text.contains("[RESULT: t1] src/Login.java"));
        assertTrue(text.contains("[RESULT: t2 ERROR] boom"));

        assertEquals("Session: backend focused on login bug | Records: 5 | Description: done today",
                formatter.summarize(session, 5, "done\ntoday"));
        assertEquals("Session: backend focused on login bug | Records: 0", formatter.summarize(session, 0, " "));
    }

    private ParsedTranscript parse(String content) throws IOException {
        return parser.parse(new BufferedReader(new StringReader(content)));
    }
}
