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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.steward.domain.model.ParsedTranscript;
import me.golemcore.steward.domain.model.TranscriptRecord;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import me.golemcore.steward.security.SecretRedactor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses a line-delimited JSON agent transcript into
 * {@link TranscriptRecord}s.
 *
 * <p>
 * Understood shapes:
 * <ul>
 * <li>{@code {"type":"user"|"assistant","message":{"content":...}}} where
 * content is a string or a list of {@code text}, {@code tool_use} and
 * {@code tool_result} parts</li>
 * <li>top-level {@code {"type":"tool_use",...}} and
 * {@code {"type":"tool_result",...}} entries</li>
 * </ul>
 * Other entry types are ignored. The source file is only read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TranscriptParser {

    private static final String TYPE = "type";
    private static final String TEXT = "text";
    private static final String TOOL_USE = "tool_use";
    private static final String TOOL_RESULT = "tool_result";
    private static final String CONTENT = "content";

    private final ObjectMapper objectMapper;
    private final SecretRedactor secretRedactor;
    private final StewardProperties properties;

    public ParsedTranscript parse(Path transcript) {
        try (BufferedReader reader = Files.newBufferedReader(transcript, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read transcript " + transcript, e);
        }
    }

    ParsedTranscript parse(BufferedReader reader) throws IOException {
        ParseState state = new ParseState();
        String line;
        while ((line = reader.readLine()) != null) {
            state.totalLines++;
            if (line.isBlank()) {
                state.blankLines++;
                continue;
            }
            JsonNode node;
            try {
                node = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                state.malformedLines++;
                continue;
            }
            if (node == null || !node.isObject()) {
                state.malformedLines++;
                continue;
            }
            parseEntry(node, state);
        }

        if (state.malformedLines > 0) {
            log.warn("[Transcript] Skipped {} malformed line(s) of {}", state.malformedLines, state.totalLines);
        }
        return ParsedTranscript.builder()
                .records(state.records)
                .totalLines(state.totalLines)
                .blankLines(state.blankLines)
                .malformedLines(state.malformedLines)
                .duplicateResults(state.duplicateResults)
                .build();
    }

    private void parseEntry(JsonNode node, ParseState state) {
        String type = node.path(TYPE).asText("");
        switch (type) {
        case "user", "assistant" -> {
            JsonNode message = node.path("message");
            String role = message.path("role").asText(type);
            JsonNode content = message.has(CONTENT) ? message.get(CONTENT) : node.path(CONTENT);
            parseContent(role, content, state);
        }
        case TOOL_USE -> addToolUse(node, state);
        case TOOL_RESULT -> addToolResult(node, state);
        default -> log.trace("[Transcript] Ignoring entry type '{}'", type);
        }
    }

    private void parseContent(String role, JsonNode content, ParseState state) {
        if (content.isTextual()) {
            if (!content.asText().isBlank()) {
                state.records.add(TranscriptRecord.text(role, content.asText()));
            }
            return;
        }
        if (!content.isArray()) {
            return;
        }
        for (JsonNode part : content) {
            String partType = part.path(TYPE).asText("");
            if (TEXT.equals(partType)) {
                String text = part.path(TEXT).asText("");
                if (!text.isBlank()) {
                    state.records.add(TranscriptRecord.text(role, text));
                }
            } else if (TOOL_USE.equals(partType)) {
                addToolUse(part, state);
            } else if (TOOL_RESULT.equals(partType)) {
                addToolResult(part, state);
            }
        }
    }

    private void addToolUse(JsonNode node, ParseState state) {
        String name = node.path("name").asText("unknown");
        String id = node.path("id").asText(node.path("tool_use_id").asText(""));
        JsonNode input = node.has("input") ? node.get("input") : node.path("parameters");
        state.records.add(TranscriptRecord.toolUse(name, id, secretRedactor.redactParameters(input)));
    }

    private void addToolResult(JsonNode node, ParseState state) {
        String toolUseId = node.path("tool_use_id").asText("");
        if (!toolUseId.isEmpty() && !state.seenResults.add(toolUseId)) {
            state.duplicateResults++;
            log.warn("[Transcript] Dropping duplicate tool result for {}", toolUseId);
            return;
        }
        boolean error = node.path("is_error").asBoolean(false);
        String output = bound(secretRedactor.redactText(resultText(node.path(CONTENT))));
        state.records.add(TranscriptRecord.toolResult(toolUseId, output, error));
    }

    private String resultText(JsonNode content) {
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : content) {
                if (part.has(TEXT)) {
                    if (sb.length() > 0) {
                        sb.append('\n');
                    }
                    sb.append(part.path(TEXT).asText(""));
                }
            }
            return sb.toString();
        }
        if (content.isMissingNode() || content.isNull()) {
            return "";
        }
        return content.toString();
    }

    private String bound(String output) {
        int max = properties.getTranscripts().getMaxToolOutputChars();
        if (output.length() <= max) {
            return output;
        }
        int dropped = output.length() - max;
        return output.substring(0, max) + "... [truncated " + dropped + " chars]";
    }

    private static final class ParseState {
        private final List<TranscriptRecord> records = new ArrayList<>();
        private final Set<String> seenResults = new HashSet<>();
        private int totalLines;
        private int blankLines;
        private int malformedLines;
        private int duplicateResults;
    }
}
