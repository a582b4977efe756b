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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.steward.domain.model.ParsedTranscript;
import me.golemcore.steward.domain.model.Session;
import me.golemcore.steward.domain.model.TranscriptRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Renders parsed transcripts as human-readable text and builds the one-line
 * session summary.
 */
@Component
@RequiredArgsConstructor
public class TranscriptFormatter {

    private static final String RULE = "=".repeat(60);

    private final ObjectMapper objectMapper;

    public String format(Session session, ParsedTranscript transcript, Instant archivedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append("Session: ").append(session.getSessionId()).append('\n');
        sb.append("Role: ").append(nullToDash(session.getRole())).append('\n');
        sb.append("Focus: ").append(nullToDash(session.getFocus())).append('\n');
        sb.append("Model: ").append(nullToDash(session.getModel())).append('\n');
        sb.append("Started: ").append(session.getCreatedAt() != null ? session.getCreatedAt() : "-").append('\n');
        sb.append("Archived: ").append(archivedAt).append('\n');
        sb.append("Records: ").append(transcript.getRecords().size());
        if (transcript.getMalformedLines() > 0) {
            sb.append(" (").append(transcript.getMalformedLines()).append(" malformed line(s) skipped)");
        }
        sb.append('\n').append(RULE).append("\n\n");

        for (TranscriptRecord record : transcript.getRecords()) {
            switch (record.getType()) {
            case TEXT -> sb.append('[').append(record.getRole()).append("] ").append(record.getContent());
            case TOOL_USE -> sb.append("[TOOL: ").append(record.getToolName()).append("] ")
                    .append(toJson(record));
            case TOOL_RESULT -> sb.append("[RESULT: ").append(record.getToolUseId())
                    .append(record.isError() ? " ERROR" : "").append("] ").append(record.getOutput());
            }
            sb.append("\n\n");
        }
        return sb.toString();
    }

    public String summarize(Session session, int recordCount, String description) {
        String summary = "Session: " + nullToDash(session.getRole()) + " focused on " + nullToDash(session.getFocus())
                + " | Records: " + recordCount;
        if (description != null && !description.isBlank()) {
            summary += " | Description: " + description.replaceAll("[\\r\\n]+", " ").trim();
        }
        return summary;
    }

    private String toJson(TranscriptRecord record) {
        try {
            return objectMapper.writeValueAsString(record.getParameters());
        } catch (JsonProcessingException e) {
            return String.valueOf(record.getParameters());
        }
    }

    private static String nullToDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
