package me.golemcore.steward.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One dated entry of the changelog embedded in a context artifact.
 *
 * <p>
 * {@link #lines} holds the entry exactly as it appears in the document, so
 * moving it to history is verbatim. Rendered form:
 *
 * <pre>
 * ### 2026-01-01 12:00 [PROJECT-CONTEXT] session=1a2b3c4d
 * **intent**
 * Direct append | sections: Current Focus
 * </pre>
 */
@Data
@Builder
public class ChangelogEntry {

    public static final Pattern HEADING = Pattern.compile(
            "^### (\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}) \\[([^\\]]+)] session=(\\S+)\\s*$");

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final Pattern SECTIONS = Pattern.compile("sections: (.*)$");
    private static final String NO_SECTIONS = "-";

    private Instant timestamp;
    private String target;
    private String sessionId;
    private String intent;
    private String description;

    @Builder.Default
    private List<String> sections = new ArrayList<>();

    @Builder.Default
    private List<String> lines = new ArrayList<>();

    public String text() {
        return String.join("\n", lines);
    }

    public static boolean isHeading(String line) {
        return HEADING.matcher(line).matches();
    }

    /**
     * Build a new entry stamped in UTC.
     */
    public static ChangelogEntry create(Instant timestamp, String target, String sessionId, String intent,
            String action, List<String> sections) {
        String safeIntent = oneLine(intent).isEmpty() ? "update" : oneLine(intent);
        String sectionList = sections.isEmpty() ? NO_SECTIONS : String.join(", ", sections);
        String description = oneLine(action) + " | sections: " + sectionList;
        String heading = "### " + STAMP.format(timestamp.atOffset(ZoneOffset.UTC)) + " [" + target + "] session="
                + (sessionId == null || sessionId.isBlank() ? "unknown" : sessionId);
        return ChangelogEntry.builder()
                .timestamp(timestamp)
                .target(target)
                .sessionId(sessionId)
                .intent(safeIntent)
                .description(description)
                .sections(new ArrayList<>(sections))
                .lines(new ArrayList<>(List.of(heading, "**" + safeIntent + "**", description, "")))
                .build();
    }

    /**
     * Parse an entry from its raw lines; the first line must be a heading.
     */
    public static Optional<ChangelogEntry> parse(List<String> rawLines) {
        if (rawLines.isEmpty()) {
            return Optional.empty();
        }
        Matcher heading = HEADING.matcher(rawLines.get(0));
        if (!heading.matches()) {
            return Optional.empty();
        }
        Instant timestamp;
        try {
            timestamp = LocalDateTime.parse(heading.group(1), STAMP).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }

        String intent = null;
        String description = null;
        for (String line : rawLines.subList(1, rawLines.size())) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (intent == null && trimmed.startsWith("**") && trimmed.endsWith("**") && trimmed.length() >= 4) {
                intent = trimmed.substring(2, trimmed.length() - 2);
            } else if (description == null) {
                description = trimmed;
            }
        }

        List<String> sections = new ArrayList<>();
        if (description != null) {
            Matcher matcher = SECTIONS.matcher(description);
            if (matcher.find() && !NO_SECTIONS.equals(matcher.group(1).trim())) {
                Arrays.stream(matcher.group(1).split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .forEach(sections::add);
            }
        }

        return Optional.of(ChangelogEntry.builder()
                .timestamp(timestamp)
                .target(heading.group(2))
                .sessionId(heading.group(3))
                .intent(intent)
                .description(description)
                .sections(sections)
                .lines(new ArrayList<>(rawLines))
                .build());
    }

    private static String oneLine(String value) {
        return value == null ? "" : value.replaceAll("[\\r\\n]+", " ").trim();
    }
}
