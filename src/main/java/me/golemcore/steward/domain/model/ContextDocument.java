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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * Parsed markdown context artifact.
 *
 * <p>
 * Structure:
 * <ul>
 * <li>preamble - every line before the first {@code ## } heading (title and
 * intro)</li>
 * <li>sections - ordered {@code ## } sections</li>
 * <li>changelog - entries below the {@code ## CHANGELOG} heading, newest
 * first</li>
 * </ul>
 *
 * <p>
 * Parsing keeps every line: {@link #render()} of a parsed document yields the
 * same lines, with the changelog always rendered last.
 */
public class ContextDocument {

    public static final String CHANGELOG_TITLE = "CHANGELOG";
    private static final String SECTION_PREFIX = "## ";

    private final List<String> preamble;
    private final List<ContextSection> sections;
    private final List<String> changelogIntro;
    private final List<ChangelogEntry> changelog;

    private ContextDocument(List<String> preamble, List<ContextSection> sections, List<String> changelogIntro,
            List<ChangelogEntry> changelog) {
        this.preamble = new ArrayList<>(preamble);
        this.sections = new ArrayList<>(sections);
        this.changelogIntro = new ArrayList<>(changelogIntro);
        this.changelog = new ArrayList<>(changelog);
    }

    public static ContextDocument empty(String target) {
        return new ContextDocument(List.of("# " + target, ""), List.of(), List.of(), List.of());
    }

    public static ContextDocument parse(String text) {
        List<String> preamble = new ArrayList<>();
        List<ContextSection> sections = new ArrayList<>();
        List<String> changelogIntro = new ArrayList<>();
        List<ChangelogEntry> changelog = new ArrayList<>();

        String currentTitle = null;
        List<String> current = null;
        boolean inChangelog = false;
        List<String> entryLines = null;

        for (String line : splitLines(text)) {
            if (isSectionHeading(line)) {
                String title = line.substring(SECTION_PREFIX.length()).trim();
                if (current != null) {
                    sections.add(new ContextSection(currentTitle, current));
                    current = null;
                }
                if (entryLines != null) {
                    addEntry(changelog, changelogIntro, entryLines);
                    entryLines = null;
                }
                if (isChangelogTitle(title)) {
                    inChangelog = true;
                    continue;
                }
                inChangelog = false;
                currentTitle = title;
                current = new ArrayList<>();
                current.add(line);
                continue;
            }

            if (inChangelog) {
                if (ChangelogEntry.isHeading(line)) {
                    if (entryLines != null) {
                        addEntry(changelog, changelogIntro, entryLines);
                    }
                    entryLines = new ArrayList<>();
                    entryLines.add(line);
                } else if (entryLines != null) {
                    entryLines.add(line);
                } else {
                    changelogIntro.add(line);
                }
            } else if (current != null) {
                current.add(line);
            } else {
                preamble.add(line);
            }
        }

        if (current != null) {
            sections.add(new ContextSection(currentTitle, current));
        }
        if (entryLines != null) {
            addEntry(changelog, changelogIntro, entryLines);
        }
        return new ContextDocument(preamble, sections, changelogIntro, changelog);
    }

    public String render() {
        List<String> lines = renderLines();
        if (lines.isEmpty()) {
            return "";
        }
        return String.join("\n", lines) + "\n";
    }

    public int lineCount() {
        return renderLines().size();
    }

    public ContextDocument copy() {
        return new ContextDocument(preamble, sections, changelogIntro, changelog);
    }

    public List<String> getPreamble() {
        return List.copyOf(preamble);
    }

    public List<ContextSection> getSections() {
        return List.copyOf(sections);
    }

    /**
     * Changelog entries, newest first.
     */
    public List<ChangelogEntry> getChangelog() {
        return List.copyOf(changelog);
    }

    public OptionalInt indexOfSection(String title) {
        String wanted = ContextSection.normalizeTitle(title);
        return IntStream.range(0, sections.size())
                .filter(i -> sections.get(i).normalizedTitle().equals(wanted))
                .findFirst();
    }

    public Optional<ContextSection> findSection(String title) {
        OptionalInt index = indexOfSection(title);
        return index.isPresent() ? Optional.of(sections.get(index.getAsInt())) : Optional.empty();
    }

    public void appendSection(ContextSection section) {
        ensureBlankSeparator();
        sections.add(section);
    }

    public ContextSection replaceSection(int index, ContextSection replacement) {
        return sections.set(index, replacement);
    }

    public ContextSection removeSection(int index) {
        return sections.remove(index);
    }

    public void addChangelogEntry(ChangelogEntry entry) {
        ensureBlankSeparator();
        if (changelog.isEmpty() && changelogIntro.isEmpty()) {
            changelogIntro.add("");
        }
        changelog.add(0, entry);
    }

    /**
     * Replace this document's changelog, intro lines included, with the one
     * of {@code source}.
     */
    public void keepChangelogOf(ContextDocument source) {
        changelogIntro.clear();
        changelog.clear();
        changelogIntro.addAll(source.changelogIntro);
        changelog.addAll(source.changelog);
        if (!changelog.isEmpty() || !changelogIntro.isEmpty()) {
            ensureBlankSeparator();
        }
    }

    /**
     * Remove and return the oldest changelog entry, if any.
     */
    public Optional<ChangelogEntry> removeOldestChangelogEntry() {
        if (changelog.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(changelog.remove(changelog.size() - 1));
    }

    public static boolean isSectionHeading(String line) {
        return line.startsWith(SECTION_PREFIX);
    }

    public static boolean isChangelogTitle(String title) {
        return CHANGELOG_TITLE.equals(title.trim().toUpperCase(Locale.ROOT));
    }

    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        for (String line : text.split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private List<String> renderLines() {
        List<String> lines = new ArrayList<>(preamble);
        for (ContextSection section : sections) {
            lines.addAll(section.lines());
        }
        if (!changelog.isEmpty() || !changelogIntro.isEmpty()) {
            lines.add(SECTION_PREFIX + CHANGELOG_TITLE);
            lines.addAll(changelogIntro);
            for (ChangelogEntry entry : changelog) {
                lines.addAll(entry.getLines());
            }
        }
        return lines;
    }

    private void ensureBlankSeparator() {
        List<String> tail = sections.isEmpty() ? preamble : null;
        if (tail != null) {
            if (!tail.isEmpty() && !tail.get(tail.size() - 1).isBlank()) {
                tail.add("");
            }
            return;
        }
        int last = sections.size() - 1;
        ContextSection lastSection = sections.get(last);
        List<String> lines = lastSection.lines();
        if (!lines.get(lines.size() - 1).isBlank()) {
            List<String> padded = new ArrayList<>(lines);
            padded.add("");
            sections.set(last, new ContextSection(lastSection.title(), padded));
        }
    }

    private static void addEntry(List<ChangelogEntry> changelog, List<String> intro, List<String> entryLines) {
        Optional<ChangelogEntry> parsed = ChangelogEntry.parse(entryLines);
        if (parsed.isPresent()) {
            changelog.add(parsed.get());
        } else {
            intro.addAll(entryLines);
        }
    }
}
