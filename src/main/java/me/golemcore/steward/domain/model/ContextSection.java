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

import java.util.List;
import java.util.Locale;

/**
 * A {@code ## } section of a context artifact: its heading line and every line
 * up to the next heading.
 */
public record ContextSection(String title, List<String> lines) {

    public ContextSection {
        lines = List.copyOf(lines);
    }

    public String text() {
        return String.join("\n", lines);
    }

    public String normalizedTitle() {
        return normalizeTitle(title);
    }

    public static String normalizeTitle(String title) {
        return title == null ? "" : title.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
    }
}
